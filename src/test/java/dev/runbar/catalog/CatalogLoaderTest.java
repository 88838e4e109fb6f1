package dev.runbar.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.runbar.search.CatalogEntry;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class CatalogLoaderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final CatalogLoader loader = new CatalogLoader(new DefaultResourceLoader(), objectMapper);

  @Test
  void loads_entries_and_skips_items_without_token() {
    CatalogStore store = loader.load("classpath:catalog-sample.json");

    assertThat(store.entries())
        .extracting(CatalogEntry::token)
        .containsExactly("visual-studio-code", "spectacle", "ghostty");
  }

  @Test
  void only_app_artifacts_contribute_program_filenames() {
    CatalogStore store = loader.load("classpath:catalog-sample.json");

    CatalogEntry vscode = store.lookupByNameOrToken("visual-studio-code").orElseThrow();
    assertThat(vscode.appNames()).containsExactly("Visual Studio Code.app");
    assertThat(vscode.names()).containsExactly("Microsoft Visual Studio Code", "VS Code");
    assertThat(vscode.description()).isEqualTo("Open-source code editor");
  }

  @Test
  void optional_fields_default_sensibly() {
    CatalogStore store = loader.load("classpath:catalog-sample.json");

    CatalogEntry spectacle = store.lookupByNameOrToken("spectacle").orElseThrow();
    CatalogEntry ghostty = store.lookupByNameOrToken("ghostty").orElseThrow();
    assertThat(spectacle.deprecated()).isTrue();
    assertThat(spectacle.fullToken()).isEqualTo("spectacle");
    assertThat(ghostty.fullToken()).isEqualTo("homebrew/cask/ghostty");
    assertThat(ghostty.displayName()).isEqualTo("ghostty");
    assertThat(ghostty.description()).isNull();
    assertThat(ghostty.deprecated()).isFalse();
  }

  @Test
  void missing_resource_yields_empty_catalog() {
    assertThat(loader.load("classpath:does-not-exist.json").size()).isZero();
  }

  @Test
  void malformed_json_yields_empty_catalog(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("catalog.json");
    Files.writeString(file, "{\"data\": [ {\"token\": ");

    assertThat(loader.load(file.toUri().toString()).size()).isZero();
  }

  @Test
  void document_without_data_array_yields_no_entries() throws Exception {
    assertThat(loader.parse(objectMapper.readTree("{\"items\": []}"))).isEmpty();
  }
}
