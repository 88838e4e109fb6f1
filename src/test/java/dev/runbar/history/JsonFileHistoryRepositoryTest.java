package dev.runbar.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.runbar.search.HistoryTarget;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileHistoryRepositoryTest {

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

  @TempDir Path dir;

  @Test
  void missing_file_loads_as_empty_history() throws IOException {
    JsonFileHistoryRepository repository =
        new JsonFileHistoryRepository(dir.resolve("history.json"), objectMapper);

    assertThat(repository.load()).isEmpty();
  }

  @Test
  void saved_entries_load_back_in_order() throws IOException {
    Path file = dir.resolve("nested").resolve("history.json");
    JsonFileHistoryRepository repository = new JsonFileHistoryRepository(file, objectMapper);
    List<HistoryEntry> entries =
        List.of(
            new HistoryEntry(
                "docs",
                "Documentation",
                "example.com/docs",
                new HistoryTarget(HistoryTarget.Kind.URL, "https://example.com/docs"),
                Instant.parse("2026-01-05T10:00:00Z")),
            new HistoryEntry("ls", null, null, null, Instant.parse("2026-01-04T09:30:00Z")));

    repository.save(entries);

    assertThat(repository.load()).containsExactlyElementsOf(entries);
  }

  @Test
  void save_replaces_the_file_without_leaving_temp_files() throws IOException {
    Path file = dir.resolve("history.json");
    JsonFileHistoryRepository repository = new JsonFileHistoryRepository(file, objectMapper);
    Instant at = Instant.parse("2026-01-05T10:00:00Z");

    repository.save(List.of(new HistoryEntry("first", null, null, null, at)));
    repository.save(List.of(new HistoryEntry("second", null, null, null, at)));

    assertThat(repository.load()).extracting(HistoryEntry::command).containsExactly("second");
    try (Stream<Path> files = Files.list(dir)) {
      assertThat(files).containsExactly(file);
    }
  }

  @Test
  void corrupt_file_fails_to_load() throws IOException {
    Path file = dir.resolve("history.json");
    Files.writeString(file, "[{\"command\": ", StandardCharsets.UTF_8);
    JsonFileHistoryRepository repository = new JsonFileHistoryRepository(file, objectMapper);

    assertThatThrownBy(repository::load).isInstanceOf(IOException.class);
  }

  @Test
  void history_over_a_corrupt_file_starts_empty_and_rewrites_it() throws IOException {
    Path file = dir.resolve("history.json");
    Files.writeString(file, "not json", StandardCharsets.UTF_8);
    JsonFileHistoryRepository repository = new JsonFileHistoryRepository(file, objectMapper);
    Clock clock = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);

    CommandHistory history = new CommandHistory(repository, new HistoryProperties(), clock);
    assertThat(history.size()).isZero();

    history.record("code");
    assertThat(repository.load()).extracting(HistoryEntry::command).containsExactly("code");
  }
}
