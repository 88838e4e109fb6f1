package dev.runbar.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.runbar.search.CatalogEntry;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads the offline package catalog into a {@link CatalogStore}.
 *
 * <p>Expected shape: {@code {"data": [{"token", "full_token", "name": [], "desc", "homepage",
 * "url", "version", "sha256", "deprecated", "artifacts": []}]}}. Only {@code artifacts} elements
 * that are objects carrying an {@code app} string array contribute program filenames. Items
 * without a token are skipped. A missing or unparseable catalog yields an empty store.
 */
@Component
public class CatalogLoader {

  private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;

  public CatalogLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
    this.resourceLoader = resourceLoader;
    this.objectMapper = objectMapper;
  }

  /**
   * Loads the catalog from a Spring resource location.
   *
   * @param location e.g. {@code classpath:catalog.json} or {@code file:/opt/runbar/catalog.json}
   * @return the indexed catalog, empty when the resource is missing or malformed
   */
  public CatalogStore load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      log.warn("Catalog not found at {}, continuing with an empty catalog", location);
      return CatalogStore.empty();
    }
    try (InputStream in = resource.getInputStream()) {
      List<CatalogEntry> entries = parse(objectMapper.readTree(in));
      log.info("Loaded catalog with {} entries from {}", entries.size(), location);
      return new CatalogStore(entries);
    } catch (IOException e) {
      log.warn("Failed to read catalog at {}, continuing with an empty catalog", location, e);
      return CatalogStore.empty();
    }
  }

  List<CatalogEntry> parse(@Nullable JsonNode root) {
    if (root == null || !root.path("data").isArray()) {
      log.warn("Catalog has no 'data' array");
      return List.of();
    }
    List<CatalogEntry> entries = new ArrayList<>();
    int skipped = 0;
    for (JsonNode item : root.path("data")) {
      CatalogEntry entry = toEntry(item);
      if (entry == null) {
        skipped++;
      } else {
        entries.add(entry);
      }
    }
    if (skipped > 0) {
      log.warn("Skipped {} malformed catalog items", skipped);
    }
    return entries;
  }

  private static @Nullable CatalogEntry toEntry(JsonNode item) {
    String token = text(item, "token");
    if (token == null || token.isBlank()) {
      return null;
    }
    return new CatalogEntry(
        token,
        text(item, "full_token"),
        strings(item.path("name")),
        text(item, "desc"),
        text(item, "homepage"),
        text(item, "url"),
        text(item, "version"),
        item.path("deprecated").asBoolean(false),
        appNames(item.path("artifacts")));
  }

  private static List<String> appNames(JsonNode artifacts) {
    List<String> appNames = new ArrayList<>();
    for (JsonNode artifact : artifacts) {
      if (artifact.isObject()) {
        appNames.addAll(strings(artifact.path("app")));
      }
    }
    return appNames;
  }

  private static List<String> strings(JsonNode array) {
    List<String> values = new ArrayList<>();
    for (JsonNode element : array) {
      if (element.isTextual()) {
        values.add(element.asText());
      }
    }
    return values;
  }

  private static @Nullable String text(JsonNode item, String field) {
    JsonNode value = item.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }
}
