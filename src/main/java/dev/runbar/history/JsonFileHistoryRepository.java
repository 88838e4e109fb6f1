package dev.runbar.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores the history as a JSON array in a single file.
 *
 * <p>Writes go to a sibling temp file first and are then moved over the target, so a crash
 * mid-write leaves the previous file intact.
 */
@Component
public class JsonFileHistoryRepository implements HistoryRepository {

  private static final Logger log = LoggerFactory.getLogger(JsonFileHistoryRepository.class);

  private static final TypeReference<List<HistoryEntry>> ENTRY_LIST = new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper objectMapper;

  @Autowired
  public JsonFileHistoryRepository(HistoryProperties properties, ObjectMapper objectMapper) {
    this(properties.getFile(), objectMapper);
  }

  JsonFileHistoryRepository(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<HistoryEntry> load() throws IOException {
    if (!Files.exists(file)) {
      log.debug("No history file at {}", file);
      return List.of();
    }
    List<HistoryEntry> entries = objectMapper.readValue(file.toFile(), ENTRY_LIST);
    return entries == null ? List.of() : entries;
  }

  @Override
  public void save(List<HistoryEntry> entries) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
    try {
      objectMapper.writeValue(temp.toFile(), entries);
      try {
        Files.move(
            temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
