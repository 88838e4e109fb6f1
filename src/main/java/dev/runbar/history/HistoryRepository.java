package dev.runbar.history;

import java.io.IOException;
import java.util.List;

/** Durable storage for the command history, most recent entry first. */
public interface HistoryRepository {

  /**
   * Reads the stored entries.
   *
   * @return stored entries, most recent first; empty when nothing was stored yet
   * @throws IOException if the storage exists but cannot be read or parsed
   */
  List<HistoryEntry> load() throws IOException;

  /**
   * Replaces the stored entries.
   *
   * @param entries entries to store, most recent first
   * @throws IOException if the storage cannot be written
   */
  void save(List<HistoryEntry> entries) throws IOException;
}
