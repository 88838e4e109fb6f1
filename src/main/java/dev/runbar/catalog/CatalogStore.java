package dev.runbar.catalog;

import dev.runbar.search.CatalogEntry;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only, in-memory view of the package catalog with three case-insensitive lookup indices:
 * by name (every listed name), by token and by provided program filename. On key collisions the
 * later entry wins.
 *
 * <p>Built once at startup and never mutated afterwards, so providers may read it concurrently
 * without locking.
 */
public class CatalogStore {

  private final List<CatalogEntry> entries;
  private final Map<String, CatalogEntry> nameIndex = new HashMap<>();
  private final Map<String, CatalogEntry> tokenIndex = new HashMap<>();
  private final Map<String, CatalogEntry> appNameIndex = new HashMap<>();

  public CatalogStore(List<CatalogEntry> entries) {
    this.entries = List.copyOf(entries);
    for (CatalogEntry entry : this.entries) {
      tokenIndex.put(lower(entry.token()), entry);
      nameIndex.put(lower(entry.displayName()), entry);
      for (String name : entry.names()) {
        nameIndex.put(lower(name), entry);
      }
      for (String appName : entry.appNames()) {
        appNameIndex.put(lower(appName), entry);
      }
    }
  }

  /** A store with no entries, used when the catalog cannot be loaded. */
  public static CatalogStore empty() {
    return new CatalogStore(List.of());
  }

  /** All entries in catalog order. */
  public List<CatalogEntry> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  /**
   * Looks up an entry by one of its names, falling back to its token.
   *
   * @param nameOrToken display name or token, any case
   * @return the matching entry, if any
   */
  public Optional<CatalogEntry> lookupByNameOrToken(String nameOrToken) {
    String key = lower(nameOrToken);
    CatalogEntry byName = nameIndex.get(key);
    return byName != null ? Optional.of(byName) : Optional.ofNullable(tokenIndex.get(key));
  }

  /**
   * Looks up the entry that provides a program file, e.g. {@code Visual Studio Code.app}.
   *
   * @param filename program filename, any case
   * @return the providing entry, if any
   */
  public Optional<CatalogEntry> lookupByProvidedFilename(String filename) {
    return Optional.ofNullable(appNameIndex.get(lower(filename)));
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
