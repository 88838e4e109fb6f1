package dev.runbar.search;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.nio.file.Path;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * A candidate action shown in the launcher's result list. The variants are closed: installed
 * programs, catalog packages available to install, history commands, URLs and filesystem entries.
 *
 * <p>Every variant exposes a stable {@link #identityKey()}. Two results with equal identity keys
 * are the same real-world entity no matter which provider produced them, and the conductor keeps
 * only the first of them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = SearchResult.InstalledProgram.class, name = "installed"),
  @JsonSubTypes.Type(value = SearchResult.AvailablePackage.class, name = "package"),
  @JsonSubTypes.Type(value = SearchResult.HistoryCommand.class, name = "history"),
  @JsonSubTypes.Type(value = SearchResult.UrlTarget.class, name = "url"),
  @JsonSubTypes.Type(value = SearchResult.FileSystemEntry.class, name = "file")
})
public sealed interface SearchResult {

  /** Title shown for the row. */
  @JsonProperty
  String displayName();

  /** Canonical key used for cross-source deduplication. */
  @JsonIgnore
  String identityKey();

  /** Whether this is a history row (allowed to share a display name with its target). */
  @JsonIgnore
  default boolean isHistory() {
    return false;
  }

  /**
   * A program found in the OS program index.
   *
   * @param name display name reported by the index
   * @param path location of the program bundle or launcher entry
   * @param bundleId platform bundle identifier, when known
   * @param description short description, borrowed from the catalog when the index has none
   * @param catalogRef the catalog package this program corresponds to, if any
   */
  record InstalledProgram(
      String name,
      @Nullable String path,
      @Nullable String bundleId,
      @Nullable String description,
      @Nullable CatalogEntry catalogRef)
      implements SearchResult {

    @Override
    public String displayName() {
      return name;
    }

    @Override
    public String identityKey() {
      if (bundleId != null && !bundleId.isEmpty()) {
        return bundleId.toLowerCase(Locale.ROOT);
      }
      if (path != null && !path.isEmpty()) {
        return path.toLowerCase(Locale.ROOT);
      }
      return name.toLowerCase(Locale.ROOT);
    }
  }

  /**
   * A catalog package that can be installed.
   *
   * @param entry the catalog data
   */
  record AvailablePackage(CatalogEntry entry) implements SearchResult {

    @Override
    public String displayName() {
      return entry.displayName();
    }

    @Override
    public String identityKey() {
      return entry.displayName().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * A command the user ran successfully before.
   *
   * @param command the stored command text
   * @param display optional title recorded with the command
   * @param subtitle optional subtitle recorded with the command
   * @param recent true when shown by the empty-query recents view
   * @param target stored reference to what the command launched
   * @param resolved the target re-resolved for this search, when it still exists
   */
  record HistoryCommand(
      String command,
      @Nullable String display,
      @Nullable String subtitle,
      boolean recent,
      @Nullable HistoryTarget target,
      @Nullable SearchResult resolved)
      implements SearchResult {

    @Override
    public String displayName() {
      return display != null && !display.isEmpty() ? display : command;
    }

    @Override
    public String identityKey() {
      return command.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean isHistory() {
      return true;
    }
  }

  /**
   * A navigable URL typed directly into the field.
   *
   * @param url the absolute URL
   */
  record UrlTarget(String url) implements SearchResult {

    @Override
    public String displayName() {
      return url;
    }

    @Override
    public String identityKey() {
      return url.toLowerCase(Locale.ROOT);
    }
  }

  /**
   * A file or directory reached by typing a path.
   *
   * @param path absolute path
   * @param directory whether the entry is a directory
   * @param displayOverride title to show instead of the file name
   */
  record FileSystemEntry(String path, boolean directory, @Nullable String displayOverride)
      implements SearchResult {

    @Override
    public String displayName() {
      if (displayOverride != null && !displayOverride.isEmpty()) {
        return displayOverride;
      }
      Path fileName = Path.of(path).getFileName();
      String name = fileName == null ? path : fileName.toString();
      if (directory && !name.endsWith("/")) {
        return name + "/";
      }
      return name;
    }

    @Override
    public String identityKey() {
      return path.toLowerCase(Locale.ROOT);
    }
  }
}
