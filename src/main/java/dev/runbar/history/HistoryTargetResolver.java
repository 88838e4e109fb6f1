package dev.runbar.history;

import dev.runbar.catalog.CatalogStore;
import dev.runbar.search.CatalogEntry;
import dev.runbar.search.HistoryTarget;
import dev.runbar.search.SearchResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Turns a stored {@link HistoryTarget} back into a live {@link SearchResult}. Program and file
 * targets resolve only while they still exist on disk; catalog targets only while the catalog still
 * lists them.
 */
@Component
public class HistoryTargetResolver {

  private static final String BUNDLE_SUFFIX = ".app";

  private final CatalogStore catalog;

  public HistoryTargetResolver(CatalogStore catalog) {
    this.catalog = catalog;
  }

  /**
   * Resolves a stored target.
   *
   * @param target the stored reference, may be absent
   * @return the current result for the target, empty when it no longer exists
   */
  public Optional<SearchResult> resolve(@Nullable HistoryTarget target) {
    if (target == null) {
      return Optional.empty();
    }
    String reference = target.reference();
    return switch (target.kind()) {
      case INSTALLED_PROGRAM -> resolveProgram(reference);
      case CATALOG_ENTRY -> catalog
          .lookupByNameOrToken(reference)
          .map(entry -> new SearchResult.AvailablePackage(entry));
      case URL -> Optional.of(new SearchResult.UrlTarget(reference));
      case FILESYSTEM -> resolveFile(reference);
    };
  }

  /**
   * Whether a resolved target points at a deprecated catalog package, directly or through the
   * catalog reference of an installed program.
   */
  public static boolean isDeprecated(@Nullable SearchResult resolved) {
    if (resolved instanceof SearchResult.AvailablePackage pkg) {
      return pkg.entry().deprecated();
    }
    if (resolved instanceof SearchResult.InstalledProgram program) {
      return program.catalogRef() != null && program.catalogRef().deprecated();
    }
    return false;
  }

  private static Optional<SearchResult> resolveFile(String reference) {
    Path path = Path.of(reference);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    return Optional.of(new SearchResult.FileSystemEntry(reference, Files.isDirectory(path), null));
  }

  private Optional<SearchResult> resolveProgram(String reference) {
    Path path = Path.of(reference);
    if (!Files.exists(path) || path.getFileName() == null) {
      return Optional.empty();
    }
    String filename = path.getFileName().toString();
    String name =
        filename.endsWith(BUNDLE_SUFFIX)
            ? filename.substring(0, filename.length() - BUNDLE_SUFFIX.length())
            : filename;
    CatalogEntry catalogRef =
        catalog
            .lookupByProvidedFilename(filename)
            .or(() -> catalog.lookupByNameOrToken(name))
            .orElse(null);
    String description = catalogRef == null ? null : catalogRef.description();
    return Optional.of(
        new SearchResult.InstalledProgram(name, reference, null, description, catalogRef));
  }
}
