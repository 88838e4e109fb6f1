package dev.runbar.search;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Decides whether the typed input is itself a navigable URL or a filesystem path, and produces the
 * synthetic results the conductor places ahead of provider output.
 *
 * <p>Checks, in order: a link spanning the whole input (scheme kept, bare hosts get {@code
 * https://}); any dotted input without whitespace that is not path-like (implicit {@code
 * https://}); a path-like input, which is listed when it names a directory, returned as a single
 * entry when it names a file, or used as a name-prefix filter over its parent directory when only
 * the last component is missing.
 */
@Component
public class QueryClassifier {

  private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

  private static final Pattern SCHEME_URL =
      Pattern.compile("^[a-z][a-z0-9+.-]*://[^\\s/?#]+\\S*$", Pattern.CASE_INSENSITIVE);
  private static final Pattern MAILTO =
      Pattern.compile("^mailto:[^\\s@]+@[^\\s@]+$", Pattern.CASE_INSENSITIVE);
  private static final Pattern BARE_HOST =
      Pattern.compile(
          "^(?:[\\p{L}\\p{N}-]+\\.)+\\p{L}{2,}(?::\\d{1,5})?(?:[/?#]\\S*)?$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern SCHEME_PREFIX =
      Pattern.compile("^[a-z][a-z0-9+.-]*:.*", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private final Path homeDirectory;
  private final int listingLimit;

  public QueryClassifier(
      SearchProperties properties, @Value("${user.home}") String homeDirectory) {
    this.homeDirectory = Path.of(homeDirectory).toAbsolutePath().normalize();
    this.listingLimit = properties.getPathListingLimit();
  }

  /**
   * Classifies the query's trimmed input.
   *
   * @param query the current query
   * @return a single URL result, filesystem entries for a path, or an empty list
   */
  public List<SearchResult> classify(SearchQuery query) {
    String input = query.trimmed();
    if (input.isEmpty()) {
      return List.of();
    }
    Optional<String> url = resolveUrl(input);
    if (url.isPresent()) {
      return List.of(new SearchResult.UrlTarget(url.get()));
    }
    if (looksLikePath(input)) {
      return listPath(input);
    }
    return List.of();
  }

  /**
   * Resolves the input to an absolute URL when it is one.
   *
   * @param input trimmed, non-empty input
   * @return the URL to open, or empty when the input is not a URL
   */
  Optional<String> resolveUrl(String input) {
    if (SCHEME_URL.matcher(input).matches() || MAILTO.matcher(input).matches()) {
      return validated(input);
    }
    if (BARE_HOST.matcher(input).matches()) {
      return validated("https://" + input);
    }
    if (input.contains(".") && !containsWhitespace(input) && !looksLikePath(input)) {
      if (SCHEME_PREFIX.matcher(input).matches()) {
        return validated(input);
      }
      return validated("https://" + input);
    }
    return Optional.empty();
  }

  /** Starts with {@code /}, {@code ~} or {@code .}, or contains {@code /}, and has no scheme. */
  static boolean looksLikePath(String input) {
    if (input.isEmpty() || SCHEME_PREFIX.matcher(input).matches()) {
      return false;
    }
    return input.startsWith("/")
        || input.startsWith("~")
        || input.startsWith(".")
        || input.contains("/");
  }

  private List<SearchResult> listPath(String input) {
    Path path = expand(input);
    if (path == null) {
      return List.of();
    }
    if (Files.isDirectory(path)) {
      return listChildren(path, null);
    }
    if (Files.exists(path)) {
      return List.of(entryFor(path));
    }
    Path parent = path.getParent();
    Path fileName = path.getFileName();
    if (parent != null && fileName != null && Files.isDirectory(parent)) {
      return listChildren(parent, fileName.toString().toLowerCase(Locale.ROOT));
    }
    return List.of();
  }

  private @Nullable Path expand(String input) {
    try {
      if (input.equals("~")) {
        return homeDirectory;
      }
      if (input.startsWith("~/")) {
        return homeDirectory.resolve(input.substring(2)).normalize();
      }
      Path path = Path.of(input);
      return path.isAbsolute() ? path.normalize() : homeDirectory.resolve(path).normalize();
    } catch (InvalidPathException e) {
      log.debug("Input is not a valid path: {}", input);
      return null;
    }
  }

  private List<SearchResult> listChildren(Path directory, @Nullable String namePrefix) {
    try (Stream<Path> children = Files.list(directory)) {
      return children
          .filter(child -> !lowerName(child).startsWith("."))
          .filter(child -> namePrefix == null || lowerName(child).startsWith(namePrefix))
          .map(this::entryFor)
          .sorted(
              Comparator.comparing((SearchResult.FileSystemEntry entry) -> !entry.directory())
                  .thenComparing(
                      entry -> Path.of(entry.path()).getFileName().toString(),
                      String.CASE_INSENSITIVE_ORDER))
          .limit(listingLimit)
          .map(SearchResult.class::cast)
          .toList();
    } catch (IOException | SecurityException e) {
      log.warn("Cannot list directory {}: {}", directory, e.getMessage());
      return List.of();
    }
  }

  private SearchResult.FileSystemEntry entryFor(Path path) {
    return new SearchResult.FileSystemEntry(
        path.toAbsolutePath().toString(), Files.isDirectory(path), null);
  }

  private static Optional<String> validated(String candidate) {
    try {
      URI uri = new URI(candidate);
      return uri.getScheme() == null ? Optional.empty() : Optional.of(uri.toString());
    } catch (URISyntaxException e) {
      log.debug("Input looked like a URL but did not parse: {}", candidate);
      return Optional.empty();
    }
  }

  private static String lowerName(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT);
  }

  private static boolean containsWhitespace(String input) {
    return input.codePoints().anyMatch(Character::isWhitespace);
  }
}
