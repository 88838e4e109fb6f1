package dev.runbar.search;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One package from the offline catalog.
 *
 * @param token the short package token, e.g. {@code visual-studio-code}
 * @param fullToken the fully qualified token (tap-prefixed where applicable)
 * @param names display names, the first being the primary one
 * @param description optional one-line description
 * @param homepage optional project homepage
 * @param url optional download URL
 * @param version optional version string
 * @param deprecated whether the catalog flags the package as deprecated
 * @param appNames program filenames the package installs, e.g. {@code Visual Studio Code.app}
 */
public record CatalogEntry(
    String token,
    String fullToken,
    List<String> names,
    @Nullable String description,
    @Nullable String homepage,
    @Nullable String url,
    @Nullable String version,
    boolean deprecated,
    List<String> appNames) {

  /** Compact constructor validating input and freezing the lists. */
  public CatalogEntry {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("Catalog token must not be blank");
    }
    fullToken = fullToken == null || fullToken.isBlank() ? token : fullToken;
    names = names == null ? List.of() : List.copyOf(names);
    appNames = appNames == null ? List.of() : List.copyOf(appNames);
  }

  /** Primary display name: the first listed name, else the token. */
  public String displayName() {
    return names.isEmpty() ? token : names.get(0);
  }

  /** Every string a query may match against: names, token, full token and description. */
  public List<String> searchableTerms() {
    List<String> terms = new ArrayList<>(names);
    terms.add(token);
    terms.add(fullToken);
    if (description != null) {
      terms.add(description);
    }
    return terms;
  }
}
