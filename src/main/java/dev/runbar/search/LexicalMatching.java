package dev.runbar.search;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure lexical helpers shared by the providers: wildcard pattern construction for indices that
 * only understand globbing, alphanumeric tokenization for whole-word bonuses, and a bounded
 * edit-distance gate.
 *
 * <p>This class has no Spring dependencies and no state -- all methods are pure functions.
 */
public final class LexicalMatching {

  private LexicalMatching() {}

  /**
   * Interleaves the query's characters with wildcards so a glob-only index can answer subsequence
   * lookups: {@code abc} becomes {@code *a*b*c*}.
   *
   * @param lowercasedQuery the already lowercased query
   * @return the wildcard pattern, or {@code *} for an empty query
   */
  public static String wildcardPattern(String lowercasedQuery) {
    if (lowercasedQuery.isEmpty()) {
      return "*";
    }
    StringBuilder pattern = new StringBuilder(lowercasedQuery.length() * 2 + 1).append('*');
    lowercasedQuery
        .codePoints()
        .forEach(codePoint -> pattern.appendCodePoint(codePoint).append('*'));
    return pattern.toString();
  }

  /**
   * Splits a string on every non-alphanumeric character and returns the non-empty pieces
   * lowercased. {@code "Visual Studio Code"} yields {@code [visual, studio, code]}.
   *
   * @param text the string to tokenize
   * @return tokens in order of appearance
   */
  public static List<String> tokens(String text) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    text.codePoints()
        .forEach(
            codePoint -> {
              if (Character.isLetterOrDigit(codePoint)) {
                current.appendCodePoint(codePoint);
              } else if (current.length() > 0) {
                tokens.add(current.toString().toLowerCase(Locale.ROOT));
                current.setLength(0);
              }
            });
    if (current.length() > 0) {
      tokens.add(current.toString().toLowerCase(Locale.ROOT));
    }
    return tokens;
  }

  /**
   * Returns true iff {@code a} and {@code b} are identical or differ by exactly one substitution,
   * insertion or deletion. A transposition counts as two substitutions. Pairs whose lengths differ
   * by more than one are rejected without comparing characters.
   *
   * @param a first string
   * @param b second string
   * @return whether the edit distance is at most one
   */
  public static boolean isEditDistanceLeOne(String a, String b) {
    if (a.equals(b)) {
      return true;
    }
    int la = a.length();
    int lb = b.length();
    if (Math.abs(la - lb) > 1) {
      return false;
    }
    int i = 0;
    int j = 0;
    int diffs = 0;
    while (i < la && j < lb) {
      if (a.charAt(i) == b.charAt(j)) {
        i++;
        j++;
        continue;
      }
      diffs++;
      if (diffs > 1) {
        return false;
      }
      if (la == lb) {
        i++;
        j++;
      } else if (la > lb) {
        i++;
      } else {
        j++;
      }
    }
    if (i < la || j < lb) {
      diffs++;
    }
    return diffs <= 1;
  }

  /**
   * Glob match where {@code *} stands for any run of characters. Comparison ignores case and
   * diacritics, like a {@code LIKE[cd]} predicate.
   *
   * @param pattern the wildcard pattern
   * @param text the candidate text
   * @return whether the whole text matches the pattern
   */
  public static boolean matchesWildcard(String pattern, String text) {
    String p = fold(pattern);
    String t = fold(text);
    int pi = 0;
    int ti = 0;
    int starPi = -1;
    int starTi = 0;
    while (ti < t.length()) {
      if (pi < p.length() && p.charAt(pi) == '*') {
        starPi = pi++;
        starTi = ti;
      } else if (pi < p.length() && p.charAt(pi) == t.charAt(ti)) {
        pi++;
        ti++;
      } else if (starPi >= 0) {
        pi = starPi + 1;
        ti = ++starTi;
      } else {
        return false;
      }
    }
    while (pi < p.length() && p.charAt(pi) == '*') {
      pi++;
    }
    return pi == p.length();
  }

  /** Lowercases and strips combining marks so {@code é} compares equal to {@code e}. */
  static String fold(String text) {
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
    return decomposed.replaceAll("\\p{M}+", "").toLowerCase(Locale.ROOT);
  }
}
