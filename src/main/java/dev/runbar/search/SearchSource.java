package dev.runbar.search;

/** High-level source identifiers so the reranker can reason about cross-source priority. */
public enum SearchSource {
  INSTALLED,
  CATALOG,
  HISTORY
}
