package dev.runbar.search;

import java.util.Map;

/**
 * Final scores of one reranked search.
 *
 * @param query the trimmed query text
 * @param scores identity key to final score, in delivery order
 */
public record RecordedScores(String query, Map<String, Integer> scores) {}
