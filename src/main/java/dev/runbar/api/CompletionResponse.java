package dev.runbar.api;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Inline-completion answer for a typed prefix.
 *
 * @param prefix the prefix as sent
 * @param completion the most recent command extending the prefix, if any
 * @param candidates every stored command starting with the prefix, most recent first
 */
public record CompletionResponse(
    String prefix, @Nullable String completion, List<String> candidates) {}
