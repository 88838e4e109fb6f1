package dev.runbar.api;

import dev.runbar.search.HistoryTarget;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/history}: a command the user just ran successfully.
 *
 * @param command the command text
 * @param display optional title to show for it
 * @param subtitle optional subtitle to show for it
 * @param target optional reference to what it launched
 */
public record RecordCommandRequest(
    @NotBlank @Size(max = 4096) String command,
    @Nullable String display,
    @Nullable String subtitle,
    @Nullable HistoryTarget target) {}
