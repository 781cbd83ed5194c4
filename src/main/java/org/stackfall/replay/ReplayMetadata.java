package org.stackfall.replay;

import org.stackfall.runtime.model.Shape;

/**
 * Session summary stored alongside the event log. Computed once when a session ends.
 *
 * @param version        Format version, {@link #CURRENT_VERSION} for new recordings.
 * @param startTimestamp Wall-clock start in epoch milliseconds.
 * @param boardWidth     Board columns.
 * @param boardHeight    Board rows.
 * @param firstShape     The shape of the first active piece.
 * @param secondShape    The first previewed shape.
 * @param finalScore     Score when the session ended.
 * @param finalLevel     Level when the session ended.
 * @param finalLines     Lines cleared when the session ended.
 * @param durationMs     Session length in milliseconds.
 */
public record ReplayMetadata(
        String version,
        long startTimestamp,
        int boardWidth,
        int boardHeight,
        Shape firstShape,
        Shape secondShape,
        int finalScore,
        int finalLevel,
        int finalLines,
        long durationMs
) {

    public static final String CURRENT_VERSION = "1.0";
}
