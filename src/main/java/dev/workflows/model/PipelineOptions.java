package dev.workflows.model;

import java.util.Objects;

/**
 * Knobs for one pipeline run.
 *
 * @param maxInputChars raw input beyond this length is cut before any parsing
 * @param rowTolerance  vertical distance within which two nodes count as the same row
 */
public record PipelineOptions(
    int maxInputChars,
    boolean autoRepair,
    int rowTolerance,
    Layout layout
) {
    public static final int DEFAULT_MAX_INPUT_CHARS = 100_000;
    public static final boolean DEFAULT_AUTO_REPAIR = true;
    public static final int DEFAULT_ROW_TOLERANCE = 150;

    public PipelineOptions {
        if (maxInputChars <= 0) {
            throw new IllegalArgumentException("maxInputChars must be positive: " + maxInputChars);
        }
        if (rowTolerance < 0) {
            throw new IllegalArgumentException("rowTolerance must not be negative: " + rowTolerance);
        }
        Objects.requireNonNull(layout, "layout");
    }

    public static PipelineOptions defaults() {
        return new PipelineOptions(DEFAULT_MAX_INPUT_CHARS, DEFAULT_AUTO_REPAIR, DEFAULT_ROW_TOLERANCE,
            Layout.defaults());
    }

    public PipelineOptions withAutoRepair(boolean autoRepair) {
        return new PipelineOptions(maxInputChars, autoRepair, rowTolerance, layout);
    }

    public PipelineOptions withMaxInputChars(int maxInputChars) {
        return new PipelineOptions(maxInputChars, autoRepair, rowTolerance, layout);
    }
}
