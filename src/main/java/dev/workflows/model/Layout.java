package dev.workflows.model;

/**
 * Canvas geometry used when positions have to be invented.
 */
public record Layout(
    int startX,
    int startY,
    int horizontalSpacing,
    int branchSpacing,
    int parallelSpacing
) {
    public static final int DEFAULT_START_X = 250;
    public static final int DEFAULT_START_Y = 300;
    public static final int DEFAULT_HORIZONTAL_SPACING = 200;
    public static final int DEFAULT_BRANCH_SPACING = 400;
    public static final int DEFAULT_PARALLEL_SPACING = 200;

    public static Layout defaults() {
        return new Layout(DEFAULT_START_X, DEFAULT_START_Y, DEFAULT_HORIZONTAL_SPACING,
            DEFAULT_BRANCH_SPACING, DEFAULT_PARALLEL_SPACING);
    }

    public Position start() {
        return new Position(startX, startY);
    }
}
