package dev.workflows.model;

/**
 * One recorded heuristic choice: which stage, which rule, and how sure it was.
 *
 * @param confidence 0-1, or {@link Double#NaN} where the rule carries no confidence
 */
public record Decision(String stage, String rule, String detail, double confidence) {

    public static Decision of(String stage, String rule, String detail) {
        return new Decision(stage, rule, detail, Double.NaN);
    }

    public boolean hasConfidence() {
        return !Double.isNaN(confidence);
    }

    @Override
    public String toString() {
        String base = "[" + stage + "] " + rule + ": " + detail;
        return hasConfidence() ? base + " (confidence %.2f)".formatted(confidence) : base;
    }
}
