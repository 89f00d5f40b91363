package dev.workflows.engine;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips a second, unrelated task description that a text generator appended to the first.
 *
 * <p>Boundary rules are tried by priority; the first that fires decides where the second
 * description starts. The cut is then moved back to the end of the first description if one
 * of the end markers is found before the boundary. Never throws.
 */
public final class PromptNormalizer {

    static final String STAGE = "normalizer";

    private static final String INTEGRATIONS_HEADER = "**Required Integrations:**";
    private static final String BRANCH_ONE = "### BRANCH 1:";

    /** A signature that locates the start of an appended description, or nothing. */
    record BoundaryRule(String id, int priority, Function<String, OptionalInt> locator) {}

    /** A marker that closes the first description; the cut goes right after the match. */
    record EndMarker(String id, Pattern pattern) {}

    static final List<BoundaryRule> BOUNDARY_RULES = List.of(
        new BoundaryRule("system-warning", 10,
            anchoredBy("### ⚠️ Otomatik Sistem Uyarısı:", "\n\n**Required Integrations:")),
        new BoundaryRule("blank-lines-before-integrations", 20, PromptNormalizer::blankLinesBeforeIntegrations),
        new BoundaryRule("plan-conclusion-then-integrations", 30,
            anchoredBy("This comprehensive plan ensures", "\n\n**Required Integrations:")),
        new BoundaryRule("repeated-branch-one", 40, PromptNormalizer::repeatedBranchOne),
        new BoundaryRule("repeated-integrations-after-branch", 50, PromptNormalizer::repeatedIntegrations),
        new BoundaryRule("additional-requirements-then-section", 60, PromptNormalizer::additionalThenSection)
    ).stream().sorted(Comparator.comparingInt(BoundaryRule::priority)).toList();

    /** Marker spans are bounded so a marker without its closing text costs at most one window. */
    static final List<EndMarker> END_MARKERS = List.of(
        new EndMarker("plan-conclusion", Pattern.compile("This comprehensive plan ensures[^\n]{0,2000}?workflow\\.")),
        new EndMarker("additional-requirements", Pattern.compile("## Additional Requirements:[^.]{0,2000}\\.")),
        new EndMarker("validation-checklist", Pattern.compile("### Validation Checklist[^☑]{0,4000}☑[^\n]{0,2000}\\."))
    );

    private PromptNormalizer() {}

    public static String normalize(String raw) {
        return normalize(raw, DecisionTrace.discarding());
    }

    /**
     * Remove an appended second description, if one is detected.
     *
     * @return the trimmed first description, or the input unchanged when nothing was detected
     */
    public static String normalize(String raw, DecisionTrace trace) {
        if (raw == null) {
            return "";
        }
        for (BoundaryRule rule : BOUNDARY_RULES) {
            OptionalInt located = rule.locator().apply(raw);
            // a boundary at offset 0 leaves no first description to keep
            if (located.isEmpty() || located.getAsInt() <= 0) {
                continue;
            }
            int boundary = located.getAsInt();
            int cut = cutPoint(raw, boundary, rule, trace);
            String cleaned = raw.substring(0, cut).trim();
            trace.record(STAGE, rule.id(),
                "boundary at %d, cut at %d, removed %d chars".formatted(boundary, cut, raw.length() - cleaned.length()));
            return cleaned;
        }
        return raw;
    }

    private static int cutPoint(String raw, int boundary, BoundaryRule rule, DecisionTrace trace) {
        String before = raw.substring(0, boundary);
        for (EndMarker marker : END_MARKERS) {
            Matcher m = marker.pattern().matcher(before);
            if (m.find()) {
                trace.record(STAGE, "end-marker", marker.id());
                return m.end();
            }
        }
        if (rule.id().equals("repeated-branch-one")) {
            int blank = raw.lastIndexOf("\n\n", boundary);
            if (blank > 0) {
                return blank;
            }
        }
        return boundary;
    }

    private static Function<String, OptionalInt> anchoredBy(String anchor, String follow) {
        return text -> {
            int start = text.indexOf(anchor);
            if (start < 0 || text.indexOf(follow, start + anchor.length()) < 0) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(start);
        };
    }

    /** Start of a run of three or more newlines directly before the integrations header. */
    private static OptionalInt blankLinesBeforeIntegrations(String text) {
        int header = text.indexOf(INTEGRATIONS_HEADER);
        while (header >= 0) {
            int runStart = newlineRunStart(text, header);
            if (header - runStart >= 3) {
                return OptionalInt.of(runStart);
            }
            header = text.indexOf(INTEGRATIONS_HEADER, header + INTEGRATIONS_HEADER.length());
        }
        return OptionalInt.empty();
    }

    private static int newlineRunStart(String text, int end) {
        int start = end;
        while (start > 0 && text.charAt(start - 1) == '\n') {
            start--;
        }
        return start;
    }

    private static OptionalInt repeatedBranchOne(String text) {
        int first = text.indexOf(BRANCH_ONE);
        if (first < 0) {
            return OptionalInt.empty();
        }
        int second = text.indexOf(BRANCH_ONE, first + BRANCH_ONE.length());
        return second < 0 ? OptionalInt.empty() : OptionalInt.of(second);
    }

    private static OptionalInt repeatedIntegrations(String text) {
        int branch = text.indexOf("### BRANCH");
        if (branch < 0) {
            return OptionalInt.empty();
        }
        int first = text.indexOf(INTEGRATIONS_HEADER);
        if (first < 0) {
            return OptionalInt.empty();
        }
        int second = text.indexOf(INTEGRATIONS_HEADER, Math.max(first + INTEGRATIONS_HEADER.length(), branch));
        return second < 0 ? OptionalInt.empty() : OptionalInt.of(second);
    }

    private static OptionalInt additionalThenSection(String text) {
        int start = text.indexOf("## Additional Requirements:");
        if (start < 0) {
            return OptionalInt.empty();
        }
        return sectionAfterBlankLine(text, start);
    }

    /** First blank-line run from {@code from} that is followed by a branch or level-2 section header. */
    private static OptionalInt sectionAfterBlankLine(String text, int from) {
        int run = text.indexOf("\n\n", from);
        while (run >= 0) {
            int end = run;
            while (end < text.length() && text.charAt(end) == '\n') {
                end++;
            }
            if (text.startsWith("### BRANCH", end) || (text.startsWith("## ", end)
                    && end + 3 < text.length() && text.charAt(end + 3) >= 'A' && text.charAt(end + 3) <= 'Z')) {
                return OptionalInt.of(run);
            }
            run = text.indexOf("\n\n", end);
        }
        return OptionalInt.empty();
    }
}
