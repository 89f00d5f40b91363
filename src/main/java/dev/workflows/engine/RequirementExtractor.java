package dev.workflows.engine;

import dev.workflows.model.Branch;
import dev.workflows.model.ComplexityRange;
import dev.workflows.model.MatchResult;
import dev.workflows.model.NodeType;
import dev.workflows.model.Requirement;
import dev.workflows.model.RequirementTree;
import dev.workflows.model.TriggerKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses normalized prompt text into a {@link RequirementTree}.
 *
 * <p>Two grammars are tried in order: explicit {@code ### BRANCH n:} sections with a
 * {@code **Trigger:**} field and a numbered {@code **Processing Flow:**} list, then a
 * generic numbered-step list with {@code **Node Type:**} / {@code **Node:**} sub-fields.
 * Neither matching yields an empty tree rather than an exception. All patterns are
 * line-anchored.
 */
public final class RequirementExtractor {

    static final String STAGE = "extractor";
    static final String MAIN_BRANCH = "Main Workflow";

    private static final Pattern BRANCH_HEADER = Pattern.compile("^\\s*#{2,4}\\s*BRANCH\\s+(\\d+)\\s*:\\s*(.*)$");
    private static final Pattern SECTION_END = Pattern.compile("^\\s*##\\s+Additional\\b.*$");
    private static final Pattern TRIGGER_FIELD = Pattern.compile("^\\s*(?:[-*]\\s*)?\\*\\*Trigger:\\*\\*\\s*(.*)$");
    private static final Pattern FLOW_FIELD = Pattern.compile("^\\s*(?:[-*]\\s*)?\\*\\*Processing Flow:\\*\\*\\s*$");
    private static final Pattern FIELD = Pattern.compile("^\\s*(?:[-*]\\s*)?\\*\\*[^*\n]+:\\*\\*.*$");
    private static final Pattern FLOW_ITEM = Pattern.compile("^\\s*(\\d+)\\.\\s+(.+)$");

    private static final Pattern STEP = Pattern.compile("^\\s*(\\d+)\\.\\s+\\*\\*([^*\n]+)\\*\\*(.*)$");
    private static final Pattern NODE_TYPE_FIELD = Pattern.compile("\\*\\*Node Type:\\*\\*\\s*(.+)$");
    private static final Pattern NODE_FIELD = Pattern.compile("\\*\\*Node:\\*\\*\\s*(.+)$");
    private static final int STEP_LOOKAHEAD = 4;

    private static final Pattern TITLE = Pattern.compile("^#{1,2}\\s+(.+)$");
    private static final Pattern NAME_LINE = Pattern.compile("^\\s*(?:\\*\\*)?Name:(?:\\*\\*)?\\s*(.+)$");
    private static final Pattern COMPLEXITY = Pattern.compile(
        "(?i)Expected Complexity:\\**\\s*(\\d{1,4})\\s*-\\s*(\\d{1,4})\\s*nodes");
    private static final Pattern ERROR_HANDLING = Pattern.compile(
        "(?i)error\\s{0,3}handling|error\\s{0,3}trigger|catch[^\n]{0,200}errors");

    /** A parsed list item before it becomes a {@link Requirement}. */
    private record Step(String name, String description, String declaredType, int line) {}

    private RequirementExtractor() {}

    public static RequirementTree extract(String text) {
        return extract(text, DecisionTrace.discarding());
    }

    public static RequirementTree extract(String text, DecisionTrace trace) {
        if (text == null || text.isBlank()) {
            trace.record(STAGE, "empty-input", "nothing to parse");
            return RequirementTree.empty();
        }
        List<String> lines = List.of(text.split("\r?\n", -1));

        List<Branch> branches = parseBranchSections(lines, trace);
        if (branches.isEmpty()) {
            branches = parseNumberedSteps(lines, trace);
        } else {
            trace.record(STAGE, "grammar", "branch sections (" + branches.size() + ")");
        }
        if (branches.isEmpty()) {
            trace.record(STAGE, "grammar", "no grammar matched");
        }

        String name = workflowName(lines);
        ComplexityRange complexity = complexity(text);
        boolean errorHandling = ERROR_HANDLING.matcher(text).find();
        if (errorHandling) {
            trace.record(STAGE, "error-handling", "global error handling requested");
        }
        return new RequirementTree(name, branches, complexity, errorHandling);
    }

    private static List<Branch> parseBranchSections(List<String> lines, DecisionTrace trace) {
        var branches = new ArrayList<Branch>();
        int i = 0;
        while (i < lines.size()) {
            Matcher header = BRANCH_HEADER.matcher(lines.get(i));
            if (!header.matches()) {
                i++;
                continue;
            }
            String branchId = header.group(1);
            String branchName = stripMarkup(header.group(2));
            int end = i + 1;
            while (end < lines.size()
                && !BRANCH_HEADER.matcher(lines.get(end)).matches()
                && !SECTION_END.matcher(lines.get(end)).matches()) {
                end++;
            }
            branches.add(parseSection(lines, i + 1, end, branchId, branchName, trace));
            i = end;
        }
        return branches;
    }

    private static Branch parseSection(List<String> lines, int from, int to, String branchId,
                                       String branchName, DecisionTrace trace) {
        String triggerText = null;
        var steps = new ArrayList<Step>();
        boolean inFlow = false;
        for (int i = from; i < to; i++) {
            String line = lines.get(i);
            Matcher trigger = TRIGGER_FIELD.matcher(line);
            if (trigger.matches()) {
                triggerText = stripMarkup(trigger.group(1));
                inFlow = false;
                continue;
            }
            if (FLOW_FIELD.matcher(line).matches()) {
                inFlow = true;
                continue;
            }
            if (!inFlow) {
                continue;
            }
            Matcher item = FLOW_ITEM.matcher(line);
            if (item.matches()) {
                String full = stripMarkup(item.group(2));
                int paren = full.indexOf('(');
                String name = (paren > 0 ? full.substring(0, paren) : full).trim();
                if (name.endsWith(":")) {
                    name = name.substring(0, name.length() - 1).trim();
                }
                steps.add(new Step(name.isEmpty() ? full : name, full, null, i));
            } else if (FIELD.matcher(line).matches()) {
                inFlow = false;
            }
        }
        TriggerKind fallback = TriggerKind.WEBHOOK;
        var elided = elideTriggerSteps(steps, trace);
        if (triggerText == null && elided != null) {
            triggerText = elided;
        }
        TriggerKind kind = triggerText == null ? fallback : inferTrigger(triggerText, fallback);
        trace.record(STAGE, "trigger", "branch " + branchId + ": " + kind);
        List<Requirement> requirements = toRequirements(steps, lines, branchId, to, trace);
        return new Branch(branchId, branchName.isEmpty() ? "Branch " + branchId : branchName, kind, requirements);
    }

    private static List<Branch> parseNumberedSteps(List<String> lines, DecisionTrace trace) {
        var steps = new ArrayList<Step>();
        for (int i = 0; i < lines.size(); i++) {
            Matcher step = STEP.matcher(lines.get(i));
            if (!step.matches()) {
                continue;
            }
            String name = step.group(2).trim();
            if (name.endsWith(":")) {
                name = name.substring(0, name.length() - 1).trim();
            }
            String declaredType = null;
            String description = stripMarkup(step.group(3)).replaceFirst("^[\\s:\\-]+", "");
            for (int j = i + 1; j < Math.min(i + 1 + STEP_LOOKAHEAD, lines.size()); j++) {
                String detail = lines.get(j);
                if (FLOW_ITEM.matcher(detail).matches()) {
                    break;
                }
                Matcher type = NODE_TYPE_FIELD.matcher(detail);
                if (type.find()) {
                    declaredType = stripMarkup(type.group(1)).replace("`", "").trim();
                }
                Matcher node = NODE_FIELD.matcher(detail);
                if (node.find()) {
                    description = stripMarkup(node.group(1));
                }
            }
            steps.add(new Step(name, description.isBlank() ? name : description, declaredType, i));
        }
        if (steps.isEmpty()) {
            return List.of();
        }
        String elided = elideTriggerSteps(steps, trace);
        TriggerKind kind = elided == null ? TriggerKind.WEBHOOK : inferTrigger(elided, TriggerKind.WEBHOOK);
        List<Requirement> requirements = toRequirements(steps, lines, "1", lines.size(), trace);
        if (requirements.isEmpty()) {
            return List.of();
        }
        trace.record(STAGE, "grammar", "numbered steps (" + requirements.size() + ")");
        return List.of(new Branch("1", MAIN_BRANCH, kind, requirements));
    }

    /**
     * Drop leading trigger-like steps; a trigger node is synthesized separately.
     *
     * @return the text of the first elided step, or null if none was elided
     */
    private static String elideTriggerSteps(List<Step> steps, DecisionTrace trace) {
        String first = null;
        while (!steps.isEmpty() && isTriggerLike(steps.get(0))) {
            Step elided = steps.remove(0);
            trace.record(STAGE, "elide-trigger-step", elided.name());
            if (first == null) {
                first = elided.name() + " " + elided.description()
                    + (elided.declaredType() == null ? "" : " " + elided.declaredType());
            }
        }
        return first;
    }

    private static boolean isTriggerLike(Step step) {
        String name = step.name().toLowerCase(Locale.ROOT);
        if (name.contains("trigger") || name.contains("order received")) {
            return true;
        }
        return step.declaredType() != null && NodeType.fromTag(step.declaredType()).isTrigger();
    }

    static TriggerKind inferTrigger(String text, TriggerKind fallback) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("webhook") || lower.contains("http") || lower.contains("api request")) {
            return TriggerKind.WEBHOOK;
        }
        if (lower.contains("schedule") || lower.contains("cron") || lower.contains("hourly")
            || lower.contains("daily") || lower.contains("every ")) {
            return TriggerKind.SCHEDULE;
        }
        if (lower.contains("error")) {
            return TriggerKind.ERROR;
        }
        if (lower.contains("manual")) {
            return TriggerKind.MANUAL;
        }
        return fallback;
    }

    private static List<Requirement> toRequirements(List<Step> steps, List<String> lines, String branchId,
                                                    int sectionEnd, DecisionTrace trace) {
        var requirements = new ArrayList<Requirement>();
        for (int s = 0; s < steps.size(); s++) {
            Step step = steps.get(s);
            int contextEnd = s + 1 < steps.size() ? steps.get(s + 1).line() : Math.min(sectionEnd, step.line() + 4);
            List<String> context = lines.subList(step.line(), Math.max(step.line() + 1, contextEnd));

            MatchResult match = resolve(step, trace);
            var motifs = MotifAnalyzer.analyze(
                new MotifAnalyzer.Subject(step.name(), step.description(), context, match.nodeType()));
            if (!motifs.firedRules().isEmpty()) {
                trace.record(STAGE, "motif", step.name() + ": " + motifs.motifs() + " via " + motifs.firedRules());
            }
            requirements.add(new Requirement(
                step.name(),
                step.description(),
                match,
                branchId,
                motifs.has(MotifAnalyzer.Motif.PARALLEL),
                motifs.has(MotifAnalyzer.Motif.SWITCH),
                motifs.has(MotifAnalyzer.Motif.MERGE),
                motifs.conditions()));
        }
        return requirements;
    }

    private static MatchResult resolve(Step step, DecisionTrace trace) {
        if (step.declaredType() != null) {
            NodeType declared = NodeType.fromTag(step.declaredType());
            if (declared != NodeType.UNRECOGNIZED) {
                trace.record(NodeTypeResolver.STAGE, "declared", step.name() + " -> " + declared.shortName(), 1.0);
                return new MatchResult(declared, 1.0, "Declared in prompt", List.of(), MatchResult.Strategy.DECLARED);
            }
        }
        String text = step.name().equals(step.description()) ? step.name() : step.name() + " " + step.description();
        return NodeTypeResolver.resolve(text, trace);
    }

    private static String workflowName(List<String> lines) {
        for (String line : lines) {
            Matcher title = TITLE.matcher(line.trim());
            if (title.matches()) {
                String name = stripMarkup(title.group(1));
                if (!name.isEmpty()) {
                    return name;
                }
            }
        }
        for (String line : lines) {
            Matcher name = NAME_LINE.matcher(line);
            if (name.matches()) {
                String value = stripMarkup(name.group(1));
                if (!value.isEmpty()) {
                    return value;
                }
            }
        }
        return RequirementTree.DEFAULT_NAME;
    }

    private static ComplexityRange complexity(String text) {
        Matcher m = COMPLEXITY.matcher(text);
        if (!m.find()) {
            return null;
        }
        return new ComplexityRange(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    private static String stripMarkup(String text) {
        return text == null ? "" : text.replace("**", "").trim();
    }
}
