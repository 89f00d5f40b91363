package dev.workflows.engine;

import dev.workflows.model.NodeType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Motif detection for one requirement, driven by a rule table, plus the named-alternative
 * groups the synthesis builder uses to spot implicit fan-out.
 */
public final class MotifAnalyzer {

    public enum Motif { PARALLEL, SWITCH, MERGE }

    /**
     * What the analyzer looks at.
     *
     * @param context the requirement's own line and the lines that belong to it
     */
    public record Subject(String name, String description, List<String> context, NodeType resolvedType) {

        String lowerName() {
            return name.toLowerCase(Locale.ROOT);
        }

        String lowerDescription() {
            return description.toLowerCase(Locale.ROOT);
        }

        String lowerContext() {
            return String.join("\n", context).toLowerCase(Locale.ROOT);
        }
    }

    public record MotifRule(String id, Motif motif, Predicate<Subject> test) {}

    /** Detected motifs and any switch conditions found. */
    public record Motifs(Set<Motif> motifs, List<String> conditions, List<String> firedRules) {

        public boolean has(Motif motif) {
            return motifs.contains(motif);
        }
    }

    /** One named alternative, e.g. the PayPal option of the payment group. */
    public record Alternative(String group, String label) {}

    private record AlternativeGroup(String group, List<Option> options) {}

    private record Option(String label, Pattern pattern) {}

    static final List<MotifRule> RULES = List.of(
        new MotifRule("switch-name", Motif.SWITCH, s -> containsAny(s.lowerName(),
            "switch", "route", "router", "routing", "decision", "evaluation")),
        new MotifRule("switch-description", Motif.SWITCH, s -> s.resolvedType() != NodeType.IF
            && containsAny(s.lowerDescription(), "condition", "branches:", "route based on")),
        new MotifRule("switch-type", Motif.SWITCH, s -> s.resolvedType() == NodeType.SWITCH),
        new MotifRule("merge-name", Motif.MERGE, s -> containsAny(s.lowerName(),
            "merge", "combine", "collect results")),
        new MotifRule("merge-type", Motif.MERGE, s -> s.resolvedType() == NodeType.MERGE),
        new MotifRule("parallel-marker", Motif.PARALLEL, s -> containsAny(
            s.lowerName() + "\n" + s.lowerDescription() + "\n" + s.lowerContext(),
            "parallel execution", "parallel processing", "(parallel)", "simultaneously", "at the same time"))
    );

    private static final List<AlternativeGroup> ALTERNATIVES = List.of(
        new AlternativeGroup("payment", List.of(
            option("Stripe", "(?i)\\bstripe\\b"),
            option("PayPal", "(?i)\\bpaypal\\b"),
            option("Crypto", "(?i)\\bcrypto(?:currency)?\\b"))),
        new AlternativeGroup("notification", List.of(
            option("Email", "(?i)\\be-?mail\\b"),
            option("SMS", "(?i)\\bsms\\b"),
            option("Slack", "(?i)\\bslack\\b"),
            option("WhatsApp", "(?i)\\bwhatsapp\\b"),
            option("Telegram", "(?i)\\btelegram\\b"))),
        new AlternativeGroup("shipping", List.of(
            option("DHL", "(?i)\\bdhl\\b"),
            // case-sensitive: lower-case "ups" is an ordinary word
            option("UPS", "\\bUPS\\b"),
            option("FedEx", "(?i)\\bfedex\\b")))
    );

    private static final Pattern CONDITION_HEADER =
        Pattern.compile("(?i)\\b(?:condition|branch|case)s?:\\**\\s*$");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*]\\s+(.+)$");
    private static final Pattern INLINE_GROUP = Pattern.compile("\\(([^()\n]*)\\)");

    private MotifAnalyzer() {}

    public static Motifs analyze(Subject subject) {
        var motifs = EnumSet.noneOf(Motif.class);
        var fired = new ArrayList<String>();
        for (MotifRule rule : RULES) {
            if (rule.test().test(subject)) {
                motifs.add(rule.motif());
                fired.add(rule.id());
            }
        }
        List<String> conditions = motifs.contains(Motif.SWITCH) ? extractConditions(subject) : List.of();
        return new Motifs(motifs, conditions, fired);
    }

    /**
     * Conditions from a "Conditions:" / "Branches:" / "Cases:" bullet list in the context,
     * then from parenthesized comma lists on the requirement itself.
     */
    static List<String> extractConditions(Subject subject) {
        var conditions = new LinkedHashSet<String>();
        List<String> lines = subject.context();
        for (int i = 0; i < lines.size(); i++) {
            if (!CONDITION_HEADER.matcher(lines.get(i)).find()) {
                continue;
            }
            for (int j = i + 1; j < lines.size(); j++) {
                Matcher bullet = BULLET.matcher(lines.get(j));
                if (!bullet.matches()) {
                    break;
                }
                String condition = bullet.group(1).replace("**", "").trim();
                if (!condition.isEmpty()) {
                    conditions.add(condition);
                }
            }
        }
        Matcher inline = INLINE_GROUP.matcher(subject.name() + " " + subject.description());
        while (inline.find()) {
            String content = inline.group(1);
            if (content.contains(",")) {
                for (String part : content.split(",")) {
                    String condition = part.replaceFirst("(?i)^\\s*(?:and|or)\\s+", "").trim();
                    if (!condition.isEmpty()) {
                        conditions.add(condition);
                    }
                }
            }
        }
        return List.copyOf(conditions);
    }

    /**
     * The single named alternative a requirement refers to. The name is consulted first;
     * the description only when the name names none. Text naming several is not an alternative.
     */
    public static Optional<Alternative> alternativeOf(String name, String description) {
        Optional<Alternative> fromName = singleAlternative(name);
        if (fromName.isPresent() || !mentionsNone(name)) {
            return fromName;
        }
        return singleAlternative(description);
    }

    /** Members of a known alternative group mentioned in the text, in group order. */
    public static List<String> alternativesMentioned(String text, String group) {
        var labels = new ArrayList<String>();
        for (AlternativeGroup g : ALTERNATIVES) {
            if (g.group().equals(group)) {
                for (Option option : g.options()) {
                    if (option.pattern().matcher(text).find()) {
                        labels.add(option.label());
                    }
                }
            }
        }
        return labels;
    }

    private static Optional<Alternative> singleAlternative(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Alternative found = null;
        for (AlternativeGroup group : ALTERNATIVES) {
            for (Option option : group.options()) {
                if (option.pattern().matcher(text).find()) {
                    if (found != null) {
                        return Optional.empty();
                    }
                    found = new Alternative(group.group(), option.label());
                }
            }
        }
        return Optional.ofNullable(found);
    }

    private static boolean mentionsNone(String text) {
        if (text == null) {
            return true;
        }
        for (AlternativeGroup group : ALTERNATIVES) {
            for (Option option : group.options()) {
                if (option.pattern().matcher(text).find()) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Option option(String label, String regex) {
        return new Option(label, Pattern.compile(regex));
    }

    static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
