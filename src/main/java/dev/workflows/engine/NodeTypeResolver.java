package dev.workflows.engine;

import dev.workflows.model.MatchResult;
import dev.workflows.model.MatchResult.Strategy;
import dev.workflows.model.NodeType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a free-text requirement to a node type with a confidence score.
 *
 * <p>Resolution order: semantic profiles (accepted at 0.5 or above), catalog lookup,
 * two phrasing overrides, then the generic function node. Total and deterministic.
 */
public final class NodeTypeResolver {

    static final String STAGE = "resolver";

    public static final double ACCEPT_THRESHOLD = 0.5;
    public static final double CATALOG_CONFIDENCE = 0.6;
    public static final double OVERRIDE_CONFIDENCE = 0.5;
    public static final double DEFAULT_CONFIDENCE = 0.2;
    public static final int MAX_DESCRIPTION_CHARS = 4096;
    public static final NodeType DEFAULT_TYPE = NodeType.FUNCTION;

    private static final double KEYWORD_WEIGHT = 0.5;
    private static final double CONCEPT_WEIGHT = 0.3;
    private static final double USE_CASE_WEIGHT = 0.2;
    private static final int MAX_ALTERNATIVES = 3;

    /** Keyword, concept and use-case vocabulary for one node type. Phrases use '_' between words. */
    record SemanticProfile(NodeType type, List<String> keywords, List<String> concepts, List<String> useCases) {}

    private record Scored(SemanticProfile profile, double score) {}

    static final List<SemanticProfile> PROFILES = List.of(
        new SemanticProfile(NodeType.MQTT,
            List.of("mqtt", "broker", "iot", "sensor", "device", "telemetry", "publish", "subscribe", "topic"),
            List.of("real_time_monitoring", "device_communication", "sensor_data_collection"),
            List.of("iot_integration", "sensor_monitoring", "device_control")),
        new SemanticProfile(NodeType.EMAIL_SEND,
            List.of("email", "mail", "send", "notify", "alert", "report", "message"),
            List.of("notification", "alerting", "reporting", "communication"),
            List.of("send_alerts", "send_reports", "notify_users")),
        new SemanticProfile(NodeType.TWILIO,
            List.of("sms", "text", "message", "phone", "twilio", "mobile", "urgent"),
            List.of("urgent_notification", "mobile_alert", "sms_messaging"),
            List.of("critical_alerts", "mobile_notifications", "two_factor_auth")),
        new SemanticProfile(NodeType.WHATSAPP_BUSINESS,
            List.of("whatsapp", "chat", "instant", "message", "business", "customer"),
            List.of("instant_messaging", "customer_communication", "chat_integration"),
            List.of("customer_support", "instant_notifications", "order_updates")),
        new SemanticProfile(NodeType.HTTP_REQUEST,
            List.of("http", "api", "rest", "webhook", "request", "fetch", "get", "post", "web",
                "gpio", "relay", "hardware", "control"),
            List.of("api_integration", "web_service", "data_fetching", "hardware_control_api"),
            List.of("api_calls", "webhook_integration", "external_service", "gpio_control",
                "relay_switching", "hardware_interface")),
        new SemanticProfile(NodeType.FUNCTION,
            List.of("function", "code", "process", "calculate", "transform", "logic", "custom"),
            List.of("data_processing", "custom_logic", "calculation"),
            List.of("data_transformation", "complex_calculations", "business_logic")),
        new SemanticProfile(NodeType.CODE,
            List.of("code", "javascript", "python", "script", "program", "algorithm", "model"),
            List.of("scripting", "advanced_processing", "ml_models"),
            List.of("machine_learning", "complex_algorithms", "data_analysis")),
        new SemanticProfile(NodeType.EXECUTE_COMMAND,
            List.of("execute", "command", "shell", "bash", "script", "gpio", "pin", "hardware", "system", "control"),
            List.of("system_control", "shell_execution", "hardware_control_script"),
            List.of("system_commands", "script_execution", "gpio_control", "hardware_manipulation", "sensor_reading"))
    );

    private NodeTypeResolver() {}

    public static MatchResult resolve(String description) {
        return resolve(description, DecisionTrace.discarding());
    }

    /**
     * Resolve a requirement description. Never throws; confidence is always within [0, 1].
     */
    public static MatchResult resolve(String description, DecisionTrace trace) {
        String text = description == null ? "" : description;
        if (text.length() > MAX_DESCRIPTION_CHARS) {
            text = text.substring(0, MAX_DESCRIPTION_CHARS);
        }
        String lower = text.toLowerCase(Locale.ROOT);

        List<Scored> ranked = rankProfiles(lower);
        List<NodeType> alternatives = ranked.stream()
            .skip(1)
            .limit(MAX_ALTERNATIVES)
            .map(s -> s.profile().type())
            .toList();

        if (!ranked.isEmpty()) {
            Scored best = ranked.get(0);
            double confidence = best.score() / 100.0;
            if (confidence >= ACCEPT_THRESHOLD) {
                var result = new MatchResult(best.profile().type(), confidence,
                    reasoning(lower, best), alternatives, Strategy.SEMANTIC);
                trace.record(STAGE, "semantic", summary(text, result), result.confidence());
                return result;
            }
        }

        Optional<NodeCatalog.CatalogMatch> catalog = NodeCatalog.bestMatch(lower);
        if (catalog.isPresent()) {
            var result = new MatchResult(catalog.get().type(), CATALOG_CONFIDENCE,
                "Catalog match with score " + catalog.get().score(), alternatives, Strategy.CATALOG);
            trace.record(STAGE, "catalog", summary(text, result), result.confidence());
            return result;
        }

        if (lower.contains("central router") || lower.contains("route based on")) {
            var result = new MatchResult(NodeType.SWITCH, OVERRIDE_CONFIDENCE,
                "Routing phrasing", alternatives, Strategy.OVERRIDE);
            trace.record(STAGE, "override-router", summary(text, result), result.confidence());
            return result;
        }
        if (lower.contains("collect") && lower.contains("results")) {
            var result = new MatchResult(NodeType.MERGE, OVERRIDE_CONFIDENCE,
                "Result collection phrasing", alternatives, Strategy.OVERRIDE);
            trace.record(STAGE, "override-collect", summary(text, result), result.confidence());
            return result;
        }

        var result = new MatchResult(DEFAULT_TYPE, DEFAULT_CONFIDENCE,
            "No confident match, using generic processing node", alternatives, Strategy.DEFAULT);
        trace.record(STAGE, "default", summary(text, result), result.confidence());
        return result;
    }

    private static List<Scored> rankProfiles(String lower) {
        var scored = new ArrayList<Scored>();
        for (SemanticProfile profile : PROFILES) {
            double total = KEYWORD_WEIGHT * keywordScore(lower, profile.keywords())
                + CONCEPT_WEIGHT * conceptScore(lower, profile.concepts())
                + USE_CASE_WEIGHT * useCaseScore(lower, profile.useCases());
            if (total > 0) {
                scored.add(new Scored(profile, total));
            }
        }
        // stable sort: equal scores keep profile order
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        return scored;
    }

    /** Exact substring 10, 70% partial 5, stem 3; normalized to 0-100. */
    static double keywordScore(String lower, List<String> keywords) {
        if (keywords.isEmpty()) {
            return 0;
        }
        int score = 0;
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                score += 10;
            } else if (partialMatch(lower, keyword)) {
                score += 5;
            } else if (stemMatch(lower, keyword)) {
                score += 3;
            }
        }
        return score * 100.0 / (keywords.size() * 10);
    }

    /**
     * Some 70%-length slice of the keyword appears in the text. Slices shorter than four
     * characters are too unspecific and never match.
     */
    static boolean partialMatch(String lower, String keyword) {
        int window = (int) Math.floor(keyword.length() * 0.7);
        if (window < 4) {
            return false;
        }
        for (int i = 0; i + window <= keyword.length(); i++) {
            if (lower.contains(keyword.substring(i, i + window))) {
                return true;
            }
        }
        return false;
    }

    /** Keyword minus its last two characters, at least three, found at a word start. */
    static boolean stemMatch(String lower, String keyword) {
        String stem = keyword.substring(0, Math.min(keyword.length(), Math.max(3, keyword.length() - 2)));
        int from = 0;
        while (true) {
            int at = lower.indexOf(stem, from);
            if (at < 0) {
                return false;
            }
            if (at == 0 || !Character.isLetterOrDigit(lower.charAt(at - 1))) {
                return true;
            }
            from = at + 1;
        }
    }

    /** 100/|concepts| for each concept whose words are all present. */
    static double conceptScore(String lower, List<String> concepts) {
        double score = 0;
        for (String concept : concepts) {
            boolean all = true;
            for (String word : concept.split("_")) {
                if (!lower.contains(word)) {
                    all = false;
                    break;
                }
            }
            if (all) {
                score += 100.0 / concepts.size();
            }
        }
        return score;
    }

    /** 100/|useCases| for each use case with at least 60% of its words present. */
    static double useCaseScore(String lower, List<String> useCases) {
        double score = 0;
        for (String useCase : useCases) {
            String[] words = useCase.split("_");
            int present = 0;
            for (String word : words) {
                if (lower.contains(word)) {
                    present++;
                }
            }
            if (present >= words.length * 0.6) {
                score += 100.0 / useCases.size();
            }
        }
        return score;
    }

    private static String reasoning(String lower, Scored best) {
        List<String> matched = best.profile().keywords().stream().filter(lower::contains).toList();
        String percent = "%.1f%%".formatted(best.score());
        return matched.isEmpty()
            ? "Conceptual match based on use case similarity (" + percent + ")"
            : "Matched keywords: " + String.join(", ", matched) + " (" + percent + ")";
    }

    private static String summary(String text, MatchResult result) {
        String head = text.length() > 60 ? text.substring(0, 60) + "..." : text;
        return "\"" + head + "\" -> " + result.nodeType().shortName();
    }
}
