package dev.workflows.engine;

import dev.workflows.model.Node;
import dev.workflows.model.NodeType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-type parameter registry: required keys, documented defaults, keys that must hold
 * lists, and key aliases a text generator tends to use instead of the real key.
 */
public final class NodeParameters {

    /**
     * Parameter rules for one node type.
     *
     * @param defaults documented defaults; required keys without one get a blank placeholder
     * @param aliases  alias key to canonical key
     */
    public record ParameterSpec(
        List<String> required,
        Map<String, Object> defaults,
        Set<String> listKeys,
        Map<String, String> aliases
    ) {
        static final ParameterSpec NONE = new ParameterSpec(List.of(), Map.of(), Set.of(), Map.of());
    }

    private static final Map<NodeType, ParameterSpec> SPECS = new EnumMap<>(NodeType.class);

    static {
        spec(NodeType.WEBHOOK, List.of("path", "httpMethod", "options"),
            Map.of("httpMethod", "POST", "options", Map.of()));
        spec(NodeType.SCHEDULE_TRIGGER, List.of("rule"),
            Map.of("rule", Map.of("interval", List.of(Map.of("field", "hours", "hoursInterval", 1)))));
        spec(NodeType.CRON, List.of("triggerTimes"),
            Map.of("triggerTimes", Map.of("item", List.of(Map.of("mode", "everyMinute")))));
        SPECS.put(NodeType.EMAIL_SEND, new ParameterSpec(
            List.of("toRecipients", "subject", "text", "options"),
            Map.of("options", Map.of()),
            Set.of("toRecipients"),
            Map.of("toEmail", "toRecipients", "sendTo", "toRecipients")));
        SPECS.put(NodeType.HTTP_REQUEST, new ParameterSpec(
            List.of("url", "method", "options"),
            Map.of("method", "GET", "options", Map.of()),
            Set.of(),
            Map.of("endpoint", "url")));
        SPECS.put(NodeType.SWITCH, new ParameterSpec(
            List.of("dataType", "value1", "rules", "fallbackOutput"),
            Map.of("dataType", "string", "value1", "={{$json}}", "fallbackOutput", 0),
            Set.of(),
            Map.of("value", "value1")));
        spec(NodeType.IF, List.of("conditions"), Map.of("conditions", Map.of("boolean", List.of())));
        spec(NodeType.FUNCTION, List.of("functionCode"),
            Map.of("functionCode", "// Your code here\nreturn items;"));
        spec(NodeType.CODE, List.of("jsCode"), Map.of("jsCode", "// Your code here\nreturn $input.all();"));
        spec(NodeType.SPLIT_IN_BATCHES, List.of("batchSize", "options"),
            Map.of("batchSize", 10, "options", Map.of()));
        spec(NodeType.MQTT, List.of("broker", "topic", "options"),
            Map.of("broker", "mqtt://localhost:1883", "topic", "n8n/default",
                "options", Map.of("qos", 1, "retain", false)));
        spec(NodeType.TWILIO, List.of("operation", "from", "to", "message"),
            Map.of("operation", "sms", "from", "={{$credentials.fromNumber}}"));
        spec(NodeType.WHATSAPP_BUSINESS, List.of("phoneNumberId", "to", "messageType", "text"),
            Map.of("messageType", "text"));
        spec(NodeType.SLACK, List.of("channel", "text"), Map.of());
        spec(NodeType.TELEGRAM, List.of("chatId", "text"), Map.of());
        spec(NodeType.SET, List.of("values", "options"),
            Map.of("values", Map.of("string", List.of()), "options", Map.of()));
        spec(NodeType.MERGE, List.of("mode", "options"), Map.of("mode", "append", "options", Map.of()));
        spec(NodeType.POSTGRES, List.of("operation", "query"), Map.of("operation", "executeQuery"));
        spec(NodeType.MYSQL, List.of("operation", "query"), Map.of("operation", "executeQuery"));
        spec(NodeType.EXECUTE_COMMAND, List.of("command"), Map.of());
        spec(NodeType.WAIT, List.of("amount", "unit"), Map.of("amount", 1, "unit", "seconds"));
        spec(NodeType.RESPOND_TO_WEBHOOK, List.of("options"), Map.of("options", Map.of()));
        spec(NodeType.ERROR_TRIGGER, List.of(), Map.of());
        spec(NodeType.MANUAL_TRIGGER, List.of(), Map.of());
    }

    private static void spec(NodeType type, List<String> required, Map<String, Object> defaults) {
        SPECS.put(type, new ParameterSpec(required, defaults, Set.of(), Map.of()));
    }

    private NodeParameters() {}

    public static ParameterSpec spec(NodeType type) {
        return SPECS.getOrDefault(type, ParameterSpec.NONE);
    }

    public static List<String> requiredKeys(NodeType type) {
        return spec(type).required();
    }

    /** The documented default for {@code key}, deep-copied so callers may mutate it. */
    public static Optional<Object> documentedDefault(NodeType type, String key) {
        Object value = spec(type).defaults().get(key);
        return value == null ? Optional.empty() : Optional.of(mutableCopy(value));
    }

    /**
     * Bring a node's parameters into shape: resolve aliases, fix known malformed shapes,
     * then fill every absent required key. A value already present always wins.
     *
     * @return one entry per change made, for tracing
     */
    public static List<String> complete(Node node) {
        var changes = new ArrayList<String>();
        ParameterSpec spec = spec(node.type());
        Map<String, Object> params = node.parameters();

        for (var alias : spec.aliases().entrySet()) {
            String from = alias.getKey();
            String to = alias.getValue();
            if (params.containsKey(from) && isMissing(params.get(to))) {
                params.put(to, params.remove(from));
                changes.add("renamed " + from + " to " + to);
            }
        }

        fixShapes(node, changes);

        for (String key : spec.listKeys()) {
            Object value = params.get(key);
            if (value != null && !(value instanceof List<?>)) {
                params.put(key, asList(value));
                changes.add("wrapped " + key + " as list");
            }
        }

        for (String key : spec.required()) {
            if (params.containsKey(key) && params.get(key) != null) {
                continue;
            }
            Object filler = documentedDefault(node.type(), key)
                .orElseGet(() -> spec.listKeys().contains(key) ? new ArrayList<>() : "");
            params.put(key, filler);
            changes.add("filled " + key);
        }
        return changes;
    }

    /** Required keys whose value is absent, null, a blank string or an empty list. */
    public static List<String> missingRequired(Node node) {
        var missing = new ArrayList<String>();
        for (String key : spec(node.type()).required()) {
            if (isMissing(node.parameters().get(key))) {
                missing.add(key);
            }
        }
        return missing;
    }

    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        return false;
    }

    /**
     * Starter values for a node synthesized from prose, where no draft parameters exist.
     * Expression placeholders point at the incoming item so the node is usable as placed.
     */
    static Map<String, Object> starterParameters(NodeType type, String nodeName) {
        var params = new LinkedHashMap<String, Object>();
        switch (type) {
            case WEBHOOK -> {
                params.put("path", slug(nodeName));
                params.put("httpMethod", "POST");
                params.put("authentication", "none");
                params.put("options", new LinkedHashMap<>());
            }
            case FUNCTION -> params.put("functionCode", CodeTemplates.forNode(nodeName));
            case CODE -> params.put("jsCode", CodeTemplates.forNode(nodeName));
            case EMAIL_SEND -> {
                params.put("toRecipients", new ArrayList<>(List.of("={{$json.email}}")));
                params.put("subject", nodeName);
                params.put("text", "={{$json.message}}");
            }
            case TWILIO -> {
                params.put("to", "={{$json.phone}}");
                params.put("message", "={{$json.message}}");
            }
            case WHATSAPP_BUSINESS -> {
                params.put("to", "={{$json.phone}}");
                params.put("text", "={{$json.message}}");
            }
            case SLACK, TELEGRAM -> params.put("text", "={{$json.message}}");
            case POSTGRES, MYSQL -> params.put("query", "SELECT * FROM table_name WHERE id = {{$json.id}}");
            case HTTP_REQUEST -> params.put("url", "https://api.example.com/endpoint");
            case IF -> params.put("conditions", new LinkedHashMap<>(Map.of("boolean",
                new ArrayList<>(List.of(new LinkedHashMap<>(Map.of("value1", "={{$json.value}}", "value2", true)))))));
            default -> { }
        }
        return params;
    }

    private static void fixShapes(Node node, List<String> changes) {
        Map<String, Object> params = node.parameters();
        if (node.type() == NodeType.SWITCH && params.get("rules") instanceof List<?> rules) {
            var wrapped = new LinkedHashMap<String, Object>();
            wrapped.put("rules", new ArrayList<>(rules));
            params.put("rules", wrapped);
            changes.add("wrapped rules array");
        }
        if (node.type() == NodeType.SET && params.get("values") instanceof Map<?, ?> values
                && !values.containsKey("string") && !values.containsKey("number")
                && !values.containsKey("boolean") && !values.containsKey("json")) {
            var entries = new ArrayList<Object>();
            for (Map.Entry<?, ?> value : values.entrySet()) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("name", String.valueOf(value.getKey()));
                entry.put("value", String.valueOf(value.getValue()));
                entries.add(entry);
            }
            var typed = new LinkedHashMap<String, Object>();
            typed.put("string", entries);
            params.put("values", typed);
            changes.add("converted values object to string entries");
        }
    }

    private static List<Object> asList(Object value) {
        var list = new ArrayList<Object>();
        if (value instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    list.add(part.trim());
                }
            }
        } else {
            list.add(value);
        }
        return list;
    }

    static Object mutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), mutableCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>();
            list.forEach(item -> copy.add(mutableCopy(item)));
            return copy;
        }
        return value;
    }

    static String slug(String name) {
        String slug = name.toLowerCase(java.util.Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "webhook" : slug;
    }
}
