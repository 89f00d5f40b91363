package dev.workflows.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed catalog of node types the platform accepts.
 * External type strings that match no entry or alias resolve to {@link #UNRECOGNIZED}.
 */
public enum NodeType {
    WEBHOOK("webhook", NodeCategory.TRIGGER),
    SCHEDULE_TRIGGER("scheduleTrigger", NodeCategory.TRIGGER),
    CRON("cron", NodeCategory.TRIGGER),
    ERROR_TRIGGER("errorTrigger", NodeCategory.TRIGGER),
    MANUAL_TRIGGER("manualTrigger", NodeCategory.TRIGGER),

    EMAIL_SEND("emailSend", NodeCategory.COMMUNICATION),
    SLACK("slack", NodeCategory.COMMUNICATION),
    TELEGRAM("telegram", NodeCategory.COMMUNICATION),
    TWILIO("twilio", NodeCategory.COMMUNICATION),
    DISCORD("discord", NodeCategory.COMMUNICATION),
    WHATSAPP_BUSINESS("whatsappBusiness", NodeCategory.COMMUNICATION),
    MQTT("mqtt", NodeCategory.COMMUNICATION),

    FUNCTION("function", NodeCategory.DATA),
    CODE("code", NodeCategory.DATA),
    SET("set", NodeCategory.DATA),
    MERGE("merge", NodeCategory.DATA),
    SPLIT_IN_BATCHES("splitInBatches", NodeCategory.DATA),

    IF("if", NodeCategory.FLOW),
    SWITCH("switch", NodeCategory.FLOW),
    WAIT("wait", NodeCategory.FLOW),
    NO_OP("noOp", NodeCategory.FLOW),

    HTTP_REQUEST("httpRequest", NodeCategory.HTTP),
    RESPOND_TO_WEBHOOK("respondToWebhook", NodeCategory.HTTP),
    GRAPHQL("graphql", NodeCategory.HTTP),

    POSTGRES("postgres", NodeCategory.DATABASE),
    MYSQL("mysql", NodeCategory.DATABASE),
    MONGO_DB("mongoDb", NodeCategory.DATABASE),
    REDIS("redis", NodeCategory.DATABASE),

    READ_BINARY_FILE("readBinaryFile", NodeCategory.FILES),
    WRITE_BINARY_FILE("writeBinaryFile", NodeCategory.FILES),
    SPREADSHEET_FILE("spreadsheetFile", NodeCategory.FILES),

    GOOGLE_SHEETS("googleSheets", NodeCategory.CLOUD),
    GOOGLE_DRIVE("googleDrive", NodeCategory.CLOUD),
    AWS("aws", NodeCategory.CLOUD),

    HTML("html", NodeCategory.UTILITY),
    CRYPTO("crypto", NodeCategory.UTILITY),
    DATE_TIME("dateTime", NodeCategory.UTILITY),
    EXECUTE_COMMAND("executeCommand", NodeCategory.UTILITY),

    GITHUB("github", NodeCategory.INTEGRATION),
    GITLAB("gitlab", NodeCategory.INTEGRATION),
    JIRA("jira", NodeCategory.INTEGRATION),
    NOTION("notion", NodeCategory.INTEGRATION),
    AIRTABLE("airtable", NodeCategory.INTEGRATION),

    UNRECOGNIZED("", NodeCategory.UNRECOGNIZED);

    public static final String TAG_PREFIX = "n8n-nodes-base.";

    private static final Map<String, NodeType> BY_TAG = new HashMap<>();
    private static final Map<String, NodeType> BY_SHORT_NAME = new HashMap<>();
    private static final Map<String, NodeType> ALIASES = new HashMap<>();

    static {
        for (NodeType type : values()) {
            if (type != UNRECOGNIZED) {
                BY_TAG.put(type.tag(), type);
                BY_SHORT_NAME.put(type.shortName.toLowerCase(Locale.ROOT), type);
            }
        }
        alias(EMAIL_SEND, "sendEmail", "emailSendSmtp", "email");
        alias(FUNCTION, "functionItem");
        alias(ERROR_TRIGGER, "errorWorkflow", "error");
        alias(MERGE, "join");
        alias(HTTP_REQUEST, "raspberryPi", "gpio", "iot");
        alias(EXECUTE_COMMAND, "exec");
        alias(WEBHOOK, "discordTrigger", "discordWebhook", "slackTrigger");
        ALIASES.put("n8n-nodes-raspberry.raspberrypi", HTTP_REQUEST);
    }

    private static void alias(NodeType target, String... shortNames) {
        for (String name : shortNames) {
            ALIASES.put(name.toLowerCase(Locale.ROOT), target);
            ALIASES.put((TAG_PREFIX + name).toLowerCase(Locale.ROOT), target);
        }
    }

    private final String shortName;
    private final NodeCategory category;

    NodeType(String shortName, NodeCategory category) {
        this.shortName = shortName;
        this.category = category;
    }

    /** Full platform tag, e.g. {@code n8n-nodes-base.emailSend}. Empty for {@link #UNRECOGNIZED}. */
    public String tag() {
        return this == UNRECOGNIZED ? "" : TAG_PREFIX + shortName;
    }

    public String shortName() {
        return shortName;
    }

    public NodeCategory category() {
        return category;
    }

    public boolean isTrigger() {
        return category == NodeCategory.TRIGGER;
    }

    /**
     * Resolve an external type string: exact tag, then alias, then bare short name
     * (case-insensitive). Never returns null.
     */
    public static NodeType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNRECOGNIZED;
        }
        String trimmed = tag.trim();
        NodeType exact = BY_TAG.get(trimmed);
        if (exact != null) {
            return exact;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        NodeType aliased = ALIASES.get(lower);
        if (aliased != null) {
            return aliased;
        }
        String shortName = lower.startsWith(TAG_PREFIX.toLowerCase(Locale.ROOT))
            ? lower.substring(TAG_PREFIX.length())
            : lower;
        if (shortName.contains(".")) {
            return UNRECOGNIZED;
        }
        return BY_SHORT_NAME.getOrDefault(shortName, UNRECOGNIZED);
    }
}
