package dev.workflows.engine;

import dev.workflows.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Catalog lookup: common names and use cases per node type, matched as whole words.
 * A common name scores 10, a use case 5, the category label 3; the highest score wins
 * and ties keep catalog order.
 */
public final class NodeCatalog {

    public record Entry(NodeType type, List<String> commonNames, List<String> useCases) {}

    public record CatalogMatch(NodeType type, int score) {}

    private record CompiledEntry(Entry entry, List<Pattern> names, List<Pattern> useCases, Pattern category) {}

    static final List<Entry> ENTRIES = List.of(
        entry(NodeType.WEBHOOK, names("webhook", "http trigger", "api trigger", "rest trigger"),
            uses("receive http requests", "api endpoint", "external triggers", "form submissions")),
        entry(NodeType.SCHEDULE_TRIGGER, names("schedule", "cron", "timer", "periodic", "daily", "hourly"),
            uses("scheduled tasks", "recurring jobs", "periodic checks", "maintenance tasks")),
        entry(NodeType.ERROR_TRIGGER, names("error trigger", "error handler", "exception handler"),
            uses("error handling", "failure notifications", "recovery workflows")),
        entry(NodeType.MANUAL_TRIGGER, names("manual", "test trigger", "debug trigger"),
            uses("testing", "manual execution", "debugging")),
        entry(NodeType.EMAIL_SEND, names("email", "send email", "mail", "notification email", "alert email"),
            uses("email notifications", "alerts", "reports", "confirmations")),
        entry(NodeType.SLACK, names("slack", "slack message", "slack notification", "slack alert"),
            uses("team notifications", "alerts", "status updates", "channel messages")),
        entry(NodeType.TELEGRAM, names("telegram", "telegram message", "telegram bot"),
            uses("instant messaging", "bot notifications", "personal alerts")),
        entry(NodeType.TWILIO, names("sms", "text message", "twilio", "phone", "call"),
            uses("sms notifications", "phone calls", "two-factor auth", "urgent alerts")),
        entry(NodeType.DISCORD, names("discord", "discord message", "discord notification"),
            uses("community notifications", "gaming alerts", "server updates")),
        entry(NodeType.FUNCTION, names("function", "code", "javascript", "custom logic", "process", "transform"),
            uses("data transformation", "custom logic", "calculations", "data validation")),
        entry(NodeType.CODE, names("code", "script", "execute", "python", "javascript"),
            uses("complex transformations", "api calls", "data processing", "custom operations")),
        entry(NodeType.SET, names("set", "set data", "modify", "update", "prepare data"),
            uses("data preparation", "field mapping", "data structuring", "format data")),
        entry(NodeType.MERGE, names("merge", "combine", "join", "union", "collect results"),
            uses("combine branches", "aggregate data", "collect results", "join parallel flows")),
        entry(NodeType.SPLIT_IN_BATCHES, names("split", "batch", "chunk", "paginate"),
            uses("batch processing", "large datasets", "api rate limits", "memory management")),
        entry(NodeType.IF, names("if", "condition", "check", "validate", "decision", "branch"),
            uses("conditional logic", "validation", "routing", "decision making")),
        entry(NodeType.SWITCH, names("switch", "router", "route", "multiple conditions", "case"),
            uses("multiple branches", "complex routing", "type-based routing", "multi-path workflows")),
        entry(NodeType.WAIT, names("wait", "delay", "pause", "sleep", "timeout"),
            uses("rate limiting", "scheduled delays", "webhook waiting", "async operations")),
        entry(NodeType.HTTP_REQUEST, names("http", "api", "rest", "request", "fetch", "call api", "web request"),
            uses("api calls", "webhooks", "rest apis", "data fetching", "external services")),
        entry(NodeType.RESPOND_TO_WEBHOOK, names("respond", "response", "webhook response", "return", "reply"),
            uses("api responses", "webhook replies", "http responses", "acknowledgments")),
        entry(NodeType.GRAPHQL, names("graphql", "gql", "query", "mutation"),
            uses("graphql apis", "complex queries", "data fetching", "api integration")),
        entry(NodeType.POSTGRES, names("postgres", "postgresql", "sql", "database", "db", "query"),
            uses("database queries", "data storage", "sql operations", "data retrieval")),
        entry(NodeType.MYSQL, names("mysql", "mariadb", "sql", "database"),
            uses("database queries", "data storage", "sql operations")),
        entry(NodeType.MONGO_DB, names("mongodb", "mongo", "nosql", "document db"),
            uses("nosql operations", "document storage", "json data", "flexible schemas")),
        entry(NodeType.REDIS, names("redis", "cache", "key-value", "memory db"),
            uses("caching", "session storage", "pub/sub", "rate limiting")),
        entry(NodeType.READ_BINARY_FILE, names("read file", "load file", "import file", "file input"),
            uses("file reading", "data import", "file processing", "csv reading")),
        entry(NodeType.WRITE_BINARY_FILE, names("write file", "save file", "export file", "file output"),
            uses("file writing", "data export", "report generation", "backup creation")),
        entry(NodeType.SPREADSHEET_FILE, names("excel", "spreadsheet", "xlsx", "csv"),
            uses("excel processing", "data import/export", "report generation")),
        entry(NodeType.GOOGLE_SHEETS, names("google sheets", "sheets", "spreadsheet", "google"),
            uses("spreadsheet operations", "data storage", "collaborative data", "reporting")),
        entry(NodeType.GOOGLE_DRIVE, names("google drive", "drive", "cloud storage", "file storage"),
            uses("file management", "cloud storage", "document sharing", "backup")),
        entry(NodeType.AWS, names("aws", "amazon", "s3", "lambda", "cloud"),
            uses("cloud operations", "s3 storage", "lambda functions", "aws services")),
        entry(NodeType.HTML, names("html", "template", "render", "generate html", "format"),
            uses("html generation", "email templates", "report formatting", "web content")),
        entry(NodeType.CRYPTO, names("crypto", "encrypt", "decrypt", "hash", "sign"),
            uses("encryption", "hashing", "digital signatures", "security operations")),
        entry(NodeType.DATE_TIME, names("date", "time", "datetime", "timestamp", "format date"),
            uses("date formatting", "time calculations", "scheduling", "timestamps")),
        entry(NodeType.GITHUB, names("github", "git", "repository", "pull request", "issue"),
            uses("repository management", "issue tracking", "ci/cd", "code operations")),
        entry(NodeType.GITLAB, names("gitlab", "git", "repository", "merge request"),
            uses("repository management", "ci/cd", "issue tracking", "code operations")),
        entry(NodeType.JIRA, names("jira", "issue", "ticket", "project management"),
            uses("issue tracking", "project management", "ticket creation", "workflow automation")),
        entry(NodeType.NOTION, names("notion", "notes", "wiki", "knowledge base"),
            uses("documentation", "knowledge management", "note taking", "database operations"))
    );

    private static final List<CompiledEntry> COMPILED = ENTRIES.stream()
        .map(e -> new CompiledEntry(e,
            e.commonNames().stream().map(NodeCatalog::word).toList(),
            e.useCases().stream().map(NodeCatalog::word).toList(),
            word(e.type().category().label())))
        .toList();

    private NodeCatalog() {}

    /** Best catalog entry for the text, or empty when nothing scores above zero. */
    public static Optional<CatalogMatch> bestMatch(String text) {
        List<CatalogMatch> ranked = rank(text);
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    /** Every entry with a positive score, best first; equal scores keep catalog order. */
    public static List<CatalogMatch> rank(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        var matches = new ArrayList<CatalogMatch>();
        for (CompiledEntry compiled : COMPILED) {
            int score = 0;
            for (Pattern name : compiled.names()) {
                if (name.matcher(lower).find()) {
                    score += 10;
                }
            }
            for (Pattern useCase : compiled.useCases()) {
                if (useCase.matcher(lower).find()) {
                    score += 5;
                }
            }
            if (compiled.category().matcher(lower).find()) {
                score += 3;
            }
            if (score > 0) {
                matches.add(new CatalogMatch(compiled.entry().type(), score));
            }
        }
        matches.sort((a, b) -> Integer.compare(b.score(), a.score()));
        return matches;
    }

    private static Pattern word(String phrase) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(phrase) + "(?![a-z0-9])");
    }

    private static Entry entry(NodeType type, List<String> names, List<String> useCases) {
        return new Entry(type, names, useCases);
    }

    private static List<String> names(String... names) {
        return List.of(names);
    }

    private static List<String> uses(String... useCases) {
        return List.of(useCases);
    }
}
