package dev.workflows.engine;

import java.util.List;
import java.util.Locale;

/**
 * Starter code bodies for function and code nodes, picked by keywords in the node name.
 */
public final class CodeTemplates {

    private record Template(List<String> keywords, String body) {}

    private static final List<Template> TEMPLATES = List.of(
        new Template(List.of("validate", "verify", "check"), """
            // Validation logic for %1$s
            const requiredFields = ['field1', 'field2'];
            const item = items[0];

            for (const field of requiredFields) {
              if (!item.json[field]) {
                throw new Error(`Missing required field: ${field}`);
              }
            }

            return items;"""),
        new Template(List.of("transform", "process", "format", "enrich"), """
            // Transform data for %1$s
            return items.map(item => {
              return {
                json: {
                  ...item.json,
                  processed: true,
                  timestamp: new Date().toISOString()
                }
              };
            });"""),
        new Template(List.of("filter"), """
            // Filter logic for %1$s
            return items.filter(item => {
              return item.json.status === 'active';
            });"""),
        new Template(List.of("analyze", "analyse", "score", "calculate"), """
            // Analysis logic for %1$s
            const results = items.map(item => {
              return {
                ...item.json,
                analysis: {}
              };
            });

            return [{
              json: {
                results,
                summary: {
                  total: results.length,
                  timestamp: new Date().toISOString()
                }
              }
            }];""")
    );

    private static final String DEFAULT_BODY = """
        // %1$s logic

        return items;""";

    private CodeTemplates() {}

    public static String forNode(String nodeName) {
        String name = nodeName == null ? "" : nodeName;
        String lower = name.toLowerCase(Locale.ROOT);
        for (Template template : TEMPLATES) {
            for (String keyword : template.keywords()) {
                if (lower.contains(keyword)) {
                    return template.body().formatted(name);
                }
            }
        }
        return DEFAULT_BODY.formatted(name);
    }
}
