package dev.workflows.provider;

import dev.workflows.model.Node;
import dev.workflows.model.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Some generators repeat a node's code body at the node root next to {@code parameters}.
 * Moves those fields into {@code parameters}, keeping the longer body when both are present.
 */
public final class StrayCodeFieldPostProcessor implements ProviderPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(StrayCodeFieldPostProcessor.class);

    static final List<String> CODE_FIELDS = List.of("functionCode", "jsCode", "pythonCode", "expression");

    @Override
    public WorkflowDocument apply(WorkflowDocument document) {
        for (Node node : document.nodes()) {
            for (String field : CODE_FIELDS) {
                if (!node.attributes().containsKey(field)) {
                    continue;
                }
                Object stray = node.attributes().remove(field);
                Object existing = node.parameters().get(field);
                if (length(stray) > length(existing)) {
                    node.parameters().put(field, stray);
                    log.debug("Moved stray {} of '{}' into parameters", field, node.name());
                } else {
                    log.debug("Dropped stray {} of '{}', parameters already hold a longer body", field, node.name());
                }
            }
        }
        return document;
    }

    private static int length(Object value) {
        if (value == null) {
            return -1;
        }
        return value instanceof String s ? s.length() : String.valueOf(value).length();
    }
}
