package dev.workflows.provider;

import dev.workflows.model.WorkflowDocument;

/**
 * Hook for quirks of the upstream text generator. Invoked once per build, after repair;
 * whatever it returns is the document handed back to the caller.
 */
@FunctionalInterface
public interface ProviderPostProcessor {

    WorkflowDocument apply(WorkflowDocument document);

    static ProviderPostProcessor identity() {
        return document -> document;
    }

    default ProviderPostProcessor andThen(ProviderPostProcessor next) {
        return document -> next.apply(apply(document));
    }
}
