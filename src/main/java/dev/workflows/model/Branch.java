package dev.workflows.model;

import java.util.List;

/**
 * An ordered run of requirements sharing one trigger.
 */
public record Branch(String id, String name, TriggerKind trigger, List<Requirement> requirements) {

    public Branch {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}
