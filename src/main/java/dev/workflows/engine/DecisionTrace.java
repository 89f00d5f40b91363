package dev.workflows.engine;

import dev.workflows.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run record of heuristic decisions. Each decision is also logged at debug level;
 * callers and tests read the recorded data, never the log text.
 */
public class DecisionTrace {

    private static final Logger log = LoggerFactory.getLogger(DecisionTrace.class);

    private final List<Decision> decisions = new ArrayList<>();

    public void record(String stage, String rule, String detail) {
        add(Decision.of(stage, rule, detail));
    }

    public void record(String stage, String rule, String detail, double confidence) {
        add(new Decision(stage, rule, detail, confidence));
    }

    protected void add(Decision decision) {
        log.debug("{}", decision);
        decisions.add(decision);
    }

    public List<Decision> decisions() {
        return Collections.unmodifiableList(decisions);
    }

    /** Decisions recorded by one stage, in order. */
    public List<Decision> forStage(String stage) {
        return decisions.stream().filter(d -> d.stage().equals(stage)).toList();
    }

    public boolean contains(String stage, String rule) {
        return decisions.stream().anyMatch(d -> d.stage().equals(stage) && d.rule().equals(rule));
    }

    /** A trace that logs but keeps nothing, for callers that do not care. */
    public static DecisionTrace discarding() {
        return new DecisionTrace() {
            @Override
            protected void add(Decision decision) {
                log.debug("{}", decision);
            }
        };
    }
}
