package dev.workflows.engine;

import dev.workflows.engine.MotifAnalyzer.Motif;
import dev.workflows.engine.MotifAnalyzer.Subject;
import dev.workflows.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MotifAnalyzerTest {

    private static Subject subject(String name, String description, NodeType type, String... context) {
        return new Subject(name, description, List.of(context), type);
    }

    @Test
    void detectsSwitchByNameAndReadsInlineConditions() {
        var motifs = MotifAnalyzer.analyze(subject("Shipping Router", "Shipping Router (DHL, UPS, and FedEx)",
            NodeType.FUNCTION));

        assertThat(motifs.has(Motif.SWITCH)).isTrue();
        assertThat(motifs.firedRules()).contains("switch-name");
        assertThat(motifs.conditions()).containsExactly("DHL", "UPS", "FedEx");
    }

    @Test
    void conditionDescriptionDoesNotMakeAnIfNodeASwitch() {
        var motifs = MotifAnalyzer.analyze(subject("Check Stock", "Check Stock (condition: quantity > 0)",
            NodeType.IF));

        assertThat(motifs.has(Motif.SWITCH)).isFalse();
        assertThat(motifs.conditions()).isEmpty();
    }

    @Test
    void detectsMergeByName() {
        var motifs = MotifAnalyzer.analyze(subject("Combine Quotes", "Combine Quotes", NodeType.FUNCTION));

        assertThat(motifs.has(Motif.MERGE)).isTrue();
        assertThat(motifs.has(Motif.SWITCH)).isFalse();
    }

    @Test
    void detectsParallelMarkerInContext() {
        var motifs = MotifAnalyzer.analyze(subject("Fan Out", "Fan Out", NodeType.FUNCTION,
            "3. Fan Out", "   - Run the following simultaneously"));

        assertThat(motifs.has(Motif.PARALLEL)).isTrue();
    }

    @Test
    void findsSingleNamedAlternative() {
        assertThat(MotifAnalyzer.alternativeOf("Charge via Stripe", ""))
            .contains(new MotifAnalyzer.Alternative("payment", "Stripe"));
        assertThat(MotifAnalyzer.alternativeOf("Send Update", "Post to the Slack channel"))
            .contains(new MotifAnalyzer.Alternative("notification", "Slack"));
    }

    @Test
    void textNamingSeveralAlternativesIsNotOne() {
        assertThat(MotifAnalyzer.alternativeOf("Notify by Email and SMS", "")).isEmpty();
        assertThat(MotifAnalyzer.alternativeOf("Scale ups and downs", "")).isEmpty();
    }

    @Test
    void listsMentionedGroupMembersInGroupOrder() {
        assertThat(MotifAnalyzer.alternativesMentioned("Ship with FedEx or DHL", "shipping"))
            .containsExactly("DHL", "FedEx");
    }
}
