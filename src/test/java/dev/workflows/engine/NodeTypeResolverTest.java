package dev.workflows.engine;

import dev.workflows.model.*;
import dev.workflows.model.MatchResult.Strategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NodeTypeResolverTest {

    @Test
    void resolvesIotPhrasingThroughSemanticProfile() {
        MatchResult result = NodeTypeResolver.resolve(
            "Publish real time sensor telemetry to the MQTT broker topic for IoT device monitoring");

        assertThat(result.nodeType()).isEqualTo(NodeType.MQTT);
        assertThat(result.strategy()).isEqualTo(Strategy.SEMANTIC);
        assertThat(result.confidence()).isGreaterThanOrEqualTo(NodeTypeResolver.ACCEPT_THRESHOLD);
        assertThat(result.reasoning()).startsWith("Matched keywords: mqtt");
        assertThat(result.alternatives()).hasSizeLessThanOrEqualTo(3).doesNotContain(NodeType.MQTT);
    }

    @Test
    void fallsBackToCatalogBelowSemanticThreshold() {
        MatchResult result = NodeTypeResolver.resolve("Send email report to managers");

        assertThat(result.nodeType()).isEqualTo(NodeType.EMAIL_SEND);
        assertThat(result.strategy()).isEqualTo(Strategy.CATALOG);
        assertThat(result.confidence()).isEqualTo(NodeTypeResolver.CATALOG_CONFIDENCE);
    }

    @Test
    void catalogMatchesWholeWordsOnly() {
        MatchResult result = NodeTypeResolver.resolve("Payment Router");

        assertThat(result.nodeType()).isEqualTo(NodeType.SWITCH);
        assertThat(result.strategy()).isEqualTo(Strategy.CATALOG);
    }

    @Test
    void appliesCollectionOverrideWhenNothingElseMatches() {
        MatchResult result = NodeTypeResolver.resolve("Collects all results");

        assertThat(result.nodeType()).isEqualTo(NodeType.MERGE);
        assertThat(result.strategy()).isEqualTo(Strategy.OVERRIDE);
        assertThat(result.confidence()).isEqualTo(NodeTypeResolver.OVERRIDE_CONFIDENCE);
    }

    @Test
    void defaultsToGenericFunctionForUnknownText() {
        MatchResult result = NodeTypeResolver.resolve("qqqq zzzz");

        assertThat(result.nodeType()).isEqualTo(NodeTypeResolver.DEFAULT_TYPE);
        assertThat(result.strategy()).isEqualTo(Strategy.DEFAULT);
        assertThat(result.confidence()).isEqualTo(NodeTypeResolver.DEFAULT_CONFIDENCE);
        assertThat(result.isAmbiguous()).isTrue();
    }

    @Test
    void isTotalOverEmptyNullAndOversizedInput() {
        assertThat(NodeTypeResolver.resolve("").strategy()).isEqualTo(Strategy.DEFAULT);
        assertThat(NodeTypeResolver.resolve(null).nodeType()).isEqualTo(NodeType.FUNCTION);

        MatchResult large = NodeTypeResolver.resolve("send email ".repeat(5_000));
        assertThat(large.confidence()).isBetween(0.0, 1.0);
    }

    @Test
    void isDeterministic() {
        String text = "Fetch customer records from the REST API";

        MatchResult first = NodeTypeResolver.resolve(text);
        MatchResult second = NodeTypeResolver.resolve(text);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void recordsResolutionInTrace() {
        var trace = new DecisionTrace();

        NodeTypeResolver.resolve("qqqq zzzz", trace);

        assertThat(trace.contains(NodeTypeResolver.STAGE, "default")).isTrue();
        assertThat(trace.decisions().get(0).confidence()).isEqualTo(NodeTypeResolver.DEFAULT_CONFIDENCE);
    }

    @Test
    void partialMatchesNeedFourCharacterSlices() {
        assertThat(NodeTypeResolver.partialMatch("the telemetr feed", "telemetry")).isTrue();
        assertThat(NodeTypeResolver.partialMatch("iox", "iot")).isFalse();
    }

    @Test
    void stemMatchesOnlyAtWordStart() {
        assertThat(NodeTypeResolver.stemMatch("calculating totals", "calculate")).isTrue();
        assertThat(NodeTypeResolver.stemMatch("recalculating totals", "calculate")).isFalse();
    }
}
