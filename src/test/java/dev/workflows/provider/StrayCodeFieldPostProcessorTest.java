package dev.workflows.provider;

import dev.workflows.model.*;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StrayCodeFieldPostProcessorTest {

    private static WorkflowDocument withCode(Map<String, Object> parameters, String strayField, Object strayValue) {
        var document = WorkflowDocument.create("Code");
        var node = new Node("1", "Compute", NodeType.CODE, new Position(0, 0), parameters);
        node.attributes().put(strayField, strayValue);
        document.addNode(node);
        return document;
    }

    @Test
    void movesLongerStrayBodyIntoParameters() {
        WorkflowDocument document = withCode(Map.of("jsCode", "return [];"),
            "jsCode", "const rows = $input.all();\nreturn rows.filter(r => r.json.active);");

        new StrayCodeFieldPostProcessor().apply(document);

        Node node = document.nodes().get(0);
        assertThat(node.attributes()).doesNotContainKey("jsCode");
        assertThat((String) node.parameters().get("jsCode")).startsWith("const rows");
    }

    @Test
    void keepsLongerParameterBody() {
        WorkflowDocument document = withCode(Map.of("jsCode", "return $input.all().map(i => i.json);"),
            "jsCode", "return [];");

        new StrayCodeFieldPostProcessor().apply(document);

        Node node = document.nodes().get(0);
        assertThat(node.attributes()).isEmpty();
        assertThat(node.parameters()).containsEntry("jsCode", "return $input.all().map(i => i.json);");
    }

    @Test
    void fillsAbsentParameterFromStrayField() {
        WorkflowDocument document = withCode(Map.of(), "pythonCode", "return items");

        new StrayCodeFieldPostProcessor().apply(document);

        assertThat(document.nodes().get(0).parameters()).containsEntry("pythonCode", "return items");
    }

    @Test
    void leavesOtherAttributesAlone() {
        WorkflowDocument document = withCode(Map.of(), "notes", "hand written");

        new StrayCodeFieldPostProcessor().apply(document);

        assertThat(document.nodes().get(0).attributes()).containsEntry("notes", "hand written");
    }

    @Test
    void chainsWithOtherPostProcessors() {
        ProviderPostProcessor chain = new StrayCodeFieldPostProcessor().andThen(document -> {
            document.rename("Chained");
            return document;
        });

        WorkflowDocument result = chain.apply(withCode(Map.of(), "expression", "={{ 1 + 1 }}"));

        assertThat(result.name()).isEqualTo("Chained");
        assertThat(result.nodes().get(0).parameters()).containsKey("expression");
    }
}
