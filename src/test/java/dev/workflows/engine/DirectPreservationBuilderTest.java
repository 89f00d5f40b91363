package dev.workflows.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflows.model.*;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectPreservationBuilderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String LEAD_DRAFT = """
        {
          "name": "Lead Intake",
          "tags": ["sales"],
          "nodes": [
            {"id": "a1", "name": "Incoming Lead", "type": "n8n-nodes-base.webhook", "parameters": {"path": "lead"}},
            {"name": "Notify Sales", "type": "n8n-nodes-base.emailSend", "typeVersion": 2.1,
             "parameters": {"toEmail": "sales@example.com, ops@example.com", "subject": "New lead"}},
            {"id": "a3", "name": "Incoming Lead", "type": "n8n-nodes-base.noOp", "position": {"x": 900, "y": 40},
             "credentials": {"smtp": {"id": "7"}}}
          ],
          "connections": {
            "a1": {"main": [{"node": "Notify Sales", "type": "main", "index": 0}]},
            "Notify Sales": ["a3"]
          }
        }
        """;

    private static WorkflowDocument build(String json, DecisionTrace trace) throws IOException {
        return DirectPreservationBuilder.build(MAPPER.readTree(json), Layout.defaults(), trace);
    }

    @Test
    void keepsDraftValuesAndFillsGaps() throws IOException {
        WorkflowDocument document = build(LEAD_DRAFT, new DecisionTrace());

        assertThat(document.name()).isEqualTo("Lead Intake");
        assertThat(document.tags()).containsExactly("sales");
        assertThat(document.nodes()).extracting(Node::name)
            .containsExactly("Incoming Lead", "Notify Sales", "Incoming Lead 2");
        assertThat(document.nodes()).extracting(Node::id).containsExactly("a1", "node-2", "a3");
        assertThat(document.nodes()).extracting(Node::position).containsExactly(
            new Position(250, 300), new Position(450, 300), new Position(900, 40));
        assertThat(document.nodes()).extracting(Node::typeVersion).containsExactly(1.0, 2.1, 1.0);
    }

    @Test
    void completesWebhookParametersAndIdentifier() throws IOException {
        Node webhook = build(LEAD_DRAFT, new DecisionTrace()).node("Incoming Lead").orElseThrow();

        assertThat(webhook.parameters())
            .containsEntry("path", "lead")
            .containsEntry("httpMethod", "POST")
            .containsKey("options");
        assertThat(webhook.attributes()).containsKey("webhookId");
    }

    @Test
    void correctsEmailRecipientAlias() throws IOException {
        Node email = build(LEAD_DRAFT, new DecisionTrace()).node("Notify Sales").orElseThrow();

        assertThat(email.parameters())
            .doesNotContainKey("toEmail")
            .containsEntry("toRecipients", List.of("sales@example.com", "ops@example.com"))
            .containsEntry("subject", "New lead");
    }

    @Test
    void remapsConnectionsKeyedById() throws IOException {
        var trace = new DecisionTrace();
        WorkflowDocument document = build(LEAD_DRAFT, trace);

        assertThat(document.connections().sources()).containsExactly("Incoming Lead", "Notify Sales");
        assertThat(document.connections().edgesFrom("Incoming Lead")).containsExactly(Edge.to("Notify Sales"));
        assertThat(document.connections().edgesFrom("Notify Sales")).containsExactly(Edge.to("Incoming Lead 2"));
        assertThat(trace.forStage(DirectPreservationBuilder.STAGE)).extracting(Decision::rule)
            .contains("id-remapped", "id-assigned", "position-assigned", "renamed-duplicate");
    }

    @Test
    void keepsNonCoreFieldsAsAttributes() throws IOException {
        Node noOp = build(LEAD_DRAFT, new DecisionTrace()).node("Incoming Lead 2").orElseThrow();

        assertThat(noOp.attributes()).containsEntry("credentials", Map.of("smtp", Map.of("id", "7")));
    }

    @Test
    void keepsUnrecognizedTypeTag() throws IOException {
        var trace = new DecisionTrace();
        WorkflowDocument document = build("""
            {"nodes": [{"name": "Custom", "type": "acme.fancyNode", "parameters": {"level": 3}}]}
            """, trace);

        Node custom = document.nodes().get(0);
        assertThat(custom.type()).isEqualTo(NodeType.UNRECOGNIZED);
        assertThat(custom.typeTag()).isEqualTo("acme.fancyNode");
        assertThat(custom.parameters()).containsEntry("level", 3);
        assertThat(trace.contains(DirectPreservationBuilder.STAGE, "unrecognized-type")).isTrue();
    }

    @Test
    void resolvesMissingTypeFromName() throws IOException {
        var trace = new DecisionTrace();
        WorkflowDocument document = build("""
            {"nodes": [{"name": "Send email report to managers"}]}
            """, trace);

        assertThat(document.nodes().get(0).type()).isEqualTo(NodeType.EMAIL_SEND);
        assertThat(trace.contains(DirectPreservationBuilder.STAGE, "type-resolved")).isTrue();
    }

    @Test
    void acceptsConnectionsWithoutNodes() throws IOException {
        WorkflowDocument document = build("""
            {"connections": {"A": ["B"]}}
            """, new DecisionTrace());

        assertThat(document.nodes()).isEmpty();
        assertThat(document.connections().edgesFrom("A")).containsExactly(Edge.to("B"));
    }

    @Test
    void dropsEdgesIntoTriggers() throws IOException {
        var trace = new DecisionTrace();
        WorkflowDocument document = build("""
            {
              "nodes": [
                {"id": "s", "name": "Start", "type": "n8n-nodes-base.manualTrigger", "position": [250, 300]},
                {"name": "Work", "type": "n8n-nodes-base.function", "position": [450, 300],
                 "parameters": {"functionCode": "return items;"}}
              ],
              "connections": {
                "Start": {"main": [[{"node": "Work", "type": "main", "index": 0}]]},
                "Work": {"main": [[{"node": "s", "type": "main", "index": 0}]]}
              }
            }
            """, trace);

        assertThat(document.connections().targets()).containsExactly("Work");
        assertThat(document.connections().edgesFrom("Work")).isEmpty();
        assertThat(trace.forStage(DirectPreservationBuilder.STAGE)).extracting(Decision::detail)
            .contains("Work -> Start");
        assertThat(trace.contains(DirectPreservationBuilder.STAGE, "dropped-trigger-target")).isTrue();
        assertThat(WorkflowValidator.validate(document).isValid()).isTrue();
    }

    @Test
    void rejectsDraftWithoutNodesOrConnections() throws IOException {
        JsonNode shapeless = MAPPER.readTree("""
            {"name": "Nothing here"}
            """);

        assertThatThrownBy(() -> DirectPreservationBuilder.build(shapeless, Layout.defaults()))
            .isInstanceOf(StructuralException.class);
        assertThatThrownBy(() -> DirectPreservationBuilder.build(MAPPER.readTree("[]"), Layout.defaults()))
            .isInstanceOf(StructuralException.class);
    }

    @Test
    void readsBothPositionShapes() throws IOException {
        assertThat(DirectPreservationBuilder.position(MAPPER.readTree("[10, 20]"))).isEqualTo(new Position(10, 20));
        assertThat(DirectPreservationBuilder.position(MAPPER.readTree("{\"x\": 5, \"y\": 6}")))
            .isEqualTo(new Position(5, 6));
        assertThat(DirectPreservationBuilder.position(MAPPER.readTree("\"left\""))).isNull();
    }
}
