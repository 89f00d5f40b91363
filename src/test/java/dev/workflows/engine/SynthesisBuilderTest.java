package dev.workflows.engine;

import dev.workflows.model.*;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesisBuilderTest {

    private static Requirement req(String name, NodeType type) {
        return new Requirement(name, name, declared(type), "1", false, false, false, List.of());
    }

    private static Requirement router(String name, List<String> conditions) {
        return new Requirement(name, name, declared(NodeType.SWITCH), "1", false, true, false, conditions);
    }

    private static MatchResult declared(NodeType type) {
        return new MatchResult(type, 1.0, "test", List.of(), MatchResult.Strategy.DECLARED);
    }

    private static RequirementTree tree(TriggerKind trigger, boolean errorHandling, Requirement... requirements) {
        var branch = new Branch("1", "Order Intake", trigger, List.of(requirements));
        return new RequirementTree("Orders", List.of(branch), null, errorHandling);
    }

    private static WorkflowDocument paymentWorkflow() {
        return SynthesisBuilder.build(tree(TriggerKind.WEBHOOK, false,
            req("Validate Order", NodeType.FUNCTION),
            router("Payment Router", List.of("Stripe", "PayPal")),
            req("Process Stripe Payment", NodeType.FUNCTION),
            req("Process PayPal Payment", NodeType.FUNCTION),
            req("Save Order", NodeType.POSTGRES)), Layout.defaults());
    }

    @Test
    void buildsSequentialWebhookBranchWithResponse() {
        WorkflowDocument document = SynthesisBuilder.build(tree(TriggerKind.WEBHOOK, false,
            req("Fetch Customer", NodeType.HTTP_REQUEST),
            req("Shape Payload", NodeType.FUNCTION)), Layout.defaults());

        assertThat(document.name()).isEqualTo("Orders");
        assertThat(document.nodes()).extracting(Node::name)
            .containsExactly("Webhook Trigger", "Fetch Customer", "Shape Payload", "Respond to Webhook");
        assertThat(document.nodes()).extracting(Node::id).containsExactly("1", "2", "3", "4");
        assertThat(document.nodes()).extracting(Node::position).containsExactly(
            new Position(250, 300), new Position(450, 300), new Position(650, 300), new Position(850, 300));
        assertThat(document.connections().edgesFrom("Shape Payload")).containsExactly(Edge.to("Respond to Webhook"));

        Node trigger = document.node("Webhook Trigger").orElseThrow();
        assertThat(trigger.parameters()).containsEntry("path", "order-intake").containsEntry("httpMethod", "POST");
        assertThat(trigger.attributes()).containsKey("webhookId");
        assertThat(WorkflowValidator.validate(document).score()).isEqualTo(100);
    }

    @Test
    void routesSwitchBranchesByConditionAndReconverges() {
        WorkflowDocument document = paymentWorkflow();

        Connections connections = document.connections();
        assertThat(connections.ports("Payment Router")).hasSize(2);
        assertThat(connections.ports("Payment Router").get(0)).containsExactly(Edge.to("Process Stripe Payment"));
        assertThat(connections.ports("Payment Router").get(1)).containsExactly(Edge.to("Process PayPal Payment"));

        Node merge = document.node("Merge Payment Router Results").orElseThrow();
        assertThat(merge.parameters()).containsEntry("mode", "chooseBranch");
        assertThat(merge.typeVersion()).isEqualTo(2.0);
        assertThat(connections.edgesFrom("Process Stripe Payment"))
            .containsExactly(new Edge(merge.name(), Edge.MAIN, 0));
        assertThat(connections.edgesFrom("Process PayPal Payment"))
            .containsExactly(new Edge(merge.name(), Edge.MAIN, 1));
        assertThat(connections.edgesFrom(merge.name())).containsExactly(Edge.to("Save Order"));
        assertThat(connections.edgesFrom("Save Order")).containsExactly(Edge.to("Respond to Webhook"));

        assertThat(document.node("Process Stripe Payment").orElseThrow().position()).isEqualTo(new Position(850, 200));
        assertThat(document.node("Process PayPal Payment").orElseThrow().position()).isEqualTo(new Position(850, 400));
        assertThat(merge.position()).isEqualTo(new Position(1050, 300));
    }

    @Test
    void synthesizedPaymentWorkflowValidatesClean() {
        ValidationResult result = WorkflowValidator.validate(paymentWorkflow());

        assertThat(result.isValid()).isTrue();
        assertThat(result.score()).isEqualTo(100);
    }

    @Test
    void writesSwitchRulesFromConditions() {
        Node router = paymentWorkflow().node("Payment Router").orElseThrow();

        assertThat(WorkflowValidator.declaredBranches(router)).isEqualTo(2);
        assertThat(router.parameters()).containsKeys("dataType", "value1", "fallbackOutput");
    }

    @Test
    void leavesUnmatchedSwitchOutputsEmpty() {
        var trace = new DecisionTrace();
        WorkflowDocument document = SynthesisBuilder.build(tree(TriggerKind.MANUAL, false,
            router("Risk Router", List.of()),
            req("Approve Order", NodeType.FUNCTION)), Layout.defaults(), trace);

        List<List<Edge>> ports = document.connections().ports("Risk Router");
        assertThat(ports).hasSize(3);
        assertThat(ports.get(0)).containsExactly(Edge.to("Approve Order"));
        assertThat(ports.get(1)).isEmpty();
        assertThat(ports.get(2)).isEmpty();
        assertThat(trace.contains(SynthesisBuilder.STAGE, "switch-unrouted")).isTrue();
        assertThat(WorkflowValidator.validate(document).errors()).extracting(ValidationIssue::category)
            .containsExactly(IssueCategory.INCOMPLETE_SWITCH, IssueCategory.INCOMPLETE_SWITCH);
    }

    @Test
    void fansOutRunOfAlternatives() {
        WorkflowDocument document = SynthesisBuilder.build(tree(TriggerKind.SCHEDULE, false,
            req("Load Orders", NodeType.HTTP_REQUEST),
            req("Notify via Email", NodeType.EMAIL_SEND),
            req("Notify via Slack", NodeType.SLACK),
            req("Notify via SMS", NodeType.TWILIO)), Layout.defaults());

        assertThat(document.connections().edgesFrom("Load Orders")).containsExactly(
            Edge.to("Notify via Email"), Edge.to("Notify via Slack"), Edge.to("Notify via SMS"));
        assertThat(document.nodes()).extracting(Node::position).contains(
            new Position(650, 300), new Position(650, 500), new Position(650, 700));
        Node merge = document.node(SynthesisBuilder.MERGE_NODE).orElseThrow();
        assertThat(merge.position()).isEqualTo(new Position(850, 300));
        assertThat(document.connections().edgesFrom("Notify via SMS"))
            .containsExactly(new Edge(merge.name(), Edge.MAIN, 2));
        assertThat(document.node("Respond to Webhook")).isEmpty();
    }

    @Test
    void addsErrorHandlingWhenRequested() {
        WorkflowDocument document = SynthesisBuilder.build(tree(TriggerKind.WEBHOOK, true,
            req("Shape Payload", NodeType.FUNCTION)), Layout.defaults());

        Node handler = document.node(SynthesisBuilder.ERROR_TRIGGER_NODE).orElseThrow();
        assertThat(handler.type()).isEqualTo(NodeType.ERROR_TRIGGER);
        assertThat(handler.position()).isEqualTo(new Position(250, 100));
        assertThat(document.connections().edgesFrom(handler.name()))
            .containsExactly(Edge.to(SynthesisBuilder.ERROR_NOTIFICATION_NODE));
        assertThat(document.connections().targets()).doesNotContain(handler.name());
    }

    @Test
    void substitutesTriggerTypesPlacedMidBranch() {
        var trace = new DecisionTrace();
        WorkflowDocument document = SynthesisBuilder.build(tree(TriggerKind.MANUAL, false,
            req("Relay Webhook", NodeType.WEBHOOK)), Layout.defaults(), trace);

        assertThat(document.node("Relay Webhook").orElseThrow().type()).isEqualTo(NodeType.FUNCTION);
        assertThat(trace.contains(SynthesisBuilder.STAGE, "trigger-substituted")).isTrue();
    }

    @Test
    void suffixesDuplicateRequirementNames() {
        WorkflowDocument document = SynthesisBuilder.build(tree(TriggerKind.MANUAL, false,
            req("Transform Data", NodeType.FUNCTION),
            req("Transform Data", NodeType.FUNCTION)), Layout.defaults());

        assertThat(document.nodes()).extracting(Node::name)
            .containsExactly("Manual Trigger", "Transform Data", "Transform Data 2");
    }

    @Test
    void keepsGraphInvariants() {
        WorkflowDocument document = paymentWorkflow();

        var names = new HashSet<String>();
        assertThat(document.nodes()).allSatisfy(node -> assertThat(names.add(node.name())).isTrue());
        for (Node node : document.nodes()) {
            if (node.isTrigger()) {
                assertThat(document.connections().targets()).doesNotContain(node.name());
            }
        }
        assertThat(document.connections().targets()).allSatisfy(target ->
            assertThat(document.hasNode(target)).isTrue());
    }

    @Test
    void rejectsTreeWithoutRequirements() {
        assertThatThrownBy(() -> SynthesisBuilder.build(RequirementTree.empty(), Layout.defaults()))
            .isInstanceOf(StructuralException.class);
    }
}
