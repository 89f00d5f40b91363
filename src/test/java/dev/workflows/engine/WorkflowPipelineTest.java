package dev.workflows.engine;

import dev.workflows.model.*;
import dev.workflows.provider.ProviderPostProcessor;
import dev.workflows.provider.StrayCodeFieldPostProcessor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class WorkflowPipelineTest {

    private static final String ECHO_DRAFT = """
        {
          "name": "Echo",
          "nodes": [
            {"name": "Hook", "type": "n8n-nodes-base.webhook", "parameters": {"path": "echo"}, "position": [250, 300]},
            {"name": "Shape Reply", "type": "n8n-nodes-base.function", "position": [450, 300],
             "parameters": {"functionCode": "return items;"},
             "functionCode": "return items.map(item => ({ json: { echoed: item.json } }));"},
            {"name": "Reply", "type": "n8n-nodes-base.respondToWebhook", "position": [650, 300]}
          ],
          "connections": {
            "Hook": {"main": [{"node": "Shape Reply", "type": "main", "index": 0}]},
            "Shape Reply": {"main": [[{"node": "Reply", "type": "main", "index": 0}]]}
          }
        }
        """;

    @Test
    void buildsFromJsonDraft() {
        var pipeline = new WorkflowPipeline(PipelineOptions.defaults(), new StrayCodeFieldPostProcessor());

        BuildResult result = pipeline.buildWorkflow(ECHO_DRAFT);

        assertThat(result.inputKind()).isEqualTo(InputKind.JSON_DRAFT);
        assertThat(result.validation().isValid()).isTrue();
        assertThat(result.validation().score()).isEqualTo(100);
        assertThat(result.document().nodes()).extracting(Node::name).containsExactly("Hook", "Shape Reply", "Reply");
        Node shape = result.document().node("Shape Reply").orElseThrow();
        assertThat((String) shape.parameters().get("functionCode")).contains("echoed");
        assertThat(shape.attributes()).doesNotContainKey("functionCode");
        assertThat(result.decisions()).extracting(Decision::rule).contains("input-json");
    }

    @Test
    void stripsMarkdownFenceAroundDraft() {
        BuildResult result = new WorkflowPipeline().buildWorkflow("```json\n" + ECHO_DRAFT + "```\n");

        assertThat(result.inputKind()).isEqualTo(InputKind.JSON_DRAFT);
        assertThat(result.document().name()).isEqualTo("Echo");
    }

    @Test
    void buildsFromNumberedStepText() {
        BuildResult result = new WorkflowPipeline().buildWorkflow(RequirementExtractorTest.STEP_PROMPT);

        assertThat(result.inputKind()).isEqualTo(InputKind.TEXT);
        assertThat(result.document().name()).isEqualTo("Invoice Reminder");
        assertThat(result.document().nodes()).extracting(Node::name)
            .containsExactly("Schedule Trigger", "Fetch Overdue Invoices", "Send Reminder Email");
        assertThat(result.validation().isValid()).isTrue();
        assertThat(result.validation().score()).isEqualTo(100);
        assertThat(result.decisions()).extracting(Decision::stage)
            .contains(WorkflowPipeline.STAGE, RequirementExtractor.STAGE, SynthesisBuilder.STAGE);
    }

    @Test
    void buildsBranchedWorkflowFromSectionText() {
        BuildResult result = new WorkflowPipeline().buildWorkflow(RequirementExtractorTest.BRANCH_PROMPT);

        WorkflowDocument document = result.document();
        assertThat(document.name()).isEqualTo("Order Processing Workflow");
        assertThat(document.nodes()).extracting(Node::name).contains(
            "Webhook Trigger", "Payment Router", "Process Stripe Payment", "Process PayPal Payment",
            "Merge Payment Router Results", "Save Order to Database", "Respond to Webhook",
            "Schedule Trigger", "Purge Stale Carts", "Error Handler", "Error Notification");
        assertThat(document.connections().ports("Payment Router")).hasSize(2);
        assertThat(result.validation().isValid()).isTrue();
    }

    @Test
    void repairsDraftBeforeReturningIt() {
        String draft = """
            {
              "nodes": [
                {"name": "Start", "type": "n8n-nodes-base.manualTrigger", "position": [0, 0]},
                {"name": "Fetch", "type": "n8n-nodes-base.function", "position": [200, 0]},
                {"name": "Process", "type": "n8n-nodes-base.function", "position": [400, 0]}
              ],
              "connections": {"Start": ["Fetch"]}
            }
            """;

        BuildResult result = new WorkflowPipeline().buildWorkflow(draft);

        assertThat(result.repair()).isNotNull();
        assertThat(result.repair().fixCount()).isEqualTo(1);
        assertThat(result.validation().score()).isEqualTo(100);
        assertThat(result.decisions()).extracting(Decision::detail).contains("before repair: score 80");
    }

    @Test
    void skipsRepairWhenDisabled() {
        var pipeline = new WorkflowPipeline(PipelineOptions.defaults().withAutoRepair(false),
            ProviderPostProcessor.identity());
        String draft = """
            {
              "nodes": [
                {"name": "Start", "type": "n8n-nodes-base.manualTrigger", "position": [0, 0]},
                {"name": "Fetch", "type": "n8n-nodes-base.function", "position": [200, 0]},
                {"name": "Process", "type": "n8n-nodes-base.function", "position": [400, 0]}
              ],
              "connections": {"Start": ["Fetch"]}
            }
            """;

        BuildResult result = pipeline.buildWorkflow(draft);

        assertThat(result.repair()).isNull();
        assertThat(result.validation().isValid()).isFalse();
        assertThat(result.validation().score()).isEqualTo(80);
    }

    @Test
    void runsPostProcessorExactlyOnce() {
        var calls = new AtomicInteger();
        var pipeline = new WorkflowPipeline(PipelineOptions.defaults(), document -> {
            calls.incrementAndGet();
            document.rename("Post-processed");
            return document;
        });

        BuildResult result = pipeline.buildWorkflow(ECHO_DRAFT);

        assertThat(calls).hasValue(1);
        assertThat(result.document().name()).isEqualTo("Post-processed");
    }

    @Test
    void rejectsPostProcessorReturningNull() {
        var pipeline = new WorkflowPipeline(PipelineOptions.defaults(), document -> null);

        assertThatThrownBy(() -> pipeline.buildWorkflow(ECHO_DRAFT)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void rejectsShapelessJson() {
        assertThatThrownBy(() -> new WorkflowPipeline().buildWorkflow("{\"name\": \"nothing\"}"))
            .isInstanceOf(StructuralException.class);
    }

    @Test
    void rejectsTextWithoutRequirements() {
        assertThatThrownBy(() -> new WorkflowPipeline().buildWorkflow("Please automate something useful."))
            .isInstanceOf(StructuralException.class);
        assertThatThrownBy(() -> new WorkflowPipeline().buildWorkflow(null))
            .isInstanceOf(StructuralException.class);
    }

    @Test
    void truncatesOversizedInput() {
        var pipeline = new WorkflowPipeline(PipelineOptions.defaults().withMaxInputChars(40),
            ProviderPostProcessor.identity());
        var trace = new DecisionTrace();

        WorkflowPipeline.ParsedInput parsed = pipeline.parse("x".repeat(500), trace);

        assertThat(parsed).isInstanceOf(WorkflowPipeline.ParsedInput.Text.class);
        assertThat(((WorkflowPipeline.ParsedInput.Text) parsed).text()).hasSize(40);
        assertThat(trace.contains(WorkflowPipeline.STAGE, "input-truncated")).isTrue();
    }

    @Test
    void fallsBackToTextForBrokenJson() {
        var trace = new DecisionTrace();

        WorkflowPipeline.ParsedInput parsed = new WorkflowPipeline().parse("{ \"nodes\": [ oops", trace);

        assertThat(parsed).isInstanceOf(WorkflowPipeline.ParsedInput.Text.class);
        assertThat(trace.contains(WorkflowPipeline.STAGE, "input-json-rejected")).isTrue();
    }

    @Test
    void validatesPrebuiltDocumentWithoutPostProcessing() {
        var calls = new AtomicInteger();
        var pipeline = new WorkflowPipeline(PipelineOptions.defaults(), document -> {
            calls.incrementAndGet();
            return document;
        });

        BuildResult result = pipeline.validateDocument(WorkflowValidatorTest.disconnectedChain());

        assertThat(result.inputKind()).isEqualTo(InputKind.DOCUMENT);
        assertThat(result.validation().score()).isEqualTo(100);
        assertThat(calls).hasValue(0);
    }

    @Test
    void stripFencesLeavesUnfencedTextAlone() {
        assertThat(WorkflowPipeline.stripFences("plain text")).isEqualTo("plain text");
        assertThat(WorkflowPipeline.stripFences("```\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
    }

    @Test
    void draftLoopBackIntoTriggerStillBuildsValidWorkflow() {
        BuildResult result = new WorkflowPipeline().buildWorkflow("""
            {
              "nodes": [
                {"name": "Start", "type": "n8n-nodes-base.manualTrigger", "position": [250, 300]},
                {"name": "Work", "type": "n8n-nodes-base.function", "position": [450, 300],
                 "parameters": {"functionCode": "return items;"}}
              ],
              "connections": {"Start": ["Work"], "Work": ["Start"]}
            }
            """);

        assertThat(result.validation().isValid()).isTrue();
        assertThat(result.validation().issues())
            .noneMatch(issue -> issue.category() == IssueCategory.TRIGGER_AS_TARGET);
    }

    @Test
    void manyIdenticallyNamedStepsBuildInBoundedTime() {
        String input = "1. **Fetch data**\n".repeat(5000);

        BuildResult result = assertTimeoutPreemptively(Duration.ofSeconds(20),
            () -> new WorkflowPipeline().buildWorkflow(input));

        assertThat(result.document().nodes()).hasSize(5002);
        assertThat(result.document().hasNode("Fetch data 5000")).isTrue();
        assertThat(result.document().hasNode("Fetch data 5001")).isFalse();
    }
}
