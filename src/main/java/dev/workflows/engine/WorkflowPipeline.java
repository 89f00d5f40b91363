package dev.workflows.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflows.model.BuildResult;
import dev.workflows.model.InputKind;
import dev.workflows.model.PipelineOptions;
import dev.workflows.model.RepairResult;
import dev.workflows.model.RequirementTree;
import dev.workflows.model.StructuralException;
import dev.workflows.model.ValidationResult;
import dev.workflows.model.WorkflowDocument;
import dev.workflows.provider.ProviderPostProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The {@code buildWorkflow(rawInput)} entry point. Synchronous and free of shared mutable state:
 * every call allocates its own trace and document, so one instance may serve concurrent callers.
 */
public final class WorkflowPipeline {

    static final String STAGE = "pipeline";

    private static final Logger log = LoggerFactory.getLogger(WorkflowPipeline.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PipelineOptions options;
    private final ProviderPostProcessor postProcessor;

    /** Raw input after bounding and fence stripping, classified by which builder takes it. */
    sealed interface ParsedInput {

        record Text(String text) implements ParsedInput {}

        record Draft(JsonNode json) implements ParsedInput {}
    }

    public WorkflowPipeline() {
        this(PipelineOptions.defaults(), ProviderPostProcessor.identity());
    }

    public WorkflowPipeline(PipelineOptions options, ProviderPostProcessor postProcessor) {
        this.options = Objects.requireNonNull(options, "options");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor");
    }

    public PipelineOptions options() {
        return options;
    }

    /**
     * Build, validate and (if enabled) repair a workflow from model output.
     *
     * @throws StructuralException if the input has no usable node/connection shape or yields no nodes
     */
    public BuildResult buildWorkflow(String rawInput) {
        var trace = new DecisionTrace();
        ParsedInput input = parse(rawInput == null ? "" : rawInput, trace);

        WorkflowDocument document;
        InputKind kind;
        if (input instanceof ParsedInput.Draft draft) {
            kind = InputKind.JSON_DRAFT;
            document = DirectPreservationBuilder.build(draft.json(), options.layout(), trace);
        } else {
            kind = InputKind.TEXT;
            String text = ((ParsedInput.Text) input).text();
            String normalized = PromptNormalizer.normalize(text, trace);
            RequirementTree tree = RequirementExtractor.extract(normalized, trace);
            document = SynthesisBuilder.build(tree, options.layout(), trace);
        }
        if (document.nodes().isEmpty()) {
            throw new StructuralException("Input produced a workflow with no nodes");
        }

        return finish(document, kind, trace);
    }

    /**
     * Validate an already-built document, repairing it first when auto-repair is on. The
     * post-processor does not run: the document did not come from the text generator.
     */
    public BuildResult validateDocument(WorkflowDocument document) {
        return finish(document, InputKind.DOCUMENT, new DecisionTrace());
    }

    private BuildResult finish(WorkflowDocument document, InputKind kind, DecisionTrace trace) {
        RepairResult repair = null;
        if (options.autoRepair()) {
            ValidationResult before = WorkflowValidator.validate(document, options.rowTolerance());
            trace.record(STAGE, "validated", "before repair: score " + before.score());
            repair = before.issues().isEmpty()
                ? new RepairResult(document, 0, null)
                : WorkflowRepairer.repair(document, options.rowTolerance(), trace);
        }

        WorkflowDocument result = kind == InputKind.DOCUMENT
            ? document
            : Objects.requireNonNull(postProcessor.apply(document), "post-processor returned null");
        ValidationResult validation = WorkflowValidator.validate(result, options.rowTolerance());
        trace.record(STAGE, "validated", "final: score " + validation.score());

        log.info("Built '{}' from {} input: {} nodes, valid={}, score={}",
            result.name(), kind, result.nodes().size(), validation.isValid(), validation.score());
        return new BuildResult(result, validation, repair, trace.decisions(), kind);
    }

    ParsedInput parse(String raw, DecisionTrace trace) {
        String input = raw;
        if (input.length() > options.maxInputChars()) {
            trace.record(STAGE, "input-truncated", input.length() + " chars cut to " + options.maxInputChars());
            input = input.substring(0, options.maxInputChars());
        }
        String candidate = stripFences(input.trim());
        if (candidate.startsWith("{")) {
            try {
                JsonNode json = MAPPER.readTree(candidate);
                if (json != null && json.isObject()) {
                    trace.record(STAGE, "input-json", "parsed JSON draft");
                    return new ParsedInput.Draft(json);
                }
            } catch (JsonProcessingException e) {
                trace.record(STAGE, "input-json-rejected", e.getOriginalMessage());
            }
        }
        trace.record(STAGE, "input-text", input.length() + " chars of text");
        return new ParsedInput.Text(input);
    }

    /** Drop a Markdown code fence wrapping the whole input. */
    static String stripFences(String input) {
        if (!input.startsWith("```")) {
            return input;
        }
        int firstLineEnd = input.indexOf('\n');
        if (firstLineEnd < 0) {
            return input;
        }
        String body = input.substring(firstLineEnd + 1);
        int closing = body.lastIndexOf("```");
        if (closing >= 0) {
            body = body.substring(0, closing);
        }
        return body.trim();
    }
}
