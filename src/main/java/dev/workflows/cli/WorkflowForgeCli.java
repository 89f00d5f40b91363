package dev.workflows.cli;

import ch.qos.logback.classic.Level;
import dev.workflows.engine.OptionsLoader;
import dev.workflows.engine.WorkflowJson;
import dev.workflows.engine.WorkflowPipeline;
import dev.workflows.model.BuildResult;
import dev.workflows.model.Decision;
import dev.workflows.model.PipelineOptions;
import dev.workflows.model.StructuralException;
import dev.workflows.model.WorkflowDocument;
import dev.workflows.provider.StrayCodeFieldPostProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for workflow-forge.
 */
@Command(
    name = "workflow-forge",
    mixinStandardHelpOptions = true,
    version = "workflow-forge 0.1.0",
    description = "Turn AI-generated workflow descriptions or JSON drafts into validated workflow documents."
)
public class WorkflowForgeCli implements Callable<Integer> {

    static final int EXIT_VALID = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_INVALID = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", defaultValue = "-",
        description = "Input file with model output, or - for stdin (default)")
    private String input;

    @Option(names = "--config", description = "JSON file with pipeline options")
    private Path config;

    @Option(names = "--no-repair", description = "Validate only, do not apply automatic repairs")
    private boolean noRepair;

    @Option(names = "--max-input-chars", description = "Override the input length bound")
    private Integer maxInputChars;

    @Option(names = "--validate-only", description = "Treat the input as a serialized workflow document")
    private boolean validateOnly;

    @Option(names = "--trace", description = "Print every heuristic decision to stderr")
    private boolean trace;

    @Option(names = "--compact", description = "Print JSON on one line")
    private boolean compact;

    @Option(names = "--verbose", description = "Enable debug logging")
    private boolean verbose;

    private InputStream stdin = System.in;

    WorkflowForgeCli withStdin(InputStream stdin) {
        this.stdin = stdin;
        return this;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            if (root instanceof ch.qos.logback.classic.Logger logback) {
                logback.setLevel(Level.DEBUG);
            }
        }

        PipelineOptions options;
        String raw;
        try {
            options = config == null ? PipelineOptions.defaults() : OptionsLoader.loadFromFile(config);
            raw = "-".equals(input)
                ? new String(stdin.readAllBytes(), StandardCharsets.UTF_8)
                : Files.readString(Path.of(input));
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_REJECTED;
        } catch (IllegalArgumentException e) {
            err.println("Error: invalid options: " + e.getMessage());
            return EXIT_REJECTED;
        }
        if (noRepair) {
            options = options.withAutoRepair(false);
        }
        if (maxInputChars != null) {
            if (maxInputChars <= 0) {
                err.println("Error: --max-input-chars must be positive");
                return EXIT_REJECTED;
            }
            options = options.withMaxInputChars(maxInputChars);
        }

        var pipeline = new WorkflowPipeline(options, new StrayCodeFieldPostProcessor());
        BuildResult result;
        try {
            if (validateOnly) {
                WorkflowDocument document = WorkflowJson.readDocument(raw);
                result = pipeline.validateDocument(document);
            } else {
                result = pipeline.buildWorkflow(raw);
            }
        } catch (IOException e) {
            err.println("Error: not a workflow document: " + e.getMessage());
            return EXIT_REJECTED;
        } catch (StructuralException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_REJECTED;
        }

        if (trace) {
            for (Decision decision : result.decisions()) {
                err.println(decision);
            }
        }
        out.println(WorkflowJson.write(WorkflowJson.toJson(result.document(), result.validation()), !compact));
        out.flush();
        return result.validation().isValid() ? EXIT_VALID : EXIT_INVALID;
    }
}
