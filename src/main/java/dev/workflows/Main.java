package dev.workflows;

import dev.workflows.cli.WorkflowForgeCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkflowForgeCli()).execute(args);
        System.exit(exitCode);
    }
}
