package com.ledgerwise.dispatch.cli;

import com.ledgerwise.core.events.AssistantEvent;
import com.ledgerwise.core.model.AggregatedAnswer;
import com.ledgerwise.core.model.SourceAttribution;
import com.ledgerwise.core.model.StepResult;
import com.ledgerwise.core.model.ToolSpec;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Ledgerwise CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) LEDGERWISE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LEDGERWISE]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void answer(AggregatedAnswer answer) {
        System.out.println();
        System.out.println(answer.text());
        if (!answer.sources().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Sources|@"));
            for (SourceAttribution source : answer.sources()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  @|fg(cyan) " + source.origin() + "|@"
                                + (source.confidence() == null ? "" : String.format(" (%.2f)", source.confidence()))));
            }
        }
    }

    public static void steps(AggregatedAnswer answer) {
        System.out.println("──────────────────────────────────");
        for (StepResult result : answer.stepResults()) {
            String status = result.success()
                    ? "@|fg(green) OK  |@"
                    : "@|fg(red) FAIL|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + status + " " + result.stepId() + " " + result.toolName()
                            + (result.retries() > 0 ? " (" + result.retries() + " retries)" : "")
                            + (result.success() ? "" : " " + result.error().kind())));
        }
    }

    public static void tool(ToolSpec spec) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + spec.name() + "|@ @|fg(yellow) [" + spec.category() + ", " + spec.sideEffect() + "]|@"));
        System.out.println("    " + spec.description());
        System.out.println("    requires: " + (spec.requiredParameters().isEmpty() ? "-" : String.join(", ", spec.requiredParameters()))
                + " | optional: " + (spec.optionalParameters().isEmpty() ? "-" : String.join(", ", spec.optionalParameters()))
                + " | exports: " + (spec.exports().isEmpty() ? "-" : String.join(", ", spec.exports())));
    }

    public static void event(AssistantEvent event) {
        String prefix = switch (event.eventType()) {
            case "request.received", "request.completed" -> "@|fg(cyan) [REQUEST]|@";
            case "plan.resolved" -> "@|fg(blue) [PLAN]|@";
            case "plan.rejected" -> "@|fg(red),bold [REJECTED]|@";
            case "step.started", "step.completed" -> "@|fg(blue) [STEP]|@";
            case "step.retrying" -> "@|fg(yellow) [RETRY]|@";
            case "step.failed" -> "@|fg(red) [STEP]|@";
            case "request.cancelled" -> "@|fg(magenta) [CANCELLED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String step = event.stepId() == null ? "" : event.stepId() + " ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + step + event.payload()));
    }
}
