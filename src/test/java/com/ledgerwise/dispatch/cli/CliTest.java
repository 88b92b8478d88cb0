package com.ledgerwise.dispatch.cli;

import com.ledgerwise.core.engine.AssistantEngine;
import com.ledgerwise.core.events.AssistantEvent;
import com.ledgerwise.core.events.EventBus;
import com.ledgerwise.core.llm.LlmService;
import com.ledgerwise.core.model.AggregatedAnswer;
import com.ledgerwise.core.model.Intent;
import com.ledgerwise.core.model.InternalFaultException;
import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.model.SourceAttribution;
import com.ledgerwise.core.model.StepResult;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.core.tools.TestCatalog;
import com.ledgerwise.core.tools.ToolRegistry;
import com.ledgerwise.records.OutboxMailGateway;
import com.ledgerwise.records.TestRecords;
import com.ledgerwise.retrieval.PolicyRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private AssistantEngine engine;
    private EventBus eventBus;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        engine = mock(AssistantEngine.class);
        when(engine.generateRequestId()).thenReturn("LW-20240402-0001");
        eventBus = new EventBus();
        registry = TestCatalog.registry(TestRecords.seededStore(), mock(PolicyRetriever.class),
                mock(LlmService.class), new OutboxMailGateway());
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AskCommand.class) {
                    return (K) new AskCommand(engine, eventBus);
                }
                if (cls == ToolsCommand.class) {
                    return (K) new ToolsCommand(registry);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new LedgerwiseCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static AggregatedAnswer answer(RequestStatus status, String text) {
        var step = PlanStep.pending("step-1", "employee_lookup", Map.of());
        var result = StepResult.succeeded(step, ToolOutput.of("Alice Chen (E001)", Map.of(), "employees/E001"), 1);
        return new AggregatedAnswer("LW-20240402-0001", text,
                List.of(new SourceAttribution("employees/E001", "Alice Chen (E001)", null)),
                status == RequestStatus.DONE ? List.of(result) : List.of(),
                Intent.SIMPLE_LOOKUP, status, List.of());
    }

    @Nested
    @DisplayName("Help output")
    class HelpOutput {

        @Test
        @DisplayName("--help lists the subcommands")
        void help() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ask"));
            assertTrue(result.output().contains("tools"));
            assertTrue(result.output().contains("Finance and HR task assistant"));
        }

        @Test
        @DisplayName("--version shows the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Ledgerwise 0.1.0"));
        }

        @Test
        @DisplayName("ask --help shows the verbose option")
        void askHelp() {
            CliResult result = execute("ask", "--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--verbose"));
        }
    }

    @Nested
    @DisplayName("ask")
    class Ask {

        @Test
        @DisplayName("prints the answer and its sources")
        void done() {
            when(engine.run(eq("LW-20240402-0001"), anyString()))
                    .thenReturn(answer(RequestStatus.DONE, "Alice Chen works in Finance."));

            CliResult result = execute("ask", "Who is Alice Chen?");

            assertEquals(AskCommand.EXIT_DONE, result.exitCode());
            assertTrue(result.output().contains("Alice Chen works in Finance."));
            assertTrue(result.output().contains("employees/E001"));
        }

        @Test
        @DisplayName("rejected requests exit with 1")
        void rejected() {
            when(engine.run(eq("LW-20240402-0001"), anyString()))
                    .thenReturn(answer(RequestStatus.REJECTED, "I can't carry out this request: missing dates."));

            CliResult result = execute("ask", "How much did E001 claim?");

            assertEquals(AskCommand.EXIT_REJECTED, result.exitCode());
            assertTrue(result.output().contains("I can't carry out this request"));
        }

        @Test
        @DisplayName("faults print the root cause and exit with 2")
        void faulted() {
            when(engine.run(eq("LW-20240402-0001"), anyString())).thenThrow(
                    new InternalFaultException("Request failed", new IllegalStateException("vector store offline")));

            CliResult result = execute("ask", "What is the hotel limit?");

            assertEquals(AskCommand.EXIT_FAILED, result.exitCode());
            assertTrue(result.output().contains("vector store offline"));
        }

        @Test
        @DisplayName("--verbose streams events and lists the steps")
        void verbose() {
            doAnswer(inv -> {
                eventBus.publish(AssistantEvent.of("step.retrying", "LW-20240402-0001", "step-1",
                        Map.of("error", "TRANSIENT")));
                return answer(RequestStatus.DONE, "Alice Chen works in Finance.");
            }).when(engine).run(eq("LW-20240402-0001"), anyString());

            CliResult result = execute("ask", "--verbose", "Who is Alice Chen?");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("LW-20240402-0001"));
            assertTrue(result.output().contains("[RETRY]"));
            assertTrue(result.output().contains("step-1 employee_lookup (1 retries)"));
        }
    }

    @Test
    @DisplayName("tools lists every registered tool")
    void tools() {
        CliResult result = execute("tools");

        assertEquals(0, result.exitCode());
        for (ToolSpec spec : registry.specs()) {
            assertTrue(result.output().contains(spec.name()), spec.name());
        }
        assertTrue(result.output().contains("send_email [ACTION, MUTATING]"));
    }
}
