package com.ledgerwise.core.executor;

import com.ledgerwise.core.engine.EngineProperties;
import com.ledgerwise.core.events.AssistantEvent;
import com.ledgerwise.core.events.EventBus;
import com.ledgerwise.core.metrics.AssistantMetrics;
import com.ledgerwise.core.model.ArgumentValue;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.EntityKind;
import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.InternalFaultException;
import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.StepError;
import com.ledgerwise.core.model.StepResult;
import com.ledgerwise.core.model.StepStatus;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.core.tools.StubTool;
import com.ledgerwise.core.tools.StubTool.Outcome;
import com.ledgerwise.core.tools.Tool;
import com.ledgerwise.core.tools.ToolRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class StepExecutorTest {

    private static final ToolOutput OK = ToolOutput.of("ok", Map.of("employee_id", "E001"), "employees/E001");

    private EngineProperties properties;
    private EventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private ParameterRepairer repairer;
    private final List<StepExecutor> executors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        eventBus = new EventBus();
        meterRegistry = new SimpleMeterRegistry();
        repairer = new ParameterRepairer(Clock.fixed(Instant.parse("2024-05-15T09:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        executors.forEach(StepExecutor::shutdown);
        MDC.clear();
    }

    private StepExecutor executor(Tool... tools) {
        var executor = new StepExecutor(new ToolRegistry(List.of(tools)), repairer, properties, eventBus,
                new AssistantMetrics(meterRegistry));
        executors.add(executor);
        return executor;
    }

    private static StubTool lookup(SideEffect sideEffect, Outcome... outcomes) {
        return new StubTool(StubTool.spec("lookup", List.of("employee_id"), List.of(), List.of("employee_id"),
                sideEffect), outcomes);
    }

    private static PlanStep step(String tool, Map<String, ArgumentValue> arguments) {
        return PlanStep.pending("step-1", tool, arguments);
    }

    private static final Map<String, ArgumentValue> E001 = Map.of("employee_id", ArgumentValue.literal("E001"));

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("a transient failure followed by success records one retry")
        void transientThenSuccess() {
            var tool = lookup(SideEffect.READ_ONLY, Outcome.failure(ErrorKind.TRANSIENT, "busy"), Outcome.success(OK));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertTrue(outcome.result().success());
            assertEquals(1, outcome.result().retries());
            assertEquals(StepStatus.SUCCEEDED, outcome.step().status());
            assertEquals(2, tool.invocationCount());
        }

        @Test
        @DisplayName("invokes at most maxRetries + 1 times")
        void retryBound() {
            properties.setMaxRetries(2);
            var tool = lookup(SideEffect.READ_ONLY, Outcome.failure(ErrorKind.TRANSIENT, "busy"));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertFalse(outcome.result().success());
            assertEquals(3, tool.invocationCount());
            assertEquals(2, outcome.result().retries());
            assertEquals(ErrorKind.TRANSIENT, outcome.result().error().kind());
            assertEquals(StepStatus.FAILED_TERMINAL, outcome.step().status());
            assertEquals(2.0, meterRegistry.find("ledgerwise.step.retries").tag("tool", "lookup").counter().count());
        }

        @Test
        @DisplayName("zero retries means a single attempt")
        void zeroRetries() {
            properties.setMaxRetries(0);
            var tool = lookup(SideEffect.READ_ONLY, Outcome.failure(ErrorKind.TRANSIENT, "busy"));

            executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertEquals(1, tool.invocationCount());
        }

        @Test
        @DisplayName("non-retryable failures are not retried")
        void notFoundNotRetried() {
            var tool = lookup(SideEffect.READ_ONLY, Outcome.failure(ErrorKind.ENTITY_NOT_FOUND, "no such employee"));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertEquals(1, tool.invocationCount());
            assertEquals(0, outcome.result().retries());
            assertEquals(ErrorKind.ENTITY_NOT_FOUND, outcome.result().error().kind());
        }

        @Test
        @DisplayName("repairs arguments before retrying without changing the target employee")
        void repairsButKeepsIdentity() {
            var spec = StubTool.spec("summary", List.of("employee_id", "start_date", "end_date"), List.of(),
                    List.of("total_amount"), SideEffect.READ_ONLY);
            var tool = new StubTool(spec,
                    Outcome.failure(ErrorKind.PARAMETER_INVALID, "bad date"), Outcome.success(OK));
            var entities = EntityBag.empty().with(EntityKind.EMPLOYEE_ID, "E002");
            var summary = step("summary", Map.of(
                    "employee_id", ArgumentValue.literal("E001"),
                    "start_date", ArgumentValue.literal("March 2024"),
                    "end_date", ArgumentValue.literal("March 2024")));

            var outcome = executor(tool).execute("R-1", summary, entities, Map.of());

            assertTrue(outcome.result().success());
            var retried = tool.invocations().get(1);
            assertEquals("E001", retried.get("employee_id"));
            assertEquals("2024-03-01", retried.get("start_date"));
            assertEquals("2024-03-31", retried.get("end_date"));
        }
    }

    @Nested
    @DisplayName("side effects")
    class SideEffects {

        @Test
        @DisplayName("an unexpected exception from a mutating tool is uncertain and never re-invoked")
        void mutatingCrash() {
            var tool = lookup(SideEffect.MUTATING, Outcome.crash(new IllegalStateException("socket closed")));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertEquals(1, tool.invocationCount());
            assertEquals(ErrorKind.EXTERNAL_MUTATION_UNCERTAIN, outcome.result().error().kind());
        }

        @Test
        @DisplayName("a mutating tool that times out is uncertain and never re-invoked")
        void mutatingTimeout() {
            properties.setStepTimeout(Duration.ofMillis(100));
            var tool = lookup(SideEffect.MUTATING, Outcome.success(OK).delayed(2_000));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertEquals(1, tool.invocationCount());
            assertEquals(ErrorKind.EXTERNAL_MUTATION_UNCERTAIN, outcome.result().error().kind());
        }

        @Test
        @DisplayName("a read-only tool that times out is retried")
        void readOnlyTimeout() {
            properties.setStepTimeout(Duration.ofMillis(100));
            var tool = lookup(SideEffect.READ_ONLY, Outcome.success(OK).delayed(2_000), Outcome.success(OK));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertTrue(outcome.result().success());
            assertEquals(1, outcome.result().retries());
        }

        @Test
        @DisplayName("a mutating tool reporting a transient refusal is retried")
        void mutatingDeclaredTransient() {
            var tool = lookup(SideEffect.MUTATING, Outcome.failure(ErrorKind.TRANSIENT, "refused"), Outcome.success(OK));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertTrue(outcome.result().success());
            assertEquals(2, tool.invocationCount());
        }
    }

    @Nested
    @DisplayName("binding")
    class Binding {

        private final StubTool summary = new StubTool(
                StubTool.spec("summary", List.of("employee_id"), List.of(), List.of(), SideEffect.READ_ONLY),
                Outcome.success(OK));

        private final PlanStep consumer = PlanStep.pending("step-2", "summary",
                Map.of("employee_id", ArgumentValue.reference("step-1", "employee_id")));

        @Test
        @DisplayName("reads back-references from earlier results")
        void backReference() {
            var prior = new StepResult("step-1", "lookup", true,
                    ToolOutput.of("Alice", Map.of("employee_id", "E001"), null), null, 0);

            var outcome = executor(summary).execute("R-1", consumer, EntityBag.empty(), Map.of("step-1", prior));

            assertTrue(outcome.result().success());
            assertEquals("E001", summary.invocations().get(0).get("employee_id"));
        }

        @Test
        @DisplayName("a reference to a failed step is a precondition failure without invocation")
        void failedPrerequisite() {
            var prior = new StepResult("step-1", "lookup", false, null,
                    StepError.of(ErrorKind.ENTITY_NOT_FOUND, "no such employee"), 0);

            var outcome = executor(summary).execute("R-1", consumer, EntityBag.empty(), Map.of("step-1", prior));

            assertEquals(ErrorKind.PRECONDITION_FAILED, outcome.result().error().kind());
            assertEquals(0, summary.invocationCount());
        }

        @Test
        @DisplayName("a missing prior result or export is a precondition failure")
        void missingPrerequisite() {
            var executor = executor(summary);
            assertEquals(ErrorKind.PRECONDITION_FAILED,
                    executor.execute("R-1", consumer, EntityBag.empty(), Map.of()).result().error().kind());

            var noExport = new StepResult("step-1", "lookup", true, ToolOutput.of("?", Map.of(), null), null, 0);
            assertEquals(ErrorKind.PRECONDITION_FAILED,
                    executor.execute("R-1", consumer, EntityBag.empty(), Map.of("step-1", noExport)).result().error().kind());
            assertEquals(0, summary.invocationCount());
        }

        @Test
        @DisplayName("unbound parameters come from entities and optional ones from defaults")
        void entitiesAndDefaults() {
            var spec = new ToolSpec("ticket", "Ticket", "d", List.of("assignee_id"), List.of("priority"),
                    Map.of("priority", "medium"), List.of(), ToolCategory.ACTION, SideEffect.IDEMPOTENT_BY_KEY);
            var tool = new StubTool(spec, Outcome.success(OK));

            executor(tool).execute("R-1", step("ticket", Map.of("assignee_id", ArgumentValue.UNBOUND)),
                    EntityBag.empty().with(EntityKind.EMPLOYEE_ID, "E003"), Map.of());

            assertEquals(Map.of("assignee_id", "E003", "priority", "medium"), tool.invocations().get(0));
        }

        @Test
        @DisplayName("a required parameter nothing supplies fails at once without invoking the tool")
        void missingRequired() {
            var tool = lookup(SideEffect.READ_ONLY, Outcome.success(OK));

            var outcome = executor(tool).execute("R-1", step("lookup", Map.of("employee_id", ArgumentValue.UNBOUND)),
                    EntityBag.empty(), Map.of());

            assertEquals(ErrorKind.PARAMETER_INVALID, outcome.result().error().kind());
            assertEquals(0, tool.invocationCount());
            assertEquals(0, outcome.result().retries());
            assertNull(meterRegistry.find("ledgerwise.step.retries").counter());
        }

        @Test
        @DisplayName("an invalid parameter the tool rejects is not retried when no repair applies")
        void unrepairableInvalid() {
            var tool = lookup(SideEffect.READ_ONLY, Outcome.failure(ErrorKind.PARAMETER_INVALID, "bad id"));

            var outcome = executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of());

            assertEquals(1, tool.invocationCount());
            assertEquals(0, outcome.result().retries());
            assertEquals(ErrorKind.PARAMETER_INVALID, outcome.result().error().kind());
        }

        @Test
        @DisplayName("a step marked failed without an error is an internal fault")
        void failedWithoutError() {
            var tool = lookup(SideEffect.READ_ONLY, Outcome.success(OK));
            var broken = step("lookup", E001).withStatus(StepStatus.FAILED_TERMINAL);

            assertThrows(InternalFaultException.class,
                    () -> executor(tool).execute("R-1", broken, EntityBag.empty(), Map.of()));
            assertEquals(0, tool.invocationCount());
        }

        @Test
        @DisplayName("a step failed during resolution is reported without invocation")
        void alreadyFailed() {
            var tool = lookup(SideEffect.READ_ONLY, Outcome.success(OK));
            var failed = step("lookup", E001).failed(StepError.of(ErrorKind.DEPENDENCY_UNSATISFIABLE, "nothing"), 0);

            var outcome = executor(tool).execute("R-1", failed, EntityBag.empty(), Map.of());

            assertEquals(ErrorKind.DEPENDENCY_UNSATISFIABLE, outcome.result().error().kind());
            assertEquals(0, tool.invocationCount());
        }
    }

    @Test
    @DisplayName("publishes step events in order")
    void publishesEvents() {
        List<AssistantEvent> events = new CopyOnWriteArrayList<>();
        eventBus.subscribe("R-7", events::add);
        var tool = lookup(SideEffect.READ_ONLY, Outcome.failure(ErrorKind.TRANSIENT, "busy"), Outcome.success(OK));

        executor(tool).execute("R-7", step("lookup", E001), EntityBag.empty(), Map.of());

        assertEquals(List.of("step.started", "step.retrying", "step.started", "step.completed"),
                events.stream().map(AssistantEvent::eventType).toList());
        assertEquals("step-1", events.get(0).stepId());
        assertEquals(List.of("RUNNING", "FAILED_RETRYABLE", "RUNNING", "SUCCEEDED"),
                events.stream().map(e -> e.payload().get("status")).toList());
        assertEquals(2, events.get(2).payload().get("attempt"));
    }

    @Test
    @DisplayName("a step that runs out of retries ends failed-terminal after failed-retryable attempts")
    void lifecycleToTerminal() {
        properties.setMaxRetries(1);
        List<AssistantEvent> events = new CopyOnWriteArrayList<>();
        eventBus.subscribe("R-8", events::add);
        var tool = lookup(SideEffect.READ_ONLY, Outcome.failure(ErrorKind.TRANSIENT, "busy"));

        var outcome = executor(tool).execute("R-8", step("lookup", E001), EntityBag.empty(), Map.of());

        assertEquals(List.of("RUNNING", "FAILED_RETRYABLE", "RUNNING", "FAILED_TERMINAL"),
                events.stream().map(e -> e.payload().get("status")).toList());
        assertEquals(StepStatus.FAILED_TERMINAL, outcome.step().status());
        assertEquals(ErrorKind.TRANSIENT, outcome.step().error().kind());
    }

    @Test
    @DisplayName("a tool that returns no output aborts with an internal fault")
    void nullOutput() {
        var tool = lookup(SideEffect.READ_ONLY, Outcome.success(null));

        var thrown = assertThrows(InternalFaultException.class,
                () -> executor(tool).execute("R-1", step("lookup", E001), EntityBag.empty(), Map.of()));

        assertTrue(thrown.getMessage().contains("returned no output"));
        assertEquals(1, tool.invocationCount());
        assertNull(MDC.get("stepId"));
    }

    @Test
    @DisplayName("tool calls see the request and step in the MDC")
    void propagatesMdc() {
        List<String> seen = new CopyOnWriteArrayList<>();
        var spec = StubTool.spec("mdc_reader", List.of(), List.of(), List.of(), SideEffect.READ_ONLY);
        Tool mdcReader = new Tool() {
            @Override
            public ToolSpec spec() {
                return spec;
            }

            @Override
            public ToolOutput invoke(Map<String, Object> arguments) {
                seen.add(MDC.get("requestId") + "/" + MDC.get("stepId"));
                return OK;
            }
        };

        executor(mdcReader).execute("R-9", step("mdc_reader", Map.of()), EntityBag.empty(), Map.of());

        assertEquals(List.of("R-9/step-1"), seen);
        assertNull(MDC.get("stepId"));
    }

    @Test
    @DisplayName("identity values survive repairs that change them")
    void preserveIdentity() {
        var original = Map.<String, Object>of("employee_id", "e001", "to_email", "a@example.com", "subject", "x");
        var repaired = Map.<String, Object>of("employee_id", "E001", "subject", "y");

        var result = StepExecutor.preserveIdentity(original, repaired);

        assertEquals("E001", result.get("employee_id"));
        assertEquals("a@example.com", result.get("to_email"));
        assertEquals("y", result.get("subject"));
        assertEquals("E001", StepExecutor.preserveIdentity(Map.of("employee_id", "E001"),
                Map.of("employee_id", "E002")).get("employee_id"));
    }
}
