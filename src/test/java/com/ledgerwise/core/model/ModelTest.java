package com.ledgerwise.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("Intent")
    class IntentTests {

        @Test
        @DisplayName("parses labels case-insensitively with dashes and spaces")
        void parsesLabels() {
            assertEquals(Intent.DATA_QUERY, Intent.fromLabel("data_query"));
            assertEquals(Intent.SIMPLE_LOOKUP, Intent.fromLabel("Simple Lookup"));
            assertEquals(Intent.CONTENT_GENERATION, Intent.fromLabel("content-generation"));
        }

        @Test
        @DisplayName("unknown or missing labels fall back to COMPOSITE_TASK")
        void fallsBackToComposite() {
            assertEquals(Intent.COMPOSITE_TASK, Intent.fromLabel("weather"));
            assertEquals(Intent.COMPOSITE_TASK, Intent.fromLabel(""));
            assertEquals(Intent.COMPOSITE_TASK, Intent.fromLabel(null));
        }
    }

    @Nested
    @DisplayName("EntityKind")
    class EntityKindTests {

        @Test
        @DisplayName("maps tool parameters to entity kinds")
        void mapsParameters() {
            assertEquals(EntityKind.EMPLOYEE_ID, EntityKind.forParameter("employee_id").orElseThrow());
            assertEquals(EntityKind.EMPLOYEE_ID, EntityKind.forParameter("assignee_id").orElseThrow());
            assertEquals(EntityKind.RECIPIENT, EntityKind.forParameter("to_email").orElseThrow());
            assertTrue(EntityKind.forParameter("body").isEmpty());
        }
    }

    @Nested
    @DisplayName("EntityBag")
    class EntityBagTests {

        @Test
        @DisplayName("drops blank values and trims the rest")
        void dropsBlankValues() {
            var values = new HashMap<EntityKind, String>();
            values.put(EntityKind.EMPLOYEE_NAME, "  Alice Chen ");
            values.put(EntityKind.SUBJECT, "   ");
            values.put(EntityKind.PRIORITY, null);
            var bag = new EntityBag(values);

            assertEquals(1, bag.size());
            assertEquals("Alice Chen", bag.get(EntityKind.EMPLOYEE_NAME).orElseThrow());
            assertFalse(bag.has(EntityKind.SUBJECT));
        }

        @Test
        @DisplayName("with and without return new bags")
        void withAndWithout() {
            var bag = EntityBag.empty().with(EntityKind.EMPLOYEE_ID, "E001");
            var without = bag.without(EntityKind.EMPLOYEE_ID);

            assertTrue(bag.has(EntityKind.EMPLOYEE_ID));
            assertTrue(without.isEmpty());
        }

        @Test
        @DisplayName("orElse keeps own values and fills gaps from the fallback")
        void orElseFillsGaps() {
            var own = EntityBag.empty().with(EntityKind.EMPLOYEE_ID, "E002");
            var fallback = EntityBag.empty()
                    .with(EntityKind.EMPLOYEE_ID, "E001")
                    .with(EntityKind.START_DATE, "2024-03-01");

            var merged = own.orElse(fallback);

            assertEquals("E002", merged.get(EntityKind.EMPLOYEE_ID).orElseThrow());
            assertEquals("2024-03-01", merged.get(EntityKind.START_DATE).orElseThrow());
        }

        @Test
        @DisplayName("forParameter reads assignee_id from the employee id")
        void forParameter() {
            var bag = EntityBag.empty().with(EntityKind.EMPLOYEE_ID, "E003");
            assertEquals("E003", bag.forParameter("assignee_id").orElseThrow());
            assertTrue(bag.forParameter("body").isEmpty());
        }
    }

    @Nested
    @DisplayName("PlanStep and Plan")
    class PlanTests {

        @Test
        @DisplayName("rejects a blank step id")
        void rejectsBlankId() {
            assertThrows(IllegalArgumentException.class, () -> PlanStep.pending(" ", "employee_lookup", Map.of()));
        }

        @Test
        @DisplayName("renumbers sequences by position")
        void renumbersSequences() {
            var plan = Plan.of(List.of(
                    PlanStep.pending("step-2", "policy_search", Map.of()).withSequence(7),
                    PlanStep.pending("step-1", "employee_lookup", Map.of())));

            assertEquals(1, plan.steps().get(0).sequence());
            assertEquals(2, plan.steps().get(1).sequence());
            assertEquals(List.of("policy_search", "employee_lookup"), plan.toolNames());
        }

        @Test
        @DisplayName("lists prerequisites and unbound parameters")
        void prerequisitesAndUnbound() {
            var step = PlanStep.pending("step-2", "reimbursement_summary", Map.of(
                            "start_date", ArgumentValue.literal("2024-03-01")))
                    .withArgument("employee_id", ArgumentValue.reference("step-1", "employee_id"))
                    .withArgument("end_date", ArgumentValue.UNBOUND);

            assertEquals(Set.of("step-1"), step.prerequisites());
            assertEquals(List.of("end_date"), step.unboundParameters());
            assertFalse(step.argument("category").isBound());
        }

        @Test
        @DisplayName("isOrdered detects references to later or missing steps")
        void isOrdered() {
            var lookup = PlanStep.pending("step-1", "employee_lookup", Map.of());
            var summary = PlanStep.pending("step-2", "reimbursement_summary",
                    Map.of("employee_id", ArgumentValue.reference("step-1", "employee_id")));
            var dangling = PlanStep.pending("step-3", "reimbursement_status",
                    Map.of("employee_id", ArgumentValue.reference("step-9", "employee_id")));

            assertTrue(Plan.of(List.of(lookup, summary)).isOrdered());
            assertFalse(Plan.of(List.of(summary, lookup)).isOrdered());
            assertFalse(Plan.of(List.of(lookup, dangling)).isOrdered());
        }

        @Test
        @DisplayName("failed and succeeded copies carry status and retries")
        void statusTransitions() {
            var step = PlanStep.pending("step-1", "employee_lookup", Map.of());
            var failed = step.failed(StepError.of(ErrorKind.TRANSIENT, "down"), 2);
            var ok = step.succeeded(1);

            assertEquals(StepStatus.FAILED_TERMINAL, failed.status());
            assertTrue(failed.status().isTerminal());
            assertEquals(2, failed.retries());
            assertEquals(StepStatus.SUCCEEDED, ok.status());
            assertNull(ok.error());

            var retrying = step.withStatus(StepStatus.RUNNING).retrying(StepError.of(ErrorKind.TRANSIENT, "busy"), 1);
            assertEquals(StepStatus.FAILED_RETRYABLE, retrying.status());
            assertFalse(retrying.status().isTerminal());
            assertEquals(1, retrying.retries());
            assertEquals(ErrorKind.TRANSIENT, retrying.error().kind());
            assertNull(retrying.succeeded(1).error());
        }
    }

    @Nested
    @DisplayName("ToolSpec")
    class ToolSpecTests {

        @Test
        @DisplayName("rejects a default for a parameter that is not optional")
        void rejectsUnknownDefault() {
            assertThrows(IllegalArgumentException.class, () -> new ToolSpec("t", "T", "d",
                    List.of("subject"), List.of(), Map.of("subject", "x"), List.of(),
                    ToolCategory.DATA, SideEffect.READ_ONLY));
        }

        @Test
        @DisplayName("answers requires, accepts and exportsParameter")
        void queries() {
            var spec = new ToolSpec("compose_content", "Draft", "d",
                    List.of("subject"), List.of("tone"), Map.of("tone", "professional"), List.of("body"),
                    ToolCategory.GENERATION, SideEffect.READ_ONLY);

            assertTrue(spec.requires("subject"));
            assertTrue(spec.accepts("tone"));
            assertFalse(spec.accepts("priority"));
            assertTrue(spec.exportsParameter("body"));
            assertEquals("professional", spec.defaultFor("tone").orElseThrow());
        }
    }

    @Nested
    @DisplayName("ErrorKind")
    class ErrorKindTests {

        @Test
        @DisplayName("only parameter and transient failures are retryable")
        void retryable() {
            assertTrue(ErrorKind.PARAMETER_INVALID.retryable());
            assertTrue(ErrorKind.TRANSIENT.retryable());
            assertFalse(ErrorKind.ENTITY_NOT_FOUND.retryable());
            assertFalse(ErrorKind.EXTERNAL_MUTATION_UNCERTAIN.retryable());
            assertFalse(ErrorKind.PRECONDITION_FAILED.retryable());
        }

        @Test
        @DisplayName("infrastructure detail is not user-facing")
        void userFacingDetail() {
            assertTrue(ErrorKind.ENTITY_NOT_FOUND.userFacingDetail());
            assertFalse(ErrorKind.TRANSIENT.userFacingDetail());
            assertFalse(ErrorKind.INTERNAL_FAULT.userFacingDetail());
        }

        @Test
        @DisplayName("SideEffect reports whether repeating is safe")
        void sideEffect() {
            assertTrue(SideEffect.READ_ONLY.safeToRepeat());
            assertTrue(SideEffect.IDEMPOTENT_BY_KEY.safeToRepeat());
            assertFalse(SideEffect.MUTATING.safeToRepeat());
        }
    }

    @Test
    @DisplayName("plans survive Java serialization")
    void planIsSerializable() throws Exception {
        var plan = Plan.of(List.of(PlanStep.pending("step-1", "reimbursement_summary", Map.of(
                "employee_id", ArgumentValue.reference("step-0", "employee_id"),
                "start_date", ArgumentValue.literal("2024-03-01"),
                "end_date", ArgumentValue.UNBOUND))));

        var bytes = new ByteArrayOutputStream();
        try (var out = new ObjectOutputStream(bytes)) {
            out.writeObject(plan);
        }
        try (var in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            var copy = (Plan) in.readObject();
            assertEquals(plan, copy);
        }
    }
}
