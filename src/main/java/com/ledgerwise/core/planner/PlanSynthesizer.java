package com.ledgerwise.core.planner;

import com.ledgerwise.core.model.ArgumentValue;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.Intent;
import com.ledgerwise.core.model.Plan;
import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.TaskFacet;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a {@link Classification} into a draft {@link Plan}: picks tools from
 * the intent's family, orders them by priority and binds what the request
 * entities already supply. Dependencies between steps are left to
 * {@link DependencyResolver}.
 */
@Component
public class PlanSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(PlanSynthesizer.class);

    /** Tools each intent may draw from. */
    static final Map<Intent, List<String>> TOOL_FAMILIES = Map.of(
            Intent.SIMPLE_LOOKUP, List.of("policy_search", "employee_lookup"),
            Intent.DATA_QUERY, List.of("employee_lookup", "reimbursement_summary",
                    "reimbursement_status", "reimbursement_records"),
            Intent.CONTENT_GENERATION, List.of("compose_content"),
            Intent.COMPOSITE_TASK, List.of("employee_lookup", "policy_search", "reimbursement_summary",
                    "reimbursement_status", "reimbursement_records", "compose_content",
                    "create_work_order", "send_email"));

    /** Tool used when no facet of the request selects one from the family. */
    static final Map<Intent, String> DEFAULT_TOOLS = Map.of(
            Intent.SIMPLE_LOOKUP, "policy_search",
            Intent.DATA_QUERY, "reimbursement_summary",
            Intent.CONTENT_GENERATION, "compose_content",
            Intent.COMPOSITE_TASK, "policy_search");

    static final Map<String, TaskFacet> TOOL_FACETS = Map.of(
            "employee_lookup", TaskFacet.EMPLOYEE_PROFILE,
            "policy_search", TaskFacet.POLICY,
            "reimbursement_summary", TaskFacet.EXPENSE_SUMMARY,
            "reimbursement_status", TaskFacet.EXPENSE_STATUS,
            "reimbursement_records", TaskFacet.EXPENSE_RECORDS,
            "compose_content", TaskFacet.DRAFT,
            "create_work_order", TaskFacet.WORK_ORDER,
            "send_email", TaskFacet.EMAIL);

    /** Lookups before data, data before generation, generation before actions. */
    static final List<String> PRIORITY_ORDER = List.of(
            "employee_lookup", "policy_search", "reimbursement_summary", "reimbursement_status",
            "reimbursement_records", "compose_content", "create_work_order", "send_email");

    private final ToolRegistry registry;

    public PlanSynthesizer(ToolRegistry registry) {
        this.registry = registry;
    }

    /**
     * Builds the draft plan. Steps get ids {@code step-1}, {@code step-2}, ...
     * in plan order. Two steps with the same tool and the same bindings are
     * collapsed into one.
     */
    public Plan synthesize(Classification classification) {
        List<String> family = TOOL_FAMILIES.get(classification.intent());
        List<String> selected = new ArrayList<>();
        for (String tool : PRIORITY_ORDER) {
            if (family.contains(tool)
                    && classification.facets().contains(TOOL_FACETS.get(tool))
                    && registry.lookup(tool).isPresent()) {
                selected.add(tool);
            }
        }
        if (selected.isEmpty()) {
            String fallback = DEFAULT_TOOLS.get(classification.intent());
            if (registry.lookup(fallback).isPresent()) {
                selected.add(fallback);
            }
        }

        List<PlanStep> steps = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String tool : selected) {
            Optional<ToolSpec> spec = registry.lookup(tool);
            if (spec.isEmpty()) {
                continue;
            }
            Map<String, ArgumentValue> arguments = ArgumentBinding.fromEntities(spec.get(), classification.entities());
            if (seen.add(tool + arguments)) {
                steps.add(PlanStep.pending("step-" + (steps.size() + 1), tool, arguments));
            }
        }
        Plan plan = Plan.of(steps);
        log.info("Synthesized {}-step plan for {}: {}", plan.size(), classification.intent(), plan.toolNames());
        return plan;
    }
}
