package com.ledgerwise.core.aggregate;

import com.ledgerwise.core.llm.LlmService;
import com.ledgerwise.core.model.AggregatedAnswer;
import com.ledgerwise.core.model.Intent;
import com.ledgerwise.core.model.Plan;
import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.model.SourceAttribution;
import com.ledgerwise.core.model.StepError;
import com.ledgerwise.core.model.StepResult;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.core.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines step results into the user-facing answer.
 * <p>
 * Successful outputs are grouped into sections by {@link ToolCategory}. The
 * language model composes the answer from those sections and the list of
 * unfinished sub-tasks; if it fails, the sections are returned as they are.
 * Failed and unattempted steps are always
 * listed with a plain-language reason. When nothing succeeded the answer is
 * a fixed apology that lists the reasons, and the model is not called.
 */
@Component
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    static final int EXCERPT_LENGTH = 240;
    static final String UNFINISHED_HEADING = "Could not complete";

    private static final String SYSTEM_PROMPT = """
            You are Ledgerwise, an assistant for finance and HR staff.
            Answer the user's request using only the information in the sections provided.
            Keep figures, ids and dates exactly as given. Do not add facts that are not in the sections.
            Be brief and use plain language. Do not mention tools, steps or sections.
            If a "Could not complete" list is given, end the answer with that list exactly as given.
            """;

    private final LlmService llmService;
    private final ToolRegistry registry;

    public ResultAggregator(LlmService llmService, ToolRegistry registry) {
        this.llmService = llmService;
        this.registry = registry;
    }

    /**
     * Builds the answer for an executed plan.
     *
     * @param requestId        request being answered
     * @param request          original request text
     * @param intent           classified intent
     * @param plan             the executed plan
     * @param results          results of the steps that ran, in plan order
     * @param cancelled        whether execution stopped on cancellation
     * @param stepLimitReached whether execution stopped at the step limit
     */
    public AggregatedAnswer aggregate(String requestId, String request, Intent intent, Plan plan,
                                      List<StepResult> results, boolean cancelled, boolean stepLimitReached) {
        Map<String, StepResult> byStep = new LinkedHashMap<>();
        results.forEach(r -> byStep.put(r.stepId(), r));

        Map<ToolCategory, List<String>> sections = new EnumMap<>(ToolCategory.class);
        List<SourceAttribution> sources = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (PlanStep step : plan.steps()) {
            StepResult result = byStep.get(step.id());
            if (result == null) {
                failures.add(titleOf(step.toolName()) + ": not attempted because "
                        + (cancelled ? "the request was cancelled"
                        : stepLimitReached ? "the step limit for one request was reached"
                        : "execution stopped early"));
            } else if (!result.success()) {
                failures.add(describeFailure(result));
            } else {
                ToolCategory category = registry.lookup(step.toolName())
                        .map(ToolSpec::category)
                        .orElse(ToolCategory.DATA);
                sections.computeIfAbsent(category, c -> new ArrayList<>()).add(result.output().summary());
                if (result.output().origin() != null) {
                    sources.add(new SourceAttribution(result.output().origin(),
                            excerpt(result.output().summary()), result.output().confidence()));
                }
            }
        }

        String text;
        if (sections.isEmpty()) {
            text = apology(failures);
            log.info("Request {} produced no successful step; returning apology", requestId);
        } else {
            text = compose(request, sectionsText(sections), unfinishedText(failures));
        }
        return new AggregatedAnswer(requestId, text, sources, results, intent, RequestStatus.DONE, failures);
    }

    /**
     * Builds the answer for a plan that was rejected before execution.
     */
    public AggregatedAnswer rejection(String requestId, Intent intent, String reason) {
        String text = "I can't carry out this request: " + reason
                + ". Please rephrase it or provide the missing details.";
        return new AggregatedAnswer(requestId, text, List.of(), List.of(), intent, RequestStatus.REJECTED,
                List.of(reason));
    }

    /**
     * The model sees the sections and the unfinished list. The list is
     * appended verbatim when the model dropped it or could not be reached.
     */
    private String compose(String request, String sections, String unfinished) {
        String composed;
        try {
            composed = llmService.generate(SYSTEM_PROMPT, "Request: " + request + "\n\n" + sections + unfinished);
        } catch (RuntimeException e) {
            log.warn("Answer composition failed, returning raw sections: {}", e.getMessage());
            return "Here is what I found for your request.\n\n" + sections + unfinished;
        }
        if (!unfinished.isEmpty() && !composed.contains(UNFINISHED_HEADING + ":")) {
            return composed + unfinished;
        }
        return composed;
    }

    private String describeFailure(StepResult result) {
        StepError error = result.error();
        String line = titleOf(result.toolName()) + ": " + error.kind().reason();
        if (error.kind().userFacingDetail() && error.message() != null && !error.message().isBlank()) {
            line += " (" + error.message() + ")";
        }
        return line;
    }

    static String sectionsText(Map<ToolCategory, List<String>> sections) {
        var sb = new StringBuilder();
        sections.forEach((category, excerpts) -> {
            sb.append("## ").append(category.heading()).append('\n');
            excerpts.forEach(excerpt -> sb.append(excerpt.strip()).append("\n\n"));
        });
        return sb.toString().strip();
    }

    static String unfinishedText(List<String> failures) {
        if (failures.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder("\n\n").append(UNFINISHED_HEADING).append(":\n");
        failures.forEach(f -> sb.append("- ").append(f).append('\n'));
        return sb.toString().stripTrailing();
    }

    static String apology(List<String> failures) {
        var sb = new StringBuilder("I'm sorry, I couldn't complete your request.");
        if (!failures.isEmpty()) {
            sb.append("\n\nWhat went wrong:\n");
            failures.forEach(f -> sb.append("- ").append(f).append('\n'));
        }
        return sb.toString().stripTrailing();
    }

    private String titleOf(String toolName) {
        return registry.lookup(toolName).map(ToolSpec::title).orElse(toolName);
    }

    private static String excerpt(String text) {
        String flat = text.strip().replaceAll("\\s+", " ");
        return flat.length() <= EXCERPT_LENGTH ? flat : flat.substring(0, EXCERPT_LENGTH - 3) + "...";
    }
}
