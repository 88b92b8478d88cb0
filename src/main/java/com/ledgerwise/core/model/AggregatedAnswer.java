package com.ledgerwise.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final answer returned for a request.
 *
 * @param requestId   the request this answers
 * @param text        user-facing answer text
 * @param sources     attributions for the content in {@code text}
 * @param stepResults per-step results in plan order
 * @param intent      classified intent
 * @param status      DONE or REJECTED
 * @param failures    plain-language reasons for steps that did not succeed
 */
public record AggregatedAnswer(
    String requestId,
    String text,
    List<SourceAttribution> sources,
    List<StepResult> stepResults,
    Intent intent,
    RequestStatus status,
    List<String> failures
) implements Serializable {

    public AggregatedAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean fullySucceeded() {
        return status == RequestStatus.DONE && failures.isEmpty();
    }
}
