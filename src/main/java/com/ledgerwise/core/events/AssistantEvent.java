package com.ledgerwise.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a request is processed, used by the CLI's verbose
 * mode.
 *
 * @param eventType event type, e.g. "request.received", "step.retrying", "plan.rejected"
 * @param requestId the request this event belongs to
 * @param stepId    the plan step this event relates to; null for request-level events
 * @param payload   event details
 * @param timestamp when the event occurred
 */
public record AssistantEvent(
    String eventType,
    String requestId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AssistantEvent of(String eventType, String requestId, String stepId, Map<String, Object> payload) {
        return new AssistantEvent(eventType, requestId, stepId, payload, Instant.now());
    }
}
