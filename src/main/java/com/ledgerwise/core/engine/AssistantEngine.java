package com.ledgerwise.core.engine;

import com.ledgerwise.core.events.AssistantEvent;
import com.ledgerwise.core.events.EventBus;
import com.ledgerwise.core.graph.AssistantGraph;
import com.ledgerwise.core.logging.MdcContext;
import com.ledgerwise.core.metrics.AssistantMetrics;
import com.ledgerwise.core.model.AggregatedAnswer;
import com.ledgerwise.core.model.InternalFaultException;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.state.AssistantState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for processing a request. Runs the {@link AssistantGraph} to
 * completion and returns the answer.
 * <p>
 * Requests are independent; several may run concurrently.
 */
@Service
public class AssistantEngine {

    private static final Logger log = LoggerFactory.getLogger(AssistantEngine.class);
    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final AtomicInteger requestCounter = new AtomicInteger(0);
    private final AssistantGraph graph;
    private final CancellationRegistry cancellations;
    private final EventBus eventBus;
    private final AssistantMetrics metrics;

    public AssistantEngine(AssistantGraph graph, CancellationRegistry cancellations,
                           EventBus eventBus, AssistantMetrics metrics) {
        this.graph = graph;
        this.cancellations = cancellations;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public AggregatedAnswer run(String request) {
        return run(generateRequestId(), request);
    }

    /**
     * Processes a request under a caller-chosen id.
     *
     * @param requestId id used for logging, events and cancellation
     * @param request   request text
     * @return the answer; status DONE or REJECTED
     * @throws IllegalArgumentException if the request is blank
     * @throws InternalFaultException   if the graph failed; the request is FAULTED
     */
    public AggregatedAnswer run(String requestId, String request) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("Request text must not be blank");
        }
        MdcContext.setRequest(requestId);
        cancellations.register(requestId);
        long start = System.currentTimeMillis();
        try {
            log.info("Processing request {}: {}", requestId, request);
            eventBus.publish(AssistantEvent.of("request.received", requestId, null, Map.of("request", request)));

            Map<String, Object> initialState = Map.of(
                    "requestId", requestId,
                    "request", request,
                    "status", RequestStatus.RECEIVED.name()
            );
            var config = RunnableConfig.builder()
                    .threadId(requestId)
                    .build();

            AggregatedAnswer answer;
            try {
                AssistantState finalState = graph.getCompiledGraph().invoke(initialState, config)
                        .orElseThrow(() -> new InternalFaultException(
                                "Graph execution returned empty state for request " + requestId));
                answer = finalState.answer()
                        .orElseThrow(() -> new InternalFaultException("No answer produced for request " + requestId));
            } catch (RuntimeException e) {
                throw fault(requestId, e);
            }

            metrics.recordRequestResult(answer.status().name());
            metrics.recordRequestDuration(System.currentTimeMillis() - start);
            eventBus.publish(AssistantEvent.of("request.completed", requestId, null, Map.of(
                    "status", answer.status().name(),
                    "failures", answer.failures().size())));
            log.info("Request {} finished with status {} ({} failures)", requestId, answer.status(),
                    answer.failures().size());
            return answer;
        } finally {
            cancellations.release(requestId);
            MdcContext.clear();
        }
    }

    /**
     * Requests cancellation of an in-flight request. Steps not yet started are
     * skipped; the answer covers what completed.
     *
     * @return false if no such request is in flight
     */
    public boolean cancel(String requestId) {
        boolean cancelled = cancellations.cancel(requestId);
        if (cancelled) {
            log.info("Cancellation requested for {}", requestId);
        }
        return cancelled;
    }

    public String generateRequestId() {
        return "LW-" + LocalDate.now().format(ID_DATE) + "-" + String.format("%04d", requestCounter.incrementAndGet());
    }

    private InternalFaultException fault(String requestId, RuntimeException e) {
        log.error("Request {} faulted: {}", requestId, e.getMessage(), e);
        metrics.recordRequestResult(RequestStatus.FAULTED.name());
        eventBus.publish(AssistantEvent.of("request.faulted", requestId, null,
                Map.of("error", String.valueOf(e.getMessage()))));
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof InternalFaultException internal) {
                return internal;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return new InternalFaultException("Request " + requestId + " failed: " + e.getMessage(), e);
    }
}
