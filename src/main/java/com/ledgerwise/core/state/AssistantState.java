package com.ledgerwise.core.state;

import com.ledgerwise.core.model.AggregatedAnswer;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.Plan;
import com.ledgerwise.core.model.RequestStatus;
import com.ledgerwise.core.model.StepResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one request.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Every channel
 * is last-write-wins; the execute node writes the full step result list at
 * once.
 */
public class AssistantState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("requestId",          Channels.base(() -> "")),
        Map.entry("request",            Channels.base(() -> "")),
        Map.entry("status",             Channels.base(() -> RequestStatus.RECEIVED.name())),
        Map.entry("classification",     Channels.base((Reducer<Classification>) null)),
        Map.entry("plan",               Channels.base((Reducer<Plan>) null)),
        Map.entry("stepResults",        Channels.base((Supplier<List<StepResult>>) List::of)),
        Map.entry("executionCancelled", Channels.base(() -> false)),
        Map.entry("stepLimitReached",   Channels.base(() -> false)),
        Map.entry("rejectionReason",    Channels.base(() -> "")),
        Map.entry("answer",             Channels.base((Reducer<AggregatedAnswer>) null))
    );

    public AssistantState(Map<String, Object> initData) {
        super(initData);
    }

    public String requestId() {
        return this.<String>value("requestId").orElse("");
    }

    public String request() {
        return this.<String>value("request").orElse("");
    }

    public RequestStatus status() {
        String raw = this.<String>value("status").orElse(RequestStatus.RECEIVED.name());
        return RequestStatus.valueOf(raw);
    }

    public Optional<Classification> classification() {
        return value("classification");
    }

    public Plan plan() {
        return this.<Plan>value("plan").orElse(Plan.empty());
    }

    public List<StepResult> stepResults() {
        return this.<List<StepResult>>value("stepResults").orElse(List.of());
    }

    public boolean executionCancelled() {
        return this.<Boolean>value("executionCancelled").orElse(false);
    }

    public boolean stepLimitReached() {
        return this.<Boolean>value("stepLimitReached").orElse(false);
    }

    public String rejectionReason() {
        return this.<String>value("rejectionReason").orElse("");
    }

    public Optional<AggregatedAnswer> answer() {
        return value("answer");
    }
}
