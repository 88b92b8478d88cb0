package com.ledgerwise.core.executor;

import com.ledgerwise.core.engine.EngineProperties;
import com.ledgerwise.core.events.AssistantEvent;
import com.ledgerwise.core.events.EventBus;
import com.ledgerwise.core.logging.MdcContext;
import com.ledgerwise.core.metrics.AssistantMetrics;
import com.ledgerwise.core.model.ArgumentValue;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.InternalFaultException;
import com.ledgerwise.core.model.PlanStep;
import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.StepError;
import com.ledgerwise.core.model.StepResult;
import com.ledgerwise.core.model.StepStatus;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.core.tools.Tool;
import com.ledgerwise.core.tools.ToolInvocationException;
import com.ledgerwise.core.tools.ToolRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a single plan step.
 * <p>
 * Binding: literals are used as-is, back-references read the named export of
 * an earlier successful step, unbound parameters are filled from the request
 * entities, and missing optional parameters get the tool's defaults. A
 * back-reference to a step that failed fails this step with
 * {@link ErrorKind#PRECONDITION_FAILED} without invoking the tool.
 * <p>
 * Retries: a retryable failure is repaired by {@link ParameterRepairer} and
 * retried, up to {@code maxRetries} re-invocations. Identity parameters keep
 * their original values across repairs. A timeout or unexpected exception
 * from a {@link SideEffect#MUTATING} tool is classified
 * {@link ErrorKind#EXTERNAL_MUTATION_UNCERTAIN}, which is never retried. A
 * missing or invalid parameter that no repair changes fails at once.
 * <p>
 * Lifecycle: pending, then running for each attempt, failed-retryable between
 * attempts, and finally succeeded or failed-terminal. Every transition is
 * published with the step's status. A broken engine invariant, such as a tool
 * returning no output, throws {@link InternalFaultException} and aborts the
 * request.
 */
@Component
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    /** Parameters that name the entity a step acts on. */
    static final Set<String> IDENTITY_PARAMETERS = Set.of("employee_id", "employee_name", "assignee_id", "to_email");

    private final ToolRegistry registry;
    private final ParameterRepairer repairer;
    private final EngineProperties properties;
    private final EventBus eventBus;
    private final AssistantMetrics metrics;
    private final ExecutorService invoker;

    public StepExecutor(ToolRegistry registry, ParameterRepairer repairer, EngineProperties properties,
                        EventBus eventBus, AssistantMetrics metrics) {
        this.registry = registry;
        this.repairer = repairer;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        var threadCount = new AtomicInteger();
        this.invoker = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "tool-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Executes {@code step}.
     *
     * @param requestId    owning request, for logging and events
     * @param step         the step to execute
     * @param entities     request entities for filling unbound parameters
     * @param priorResults results of earlier steps by step id
     * @return the step with its terminal status, and its result
     */
    public StepOutcome execute(String requestId, PlanStep step, EntityBag entities,
                               Map<String, StepResult> priorResults) {
        Tool tool = registry.find(step.toolName())
                .orElseThrow(() -> new InternalFaultException("Step " + step.id()
                        + " references unregistered tool " + step.toolName()));
        ToolSpec spec = tool.spec();
        MdcContext.setStep(requestId, step.id(), spec.name());
        long start = System.currentTimeMillis();
        try {
            if (step.status() == StepStatus.FAILED_TERMINAL) {
                if (step.error() == null) {
                    throw new InternalFaultException("Step " + step.id() + " was marked failed without an error");
                }
                return failed(requestId, step, step.error(), 0, start);
            }

            Map<String, Object> arguments;
            try {
                arguments = bind(step, spec, entities, priorResults);
            } catch (ToolInvocationException e) {
                log.info("Step {} ({}) skipped: {}", step.id(), spec.name(), e.getMessage());
                return failed(requestId, step, e.toStepError(), 0, start);
            }
            Map<String, Object> original = Map.copyOf(arguments);

            PlanStep current = step;
            int retries = 0;
            while (true) {
                current = current.withStatus(StepStatus.RUNNING);
                publish("step.started", requestId, current, Map.of(
                        "tool", spec.name(), "attempt", retries + 1, "status", current.status().name()));
                StepError error;
                try {
                    String missing = firstMissingRequired(spec, arguments);
                    if (missing != null) {
                        throw ToolInvocationException.invalid(missing,
                                "Missing required parameter '" + missing + "' for " + spec.title());
                    }
                    ToolOutput output = invokeOnce(tool, arguments);
                    log.info("Step {} ({}) succeeded after {} retries", step.id(), spec.name(), retries);
                    metrics.recordStepExecution(spec.name(), "succeeded", System.currentTimeMillis() - start);
                    PlanStep succeeded = current.succeeded(retries);
                    publish("step.completed", requestId, succeeded, Map.of(
                            "tool", spec.name(), "retries", retries, "status", succeeded.status().name()));
                    return new StepOutcome(succeeded, StepResult.succeeded(step, output, retries));
                } catch (ToolInvocationException e) {
                    error = e.toStepError();
                }

                if (!error.kind().retryable() || retries >= properties.getMaxRetries()) {
                    return failed(requestId, current, error, retries, start);
                }
                Map<String, Object> repaired = preserveIdentity(original,
                        repairer.repair(spec, arguments, error, entities));
                if (error.kind() == ErrorKind.PARAMETER_INVALID && repaired.equals(arguments)) {
                    log.info("Step {} ({}) not retried: no repair applies to {}", step.id(), spec.name(),
                            error.message());
                    return failed(requestId, current, error, retries, start);
                }
                retries++;
                current = current.retrying(error, retries);
                log.warn("Step {} ({}) failed with {}: {}; retry {}/{}", step.id(), spec.name(), error.kind(),
                        error.message(), retries, properties.getMaxRetries());
                metrics.recordRetry(spec.name(), error.kind().name());
                publish("step.retrying", requestId, current, Map.of(
                        "tool", spec.name(), "error", error.kind().name(), "attempt", retries + 1,
                        "status", current.status().name()));
                arguments = repaired;
            }
        } finally {
            MdcContext.clearStep();
        }
    }

    private StepOutcome failed(String requestId, PlanStep step, StepError error, int retries, long start) {
        log.warn("Step {} ({}) failed terminally with {}: {}", step.id(), step.toolName(), error.kind(), error.message());
        metrics.recordStepExecution(step.toolName(), error.kind().name(), System.currentTimeMillis() - start);
        PlanStep failedStep = step.failed(error, retries);
        publish("step.failed", requestId, failedStep, Map.of("tool", step.toolName(), "error", error.kind().name(),
                "status", failedStep.status().name()));
        return new StepOutcome(failedStep, StepResult.failed(step, error, retries));
    }

    /** Resolves every argument binding to a value. */
    Map<String, Object> bind(PlanStep step, ToolSpec spec, EntityBag entities, Map<String, StepResult> priorResults)
            throws ToolInvocationException {
        var arguments = new LinkedHashMap<String, Object>();
        for (var entry : step.arguments().entrySet()) {
            String parameter = entry.getKey();
            ArgumentValue value = entry.getValue();
            if (value instanceof ArgumentValue.Literal literal) {
                if (literal.value() != null) {
                    arguments.put(parameter, literal.value());
                }
            } else if (value instanceof ArgumentValue.BackReference ref) {
                StepResult prior = priorResults.get(ref.stepId());
                if (prior == null || !prior.success()) {
                    String producer = prior == null ? ref.stepId() : titleOf(prior.toolName());
                    throw new ToolInvocationException(ErrorKind.PRECONDITION_FAILED,
                            producer + " did not succeed, so '" + parameter + "' is unknown", parameter);
                }
                Object exported = prior.exports().get(ref.export());
                if (exported == null) {
                    throw new ToolInvocationException(ErrorKind.PRECONDITION_FAILED,
                            titleOf(prior.toolName()) + " did not return '" + ref.export() + "'", parameter);
                }
                arguments.put(parameter, exported);
            } else {
                entities.forParameter(parameter).ifPresent(v -> arguments.put(parameter, v));
            }
        }
        for (String parameter : spec.optionalParameters()) {
            if (!arguments.containsKey(parameter)) {
                spec.defaultFor(parameter).ifPresent(v -> arguments.put(parameter, v));
            }
        }
        return arguments;
    }

    private static String firstMissingRequired(ToolSpec spec, Map<String, Object> arguments) {
        for (String parameter : spec.requiredParameters()) {
            Object value = arguments.get(parameter);
            if (value == null || value.toString().isBlank()) {
                return parameter;
            }
        }
        return null;
    }

    /**
     * Puts back every identity value of the first attempt that a repair
     * changed or removed.
     */
    static Map<String, Object> preserveIdentity(Map<String, Object> original, Map<String, Object> repaired) {
        var result = new LinkedHashMap<>(repaired);
        for (String parameter : IDENTITY_PARAMETERS) {
            Object before = original.get(parameter);
            if (before == null) {
                continue;
            }
            Object after = result.get(parameter);
            if (after == null || !sameIdentity(before, after)) {
                log.warn("Repair tried to change identity parameter '{}' from '{}' to '{}'; keeping original",
                        parameter, before, after);
                result.put(parameter, before);
            }
        }
        return result;
    }

    private static boolean sameIdentity(Object before, Object after) {
        return Objects.equals(before, after)
                || before.toString().trim().equalsIgnoreCase(after.toString().trim());
    }

    /** One invocation under the step timeout, on a pool thread carrying the caller's MDC. */
    private ToolOutput invokeOnce(Tool tool, Map<String, Object> arguments) throws ToolInvocationException {
        SideEffect sideEffect = tool.spec().sideEffect();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Map<String, Object> readOnly = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        Future<ToolOutput> future = invoker.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return tool.invoke(readOnly);
            } finally {
                MDC.clear();
            }
        });
        long timeoutMs = properties.getStepTimeout().toMillis();
        try {
            ToolOutput output = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (output == null) {
                throw new InternalFaultException(tool.name() + " returned no output");
            }
            return output;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolInvocationException(uncertainIfMutating(sideEffect),
                    tool.name() + " did not respond within " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ToolInvocationException tie) {
                throw tie;
            }
            log.error("Tool {} threw unexpectedly: {}", tool.name(), cause == null ? e.getMessage() : cause.toString(), cause);
            throw new ToolInvocationException(uncertainIfMutating(sideEffect),
                    tool.name() + " failed unexpectedly", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(uncertainIfMutating(sideEffect),
                    tool.name() + " was interrupted", e);
        }
    }

    private static ErrorKind uncertainIfMutating(SideEffect sideEffect) {
        return sideEffect == SideEffect.MUTATING ? ErrorKind.EXTERNAL_MUTATION_UNCERTAIN : ErrorKind.TRANSIENT;
    }

    private String titleOf(String toolName) {
        return registry.lookup(toolName).map(ToolSpec::title).orElse(toolName);
    }

    private void publish(String type, String requestId, PlanStep step, Map<String, Object> payload) {
        eventBus.publish(AssistantEvent.of(type, requestId, step.id(), payload));
    }

    @PreDestroy
    void shutdown() {
        invoker.shutdownNow();
    }
}
