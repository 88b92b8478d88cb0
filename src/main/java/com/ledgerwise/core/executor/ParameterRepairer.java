package com.ledgerwise.core.executor;

import com.ledgerwise.core.classify.DateRanges;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.StepError;
import com.ledgerwise.core.model.ToolSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic argument repairs applied before a retry.
 * <p>
 * Repairs never invent identity values; {@link StepExecutor} additionally
 * restores any identity parameter a repair changed.
 */
@Component
public class ParameterRepairer {

    private static final Logger log = LoggerFactory.getLogger(ParameterRepairer.class);

    static final Set<String> DATE_PARAMETERS = Set.of("start_date", "end_date");
    static final Set<String> ID_PARAMETERS = Set.of("employee_id", "assignee_id");
    static final Set<String> EMAIL_PARAMETERS = Set.of("to_email", "cc_email");

    private static final Map<String, String> PRIORITY_SYNONYMS = Map.of(
            "critical", "urgent", "asap", "urgent", "immediate", "urgent",
            "normal", "medium", "standard", "medium", "med", "medium",
            "hi", "high", "lo", "low");

    private final Clock clock;

    public ParameterRepairer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns repaired arguments for the next attempt. The input map is not
     * modified.
     *
     * @param spec      the tool's spec
     * @param arguments arguments of the failed attempt
     * @param error     the failure being retried
     * @param entities  request entities, used to fill gaps
     */
    public Map<String, Object> repair(ToolSpec spec, Map<String, Object> arguments, StepError error, EntityBag entities) {
        var repaired = new LinkedHashMap<>(arguments);

        for (String parameter : spec.requiredParameters()) {
            if (isBlank(repaired.get(parameter))) {
                entities.forParameter(parameter).ifPresent(value -> repaired.put(parameter, value));
            }
        }
        for (String parameter : ID_PARAMETERS) {
            if (repaired.get(parameter) instanceof String id) {
                repaired.put(parameter, id.trim().toUpperCase(Locale.ROOT));
            }
        }
        for (String parameter : EMAIL_PARAMETERS) {
            if (repaired.get(parameter) instanceof String address) {
                repaired.put(parameter, address.trim().toLowerCase(Locale.ROOT));
            }
        }
        repairDates(repaired);
        if (repaired.get("priority") instanceof String priority) {
            String normalized = priority.trim().toLowerCase(Locale.ROOT);
            repaired.put("priority", PRIORITY_SYNONYMS.getOrDefault(normalized, normalized));
        }

        if (error != null && error.kind() == ErrorKind.PARAMETER_INVALID && error.parameter() != null) {
            resetOffendingOptional(spec, repaired, error.parameter());
        }

        if (!repaired.equals(arguments)) {
            log.info("Repaired arguments for {}: {} -> {}", spec.name(), arguments, repaired);
        }
        return repaired;
    }

    private void repairDates(Map<String, Object> arguments) {
        for (String parameter : DATE_PARAMETERS) {
            if (!(arguments.get(parameter) instanceof String raw)) {
                continue;
            }
            Optional<LocalDate> date = DateRanges.normalizeDate(raw);
            if (date.isEmpty()) {
                Optional<YearMonth> month = DateRanges.monthIn(raw, LocalDate.now(clock).getYear());
                if (month.isPresent()) {
                    date = Optional.of("start_date".equals(parameter)
                            ? month.get().atDay(1)
                            : month.get().atEndOfMonth());
                }
            }
            date.ifPresent(d -> arguments.put(parameter, DateRanges.format(d)));
        }
        if (arguments.get("start_date") instanceof String start && arguments.get("end_date") instanceof String end
                && DateRanges.normalizeDate(start).isPresent() && DateRanges.normalizeDate(end).isPresent()
                && start.compareTo(end) > 0) {
            arguments.put("start_date", end);
            arguments.put("end_date", start);
        }
    }

    /**
     * An optional, non-identity parameter the tool rejected falls back to its
     * default, or is dropped when it has none.
     */
    private void resetOffendingOptional(ToolSpec spec, Map<String, Object> arguments, String parameter) {
        if (!spec.optionalParameters().contains(parameter) || StepExecutor.IDENTITY_PARAMETERS.contains(parameter)) {
            return;
        }
        Optional<String> fallback = spec.defaultFor(parameter);
        if (fallback.isPresent()) {
            arguments.put(parameter, fallback.get());
        } else {
            arguments.remove(parameter);
        }
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
