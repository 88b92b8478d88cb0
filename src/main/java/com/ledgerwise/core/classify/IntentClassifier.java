package com.ledgerwise.core.classify;

import com.ledgerwise.core.llm.LlmService;
import com.ledgerwise.core.model.Classification;
import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.EntityKind;
import com.ledgerwise.core.model.Intent;
import com.ledgerwise.core.model.IntentAnalysis;
import com.ledgerwise.core.model.TaskFacet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a request into an {@link Intent}, a set of {@link TaskFacet}s
 * and an {@link EntityBag}.
 * <p>
 * The language model does the classification; {@link EntityExtractor} and
 * {@link FacetKeywordDetector} run alongside it. Identifiers, dates and email
 * addresses always come from the pattern extractor when it found them. When
 * the model call fails the request is classified as
 * {@link Intent#COMPOSITE_TASK} with pattern-extracted entities only.
 */
@Component
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private static final String SYSTEM_PROMPT = """
            You are the request classifier for Ledgerwise, an assistant for finance and HR staff.
            Classify the user's request:
            - intent: one of
              "SIMPLE_LOOKUP" (a policy question or a single fact about an employee),
              "DATA_QUERY" (reimbursement totals, statuses or records),
              "COMPOSITE_TASK" (several steps, or any action such as a work order or an email),
              "CONTENT_GENERATION" (drafting a notice or message without sending it)
            - facets: every item that applies out of "POLICY", "EMPLOYEE_PROFILE", "EXPENSE_SUMMARY",
              "EXPENSE_STATUS", "EXPENSE_RECORDS", "DRAFT", "WORK_ORDER", "EMAIL"
            - employeeName, employeeId (like E001), startDate and endDate (yyyy-MM-dd, inclusive),
              subject (a short topic), recipient (an email address), priority (low, medium, high, urgent),
              category (travel, meals, office_supplies, training for expenses; general, finance, hr, it for work orders)
            Leave a field null when the request does not state it. Never invent employee ids or email addresses.

            Respond with valid JSON matching the schema provided.
            """;

    private static final Set<EntityKind> PATTERN_AUTHORITATIVE =
            EnumSet.of(EntityKind.EMPLOYEE_ID, EntityKind.START_DATE, EntityKind.END_DATE, EntityKind.RECIPIENT);
    private static final Pattern EMPLOYEE_ID = Pattern.compile("^[Ee]\\d{3,6}$");
    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Set<String> PRIORITIES = Set.of("low", "medium", "high", "urgent");
    private static final Set<String> PRONOUNS = Set.of("i", "me", "my", "myself", "you", "he", "she", "they", "them");

    private final LlmService llmService;
    private final EntityExtractor entityExtractor;

    public IntentClassifier(LlmService llmService, EntityExtractor entityExtractor) {
        this.llmService = llmService;
        this.entityExtractor = entityExtractor;
    }

    /**
     * Classifies the request. Never throws for model failures.
     *
     * @param request request text
     * @return the classification
     */
    public Classification classify(String request) {
        EntityBag extracted = entityExtractor.extract(request);
        Set<TaskFacet> detectedFacets = FacetKeywordDetector.detect(request);

        IntentAnalysis analysis;
        try {
            analysis = llmService.structuredCall(SYSTEM_PROMPT, request, IntentAnalysis.class);
        } catch (RuntimeException e) {
            log.warn("Intent classification failed, falling back to COMPOSITE_TASK: {}", e.getMessage());
            return new Classification(Intent.COMPOSITE_TASK, extracted, detectedFacets);
        }
        if (analysis == null) {
            log.warn("Intent classification returned nothing, falling back to COMPOSITE_TASK");
            return new Classification(Intent.COMPOSITE_TASK, extracted, detectedFacets);
        }

        Intent intent = Intent.fromLabel(analysis.intent());
        Set<TaskFacet> facets = facetsOf(analysis.facets());
        if (facets.isEmpty()) {
            facets = detectedFacets;
        }
        EntityBag entities = merge(toEntityBag(analysis), extracted);
        log.info("Classified request as {} with facets {} and {} entities", intent, facets, entities.size());
        return new Classification(intent, entities, facets);
    }

    /**
     * Combines model and pattern entities. Pattern values win for kinds in
     * {@link #PATTERN_AUTHORITATIVE}; the model wins elsewhere. Dates are
     * taken as a pair from a single source.
     */
    static EntityBag merge(EntityBag fromModel, EntityBag fromPatterns) {
        EntityBag merged = fromModel.orElse(fromPatterns);
        boolean patternDates = fromPatterns.has(EntityKind.START_DATE);
        for (EntityKind kind : PATTERN_AUTHORITATIVE) {
            if (fromPatterns.has(kind)) {
                merged = merged.with(kind, fromPatterns.get(kind).orElseThrow());
            } else if (patternDates && (kind == EntityKind.START_DATE || kind == EntityKind.END_DATE)) {
                merged = merged.without(kind);
            }
        }
        return merged;
    }

    private static Set<TaskFacet> facetsOf(List<String> labels) {
        var facets = EnumSet.noneOf(TaskFacet.class);
        if (labels != null) {
            for (String label : labels) {
                TaskFacet.fromLabel(label).ifPresent(facets::add);
            }
        }
        return facets;
    }

    /** Validates each model field before it becomes an entity; invalid values are dropped. */
    private static EntityBag toEntityBag(IntentAnalysis analysis) {
        var values = new EnumMap<EntityKind, String>(EntityKind.class);
        if (analysis.employeeName() != null && !PRONOUNS.contains(analysis.employeeName().trim().toLowerCase(Locale.ROOT))) {
            values.put(EntityKind.EMPLOYEE_NAME, analysis.employeeName());
        }
        if (analysis.employeeId() != null && EMPLOYEE_ID.matcher(analysis.employeeId().trim()).matches()) {
            values.put(EntityKind.EMPLOYEE_ID, analysis.employeeId().trim().toUpperCase(Locale.ROOT));
        }
        var start = DateRanges.normalizeDate(analysis.startDate());
        var end = DateRanges.normalizeDate(analysis.endDate());
        if (start.isPresent() && end.isPresent() && !start.get().isAfter(end.get())) {
            values.put(EntityKind.START_DATE, DateRanges.format(start.get()));
            values.put(EntityKind.END_DATE, DateRanges.format(end.get()));
        }
        if (analysis.subject() != null) {
            String subject = analysis.subject().trim();
            values.put(EntityKind.SUBJECT, subject.length() <= EntityExtractor.MAX_SUBJECT_LENGTH
                    ? subject : subject.substring(0, EntityExtractor.MAX_SUBJECT_LENGTH));
        }
        if (analysis.recipient() != null && EMAIL.matcher(analysis.recipient().trim()).matches()) {
            values.put(EntityKind.RECIPIENT, analysis.recipient().trim().toLowerCase(Locale.ROOT));
        }
        if (analysis.priority() != null && PRIORITIES.contains(analysis.priority().trim().toLowerCase(Locale.ROOT))) {
            values.put(EntityKind.PRIORITY, analysis.priority().trim().toLowerCase(Locale.ROOT));
        }
        if (analysis.category() != null) {
            values.put(EntityKind.CATEGORY, analysis.category().trim().toLowerCase(Locale.ROOT).replace(' ', '_'));
        }
        return new EntityBag(values);
    }
}
