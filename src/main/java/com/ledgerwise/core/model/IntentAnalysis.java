package com.ledgerwise.core.model;

import java.util.List;

/**
 * Structured output requested from the language model when classifying a
 * request. Every field is optional; the classifier validates each one before
 * it reaches the entity bag.
 *
 * @param intent       one of SIMPLE_LOOKUP, DATA_QUERY, COMPOSITE_TASK, CONTENT_GENERATION
 * @param facets       task facet labels, see {@link TaskFacet}
 * @param employeeName full name of the employee the request is about
 * @param employeeId   employee id such as E001
 * @param startDate    ISO start of the period, yyyy-MM-dd
 * @param endDate      ISO end of the period, yyyy-MM-dd
 * @param subject      short topic of the request
 * @param recipient    email address to send to
 * @param priority     low, medium, high or urgent
 * @param category     expense or work order category
 */
public record IntentAnalysis(
    String intent,
    List<String> facets,
    String employeeName,
    String employeeId,
    String startDate,
    String endDate,
    String subject,
    String recipient,
    String priority,
    String category
) {}
