package com.ledgerwise.core.classify;

import com.ledgerwise.core.model.TaskFacet;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scans request text for keywords that indicate which {@link TaskFacet}s a
 * request asks for.
 * <p>
 * Used by {@link IntentClassifier} when the language model returns no facets
 * or cannot be reached at all.
 */
public final class FacetKeywordDetector {

    private record FacetPattern(TaskFacet facet, List<String> keywords) {}

    private static final List<FacetPattern> FACET_PATTERNS = List.of(
            new FacetPattern(TaskFacet.POLICY,
                    List.of("policy", "policies", "rule", "rules", "allowed", "eligible", "eligibility",
                            "limit", "limits", "reimbursable", "allowance", "regulation", "standard")),
            new FacetPattern(TaskFacet.EMPLOYEE_PROFILE,
                    List.of("department", "profile", "who is", "contact details", "position", "job title")),
            new FacetPattern(TaskFacet.EXPENSE_SUMMARY,
                    List.of("summary", "summarise", "summarize", "total", "how much", "spent", "spending")),
            new FacetPattern(TaskFacet.EXPENSE_STATUS,
                    List.of("status", "approved", "pending", "rejected", "paid out", "been paid")),
            new FacetPattern(TaskFacet.EXPENSE_RECORDS,
                    List.of("records", "claims", "list", "details", "history", "itemised", "itemized")),
            new FacetPattern(TaskFacet.DRAFT,
                    List.of("draft", "write", "compose", "notice", "announcement", "message")),
            new FacetPattern(TaskFacet.WORK_ORDER,
                    List.of("work order", "ticket", "follow up", "follow-up", "task for", "assign")),
            new FacetPattern(TaskFacet.EMAIL,
                    List.of("email", "e-mail", "send", "mail to", "notify"))
    );

    private FacetKeywordDetector() {} // utility class

    /**
     * Returns the facets whose keywords occur in {@code text}. Matching is
     * case-insensitive and on word boundaries.
     *
     * @param text request text
     * @return detected facets, empty if none matched or the text is blank
     */
    public static Set<TaskFacet> detect(String text) {
        var detected = EnumSet.noneOf(TaskFacet.class);
        if (text == null || text.isBlank()) {
            return detected;
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        for (var pattern : FACET_PATTERNS) {
            for (String keyword : pattern.keywords()) {
                if (matchesKeyword(lowerText, keyword)) {
                    detected.add(pattern.facet());
                    break;
                }
            }
        }
        return detected;
    }

    private static boolean matchesKeyword(String lowerText, String keyword) {
        return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lowerText).find();
    }
}
