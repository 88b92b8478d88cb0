package com.ledgerwise.core.classify;

import com.ledgerwise.core.model.EntityBag;
import com.ledgerwise.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic, pattern-based entity extraction. Runs on every request and
 * is the only source of entities when the language model is unavailable.
 */
@Component
public class EntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(EntityExtractor.class);

    static final int MAX_SUBJECT_LENGTH = 200;

    private static final Pattern EMPLOYEE_ID = Pattern.compile("\\b[Ee](\\d{3,6})\\b");
    private static final Pattern EMAIL =
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern QUOTED = Pattern.compile("[\"“]([^\"”]{2,200})[\"”]");
    private static final Pattern POSSESSIVE_NAME =
            Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)['’]s\\b");
    private static final Pattern CUED_NAME = Pattern.compile(
            "\\b(?:for|of|about|employee|colleague|to|by|from)\\s+([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)?)\\b");
    private static final Pattern FIRST_PERSON = Pattern.compile("\\b(?:[Mm]y|[Mm]e|[Mm]ine|I)\\b");
    private static final Pattern STATUS = Pattern.compile(
            "\\b(pending|approved|rejected|paid)\\s+(?:claims?|reimbursements?|expenses?|records?)\\b");
    private static final Pattern URGENT = Pattern.compile("\\b(?:urgent|urgently|asap)\\b");
    private static final Pattern LEVELLED_PRIORITY = Pattern.compile("\\b(low|medium|high)[- ]priority\\b");

    private static final List<Map.Entry<Pattern, String>> CATEGORIES = List.of(
            Map.entry(Pattern.compile("\\b(?:travel|trip|flights?|hotels?)\\b"), "travel"),
            Map.entry(Pattern.compile("\\b(?:meals?|dinners?|lunch(?:es)?|catering)\\b"), "meals"),
            Map.entry(Pattern.compile("\\b(?:office supplies|stationery)\\b"), "office_supplies"),
            Map.entry(Pattern.compile("\\b(?:training|courses?)\\b"), "training"));

    private static final Set<String> NOT_NAMES = Set.of(
            "january", "february", "march", "april", "may", "june", "july", "august", "september",
            "october", "november", "december", "monday", "tuesday", "wednesday", "thursday", "friday",
            "please", "the", "what", "show", "send", "create", "draft", "write", "email", "policy",
            "finance", "hr", "it", "travel", "meals", "urgent", "team", "all", "everyone", "our", "their",
            "q1", "q2", "q3", "q4", "i", "me", "my", "this", "last", "next");

    private final Clock clock;
    private final CurrentUserProperties currentUser;

    public EntityExtractor(Clock clock, CurrentUserProperties currentUser) {
        this.clock = clock;
        this.currentUser = currentUser;
    }

    /**
     * Extracts entities from the request text.
     *
     * @param text request text
     * @return the extracted entities; never null
     */
    public EntityBag extract(String text) {
        if (text == null || text.isBlank()) {
            return EntityBag.empty();
        }
        var values = new EnumMap<EntityKind, String>(EntityKind.class);

        Matcher id = EMPLOYEE_ID.matcher(text);
        if (id.find()) {
            values.put(EntityKind.EMPLOYEE_ID, "E" + id.group(1));
        }
        employeeName(text).ifPresent(name -> values.put(EntityKind.EMPLOYEE_NAME, name));

        if (!values.containsKey(EntityKind.EMPLOYEE_ID) && !values.containsKey(EntityKind.EMPLOYEE_NAME)
                && currentUser.isConfigured() && FIRST_PERSON.matcher(text).find()) {
            values.put(EntityKind.EMPLOYEE_ID, currentUser.getEmployeeId().trim().toUpperCase(Locale.ROOT));
            if (currentUser.getName() != null && !currentUser.getName().isBlank()) {
                values.put(EntityKind.EMPLOYEE_NAME, currentUser.getName().trim());
            }
        }

        DateRanges.parse(text, LocalDate.now(clock)).ifPresent(range -> {
            values.put(EntityKind.START_DATE, DateRanges.format(range.start()));
            values.put(EntityKind.END_DATE, DateRanges.format(range.end()));
        });

        Matcher email = EMAIL.matcher(text);
        if (email.find()) {
            values.put(EntityKind.RECIPIENT, email.group().toLowerCase(Locale.ROOT));
        }

        String lower = text.toLowerCase(Locale.ROOT);
        Matcher levelled = LEVELLED_PRIORITY.matcher(lower);
        if (URGENT.matcher(lower).find()) {
            values.put(EntityKind.PRIORITY, "urgent");
        } else if (levelled.find()) {
            values.put(EntityKind.PRIORITY, levelled.group(1));
        }
        for (var category : CATEGORIES) {
            if (category.getKey().matcher(lower).find()) {
                values.put(EntityKind.CATEGORY, category.getValue());
                break;
            }
        }
        Matcher status = STATUS.matcher(lower);
        if (status.find()) {
            values.put(EntityKind.STATUS, status.group(1));
        }

        values.put(EntityKind.SUBJECT, subject(text));

        var bag = new EntityBag(values);
        log.debug("Extracted {} entities: {}", bag.size(), bag.values().keySet());
        return bag;
    }

    private Optional<String> employeeName(String text) {
        for (Pattern pattern : new Pattern[] {POSSESSIVE_NAME, CUED_NAME}) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = matcher.group(1);
                String firstWord = candidate.split("\\s+")[0].toLowerCase(Locale.ROOT);
                if (!NOT_NAMES.contains(firstWord)) {
                    return Optional.of(trimTrailingNonName(candidate));
                }
            }
        }
        return Optional.empty();
    }

    private static String trimTrailingNonName(String candidate) {
        String[] words = candidate.split("\\s+");
        if (words.length == 2 && NOT_NAMES.contains(words[1].toLowerCase(Locale.ROOT))) {
            return words[0];
        }
        return candidate;
    }

    private static String subject(String text) {
        Matcher quoted = QUOTED.matcher(text);
        if (quoted.find()) {
            return quoted.group(1).trim();
        }
        String collapsed = text.trim().replaceAll("\\s+", " ");
        return collapsed.length() <= MAX_SUBJECT_LENGTH ? collapsed : collapsed.substring(0, MAX_SUBJECT_LENGTH);
    }
}
