package com.ledgerwise.core.classify;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date expressions that appear in finance requests: explicit
 * dates, month names, quarters, halves and relative months.
 */
public final class DateRanges {

    /** An inclusive date range. */
    public record DateRange(LocalDate start, LocalDate end) {}

    private static final Pattern NUMERIC_DATE =
            Pattern.compile("\\b(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})\\b");
    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
    private static final Pattern QUARTER =
            Pattern.compile("\\b(?:q([1-4])|([1-4])(?:st|nd|rd|th) quarter)\\b(?:\\s+(?:of\\s+)?((?:19|20)\\d{2}))?");
    private static final Pattern HALF =
            Pattern.compile("\\b(?:(first|second) half|h([12]))\\b(?:\\s+(?:of\\s+)?((?:19|20)\\d{2}))?");
    private static final Pattern MONTH_NAME = Pattern.compile(
            "\\b(january|february|march|april|may|june|july|august|september|october|november|december)\\b"
                    + "(?:\\s+(?:of\\s+)?((?:19|20)\\d{2}))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY_YEAR = Pattern.compile(
            "\\b(january|february|march|april|may|june|july|august|september|october|november|december)"
                    + "\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+((?:19|20)\\d{2})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile(
            "\\b(\\d{1,2})\\s+(january|february|march|april|may|june|july|august|september|october|november|december)"
                    + ",?\\s+((?:19|20)\\d{2})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPACT_DATE = Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})$");

    private DateRanges() {} // utility class

    /**
     * Finds the date range a request refers to.
     *
     * @param text  request text
     * @param today reference date for relative and year-less expressions
     * @return the range, or empty if the text names no period
     */
    public static Optional<DateRange> parse(String text, LocalDate today) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<LocalDate> explicit = explicitDates(text);
        if (explicit.size() >= 2) {
            LocalDate first = explicit.get(0);
            LocalDate second = explicit.get(1);
            return Optional.of(first.isAfter(second) ? new DateRange(second, first) : new DateRange(first, second));
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int defaultYear = YEAR.matcher(lower).results().findFirst()
                .map(m -> Integer.parseInt(m.group()))
                .orElse(today.getYear());

        Matcher quarter = QUARTER.matcher(lower);
        if (quarter.find()) {
            int q = Integer.parseInt(quarter.group(1) != null ? quarter.group(1) : quarter.group(2));
            int year = quarter.group(3) != null ? Integer.parseInt(quarter.group(3)) : defaultYear;
            YearMonth first = YearMonth.of(year, (q - 1) * 3 + 1);
            return Optional.of(new DateRange(first.atDay(1), first.plusMonths(2).atEndOfMonth()));
        }
        Matcher half = HALF.matcher(lower);
        if (half.find()) {
            boolean firstHalf = "first".equals(half.group(1)) || "1".equals(half.group(2));
            int year = half.group(3) != null ? Integer.parseInt(half.group(3)) : defaultYear;
            return Optional.of(firstHalf
                    ? new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 6, 30))
                    : new DateRange(LocalDate.of(year, 7, 1), LocalDate.of(year, 12, 31)));
        }
        if (lower.contains("last month") || lower.contains("previous month")) {
            YearMonth previous = YearMonth.from(today).minusMonths(1);
            return Optional.of(new DateRange(previous.atDay(1), previous.atEndOfMonth()));
        }
        if (lower.contains("this month") || lower.contains("current month")) {
            YearMonth current = YearMonth.from(today);
            return Optional.of(new DateRange(current.atDay(1), current.atEndOfMonth()));
        }
        Optional<YearMonth> month = monthIn(text, defaultYear);
        if (month.isPresent()) {
            return Optional.of(new DateRange(month.get().atDay(1), month.get().atEndOfMonth()));
        }
        if (explicit.size() == 1) {
            return Optional.of(new DateRange(explicit.get(0), explicit.get(0)));
        }
        if (lower.contains("this year")) {
            return Optional.of(new DateRange(LocalDate.of(today.getYear(), 1, 1), LocalDate.of(today.getYear(), 12, 31)));
        }
        return Optional.empty();
    }

    /**
     * Normalizes a single date written in any supported format to a date.
     * Accepts {@code 2024-03-05}, {@code 2024/3/5}, {@code 2024.03.05},
     * {@code 20240305}, {@code March 5, 2024} and {@code 5 March 2024}.
     */
    public static Optional<LocalDate> normalizeDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        Matcher compact = COMPACT_DATE.matcher(trimmed);
        if (compact.matches()) {
            return dateOf(compact.group(1), compact.group(2), compact.group(3));
        }
        List<LocalDate> dates = explicitDates(trimmed);
        return dates.isEmpty() ? Optional.empty() : Optional.of(dates.get(0));
    }

    /**
     * Reads a month expression such as {@code March 2024} as a whole month.
     */
    public static Optional<YearMonth> monthIn(String text, int defaultYear) {
        Matcher month = MONTH_NAME.matcher(text);
        while (month.find()) {
            String name = month.group(1);
            // "may" is a modal verb far more often than a month
            if ("may".equalsIgnoreCase(name) && !name.equals("May")) {
                continue;
            }
            int year = month.group(2) != null ? Integer.parseInt(month.group(2)) : defaultYear;
            return Optional.of(YearMonth.of(year, Month.valueOf(name.toUpperCase(Locale.ROOT))));
        }
        return Optional.empty();
    }

    public static String format(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    public static String describe(YearMonth month) {
        return month.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + month.getYear();
    }

    private static List<LocalDate> explicitDates(String text) {
        var dates = new ArrayList<LocalDate>();
        Matcher numeric = NUMERIC_DATE.matcher(text);
        while (numeric.find()) {
            dateOf(numeric.group(1), numeric.group(2), numeric.group(3)).ifPresent(dates::add);
        }
        Matcher monthDayYear = MONTH_DAY_YEAR.matcher(text);
        while (monthDayYear.find()) {
            dateOf(monthDayYear.group(3), monthNumber(monthDayYear.group(1)), monthDayYear.group(2)).ifPresent(dates::add);
        }
        Matcher dayMonthYear = DAY_MONTH_YEAR.matcher(text);
        while (dayMonthYear.find()) {
            dateOf(dayMonthYear.group(3), monthNumber(dayMonthYear.group(2)), dayMonthYear.group(1)).ifPresent(dates::add);
        }
        return dates;
    }

    private static String monthNumber(String name) {
        return String.valueOf(Month.valueOf(name.toUpperCase(Locale.ROOT)).getValue());
    }

    private static Optional<LocalDate> dateOf(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }
}
