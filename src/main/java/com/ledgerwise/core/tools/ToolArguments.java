package com.ledgerwise.core.tools;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Typed, validating reads of tool arguments. Every failure is a
 * {@code PARAMETER_INVALID} naming the parameter.
 */
final class ToolArguments {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Pattern EMPLOYEE_ID = Pattern.compile("^E\\d{3,6}$");

    private ToolArguments() {}

    static String requireText(Map<String, Object> arguments, String name) throws ToolInvocationException {
        Object value = arguments.get(name);
        if (value == null || value.toString().isBlank()) {
            throw ToolInvocationException.invalid(name, "Missing required parameter '" + name + "'");
        }
        return value.toString().trim();
    }

    static String optionalText(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        return value == null || value.toString().isBlank() ? null : value.toString().trim();
    }

    static LocalDate requireDate(Map<String, Object> arguments, String name) throws ToolInvocationException {
        return parseDate(name, requireText(arguments, name));
    }

    static LocalDate optionalDate(Map<String, Object> arguments, String name) throws ToolInvocationException {
        String raw = optionalText(arguments, name);
        return raw == null ? null : parseDate(name, raw);
    }

    static String requireEmployeeId(Map<String, Object> arguments, String name) throws ToolInvocationException {
        String id = requireText(arguments, name);
        if (!EMPLOYEE_ID.matcher(id).matches()) {
            throw ToolInvocationException.invalid(name, "'" + id + "' is not an employee id like E001");
        }
        return id;
    }

    static String requireEmail(Map<String, Object> arguments, String name) throws ToolInvocationException {
        String address = requireText(arguments, name);
        if (!EMAIL.matcher(address).matches()) {
            throw ToolInvocationException.invalid(name, "'" + address + "' is not a valid email address");
        }
        return address;
    }

    static String oneOf(Map<String, Object> arguments, String name, Set<String> allowed)
            throws ToolInvocationException {
        String value = optionalText(arguments, name);
        if (value != null && !allowed.contains(value)) {
            throw ToolInvocationException.invalid(name,
                    "'" + value + "' is not a valid " + name + "; expected one of " + allowed);
        }
        return value;
    }

    static int optionalInt(Map<String, Object> arguments, String name, int fallback) throws ToolInvocationException {
        String raw = optionalText(arguments, name);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw ToolInvocationException.invalid(name, "'" + raw + "' is not a number");
        }
    }

    static void checkRange(LocalDate start, LocalDate end) throws ToolInvocationException {
        if (start != null && end != null && start.isAfter(end)) {
            throw ToolInvocationException.invalid("start_date",
                    "Start date " + start + " is after end date " + end);
        }
    }

    private static LocalDate parseDate(String name, String raw) throws ToolInvocationException {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw ToolInvocationException.invalid(name, "'" + raw + "' is not a date in yyyy-MM-dd format");
        }
    }
}
