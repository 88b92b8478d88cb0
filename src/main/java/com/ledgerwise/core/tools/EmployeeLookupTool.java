package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.records.Employee;
import com.ledgerwise.records.EmployeeDirectory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Looks an employee up by id or by name. Exports the identifiers later steps
 * need: the employee id (also as {@code assignee_id}) and the email address
 * (as {@code to_email}).
 */
@Component
public class EmployeeLookupTool implements Tool {

    public static final String NAME = "employee_lookup";

    private static final ToolSpec SPEC = new ToolSpec(
            NAME,
            "Employee lookup",
            "Finds an employee by id or name and returns department, position and email",
            List.of(),
            List.of("employee_id", "employee_name"),
            Map.of(),
            List.of("employee_id", "employee_name", "department", "to_email", "assignee_id"),
            ToolCategory.DATA,
            SideEffect.READ_ONLY);

    private final EmployeeDirectory directory;

    public EmployeeLookupTool(EmployeeDirectory directory) {
        this.directory = directory;
    }

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException {
        String id = ToolArguments.optionalText(arguments, "employee_id");
        String name = ToolArguments.optionalText(arguments, "employee_name");
        Employee employee;
        if (id != null) {
            employee = directory.findById(id)
                    .orElseThrow(() -> ToolInvocationException.notFound("No employee has id " + id));
        } else if (name != null) {
            employee = byName(name);
        } else {
            throw ToolInvocationException.invalid("employee_name",
                    "An employee id or employee name is needed to look an employee up");
        }

        var data = new LinkedHashMap<String, Object>();
        data.put("employee_id", employee.employeeId());
        data.put("employee_name", employee.name());
        data.put("department", employee.department());
        data.put("position", employee.position());
        data.put("email", employee.email());

        var exports = new LinkedHashMap<String, Object>();
        exports.put("employee_id", employee.employeeId());
        exports.put("employee_name", employee.name());
        exports.put("department", employee.department());
        exports.put("to_email", employee.email());
        exports.put("assignee_id", employee.employeeId());

        String summary = employee.name() + " (" + employee.employeeId() + "), " + employee.position()
                + ", " + employee.department() + " department, " + employee.email();
        return new ToolOutput(summary, data, exports, "employees/" + employee.employeeId(), null);
    }

    private Employee byName(String name) throws ToolInvocationException {
        List<Employee> matches = directory.findByName(name);
        if (matches.isEmpty()) {
            throw ToolInvocationException.notFound("No employee named '" + name + "' could be found");
        }
        if (matches.size() > 1) {
            String candidates = matches.stream()
                    .map(e -> e.name() + " (" + e.employeeId() + ")")
                    .collect(Collectors.joining(", "));
            throw ToolInvocationException.notFound(
                    "'" + name + "' matches several employees: " + candidates + "; please give the employee id");
        }
        return matches.get(0);
    }
}
