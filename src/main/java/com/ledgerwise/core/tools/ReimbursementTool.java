package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.records.Employee;
import com.ledgerwise.records.EmployeeDirectory;
import com.ledgerwise.records.Reimbursement;
import com.ledgerwise.records.ReimbursementLedger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared argument handling for the reimbursement tools.
 */
abstract class ReimbursementTool implements Tool {

    static final Set<String> STATUSES = Set.of("pending", "approved", "rejected", "paid");

    /** A validated ledger query. */
    record Query(Employee employee, LocalDate start, LocalDate end, String status) {

        String period() {
            if (start == null && end == null) {
                return "all dates";
            }
            return (start == null ? "the beginning" : start.toString())
                    + " to " + (end == null ? "today" : end.toString());
        }
    }

    private final EmployeeDirectory directory;
    private final ReimbursementLedger ledger;

    ReimbursementTool(EmployeeDirectory directory, ReimbursementLedger ledger) {
        this.directory = directory;
        this.ledger = ledger;
    }

    Query query(Map<String, Object> arguments, boolean datesRequired) throws ToolInvocationException {
        String employeeId = ToolArguments.requireEmployeeId(arguments, "employee_id");
        LocalDate start = datesRequired
                ? ToolArguments.requireDate(arguments, "start_date")
                : ToolArguments.optionalDate(arguments, "start_date");
        LocalDate end = datesRequired
                ? ToolArguments.requireDate(arguments, "end_date")
                : ToolArguments.optionalDate(arguments, "end_date");
        ToolArguments.checkRange(start, end);
        String status = ToolArguments.oneOf(arguments, "status", STATUSES);
        Employee employee = directory.findById(employeeId)
                .orElseThrow(() -> ToolInvocationException.notFound("No employee has id " + employeeId));
        return new Query(employee, start, end, status);
    }

    List<Reimbursement> claims(Query query) throws ToolInvocationException {
        try {
            return ledger.findByEmployee(query.employee().employeeId(), query.start(), query.end()).stream()
                    .filter(r -> query.status() == null || query.status().equals(r.status()))
                    .toList();
        } catch (RuntimeException e) {
            throw new ToolInvocationException(ErrorKind.TRANSIENT, "Reimbursement ledger is unavailable", e);
        }
    }

    static String money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    static String origin(Query query) {
        return "reimbursements/" + query.employee().employeeId();
    }
}
