package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.records.EmployeeDirectory;
import com.ledgerwise.records.Reimbursement;
import com.ledgerwise.records.ReimbursementLedger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists an employee's claims in full.
 */
@Component
public class ReimbursementRecordsTool extends ReimbursementTool {

    public static final String NAME = "reimbursement_records";

    private static final ToolSpec SPEC = new ToolSpec(
            NAME,
            "Reimbursement records",
            "Lists an employee's reimbursement claims with amounts, descriptions and dates",
            List.of("employee_id"),
            List.of("start_date", "end_date", "status"),
            Map.of(),
            List.of(),
            ToolCategory.DATA,
            SideEffect.READ_ONLY);

    public ReimbursementRecordsTool(EmployeeDirectory directory, ReimbursementLedger ledger) {
        super(directory, ledger);
    }

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException {
        Query query = query(arguments, false);
        List<Reimbursement> claims = claims(query);
        String who = query.employee().name() + " (" + query.employee().employeeId() + ")";
        String summary = claims.isEmpty()
                ? "No claims found for " + who + " from " + query.period() + "."
                : claims.size() + " claim" + (claims.size() == 1 ? "" : "s") + " for " + who
                        + " from " + query.period() + ":\n" + claims.stream()
                        .map(ReimbursementRecordsTool::describe)
                        .collect(Collectors.joining("\n"));
        return new ToolOutput(summary, Map.of("claim_count", claims.size()), Map.of(), origin(query), null);
    }

    private static String describe(Reimbursement r) {
        return "- " + r.reimbursementId() + " | " + r.submittedOn() + " | " + r.category() + " | "
                + money(r.amount()) + " | " + r.status() + " | " + r.description();
    }
}
