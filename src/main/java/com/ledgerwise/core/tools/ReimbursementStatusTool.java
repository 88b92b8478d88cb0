package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.records.EmployeeDirectory;
import com.ledgerwise.records.Reimbursement;
import com.ledgerwise.records.ReimbursementLedger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports where each of an employee's claims stands.
 */
@Component
public class ReimbursementStatusTool extends ReimbursementTool {

    public static final String NAME = "reimbursement_status";

    private static final ToolSpec SPEC = new ToolSpec(
            NAME,
            "Reimbursement status",
            "Shows the approval status of an employee's reimbursement claims",
            List.of("employee_id"),
            List.of("start_date", "end_date", "status"),
            Map.of(),
            List.of("pending_count"),
            ToolCategory.DATA,
            SideEffect.READ_ONLY);

    public ReimbursementStatusTool(EmployeeDirectory directory, ReimbursementLedger ledger) {
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
        long pending = claims.stream().filter(r -> "pending".equals(r.status())).count();

        String who = query.employee().name() + " (" + query.employee().employeeId() + ")";
        String summary = claims.isEmpty()
                ? who + " has no " + (query.status() == null ? "" : query.status() + " ")
                        + "claims from " + query.period() + "."
                : who + ", claims from " + query.period() + ":\n" + claims.stream()
                        .map(r -> "- " + r.reimbursementId() + " " + r.category() + " " + money(r.amount())
                                + ": " + r.status()
                                + (r.processedOn() == null ? "" : " on " + r.processedOn()))
                        .collect(Collectors.joining("\n"));

        var data = new LinkedHashMap<String, Object>();
        data.put("claim_count", claims.size());
        data.put("pending_count", pending);
        return new ToolOutput(summary, data, Map.of("pending_count", String.valueOf(pending)), origin(query), null);
    }
}
