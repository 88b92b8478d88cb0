package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.records.EmployeeDirectory;
import com.ledgerwise.records.Reimbursement;
import com.ledgerwise.records.ReimbursementLedger;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Totals an employee's claims over a period, broken down by category and
 * status.
 */
@Component
public class ReimbursementSummaryTool extends ReimbursementTool {

    public static final String NAME = "reimbursement_summary";

    private static final ToolSpec SPEC = new ToolSpec(
            NAME,
            "Reimbursement summary",
            "Totals an employee's reimbursement claims for a period by category and status",
            List.of("employee_id", "start_date", "end_date"),
            List.of("category"),
            Map.of(),
            List.of("total_amount", "claim_count"),
            ToolCategory.DATA,
            SideEffect.READ_ONLY);

    public ReimbursementSummaryTool(EmployeeDirectory directory, ReimbursementLedger ledger) {
        super(directory, ledger);
    }

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException {
        Query query = query(arguments, true);
        String category = ToolArguments.optionalText(arguments, "category");
        List<Reimbursement> claims = claims(query).stream()
                .filter(r -> category == null || category.equalsIgnoreCase(r.category()))
                .toList();

        BigDecimal total = claims.stream().map(Reimbursement::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
        Map<String, BigDecimal> byCategory = new TreeMap<>();
        Map<String, Long> byStatus = new TreeMap<>();
        for (Reimbursement claim : claims) {
            byCategory.merge(claim.category(), claim.amount(), BigDecimal::add);
            byStatus.merge(claim.status(), 1L, Long::sum);
        }

        String who = query.employee().name() + " (" + query.employee().employeeId() + ")";
        String summary;
        if (claims.isEmpty()) {
            summary = who + " has no reimbursement claims" + (category == null ? "" : " for " + category)
                    + " from " + query.period() + ".";
        } else {
            summary = who + " claimed " + money(total) + " across " + claims.size() + " claim"
                    + (claims.size() == 1 ? "" : "s") + " from " + query.period() + ". By category: "
                    + byCategory.entrySet().stream().map(e -> e.getKey() + " " + money(e.getValue()))
                            .collect(Collectors.joining(", "))
                    + ". By status: "
                    + byStatus.entrySet().stream().map(e -> e.getValue() + " " + e.getKey())
                            .collect(Collectors.joining(", "))
                    + ".";
        }

        var data = new LinkedHashMap<String, Object>();
        data.put("employee_id", query.employee().employeeId());
        data.put("total_amount", money(total));
        data.put("claim_count", claims.size());
        data.put("by_category", byCategory.entrySet().stream()
                .map(e -> e.getKey() + "=" + money(e.getValue())).collect(Collectors.joining(",")));
        return new ToolOutput(summary, data,
                Map.of("total_amount", money(total), "claim_count", String.valueOf(claims.size())),
                origin(query), null);
    }
}
