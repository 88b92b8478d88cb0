package com.ledgerwise.records;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to reimbursement claims.
 */
public interface ReimbursementLedger {

    /**
     * Claims of one employee submitted within {@code [from, to]}. A null bound
     * is open.
     */
    List<Reimbursement> findByEmployee(String employeeId, LocalDate from, LocalDate to);
}
