package com.ledgerwise.records;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A reimbursement claim.
 *
 * @param reimbursementId unique id, e.g. R20240315001
 * @param employeeId      claimant
 * @param amount          claimed amount
 * @param category        travel, meals, office_supplies or training
 * @param description     free-text description
 * @param status          pending, approved, rejected or paid
 * @param submittedOn     submission date
 * @param processedOn     approval, rejection or payment date; null while pending
 */
public record Reimbursement(
    String reimbursementId,
    String employeeId,
    BigDecimal amount,
    String category,
    String description,
    String status,
    LocalDate submittedOn,
    LocalDate processedOn
) {}
