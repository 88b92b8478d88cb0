package com.ledgerwise.records;

import java.time.Instant;

/**
 * A follow-up task assigned to an employee.
 *
 * @param workOrderId unique id, e.g. WO20240315-0001
 * @param subject     what needs doing
 * @param assigneeId  employee id of the assignee
 * @param priority    low, medium, high or urgent
 * @param category    general, finance, hr or it
 * @param status      open, in_progress or closed
 * @param createdAt   creation time
 */
public record WorkOrder(
    String workOrderId,
    String subject,
    String assigneeId,
    String priority,
    String category,
    String status,
    Instant createdAt
) {

    public boolean isActive() {
        return "open".equals(status) || "in_progress".equals(status);
    }
}
