package com.ledgerwise.records;

/**
 * Creates work orders. Opening is idempotent by (assignee, subject): an active
 * work order with the same key is returned instead of a duplicate.
 */
public interface WorkOrderDesk {

    /**
     * @param order   the open work order for this key
     * @param created false when an existing active work order was returned
     */
    record Receipt(WorkOrder order, boolean created) {}

    Receipt open(String subject, String assigneeId, String priority, String category);
}
