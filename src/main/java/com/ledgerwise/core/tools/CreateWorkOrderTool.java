package com.ledgerwise.core.tools;

import com.ledgerwise.core.model.ErrorKind;
import com.ledgerwise.core.model.SideEffect;
import com.ledgerwise.core.model.ToolCategory;
import com.ledgerwise.core.model.ToolOutput;
import com.ledgerwise.core.model.ToolSpec;
import com.ledgerwise.records.EmployeeDirectory;
import com.ledgerwise.records.WorkOrder;
import com.ledgerwise.records.WorkOrderDesk;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Opens a work order for an employee. Opening twice with the same assignee
 * and subject returns the existing active order.
 */
@Component
public class CreateWorkOrderTool implements Tool {

    public static final String NAME = "create_work_order";

    static final Set<String> PRIORITIES = Set.of("low", "medium", "high", "urgent");
    static final Set<String> CATEGORIES = Set.of("general", "finance", "hr", "it");

    private static final ToolSpec SPEC = new ToolSpec(
            NAME,
            "Work order",
            "Opens a follow-up work order assigned to an employee",
            List.of("subject", "assignee_id"),
            List.of("priority", "category"),
            Map.of("priority", "medium", "category", "general"),
            List.of("work_order_id"),
            ToolCategory.ACTION,
            SideEffect.IDEMPOTENT_BY_KEY);

    private final WorkOrderDesk desk;
    private final EmployeeDirectory directory;

    public CreateWorkOrderTool(WorkOrderDesk desk, EmployeeDirectory directory) {
        this.desk = desk;
        this.directory = directory;
    }

    @Override
    public ToolSpec spec() {
        return SPEC;
    }

    @Override
    public ToolOutput invoke(Map<String, Object> arguments) throws ToolInvocationException {
        String subject = ToolArguments.requireText(arguments, "subject");
        String assigneeId = ToolArguments.requireEmployeeId(arguments, "assignee_id");
        String priority = ToolArguments.oneOf(arguments, "priority", PRIORITIES);
        String category = ToolArguments.oneOf(arguments, "category", CATEGORIES);
        if (directory.findById(assigneeId).isEmpty()) {
            throw ToolInvocationException.notFound("No employee has id " + assigneeId + " to assign the work order to");
        }

        WorkOrderDesk.Receipt receipt;
        try {
            receipt = desk.open(subject, assigneeId,
                    priority == null ? "medium" : priority,
                    category == null ? "general" : category);
        } catch (RuntimeException e) {
            throw new ToolInvocationException(ErrorKind.TRANSIENT, "Work order desk is unavailable", e);
        }

        WorkOrder order = receipt.order();
        String summary = (receipt.created() ? "Opened work order " : "Work order already open: ")
                + order.workOrderId() + " '" + order.subject() + "' for " + order.assigneeId()
                + " (" + order.priority() + " priority, " + order.category() + ")";
        var data = new LinkedHashMap<String, Object>();
        data.put("work_order_id", order.workOrderId());
        data.put("created", receipt.created());
        data.put("status", order.status());
        return new ToolOutput(summary, data, Map.of("work_order_id", order.workOrderId()),
                "work_orders/" + order.workOrderId(), null);
    }
}
