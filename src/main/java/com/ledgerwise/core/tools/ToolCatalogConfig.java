package com.ledgerwise.core.tools;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Registers the tool catalog. The order below is the registration order,
 * which decides the default producer when several tools export the same
 * parameter.
 */
@Configuration
public class ToolCatalogConfig {

    @Bean
    public ToolRegistry toolRegistry(EmployeeLookupTool employeeLookup,
                                     PolicySearchTool policySearch,
                                     ReimbursementSummaryTool reimbursementSummary,
                                     ReimbursementStatusTool reimbursementStatus,
                                     ReimbursementRecordsTool reimbursementRecords,
                                     ComposeContentTool composeContent,
                                     CreateWorkOrderTool createWorkOrder,
                                     SendEmailTool sendEmail) {
        return new ToolRegistry(List.of(
                employeeLookup,
                policySearch,
                reimbursementSummary,
                reimbursementStatus,
                reimbursementRecords,
                composeContent,
                createWorkOrder,
                sendEmail));
    }
}
