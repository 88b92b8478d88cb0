package com.ledgerwise.core.classify;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * The employee on whose behalf requests are made. First-person references
 * ("my claims", "send me") resolve to this employee.
 */
@Component
@ConfigurationProperties(prefix = "ledgerwise.user")
public class CurrentUserProperties {

    private String employeeId = "";
    private String name = "";

    public String getEmployeeId() {
        return employeeId;
    }

    public void setEmployeeId(String employeeId) {
        this.employeeId = employeeId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isConfigured() {
        return employeeId != null && !employeeId.isBlank();
    }
}
