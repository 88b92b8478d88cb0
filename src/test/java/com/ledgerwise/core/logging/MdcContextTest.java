package com.ledgerwise.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRequest puts requestId in MDC")
    void setRequest() {
        MdcContext.setRequest("LW-20240402-0001");
        assertEquals("LW-20240402-0001", MDC.get("requestId"));
    }

    @Test
    @DisplayName("setStep puts requestId, stepId and toolName in MDC")
    void setStep() {
        MdcContext.setStep("LW-20240402-0001", "step-2", "employee_lookup");
        assertEquals("LW-20240402-0001", MDC.get("requestId"));
        assertEquals("step-2", MDC.get("stepId"));
        assertEquals("employee_lookup", MDC.get("toolName"));
    }

    @Test
    @DisplayName("clearStep keeps the request key")
    void clearStep() {
        MdcContext.setStep("LW-20240402-0001", "step-2", "employee_lookup");
        MdcContext.clearStep();
        assertEquals("LW-20240402-0001", MDC.get("requestId"));
        assertNull(MDC.get("stepId"));
        assertNull(MDC.get("toolName"));
    }

    @Test
    @DisplayName("clear removes all ledgerwise MDC keys")
    void clear() {
        MdcContext.setStep("LW-20240402-0001", "step-2", "employee_lookup");
        MdcContext.clear();
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("stepId"));
    }

    @Test
    @DisplayName("the console log pattern prints every MDC key")
    void consolePatternPrintsKeys() {
        var yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource("application.yml"));
        String pattern = yaml.getObject().getProperty("logging.pattern.console");

        assertNotNull(pattern);
        for (String key : MdcContext.KEYS) {
            assertTrue(pattern.contains("%X{" + key + ":-}"), key);
        }
    }
}
