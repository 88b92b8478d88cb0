package com.ledgerwise.core.logging;

import org.slf4j.MDC;

import java.util.List;

/**
 * Ledgerwise MDC keys for structured logging. The console pattern in
 * {@code application.yml} prints every key in {@link #KEYS}.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String STEP_ID = "stepId";
    public static final String TOOL_NAME = "toolName";

    public static final List<String> KEYS = List.of(REQUEST_ID, STEP_ID, TOOL_NAME);

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put(REQUEST_ID, requestId);
    }

    public static void setStep(String requestId, String stepId, String toolName) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(STEP_ID, stepId);
        MDC.put(TOOL_NAME, toolName);
    }

    public static void clearStep() {
        MDC.remove(STEP_ID);
        MDC.remove(TOOL_NAME);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        clearStep();
    }
}
