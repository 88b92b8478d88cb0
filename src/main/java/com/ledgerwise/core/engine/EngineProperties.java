package com.ledgerwise.core.engine;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Execution limits bound from {@code ledgerwise.engine.*}.
 */
@Component
@ConfigurationProperties(prefix = "ledgerwise.engine")
public class EngineProperties {

    /** Re-invocations allowed per step after its first attempt. */
    private int maxRetries = 2;

    /** Steps executed per request at most; the rest are reported as not attempted. */
    private int maxSteps = 8;

    /** Wall-clock limit for one tool invocation. */
    private Duration stepTimeout = Duration.ofSeconds(30);

    @PostConstruct
    public void validate() {
        if (maxRetries < 0) {
            throw new IllegalStateException("ledgerwise.engine.max-retries must be >= 0, was " + maxRetries);
        }
        if (maxSteps < 1) {
            throw new IllegalStateException("ledgerwise.engine.max-steps must be >= 1, was " + maxSteps);
        }
        if (stepTimeout == null || stepTimeout.isZero() || stepTimeout.isNegative()) {
            throw new IllegalStateException("ledgerwise.engine.step-timeout must be positive, was " + stepTimeout);
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public void setStepTimeout(Duration stepTimeout) {
        this.stepTimeout = stepTimeout;
    }
}
