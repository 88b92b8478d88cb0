package com.ledgerwise.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CancellationRegistryTest {

    private final CancellationRegistry registry = new CancellationRegistry();

    @Test
    @DisplayName("only in-flight requests can be cancelled")
    void inFlightOnly() {
        assertFalse(registry.cancel("R-1"));

        registry.register("R-1");
        assertFalse(registry.isCancelled("R-1"));
        assertTrue(registry.cancel("R-1"));
        assertTrue(registry.isCancelled("R-1"));
    }

    @Test
    @DisplayName("released requests forget their flag")
    void release() {
        registry.register("R-1");
        registry.cancel("R-1");
        registry.release("R-1");

        assertFalse(registry.isCancelled("R-1"));
        assertFalse(registry.cancel("R-1"));
    }

    @Test
    @DisplayName("cancelling one request leaves others running")
    void independent() {
        registry.register("R-1");
        registry.register("R-2");
        registry.cancel("R-1");

        assertFalse(registry.isCancelled("R-2"));
    }
}
