package com.ledgerwise.core.engine;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flags for in-flight requests. The execute node checks the flag
 * before each step; a step already running is allowed to finish.
 */
@Component
public class CancellationRegistry {

    private final ConcurrentHashMap<String, AtomicBoolean> flags = new ConcurrentHashMap<>();

    public void register(String requestId) {
        flags.putIfAbsent(requestId, new AtomicBoolean(false));
    }

    /**
     * @return false if the request is not in flight
     */
    public boolean cancel(String requestId) {
        AtomicBoolean flag = flags.get(requestId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        return true;
    }

    public boolean isCancelled(String requestId) {
        AtomicBoolean flag = flags.get(requestId);
        return flag != null && flag.get();
    }

    public void release(String requestId) {
        flags.remove(requestId);
    }
}
