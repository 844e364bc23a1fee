package com.odin.call_signaling_service.utility;

import org.slf4j.MDC;

public class CorrelationIdUtil {

    private CorrelationIdUtil() {
    }

    /**
     * Runs {@code task} with {@code key} set in the MDC and restores the
     * previous value afterwards, so event-loop tasks of different devices and
     * calls never leak their context into each other.
     */
    public static Runnable wrap(String key, String value, Runnable task) {
        return () -> {
            String previous = MDC.get(key);
            if (value != null) {
                MDC.put(key, value);
            }
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.put(key, previous);
                } else {
                    MDC.remove(key);
                }
            }
        };
    }
}
