package com.gladlabs.orchestrator.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Utility for managing orchestration MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String EXECUTION_ID = "executionId";
    public static final String PHASE = "phase";
    public static final String AGENT = "agent";

    private MdcContext() {}

    public static void setExecution(String executionId) {
        MDC.put(EXECUTION_ID, executionId);
    }

    public static void setPhase(String executionId, String phase, String agent) {
        MDC.put(EXECUTION_ID, executionId);
        MDC.put(PHASE, phase);
        MDC.put(AGENT, agent);
    }

    public static void clearPhase() {
        MDC.remove(PHASE);
        MDC.remove(AGENT);
    }

    public static void clear() {
        MDC.remove(EXECUTION_ID);
        MDC.remove(PHASE);
        MDC.remove(AGENT);
    }

    /**
     * Wraps a task so it runs with the caller's MDC on whichever pool thread picks it up.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return task.get();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }
}
