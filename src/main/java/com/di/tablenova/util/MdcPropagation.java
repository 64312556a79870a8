package com.di.tablenova.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;

/**
 * Propagates SLF4J MDC ({@code requestId}, {@code jobId}) to worker threads so that logs from
 * executors stay correlated with the request or job that started them.
 * <p>
 * MDC is thread-local; without propagation, logs from pooled threads lose the correlation keys.
 * <p>
 * Usage:
 * <ul>
 *   <li>As a task decorator: {@code executor.setTaskDecorator(MdcPropagation::wrapRunnable);}</li>
 *   <li>With an explicit context: {@code MdcPropagation.runWithMdcContext(Map.of("jobId", id), () -> run());}</li>
 * </ul>
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of
     * the task and removes the keys in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> runWithMdcContext(contextMap, task);
    }

    /**
     * Runs the task in the current thread with the given keys set in MDC for its duration.
     */
    public static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        setMdc(contextMap);
        try {
            task.run();
        } finally {
            clearMdc(contextMap);
        }
    }

    /**
     * @return copy of the current MDC context; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
