package com.di.epistream.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Carries the SLF4J MDC (notably {@code runId}) from the coordinating thread into load workers,
 * so partition logs stay correlated with their run.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap before submitting: {@code executor.submit(MdcPropagation.wrapCallable(() -> loadPartition(p)));}</li>
 *   <li>For {@code CompletableFuture.supplyAsync}: {@code supplyAsync(MdcPropagation.wrapSupplier(() -> ...), pool)}</li>
 * </ul>
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> runWithMdcContext(contextMap, task);
    }

    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    public static <T> Supplier<T> wrapSupplier(Supplier<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.get();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs the task on the current thread with the given context set for its duration.
     *
     * @param contextMap MDC key-value map, e.g. from {@link #copyMdc()}
     * @param task       task to run
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
     * @return copy of the current thread's MDC; never null
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
