package lovedata.menus.cleaning.util;

import org.slf4j.MDC;

import java.util.function.Supplier;

/**
 * Utility class for managing correlation IDs throughout the application.
 * Uses SLF4J MDC (Mapped Diagnostic Context) for thread-local storage.
 *
 * Usage:
 * - Automatically managed by CorrelationIdFilter for HTTP requests
 * - {@link #wrap(Supplier)} carries the caller's id onto cleaning worker threads
 */
public class CorrelationIdUtil {

    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final String NO_CORRELATION_ID = "NO-CORRELATION-ID";

    private CorrelationIdUtil() {
    }

    /**
     * @return correlation ID or "NO-CORRELATION-ID" if not set
     */
    public static String getCurrentCorrelationId() {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        return correlationId != null ? correlationId : NO_CORRELATION_ID;
    }

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Always call this in finally blocks; pooled threads keep their MDC.
     */
    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY) != null;
    }

    /**
     * Capture the current thread's correlation id and restore it around
     * {@code task} on whichever thread runs it.
     */
    public static <T> Supplier<T> wrap(Supplier<T> task) {
        String captured = MDC.get(CORRELATION_ID_KEY);
        return () -> {
            String previous = MDC.get(CORRELATION_ID_KEY);
            restore(captured);
            try {
                return task.get();
            } finally {
                restore(previous);
            }
        };
    }

    private static void restore(String correlationId) {
        if (correlationId == null) {
            MDC.remove(CORRELATION_ID_KEY);
        } else {
            MDC.put(CORRELATION_ID_KEY, correlationId);
        }
    }
}
