package electoral.analytics.ingest.util;

import org.slf4j.MDC;

/**
 * Utility class for managing correlation IDs throughout the application.
 * Uses SLF4J MDC (Mapped Diagnostic Context) for thread-local storage.
 *
 * Usage:
 * - Automatically managed by CorrelationIdFilter for HTTP requests
 * - Set per job by the import runner, so all lines of one job share "import-job-{id}"
 */
public class CorrelationIdUtil {

    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final String JOB_PREFIX = "import-job-";

    private CorrelationIdUtil() {
    }

    /**
     * Gets the current correlation ID from MDC
     * @return correlation ID or "NO-CORRELATION-ID" if not set
     */
    public static String getCurrentCorrelationId() {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        return correlationId != null ? correlationId : "NO-CORRELATION-ID";
    }

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Sets the correlation ID used by a background import job thread
     * @param jobId import job id
     */
    public static void setJobCorrelationId(Long jobId) {
        MDC.put(CORRELATION_ID_KEY, JOB_PREFIX + jobId);
    }

    /**
     * Removes correlation ID from MDC. Call from finally blocks on pooled threads.
     */
    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY) != null;
    }
}
