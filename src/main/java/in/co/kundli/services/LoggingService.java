package in.co.kundli.services;

import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured logging facade for the chart engine.
 *
 * Features:
 * - snake_case event names as the log message
 * - key/value payload serialised as JSON into the {@code data} context key
 * - request-scoped context (requestId, chartId, function) carried in the ThreadContext
 *
 * <p>The ThreadContext is per thread, so concurrent chart requests never see each other's context.</p>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_CHART_ID = "chartId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_DATA = "data";

    /**
     * Initialize logging context with a request ID. Clears anything left by a previous request
     * on this thread.
     */
    public static void initRequest(String requestId) {
        clearContext();
        if (requestId != null) {
            ThreadContext.put(KEY_REQUEST_ID, requestId);
        }
    }

    public static void setChartId(String chartId) {
        if (chartId != null) {
            ThreadContext.put(KEY_CHART_ID, chartId);
        }
    }

    /**
     * Set the current function being executed (e.g. "calculate_chart").
     */
    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    public static void clearChartId() {
        ThreadContext.remove(KEY_CHART_ID);
    }

    /**
     * Clear the engine's logging context. Call at the end of request processing. Keys put by the
     * caller's own code are left alone.
     */
    public static void clearContext() {
        ThreadContext.removeAll(List.of(KEY_REQUEST_ID, KEY_CHART_ID, KEY_FUNCTION, KEY_DATA));
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void warn(String message, Throwable t) {
        logger.warn(message, t);
    }

    public static void error(String message) {
        logger.error(message);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Convenience Methods for Common Patterns
    // =========================================================================

    /**
     * Log the start of an operation. Returns start time for use with logOperationEnd.
     */
    public static long logOperationStart(String operation) {
        debug(operation + "_started");
        return System.currentTimeMillis();
    }

    public static long logOperationStart(String operation, Map<String, Object> data) {
        debug(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        info(operation + "_completed", Map.of("durationMs", duration));
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        long duration = System.currentTimeMillis() - startTime;
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", duration);
        info(operation + "_completed", data);
    }

    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        long duration = System.currentTimeMillis() - startTime;
        error(operation + "_failed", t, Map.of("durationMs", duration));
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }
}
