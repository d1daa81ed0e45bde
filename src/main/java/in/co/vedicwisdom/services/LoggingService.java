package in.co.vedicwisdom.services;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for CloudWatch Logs Insights.
 *
 * Messages are snake_case event names; details go into the ThreadContext as a JSON {@code data} field,
 * next to the request id, the function being run and the week or birth profile it runs for.
 *
 * <pre>
 * -- All runs for one week
 * fields @timestamp, message, weekStart, data
 * | filter weekStart = "2024-05-05"
 * | sort @timestamp asc
 *
 * -- Ephemeris failures
 * fields @timestamp, message, errorCode, data
 * | filter errorCode = "EPHEMERIS_UNAVAILABLE"
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_WEEK_START = "weekStart";
    public static final String KEY_PROFILE = "profile";
    public static final String KEY_ERROR_CODE = "errorCode";
    public static final String KEY_DATA = "data";

    private LoggingService() {
    }

    /**
     * Resets the context for a new invocation. Scheduled events have no request id worth keeping, so a
     * null {@code context} just clears.
     */
    public static void initRequest(Context context) {
        clearContext();
        if (context != null) {
            ThreadContext.put(KEY_REQUEST_ID, context.getAwsRequestId());
        }
    }

    public static void setFunction(String function) {
        putIfPresent(KEY_FUNCTION, function);
    }

    public static void setWeekStart(String weekStart) {
        putIfPresent(KEY_WEEK_START, weekStart);
    }

    /**
     * Birth date of the janam patri profile being processed.
     */
    public static void setProfile(String profile) {
        putIfPresent(KEY_PROFILE, profile);
    }

    public static void clearContext() {
        ThreadContext.clearAll();
    }

    public static void debug(String message, Map<String, Object> data) {
        if (logger.isDebugEnabled()) {
            withData(data, () -> logger.debug(message));
        }
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        withData(data, () -> logger.info(message));
    }

    public static void warn(String message, Map<String, Object> data) {
        withData(data, () -> logger.warn(message));
    }

    public static void error(String message, Throwable t) {
        error(message, t, null);
    }

    /**
     * A {@link ComputationException} also puts its error code in the context for the duration of the event.
     */
    public static void error(String message, Throwable t, Map<String, Object> data) {
        boolean coded = t instanceof ComputationException;
        if (coded) {
            ThreadContext.put(KEY_ERROR_CODE, ((ComputationException) t).getErrorCode().name());
        }
        try {
            withData(data, () -> logger.error(message, t));
        } finally {
            if (coded) {
                ThreadContext.remove(KEY_ERROR_CODE);
            }
        }
    }

    /**
     * Logs {@code <operation>_started} and returns the start time to pass to the matching end or failure call.
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        info(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", System.currentTimeMillis() - startTime);
        info(operation + "_completed", data);
    }

    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        error(operation + "_failed", t, data("durationMs", System.currentTimeMillis() - startTime));
    }

    /**
     * Mutable map from alternating keys and values; a trailing key without a value is dropped.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }

    private static void withData(Map<String, Object> data, Runnable log) {
        boolean hasData = data != null && !data.isEmpty();
        if (hasData) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
        try {
            log.run();
        } finally {
            if (hasData) {
                ThreadContext.remove(KEY_DATA);
            }
        }
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            ThreadContext.put(key, value);
        }
    }
}
