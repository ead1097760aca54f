package com.e2eq.composite.util;

import io.quarkus.logging.Log;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for the composite service.
 */
public final class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {
    }

    /**
     * Log exception with full stack trace at WARN level
     *
     * @param exception the exception to log
     * @param message the message format string
     * @param args optional arguments for message formatting
     */
    public static void logWarn(Throwable exception, String message, Object... args) {
        String formatted = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            Log.warn(formatted);
            return;
        }
        Log.warnf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    /**
     * Log exception at DEBUG level. Client errors land here; the stack trace is only built when
     * DEBUG is enabled.
     */
    public static void logDebug(Throwable exception, String message, Object... args) {
        if (!Log.isDebugEnabled()) {
            return;
        }
        String formatted = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            Log.debug(formatted);
            return;
        }
        Log.debugf("%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static String describe(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }
}
