package io.github.timedingest.dispatcher.audit;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logs with the MDC key {@code event.type} set for the duration of the call, so lifecycle events can be
 * filtered and counted downstream.
 */
public final class Log {

    public static final String EVENT_TYPE = "event.type";

    private Log() {
    }

    public static void event(Logger logger, String eventType, String message, Object... args) {
        if (logger.isInfoEnabled()) {
            MDC.put(EVENT_TYPE, eventType);
            try {
                logger.info(message, args);
            } finally {
                MDC.remove(EVENT_TYPE);
            }
        }
    }

    public static void warn(Logger logger, String eventType, String message, Object... args) {
        if (logger.isWarnEnabled()) {
            MDC.put(EVENT_TYPE, eventType);
            try {
                logger.warn(message, args);
            } finally {
                MDC.remove(EVENT_TYPE);
            }
        }
    }

    /**
     * The throwable goes last in {@code args}; SLF4J prints its stack trace.
     */
    public static void error(Logger logger, String eventType, String message, Object... args) {
        if (logger.isErrorEnabled()) {
            MDC.put(EVENT_TYPE, eventType);
            try {
                logger.error(message, args);
            } finally {
                MDC.remove(EVENT_TYPE);
            }
        }
    }
}
