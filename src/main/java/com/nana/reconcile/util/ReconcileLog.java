package com.nana.reconcile.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured event logging and MDC context for import and export runs.
 *
 * <p>Ordinary diagnostics go through each class's own SLF4J logger. This
 * class adds a second channel: one-line {@code [EVENT]} records on the
 * {@code com.nana.reconcile.EVENTS} logger, which a Logback configuration
 * can route to a separate audit appender.
 *
 * <p>MDC KEYS:
 * <ul>
 *   <li>{@value #MDC_OPERATION}: the batch operation in progress
 *       (e.g. {@code IMPORT:BookResource}).</li>
 *   <li>{@value #MDC_ROW}: the 1-based dataset row being reconciled.</li>
 * </ul>
 * Use {@code %X{operation}} and {@code %X{row}} in the Logback pattern to
 * print them.
 */
public final class ReconcileLog {

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    /** Logger for structured events. */
    private static final Logger EVENT_LOG =
            LoggerFactory.getLogger("com.nana.reconcile.EVENTS");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the current dataset row number. */
    public static final String MDC_ROW = "row";

    private ReconcileLog() {
        throw new UnsupportedOperationException(
                "ReconcileLog is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Logs a named business event at INFO.
     *
     * @param eventName short upper-case event name (e.g. {@code IMPORT_COMPLETE})
     * @param details   free-form key=value details
     */
    public static void logEvent(String eventName, String details) {
        EVENT_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a named event at WARN.
     *
     * @param eventName short upper-case event name
     * @param details   free-form key=value details
     */
    public static void logWarningEvent(String eventName, String details) {
        EVENT_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a named event at ERROR together with its cause.
     *
     * @param eventName short upper-case event name
     * @param details   free-form key=value details
     * @param throwable the failure; its stack trace is logged
     */
    public static void logErrorEvent(String eventName,
                                     String details,
                                     Throwable throwable) {
        EVENT_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    /** @param operationName the operation to tag subsequent log lines with */
    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    /** @param rowNumber the 1-based row number being processed */
    public static void setRowContext(int rowNumber) {
        MDC.put(MDC_ROW, String.valueOf(rowNumber));
    }

    /** Removes the row tag. */
    public static void clearRowContext() {
        MDC.remove(MDC_ROW);
    }

    /** Removes every key this class sets. */
    public static void clearAllContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_ROW);
    }
}
