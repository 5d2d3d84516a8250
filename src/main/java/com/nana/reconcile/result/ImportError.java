package com.nana.reconcile.result;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A failure captured during an import together with its stack trace text,
 * so a result can be reported after the exception itself is gone.
 */
public final class ImportError {

    private final Throwable error;
    private final String traceback;

    public ImportError(Throwable error) {
        this.error = Objects.requireNonNull(error, "error");
        StringWriter sw = new StringWriter();
        error.printStackTrace(new PrintWriter(sw));
        this.traceback = sw.toString();
    }

    public Throwable getError() { return error; }

    public String getTraceback() { return traceback; }

    /** @return the exception message, or its class name when it has none */
    public String getMessage() {
        String message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }

    @Override
    public String toString() {
        return "ImportError{" + error.getClass().getSimpleName() + ": " + getMessage() + "}";
    }
}
