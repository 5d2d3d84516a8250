package com.nana.reconcile.resource;

/**
 * Base class for failures raised by the reconciliation engine itself.
 *
 * <p>Unchecked so that accessor and hook lambdas can raise it freely.
 */
public class ReconcileException extends RuntimeException {

    public ReconcileException(String message) {
        super(message);
    }

    public ReconcileException(String message, Throwable cause) {
        super(message, cause);
    }
}
