package com.nana.reconcile.resource;

/**
 * A before/after save or delete hook failed. The hook's exception is the cause.
 */
public class HookException extends ReconcileException {

    public HookException(String message, Throwable cause) {
        super(message, cause);
    }
}
