package com.nana.reconcile.resource;

/**
 * Whether an import batch runs inside one store transaction.
 */
public enum TransactionMode {
    ENABLED,
    DISABLED,
    /** Defer to the next level: resource options, then process configuration. */
    INHERIT
}
