package com.nana.reconcile.result;

/**
 * Outcome of reconciling one dataset row.
 */
public enum ImportType {
    /** No existing object matched; a new one was created. */
    NEW,
    /** An existing object was updated. */
    UPDATE,
    /** An existing object was deleted. */
    DELETE,
    /** Nothing was persisted: unchanged, vetoed, or nothing to delete. */
    SKIP,
    /** Processing failed; see the row's errors. */
    ERROR
}
