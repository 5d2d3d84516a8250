package com.nana.reconcile.resource;

/**
 * A row's identification columns are missing or match more than one object.
 */
public class ResolutionException extends ReconcileException {

    public ResolutionException(String message) {
        super(message);
    }
}
