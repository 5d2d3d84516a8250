package com.nana.reconcile.resource;

/**
 * Strategy used to find the existing object for a row.
 */
public enum InstanceLoaderType {
    /** One exact-match lookup per row. */
    MODEL,
    /** One lookup for the whole dataset; needs a single identification field. */
    CACHED
}
