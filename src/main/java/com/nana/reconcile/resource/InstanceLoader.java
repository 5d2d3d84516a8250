package com.nana.reconcile.resource;

import com.nana.reconcile.dataset.Row;

import java.util.Optional;

/**
 * Finds the existing object a row refers to. Never creates objects.
 *
 * <p>Implementations must answer identically for identical keys within one
 * batch.
 *
 * @param <T> model type
 */
public interface InstanceLoader<T> {

    /**
     * @return the matching object, or empty when none exists
     * @throws ResolutionException if identification columns are missing or
     *         the key is ambiguous
     * @throws com.nana.reconcile.widget.ConversionException if a key cell
     *         does not convert
     */
    Optional<T> getInstance(Row row);
}
