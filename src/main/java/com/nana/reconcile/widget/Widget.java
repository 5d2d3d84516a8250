package com.nana.reconcile.widget;

/**
 * Two-way converter between a raw cell string and a native value.
 *
 * <p>{@link #clean(String)} may fail with {@link ConversionException};
 * {@link #render(Object)} never fails for a value {@code clean} can produce
 * and renders {@code null} as an empty string.
 *
 * @param <V> native value type
 */
public interface Widget<V> {

    V clean(String value);

    String render(V value);

    /** @return {@code true} for {@code null}, empty or whitespace-only input */
    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
