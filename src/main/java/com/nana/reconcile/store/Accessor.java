package com.nana.reconcile.store;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Reads and optionally writes one attribute of a domain object.
 *
 * <p>Reads are null-safe: reading from a {@code null} object yields
 * {@code null}. Accessors compose with {@link #then(Accessor)} to follow a
 * relationship path such as {@code author.name}; writing through a composed
 * accessor sets the attribute on the intermediate object when it exists.
 *
 * @param <T> owning type
 * @param <V> attribute value type
 */
public final class Accessor<T, V> {

    private final Function<T, V> getter;
    private final BiConsumer<T, V> setter;

    private Accessor(Function<T, V> getter, BiConsumer<T, V> setter) {
        this.getter = Objects.requireNonNull(getter, "getter");
        this.setter = setter;
    }

    public static <T, V> Accessor<T, V> of(Function<T, V> getter, BiConsumer<T, V> setter) {
        return new Accessor<>(getter, setter);
    }

    public static <T, V> Accessor<T, V> readOnly(Function<T, V> getter) {
        return new Accessor<>(getter, null);
    }

    public V get(T target) {
        return target == null ? null : getter.apply(target);
    }

    public boolean isWritable() {
        return setter != null;
    }

    /**
     * @throws UnsupportedOperationException if this accessor has no setter
     */
    public void set(T target, V value) {
        if (setter == null) {
            throw new UnsupportedOperationException("Attribute is read-only.");
        }
        setter.accept(target, value);
    }

    /**
     * Composes this accessor with one on the value it reads.
     *
     * @param next accessor applied to this accessor's value
     * @return an accessor from {@code T} straight to {@code W}
     */
    public <W> Accessor<T, W> then(Accessor<V, W> next) {
        Function<T, W> composedGetter = target -> next.get(get(target));
        if (!next.isWritable()) {
            return readOnly(composedGetter);
        }
        return of(composedGetter, (target, value) -> {
            V intermediate = get(target);
            if (intermediate != null) {
                next.set(intermediate, value);
            }
        });
    }
}
