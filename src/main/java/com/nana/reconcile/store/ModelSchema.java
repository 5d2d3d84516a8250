package com.nana.reconcile.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Ordered attribute catalogue of one model type.
 *
 * <p>Built once per store with {@link #builder(String)}. Attribute order is
 * declaration order; generated resources follow it.
 *
 * @param <T> the model type
 */
public final class ModelSchema<T> {

    private final String modelName;
    private final Map<String, Attribute<T, ?>> attributes;

    private ModelSchema(Builder<T> builder) {
        this.modelName = builder.modelName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static <T> Builder<T> builder(String modelName) {
        return new Builder<>(modelName);
    }

    public String getModelName() { return modelName; }

    public List<Attribute<T, ?>> getAttributes() {
        return new ArrayList<>(attributes.values());
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if the model has no such attribute
     */
    public Attribute<T, ?> getAttribute(String name) {
        Attribute<T, ?> attribute = attributes.get(name);
        if (attribute == null) {
            throw new IllegalArgumentException(
                    "Model '" + modelName + "' has no attribute '" + name + "'.");
        }
        return attribute;
    }

    /**
     * Composes the accessors along a dotted path such as {@code author.name}.
     * Every segment except the last must be a foreign key.
     *
     * @param path attribute name or dotted relationship path
     * @return accessor from the model straight to the final attribute
     * @throws IllegalArgumentException if a segment is unknown or not traversable
     */
    @SuppressWarnings("unchecked")
    public Accessor<T, Object> resolvePath(String path) {
        String[] parts = path.split("\\.");
        Attribute<T, ?> head = getAttribute(parts[0]);
        Accessor<T, Object> accessor = (Accessor<T, Object>) head.getAccessor();
        Attribute<?, ?> current = head;
        for (int i = 1; i < parts.length; i++) {
            Attribute<Object, ?> next = (Attribute<Object, ?>) traverse(current, parts[i], path);
            accessor = accessor.then((Accessor<Object, Object>) next.getAccessor());
            current = next;
        }
        return accessor;
    }

    /**
     * @param path attribute name or dotted relationship path
     * @return the attribute the path ends at
     */
    public Attribute<?, ?> resolveAttribute(String path) {
        String[] parts = path.split("\\.");
        Attribute<?, ?> current = getAttribute(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            current = traverse(current, parts[i], path);
        }
        return current;
    }

    private static Attribute<?, ?> traverse(Attribute<?, ?> from, String segment, String path) {
        if (from.getKind() != AttributeKind.FOREIGN_KEY) {
            throw new IllegalArgumentException("Cannot traverse '" + path
                    + "': '" + from.getName() + "' is not a foreign key.");
        }
        return from.getRelatedStore().getSchema().getAttribute(segment);
    }

    @Override
    public String toString() {
        return modelName + attributes.values();
    }

    // -----------------------------------------------------------------------
    // BUILDER
    // -----------------------------------------------------------------------

    public static final class Builder<T> {

        private final String modelName;
        private final Map<String, Attribute<T, ?>> attributes = new LinkedHashMap<>();

        private Builder(String modelName) {
            this.modelName = modelName;
        }

        public <V> Builder<T> attribute(String name, AttributeKind kind,
                                        Function<T, V> getter, BiConsumer<T, V> setter) {
            if (kind.isRelation()) {
                throw new IllegalArgumentException(
                        "Use foreignKey() or manyToMany() for relation '" + name + "'.");
            }
            return add(new Attribute<>(name, kind, accessor(getter, setter), null));
        }

        public <R> Builder<T> foreignKey(String name, ModelStore<R> related,
                                         Function<T, R> getter, BiConsumer<T, R> setter) {
            return add(new Attribute<>(name, AttributeKind.FOREIGN_KEY, accessor(getter, setter), related));
        }

        public <R> Builder<T> manyToMany(String name, ModelStore<R> related,
                                         Function<T, Collection<R>> getter,
                                         BiConsumer<T, Collection<R>> setter) {
            return add(new Attribute<>(name, AttributeKind.MANY_TO_MANY, accessor(getter, setter), related));
        }

        public ModelSchema<T> build() {
            if (attributes.isEmpty()) {
                throw new IllegalStateException("Model '" + modelName + "' declares no attributes.");
            }
            return new ModelSchema<>(this);
        }

        private Builder<T> add(Attribute<T, ?> attribute) {
            if (attributes.putIfAbsent(attribute.getName(), attribute) != null) {
                throw new IllegalArgumentException("Duplicate attribute '" + attribute.getName() + "'.");
            }
            return this;
        }

        private static <T, V> Accessor<T, V> accessor(Function<T, V> getter, BiConsumer<T, V> setter) {
            return setter == null ? Accessor.readOnly(getter) : Accessor.of(getter, setter);
        }
    }
}
