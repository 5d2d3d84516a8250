package com.nana.reconcile.store;

import java.util.Objects;

/**
 * One named attribute of a model: its storage kind, how to reach it on an
 * instance, and for relations the store that holds the related objects.
 *
 * @param <T> owning type
 * @param <V> value type; a related object for {@link AttributeKind#FOREIGN_KEY},
 *            a collection of them for {@link AttributeKind#MANY_TO_MANY}
 */
public final class Attribute<T, V> {

    private final String name;
    private final AttributeKind kind;
    private final Accessor<T, V> accessor;
    private final ModelStore<?> relatedStore;

    Attribute(String name, AttributeKind kind, Accessor<T, V> accessor, ModelStore<?> relatedStore) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.accessor = Objects.requireNonNull(accessor, "accessor");
        if (kind.isRelation() && relatedStore == null) {
            throw new IllegalArgumentException("Relation attribute '" + name + "' needs a related store.");
        }
        this.relatedStore = relatedStore;
    }

    public String getName() { return name; }

    public AttributeKind getKind() { return kind; }

    public Accessor<T, V> getAccessor() { return accessor; }

    /** @return the related store, or {@code null} for scalar attributes */
    public ModelStore<?> getRelatedStore() { return relatedStore; }

    @Override
    public String toString() {
        return name + ":" + kind;
    }
}
