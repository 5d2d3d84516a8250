package com.nana.reconcile.store;

/**
 * Storage kind of a model attribute. Decides which widget a generated
 * field receives.
 */
public enum AttributeKind {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATETIME,
    TIME,
    /** Single related object held by reference. */
    FOREIGN_KEY,
    /** Collection of related objects stored outside the owning row. */
    MANY_TO_MANY;

    public boolean isRelation() {
        return this == FOREIGN_KEY || this == MANY_TO_MANY;
    }
}
