package com.nana.reconcile.diff;

import java.util.List;
import java.util.Objects;

/**
 * One segment of a text diff: kept, inserted or deleted text.
 */
public final class Edit {

    public enum Operation { EQUAL, INSERT, DELETE }

    private final Operation operation;
    private final String text;

    public Edit(Operation operation, String text) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.text = Objects.requireNonNull(text, "text");
    }

    public Operation getOperation() { return operation; }

    public String getText() { return text; }

    /** @return {@code true} if any segment inserts or deletes text */
    public static boolean hasChanges(List<Edit> edits) {
        return edits.stream().anyMatch(e -> e.operation != Operation.EQUAL);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edit)) return false;
        Edit other = (Edit) o;
        return operation == other.operation && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, text);
    }

    @Override
    public String toString() {
        return operation + "(\"" + text + "\")";
    }
}
