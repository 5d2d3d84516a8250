package com.nana.reconcile.diff;

import java.util.List;

/**
 * Text diff used to show what an import changes per field.
 */
public interface DiffEngine {

    /**
     * Computes a semantically cleaned edit sequence turning {@code before}
     * into {@code after}. Equal inputs produce no INSERT or DELETE edits.
     */
    List<Edit> diff(String before, String after);

    /** Renders edits as HTML markup. */
    String render(List<Edit> edits);

    default String diffAndRender(String before, String after) {
        return render(diff(before, after));
    }
}
