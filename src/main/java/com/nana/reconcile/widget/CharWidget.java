package com.nana.reconcile.widget;

/**
 * Text passthrough. Cleaning keeps the cell exactly as read, blanks included.
 */
public class CharWidget implements Widget<String> {

    @Override
    public String clean(String value) {
        return value;
    }

    @Override
    public String render(String value) {
        return value == null ? "" : value;
    }
}
