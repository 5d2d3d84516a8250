package com.nana.reconcile.widget;

import java.util.Locale;
import java.util.Set;

/**
 * Booleans written as {@code 1/0}, {@code true/false}, {@code yes/no} or
 * {@code y/n}, any case. Rendered as {@code 1} or {@code 0}.
 */
public class BooleanWidget implements Widget<Boolean> {

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "y");
    private static final Set<String> FALSE_VALUES = Set.of("0", "false", "no", "n");

    @Override
    public Boolean clean(String value) {
        if (Widget.isBlank(value)) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return Boolean.FALSE;
        }
        throw new ConversionException("'" + value + "' is not a valid boolean.");
    }

    @Override
    public String render(Boolean value) {
        if (value == null) {
            return "";
        }
        return value ? "1" : "0";
    }
}
