package com.nana.reconcile.widget;

import java.math.BigDecimal;

/**
 * Whole numbers. Accepts integral decimals such as {@code 3.0}, which
 * spreadsheets write for numeric cells.
 */
public class IntegerWidget implements Widget<Integer> {

    @Override
    public Integer clean(String value) {
        if (Widget.isBlank(value)) {
            return null;
        }
        try {
            return new BigDecimal(value.trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new ConversionException("'" + value + "' is not a valid integer.", ex);
        }
    }

    @Override
    public String render(Integer value) {
        return value == null ? "" : value.toString();
    }
}
