package com.nana.reconcile.widget;

import java.math.BigDecimal;

public class DecimalWidget implements Widget<BigDecimal> {

    @Override
    public BigDecimal clean(String value) {
        if (Widget.isBlank(value)) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException ex) {
            throw new ConversionException("'" + value + "' is not a valid decimal number.", ex);
        }
    }

    @Override
    public String render(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }
}
