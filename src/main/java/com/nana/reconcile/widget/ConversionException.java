package com.nana.reconcile.widget;

/**
 * A cell value cannot be converted to the field's native type, or a
 * required column or related object is missing.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
