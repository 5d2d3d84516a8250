package com.nana.reconcile.widget;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared parsing for the date and time widgets.
 *
 * <p>Input is tried against each pattern in order; the first that parses
 * wins. Output always uses the first pattern. Parsing is strict, so a
 * day that does not exist in its month is rejected rather than clamped.
 *
 * @param <V> the {@code java.time} type produced
 */
public abstract class TemporalWidget<V extends TemporalAccessor> implements Widget<V> {

    private final List<String> patterns;
    private final List<DateTimeFormatter> formatters;

    /**
     * @param patterns {@link DateTimeFormatter} patterns, at least one
     * @throws IllegalArgumentException if the list is empty or a pattern is invalid
     */
    protected TemporalWidget(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("At least one format pattern is required.");
        }
        this.patterns = List.copyOf(patterns);
        List<DateTimeFormatter> built = new ArrayList<>();
        for (String p : patterns) {
            built.add(strictFormatter(p));
        }
        this.formatters = Collections.unmodifiableList(built);
    }

    private static DateTimeFormatter strictFormatter(String pattern) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder().appendPattern(pattern);
        if (usesYearOfEra(pattern)) {
            // strict resolving needs an era for "y"
            builder.parseDefaulting(ChronoField.ERA, 1);
        }
        return builder.toFormatter().withResolverStyle(ResolverStyle.STRICT);
    }

    private static boolean usesYearOfEra(String pattern) {
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == 'y' && !quoted) {
                return true;
            }
        }
        return false;
    }

    protected abstract V parse(String value, DateTimeFormatter formatter);

    /** Name used in error messages, e.g. "date". */
    protected abstract String typeName();

    public List<String> getPatterns() { return patterns; }

    @Override
    public V clean(String value) {
        if (Widget.isBlank(value)) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter formatter : formatters) {
            try {
                return parse(trimmed, formatter);
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        throw new ConversionException("'" + value + "' is not a valid " + typeName()
                + "; expected one of " + patterns + ".");
    }

    @Override
    public String render(V value) {
        return value == null ? "" : formatters.get(0).format(value);
    }
}
