package com.nana.reconcile.widget;

import com.nana.reconcile.util.ReconcileConfig;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

public class DateWidget extends TemporalWidget<LocalDate> {

    /** Uses the patterns configured in {@link ReconcileConfig}. */
    public DateWidget() {
        this(ReconcileConfig.getInstance().getDateInputFormats());
    }

    public DateWidget(List<String> patterns) {
        super(patterns);
    }

    @Override
    protected LocalDate parse(String value, DateTimeFormatter formatter) {
        return LocalDate.parse(value, formatter);
    }

    @Override
    protected String typeName() {
        return "date";
    }
}
