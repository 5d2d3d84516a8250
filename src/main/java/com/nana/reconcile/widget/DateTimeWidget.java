package com.nana.reconcile.widget;

import com.nana.reconcile.util.ReconcileConfig;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

public class DateTimeWidget extends TemporalWidget<LocalDateTime> {

    /** Uses the patterns configured in {@link ReconcileConfig}. */
    public DateTimeWidget() {
        this(ReconcileConfig.getInstance().getDateTimeInputFormats());
    }

    public DateTimeWidget(List<String> patterns) {
        super(patterns);
    }

    @Override
    protected LocalDateTime parse(String value, DateTimeFormatter formatter) {
        return LocalDateTime.parse(value, formatter);
    }

    @Override
    protected String typeName() {
        return "date-time";
    }
}
