package com.nana.reconcile.widget;

import com.nana.reconcile.util.ReconcileConfig;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

public class TimeWidget extends TemporalWidget<LocalTime> {

    /** Uses the patterns configured in {@link ReconcileConfig}. */
    public TimeWidget() {
        this(ReconcileConfig.getInstance().getTimeInputFormats());
    }

    public TimeWidget(List<String> patterns) {
        super(patterns);
    }

    @Override
    protected LocalTime parse(String value, DateTimeFormatter formatter) {
        return LocalTime.parse(value, formatter);
    }

    @Override
    protected String typeName() {
        return "time";
    }
}
