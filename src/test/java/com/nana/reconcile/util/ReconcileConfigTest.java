package com.nana.reconcile.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ReconcileConfigTest {

    private static ReconcileConfig config(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return new ReconcileConfig(props);
    }

    @Test
    @DisplayName("Built-in defaults apply when nothing is overridden")
    void defaults() {
        ReconcileConfig config = new ReconcileConfig(new Properties());

        assertFalse(config.isUseTransactions());
        assertEquals(List.of("yyyy-MM-dd"), config.getDateInputFormats());
        assertEquals(List.of("HH:mm:ss", "HH:mm"), config.getTimeInputFormats());
        assertEquals(2, config.getDateTimeInputFormats().size());
        assertEquals("jdbc:sqlite::memory:", config.getDatasourceUrl());
    }

    @ParameterizedTest(name = "[{index}] \"{0}\" -> {1}")
    @CsvSource({
            "true,  true",
            "YES,   true",
            "1,     true",
            "false, false",
            "off,   false"
    })
    @DisplayName("Transaction default accepts boolean spellings")
    void useTransactions_parsesBooleans(String raw, boolean expected) {
        assertEquals(expected, config(ReconcileConfig.KEY_USE_TRANSACTIONS, raw).isUseTransactions());
    }

    @Test
    @DisplayName("Format lists are split on | and trimmed")
    void formats_areSplit() {
        ReconcileConfig config = config(ReconcileConfig.KEY_DATE_FORMATS, "dd/MM/yyyy | yyyy-MM-dd|");

        assertEquals(List.of("dd/MM/yyyy", "yyyy-MM-dd"), config.getDateInputFormats());
    }

    @Test
    @DisplayName("An empty format list is a configuration error")
    void emptyFormats_rejected() {
        ReconcileConfig config = config(ReconcileConfig.KEY_TIME_FORMATS, " | ");
        assertThrows(IllegalStateException.class, config::getTimeInputFormats);
    }

    @Test
    @DisplayName("The shared instance is created once")
    void sharedInstance() {
        assertSame(ReconcileConfig.getInstance(), ReconcileConfig.getInstance());
    }
}
