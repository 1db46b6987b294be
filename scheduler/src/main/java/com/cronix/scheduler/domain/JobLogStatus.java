package com.cronix.scheduler.domain;

import java.util.Locale;

public enum JobLogStatus {
    RUNNING,
    SUCCESS,
    FAILURE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobLogStatus fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
