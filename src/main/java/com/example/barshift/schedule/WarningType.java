package com.example.barshift.schedule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WarningType {
    OVERTIME,
    UNDER_HOURS,
    COVERAGE_NEEDED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
