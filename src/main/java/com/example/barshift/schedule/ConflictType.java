package com.example.barshift.schedule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConflictType {
    NO_COVERAGE,
    NO_BARTENDER,
    RULE_VIOLATION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
