package com.example.barshift.staffing;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StaffingIssueType {
    MULTIPLE_OPENERS_AT_OPEN,
    BAR_STARTS_TOO_EARLY,
    OPENER_ENDS_TOO_LATE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
