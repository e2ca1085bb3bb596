package com.example.barshift.staffing;

public enum ShiftOrigin {
    SLOT,
    LEGACY,
    FALLBACK,
    CUSTOM,
    COVERAGE
}
