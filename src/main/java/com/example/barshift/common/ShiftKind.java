package com.example.barshift.common;

import java.time.LocalTime;

/**
 * Time-of-day bucket of a shift. {@code ANY} and {@code CUSTOM} only appear on availability
 * entries and override targets, never on a concrete shift.
 */
public enum ShiftKind {
    ANY,
    MORNING,
    MID,
    NIGHT,
    CUSTOM;

    private static final int MID_START_HOUR = 12;
    private static final int NIGHT_START_HOUR = 15;

    /**
     * Infers the bucket of a concrete shift from its start time:
     * before 12:00 is morning, 15:00 and later is night, anything between is mid.
     */
    public static ShiftKind fromStart(LocalTime start) {
        if (start == null) {
            return MORNING;
        }
        int hour = start.getHour();
        if (hour < MID_START_HOUR) {
            return MORNING;
        }
        if (hour >= NIGHT_START_HOUR) {
            return NIGHT;
        }
        return MID;
    }

    /**
     * True when a rule scoped to this kind applies to a shift of {@code concrete} kind.
     */
    public boolean matches(ShiftKind concrete) {
        return this == ANY || this == concrete;
    }

    public String label() {
        return name().toLowerCase();
    }
}
