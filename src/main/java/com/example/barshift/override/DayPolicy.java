package com.example.barshift.override;

import com.example.barshift.common.TimeUtils;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Business-wide state of one weekday, computed once before any shift exists and shared by
 * every stage that has to respect closures.
 */
public record DayPolicy(DayOfWeek day, boolean closed, LocalTime closeAt) {

    public static DayPolicy open(DayOfWeek day) {
        return new DayPolicy(day, false, null);
    }

    public Optional<LocalTime> earlyClose() {
        return Optional.ofNullable(closeAt);
    }

    /**
     * False on a closed day, or when {@code start} is at or after the early-close time.
     */
    public boolean allowsStart(LocalTime start) {
        if (closed) return false;
        if (closeAt == null || start == null) return true;
        return TimeUtils.toMinutes(start) < TimeUtils.toMinutes(closeAt);
    }

    /**
     * Caps {@code end} at the early-close time. Shifts that run past midnight count as ending late.
     */
    public LocalTime clampEnd(LocalTime start, LocalTime end) {
        if (closeAt == null || start == null || end == null) return end;
        int startMin = TimeUtils.toMinutes(start);
        int endMin = startMin + TimeUtils.durationMinutes(start, end);
        return endMin > TimeUtils.toMinutes(closeAt) ? closeAt : end;
    }

    public String closedMessage() {
        return TimeUtils.dayName(day) + " - CLOSED";
    }

    public String earlyCloseMessage() {
        return TimeUtils.dayName(day) + " - Closing early at " + TimeUtils.label(closeAt);
    }
}
