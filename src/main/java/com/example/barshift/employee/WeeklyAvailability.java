package com.example.barshift.employee;

import jakarta.validation.Valid;

import java.time.DayOfWeek;

/**
 * Availability keyed by weekday. A missing day means "not available".
 */
public record WeeklyAvailability(
        @Valid DayAvailability monday,
        @Valid DayAvailability tuesday,
        @Valid DayAvailability wednesday,
        @Valid DayAvailability thursday,
        @Valid DayAvailability friday,
        @Valid DayAvailability saturday,
        @Valid DayAvailability sunday) {

    public static WeeklyAvailability none() {
        return new WeeklyAvailability(null, null, null, null, null, null, null);
    }

    public DayAvailability forDay(DayOfWeek day) {
        return switch (day) {
            case MONDAY -> monday;
            case TUESDAY -> tuesday;
            case WEDNESDAY -> wednesday;
            case THURSDAY -> thursday;
            case FRIDAY -> friday;
            case SATURDAY -> saturday;
            case SUNDAY -> sunday;
        };
    }
}
