package com.example.barshift.staffing;

import jakarta.validation.Valid;

import java.time.DayOfWeek;

public record WeeklyStaffingNeeds(
        @Valid DayStaffing monday,
        @Valid DayStaffing tuesday,
        @Valid DayStaffing wednesday,
        @Valid DayStaffing thursday,
        @Valid DayStaffing friday,
        @Valid DayStaffing saturday,
        @Valid DayStaffing sunday) {

    public DayStaffing forDay(DayOfWeek day) {
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
