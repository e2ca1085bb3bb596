package com.example.barshift.employee;

import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

/**
 * Hard time constraint on an employee. {@code time} is the bound for {@code NO_BEFORE}/{@code NO_AFTER};
 * {@code startTime}/{@code endTime} describe an {@code UNAVAILABLE_RANGE}. An empty day list means every day.
 */
public record Restriction(
        String id,
        @NotNull(message = "Restriction type is required")
        RestrictionType type,
        LocalTime time,
        LocalTime startTime,
        LocalTime endTime,
        List<DayOfWeek> days,
        String reason) {

    public Restriction {
        days = days == null ? List.of() : List.copyOf(days);
    }

    public boolean appliesTo(DayOfWeek day) {
        return days.isEmpty() || days.contains(day);
    }
}
