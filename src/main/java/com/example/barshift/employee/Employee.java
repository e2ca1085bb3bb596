package com.example.barshift.employee;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.DayOfWeek;
import java.util.List;

/**
 * Roster entry as supplied by roster management. Read-only to the scheduler.
 */
public record Employee(
        @NotBlank(message = "Employee id is required")
        String id,

        @NotBlank(message = "Employee name is required")
        @Size(max = 50, message = "Employee name must be 50 characters or fewer")
        String name,

        @Min(value = 0, message = "Bartending scale must be 0 or greater")
        @Max(value = 5, message = "Bartending scale must be 5 or less")
        int bartendingScale,

        @Min(value = 0, message = "Alone scale must be 0 or greater")
        @Max(value = 5, message = "Alone scale must be 5 or less")
        int aloneScale,

        @Valid
        WeeklyAvailability availability,

        List<@Valid Restriction> restrictions,

        List<Exclusion> exclusions,

        Preferences preferences,

        @Min(value = 0, message = "Minimum shifts per week must be 0 or greater")
        Integer minShiftsPerWeek,

        List<SetScheduleEntry> setSchedule,

        Boolean isActive) {

    public Employee {
        restrictions = restrictions == null ? List.of() : List.copyOf(restrictions);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        setSchedule = setSchedule == null ? List.of() : List.copyOf(setSchedule);
        preferences = preferences == null ? Preferences.none() : preferences;
        availability = availability == null ? WeeklyAvailability.none() : availability;
    }

    public boolean active() {
        return isActive == null || isActive;
    }

    public boolean isBartender(int threshold) {
        return bartendingScale >= threshold;
    }

    public int minShifts() {
        return minShiftsPerWeek == null ? 0 : minShiftsPerWeek;
    }

    public DayAvailability availabilityFor(DayOfWeek day) {
        return availability.forDay(day);
    }
}
