package com.example.barshift.staffing;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalTime;
import java.util.Map;

/**
 * @param openTimes business opening time keyed by lowercase day name; missing days open at 07:15
 */
public record StaffingValidationRequest(
        @NotNull(message = "staffingNeeds is required")
        @Valid WeeklyStaffingNeeds staffingNeeds,
        Map<String, LocalTime> openTimes) {

    public StaffingValidationRequest {
        openTimes = openTimes == null ? Map.of() : openTimes;
    }
}
