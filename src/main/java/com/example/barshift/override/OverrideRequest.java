package com.example.barshift.override;

import com.example.barshift.common.ShiftKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Override as authored by the rules editor. Two sentinel employee ids mark business-wide rules:
 * {@link OverrideMapper#ALL_EMPLOYEES} and {@link OverrideMapper#CLOSE_EARLY}.
 */
public record OverrideRequest(
        String id,
        @NotNull(message = "Override type is required")
        OverrideType type,
        @NotBlank(message = "Override employeeId is required")
        String employeeId,
        @NotNull(message = "Override day is required")
        DayOfWeek day,
        ShiftKind shiftType,
        LocalTime customStartTime,
        LocalTime customEndTime,
        String note) {
}
