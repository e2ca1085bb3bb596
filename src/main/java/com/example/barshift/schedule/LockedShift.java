package com.example.barshift.schedule;

import com.example.barshift.common.ShiftKind;

import java.time.DayOfWeek;

/**
 * User pin: the previous run's assignment for this employee/day/kind survives regeneration.
 */
public record LockedShift(String employeeId, DayOfWeek day, ShiftKind shiftType) {

    /**
     * {@code NIGHT} pins night work; {@code MORNING} (and {@code MID}) pins anything before night.
     */
    public boolean covers(ShiftKind assignmentKind) {
        if (shiftType == null || shiftType == ShiftKind.ANY) return true;
        if (shiftType == ShiftKind.NIGHT) return assignmentKind == ShiftKind.NIGHT;
        return assignmentKind != ShiftKind.NIGHT;
    }
}
