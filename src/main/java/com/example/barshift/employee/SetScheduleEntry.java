package com.example.barshift.employee;

import com.example.barshift.common.ShiftKind;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Recurring fixed assignment. Missing times fall back to the day's legacy morning/night window.
 */
public record SetScheduleEntry(DayOfWeek day, ShiftKind shiftType, LocalTime startTime, LocalTime endTime) {

    public SetScheduleEntry {
        shiftType = shiftType == null ? ShiftKind.MORNING : shiftType;
    }
}
