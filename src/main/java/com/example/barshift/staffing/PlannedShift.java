package com.example.barshift.staffing;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.common.TimeUtils;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Concrete shift waiting for employees. {@code designatedEmployeeId} is set on custom shifts
 * created for one employee's partial-day exception. {@code requiresSolo} marks a shift that has
 * stretches with one person on the floor.
 */
public record PlannedShift(
        String id,
        String name,
        DayOfWeek day,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        ShiftKind kind,
        int requiredStaff,
        boolean requiresBartender,
        boolean requiresSolo,
        ShiftOrigin origin,
        String designatedEmployeeId) {

    public PlannedShift withEnd(LocalTime end) {
        return new PlannedShift(id, name, day, date, startTime, end, kind, requiredStaff,
                requiresBartender, requiresSolo, origin, designatedEmployeeId);
    }

    public PlannedShift withSolo(boolean solo) {
        return new PlannedShift(id, name, day, date, startTime, endTime, kind, requiredStaff,
                requiresBartender, solo, origin, designatedEmployeeId);
    }

    public boolean sameWindow(LocalTime start, LocalTime end) {
        return startTime.equals(start) && endTime.equals(end);
    }

    public boolean spans(LocalTime time) {
        int t = TimeUtils.toMinutes(time);
        return t > TimeUtils.toMinutes(startTime) && t < TimeUtils.toMinutes(startTime) + TimeUtils.durationMinutes(startTime, endTime);
    }
}
