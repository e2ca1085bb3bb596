package com.example.barshift.schedule;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * One employee on one shift on one date. {@code (employeeId, date, shiftId)} is unique per schedule.
 */
public record ScheduleAssignment(String shiftId, String employeeId, LocalDate date,
                                 LocalTime startTime, LocalTime endTime) {

    public ScheduleAssignment withTimes(LocalTime start, LocalTime end) {
        return new ScheduleAssignment(shiftId, employeeId, date, start, end);
    }

    public boolean hasTimes() {
        return startTime != null && endTime != null;
    }
}
