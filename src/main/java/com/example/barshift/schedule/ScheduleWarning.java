package com.example.barshift.schedule;

import java.time.LocalDate;

/**
 * Soft issue. {@code employeeId} and {@code date} are absent for week-wide or business-wide notices.
 */
public record ScheduleWarning(WarningType type, String employeeId, LocalDate date, String message) {
}
