package com.example.barshift.schedule;

import java.time.LocalDate;

/**
 * Unmet hard constraint.
 */
public record ScheduleConflict(ConflictType type, String shiftId, LocalDate date, String message) {
}
