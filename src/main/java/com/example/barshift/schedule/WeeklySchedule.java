package com.example.barshift.schedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of one generation run. Superseded, never mutated, by the next run.
 */
public record WeeklySchedule(LocalDate weekStart,
                             List<ScheduleAssignment> assignments,
                             List<ScheduleConflict> conflicts,
                             List<ScheduleWarning> warnings) {

    public WeeklySchedule {
        assignments = List.copyOf(assignments);
        conflicts = List.copyOf(conflicts);
        warnings = List.copyOf(warnings);
    }
}
