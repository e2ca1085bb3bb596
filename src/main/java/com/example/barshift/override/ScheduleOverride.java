package com.example.barshift.override;

import com.example.barshift.common.ShiftKind;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * Manager-authored rule, one variant per behaviour. Business-wide variants carry no employee.
 */
public sealed interface ScheduleOverride {

    DayOfWeek day();

    /**
     * Rules that target one employee, optionally scoped to a shift kind ({@code ANY} = every shift).
     */
    sealed interface EmployeeOverride extends ScheduleOverride {
        String employeeId();

        ShiftKind shiftType();
    }

    record BusinessClosed(DayOfWeek day) implements ScheduleOverride {
    }

    record EarlyClose(DayOfWeek day, LocalTime closeAt) implements ScheduleOverride {
    }

    record Exclude(String employeeId, DayOfWeek day, ShiftKind shiftType) implements EmployeeOverride {
    }

    record Assign(String employeeId, DayOfWeek day, ShiftKind shiftType) implements EmployeeOverride {
    }

    /**
     * Partial-day exception: the employee arrives at {@code start} and/or leaves at {@code end}.
     */
    record CustomTime(String employeeId, DayOfWeek day, ShiftKind shiftType,
                      LocalTime start, LocalTime end) implements EmployeeOverride {

        public boolean hasStart() {
            return start != null;
        }

        public boolean hasEnd() {
            return end != null;
        }
    }

    record Prioritize(String employeeId, DayOfWeek day, ShiftKind shiftType) implements EmployeeOverride {
    }
}
