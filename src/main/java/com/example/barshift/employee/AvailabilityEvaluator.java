package com.example.barshift.employee;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.common.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Decides whether an employee may take a candidate shift. Both checks fail closed.
 */
@Component
public class AvailabilityEvaluator {

    /**
     * True when no exclusion covers {@code date}, the day is marked available, and some declared
     * entry accepts a {@code kind} shift starting at {@code startTime}.
     */
    public boolean isAvailable(Employee employee, DayOfWeek day, LocalDate date, ShiftKind kind, LocalTime startTime) {
        for (Exclusion exclusion : employee.exclusions()) {
            if (exclusion.contains(date)) {
                return false;
            }
        }

        DayAvailability dayAvail = employee.availabilityFor(day);
        if (dayAvail == null || !dayAvail.available()) {
            return false;
        }

        int start = TimeUtils.toMinutes(startTime);
        for (AvailableShift entry : dayAvail.shifts()) {
            ShiftKind type = entry.type();
            if (type == ShiftKind.ANY || type == kind) {
                if (entry.startTime() != null && start < TimeUtils.toMinutes(entry.startTime())) {
                    continue;
                }
                return true;
            }
            if (type == ShiftKind.CUSTOM && entry.startTime() != null && entry.endTime() != null
                    && TimeUtils.inRange(startTime, entry.startTime(), entry.endTime())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Applies the employee's restrictions scoped to {@code day}; the first violation wins.
     */
    public RestrictionCheck checkRestrictions(Employee employee, DayOfWeek day, LocalTime shiftStart, LocalTime shiftEnd) {
        int start = TimeUtils.toMinutes(shiftStart);
        int end = start + TimeUtils.durationMinutes(shiftStart, shiftEnd);

        for (Restriction restriction : employee.restrictions()) {
            if (!restriction.appliesTo(day)) {
                continue;
            }
            switch (restriction.type()) {
                case NO_BEFORE -> {
                    if (restriction.time() != null && start < TimeUtils.toMinutes(restriction.time())) {
                        return RestrictionCheck.deny(withReason(
                                "Can't work before " + TimeUtils.label(restriction.time()), restriction));
                    }
                }
                case NO_AFTER -> {
                    if (restriction.time() != null && end > TimeUtils.toMinutes(restriction.time())) {
                        return RestrictionCheck.deny(withReason(
                                "Can't work after " + TimeUtils.label(restriction.time()), restriction));
                    }
                }
                case UNAVAILABLE_RANGE -> {
                    if (restriction.startTime() == null || restriction.endTime() == null) {
                        continue;
                    }
                    int blockStart = TimeUtils.toMinutes(restriction.startTime());
                    int blockEnd = TimeUtils.toMinutes(restriction.endTime());
                    if (start < blockEnd && blockStart < end) {
                        return RestrictionCheck.deny(withReason("Unavailable "
                                + TimeUtils.label(restriction.startTime()) + " - "
                                + TimeUtils.label(restriction.endTime()), restriction));
                    }
                }
            }
        }
        return RestrictionCheck.allow();
    }

    private String withReason(String message, Restriction restriction) {
        String reason = restriction.reason();
        return (reason == null || reason.isBlank()) ? message : message + " (" + reason + ")";
    }
}
