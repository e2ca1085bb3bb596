package com.example.barshift.schedule;

import com.example.barshift.common.TimeUtils;
import com.example.barshift.exception.ScheduleGenerationException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Running record of one generation: every assignment plus per-employee hours and shift counts.
 * Adding the same {@code (employeeId, date, shiftId)} twice is a no-op; overlapping work for one
 * employee on one date is rejected.
 */
public class AssignmentLedger {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final List<ScheduleAssignment> assignments = new ArrayList<>();
    private final Set<Key> keys = new HashSet<>();
    private final Map<String, Double> hours = new HashMap<>();
    private final Map<String, Integer> shiftCounts = new HashMap<>();
    private final Map<LocalDate, Set<String>> employeesByDate = new HashMap<>();

    /**
     * @return false when this assignment was already recorded
     */
    public boolean add(ScheduleAssignment assignment) {
        Key key = new Key(assignment.employeeId(), assignment.date(), assignment.shiftId());
        if (keys.contains(key)) {
            return false;
        }
        for (ScheduleAssignment existing : assignments) {
            if (existing.employeeId().equals(assignment.employeeId())
                    && existing.date().equals(assignment.date())
                    && overlaps(existing, assignment)) {
                throw new ScheduleGenerationException(String.format(
                        "Employee %s double-booked on %s: %s overlaps %s",
                        assignment.employeeId(), assignment.date(), assignment.shiftId(), existing.shiftId()));
            }
        }
        keys.add(key);
        assignments.add(assignment);
        book(assignment);
        return true;
    }

    /**
     * Swaps in a filtered or truncated copy of the current assignments and recomputes the totals.
     */
    public void replaceAll(List<ScheduleAssignment> replacement) {
        assignments.clear();
        keys.clear();
        hours.clear();
        shiftCounts.clear();
        employeesByDate.clear();
        for (ScheduleAssignment assignment : replacement) {
            add(assignment);
        }
    }

    public boolean isAssigned(String employeeId, LocalDate date) {
        Set<String> ids = employeesByDate.get(date);
        return ids != null && ids.contains(employeeId);
    }

    public List<ScheduleAssignment> assignmentsOn(LocalDate date) {
        List<ScheduleAssignment> result = new ArrayList<>();
        for (ScheduleAssignment assignment : assignments) {
            if (assignment.date().equals(date)) {
                result.add(assignment);
            }
        }
        return result;
    }

    public double hoursOf(String employeeId) {
        return hours.getOrDefault(employeeId, 0.0);
    }

    public int shiftsOf(String employeeId) {
        return shiftCounts.getOrDefault(employeeId, 0);
    }

    public List<ScheduleAssignment> all() {
        return Collections.unmodifiableList(assignments);
    }

    /**
     * True when a shift on {@code date} from {@code start} to {@code end} overlaps no other assignment
     * of the employee and leaves at least {@code minRestHours} around each of them. Zero disables the check.
     */
    public boolean respectsRest(String employeeId, LocalDate date, LocalTime start, LocalTime end, int minRestHours) {
        if (minRestHours <= 0 || start == null || end == null) {
            return true;
        }
        long minGap = minRestHours * 60L;
        long candidateStart = absoluteMinutes(date, start);
        long candidateEnd = candidateStart + TimeUtils.durationMinutes(start, end);
        for (ScheduleAssignment existing : assignments) {
            if (!existing.employeeId().equals(employeeId) || !existing.hasTimes()) {
                continue;
            }
            long existingStart = absoluteMinutes(existing.date(), existing.startTime());
            long existingEnd = existingStart + TimeUtils.durationMinutes(existing.startTime(), existing.endTime());
            if (candidateStart < existingEnd && existingStart < candidateEnd) {
                return false;
            }
            if (existingEnd <= candidateStart && candidateStart - existingEnd < minGap) {
                return false;
            }
            if (candidateEnd <= existingStart && existingStart - candidateEnd < minGap) {
                return false;
            }
        }
        return true;
    }

    private void book(ScheduleAssignment assignment) {
        double duration = assignment.hasTimes()
                ? TimeUtils.durationHours(assignment.startTime(), assignment.endTime())
                : 0.0;
        hours.merge(assignment.employeeId(), duration, Double::sum);
        shiftCounts.merge(assignment.employeeId(), 1, Integer::sum);
        employeesByDate.computeIfAbsent(assignment.date(), d -> new HashSet<>()).add(assignment.employeeId());
    }

    private static boolean overlaps(ScheduleAssignment a, ScheduleAssignment b) {
        if (!a.hasTimes() || !b.hasTimes()) {
            return true;
        }
        int aStart = TimeUtils.toMinutes(a.startTime());
        int aEnd = aStart + TimeUtils.durationMinutes(a.startTime(), a.endTime());
        int bStart = TimeUtils.toMinutes(b.startTime());
        int bEnd = bStart + TimeUtils.durationMinutes(b.startTime(), b.endTime());
        return aStart < bEnd && bStart < aEnd;
    }

    private static long absoluteMinutes(LocalDate date, LocalTime time) {
        return date.toEpochDay() * MINUTES_PER_DAY + TimeUtils.toMinutes(time);
    }

    private record Key(String employeeId, LocalDate date, String shiftId) {
    }
}
