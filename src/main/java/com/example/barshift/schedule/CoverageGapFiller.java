package com.example.barshift.schedule;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.common.TimeUtils;
import com.example.barshift.employee.AvailabilityEvaluator;
import com.example.barshift.employee.Employee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Makes sure nobody below the bartending threshold works a minute without a qualified bartender
 * on the floor. Uncovered stretches are filled from the roster where possible and reported as
 * {@code no_bartender} conflicts otherwise.
 */
@Component
public class CoverageGapFiller {

    private static final Logger logger = LoggerFactory.getLogger(CoverageGapFiller.class);

    private final AvailabilityEvaluator availabilityEvaluator;

    public CoverageGapFiller(AvailabilityEvaluator availabilityEvaluator) {
        this.availabilityEvaluator = availabilityEvaluator;
    }

    public void fill(GenerationContext ctx) {
        for (DayOfWeek day : DayOfWeek.values()) {
            if (ctx.policy(day).closed()) {
                continue;
            }
            fillDay(ctx, day);
        }
    }

    void fillDay(GenerationContext ctx, DayOfWeek day) {
        LocalDate date = ctx.dateFor(day);
        int threshold = ctx.settings().getBartendingThreshold();

        List<ScheduleAssignment> lowSkill = new ArrayList<>();
        for (ScheduleAssignment assignment : ctx.ledger().assignmentsOn(date)) {
            Employee employee = ctx.employee(assignment.employeeId());
            if (employee != null && !employee.isBartender(threshold) && assignment.hasTimes()) {
                lowSkill.add(assignment);
            }
        }

        for (ScheduleAssignment low : lowSkill) {
            int start = TimeUtils.toMinutes(low.startTime());
            int end = start + TimeUtils.durationMinutes(low.startTime(), low.endTime());
            for (int[] gap : gaps(start, end, bartenderIntervals(ctx, date, threshold))) {
                coverGap(ctx, day, date, low, gap[0], gap[1], threshold);
            }
        }
    }

    /**
     * Qualified-bartender intervals on {@code date}, sorted and merged.
     */
    List<int[]> bartenderIntervals(GenerationContext ctx, LocalDate date, int threshold) {
        List<int[]> intervals = new ArrayList<>();
        for (ScheduleAssignment assignment : ctx.ledger().assignmentsOn(date)) {
            Employee employee = ctx.employee(assignment.employeeId());
            if (employee == null || !employee.isBartender(threshold) || !assignment.hasTimes()) {
                continue;
            }
            int s = TimeUtils.toMinutes(assignment.startTime());
            intervals.add(new int[]{s, s + TimeUtils.durationMinutes(assignment.startTime(), assignment.endTime())});
        }
        intervals.sort(Comparator.comparingInt(i -> i[0]));

        List<int[]> merged = new ArrayList<>();
        for (int[] interval : intervals) {
            if (!merged.isEmpty() && interval[0] <= merged.get(merged.size() - 1)[1]) {
                int[] last = merged.get(merged.size() - 1);
                last[1] = Math.max(last[1], interval[1]);
            } else {
                merged.add(new int[]{interval[0], interval[1]});
            }
        }
        return merged;
    }

    /**
     * Parts of {@code [start, end)} not covered by the merged {@code covered} intervals.
     */
    static List<int[]> gaps(int start, int end, List<int[]> covered) {
        List<int[]> gaps = new ArrayList<>();
        int cursor = start;
        for (int[] interval : covered) {
            if (interval[1] <= cursor) {
                continue;
            }
            if (interval[0] >= end) {
                break;
            }
            if (interval[0] > cursor) {
                gaps.add(new int[]{cursor, interval[0]});
            }
            cursor = Math.max(cursor, interval[1]);
            if (cursor >= end) {
                break;
            }
        }
        if (cursor < end) {
            gaps.add(new int[]{cursor, end});
        }
        return gaps;
    }

    private void coverGap(GenerationContext ctx, DayOfWeek day, LocalDate date, ScheduleAssignment low,
                          int gapStart, int gapEnd, int threshold) {
        Employee lowEmployee = ctx.employee(low.employeeId());
        LocalTime start = TimeUtils.fromMinutes(gapStart);
        LocalTime end = TimeUtils.fromMinutes(gapEnd);
        String window = TimeUtils.label(gapStart) + " - " + TimeUtils.label(gapEnd);

        Employee bartender = findBartender(ctx, day, date, start, end, threshold);
        if (bartender == null) {
            String message = String.format("No bartender on shift with %s from %s to %s on %s",
                    lowEmployee.name(), TimeUtils.label(gapStart), TimeUtils.label(gapEnd), TimeUtils.dayName(day));
            ctx.diagnostics().conflict(new ScheduleConflict(ConflictType.NO_BARTENDER, low.shiftId(), date, message));
            logger.debug(message);
            return;
        }

        String shiftId = TimeUtils.dayCode(day) + "-gap-" + bartender.id() + "-"
                + String.format("%02d%02d", start.getHour(), start.getMinute());
        ctx.ledger().add(new ScheduleAssignment(shiftId, bartender.id(), date, start, end));
        ctx.diagnostics().warn(new ScheduleWarning(WarningType.COVERAGE_NEEDED, bartender.id(), date,
                "Auto-added " + bartender.name() + " (" + window + ") to cover " + lowEmployee.name()
                        + " on " + TimeUtils.dayName(day)));
        logger.debug("Gap {} on {} covered by {}", window, date, bartender.id());
    }

    private Employee findBartender(GenerationContext ctx, DayOfWeek day, LocalDate date,
                                   LocalTime start, LocalTime end, int threshold) {
        ShiftKind kind = ShiftKind.fromStart(start);
        for (Employee employee : ctx.roster()) {
            if (!employee.active() || !employee.isBartender(threshold)
                    || ctx.ledger().isAssigned(employee.id(), date)
                    || ctx.rules(day).isExcluded(employee.id(), kind)) {
                continue;
            }
            if (!availabilityEvaluator.isAvailable(employee, day, date, kind, start)) {
                continue;
            }
            if (!availabilityEvaluator.checkRestrictions(employee, day, start, end).allowed()) {
                continue;
            }
            if (!ctx.ledger().respectsRest(employee.id(), date, start, end, ctx.settings().getMinRestHours())) {
                continue;
            }
            return employee;
        }
        return null;
    }
}
