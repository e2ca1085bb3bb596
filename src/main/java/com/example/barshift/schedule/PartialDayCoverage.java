package com.example.barshift.schedule;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.common.TimeUtils;
import com.example.barshift.employee.Employee;
import com.example.barshift.override.DayPolicy;
import com.example.barshift.override.DayRules;
import com.example.barshift.override.ScheduleOverride.CustomTime;
import com.example.barshift.staffing.PlannedShift;
import com.example.barshift.staffing.ShiftOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies custom-time overrides to a day's shifts.
 * <p>
 * An employee leaving early or arriving late works the part of the matching shift that fits and
 * a one-seat coverage shift is created for the remainder. Custom hours equal to a shift's own window
 * take a seat on that shift. An override with both times that lines up with no shift becomes a
 * standalone shift reserved for that employee.
 */
@Component
public class PartialDayCoverage {

    private static final Logger logger = LoggerFactory.getLogger(PartialDayCoverage.class);

    public DayPlan plan(GenerationContext ctx, DayOfWeek day, List<PlannedShift> shifts) {
        DayPolicy policy = ctx.policy(day);
        DayRules rules = ctx.rules(day);
        List<PlannedShift> standalone = new ArrayList<>();
        List<PlannedShift> followUps = new ArrayList<>();
        if (policy.closed() || rules.customTimes().isEmpty()) {
            return new DayPlan(new ArrayList<>(shifts), followUps);
        }

        LocalDate date = ctx.dateFor(day);
        String code = TimeUtils.dayCode(day);
        for (CustomTime custom : rules.customTimes()) {
            Employee employee = ctx.employee(custom.employeeId());
            if (employee == null || !employee.active()) {
                logger.warn("Custom time on {} for unknown or inactive employee {}", day, custom.employeeId());
                continue;
            }
            if (ctx.ledger().isAssigned(employee.id(), date)) {
                continue;
            }
            if (!custom.hasStart() && !custom.hasEnd()) {
                continue;
            }

            PlannedShift target = findTarget(custom, shifts, ctx);
            if (target != null && matchesWindow(custom, target)) {
                ctx.ledger().add(new ScheduleAssignment(target.id(), employee.id(), date,
                        target.startTime(), target.endTime()));
                ctx.takeSeat(target);
                logger.debug("Custom time of {} on {} matches {} exactly", employee.id(), day, target.id());
            } else if (target != null) {
                split(ctx, employee, custom, target, policy, code, followUps);
            } else if (custom.hasStart() && custom.hasEnd()) {
                if (rules.isExcluded(employee.id(), ShiftKind.fromStart(custom.start()))) {
                    continue;
                }
                if (!policy.allowsStart(custom.start())) {
                    logger.debug("Custom shift for {} on {} starts after close, skipped", employee.id(), day);
                    continue;
                }
                ShiftKind kind = ShiftKind.fromStart(custom.start());
                LocalTime end = policy.clampEnd(custom.start(), custom.end());
                standalone.add(new PlannedShift(
                        code + "-custom-" + employee.id() + "-" + kind.label(),
                        employee.name() + " (" + TimeUtils.label(custom.start()) + " - " + TimeUtils.label(end) + ")",
                        day, date, custom.start(), end, kind, 1, false, false, ShiftOrigin.CUSTOM, employee.id()));
            } else {
                logger.debug("No {} shift on {} spans the custom time of {}", custom.shiftType().label(), day, employee.id());
            }
        }

        List<PlannedShift> queue = new ArrayList<>(standalone);
        queue.addAll(shifts);
        return new DayPlan(queue, followUps);
    }

    /**
     * A shift with exactly the custom window is taken as is. Leave-early needs a shift spanning the leave time (and starting at the custom start, if given);
     * arrive-late is the mirror image.
     */
    private PlannedShift findTarget(CustomTime custom, List<PlannedShift> shifts, GenerationContext ctx) {
        for (PlannedShift shift : shifts) {
            if (!custom.shiftType().matches(shift.kind()) || ctx.openSeats(shift) <= 0) {
                continue;
            }
            if (ctx.rules(shift.day()).isExcluded(custom.employeeId(), shift.kind())) {
                continue;
            }
            if (matchesWindow(custom, shift) || leavesEarly(custom, shift) || arrivesLate(custom, shift)) {
                return shift;
            }
        }
        return null;
    }

    private static boolean matchesWindow(CustomTime custom, PlannedShift shift) {
        return custom.hasStart() && custom.hasEnd() && shift.sameWindow(custom.start(), custom.end());
    }

    private static boolean leavesEarly(CustomTime custom, PlannedShift shift) {
        return custom.hasEnd() && shift.spans(custom.end())
                && (!custom.hasStart() || custom.start().equals(shift.startTime()));
    }

    private static boolean arrivesLate(CustomTime custom, PlannedShift shift) {
        return custom.hasStart() && shift.spans(custom.start())
                && (!custom.hasEnd() || custom.end().equals(shift.endTime()));
    }

    private void split(GenerationContext ctx, Employee employee, CustomTime custom, PlannedShift target,
                       DayPolicy policy, String code, List<PlannedShift> followUps) {
        LocalTime workStart;
        LocalTime workEnd;
        LocalTime gapStart;
        LocalTime gapEnd;
        String verb;
        if (leavesEarly(custom, target)) {
            workStart = target.startTime();
            workEnd = custom.end();
            gapStart = custom.end();
            gapEnd = target.endTime();
            verb = "leaves at " + TimeUtils.label(custom.end());
        } else {
            workStart = custom.start();
            workEnd = target.endTime();
            gapStart = target.startTime();
            gapEnd = custom.start();
            verb = "arrives at " + TimeUtils.label(custom.start());
        }

        ctx.ledger().add(new ScheduleAssignment(target.id(), employee.id(), target.date(), workStart, workEnd));
        ctx.takeSeat(target);

        if (!policy.allowsStart(gapStart)) {
            return;
        }
        gapEnd = policy.clampEnd(gapStart, gapEnd);
        String window = TimeUtils.label(gapStart) + " - " + TimeUtils.label(gapEnd);
        PlannedShift coverage = new PlannedShift(
                code + "-coverage-" + employee.id() + "-" + (followUps.size() + 1),
                "Cover for " + employee.name() + " (" + window + ")",
                target.day(), target.date(), gapStart, gapEnd, ShiftKind.fromStart(gapStart), 1,
                target.requiresBartender(), false, ShiftOrigin.COVERAGE, null);
        followUps.add(coverage);
        ctx.diagnostics().warn(new ScheduleWarning(WarningType.COVERAGE_NEEDED, employee.id(), target.date(),
                employee.name() + " " + verb + " on " + TimeUtils.dayName(target.day())
                        + ", coverage needed " + window));
        logger.debug("Split {} for {}: works {}-{}, coverage {}", target.id(), employee.id(), workStart, workEnd, window);
    }
}
