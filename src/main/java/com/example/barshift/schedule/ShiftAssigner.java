package com.example.barshift.schedule;

import com.example.barshift.common.TimeUtils;
import com.example.barshift.employee.AvailabilityEvaluator;
import com.example.barshift.employee.Employee;
import com.example.barshift.employee.RestrictionCheck;
import com.example.barshift.override.DayRules;
import com.example.barshift.staffing.PlannedShift;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Fills the seats of one planned shift.
 * <ol>
 *   <li>forced employees (assign/custom-time overrides, or the shift's designated employee)</li>
 *   <li>a qualified bartender when the shift needs one and none is on it yet</li>
 *   <li>once a bartender is on the shift, employees who only work next to one</li>
 *   <li>everyone else eligible, prioritized first, then fewest hours so far</li>
 * </ol>
 * Shifts with solo time only take employees whose alone rating reaches the configured threshold.
 * Seats still open afterwards are reported as a {@code no_coverage} conflict.
 */
@Component
public class ShiftAssigner {

    private static final Logger logger = LoggerFactory.getLogger(ShiftAssigner.class);

    private final AvailabilityEvaluator availabilityEvaluator;

    public ShiftAssigner(AvailabilityEvaluator availabilityEvaluator) {
        this.availabilityEvaluator = availabilityEvaluator;
    }

    public void assign(GenerationContext ctx, PlannedShift shift) {
        if (ctx.openSeats(shift) <= 0) {
            return;
        }
        DayRules rules = ctx.rules(shift.day());
        AssignmentLedger ledger = ctx.ledger();
        int threshold = ctx.settings().getBartendingThreshold();

        List<String> forced = shift.designatedEmployeeId() != null
                ? List.of(shift.designatedEmployeeId())
                : rules.forcedFor(shift.kind());
        for (String employeeId : forced) {
            if (ctx.openSeats(shift) <= 0) {
                break;
            }
            Employee employee = ctx.employee(employeeId);
            if (employee == null) {
                logger.warn("Override for unknown employee {} on {}", employeeId, shift.date());
                continue;
            }
            if (!employee.active() || ledger.isAssigned(employeeId, shift.date())
                    || rules.isExcluded(employeeId, shift.kind())) {
                continue;
            }
            place(ctx, shift, employee);
        }
        if (shift.designatedEmployeeId() != null) {
            reportShortfall(ctx, shift);
            return;
        }

        List<Employee> candidates = rankedCandidates(ctx, shift, rules);

        if (shift.requiresBartender() && ctx.openSeats(shift) > 0 && !hasBartender(ctx, shift, threshold)) {
            for (Employee candidate : candidates) {
                if (candidate.isBartender(threshold)) {
                    place(ctx, shift, candidate);
                    candidates.remove(candidate);
                    break;
                }
            }
        }

        boolean bartenderOnShift = hasBartender(ctx, shift, threshold);
        if (bartenderOnShift) {
            for (Employee candidate : List.copyOf(candidates)) {
                if (ctx.openSeats(shift) <= 0) {
                    break;
                }
                if (candidate.preferences().needsBartender()) {
                    place(ctx, shift, candidate);
                    candidates.remove(candidate);
                }
            }
        }

        for (Employee candidate : candidates) {
            if (ctx.openSeats(shift) <= 0) {
                break;
            }
            if (candidate.preferences().needsBartender() && !bartenderOnShift) {
                logger.debug("{} skipped for {}: no bartender on shift", candidate.id(), shift.id());
                continue;
            }
            place(ctx, shift, candidate);
            bartenderOnShift |= candidate.isBartender(threshold);
        }
        reportShortfall(ctx, shift);
    }

    private List<Employee> rankedCandidates(GenerationContext ctx, PlannedShift shift, DayRules rules) {
        AssignmentLedger ledger = ctx.ledger();
        int minRest = ctx.settings().getMinRestHours();
        int aloneThreshold = ctx.settings().getAloneThreshold();
        List<Employee> candidates = new ArrayList<>();
        for (Employee employee : ctx.roster()) {
            if (!employee.active() || ledger.isAssigned(employee.id(), shift.date())
                    || rules.isExcluded(employee.id(), shift.kind())) {
                continue;
            }
            if (shift.requiresSolo() && employee.aloneScale() < aloneThreshold) {
                logger.debug("{} skipped for {}: shift has solo time", employee.id(), shift.id());
                continue;
            }
            RestrictionCheck check = availabilityEvaluator.checkRestrictions(
                    employee, shift.day(), shift.startTime(), shift.endTime());
            if (!check.allowed()) {
                logger.debug("{} skipped for {}: {}", employee.id(), shift.id(), check.reason());
                continue;
            }
            if (!availabilityEvaluator.isAvailable(employee, shift.day(), shift.date(), shift.kind(), shift.startTime())) {
                continue;
            }
            if (!ledger.respectsRest(employee.id(), shift.date(), shift.startTime(), shift.endTime(), minRest)) {
                logger.debug("{} skipped for {}: less than {}h rest", employee.id(), shift.id(), minRest);
                continue;
            }
            candidates.add(employee);
        }

        Set<String> prioritized = rules.prioritizedFor(shift.kind());
        candidates.sort(Comparator
                .comparing((Employee e) -> !prioritized.contains(e.id()))
                .thenComparingDouble(e -> ledger.hoursOf(e.id())));
        return candidates;
    }

    private boolean hasBartender(GenerationContext ctx, PlannedShift shift, int threshold) {
        for (ScheduleAssignment assignment : ctx.ledger().assignmentsOn(shift.date())) {
            if (!assignment.shiftId().equals(shift.id())) {
                continue;
            }
            Employee employee = ctx.employee(assignment.employeeId());
            if (employee != null && employee.isBartender(threshold)) {
                return true;
            }
        }
        return false;
    }

    private void place(GenerationContext ctx, PlannedShift shift, Employee employee) {
        ctx.ledger().add(new ScheduleAssignment(shift.id(), employee.id(), shift.date(),
                shift.startTime(), shift.endTime()));
        ctx.takeSeat(shift);
    }

    private void reportShortfall(GenerationContext ctx, PlannedShift shift) {
        int open = ctx.openSeats(shift);
        if (open <= 0) {
            return;
        }
        int found = shift.requiredStaff() - open;
        String message = String.format("Need %d staff for %s on %s, only found %d",
                shift.requiredStaff(), shift.name(), TimeUtils.dayName(shift.day()), found);
        ctx.diagnostics().conflict(new ScheduleConflict(ConflictType.NO_COVERAGE, shift.id(), shift.date(), message));
        logger.debug(message);
    }
}
