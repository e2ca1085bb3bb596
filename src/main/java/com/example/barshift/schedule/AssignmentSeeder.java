package com.example.barshift.schedule;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.common.TimeUtils;
import com.example.barshift.config.SchedulerSettings.TimeWindow;
import com.example.barshift.employee.Employee;
import com.example.barshift.employee.SetScheduleEntry;
import com.example.barshift.override.DayPolicy;
import com.example.barshift.staffing.PlannedShift;
import com.example.barshift.staffing.ShiftSlotBuilder;
import com.example.barshift.staffing.WeeklyStaffingNeeds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Places assignments that exist before any greedy choice: locked carry-overs from the previous
 * run, then every employee's fixed weekly schedule.
 */
@Component
public class AssignmentSeeder {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentSeeder.class);

    private final ShiftSlotBuilder slotBuilder;

    public AssignmentSeeder(ShiftSlotBuilder slotBuilder) {
        this.slotBuilder = slotBuilder;
    }

    /**
     * Re-inserts the prior assignment matching each lock. Locks on closed days, or whose shift would
     * start at or after an early close, are dropped; later ends are truncated to the close.
     */
    public void applyLocks(GenerationContext ctx, List<LockedShift> locks,
                           List<ScheduleAssignment> existing, Map<DayOfWeek, List<PlannedShift>> week) {
        for (LockedShift lock : locks) {
            if (lock == null || lock.employeeId() == null || lock.day() == null) {
                continue;
            }
            Employee employee = ctx.employee(lock.employeeId());
            if (employee == null || !employee.active()) {
                logger.debug("Skipping lock for {}: not on the active roster", lock.employeeId());
                continue;
            }
            DayPolicy policy = ctx.policy(lock.day());
            if (policy.closed()) {
                logger.debug("Dropping lock for {} on closed {}", lock.employeeId(), lock.day());
                continue;
            }
            LocalDate date = ctx.dateFor(lock.day());
            if (ctx.ledger().isAssigned(employee.id(), date)) {
                continue;
            }

            Optional<ScheduleAssignment> prior = findPrior(lock, date, existing, week.get(lock.day()));
            if (prior.isEmpty()) {
                logger.debug("No prior assignment for lock {} on {} ({})", lock.employeeId(), date, lock.shiftType());
                continue;
            }
            ScheduleAssignment previous = prior.get();
            if (!policy.allowsStart(previous.startTime())) {
                logger.debug("Dropping lock for {} on {}: starts after early close", employee.id(), date);
                continue;
            }
            LocalTime end = policy.clampEnd(previous.startTime(), previous.endTime());
            ctx.ledger().add(previous.withTimes(previous.startTime(), end));
            ctx.takeSeat(date, previous.shiftId());
        }
    }

    /**
     * Places each active employee's standing shifts. A fixed shift identical in time to an open
     * planned shift takes one of its seats; otherwise it gets an id of its own.
     */
    public void applyFixedShifts(GenerationContext ctx, WeeklyStaffingNeeds needs,
                                 Map<DayOfWeek, List<PlannedShift>> week) {
        for (Employee employee : ctx.roster()) {
            if (!employee.active()) {
                continue;
            }
            for (SetScheduleEntry entry : employee.setSchedule()) {
                if (entry == null || entry.day() == null) {
                    continue;
                }
                DayOfWeek day = entry.day();
                DayPolicy policy = ctx.policy(day);
                if (policy.closed()) {
                    continue;
                }
                LocalDate date = ctx.dateFor(day);
                if (ctx.ledger().isAssigned(employee.id(), date)) {
                    continue;
                }
                ShiftKind windowKind = entry.shiftType() == ShiftKind.NIGHT ? ShiftKind.NIGHT : ShiftKind.MORNING;
                TimeWindow window = slotBuilder.legacyWindow(needs == null ? null : needs.forDay(day), windowKind);
                LocalTime start = entry.startTime() != null ? entry.startTime() : window.start();
                LocalTime end = entry.endTime() != null ? entry.endTime() : window.end();
                ShiftKind kind = ShiftKind.fromStart(start);
                if (ctx.rules(day).isExcluded(employee.id(), kind)) {
                    logger.debug("Fixed {} shift of {} on {} excluded by override", kind.label(), employee.id(), day);
                    continue;
                }
                if (!policy.allowsStart(start)) {
                    continue;
                }
                end = policy.clampEnd(start, end);

                String shiftId = TimeUtils.dayCode(day) + "-fixed-" + employee.id() + "-" + kind.label();
                for (PlannedShift shift : week.getOrDefault(day, List.of())) {
                    if (shift.sameWindow(start, end) && ctx.openSeats(shift) > 0) {
                        shiftId = shift.id();
                        ctx.takeSeat(shift);
                        break;
                    }
                }
                ctx.ledger().add(new ScheduleAssignment(shiftId, employee.id(), date, start, end));
                logger.debug("Fixed shift {} for {} on {}", shiftId, employee.id(), date);
            }
        }
    }

    private Optional<ScheduleAssignment> findPrior(LockedShift lock, LocalDate date,
                                                   List<ScheduleAssignment> existing, List<PlannedShift> dayShifts) {
        for (ScheduleAssignment candidate : existing) {
            if (candidate == null || !lock.employeeId().equals(candidate.employeeId())
                    || !date.equals(candidate.date()) || candidate.shiftId() == null) {
                continue;
            }
            ScheduleAssignment timed = withPlannedTimes(candidate, dayShifts);
            if (timed == null) {
                continue;
            }
            if (lock.covers(ShiftKind.fromStart(timed.startTime()))) {
                return Optional.of(timed);
            }
        }
        return Optional.empty();
    }

    /**
     * Older assignments may lack times; they inherit the times of the planned shift with the same id.
     */
    private ScheduleAssignment withPlannedTimes(ScheduleAssignment assignment, List<PlannedShift> dayShifts) {
        if (assignment.hasTimes()) {
            return assignment;
        }
        if (dayShifts != null) {
            for (PlannedShift shift : dayShifts) {
                if (shift.id().equals(assignment.shiftId())) {
                    return assignment.withTimes(shift.startTime(), shift.endTime());
                }
            }
        }
        return null;
    }
}
