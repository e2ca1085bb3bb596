package com.example.barshift.schedule;

import com.example.barshift.config.SchedulerSettings;
import com.example.barshift.employee.Employee;
import com.example.barshift.override.DayPolicy;
import com.example.barshift.override.DayRules;
import com.example.barshift.override.OverrideMapper;
import com.example.barshift.override.OverrideResolver;
import com.example.barshift.override.ScheduleOverride;
import com.example.barshift.staffing.PlannedShift;
import com.example.barshift.staffing.ShiftSlotBuilder;
import com.example.barshift.staffing.WeeklyStaffingNeeds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Map;

/**
 * Produces a weekly schedule from a roster, staffing needs and overrides.
 * <p>
 * Stages run in a fixed order: closures are resolved and shifts are built, locked and fixed
 * assignments are seeded, each day is filled Monday to Sunday, bartender gaps are covered,
 * closures are enforced once more, and finally overrides and weekly workloads are reviewed.
 * The same input always yields the same output.
 */
@Service
public class ScheduleGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleGenerator.class);

    private final SchedulerSettings settings;
    private final OverrideMapper overrideMapper;
    private final OverrideResolver overrideResolver;
    private final ShiftSlotBuilder slotBuilder;
    private final AssignmentSeeder seeder;
    private final PartialDayCoverage partialDayCoverage;
    private final ShiftAssigner shiftAssigner;
    private final CoverageGapFiller gapFiller;
    private final ScheduleSafetyNet safetyNet;
    private final OverrideVerifier overrideVerifier;

    public ScheduleGenerator(SchedulerSettings settings,
                             OverrideMapper overrideMapper,
                             OverrideResolver overrideResolver,
                             ShiftSlotBuilder slotBuilder,
                             AssignmentSeeder seeder,
                             PartialDayCoverage partialDayCoverage,
                             ShiftAssigner shiftAssigner,
                             CoverageGapFiller gapFiller,
                             ScheduleSafetyNet safetyNet,
                             OverrideVerifier overrideVerifier) {
        this.settings = settings;
        this.overrideMapper = overrideMapper;
        this.overrideResolver = overrideResolver;
        this.slotBuilder = slotBuilder;
        this.seeder = seeder;
        this.partialDayCoverage = partialDayCoverage;
        this.shiftAssigner = shiftAssigner;
        this.gapFiller = gapFiller;
        this.safetyNet = safetyNet;
        this.overrideVerifier = overrideVerifier;
    }

    public WeeklySchedule generate(ScheduleRequest request) {
        return generate(request.weekStart(),
                overrideMapper.map(request.overrides()),
                request.employees(),
                request.staffingNeeds(),
                request.lockedShifts(),
                request.existingAssignments());
    }

    /**
     * @param anchor any date of the target week; the schedule always starts on that week's Monday
     * @param needs  {@code null} switches to the fallback template
     */
    public WeeklySchedule generate(LocalDate anchor,
                                   List<ScheduleOverride> overrides,
                                   List<Employee> employees,
                                   WeeklyStaffingNeeds needs,
                                   List<LockedShift> locks,
                                   List<ScheduleAssignment> existing) {
        LocalDate weekStart = anchor.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        logger.info("Generating schedule for week {} ({} employees, {} overrides, {} locks)",
                weekStart, employees.size(), overrides.size(), locks.size());

        Map<DayOfWeek, DayPolicy> policies = overrideResolver.resolvePolicies(overrides);
        Map<DayOfWeek, DayRules> rules = overrideResolver.resolveRules(overrides);
        GenerationContext ctx = new GenerationContext(weekStart, employees, policies, rules, settings);
        Map<DayOfWeek, List<PlannedShift>> week = slotBuilder.buildWeek(weekStart, needs, policies);

        seeder.applyLocks(ctx, locks, existing, week);
        seeder.applyFixedShifts(ctx, needs, week);

        for (DayOfWeek day : DayOfWeek.values()) {
            if (ctx.policy(day).closed()) {
                continue;
            }
            DayPlan plan = partialDayCoverage.plan(ctx, day, week.get(day));
            for (PlannedShift shift : plan.queue()) {
                shiftAssigner.assign(ctx, shift);
            }
            for (PlannedShift shift : plan.followUps()) {
                shiftAssigner.assign(ctx, shift);
            }
        }

        gapFiller.fill(ctx);
        safetyNet.apply(ctx);
        overrideVerifier.verify(ctx, overrides);
        reviewWorkloads(ctx);

        WeeklySchedule schedule = new WeeklySchedule(weekStart, ctx.ledger().all(),
                ctx.diagnostics().conflicts(), ctx.diagnostics().warnings());
        logger.info("Schedule for week {}: {} assignments, {} conflicts, {} warnings", weekStart,
                schedule.assignments().size(), schedule.conflicts().size(), schedule.warnings().size());
        return schedule;
    }

    /**
     * Under-hours and overtime warnings, computed from the final assignments.
     */
    private void reviewWorkloads(GenerationContext ctx) {
        AssignmentLedger ledger = ctx.ledger();
        for (Employee employee : ctx.roster()) {
            if (!employee.active()) {
                continue;
            }
            int shifts = ledger.shiftsOf(employee.id());
            if (employee.minShifts() > 0 && shifts < employee.minShifts()) {
                ctx.diagnostics().warn(new ScheduleWarning(WarningType.UNDER_HOURS, employee.id(), null,
                        String.format("%s wants %d shifts but only scheduled for %d",
                                employee.name(), employee.minShifts(), shifts)));
            }
            double hours = ledger.hoursOf(employee.id());
            if (hours > settings.getOvertimeThresholdHours()) {
                ctx.diagnostics().warn(new ScheduleWarning(WarningType.OVERTIME, employee.id(), null,
                        String.format("%s is scheduled for %.1f hours", employee.name(), hours)));
            }
        }
    }
}
