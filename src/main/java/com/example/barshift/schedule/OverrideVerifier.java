package com.example.barshift.schedule;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.common.TimeUtils;
import com.example.barshift.employee.Employee;
import com.example.barshift.override.ScheduleOverride;
import com.example.barshift.override.ScheduleOverride.Assign;
import com.example.barshift.override.ScheduleOverride.CustomTime;
import com.example.barshift.override.ScheduleOverride.Exclude;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the finished schedule against employee overrides and reports each one that did not hold.
 * Prioritize overrides are preferences and are never reported.
 */
@Component
public class OverrideVerifier {

    public void verify(GenerationContext ctx, List<ScheduleOverride> overrides) {
        for (ScheduleOverride override : overrides) {
            if (ctx.policy(override.day()).closed()) {
                continue;
            }
            LocalDate date = ctx.dateFor(override.day());
            if (override instanceof Exclude exclude) {
                for (ScheduleAssignment assignment : assignmentsOf(ctx, exclude.employeeId(), date)) {
                    if (exclude.shiftType().matches(ctx.kindOf(assignment))) {
                        ctx.diagnostics().conflict(new ScheduleConflict(ConflictType.RULE_VIOLATION,
                                assignment.shiftId(), date,
                                nameOf(ctx, exclude.employeeId()) + " is excluded on "
                                        + TimeUtils.dayName(exclude.day()) + " but was scheduled"));
                    }
                }
            } else if (override instanceof Assign assign) {
                boolean honoured = assignmentsOf(ctx, assign.employeeId(), date).stream()
                        .anyMatch(a -> assign.shiftType().matches(ctx.kindOf(a)));
                if (!honoured) {
                    ctx.diagnostics().conflict(new ScheduleConflict(ConflictType.RULE_VIOLATION, null, date,
                            nameOf(ctx, assign.employeeId()) + " must work " + describe(assign.shiftType())
                                    + " on " + TimeUtils.dayName(assign.day()) + " but is not scheduled"));
                }
            } else if (override instanceof CustomTime custom) {
                boolean honoured = assignmentsOf(ctx, custom.employeeId(), date).stream()
                        .anyMatch(a -> custom.shiftType().matches(ctx.kindOf(a)));
                if (!honoured) {
                    ctx.diagnostics().conflict(new ScheduleConflict(ConflictType.RULE_VIOLATION, null, date,
                            nameOf(ctx, custom.employeeId()) + " has custom hours for " + describe(custom.shiftType())
                                    + " on " + TimeUtils.dayName(custom.day()) + " but is not scheduled"));
                }
            }
        }
    }

    private List<ScheduleAssignment> assignmentsOf(GenerationContext ctx, String employeeId, LocalDate date) {
        List<ScheduleAssignment> result = new ArrayList<>();
        for (ScheduleAssignment assignment : ctx.ledger().assignmentsOn(date)) {
            if (assignment.employeeId().equals(employeeId)) {
                result.add(assignment);
            }
        }
        return result;
    }

    private static String describe(ShiftKind kind) {
        return kind == ShiftKind.ANY ? "a shift" : "a " + kind.label() + " shift";
    }

    private static String nameOf(GenerationContext ctx, String employeeId) {
        Employee employee = ctx.employee(employeeId);
        return employee != null ? employee.name() : employeeId;
    }
}
