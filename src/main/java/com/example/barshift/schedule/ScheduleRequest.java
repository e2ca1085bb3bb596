package com.example.barshift.schedule;

import com.example.barshift.employee.Employee;
import com.example.barshift.override.OverrideRequest;
import com.example.barshift.staffing.WeeklyStaffingNeeds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

/**
 * Snapshot of everything one generation run reads.
 *
 * @param weekStart any date in the target week
 */
public record ScheduleRequest(
        @NotNull(message = "weekStart is required")
        LocalDate weekStart,
        List<@Valid OverrideRequest> overrides,
        List<@Valid Employee> employees,
        @Valid WeeklyStaffingNeeds staffingNeeds,
        List<LockedShift> lockedShifts,
        List<ScheduleAssignment> existingAssignments) {

    public ScheduleRequest {
        overrides = overrides == null ? List.of() : overrides;
        employees = employees == null ? List.of() : employees;
        lockedShifts = lockedShifts == null ? List.of() : lockedShifts;
        existingAssignments = existingAssignments == null ? List.of() : existingAssignments;
    }
}
