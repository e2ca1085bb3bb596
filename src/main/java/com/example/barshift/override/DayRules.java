package com.example.barshift.override;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.override.ScheduleOverride.CustomTime;
import com.example.barshift.override.ScheduleOverride.EmployeeOverride;
import com.example.barshift.override.ScheduleOverride.Exclude;
import com.example.barshift.override.ScheduleOverride.Prioritize;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Employee-scoped overrides of one weekday, in declaration order.
 *
 * @param forced   assign and custom-time overrides, in the order they were authored
 * @param excludes exclusions; these outrank every forced assignment
 */
public record DayRules(DayOfWeek day,
                       List<EmployeeOverride> forced,
                       List<Exclude> excludes,
                       List<Prioritize> prioritized,
                       List<CustomTime> customTimes) {

    public static DayRules empty(DayOfWeek day) {
        return new DayRules(day, List.of(), List.of(), List.of(), List.of());
    }

    public List<String> forcedFor(ShiftKind kind) {
        Set<String> ids = new LinkedHashSet<>();
        for (EmployeeOverride o : forced) {
            if (o.shiftType().matches(kind)) {
                ids.add(o.employeeId());
            }
        }
        return new ArrayList<>(ids);
    }

    public boolean isExcluded(String employeeId, ShiftKind kind) {
        for (Exclude e : excludes) {
            if (e.employeeId().equals(employeeId) && e.shiftType().matches(kind)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> prioritizedFor(ShiftKind kind) {
        Set<String> ids = new LinkedHashSet<>();
        for (Prioritize p : prioritized) {
            if (p.shiftType().matches(kind)) {
                ids.add(p.employeeId());
            }
        }
        return ids;
    }
}
