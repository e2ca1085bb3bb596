package com.example.barshift.schedule;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.config.SchedulerSettings;
import com.example.barshift.employee.Employee;
import com.example.barshift.exception.BusinessException;
import com.example.barshift.override.DayPolicy;
import com.example.barshift.override.DayRules;
import com.example.barshift.staffing.PlannedShift;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single generation run. Never shared between runs.
 */
public class GenerationContext {

    private final LocalDate weekStart;
    private final List<Employee> roster;
    private final Map<String, Employee> employeesById = new LinkedHashMap<>();
    private final Map<DayOfWeek, DayPolicy> policies;
    private final Map<DayOfWeek, DayRules> rules;
    private final SchedulerSettings settings;
    private final AssignmentLedger ledger = new AssignmentLedger();
    private final Diagnostics diagnostics = new Diagnostics();
    private final Map<SeatKey, Integer> seatsTaken = new HashMap<>();
    private final Map<SeatKey, ShiftKind> shiftKinds = new HashMap<>();

    public GenerationContext(LocalDate weekStart,
                             List<Employee> roster,
                             Map<DayOfWeek, DayPolicy> policies,
                             Map<DayOfWeek, DayRules> rules,
                             SchedulerSettings settings) {
        this.weekStart = weekStart;
        this.roster = List.copyOf(roster);
        this.policies = policies;
        this.rules = rules;
        this.settings = settings;
        for (Employee employee : this.roster) {
            if (employeesById.putIfAbsent(employee.id(), employee) != null) {
                throw new BusinessException("DUPLICATE_EMPLOYEE",
                        "Duplicate employee id: " + employee.id());
            }
        }
    }

    public LocalDate weekStart() {
        return weekStart;
    }

    public LocalDate dateFor(DayOfWeek day) {
        return weekStart.plusDays(day.getValue() - 1L);
    }

    public List<Employee> roster() {
        return roster;
    }

    /**
     * @return the employee, or {@code null} when the id is not on the roster
     */
    public Employee employee(String id) {
        return id == null ? null : employeesById.get(id);
    }

    public DayPolicy policy(DayOfWeek day) {
        return policies.getOrDefault(day, DayPolicy.open(day));
    }

    public DayRules rules(DayOfWeek day) {
        return rules.getOrDefault(day, DayRules.empty(day));
    }

    public SchedulerSettings settings() {
        return settings;
    }

    public AssignmentLedger ledger() {
        return ledger;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public int openSeats(PlannedShift shift) {
        return shift.requiredStaff() - seatsTaken.getOrDefault(new SeatKey(shift.date(), shift.id()), 0);
    }

    public void takeSeat(LocalDate date, String shiftId) {
        seatsTaken.merge(new SeatKey(date, shiftId), 1, Integer::sum);
    }

    public void takeSeat(PlannedShift shift) {
        takeSeat(shift.date(), shift.id());
        shiftKinds.put(new SeatKey(shift.date(), shift.id()), shift.kind());
    }

    /**
     * Kind of the shift an assignment belongs to. Assignments that were not placed into a planned
     * shift (locks, fixed schedules) fall back to the kind of their start time.
     */
    public ShiftKind kindOf(ScheduleAssignment assignment) {
        ShiftKind kind = shiftKinds.get(new SeatKey(assignment.date(), assignment.shiftId()));
        return kind != null ? kind : ShiftKind.fromStart(assignment.startTime());
    }

    private record SeatKey(LocalDate date, String shiftId) {
    }
}
