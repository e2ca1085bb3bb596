package com.example.barshift.staffing;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.common.TimeUtils;
import com.example.barshift.config.SchedulerSettings;
import com.example.barshift.config.SchedulerSettings.TimeWindow;
import com.example.barshift.override.DayPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a week's staffing requirements into concrete shifts. Closures and early closes are
 * applied here, before any assignment happens.
 */
@Component
public class ShiftSlotBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ShiftSlotBuilder.class);

    private final SchedulerSettings settings;

    public ShiftSlotBuilder(SchedulerSettings settings) {
        this.settings = settings;
    }

    /**
     * Builds Monday..Sunday. A {@code null} {@code needs} switches to the fallback template.
     */
    public Map<DayOfWeek, List<PlannedShift>> buildWeek(LocalDate weekStart,
                                                        WeeklyStaffingNeeds needs,
                                                        Map<DayOfWeek, DayPolicy> policies) {
        if (needs == null) {
            logger.warn("No staffing data for week {}, using the fallback template", weekStart);
        }
        Map<DayOfWeek, List<PlannedShift>> week = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            LocalDate date = weekStart.plusDays(day.getValue() - 1L);
            DayPolicy policy = policies.getOrDefault(day, DayPolicy.open(day));
            List<PlannedShift> shifts = needs == null
                    ? buildFallbackDay(day, date, policy)
                    : buildDay(day, date, needs.forDay(day), policy);
            week.put(day, shifts);
        }
        return week;
    }

    public List<PlannedShift> buildDay(DayOfWeek day, LocalDate date, DayStaffing staffing, DayPolicy policy) {
        if (policy.closed() || staffing == null) {
            return Collections.emptyList();
        }
        List<PlannedShift> raw = new ArrayList<>();
        String code = TimeUtils.dayCode(day);
        if (staffing.hasSlots()) {
            int index = 0;
            for (StaffingSlot slot : staffing.slots()) {
                index++;
                if (slot == null || slot.startTime() == null || slot.endTime() == null) {
                    continue;
                }
                ShiftKind kind = ShiftKind.fromStart(slot.startTime());
                String id = (slot.id() == null || slot.id().isBlank()) ? code + "-slot-" + index : slot.id();
                String name = SlotLabels.normalize(slot.label(), day, slot.endTime());
                raw.add(new PlannedShift(id, name, day, date, slot.startTime(), slot.endTime(), kind, 1,
                        kind == ShiftKind.NIGHT, false, ShiftOrigin.SLOT, null));
            }
        } else {
            int morning = staffing.morning() == null ? 0 : staffing.morning();
            int night = staffing.night() == null ? 0 : staffing.night();
            if (morning > 0) {
                TimeWindow w = legacyWindow(staffing, ShiftKind.MORNING);
                raw.add(new PlannedShift(code + "-morning", "Morning Shift", day, date, w.start(), w.end(),
                        ShiftKind.MORNING, morning, false, false, ShiftOrigin.LEGACY, null));
            }
            if (night > 0) {
                TimeWindow w = legacyWindow(staffing, ShiftKind.NIGHT);
                raw.add(new PlannedShift(code + "-night", "Night Shift", day, date, w.start(), w.end(),
                        ShiftKind.NIGHT, night, true, false, ShiftOrigin.LEGACY, null));
            }
        }
        return markSoloTime(applyPolicy(raw, policy));
    }

    /**
     * Morning shift every day but Monday, night shift Tuesday to Saturday.
     */
    public List<PlannedShift> buildFallbackDay(DayOfWeek day, LocalDate date, DayPolicy policy) {
        if (policy.closed() || day == DayOfWeek.MONDAY) {
            return Collections.emptyList();
        }
        String code = TimeUtils.dayCode(day);
        int staff = settings.getFallbackStaff();
        List<PlannedShift> raw = new ArrayList<>();
        TimeWindow morning = settings.getFallbackMorning();
        raw.add(new PlannedShift(code + "-morning", "Morning Shift", day, date, morning.start(), morning.end(),
                ShiftKind.MORNING, staff, false, false, ShiftOrigin.FALLBACK, null));
        if (day != DayOfWeek.SUNDAY) {
            TimeWindow night = settings.getFallbackNight();
            raw.add(new PlannedShift(code + "-night", "Night Shift", day, date, night.start(), night.end(),
                    ShiftKind.NIGHT, staff, true, false, ShiftOrigin.FALLBACK, null));
        }
        return markSoloTime(applyPolicy(raw, policy));
    }

    /**
     * Legacy morning/night window of a day, falling back to the configured template times.
     */
    public TimeWindow legacyWindow(DayStaffing staffing, ShiftKind kind) {
        TimeWindow def = kind == ShiftKind.NIGHT ? settings.getFallbackNight() : settings.getFallbackMorning();
        if (staffing == null) {
            return def;
        }
        LocalTime start = kind == ShiftKind.NIGHT ? staffing.nightStart() : staffing.morningStart();
        LocalTime end = kind == ShiftKind.NIGHT ? staffing.nightEnd() : staffing.morningEnd();
        return new TimeWindow(start != null ? start : def.start(), end != null ? end : def.end());
    }

    /**
     * Flags every shift that is the only one on the floor for some stretch of the day with a
     * single seat to fill. Stretches are cut at every shift start and end.
     */
    static List<PlannedShift> markSoloTime(List<PlannedShift> shifts) {
        if (shifts.isEmpty()) {
            return shifts;
        }
        TreeSet<Integer> boundaries = new TreeSet<>();
        for (PlannedShift shift : shifts) {
            boundaries.add(startOf(shift));
            boundaries.add(endOf(shift));
        }
        Set<Integer> solo = new HashSet<>();
        Integer from = boundaries.first();
        for (Integer to : boundaries.tailSet(from, false)) {
            int mid = (from + to) / 2;
            int headcount = 0;
            int only = -1;
            for (int i = 0; i < shifts.size(); i++) {
                PlannedShift shift = shifts.get(i);
                if (startOf(shift) <= mid && endOf(shift) > mid) {
                    headcount += shift.requiredStaff();
                    only = i;
                }
            }
            if (headcount == 1) {
                solo.add(only);
            }
            from = to;
        }
        List<PlannedShift> marked = new ArrayList<>(shifts.size());
        for (int i = 0; i < shifts.size(); i++) {
            marked.add(shifts.get(i).withSolo(solo.contains(i)));
        }
        return marked;
    }

    private static int startOf(PlannedShift shift) {
        return TimeUtils.toMinutes(shift.startTime());
    }

    private static int endOf(PlannedShift shift) {
        return startOf(shift) + TimeUtils.durationMinutes(shift.startTime(), shift.endTime());
    }

    private List<PlannedShift> applyPolicy(List<PlannedShift> shifts, DayPolicy policy) {
        if (policy.earlyClose().isEmpty()) {
            return shifts;
        }
        List<PlannedShift> kept = new ArrayList<>();
        for (PlannedShift shift : shifts) {
            if (!policy.allowsStart(shift.startTime())) {
                logger.debug("Dropping {} on {}: starts at/after early close {}", shift.id(), policy.day(), policy.closeAt());
                continue;
            }
            LocalTime end = policy.clampEnd(shift.startTime(), shift.endTime());
            kept.add(end.equals(shift.endTime()) ? shift : shift.withEnd(end));
        }
        return kept;
    }
}
