package com.example.barshift.staffing;

import com.example.barshift.common.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Heuristic review of a staffing layout before it is scheduled. Monday is closed and never checked.
 */
@Component
public class StaffingValidator {

    static final LocalTime DEFAULT_OPEN = LocalTime.of(7, 15);
    private static final int NOON = 12 * 60;
    private static final Set<DayOfWeek> WEEKDAYS_WITH_SHORT_OPENER =
            EnumSet.of(DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);

    public List<StaffingIssue> validate(WeeklyStaffingNeeds needs, Map<String, LocalTime> openTimes) {
        List<StaffingIssue> issues = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day == DayOfWeek.MONDAY) {
                continue;
            }
            DayStaffing staffing = needs.forDay(day);
            if (staffing == null || !staffing.hasSlots()) {
                continue;
            }
            LocalTime open = openTimes.getOrDefault(day.name().toLowerCase(Locale.ROOT), DEFAULT_OPEN);
            validateDay(day, staffing.slots(), open, issues);
        }
        return issues;
    }

    private void validateDay(DayOfWeek day, List<StaffingSlot> slots, LocalTime open, List<StaffingIssue> issues) {
        String dayName = TimeUtils.dayName(day);
        int openers = 0;
        StaffingSlot opener = null;
        boolean barTooEarly = false;

        for (StaffingSlot slot : slots) {
            if (slot == null || slot.startTime() == null) {
                continue;
            }
            String label = SlotLabels.normalize(slot.label(), day, slot.endTime());
            boolean startsAtOpen = slot.startTime().equals(open);
            if (startsAtOpen && label.toLowerCase(Locale.ROOT).contains("opener")) {
                openers++;
            }
            if (startsAtOpen && opener == null && SlotLabels.OPENER.equals(label)) {
                opener = slot;
            }
            if (SlotLabels.impliesBartender(label) && TimeUtils.toMinutes(slot.startTime()) < NOON) {
                barTooEarly = true;
            }
        }

        if (openers > 1) {
            issues.add(new StaffingIssue(day, StaffingIssueType.MULTIPLE_OPENERS_AT_OPEN,
                    "More than one opener starts at " + TimeUtils.label(open) + " on " + dayName
                            + ". This usually causes two openers to be scheduled."));
        }
        if (barTooEarly) {
            issues.add(new StaffingIssue(day, StaffingIssueType.BAR_STARTS_TOO_EARLY,
                    "Bar starts before noon on " + dayName
                            + ". If you do not need bar coverage in the morning, rename or move this slot."));
        }
        if (WEEKDAYS_WITH_SHORT_OPENER.contains(day) && opener != null && opener.endTime() != null
                && TimeUtils.toMinutes(opener.endTime()) > NOON) {
            issues.add(new StaffingIssue(day, StaffingIssueType.OPENER_ENDS_TOO_LATE,
                    "Opener on " + dayName + " ends at " + TimeUtils.label(opener.endTime())
                            + ". If the opener should be done by noon, shorten this slot."));
        }
    }
}
