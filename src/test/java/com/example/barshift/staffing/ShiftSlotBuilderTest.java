package com.example.barshift.staffing;

import com.example.barshift.common.ShiftKind;
import com.example.barshift.config.SchedulerSettings;
import com.example.barshift.override.DayPolicy;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.example.barshift.ScheduleFixtures.WEEK;
import static com.example.barshift.ScheduleFixtures.dateOf;
import static com.example.barshift.ScheduleFixtures.slot;
import static com.example.barshift.ScheduleFixtures.slots;
import static com.example.barshift.ScheduleFixtures.t;
import static org.assertj.core.api.Assertions.assertThat;

class ShiftSlotBuilderTest {

    private final ShiftSlotBuilder builder = new ShiftSlotBuilder(SchedulerSettings.defaults());

    @Test
    void slotsBecomeSingleSeatShiftsWithInferredKind() {
        DayStaffing staffing = slots(
                slot("tue-open", "07:15", "12:00", "opener"),
                slot("tue-mid", "12:00", "17:00", "lunch"),
                slot(null, "16:00", "22:00", "bartender"));

        List<PlannedShift> shifts = builder.buildDay(DayOfWeek.TUESDAY, dateOf(DayOfWeek.TUESDAY), staffing,
                DayPolicy.open(DayOfWeek.TUESDAY));

        assertThat(shifts).extracting(PlannedShift::id).containsExactly("tue-open", "tue-mid", "tue-slot-3");
        assertThat(shifts).extracting(PlannedShift::kind)
                .containsExactly(ShiftKind.MORNING, ShiftKind.MID, ShiftKind.NIGHT);
        assertThat(shifts).extracting(PlannedShift::requiresBartender).containsExactly(false, false, true);
        assertThat(shifts).extracting(PlannedShift::requiredStaff).containsOnly(1);
        assertThat(shifts).extracting(PlannedShift::name).containsExactly("Opener", "Mid Shift", "Bar");
    }

    @Test
    void shiftsAloneOnTheFloorAreMarkedSolo() {
        DayStaffing staffing = slots(
                slot("a", "09:00", "17:00", null),
                slot("b", "09:00", "17:00", null),
                slot("c", "16:00", "22:00", "Bar"));

        List<PlannedShift> shifts = builder.buildDay(DayOfWeek.THURSDAY, dateOf(DayOfWeek.THURSDAY), staffing,
                DayPolicy.open(DayOfWeek.THURSDAY));

        assertThat(shifts).extracting(PlannedShift::requiresSolo).containsExactly(false, false, true);
    }

    @Test
    void singleOpenerIsSoloButMultiSeatShiftsAreNot() {
        List<PlannedShift> opener = builder.buildDay(DayOfWeek.TUESDAY, dateOf(DayOfWeek.TUESDAY),
                slots(slot("tue-1", "09:00", "17:00", "Opener")), DayPolicy.open(DayOfWeek.TUESDAY));
        List<PlannedShift> legacy = builder.buildDay(DayOfWeek.TUESDAY, dateOf(DayOfWeek.TUESDAY),
                DayStaffing.legacy(2, 2), DayPolicy.open(DayOfWeek.TUESDAY));

        assertThat(opener).singleElement().satisfies(s -> assertThat(s.requiresSolo()).isTrue());
        assertThat(legacy).extracting(PlannedShift::requiresSolo).containsOnly(false);
    }

    @Test
    void legacyCountsBecomeMorningAndNightShifts() {
        DayStaffing staffing = new DayStaffing(null, null, 2, 3, t("08:00"), t("15:00"), null, null);

        List<PlannedShift> shifts = builder.buildDay(DayOfWeek.SATURDAY, dateOf(DayOfWeek.SATURDAY), staffing,
                DayPolicy.open(DayOfWeek.SATURDAY));

        assertThat(shifts).hasSize(2);
        PlannedShift morning = shifts.get(0);
        assertThat(morning.id()).isEqualTo("sat-morning");
        assertThat(morning.name()).isEqualTo("Morning Shift");
        assertThat(morning.requiredStaff()).isEqualTo(2);
        assertThat(morning.startTime()).isEqualTo(t("08:00"));
        assertThat(morning.endTime()).isEqualTo(t("15:00"));

        PlannedShift night = shifts.get(1);
        assertThat(night.id()).isEqualTo("sat-night");
        assertThat(night.requiredStaff()).isEqualTo(3);
        assertThat(night.requiresBartender()).isTrue();
        assertThat(night.startTime()).isEqualTo(t("16:00"));
        assertThat(night.endTime()).isEqualTo(t("21:00"));
    }

    @Test
    void slotsWinOverLegacyCounts() {
        DayStaffing staffing = new DayStaffing(List.of(slot("a", "09:00", "13:00", null)), null, 4, 4,
                null, null, null, null);

        List<PlannedShift> shifts = builder.buildDay(DayOfWeek.MONDAY, WEEK, staffing, DayPolicy.open(DayOfWeek.MONDAY));

        assertThat(shifts).extracting(PlannedShift::id).containsExactly("a");
        assertThat(shifts.get(0).name()).isEqualTo("Shift");
    }

    @Test
    void closedDayHasNoShifts() {
        DayStaffing staffing = slots(slot("a", "09:00", "17:00", "Opener"));

        assertThat(builder.buildDay(DayOfWeek.WEDNESDAY, dateOf(DayOfWeek.WEDNESDAY), staffing,
                new DayPolicy(DayOfWeek.WEDNESDAY, true, null))).isEmpty();
    }

    @Test
    void earlyCloseDropsLateShiftsAndTruncatesTheRest() {
        DayStaffing staffing = slots(
                slot("a", "10:00", "18:00", null),
                slot("b", "15:00", "22:00", null),
                slot("c", "09:00", "14:00", null));

        List<PlannedShift> shifts = builder.buildDay(DayOfWeek.FRIDAY, dateOf(DayOfWeek.FRIDAY), staffing,
                new DayPolicy(DayOfWeek.FRIDAY, false, t("15:00")));

        assertThat(shifts).extracting(PlannedShift::id).containsExactly("a", "c");
        assertThat(shifts.get(0).endTime()).isEqualTo(t("15:00"));
        assertThat(shifts.get(1).endTime()).isEqualTo(t("14:00"));
    }

    @Test
    void fallbackTemplateWhenNoStaffingData() {
        Map<DayOfWeek, DayPolicy> policies = new EnumMap<>(DayOfWeek.class);
        Map<DayOfWeek, List<PlannedShift>> week = builder.buildWeek(WEEK, null, policies);

        assertThat(week.get(DayOfWeek.MONDAY)).isEmpty();
        assertThat(week.get(DayOfWeek.TUESDAY)).extracting(PlannedShift::id).containsExactly("tue-morning", "tue-night");
        assertThat(week.get(DayOfWeek.SUNDAY)).extracting(PlannedShift::id).containsExactly("sun-morning");
        assertThat(week.get(DayOfWeek.TUESDAY).get(0).startTime()).isEqualTo(t("07:15"));
        assertThat(week.get(DayOfWeek.TUESDAY).get(0).requiredStaff()).isEqualTo(2);
        assertThat(week.get(DayOfWeek.FRIDAY).get(0).origin()).isEqualTo(ShiftOrigin.FALLBACK);
    }

    @Test
    void weekDatesStartOnMonday() {
        DayStaffing staffing = slots(slot(null, "09:00", "17:00", null));
        WeeklyStaffingNeeds needs = new WeeklyStaffingNeeds(staffing, staffing, staffing, staffing, staffing,
                staffing, staffing);

        Map<DayOfWeek, List<PlannedShift>> week = builder.buildWeek(WEEK, needs, new EnumMap<>(DayOfWeek.class));

        LocalDate sunday = week.get(DayOfWeek.SUNDAY).get(0).date();
        assertThat(sunday).isEqualTo(LocalDate.of(2026, 10, 25));
        assertThat(week.get(DayOfWeek.SUNDAY).get(0).id()).isEqualTo("sun-slot-1");
    }
}
