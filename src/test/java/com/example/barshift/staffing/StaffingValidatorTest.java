package com.example.barshift.staffing;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

import static com.example.barshift.ScheduleFixtures.onlyOn;
import static com.example.barshift.ScheduleFixtures.slot;
import static com.example.barshift.ScheduleFixtures.slots;
import static com.example.barshift.ScheduleFixtures.t;
import static org.assertj.core.api.Assertions.assertThat;

class StaffingValidatorTest {

    private final StaffingValidator validator = new StaffingValidator();

    @Test
    void twoOpenersAtOpeningTimeAreFlagged() {
        WeeklyStaffingNeeds needs = onlyOn(DayOfWeek.SATURDAY, slots(
                slot("a", "07:15", "14:00", "Opener"),
                slot("b", "07:15", "16:00", "weekend opening")));

        List<StaffingIssue> issues = validator.validate(needs, Map.of());

        assertThat(issues).extracting(StaffingIssue::type).containsExactly(StaffingIssueType.MULTIPLE_OPENERS_AT_OPEN);
        assertThat(issues.get(0).day()).isEqualTo(DayOfWeek.SATURDAY);
        assertThat(issues.get(0).message()).contains("7:15 AM").contains("Saturday");
    }

    @Test
    void morningBarSlotIsFlagged() {
        WeeklyStaffingNeeds needs = onlyOn(DayOfWeek.SUNDAY, slots(slot("a", "11:00", "17:00", "bartender")));

        assertThat(validator.validate(needs, Map.of()))
                .extracting(StaffingIssue::type).containsExactly(StaffingIssueType.BAR_STARTS_TOO_EARLY);
    }

    @Test
    void weekdayOpenerRunningPastNoonIsFlagged() {
        WeeklyStaffingNeeds needs = onlyOn(DayOfWeek.TUESDAY, slots(slot("a", "07:15", "13:00", "open")));

        List<StaffingIssue> issues = validator.validate(needs, Map.of());

        assertThat(issues).extracting(StaffingIssue::type).containsExactly(StaffingIssueType.OPENER_ENDS_TOO_LATE);
        assertThat(issues.get(0).message()).contains("1:00 PM");
    }

    @Test
    void customOpeningTimeIsUsed() {
        WeeklyStaffingNeeds needs = onlyOn(DayOfWeek.THURSDAY, slots(
                slot("a", "08:00", "13:00", "Opener"),
                slot("b", "07:15", "11:00", "Opener")));

        List<StaffingIssue> issues = validator.validate(needs, Map.of("thursday", t("08:00")));

        assertThat(issues).extracting(StaffingIssue::type).containsExactly(StaffingIssueType.OPENER_ENDS_TOO_LATE);
    }

    @Test
    void mondayIsNeverChecked() {
        WeeklyStaffingNeeds needs = onlyOn(DayOfWeek.MONDAY, slots(
                slot("a", "07:15", "14:00", "Opener"),
                slot("b", "07:15", "14:00", "Opener"),
                slot("c", "09:00", "14:00", "Bar")));

        assertThat(validator.validate(needs, Map.of())).isEmpty();
    }

    @Test
    void labelsNormalizeToHouseRoles() {
        assertThat(SlotLabels.normalize("  diner 2 ", DayOfWeek.FRIDAY, null)).isEqualTo("Dinner 2");
        assertThat(SlotLabels.normalize("opening", DayOfWeek.SUNDAY, t("15:30"))).isEqualTo("Weekend Opener");
        assertThat(SlotLabels.normalize("opening", DayOfWeek.TUESDAY, t("15:30"))).isEqualTo("Opener");
        assertThat(SlotLabels.normalize("second server", DayOfWeek.TUESDAY, null)).isEqualTo("2nd Server");
        assertThat(SlotLabels.normalize("closing", DayOfWeek.TUESDAY, null)).isEqualTo("Closer");
        assertThat(SlotLabels.normalize("Host  stand", DayOfWeek.TUESDAY, null)).isEqualTo("Host stand");
        assertThat(SlotLabels.normalize(" ", DayOfWeek.TUESDAY, null)).isEqualTo("Shift");
        assertThat(SlotLabels.impliesBartender("Bar")).isTrue();
        assertThat(SlotLabels.impliesBartender("Barista")).isFalse();
    }
}
