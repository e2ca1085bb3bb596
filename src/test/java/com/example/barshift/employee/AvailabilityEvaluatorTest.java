package com.example.barshift.employee;

import com.example.barshift.common.ShiftKind;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

import static com.example.barshift.ScheduleFixtures.WEEK;
import static com.example.barshift.ScheduleFixtures.anyShift;
import static com.example.barshift.ScheduleFixtures.employee;
import static com.example.barshift.ScheduleFixtures.t;
import static com.example.barshift.ScheduleFixtures.withRestrictions;
import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityEvaluatorTest {

    private final AvailabilityEvaluator evaluator = new AvailabilityEvaluator();

    private static final LocalDate TUESDAY = WEEK.plusDays(1);

    @Test
    void missingDayIsUnavailable() {
        WeeklyAvailability mondayOnly = new WeeklyAvailability(anyShift(), null, null, null, null, null, null);
        Employee ana = employee("e1", "Ana", 4, mondayOnly);

        assertThat(evaluator.isAvailable(ana, DayOfWeek.MONDAY, WEEK, ShiftKind.MORNING, t("09:00"))).isTrue();
        assertThat(evaluator.isAvailable(ana, DayOfWeek.TUESDAY, TUESDAY, ShiftKind.MORNING, t("09:00"))).isFalse();
    }

    @Test
    void dayMarkedUnavailableFailsClosed() {
        DayAvailability off = new DayAvailability(false, List.of(new AvailableShift(ShiftKind.ANY, null, null)), "off");
        Employee ana = employee("e1", "Ana", 4, new WeeklyAvailability(off, off, off, off, off, off, off));

        assertThat(evaluator.isAvailable(ana, DayOfWeek.MONDAY, WEEK, ShiftKind.MORNING, t("09:00"))).isFalse();
    }

    @Test
    void exclusionRangeBlocksEveryDateInside() {
        Employee base = employee("e1", "Ana", 4);
        Employee onLeave = new Employee(base.id(), base.name(), 4, 3, base.availability(), null,
                List.of(new Exclusion(WEEK, TUESDAY, "vacation")), null, null, null, null);

        assertThat(evaluator.isAvailable(onLeave, DayOfWeek.TUESDAY, TUESDAY, ShiftKind.NIGHT, t("16:00"))).isFalse();
        assertThat(evaluator.isAvailable(onLeave, DayOfWeek.WEDNESDAY, WEEK.plusDays(2), ShiftKind.NIGHT, t("16:00"))).isTrue();
    }

    @Test
    void entryTypeAndEarliestStartAreRespected() {
        DayAvailability nightsFromFive = new DayAvailability(true,
                List.of(new AvailableShift(ShiftKind.NIGHT, t("17:00"), null)), null);
        Employee ana = employee("e1", "Ana", 4,
                new WeeklyAvailability(nightsFromFive, null, null, null, null, null, null));

        assertThat(evaluator.isAvailable(ana, DayOfWeek.MONDAY, WEEK, ShiftKind.MORNING, t("09:00"))).isFalse();
        assertThat(evaluator.isAvailable(ana, DayOfWeek.MONDAY, WEEK, ShiftKind.NIGHT, t("16:00"))).isFalse();
        assertThat(evaluator.isAvailable(ana, DayOfWeek.MONDAY, WEEK, ShiftKind.NIGHT, t("17:00"))).isTrue();
    }

    @Test
    void customEntryAcceptsStartsInsideItsWindow() {
        DayAvailability custom = new DayAvailability(true,
                List.of(new AvailableShift(ShiftKind.CUSTOM, t("10:00"), t("14:00"))), null);
        Employee ana = employee("e1", "Ana", 4, new WeeklyAvailability(custom, null, null, null, null, null, null));

        assertThat(evaluator.isAvailable(ana, DayOfWeek.MONDAY, WEEK, ShiftKind.MORNING, t("11:00"))).isTrue();
        assertThat(evaluator.isAvailable(ana, DayOfWeek.MONDAY, WEEK, ShiftKind.MID, t("14:00"))).isFalse();
    }

    @Test
    void noBeforeRejectsEarlyStart() {
        Employee ana = withRestrictions(employee("e1", "Ana", 4),
                new Restriction("r1", RestrictionType.NO_BEFORE, t("10:00"), null, null, null, "school run"));

        RestrictionCheck early = evaluator.checkRestrictions(ana, DayOfWeek.MONDAY, t("09:00"), t("17:00"));
        assertThat(early.allowed()).isFalse();
        assertThat(early.reason()).isEqualTo("Can't work before 10:00 AM (school run)");

        assertThat(evaluator.checkRestrictions(ana, DayOfWeek.MONDAY, t("10:00"), t("17:00")).allowed()).isTrue();
    }

    @Test
    void noAfterRejectsLateEnd() {
        Employee ana = withRestrictions(employee("e1", "Ana", 4),
                new Restriction("r1", RestrictionType.NO_AFTER, t("20:00"), null, null, null, null));

        RestrictionCheck late = evaluator.checkRestrictions(ana, DayOfWeek.FRIDAY, t("16:00"), t("21:00"));
        assertThat(late.allowed()).isFalse();
        assertThat(late.reason()).isEqualTo("Can't work after 8:00 PM");
    }

    @Test
    void unavailableRangeRejectsAnyOverlapOnScopedDaysOnly() {
        Employee ana = withRestrictions(employee("e1", "Ana", 4),
                new Restriction("r1", RestrictionType.UNAVAILABLE_RANGE, null, t("12:00"), t("13:00"),
                        List.of(DayOfWeek.TUESDAY), "class"));

        assertThat(evaluator.checkRestrictions(ana, DayOfWeek.TUESDAY, t("09:00"), t("12:30")).allowed()).isFalse();
        assertThat(evaluator.checkRestrictions(ana, DayOfWeek.TUESDAY, t("13:00"), t("18:00")).allowed()).isTrue();
        assertThat(evaluator.checkRestrictions(ana, DayOfWeek.WEDNESDAY, t("09:00"), t("17:00")).allowed()).isTrue();
    }

    @Test
    void firstViolationWins() {
        Employee ana = withRestrictions(employee("e1", "Ana", 4),
                new Restriction("r1", RestrictionType.NO_BEFORE, t("10:00"), null, null, null, null),
                new Restriction("r2", RestrictionType.NO_AFTER, t("15:00"), null, null, null, null));

        assertThat(evaluator.checkRestrictions(ana, DayOfWeek.MONDAY, t("09:00"), t("17:00")).reason())
                .startsWith("Can't work before");
    }
}
