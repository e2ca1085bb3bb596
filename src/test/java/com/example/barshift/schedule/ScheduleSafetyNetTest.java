package com.example.barshift.schedule;

import com.example.barshift.employee.Employee;
import com.example.barshift.override.ScheduleOverride;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

import static com.example.barshift.ScheduleFixtures.context;
import static com.example.barshift.ScheduleFixtures.dateOf;
import static com.example.barshift.ScheduleFixtures.employee;
import static com.example.barshift.ScheduleFixtures.t;
import static org.assertj.core.api.Assertions.assertThat;

class ScheduleSafetyNetTest {

    private final ScheduleSafetyNet safetyNet = new ScheduleSafetyNet();

    private final Employee ann = employee("ann", "Ann", 4);
    private final Employee ben = employee("ben", "Ben", 4);

    @Test
    void stripsClosedDaysAndEnforcesEarlyClose() {
        LocalDate wednesday = dateOf(DayOfWeek.WEDNESDAY);
        LocalDate friday = dateOf(DayOfWeek.FRIDAY);
        GenerationContext ctx = context(List.of(ann, ben), List.of(
                new ScheduleOverride.BusinessClosed(DayOfWeek.WEDNESDAY),
                new ScheduleOverride.EarlyClose(DayOfWeek.FRIDAY, t("15:00"))));
        ctx.ledger().add(new ScheduleAssignment("wed-a", "ann", wednesday, t("09:00"), t("17:00")));
        ctx.ledger().add(new ScheduleAssignment("fri-a", "ann", friday, t("10:00"), t("18:00")));
        ctx.ledger().add(new ScheduleAssignment("fri-b", "ben", friday, t("15:00"), t("22:00")));

        safetyNet.apply(ctx);

        assertThat(ctx.ledger().all())
                .containsExactly(new ScheduleAssignment("fri-a", "ann", friday, t("10:00"), t("15:00")));
        assertThat(ctx.ledger().hoursOf("ann")).isEqualTo(5.0);
        assertThat(ctx.ledger().hoursOf("ben")).isZero();
        assertThat(ctx.diagnostics().warnings()).extracting(ScheduleWarning::message)
                .containsExactly("Wednesday - CLOSED", "Friday - Closing early at 3:00 PM");
    }

    @Test
    void closureWarningsAreNotDuplicated() {
        GenerationContext ctx = context(List.of(ann), List.of(
                new ScheduleOverride.BusinessClosed(DayOfWeek.WEDNESDAY),
                new ScheduleOverride.BusinessClosed(DayOfWeek.WEDNESDAY)));

        safetyNet.apply(ctx);
        safetyNet.apply(ctx);

        assertThat(ctx.diagnostics().warnings()).hasSize(1);
    }
}
