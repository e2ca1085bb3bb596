package com.example.barshift.override;

import com.example.barshift.common.ShiftKind;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

import static com.example.barshift.ScheduleFixtures.t;
import static org.assertj.core.api.Assertions.assertThat;

class OverrideResolverTest {

    private final OverrideMapper mapper = new OverrideMapper();
    private final OverrideResolver resolver = new OverrideResolver();

    @Test
    void sentinelsBecomeBusinessWidePolicies() {
        List<ScheduleOverride> overrides = mapper.map(List.of(
                request(OverrideType.EXCLUDE, OverrideMapper.ALL_EMPLOYEES, DayOfWeek.WEDNESDAY, null),
                request(OverrideType.CUSTOM_TIME, OverrideMapper.CLOSE_EARLY, DayOfWeek.FRIDAY, "15:00")));

        Map<DayOfWeek, DayPolicy> policies = resolver.resolvePolicies(overrides);

        assertThat(policies).hasSize(7);
        assertThat(policies.get(DayOfWeek.WEDNESDAY).closed()).isTrue();
        assertThat(policies.get(DayOfWeek.WEDNESDAY).closedMessage()).isEqualTo("Wednesday - CLOSED");
        assertThat(policies.get(DayOfWeek.FRIDAY).closeAt()).isEqualTo(t("15:00"));
        assertThat(policies.get(DayOfWeek.FRIDAY).earlyCloseMessage()).isEqualTo("Friday - Closing early at 3:00 PM");
        assertThat(policies.get(DayOfWeek.MONDAY).closed()).isFalse();
        assertThat(policies.get(DayOfWeek.MONDAY).earlyClose()).isEmpty();
    }

    @Test
    void earliestEarlyCloseWins() {
        List<ScheduleOverride> overrides = List.of(
                new ScheduleOverride.EarlyClose(DayOfWeek.SATURDAY, t("18:00")),
                new ScheduleOverride.EarlyClose(DayOfWeek.SATURDAY, t("16:30")));

        assertThat(resolver.resolvePolicies(overrides).get(DayOfWeek.SATURDAY).closeAt()).isEqualTo(t("16:30"));
    }

    @Test
    void closeEarlyWithoutTimeAndOtherAllEmployeeRulesAreIgnored() {
        List<ScheduleOverride> overrides = mapper.map(List.of(
                request(OverrideType.CUSTOM_TIME, OverrideMapper.CLOSE_EARLY, DayOfWeek.FRIDAY, null),
                request(OverrideType.ASSIGN, OverrideMapper.ALL_EMPLOYEES, DayOfWeek.FRIDAY, null)));

        assertThat(overrides).isEmpty();
    }

    @Test
    void employeeRulesAreGroupedPerDayInDeclarationOrder() {
        List<ScheduleOverride> overrides = List.of(
                new ScheduleOverride.Assign("e2", DayOfWeek.FRIDAY, ShiftKind.NIGHT),
                new ScheduleOverride.CustomTime("e1", DayOfWeek.FRIDAY, ShiftKind.ANY, null, t("14:00")),
                new ScheduleOverride.Exclude("e3", DayOfWeek.FRIDAY, ShiftKind.MORNING),
                new ScheduleOverride.Prioritize("e4", DayOfWeek.FRIDAY, ShiftKind.ANY),
                new ScheduleOverride.Assign("e5", DayOfWeek.SATURDAY, ShiftKind.ANY));

        DayRules friday = resolver.rulesFor(DayOfWeek.FRIDAY, overrides);

        assertThat(friday.forcedFor(ShiftKind.NIGHT)).containsExactly("e2", "e1");
        assertThat(friday.forcedFor(ShiftKind.MORNING)).containsExactly("e1");
        assertThat(friday.customTimes()).hasSize(1);
        assertThat(friday.isExcluded("e3", ShiftKind.MORNING)).isTrue();
        assertThat(friday.isExcluded("e3", ShiftKind.NIGHT)).isFalse();
        assertThat(friday.prioritizedFor(ShiftKind.MID)).containsExactly("e4");
    }

    @Test
    void missingShiftTypeMeansAnyShift() {
        List<ScheduleOverride> overrides = mapper.map(List.of(
                request(OverrideType.EXCLUDE, "e1", DayOfWeek.TUESDAY, null)));

        DayRules tuesday = resolver.rulesFor(DayOfWeek.TUESDAY, overrides);
        assertThat(tuesday.isExcluded("e1", ShiftKind.MORNING)).isTrue();
        assertThat(tuesday.isExcluded("e1", ShiftKind.NIGHT)).isTrue();
    }

    @Test
    void dayPolicyClampsAndRejectsAroundEarlyClose() {
        DayPolicy policy = new DayPolicy(DayOfWeek.FRIDAY, false, t("15:00"));

        assertThat(policy.allowsStart(t("14:59"))).isTrue();
        assertThat(policy.allowsStart(t("15:00"))).isFalse();
        assertThat(policy.clampEnd(t("10:00"), t("18:00"))).isEqualTo(t("15:00"));
        assertThat(policy.clampEnd(t("10:00"), t("14:00"))).isEqualTo(t("14:00"));
    }

    private static OverrideRequest request(OverrideType type, String employeeId, DayOfWeek day, String end) {
        return new OverrideRequest(null, type, employeeId, day, null, null, end == null ? null : t(end), null);
    }
}
