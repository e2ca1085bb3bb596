package com.example.barshift.override;

import com.example.barshift.override.ScheduleOverride.Assign;
import com.example.barshift.override.ScheduleOverride.BusinessClosed;
import com.example.barshift.override.ScheduleOverride.CustomTime;
import com.example.barshift.override.ScheduleOverride.EarlyClose;
import com.example.barshift.override.ScheduleOverride.EmployeeOverride;
import com.example.barshift.override.ScheduleOverride.Exclude;
import com.example.barshift.override.ScheduleOverride.Prioritize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies a merged override list. Business-wide closures are resolved first and always win.
 */
@Component
public class OverrideResolver {

    private static final Logger logger = LoggerFactory.getLogger(OverrideResolver.class);

    /**
     * One policy per weekday, Monday to Sunday. Several early closes on the same day keep the earliest.
     */
    public Map<DayOfWeek, DayPolicy> resolvePolicies(List<ScheduleOverride> overrides) {
        Map<DayOfWeek, DayPolicy> policies = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean closed = false;
            LocalTime closeAt = null;
            for (ScheduleOverride o : overrides) {
                if (o.day() != day) continue;
                if (o instanceof BusinessClosed) {
                    closed = true;
                } else if (o instanceof EarlyClose early) {
                    if (closeAt == null || early.closeAt().isBefore(closeAt)) {
                        closeAt = early.closeAt();
                    }
                }
            }
            DayPolicy policy = new DayPolicy(day, closed, closeAt);
            if (closed || closeAt != null) {
                logger.debug("Day policy {}: closed={}, earlyClose={}", day, closed, closeAt);
            }
            policies.put(day, policy);
        }
        return policies;
    }

    public Map<DayOfWeek, DayRules> resolveRules(List<ScheduleOverride> overrides) {
        Map<DayOfWeek, DayRules> rules = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            rules.put(day, rulesFor(day, overrides));
        }
        return rules;
    }

    public DayRules rulesFor(DayOfWeek day, List<ScheduleOverride> overrides) {
        List<EmployeeOverride> forced = new ArrayList<>();
        List<Exclude> excludes = new ArrayList<>();
        List<Prioritize> prioritized = new ArrayList<>();
        List<CustomTime> customTimes = new ArrayList<>();
        for (ScheduleOverride o : overrides) {
            if (o.day() != day) continue;
            if (o instanceof Exclude exclude) {
                excludes.add(exclude);
            } else if (o instanceof Assign assign) {
                forced.add(assign);
            } else if (o instanceof CustomTime custom) {
                forced.add(custom);
                customTimes.add(custom);
            } else if (o instanceof Prioritize prioritize) {
                prioritized.add(prioritize);
            }
        }
        return new DayRules(day, List.copyOf(forced), List.copyOf(excludes),
                List.copyOf(prioritized), List.copyOf(customTimes));
    }
}
