package com.example.barshift.schedule;

import com.example.barshift.override.DayPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Final pass over the assignments: nothing survives on a closed day, nothing starts at or after an
 * early close, and nothing runs past it. Also emits one closure notice per affected day.
 */
@Component
public class ScheduleSafetyNet {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleSafetyNet.class);

    public void apply(GenerationContext ctx) {
        List<ScheduleAssignment> kept = new ArrayList<>();
        boolean changed = false;
        for (ScheduleAssignment assignment : ctx.ledger().all()) {
            DayPolicy policy = ctx.policy(assignment.date().getDayOfWeek());
            if (policy.closed() || !policy.allowsStart(assignment.startTime())) {
                logger.warn("Removing {} for {} on {}: business closed", assignment.shiftId(),
                        assignment.employeeId(), assignment.date());
                changed = true;
                continue;
            }
            LocalTime end = policy.clampEnd(assignment.startTime(), assignment.endTime());
            if (end != null && !end.equals(assignment.endTime())) {
                kept.add(assignment.withTimes(assignment.startTime(), end));
                changed = true;
            } else {
                kept.add(assignment);
            }
        }
        if (changed) {
            ctx.ledger().replaceAll(kept);
        }

        for (DayOfWeek day : DayOfWeek.values()) {
            DayPolicy policy = ctx.policy(day);
            if (policy.closed()) {
                ctx.diagnostics().warn(new ScheduleWarning(WarningType.COVERAGE_NEEDED, null,
                        ctx.dateFor(day), policy.closedMessage()));
            } else if (policy.earlyClose().isPresent()) {
                ctx.diagnostics().warn(new ScheduleWarning(WarningType.COVERAGE_NEEDED, null,
                        ctx.dateFor(day), policy.earlyCloseMessage()));
            }
        }
    }
}
