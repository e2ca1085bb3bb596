package com.example.barshift.override;

import com.example.barshift.common.ShiftKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns editor overrides into typed {@link ScheduleOverride} variants, resolving the sentinel ids.
 * Input order is preserved.
 */
@Component
public class OverrideMapper {

    private static final Logger logger = LoggerFactory.getLogger(OverrideMapper.class);

    public static final String ALL_EMPLOYEES = "__ALL__";
    public static final String CLOSE_EARLY = "__CLOSE_EARLY__";

    public List<ScheduleOverride> map(List<OverrideRequest> requests) {
        List<ScheduleOverride> result = new ArrayList<>();
        if (requests == null) {
            return result;
        }
        for (OverrideRequest req : requests) {
            if (req == null || req.type() == null || req.day() == null || req.employeeId() == null) {
                continue;
            }
            ScheduleOverride mapped = toOverride(req);
            if (mapped != null) {
                result.add(mapped);
            }
        }
        return result;
    }

    private ScheduleOverride toOverride(OverrideRequest req) {
        ShiftKind kind = req.shiftType() == null ? ShiftKind.ANY : req.shiftType();
        String employeeId = req.employeeId();

        if (ALL_EMPLOYEES.equals(employeeId)) {
            if (req.type() == OverrideType.EXCLUDE) {
                return new ScheduleOverride.BusinessClosed(req.day());
            }
            logger.warn("Ignoring business-wide override of type {} on {}", req.type(), req.day());
            return null;
        }
        if (CLOSE_EARLY.equals(employeeId)) {
            if (req.customEndTime() != null) {
                return new ScheduleOverride.EarlyClose(req.day(), req.customEndTime());
            }
            logger.warn("Ignoring early-close override on {} without a closing time", req.day());
            return null;
        }

        return switch (req.type()) {
            case EXCLUDE -> new ScheduleOverride.Exclude(employeeId, req.day(), kind);
            case ASSIGN -> new ScheduleOverride.Assign(employeeId, req.day(), kind);
            case PRIORITIZE -> new ScheduleOverride.Prioritize(employeeId, req.day(), kind);
            case CUSTOM_TIME -> new ScheduleOverride.CustomTime(employeeId, req.day(), kind,
                    req.customStartTime(), req.customEndTime());
        };
    }
}
