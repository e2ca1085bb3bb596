package com.example.barshift.schedule;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Conflicts and warnings collected during one run, in emission order. Identical warnings are kept once.
 */
public class Diagnostics {

    private final List<ScheduleConflict> conflicts = new ArrayList<>();
    private final Set<ScheduleWarning> warnings = new LinkedHashSet<>();

    public void conflict(ScheduleConflict conflict) {
        conflicts.add(conflict);
    }

    public void warn(ScheduleWarning warning) {
        warnings.add(warning);
    }

    public List<ScheduleConflict> conflicts() {
        return new ArrayList<>(conflicts);
    }

    public List<ScheduleWarning> warnings() {
        return new ArrayList<>(warnings);
    }
}
