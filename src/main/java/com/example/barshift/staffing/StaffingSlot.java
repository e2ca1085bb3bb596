package com.example.barshift.staffing;

import java.time.LocalTime;

/**
 * One seat to fill: a labelled time window needing exactly one employee. The id is stable for the
 * life of a week's draft.
 */
public record StaffingSlot(String id, LocalTime startTime, LocalTime endTime, String label) {
}
