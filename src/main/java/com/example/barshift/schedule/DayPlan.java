package com.example.barshift.schedule;

import com.example.barshift.staffing.PlannedShift;

import java.util.List;

/**
 * Shifts of one day in processing order. {@code followUps} are coverage shifts synthesized from
 * partial-day exceptions and are filled after the main queue.
 */
public record DayPlan(List<PlannedShift> queue, List<PlannedShift> followUps) {
}
