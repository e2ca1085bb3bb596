package com.example.barshift.staffing;

import jakarta.validation.constraints.Min;

import java.time.LocalTime;
import java.util.List;

/**
 * Staffing requirement of one day. {@code slots} is the canonical form; the morning/night counts
 * are the legacy form and are only read when no slot is present.
 */
public record DayStaffing(
        List<StaffingSlot> slots,
        String notes,
        @Min(value = 0, message = "Morning headcount must be 0 or greater")
        Integer morning,
        @Min(value = 0, message = "Night headcount must be 0 or greater")
        Integer night,
        LocalTime morningStart,
        LocalTime morningEnd,
        LocalTime nightStart,
        LocalTime nightEnd) {

    public DayStaffing {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public static DayStaffing ofSlots(List<StaffingSlot> slots) {
        return new DayStaffing(slots, null, null, null, null, null, null, null);
    }

    public static DayStaffing legacy(int morning, int night) {
        return new DayStaffing(List.of(), null, morning, night, null, null, null, null);
    }

    public boolean hasSlots() {
        return !slots.isEmpty();
    }
}
