package com.example.barshift.employee;

import java.util.List;

public record DayAvailability(boolean available, List<AvailableShift> shifts, String notes) {

    public DayAvailability {
        shifts = shifts == null ? List.of() : List.copyOf(shifts);
    }
}
