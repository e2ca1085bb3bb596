package com.example.barshift.employee;

import java.time.LocalDate;

/**
 * Inclusive date-range blackout (vacation, leave).
 */
public record Exclusion(LocalDate startDate, LocalDate endDate, String reason) {

    public boolean contains(LocalDate date) {
        if (date == null || startDate == null) return false;
        LocalDate end = endDate == null ? startDate : endDate;
        return !date.isBefore(startDate) && !date.isAfter(end);
    }
}
