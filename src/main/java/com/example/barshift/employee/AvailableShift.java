package com.example.barshift.employee;

import com.example.barshift.common.ShiftKind;

import java.time.LocalTime;

/**
 * One declared availability entry. For {@code CUSTOM} both bounds describe the window;
 * for the other kinds {@code startTime} is an optional earliest start.
 */
public record AvailableShift(ShiftKind type, LocalTime startTime, LocalTime endTime) {

    public AvailableShift {
        type = type == null ? ShiftKind.ANY : type;
    }
}
