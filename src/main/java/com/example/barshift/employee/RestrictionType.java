package com.example.barshift.employee;

public enum RestrictionType {
    NO_BEFORE,
    NO_AFTER,
    UNAVAILABLE_RANGE
}
