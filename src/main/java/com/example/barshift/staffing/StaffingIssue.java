package com.example.barshift.staffing;

import java.time.DayOfWeek;

public record StaffingIssue(DayOfWeek day, StaffingIssueType type, String message) {
}
