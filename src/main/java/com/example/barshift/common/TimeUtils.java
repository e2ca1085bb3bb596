package com.example.barshift.common;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Minute-of-day arithmetic shared by every scheduling stage.
 */
public final class TimeUtils {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private TimeUtils() {
    }

    public static int toMinutes(LocalTime time) {
        if (time == null) return 0;
        return time.getHour() * 60 + time.getMinute();
    }

    public static LocalTime fromMinutes(int minutes) {
        int normalized = Math.floorMod(minutes, MINUTES_PER_DAY);
        return LocalTime.of(normalized / 60, normalized % 60);
    }

    /**
     * Length of a shift in minutes; an end before the start wraps past midnight.
     */
    public static int durationMinutes(LocalTime start, LocalTime end) {
        if (start == null || end == null) return 0;
        int diff = toMinutes(end) - toMinutes(start);
        if (diff < 0) {
            diff += MINUTES_PER_DAY;
        }
        return diff;
    }

    public static double durationHours(LocalTime start, LocalTime end) {
        return durationMinutes(start, end) / 60.0;
    }

    /**
     * Half-open containment: {@code start <= t < end}.
     */
    public static boolean inRange(LocalTime t, LocalTime start, LocalTime end) {
        int m = toMinutes(t);
        return m >= toMinutes(start) && m < toMinutes(end);
    }

    /**
     * 12-hour label, e.g. {@code 14:30 -> "2:30 PM"}.
     */
    public static String label(int minutes) {
        int normalized = Math.floorMod(minutes, MINUTES_PER_DAY);
        int hour = normalized / 60;
        int minute = normalized % 60;
        String suffix = hour >= 12 ? "PM" : "AM";
        int displayHour = hour % 12 == 0 ? 12 : hour % 12;
        return String.format("%d:%02d %s", displayHour, minute, suffix);
    }

    public static String label(LocalTime time) {
        return label(toMinutes(time));
    }

    public static String dayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public static String dayCode(DayOfWeek day) {
        return day.name().substring(0, 3).toLowerCase(Locale.ROOT);
    }
}
