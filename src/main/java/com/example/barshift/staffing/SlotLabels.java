package com.example.barshift.staffing;

import com.example.barshift.common.TimeUtils;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps free-text slot labels onto the house role names (Opener, Bar, Closer, ...). Labels that
 * match no role are returned trimmed; a blank label becomes {@code "Shift"}.
 */
public final class SlotLabels {

    public static final String OPENER = "Opener";
    public static final String WEEKEND_OPENER = "Weekend Opener";
    public static final String BAR = "Bar";
    public static final String MID_SHIFT = "Mid Shift";
    public static final String SECOND_SERVER = "2nd Server";
    public static final String THIRD_SERVER = "3rd Server";
    public static final String CLOSER = "Closer";
    public static final String DINNER = "Dinner";
    public static final String DEFAULT = "Shift";

    private static final Pattern DINNER_NUMBER = Pattern.compile("\\b(dinn?er)\\s*(\\d+)\\b");
    private static final Pattern WEEKEND = Pattern.compile("\\bweekend\\b");
    private static final Pattern OPENING = Pattern.compile("\\bopen(er|ing)?\\b");
    private static final Pattern BARTENDING = Pattern.compile("\\bbar\\b|\\bbartend(er|ing)?\\b");
    private static final Pattern MID = Pattern.compile("\\bmid\\b|\\blunch\\b");
    private static final Pattern SECOND = Pattern.compile("\\b(2nd|second)\\b");
    private static final Pattern THIRD = Pattern.compile("\\b(3rd|third)\\b");
    private static final Pattern CLOSING = Pattern.compile("\\bclos(e|er|ing)\\b");
    private static final Pattern DINNER_WORD = Pattern.compile("\\bdinn?er\\b");

    private static final int WEEKEND_OPENER_END = 15 * 60;

    private SlotLabels() {
    }

    public static String normalize(String label, DayOfWeek day, LocalTime endTime) {
        if (label == null || label.isBlank()) {
            return DEFAULT;
        }
        String raw = label.trim().replaceAll("\\s+", " ");
        String lower = raw.toLowerCase(Locale.ROOT);

        Matcher dinner = DINNER_NUMBER.matcher(lower);
        if (dinner.find()) {
            int n = Integer.parseInt(dinner.group(2));
            if (n > 0) {
                return DINNER + " " + n;
            }
        }
        if (WEEKEND.matcher(lower).find() && OPENING.matcher(lower).find()) {
            return WEEKEND_OPENER;
        }
        if (OPENING.matcher(lower).find()) {
            // weekend openers that run into the afternoon
            if (endTime != null && isWeekend(day) && TimeUtils.toMinutes(endTime) >= WEEKEND_OPENER_END) {
                return WEEKEND_OPENER;
            }
            return OPENER;
        }
        if (BARTENDING.matcher(lower).find()) {
            return BAR;
        }
        if (MID.matcher(lower).find()) {
            return MID_SHIFT;
        }
        if (SECOND.matcher(lower).find()) {
            return SECOND_SERVER;
        }
        if (THIRD.matcher(lower).find()) {
            return THIRD_SERVER;
        }
        if (CLOSING.matcher(lower).find()) {
            return CLOSER;
        }
        if (DINNER_WORD.matcher(lower).find()) {
            return DINNER;
        }
        return raw;
    }

    public static boolean impliesBartender(String label) {
        return label != null && BARTENDING.matcher(label.toLowerCase(Locale.ROOT)).find();
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
