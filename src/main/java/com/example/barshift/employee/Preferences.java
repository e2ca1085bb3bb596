package com.example.barshift.employee;

public record Preferences(
        Boolean prefersMorning,
        Boolean prefersMid,
        Boolean prefersNight,
        Boolean canOpen,
        Boolean canWorkAloneExtended,
        Boolean needsBartenderOnShift) {

    public static Preferences none() {
        return new Preferences(null, null, null, null, null, null);
    }

    public boolean needsBartender() {
        return Boolean.TRUE.equals(needsBartenderOnShift);
    }
}
