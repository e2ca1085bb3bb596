package com.example.barshift.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;

@Component
public class SchedulerSettings {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerSettings.class);

    private final double overtimeThresholdHours;
    private final int bartendingThreshold;
    private final int minRestHours;
    private final int aloneThreshold;
    private final TimeWindow fallbackMorning;
    private final TimeWindow fallbackNight;
    private final int fallbackStaff;

    public SchedulerSettings(
            @Value("${scheduler.overtime-threshold-hours:38}") double overtimeThresholdHours,
            @Value("${scheduler.bartending-threshold:3}") int bartendingThreshold,
            @Value("${scheduler.min-rest-hours:0}") int minRestHours,
            @Value("${scheduler.alone-threshold:3}") int aloneThreshold,
            @Value("${scheduler.fallback.morning:07:15-14:00}") String fallbackMorning,
            @Value("${scheduler.fallback.night:16:00-21:00}") String fallbackNight,
            @Value("${scheduler.fallback.staff:2}") int fallbackStaff) {
        this.overtimeThresholdHours = overtimeThresholdHours;
        this.bartendingThreshold = bartendingThreshold;
        this.minRestHours = Math.max(0, minRestHours);
        this.aloneThreshold = aloneThreshold;
        this.fallbackMorning = parseWindow(fallbackMorning, new TimeWindow(LocalTime.of(7, 15), LocalTime.of(14, 0)));
        this.fallbackNight = parseWindow(fallbackNight, new TimeWindow(LocalTime.of(16, 0), LocalTime.of(21, 0)));
        this.fallbackStaff = Math.max(1, fallbackStaff);
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(38, 3, 0, 3, "07:15-14:00", "16:00-21:00", 2);
    }

    public SchedulerSettings withMinRestHours(int hours) {
        return new SchedulerSettings(overtimeThresholdHours, bartendingThreshold, hours, aloneThreshold,
                fallbackMorning.text(), fallbackNight.text(), fallbackStaff);
    }

    public SchedulerSettings withAloneThreshold(int threshold) {
        return new SchedulerSettings(overtimeThresholdHours, bartendingThreshold, minRestHours, threshold,
                fallbackMorning.text(), fallbackNight.text(), fallbackStaff);
    }

    public double getOvertimeThresholdHours() { return overtimeThresholdHours; }
    public int getBartendingThreshold() { return bartendingThreshold; }
    public int getMinRestHours() { return minRestHours; }
    public int getAloneThreshold() { return aloneThreshold; }
    public TimeWindow getFallbackMorning() { return fallbackMorning; }
    public TimeWindow getFallbackNight() { return fallbackNight; }
    public int getFallbackStaff() { return fallbackStaff; }

    private static TimeWindow parseWindow(String raw, TimeWindow def) {
        if (raw == null || raw.isBlank())
            return def;
        String[] parts = raw.split("-");
        if (parts.length != 2) {
            logger.warn("Ignoring fallback window '{}', using {}", raw, def.text());
            return def;
        }
        try {
            LocalTime start = LocalTime.parse(parts[0].trim());
            LocalTime end = LocalTime.parse(parts[1].trim());
            if (!start.isBefore(end)) {
                logger.warn("Ignoring empty fallback window '{}', using {}", raw, def.text());
                return def;
            }
            return new TimeWindow(start, end);
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring unparseable fallback window '{}', using {}", raw, def.text());
            return def;
        }
    }

    public record TimeWindow(LocalTime start, LocalTime end) {
        String text() {
            return start + "-" + end;
        }
    }
}
