package com.campus.timetable.time;

import com.campus.timetable.domain.DomainModels.TimeSlot;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TimeArithmetic {
    public static final int DEFAULT_BACK_TO_BACK_GAP_MINUTES = 15;

    private static final Pattern TIME_PATTERN = Pattern.compile("^([01]?\\d|2[0-3]):([0-5]\\d)$");
    private static final Pattern WINDOW_PATTERN = Pattern.compile("^\\s*([0-9:]+)\\s*-\\s*([0-9:]+)\\s*$");

    private TimeArithmetic() {}

    public static boolean isValidTime(String time) {
        return time != null && TIME_PATTERN.matcher(time.trim()).matches();
    }

    public static int toMinutes(String time) {
        if (time == null) throw new IllegalArgumentException("Time is required");
        Matcher matcher = TIME_PATTERN.matcher(time.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time '" + time + "', expected HH:MM");
        }
        return Integer.parseInt(matcher.group(1)) * 60 + Integer.parseInt(matcher.group(2));
    }

    public static String format(int minutes) {
        return String.format(Locale.US, "%02d:%02d", minutes / 60, minutes % 60);
    }

    public static int durationMinutes(TimeSlot slot) {
        return toMinutes(slot.endTime()) - toMinutes(slot.startTime());
    }

    public static OverlapKind overlapKind(TimeSlot a, TimeSlot b) {
        return overlapKind(a, b, DEFAULT_BACK_TO_BACK_GAP_MINUTES);
    }

    public static OverlapKind overlapKind(TimeSlot a, TimeSlot b, int backToBackGapMinutes) {
        if (a.day() == null || a.day() != b.day()) return OverlapKind.NONE;

        int startA = toMinutes(a.startTime());
        int endA = toMinutes(a.endTime());
        int startB = toMinutes(b.startTime());
        int endB = toMinutes(b.endTime());

        if (startA < endB && endA > startB) {
            return OverlapKind.DIRECT;
        }
        if (Math.abs(endA - startB) <= backToBackGapMinutes || Math.abs(endB - startA) <= backToBackGapMinutes) {
            return OverlapKind.BACK_TO_BACK;
        }
        return OverlapKind.NONE;
    }

    public static boolean isValidWindow(String window) {
        if (window == null) return false;
        Matcher matcher = WINDOW_PATTERN.matcher(window);
        if (!matcher.matches() || !isValidTime(matcher.group(1)) || !isValidTime(matcher.group(2))) return false;
        return toMinutes(matcher.group(1)) < toMinutes(matcher.group(2));
    }

    public static TimeWindow parseWindow(String window) {
        if (!isValidWindow(window)) {
            throw new IllegalArgumentException("Invalid time window '" + window + "', expected HH:MM-HH:MM");
        }
        Matcher matcher = WINDOW_PATTERN.matcher(window);
        matcher.matches();
        return new TimeWindow(toMinutes(matcher.group(1)), toMinutes(matcher.group(2)));
    }
}
