package com.campus.timetable.time;

/**
 * Half-open minute range {@code [startMinutes, endMinutes)} within one day.
 */
public record TimeWindow(int startMinutes, int endMinutes) {
    public boolean contains(int minute) {
        return minute >= startMinutes && minute < endMinutes;
    }

    @Override
    public String toString() {
        return TimeArithmetic.format(startMinutes) + "-" + TimeArithmetic.format(endMinutes);
    }
}
