package com.campus.timetable.config;

import com.campus.timetable.time.TimeArithmetic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunables of the optimizer, bound from {@code timetable.optimizer.*}.
 */
@Component
public class OptimizerSettings {
    private final int backToBackGapMinutes;
    private final int minFreeBlockMinutes;
    private final int dayStartMinutes;
    private final int dayEndMinutes;
    private final int creditCeiling;
    private final double heavyDayHours;
    private final int alternatives;
    private final String ordering;

    public OptimizerSettings(@Value("${timetable.optimizer.back-to-back-gap-minutes:15}") int backToBackGapMinutes,
                             @Value("${timetable.optimizer.min-free-block-minutes:30}") int minFreeBlockMinutes,
                             @Value("${timetable.optimizer.day-start:08:00}") String dayStart,
                             @Value("${timetable.optimizer.day-end:18:00}") String dayEnd,
                             @Value("${timetable.optimizer.credit-ceiling:18}") int creditCeiling,
                             @Value("${timetable.optimizer.heavy-day-hours:8}") double heavyDayHours,
                             @Value("${timetable.optimizer.alternatives:2}") int alternatives,
                             @Value("${timetable.optimizer.ordering:difficulty}") String ordering) {
        if (backToBackGapMinutes < 0) {
            throw new IllegalArgumentException("back-to-back-gap-minutes must not be negative");
        }
        if (minFreeBlockMinutes <= 0) {
            throw new IllegalArgumentException("min-free-block-minutes must be positive");
        }
        if (alternatives < 1 || alternatives > 2) {
            throw new IllegalArgumentException("alternatives must be 1 or 2, got " + alternatives);
        }
        this.dayStartMinutes = TimeArithmetic.toMinutes(dayStart);
        this.dayEndMinutes = TimeArithmetic.toMinutes(dayEnd);
        if (dayStartMinutes >= dayEndMinutes) {
            throw new IllegalArgumentException("day-start must be before day-end");
        }
        this.backToBackGapMinutes = backToBackGapMinutes;
        this.minFreeBlockMinutes = minFreeBlockMinutes;
        this.creditCeiling = creditCeiling;
        this.heavyDayHours = heavyDayHours;
        this.alternatives = alternatives;
        this.ordering = ordering;
    }

    public static OptimizerSettings defaults() {
        return new OptimizerSettings(15, 30, "08:00", "18:00", 18, 8.0, 2, "difficulty");
    }

    public int getBackToBackGapMinutes() { return backToBackGapMinutes; }
    public int getMinFreeBlockMinutes() { return minFreeBlockMinutes; }
    public int getDayStartMinutes() { return dayStartMinutes; }
    public int getDayEndMinutes() { return dayEndMinutes; }
    public int getCreditCeiling() { return creditCeiling; }
    public double getHeavyDayHours() { return heavyDayHours; }
    public int getAlternatives() { return alternatives; }
    public String getOrdering() { return ordering; }
}
