package com.campus.timetable.optimizer;

import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.domain.DomainModels.TimeSlot;
import com.campus.timetable.optimizer.OptimizerModels.ScheduledCourse;
import com.campus.timetable.optimizer.OptimizerModels.WorkloadDistribution;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class WorkloadDistributor {
    private static final double HOURS_PER_CREDIT = 3.0;
    // Weekly effort is amortized over the whole week, not over meeting days.
    private static final double AMORTIZATION_DAYS = 7.0;
    private static final double IMBALANCE_FACTOR = 1.5;

    public double weeklyWorkload(Course course) {
        return course.credits() * HOURS_PER_CREDIT * course.difficulty().workloadMultiplier();
    }

    public WorkloadDistribution distribute(List<ScheduledCourse> courses) {
        Map<DayOfWeek, Double> weekdays = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : FreeTimeCalculator.WEEKDAYS) {
            weekdays.put(day, 0.0);
        }
        double weekend = 0.0;
        double total = 0.0;

        for (ScheduledCourse course : courses) {
            double perDay = course.weeklyWorkloadHours() / AMORTIZATION_DAYS;
            total += course.weeklyWorkloadHours();

            Set<DayOfWeek> meetingDays = new LinkedHashSet<>();
            for (TimeSlot slot : course.timeSlots()) {
                meetingDays.add(slot.day());
            }
            for (DayOfWeek day : meetingDays) {
                if (weekdays.containsKey(day)) {
                    weekdays.merge(day, perDay, Double::sum);
                } else {
                    weekend += perDay;
                }
            }
        }

        return new WorkloadDistribution(Collections.unmodifiableMap(weekdays), weekend, total, isBalanced(weekdays));
    }

    private boolean isBalanced(Map<DayOfWeek, Double> weekdays) {
        double average = weekdays.values().stream().mapToDouble(v -> v).average().orElse(0.0);
        return weekdays.values().stream().noneMatch(hours -> hours > IMBALANCE_FACTOR * average);
    }
}
