package com.campus.timetable.recommendation;

import com.campus.timetable.config.OptimizerSettings;
import com.campus.timetable.domain.DomainModels.ScheduleConstraints;
import com.campus.timetable.optimizer.OptimizerModels.OptimizedSchedule;
import org.springframework.stereotype.Component;

import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
public class ScheduleRecommendationWriter {
    static final double MIN_DIFFICULTY_BALANCE = 60.0;
    static final String ALL_GOOD = "Your schedule is well balanced with no conflicts. No changes recommended.";

    private final OptimizerSettings settings;

    public ScheduleRecommendationWriter(OptimizerSettings settings) {
        this.settings = settings;
    }

    public List<String> write(OptimizedSchedule primary, List<OptimizedSchedule> alternatives, ScheduleConstraints constraints) {
        List<String> out = new ArrayList<>();

        int conflicts = primary.conflicts().size();
        if (conflicts > 0) {
            out.add(String.format(Locale.US,
                    "Resolve %d scheduling conflict(s) by choosing different sections for the overlapping or back-to-back courses.",
                    conflicts));
        }
        if (!primary.workload().balanced()) {
            out.add("Your weekly workload is unevenly distributed. Consider moving a course to a lighter day.");
        }
        if (primary.totalCredits() > settings.getCreditCeiling()) {
            out.add(String.format(Locale.US,
                    "A load of %d credits exceeds the recommended %d. Consider reducing your course load.",
                    primary.totalCredits(), settings.getCreditCeiling()));
        }
        if (primary.difficultyBalance() < MIN_DIFFICULTY_BALANCE) {
            out.add("Course difficulty is unevenly mixed. Consider replacing a demanding course with an easier elective.");
        }

        String heavyDays = primary.workload().weekdayHours().entrySet().stream()
                .filter(e -> e.getValue() > settings.getHeavyDayHours())
                .map(e -> e.getKey().getDisplayName(TextStyle.FULL, Locale.US))
                .collect(Collectors.joining(", "));
        if (!heavyDays.isEmpty()) {
            out.add(String.format(Locale.US,
                    "Heavy study days: %s exceed %.0f hours. Spread the work across lighter days.",
                    heavyDays, settings.getHeavyDayHours()));
        }

        if (!primary.unscheduledCourses().isEmpty()) {
            out.add("No available section fits for: " + String.join(", ", primary.unscheduledCourses())
                    + ". Check other terms or relax your constraints.");
        }

        Double available = constraints.availableTime();
        if (available != null && primary.workload().totalHours() > available) {
            out.add(String.format(Locale.US,
                    "Estimated workload of %.1f hours/week exceeds your available %.1f hours.",
                    primary.workload().totalHours(), available));
        }

        alternatives.stream()
                .filter(a -> a.balanceScore() > primary.balanceScore())
                .findFirst()
                .ifPresent(a -> out.add(String.format(Locale.US,
                        "The %s alternative scores higher (%d vs %d). Consider it instead.",
                        a.strategy(), a.balanceScore(), primary.balanceScore())));

        if (out.isEmpty()) {
            out.add(ALL_GOOD);
        }
        return out;
    }
}
