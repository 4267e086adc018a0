package com.campus.timetable.optimizer;

import com.campus.timetable.config.OptimizerSettings;
import com.campus.timetable.optimizer.OptimizerModels.ScheduledCourse;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ScheduleScorer {
    private static final double VARIANCE_WEIGHT = 30.0;
    private static final double CONFLICT_PENALTY = 20.0;
    private static final double BALANCED_WORKLOAD_BONUS = 10.0;
    private static final double DIFFICULTY_WEIGHT = 0.2;
    private static final double PER_CREDIT_OVERLOAD_PENALTY = 5.0;

    private final OptimizerSettings settings;

    public ScheduleScorer(OptimizerSettings settings) {
        this.settings = settings;
    }

    public double difficultyBalance(List<ScheduledCourse> courses) {
        if (courses.isEmpty()) return 100.0;

        double mean = courses.stream().mapToInt(c -> c.difficulty().rank()).average().orElse(0.0);
        double variance = courses.stream()
                .mapToDouble(c -> Math.pow(c.difficulty().rank() - mean, 2))
                .average()
                .orElse(0.0);
        return Math.max(100.0 - variance * VARIANCE_WEIGHT, 0.0);
    }

    /** Score before clamping and rounding; may leave [0, 100]. */
    public double rawBalanceScore(int conflictCount, boolean workloadBalanced, double difficultyBalance, int totalCredits) {
        double score = 100.0;
        score -= CONFLICT_PENALTY * conflictCount;
        if (workloadBalanced) {
            score += BALANCED_WORKLOAD_BONUS;
        }
        score += difficultyBalance * DIFFICULTY_WEIGHT;
        if (totalCredits > settings.getCreditCeiling()) {
            score -= PER_CREDIT_OVERLOAD_PENALTY * (totalCredits - settings.getCreditCeiling());
        }
        return score;
    }

    public int balanceScore(int conflictCount, boolean workloadBalanced, double difficultyBalance, int totalCredits) {
        double raw = rawBalanceScore(conflictCount, workloadBalanced, difficultyBalance, totalCredits);
        return (int) Math.round(Math.max(0.0, Math.min(100.0, raw)));
    }
}
