package com.campus.timetable.optimizer;

import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.domain.DomainModels.ScheduleConstraints;
import com.campus.timetable.optimizer.OptimizerModels.OptimizedSchedule;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

@Component
public class AlternativeScheduleGenerator {
    static final List<Variant> VARIANTS = List.of(
            new Variant("morning", "09:00-12:00"),
            new Variant("afternoon", "13:00-17:00")
    );

    private final SchedulePipeline pipeline;

    public AlternativeScheduleGenerator(SchedulePipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Re-runs the pipeline with the caller's constraints biased towards each variant's window,
     * best score first.
     */
    public List<OptimizedSchedule> generate(String studentId, List<Course> courses, ScheduleConstraints constraints, int count) {
        return VARIANTS.stream()
                .limit(Math.max(0, Math.min(count, VARIANTS.size())))
                .map(v -> pipeline.run(studentId, v.label(), courses, constraints.withPreferredTimeSlots(List.of(v.window()))))
                .sorted(Comparator.comparingInt(OptimizedSchedule::balanceScore).reversed())
                .toList();
    }

    record Variant(String label, String window) {}
}
