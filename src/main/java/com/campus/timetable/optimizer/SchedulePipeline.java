package com.campus.timetable.optimizer;

import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.domain.DomainModels.ScheduleConstraints;
import com.campus.timetable.domain.DomainModels.Section;
import com.campus.timetable.optimizer.OptimizerModels.Conflict;
import com.campus.timetable.optimizer.OptimizerModels.FreeTimeBlock;
import com.campus.timetable.optimizer.OptimizerModels.OptimizedSchedule;
import com.campus.timetable.optimizer.OptimizerModels.ScheduledCourse;
import com.campus.timetable.optimizer.OptimizerModels.WorkloadDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One greedy pass: order the courses, assign a section to each, then analyse and score the result.
 * Every call owns its {@link CommittedSlots}; nothing is shared between calls.
 */
@Component
public class SchedulePipeline {
    private static final Logger logger = LoggerFactory.getLogger(SchedulePipeline.class);

    private final Comparator<Course> courseOrder;
    private final SectionSelector sectionSelector;
    private final ConflictDetector conflictDetector;
    private final FreeTimeCalculator freeTimeCalculator;
    private final WorkloadDistributor workloadDistributor;
    private final ScheduleScorer scorer;

    public SchedulePipeline(Comparator<Course> courseOrder,
                            SectionSelector sectionSelector,
                            ConflictDetector conflictDetector,
                            FreeTimeCalculator freeTimeCalculator,
                            WorkloadDistributor workloadDistributor,
                            ScheduleScorer scorer) {
        this.courseOrder = courseOrder;
        this.sectionSelector = sectionSelector;
        this.conflictDetector = conflictDetector;
        this.freeTimeCalculator = freeTimeCalculator;
        this.workloadDistributor = workloadDistributor;
        this.scorer = scorer;
    }

    public OptimizedSchedule run(String studentId, String strategy, List<Course> courses, ScheduleConstraints constraints) {
        List<Course> ordered = new ArrayList<>(courses);
        ordered.sort(courseOrder);

        CommittedSlots committed = new CommittedSlots();
        List<ScheduledCourse> scheduled = new ArrayList<>();
        List<String> unscheduled = new ArrayList<>();

        for (Course course : ordered) {
            Optional<Section> section = sectionSelector.select(course, committed, constraints);
            if (section.isEmpty()) {
                logger.info("[{}] No eligible section for course {} ({}), leaving it out", strategy, course.id(), course.title());
                unscheduled.add(course.id());
                continue;
            }
            scheduled.add(new ScheduledCourse(course.id(), course.title(), course.credits(), course.difficulty(),
                    section.get(), section.get().timeSlots(), workloadDistributor.weeklyWorkload(course)));
        }

        List<Conflict> conflicts = conflictDetector.detect(scheduled);
        List<FreeTimeBlock> freeTime = freeTimeCalculator.calculate(scheduled);
        WorkloadDistribution workload = workloadDistributor.distribute(scheduled);
        double difficultyBalance = scorer.difficultyBalance(scheduled);
        int totalCredits = scheduled.stream().mapToInt(ScheduledCourse::credits).sum();
        int balanceScore = scorer.balanceScore(conflicts.size(), workload.balanced(), difficultyBalance, totalCredits);

        return new OptimizedSchedule(scheduleId(studentId, strategy, scheduled), strategy, List.copyOf(scheduled),
                totalCredits, difficultyBalance, balanceScore, conflicts, freeTime, workload, List.copyOf(unscheduled));
    }

    private String scheduleId(String studentId, String strategy, List<ScheduledCourse> scheduled) {
        String seed = studentId + "|" + strategy + "|" + scheduled.stream()
                .map(c -> c.courseId() + ":" + c.section().id())
                .collect(Collectors.joining(","));
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
