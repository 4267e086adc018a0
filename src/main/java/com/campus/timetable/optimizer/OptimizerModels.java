package com.campus.timetable.optimizer;

import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.domain.DomainModels.Difficulty;
import com.campus.timetable.domain.DomainModels.ScheduleConstraints;
import com.campus.timetable.domain.DomainModels.Section;
import com.campus.timetable.domain.DomainModels.TimeSlot;
import com.campus.timetable.time.OverlapKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

public class OptimizerModels {
    public record OptimizationRequest(String studentId,
                                      List<Course> courses,
                                      ScheduleConstraints constraints,
                                      Integer alternatives) {}

    public record ScheduledCourse(String courseId,
                                  String title,
                                  int credits,
                                  Difficulty difficulty,
                                  Section section,
                                  List<TimeSlot> timeSlots,
                                  double weeklyWorkloadHours) {}

    public record Conflict(String firstCourse,
                           String secondCourse,
                           DayOfWeek day,
                           String firstSlot,
                           String secondSlot,
                           OverlapKind type,
                           Severity severity) {}

    public enum Severity {
        @JsonProperty("high") HIGH,
        @JsonProperty("medium") MEDIUM
    }

    public record FreeTimeBlock(DayOfWeek day, String start, String end, int durationMinutes) {}

    public record WorkloadDistribution(Map<DayOfWeek, Double> weekdayHours,
                                       double weekendHours,
                                       double totalHours,
                                       boolean balanced) {}

    public record OptimizedSchedule(String scheduleId,
                                    String strategy,
                                    List<ScheduledCourse> courses,
                                    int totalCredits,
                                    double difficultyBalance,
                                    int balanceScore,
                                    List<Conflict> conflicts,
                                    List<FreeTimeBlock> freeTime,
                                    WorkloadDistribution workload,
                                    List<String> unscheduledCourses) {}

    public record ScheduleOptimization(String studentId,
                                       OptimizedSchedule primary,
                                       List<OptimizedSchedule> alternatives,
                                       int balanceScore,
                                       List<String> recommendations) {}
}
