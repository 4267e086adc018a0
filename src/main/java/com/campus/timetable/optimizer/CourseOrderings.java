package com.campus.timetable.optimizer;

import com.campus.timetable.domain.DomainModels.Course;

import java.util.Comparator;
import java.util.Locale;

/**
 * Priority rules deciding which course claims its section first.
 */
public final class CourseOrderings {
    public static final Comparator<Course> DIFFICULTY_ASCENDING =
            Comparator.comparing(Course::difficulty);

    public static final Comparator<Course> SCARCITY_FIRST =
            Comparator.<Course>comparingInt(c -> c.sections().size())
                    .thenComparing(Course::difficulty);

    private CourseOrderings() {}

    public static Comparator<Course> forName(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "difficulty" -> DIFFICULTY_ASCENDING;
            case "scarcity" -> SCARCITY_FIRST;
            default -> throw new IllegalArgumentException("Unknown course ordering: " + name);
        };
    }
}
