package com.campus.timetable.validation;

import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.domain.DomainModels.ScheduleConstraints;
import com.campus.timetable.domain.DomainModels.Section;
import com.campus.timetable.domain.DomainModels.TimeSlot;
import com.campus.timetable.optimizer.OptimizerModels.OptimizationRequest;
import com.campus.timetable.time.TimeArithmetic;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class ScheduleRequestValidator {
    static final int MAX_CREDITS_PER_COURSE = 30;

    public List<ValidationError> validate(OptimizationRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        if (request == null) {
            errors.add(new ValidationError("EMPTY_COURSES", "Request body is required", "request"));
            return errors;
        }

        List<Course> courses = request.courses();
        if (courses == null || courses.isEmpty()) {
            errors.add(new ValidationError("EMPTY_COURSES", "At least one candidate course is required", "courses"));
        } else {
            for (int i = 0; i < courses.size(); i++) {
                validateCourse(courses.get(i), "courses[" + i + "]", errors);
            }
            duplicateCourses(courses, errors);
        }

        if (request.constraints() != null) {
            validateConstraints(request.constraints(), errors);
        }

        Integer alternatives = request.alternatives();
        if (alternatives != null && (alternatives < 1 || alternatives > 2)) {
            errors.add(new ValidationError("INVALID_ALTERNATIVES", "alternatives must be 1 or 2, got " + alternatives, "alternatives"));
        }
        return errors;
    }

    private void validateCourse(Course course, String path, List<ValidationError> errors) {
        if (course == null) {
            errors.add(new ValidationError("MISSING_COURSE", "Course entry is null", path));
            return;
        }
        if (isBlank(course.id())) errors.add(new ValidationError("MISSING_FIELD", "Course id is required", path + ".id"));
        if (isBlank(course.title())) errors.add(new ValidationError("MISSING_FIELD", "Course title is required", path + ".title"));
        if (course.difficulty() == null) errors.add(new ValidationError("MISSING_FIELD", "Course difficulty is required", path + ".difficulty"));
        if (course.credits() < 0) {
            errors.add(new ValidationError("INVALID_CREDITS", "Credits must not be negative: " + course.credits(), path + ".credits"));
        } else if (course.credits() > MAX_CREDITS_PER_COURSE) {
            errors.add(new ValidationError("INVALID_CREDITS",
                    "Credits must not exceed " + MAX_CREDITS_PER_COURSE + ": " + course.credits(), path + ".credits"));
        }

        for (int s = 0; s < course.sections().size(); s++) {
            Section section = course.sections().get(s);
            String sectionPath = path + ".sections[" + s + "]";
            if (section == null) {
                errors.add(new ValidationError("MISSING_FIELD", "Section entry is null", sectionPath));
                continue;
            }
            if (isBlank(section.id())) errors.add(new ValidationError("MISSING_FIELD", "Section id is required", sectionPath + ".id"));
            if (section.seatsAvailable() < 0) {
                errors.add(new ValidationError("INVALID_SEATS", "Seats available must not be negative", sectionPath + ".seatsAvailable"));
            }
            for (int t = 0; t < section.timeSlots().size(); t++) {
                validateSlot(section.timeSlots().get(t), sectionPath + ".timeSlots[" + t + "]", errors);
            }
        }
    }

    private void validateSlot(TimeSlot slot, String path, List<ValidationError> errors) {
        if (slot == null) {
            errors.add(new ValidationError("MISSING_FIELD", "Time slot entry is null", path));
            return;
        }
        if (slot.day() == null) errors.add(new ValidationError("MISSING_DAY", "Time slot weekday is required", path + ".day"));

        boolean startOk = TimeArithmetic.isValidTime(slot.startTime());
        boolean endOk = TimeArithmetic.isValidTime(slot.endTime());
        if (!startOk) errors.add(new ValidationError("INVALID_TIME", "Malformed start time: " + slot.startTime(), path + ".startTime"));
        if (!endOk) errors.add(new ValidationError("INVALID_TIME", "Malformed end time: " + slot.endTime(), path + ".endTime"));
        if (startOk && endOk && TimeArithmetic.toMinutes(slot.endTime()) <= TimeArithmetic.toMinutes(slot.startTime())) {
            errors.add(new ValidationError("INVALID_SLOT_RANGE",
                    "End time " + slot.endTime() + " must be after start time " + slot.startTime(), path));
        }
    }

    private void validateConstraints(ScheduleConstraints constraints, List<ValidationError> errors) {
        for (int i = 0; i < constraints.preferredTimeSlots().size(); i++) {
            String window = constraints.preferredTimeSlots().get(i);
            if (!TimeArithmetic.isValidWindow(window)) {
                errors.add(new ValidationError("INVALID_TIME_WINDOW", "Malformed time window (expected HH:MM-HH:MM): " + window,
                        "constraints.preferredTimeSlots[" + i + "]"));
            }
        }
        if (constraints.preferredDays().stream().anyMatch(Objects::isNull)) {
            errors.add(new ValidationError("MISSING_DAY", "Preferred days must not contain null", "constraints.preferredDays"));
        }
        if (constraints.availableTime() != null && constraints.availableTime() < 0) {
            errors.add(new ValidationError("INVALID_AVAILABLE_TIME", "Available time must not be negative", "constraints.availableTime"));
        }
        if (constraints.budget() != null && constraints.budget() < 0) {
            errors.add(new ValidationError("INVALID_BUDGET", "Budget must not be negative", "constraints.budget"));
        }
    }

    private void duplicateCourses(List<Course> courses, List<ValidationError> errors) {
        Map<String, Long> counts = courses.stream()
                .filter(c -> c != null && c.id() != null)
                .collect(Collectors.groupingBy(Course::id, Collectors.counting()));
        counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .forEach(id -> errors.add(new ValidationError("DUPLICATE_COURSE", "Duplicate course id: " + id, "courses")));
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record ValidationError(String code, String message, String field) {}
}
