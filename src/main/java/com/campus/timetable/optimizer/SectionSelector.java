package com.campus.timetable.optimizer;

import com.campus.timetable.domain.DomainModels.Course;
import com.campus.timetable.domain.DomainModels.DeliveryFormat;
import com.campus.timetable.domain.DomainModels.ScheduleConstraints;
import com.campus.timetable.domain.DomainModels.Section;
import com.campus.timetable.domain.DomainModels.TimeSlot;
import com.campus.timetable.time.TimeArithmetic;
import com.campus.timetable.time.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class SectionSelector {
    private static final Logger logger = LoggerFactory.getLogger(SectionSelector.class);

    static final TimeWindow DEFAULT_PREFERRED_WINDOW = new TimeWindow(9 * 60, 12 * 60);

    private static final double BASE_SCORE = 50.0;
    private static final double MAX_SEAT_BONUS = 20.0;
    private static final double SEATS_PER_POINT = 5.0;
    private static final double HYBRID_BONUS = 15.0;
    private static final double ONLINE_BONUS = 10.0;
    private static final double PREFERRED_WINDOW_BONUS = 10.0;

    /**
     * Picks the best surviving section of {@code course} and commits its slots.
     * Returns empty when every section is rejected; nothing is committed in that case.
     */
    public Optional<Section> select(Course course, CommittedSlots committed, ScheduleConstraints constraints) {
        List<TimeWindow> windows = preferredWindows(constraints);
        Section best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (Section section : course.sections()) {
            if (!isEligible(section, committed, constraints)) continue;

            double score = score(section, windows);
            logger.debug("Course {} section {} scored {}", course.id(), section.id(), score);
            if (best == null || score > bestScore) {
                best = section;
                bestScore = score;
            }
        }

        if (best != null) {
            committed.commit(best);
            logger.debug("Course {} assigned section {} (score {})", course.id(), best.id(), bestScore);
        }
        return Optional.ofNullable(best);
    }

    public boolean isEligible(Section section, CommittedSlots committed, ScheduleConstraints constraints) {
        if (committed.collidesWithAny(section)) return false;

        if (!constraints.preferredDays().isEmpty()
                && section.timeSlots().stream().noneMatch(s -> constraints.preferredDays().contains(s.day()))) {
            return false;
        }

        return section.professor() == null
                || constraints.avoidProfessors().stream().noneMatch(p -> p != null && p.trim().equalsIgnoreCase(section.professor().trim()));
    }

    public double score(Section section, List<TimeWindow> preferredWindows) {
        double score = BASE_SCORE;
        score += Math.min(section.seatsAvailable() / SEATS_PER_POINT, MAX_SEAT_BONUS);

        if (section.format() == DeliveryFormat.HYBRID) {
            score += HYBRID_BONUS;
        } else if (section.format() == DeliveryFormat.ONLINE) {
            score += ONLINE_BONUS;
        }

        if (section.timeSlots().stream().anyMatch(slot -> startsWithin(slot, preferredWindows))) {
            score += PREFERRED_WINDOW_BONUS;
        }
        return score;
    }

    List<TimeWindow> preferredWindows(ScheduleConstraints constraints) {
        if (constraints.preferredTimeSlots().isEmpty()) return List.of(DEFAULT_PREFERRED_WINDOW);
        return constraints.preferredTimeSlots().stream().map(TimeArithmetic::parseWindow).toList();
    }

    private boolean startsWithin(TimeSlot slot, List<TimeWindow> windows) {
        int start = TimeArithmetic.toMinutes(slot.startTime());
        return windows.stream().anyMatch(w -> w.contains(start));
    }
}
