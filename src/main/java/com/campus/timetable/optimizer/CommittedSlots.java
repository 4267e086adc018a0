package com.campus.timetable.optimizer;

import com.campus.timetable.domain.DomainModels.Section;
import com.campus.timetable.domain.DomainModels.TimeSlot;
import com.campus.timetable.time.TimeArithmetic;

import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Slots already claimed during one optimization run, keyed by weekday.
 * Collision is an exact (start, end) match only; partial overlaps are left to {@link ConflictDetector}.
 */
public class CommittedSlots {
    private final Map<DayOfWeek, Set<String>> byDay = new EnumMap<>(DayOfWeek.class);

    public boolean collides(TimeSlot slot) {
        return byDay.getOrDefault(slot.day(), Set.of()).contains(key(slot));
    }

    public boolean collidesWithAny(Section section) {
        return section.timeSlots().stream().anyMatch(this::collides);
    }

    public void commit(Section section) {
        for (TimeSlot slot : section.timeSlots()) {
            byDay.computeIfAbsent(slot.day(), d -> new HashSet<>()).add(key(slot));
        }
    }

    public int size() {
        return byDay.values().stream().mapToInt(Set::size).sum();
    }

    private static String key(TimeSlot slot) {
        return TimeArithmetic.toMinutes(slot.startTime()) + "-" + TimeArithmetic.toMinutes(slot.endTime());
    }
}
