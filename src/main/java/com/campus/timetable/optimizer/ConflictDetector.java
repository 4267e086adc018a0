package com.campus.timetable.optimizer;

import com.campus.timetable.config.OptimizerSettings;
import com.campus.timetable.domain.DomainModels.TimeSlot;
import com.campus.timetable.optimizer.OptimizerModels.Conflict;
import com.campus.timetable.optimizer.OptimizerModels.ScheduledCourse;
import com.campus.timetable.optimizer.OptimizerModels.Severity;
import com.campus.timetable.time.OverlapKind;
import com.campus.timetable.time.TimeArithmetic;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ConflictDetector {
    private final OptimizerSettings settings;

    public ConflictDetector(OptimizerSettings settings) {
        this.settings = settings;
    }

    public List<Conflict> detect(List<ScheduledCourse> courses) {
        List<Conflict> conflicts = new ArrayList<>();
        for (int i = 0; i < courses.size(); i++) {
            for (int j = i + 1; j < courses.size(); j++) {
                ScheduledCourse first = courses.get(i);
                ScheduledCourse second = courses.get(j);
                for (TimeSlot a : first.timeSlots()) {
                    for (TimeSlot b : second.timeSlots()) {
                        OverlapKind kind = TimeArithmetic.overlapKind(a, b, settings.getBackToBackGapMinutes());
                        if (kind == OverlapKind.NONE) continue;
                        conflicts.add(new Conflict(first.title(), second.title(), a.day(),
                                a.startTime() + "-" + a.endTime(),
                                b.startTime() + "-" + b.endTime(),
                                kind,
                                kind == OverlapKind.DIRECT ? Severity.HIGH : Severity.MEDIUM));
                    }
                }
            }
        }
        return conflicts;
    }
}
