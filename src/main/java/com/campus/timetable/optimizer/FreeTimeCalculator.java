package com.campus.timetable.optimizer;

import com.campus.timetable.config.OptimizerSettings;
import com.campus.timetable.domain.DomainModels.TimeSlot;
import com.campus.timetable.optimizer.OptimizerModels.FreeTimeBlock;
import com.campus.timetable.optimizer.OptimizerModels.ScheduledCourse;
import com.campus.timetable.time.TimeArithmetic;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class FreeTimeCalculator {
    static final Set<DayOfWeek> WEEKDAYS = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    private final OptimizerSettings settings;

    public FreeTimeCalculator(OptimizerSettings settings) {
        this.settings = settings;
    }

    /**
     * Gaps between consecutive classes and fully free weekdays. Time before the first
     * and after the last class of a day is not reported.
     */
    public List<FreeTimeBlock> calculate(List<ScheduledCourse> courses) {
        List<FreeTimeBlock> blocks = new ArrayList<>();
        for (DayOfWeek day : WEEKDAYS) {
            List<TimeSlot> daySlots = courses.stream()
                    .flatMap(c -> c.timeSlots().stream())
                    .filter(s -> s.day() == day)
                    .sorted(Comparator.comparingInt(s -> TimeArithmetic.toMinutes(s.startTime())))
                    .toList();

            if (daySlots.isEmpty()) {
                int start = settings.getDayStartMinutes();
                int end = settings.getDayEndMinutes();
                blocks.add(new FreeTimeBlock(day, TimeArithmetic.format(start), TimeArithmetic.format(end), end - start));
                continue;
            }

            for (int i = 0; i + 1 < daySlots.size(); i++) {
                int gapStart = TimeArithmetic.toMinutes(daySlots.get(i).endTime());
                int gapEnd = TimeArithmetic.toMinutes(daySlots.get(i + 1).startTime());
                if (gapEnd - gapStart >= settings.getMinFreeBlockMinutes()) {
                    blocks.add(new FreeTimeBlock(day, TimeArithmetic.format(gapStart), TimeArithmetic.format(gapEnd), gapEnd - gapStart));
                }
            }
        }
        return blocks;
    }
}
