package com.campus.timetable;

import com.campus.timetable.time.OverlapKind;
import com.campus.timetable.time.TimeArithmetic;
import org.junit.jupiter.api.Test;

import static com.campus.timetable.CourseFixtures.slot;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.TUESDAY;
import static org.junit.jupiter.api.Assertions.*;

class TimeArithmeticTest {
    @Test
    void convertsWallClockToMinuteOffsets() {
        assertEquals(0, TimeArithmetic.toMinutes("00:00"));
        assertEquals(9 * 60 + 30, TimeArithmetic.toMinutes("09:30"));
        assertEquals(9 * 60 + 30, TimeArithmetic.toMinutes("9:30"));
        assertEquals(23 * 60 + 59, TimeArithmetic.toMinutes("23:59"));
        assertEquals("08:05", TimeArithmetic.format(485));
    }

    @Test
    void rejectsMalformedTimes() {
        assertThrows(IllegalArgumentException.class, () -> TimeArithmetic.toMinutes("24:00"));
        assertThrows(IllegalArgumentException.class, () -> TimeArithmetic.toMinutes("9:75"));
        assertThrows(IllegalArgumentException.class, () -> TimeArithmetic.toMinutes("nine"));
        assertThrows(IllegalArgumentException.class, () -> TimeArithmetic.toMinutes(null));
        assertFalse(TimeArithmetic.isValidTime("12:3"));
    }

    @Test
    void classifiesOverlapAndAdjacency() {
        var base = slot(MONDAY, "09:00", "10:00");

        assertEquals(OverlapKind.DIRECT, TimeArithmetic.overlapKind(base, slot(MONDAY, "09:30", "11:00")));
        assertEquals(OverlapKind.DIRECT, TimeArithmetic.overlapKind(base, slot(MONDAY, "08:00", "12:00")));
        assertEquals(OverlapKind.BACK_TO_BACK, TimeArithmetic.overlapKind(base, slot(MONDAY, "10:00", "11:00")));
        assertEquals(OverlapKind.BACK_TO_BACK, TimeArithmetic.overlapKind(base, slot(MONDAY, "10:15", "11:00")));
        assertEquals(OverlapKind.BACK_TO_BACK, TimeArithmetic.overlapKind(base, slot(MONDAY, "07:30", "08:45")));
        assertEquals(OverlapKind.NONE, TimeArithmetic.overlapKind(base, slot(MONDAY, "10:16", "11:00")));
        assertEquals(OverlapKind.NONE, TimeArithmetic.overlapKind(base, slot(TUESDAY, "09:00", "10:00")));
    }

    @Test
    void parsesPreferredWindows() {
        var window = TimeArithmetic.parseWindow("13:00-17:00");
        assertEquals(13 * 60, window.startMinutes());
        assertEquals(17 * 60, window.endMinutes());
        assertTrue(window.contains(13 * 60));
        assertFalse(window.contains(17 * 60));

        assertTrue(TimeArithmetic.isValidWindow(" 09:00 - 12:00 "));
        assertFalse(TimeArithmetic.isValidWindow("12:00-09:00"));
        assertFalse(TimeArithmetic.isValidWindow("morning"));
    }
}
