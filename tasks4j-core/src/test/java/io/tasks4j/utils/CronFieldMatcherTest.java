package io.tasks4j.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronFieldMatcherTest {

    @Test
    void weekdayRangeByName() {
        CronFieldMatcher workdays = CronFieldMatcher.dayOfWeek("mon-fri");

        for (int d = 0; d <= 4; d++) {
            assertTrue(workdays.matches(d));
        }
        assertFalse(workdays.matches(5));
        assertFalse(workdays.matches(6));
    }

    @Test
    void listsAndStepsCombine() {
        CronFieldMatcher everyOtherDay = CronFieldMatcher.dayOfWeek("*/2");
        CronFieldMatcher weekend = CronFieldMatcher.dayOfWeek("SAT,sun");

        assertTrue(everyOtherDay.matches(0));
        assertFalse(everyOtherDay.matches(1));
        assertTrue(everyOtherDay.matches(6));
        assertTrue(weekend.matches(5));
        assertTrue(weekend.matches(6));
        assertFalse(weekend.matches(4));
    }

    @Test
    void startWithStepRunsToFieldMaximum() {
        CronFieldMatcher weeks = CronFieldMatcher.isoWeek("1/26");

        assertTrue(weeks.matches(1));
        assertTrue(weeks.matches(27));
        assertTrue(weeks.matches(53));
        assertFalse(weeks.matches(2));
    }

    @Test
    void malformedExpressionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CronFieldMatcher.dayOfWeek("7"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldMatcher.dayOfWeek("mon-"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldMatcher.dayOfWeek("fri-mon"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldMatcher.dayOfWeek("*/0"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldMatcher.dayOfWeek("1,,2"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldMatcher.isoWeek("0"));
        assertThrows(IllegalArgumentException.class, () -> CronFieldMatcher.isoWeek(" "));
    }
}
