package io.cronlog4j.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeOfDayParserTest {

    @Test
    void parseShouldAcceptPaddedAndUnpaddedHours() {
        assertEquals(LocalTime.of(9, 0), TimeOfDayParser.parse("09:00"));
        assertEquals(LocalTime.of(9, 5), TimeOfDayParser.parse(" 9:05 "));
        assertEquals(LocalTime.of(23, 59), TimeOfDayParser.parse("23:59"));
    }

    @Test
    void parseShouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> TimeOfDayParser.parse("9"));
        assertThrows(IllegalArgumentException.class, () -> TimeOfDayParser.parse("12:60"));
        assertThrows(IllegalArgumentException.class, () -> TimeOfDayParser.parse("12:00:00"));
        assertThrows(IllegalArgumentException.class, () -> TimeOfDayParser.parse("  "));
    }

    @Test
    void formatShouldBeZeroPadded() {
        assertEquals("07:30", TimeOfDayParser.format(LocalTime.of(7, 30)));
        assertNull(TimeOfDayParser.format(null));
    }

    @Test
    void minuteOfShouldTruncateSeconds() {
        ZonedDateTime now = ZonedDateTime.of(2026, 1, 1, 9, 0, 59, 999, ZoneId.of("UTC"));

        assertEquals(LocalTime.of(9, 0), TimeOfDayParser.minuteOf(now));
    }
}
