package io.cronlog4j.utils;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Parses and formats fixed run times ("HH:mm", 24h clock).
 * <p>
 * Only hour and minute are significant. Seconds are never part of a run time, so a wall-clock
 * instant is compared against a run time after truncating it to the minute.
 */
public final class TimeOfDayParser {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("HH:mm");

    private TimeOfDayParser() {
    }

    /**
     * Parse a run time such as "09:00" or "9:00".
     *
     * @throws IllegalArgumentException when the value is blank or not a valid hour:minute
     */
    public static LocalTime parse(String time) {
        if (time == null) {
            throw new IllegalArgumentException("time must not be null");
        }

        String s = time.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("time must not be empty");
        }

        try {
            return LocalTime.parse(s, FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid run time (expected HH:mm): " + time, e);
        }
    }

    /**
     * Canonical "HH:mm" form, used as the persisted value of a run time.
     */
    public static String format(LocalTime time) {
        return time == null ? null : CANONICAL.format(time);
    }

    /**
     * Wall-clock time of day truncated to the minute.
     */
    public static LocalTime minuteOf(ZonedDateTime now) {
        return now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    }
}
