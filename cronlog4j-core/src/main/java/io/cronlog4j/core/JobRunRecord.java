package io.cronlog4j.core;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Outcome of one execution attempt, as stored in the run log.
 * This is a pure data object with no persistence logic.
 *
 * @param code      job code, join key of the run log
 * @param startTime when the attempt started (UTC)
 * @param endTime   when the attempt finished (UTC)
 * @param succeeded whether the job body returned normally
 * @param message   result text or failure detail, at most {@link #MAX_MESSAGE_LENGTH} characters
 * @param ranAtTime fixed run time this attempt satisfies, or null for interval and forced runs
 */
public record JobRunRecord(
        String code,
        Instant startTime,
        Instant endTime,
        boolean succeeded,
        String message,
        LocalTime ranAtTime
) {

    public static final int MAX_MESSAGE_LENGTH = 1000;

    public JobRunRecord {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(endTime, "endTime must not be null");
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("endTime must not be before startTime");
        }
        if (message == null) {
            message = "";
        }
        if (message.length() > MAX_MESSAGE_LENGTH) {
            throw new IllegalArgumentException("message must not exceed " + MAX_MESSAGE_LENGTH + " characters");
        }
    }

    public boolean failed() {
        return !succeeded;
    }

    public boolean ranAtFixedTime() {
        return ranAtTime != null;
    }
}
