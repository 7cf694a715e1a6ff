package io.cronlog4j.core;

import io.cronlog4j.utils.TimeOfDayParser;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Schedule describes when a job wants to run.
 *
 * <p>Two independent triggers can be combined:
 * <ul>
 *   <li>runEveryMinutes: run when that many minutes passed since the last successful interval run</li>
 *   <li>runAtTimes: run once per calendar day at or after each configured time of day</li>
 * </ul>
 *
 * <p>retryAfterFailureMinutes only applies to interval schedules: after a failed run it replaces
 * the normal interval until the retry window has passed.
 *
 * <p>A schedule with neither trigger never runs unless forced.
 */
public final class Schedule {

    private final Integer runEveryMinutes;
    private final List<LocalTime> runAtTimes;
    private final Integer retryAfterFailureMinutes;

    private Schedule(Integer runEveryMinutes, List<LocalTime> runAtTimes, Integer retryAfterFailureMinutes) {
        this.runEveryMinutes = runEveryMinutes;
        this.runAtTimes = Collections.unmodifiableList(new ArrayList<>(runAtTimes));
        this.retryAfterFailureMinutes = retryAfterFailureMinutes;
    }

    /**
     * Interval in minutes, or null when the schedule has no interval trigger.
     */
    public Integer runEveryMinutes() {
        return runEveryMinutes;
    }

    /**
     * Fixed times of day in configured order (never null, may be empty).
     */
    public List<LocalTime> runAtTimes() {
        return runAtTimes;
    }

    public Integer retryAfterFailureMinutes() {
        return retryAfterFailureMinutes;
    }

    public boolean hasInterval() {
        return runEveryMinutes != null;
    }

    public boolean hasRunAtTimes() {
        return !runAtTimes.isEmpty();
    }

    public boolean hasRetryAfterFailure() {
        return retryAfterFailureMinutes != null;
    }

    public boolean isEmpty() {
        return !hasInterval() && !hasRunAtTimes();
    }

    public static Schedule every(int minutes) {
        return builder().runEveryMinutes(minutes).build();
    }

    public static Schedule at(String... times) {
        return builder().runAtTimes(times).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schedule other)) return false;
        return Objects.equals(runEveryMinutes, other.runEveryMinutes)
                && runAtTimes.equals(other.runAtTimes)
                && Objects.equals(retryAfterFailureMinutes, other.retryAfterFailureMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runEveryMinutes, runAtTimes, retryAfterFailureMinutes);
    }

    @Override
    public String toString() {
        return "Schedule{runEveryMinutes=" + runEveryMinutes
                + ", runAtTimes=" + runAtTimes
                + ", retryAfterFailureMinutes=" + retryAfterFailureMinutes + '}';
    }

    public static final class Builder {
        private Integer runEveryMinutes;
        private final Set<LocalTime> runAtTimes = new LinkedHashSet<>();
        private Integer retryAfterFailureMinutes;

        public Builder runEveryMinutes(int minutes) {
            this.runEveryMinutes = requirePositive(minutes, "runEveryMinutes");
            return this;
        }

        /**
         * Add fixed times of day in "HH:mm" form (e.g. "09:00", "18:30").
         * Duplicates keep their first position.
         */
        public Builder runAtTimes(String... times) {
            Objects.requireNonNull(times, "times must not be null");
            for (String time : times) {
                runAtTime(TimeOfDayParser.parse(time));
            }
            return this;
        }

        public Builder runAtTime(LocalTime time) {
            Objects.requireNonNull(time, "time must not be null");
            this.runAtTimes.add(time.withSecond(0).withNano(0));
            return this;
        }

        public Builder retryAfterFailureMinutes(int minutes) {
            this.retryAfterFailureMinutes = requirePositive(minutes, "retryAfterFailureMinutes");
            return this;
        }

        public Schedule build() {
            return new Schedule(runEveryMinutes, new ArrayList<>(runAtTimes), retryAfterFailureMinutes);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be a positive number");
            }
            return value;
        }
    }
}
