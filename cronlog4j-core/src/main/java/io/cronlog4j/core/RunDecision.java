package io.cronlog4j.core;

import java.time.LocalTime;

/**
 * Result of the "should this job run now" check.
 *
 * ranAtTime : the matched fixed run time, null unless the run was triggered by runAtTimes
 */
public record RunDecision(
        boolean run,
        LocalTime ranAtTime
) {

    private static final RunDecision SKIP = new RunDecision(false, null);
    private static final RunDecision RUN = new RunDecision(true, null);

    public RunDecision {
        if (!run && ranAtTime != null) {
            throw new IllegalArgumentException("a skipped decision cannot carry a run time");
        }
    }

    public static RunDecision skip() {
        return SKIP;
    }

    public static RunDecision runNow() {
        return RUN;
    }

    public static RunDecision runAt(LocalTime ranAtTime) {
        if (ranAtTime == null) {
            throw new IllegalArgumentException("ranAtTime must not be null");
        }
        return new RunDecision(true, ranAtTime);
    }
}
