package io.cronlog4j;

import io.cronlog4j.core.InvalidJobException;
import io.cronlog4j.core.JobFailedException;
import io.cronlog4j.core.JobRunRecord;
import io.cronlog4j.core.RunDecision;
import io.cronlog4j.core.Schedule;
import io.cronlog4j.utils.RunMessages;
import io.cronlog4j.utils.TimeOfDayParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one {@link CronJob} at most once per call and records the outcome.
 *
 * <p>A runner is created per job definition. Each {@link #run(boolean)} call:
 * <ol>
 *   <li>asks {@link #shouldRunNow(boolean)} using the job's {@link Schedule} and the run log</li>
 *   <li>if due, calls {@link CronJob#execute()}</li>
 *   <li>appends exactly one {@link JobRunRecord}, whatever the job did</li>
 * </ol>
 *
 * <p>Anything thrown by the job body, {@link Error}s included, and run-log write failures are
 * logged and never thrown to the caller. Only setup mistakes ({@link InvalidJobException}) surface
 * as exceptions. An interrupted job leaves the caller's interrupt flag set.
 *
 * <p>Decision order:
 * <ul>
 *   <li>force</li>
 *   <li>interval, where a failed last run with retryAfterFailureMinutes decides alone</li>
 *   <li>fixed run times, first due slot without a run today wins</li>
 * </ul>
 *
 * <p>Not safe against concurrent runs of the same code: callers that need exclusivity across
 * processes must hold an external lock keyed by the job code.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final CronJob job;
    private final JobRunLog runLog;
    private final Clock clock;
    private final boolean silent;

    public JobRunner(CronJob job, JobRunLog runLog, Clock clock) {
        this(job, runLog, clock, false);
    }

    /**
     * @param silent if true, job failures are only recorded in the run log, not logged
     */
    public JobRunner(CronJob job, JobRunLog runLog, Clock clock, boolean silent) {
        this.job = requireValid(job);
        this.runLog = Objects.requireNonNull(runLog, "runLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.silent = silent;
    }

    /**
     * Create a runner for a job class with a public no-arg constructor.
     *
     * @throws InvalidJobException if {@code jobClass} is not a {@link CronJob} or cannot be instantiated
     */
    public static JobRunner forClass(Class<?> jobClass, JobRunLog runLog, Clock clock, boolean silent) {
        if (jobClass == null) {
            throw new InvalidJobException("jobClass must not be null");
        }
        if (!CronJob.class.isAssignableFrom(jobClass)) {
            throw new InvalidJobException(
                    "The cron job to be run must implement " + CronJob.class.getName() + ": " + jobClass.getName());
        }

        CronJob instance;
        try {
            instance = (CronJob) jobClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new InvalidJobException("Cannot instantiate cron job " + jobClass.getName(), e);
        }
        return new JobRunner(instance, runLog, clock, silent);
    }

    public static JobRunner forClass(Class<?> jobClass, JobRunLog runLog, Clock clock) {
        return forClass(jobClass, runLog, clock, false);
    }

    public CronJob job() {
        return job;
    }

    /**
     * Decide whether the job is due now.
     *
     * <p>The returned decision carries the matched fixed run time when a slot triggered it; that
     * value tags the record so the slot does not fire again on the same day.
     */
    public RunDecision shouldRunNow(boolean force) {
        if (force) {
            return RunDecision.runNow();
        }

        String code = job.code();
        Schedule schedule = job.schedule();
        Instant now = clock.instant();

        if (schedule.hasInterval()) {
            Optional<JobRunRecord> latest = runLog.findLatest(code);
            if (latest.isEmpty()) {
                return RunDecision.runNow();
            }

            JobRunRecord last = latest.get();
            if (last.failed() && schedule.hasRetryAfterFailure()) {
                Instant retryAt = last.startTime().plus(Duration.ofMinutes(schedule.retryAfterFailureMinutes()));
                return now.isAfter(retryAt) ? RunDecision.runNow() : RunDecision.skip();
            }

            Optional<JobRunRecord> lastSuccess = runLog.findLatestSuccessfulIntervalRun(code);
            if (lastSuccess.isEmpty()) {
                return RunDecision.runNow();
            }
            Instant dueAt = lastSuccess.get().startTime().plus(Duration.ofMinutes(schedule.runEveryMinutes()));
            if (now.isAfter(dueAt)) {
                return RunDecision.runNow();
            }
        }

        if (schedule.hasRunAtTimes()) {
            ZonedDateTime wallClock = now.atZone(clock.getZone());
            LocalTime currentMinute = TimeOfDayParser.minuteOf(wallClock);
            LocalDate today = wallClock.toLocalDate();

            for (LocalTime runAt : schedule.runAtTimes()) {
                if (currentMinute.isBefore(runAt)) {
                    continue;
                }
                if (!runLog.existsForRunAtTime(code, runAt, today, clock.getZone())) {
                    return RunDecision.runAt(runAt);
                }
            }
        }

        return RunDecision.skip();
    }

    /**
     * Run the job if it is due and append the outcome to the run log.
     * Returns normally whether the job ran, was skipped, or failed.
     */
    public void run(boolean force) {
        RunDecision decision = shouldRunNow(force);
        if (!decision.run()) {
            log.debug("cron job not due code={}", job.code());
            return;
        }

        Attempt attempt = new Attempt(job.code(), clock.instant(), decision.ranAtTime());
        log.debug("cron job started code={} job={} ranAtTime={} force={}",
                attempt.code, job.getClass().getName(), TimeOfDayParser.format(attempt.ranAtTime), force);

        try {
            attempt.succeeded(job.execute());
            log.debug("cron job succeeded code={}", attempt.code);
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            attempt.failed(e);
            logFailure(attempt);
        } finally {
            save(attempt.complete(clock.instant()));
        }
    }

    private void logFailure(Attempt attempt) {
        if (silent) {
            return;
        }
        if (attempt.partialMessage != null && !attempt.partialMessage.isEmpty()) {
            log.info("cron job partial message code={} msg={}", attempt.code, attempt.partialMessage);
        }
        log.error("cron job failed code={} msg={}", attempt.code, attempt.message);
    }

    private void save(JobRunRecord record) {
        try {
            runLog.append(record);
        } catch (Exception e) {
            log.error("Error saving cron job log code={} msg={}", record.code(), e.getMessage(), e);
        }
    }

    private static CronJob requireValid(CronJob job) {
        if (job == null) {
            throw new InvalidJobException("job must not be null");
        }
        if (job.code() == null || job.code().isBlank()) {
            throw new InvalidJobException("CronJob code must not be blank: " + job.getClass().getName());
        }
        if (job.schedule() == null) {
            throw new InvalidJobException("CronJob schedule must not be null: " + job.code());
        }
        return job;
    }

    /**
     * In-flight execution attempt. Becomes a {@link JobRunRecord} once, when it completes.
     */
    private static final class Attempt {
        private final String code;
        private final Instant startTime;
        private final LocalTime ranAtTime;

        private boolean succeeded;
        private String message = "";
        private String partialMessage;

        private Attempt(String code, Instant startTime, LocalTime ranAtTime) {
            this.code = code;
            this.startTime = startTime;
            this.ranAtTime = ranAtTime;
        }

        private void succeeded(String result) {
            this.succeeded = true;
            this.message = RunMessages.success(result);
        }

        private void failed(Throwable error) {
            Throwable detail = error;
            if (error instanceof JobFailedException jfe) {
                this.partialMessage = jfe.partialMessage();
                detail = jfe.getCause();
            }
            this.succeeded = false;
            this.message = RunMessages.failure(partialMessage, RunMessages.failureDetail(detail));
        }

        private JobRunRecord complete(Instant now) {
            Instant endTime = now.isBefore(startTime) ? startTime : now;
            return new JobRunRecord(code, startTime, endTime, succeeded, message, ranAtTime);
        }
    }
}
