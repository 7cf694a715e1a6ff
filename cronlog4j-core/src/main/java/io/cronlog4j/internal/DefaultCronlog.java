package io.cronlog4j.internal;

import io.cronlog4j.CronJob;
import io.cronlog4j.Cronlog;
import io.cronlog4j.JobRunLog;
import io.cronlog4j.JobRunner;
import io.cronlog4j.core.InvalidJobException;
import io.cronlog4j.core.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * {@link Cronlog} over a {@link JobRegistry}: one {@link JobRunner} per job and call.
 */
public class DefaultCronlog implements Cronlog {
    private static final Logger log = LoggerFactory.getLogger(DefaultCronlog.class);

    private final JobRegistry registry;
    private final JobRunLog runLog;
    private final Clock clock;
    private final boolean silent;

    public DefaultCronlog(JobRegistry registry, JobRunLog runLog, Clock clock, boolean silent) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.runLog = Objects.requireNonNull(runLog, "runLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.silent = silent;
    }

    @Override
    public void runAll(boolean force) {
        log.debug("cronlog running all jobs count={} force={}", registry.all().size(), force);
        for (CronJob job : registry.all()) {
            try {
                runner(job).run(force);
            } catch (InvalidJobException e) {
                log.error("cronlog skipped invalid job class={} msg={}", job.getClass().getName(), e.getMessage(), e);
            } catch (RuntimeException e) {
                // run log read failed while deciding
                log.error("cronlog could not decide job code={} msg={}", job.code(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void run(String code, boolean force) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
        runner(registry.getRequired(code)).run(force);
    }

    /**
     * Runner for one job; visible for callers that need {@link JobRunner#shouldRunNow(boolean)}.
     */
    public JobRunner runner(CronJob job) {
        return new JobRunner(job, runLog, clock, silent);
    }
}
