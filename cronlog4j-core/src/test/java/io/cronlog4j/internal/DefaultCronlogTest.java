package io.cronlog4j.internal;

import io.cronlog4j.CronJob;
import io.cronlog4j.JobRunLog;
import io.cronlog4j.core.InvalidJobException;
import io.cronlog4j.core.JobRegistry;
import io.cronlog4j.core.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultCronlogTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-06-01T10:15:00Z"), ZoneOffset.UTC);
    private final InMemoryJobRunLog runLog = new InMemoryJobRunLog();
    private final List<String> executed = new ArrayList<>();

    @Test
    void runAllShouldRunOnlyDueJobsInOrder() {
        JobRegistry registry = new JobRegistry(List.of(
                job("a.interval", Schedule.every(15)),
                job("b.morning", Schedule.at("10:00")),
                job("c.evening", Schedule.at("20:00"))
        ));
        DefaultCronlog cronlog = new DefaultCronlog(registry, runLog, clock, false);

        cronlog.runAll(false);
        cronlog.runAll(false);

        assertThat(executed).containsExactly("a.interval", "b.morning");
        assertThat(runLog.size()).isEqualTo(2);
    }

    @Test
    void runAllShouldContinueAfterInvalidJob() {
        JobRegistry registry = new JobRegistry(List.of(
                job("broken", null),
                job("healthy", Schedule.every(5))
        ));

        new DefaultCronlog(registry, runLog, clock, false).runAll(false);

        assertThat(executed).containsExactly("healthy");
    }

    @Test
    void runAllShouldContinueAfterJobError() {
        CronJob overflowing = new CronJob() {
            @Override
            public String code() {
                return "a.overflow";
            }

            @Override
            public Schedule schedule() {
                return Schedule.every(5);
            }

            @Override
            public String execute() {
                executed.add(code());
                throw new StackOverflowError("deep");
            }
        };
        JobRegistry registry = new JobRegistry(List.of(overflowing, job("b.healthy", Schedule.every(5))));

        assertThatCode(() -> new DefaultCronlog(registry, runLog, clock, true).runAll(false))
                .doesNotThrowAnyException();

        assertThat(executed).containsExactly("a.overflow", "b.healthy");
        assertThat(runLog.findLatest("a.overflow")).hasValueSatisfying(r -> assertThat(r.failed()).isTrue());
    }

    @Test
    void runAllShouldContinueWhenRunLogReadFails() {
        JobRunLog flakyLog = mock(JobRunLog.class);
        when(flakyLog.findLatest("a.interval")).thenThrow(new IllegalStateException("connection refused"));
        when(flakyLog.findLatest("b.interval")).thenReturn(Optional.empty());
        JobRegistry registry = new JobRegistry(List.of(
                job("a.interval", Schedule.every(5)),
                job("b.interval", Schedule.every(5))
        ));

        assertThatCode(() -> new DefaultCronlog(registry, flakyLog, clock, false).runAll(false))
                .doesNotThrowAnyException();

        assertThat(executed).containsExactly("b.interval");
        verify(flakyLog, times(1)).append(any());
    }

    @Test
    void runByCodeShouldHonourForce() {
        DefaultCronlog cronlog = new DefaultCronlog(
                new JobRegistry(List.of(job("c.evening", Schedule.at("20:00")))), runLog, clock, false);

        cronlog.run("c.evening", false);
        assertThat(executed).isEmpty();

        cronlog.run("c.evening", true);
        assertThat(executed).containsExactly("c.evening");
        assertThat(runLog.findLatest("c.evening")).isPresent();
    }

    @Test
    void runByUnknownCodeShouldFailBeforeAnyRecord() {
        DefaultCronlog cronlog = new DefaultCronlog(new JobRegistry(List.of()), runLog, clock, false);

        assertThatThrownBy(() -> cronlog.run("nope", true)).isInstanceOf(InvalidJobException.class);
        assertThat(runLog.size()).isZero();
    }

    private CronJob job(String code, Schedule schedule) {
        return new CronJob() {
            @Override
            public String code() {
                return code;
            }

            @Override
            public Schedule schedule() {
                return schedule;
            }

            @Override
            public String execute() {
                executed.add(code);
                return "ok";
            }
        };
    }
}
