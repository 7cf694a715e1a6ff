package io.cronlog4j.core;

import io.cronlog4j.CronJob;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class JobRegistry {

    private final Map<String, CronJob> jobsByCode;

    public JobRegistry(List<? extends CronJob> jobs) {
        Objects.requireNonNull(jobs, "jobs must not be null");
        Map<String, CronJob> byCode = new LinkedHashMap<>();
        for (CronJob job : jobs) {
            String code = requireCode(job);
            CronJob previous = byCode.putIfAbsent(code, job);
            if (previous != null) {
                throw new IllegalStateException("Duplicate CronJob code: " + code);
            }
        }
        this.jobsByCode = Collections.unmodifiableMap(byCode);
    }

    public CronJob getRequired(String code) {
        CronJob job = jobsByCode.get(code);
        if (job == null) {
            throw new InvalidJobException("No CronJob registered for code: " + code);
        }
        return job;
    }

    /**
     * Registered jobs in registration order.
     */
    public Collection<CronJob> all() {
        return jobsByCode.values();
    }

    private static String requireCode(CronJob job) {
        if (job == null) {
            throw new InvalidJobException("CronJob must not be null");
        }
        String code = job.code();
        if (code == null || code.isBlank()) {
            throw new InvalidJobException("CronJob code must not be blank: " + job.getClass().getName());
        }
        return code;
    }
}
