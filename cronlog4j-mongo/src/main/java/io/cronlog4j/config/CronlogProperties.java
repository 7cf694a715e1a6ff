package io.cronlog4j.config;

import io.cronlog4j.internal.mongo.JobRunDocument;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Runtime configuration for job runs and the run log.
 */
@ConfigurationProperties(prefix = "cronlog")
public class CronlogProperties {
    private boolean enabled = true;
    private String timezone; // IANA id; null means system default
    private boolean silent = false;
    private String collection = JobRunDocument.DEFAULT_COLLECTION;
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isSilent() {
        return silent;
    }

    public void setSilent(boolean silent) {
        this.silent = silent;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * Zone of the wall clock that fixed run times and calendar days are read in.
     *
     * @throws IllegalArgumentException if {@code cronlog.timezone} is not a valid zone id
     */
    public ZoneId resolveZone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (Exception e) {
            throw new IllegalArgumentException("cronlog.timezone is not a valid zone id: " + timezone, e);
        }
    }

    public Clock clock() {
        return Clock.system(resolveZone());
    }
}
