package io.cronlog4j.config;

import io.cronlog4j.CronJob;
import io.cronlog4j.Cronlog;
import io.cronlog4j.JobRunLog;
import io.cronlog4j.core.JobRegistry;
import io.cronlog4j.internal.DefaultCronlog;
import io.cronlog4j.internal.mongo.MongoJobRunLog;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for cronlog components.
 *
 * <p>Every {@link CronJob} bean is registered. Nothing is triggered automatically: the application
 * decides when to call {@link Cronlog#runAll(boolean)} (a {@code @Scheduled} method, a command-line
 * runner, an HTTP endpoint hit by an external cron).
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass({Cronlog.class, MongoTemplate.class})
@EnableConfigurationProperties(CronlogProperties.class)
@ConditionalOnProperty(prefix = "cronlog", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronlogConfig {

    public static final String CLOCK_BEAN_NAME = "cronlogClock";

    @Bean(name = CLOCK_BEAN_NAME)
    @ConditionalOnMissingBean(name = CLOCK_BEAN_NAME)
    public Clock cronlogClock(CronlogProperties props) {
        return props.clock();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRunLog jobRunLog(MongoTemplate mongoTemplate, CronlogProperties props) {
        return new MongoJobRunLog(mongoTemplate, props.getCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    protected CronlogMongoIndexConfig cronlogMongoIndexConfig(MongoTemplate mongoTemplate, CronlogProperties props) {
        return new CronlogMongoIndexConfig(mongoTemplate, props.getCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry(ObjectProvider<List<CronJob>> jobsProvider) {
        List<CronJob> jobs = jobsProvider.getIfAvailable(List::of);
        return new JobRegistry(jobs);
    }

    @Bean
    @ConditionalOnMissingBean
    public Cronlog cronlog(JobRegistry registry,
                           JobRunLog runLog,
                           @Qualifier(CLOCK_BEAN_NAME) Clock clock,
                           CronlogProperties props) {
        return new DefaultCronlog(registry, runLog, clock, props.isSilent());
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronlog", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton cronlogIndexesInitializer(CronlogMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
