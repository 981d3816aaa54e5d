package com.eyelevel.jobengine;

import com.eyelevel.jobengine.config.JobEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;

/**
 * The main entry point for the document job engine.
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.jobs" properties to
 *     {@link JobEngineProperties}.</li>
 *     <li>{@link EnableJpaRepositories}: scans the job ledger and tracked entity repositories.</li>
 *     <li>{@link EnableRetry}: retries ledger writes that hit transient database errors.</li>
 * </ul>
 * Workers and the stale job watchdog are started by {@link com.eyelevel.jobengine.service.job.JobOrchestrator}
 * once the context is up.
 */
@Slf4j
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.jobengine.repository")
@EnableConfigurationProperties(value = JobEngineProperties.class)
@EnableRetry
public class JobEngineApplication {

    public static void main(final String[] args) {
        log.info("Starting JobEngineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(JobEngineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "JobEngine"));
        log.info("  - Broker:     {}", env.getProperty("app.jobs.broker.type", "redis"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
