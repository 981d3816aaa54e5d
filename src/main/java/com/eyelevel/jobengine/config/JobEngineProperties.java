package com.eyelevel.jobengine.config;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.model.JobType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Binds application properties under the "app.jobs" prefix: the broker, the queue topology, the
 * stale job watchdog and ledger listing limits.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.jobs")
public class JobEngineProperties {

    @Valid
    private Broker broker = new Broker();

    /**
     * Priority given to submissions that do not request one. Lower values are serviced first.
     */
    @Min(0)
    @Max(QueueBackend.MAX_PRIORITY)
    private int defaultPriority = 10;

    @Valid
    private Map<String, Queue> queues = new LinkedHashMap<>();

    @Valid
    private Watchdog watchdog = new Watchdog();

    @Valid
    private Listing listing = new Listing();

    public enum BrokerType {
        REDIS, MEMORY, NONE
    }

    @Data
    public static class Broker {
        @NotNull
        private BrokerType type = BrokerType.REDIS;
        @Valid
        private Redis redis = new Redis();

        @Data
        public static class Redis {
            @NotBlank
            private String keyPrefix = "jobs";
        }
    }

    @Data
    public static class Queue {
        private Set<JobType> jobTypes = EnumSet.noneOf(JobType.class);
        @Min(1)
        private int concurrency = 1;
        @Min(1)
        private int attempts = 3;
        @NotNull
        private Duration backoffDelay = Duration.ofSeconds(1);
        @NotNull
        private Duration lockDuration = Duration.ofSeconds(30);
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);
        @NotNull
        private Duration stalledInterval = Duration.ofSeconds(30);
        @Min(0)
        private int maxStalledCount = 1;
        @Valid
        private Retention removeOnComplete = new Retention(Duration.ofHours(24), 100);
        @Valid
        private Retention removeOnFail = new Retention(Duration.ofDays(7), 500);
    }

    @Data
    public static class Retention {
        @NotNull
        private Duration age;
        @Min(0)
        private int count;

        public Retention() {
        }

        public Retention(final Duration age, final int count) {
            this.age = age;
            this.count = count;
        }
    }

    @Data
    public static class Watchdog {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofMinutes(3);
        @NotNull
        private Duration staleThreshold = Duration.ofMinutes(5);
        @Min(1)
        private int maxRecoveryAttempts = 3;
        @Min(0)
        @Max(QueueBackend.MAX_PRIORITY)
        private int recoveryPriority = 1;
    }

    @Data
    public static class Listing {
        @Min(1)
        private int defaultPageSize = 20;
        @Min(1)
        @Max(1000)
        private int maxPageSize = 100;
    }
}
