package com.whereq.crucible.config;

import com.whereq.crucible.model.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ Crucible.
 */
@Configuration
@ConfigurationProperties(prefix = "crucible")
@Data
public class CrucibleProperties {

    /**
     * Start the orchestrator once the application context is ready.
     */
    private boolean autoStart = true;

    /**
     * How long finished job records and timelines are kept.
     */
    private Duration statusRetention = Duration.ofHours(24);

    private SchedulerConfig scheduler = new SchedulerConfig();

    private MatchingConfig matching = new MatchingConfig();

    private RetryPolicy retry = new RetryPolicy();

    private PersistenceConfig persistence = new PersistenceConfig();

    private MonitorConfig monitor = new MonitorConfig();

    private RecoveryConfig recovery = new RecoveryConfig();

    private RunnerConfig runner = new RunnerConfig();

    @Data
    public static class SchedulerConfig {
        /**
         * Admission loop and timeout check period.
         */
        private Duration pollInterval = Duration.ofSeconds(1);

        /**
         * Upper bound on any job's execution time.
         */
        private Duration defaultTimeout = Duration.ofMinutes(30);

        /**
         * Safety margin added to a job's own estimate, as a fraction of it.
         */
        private double timeoutMarginRatio = 0.5;

        /**
         * Fraction of the budget after which a timeout warning is logged.
         */
        private double timeoutWarningRatio = 0.8;

        /**
         * Maximum number of jobs running at once.
         */
        private int maxConcurrentTests = 10;

        /**
         * How long stop() waits for running jobs before cancelling them.
         */
        private Duration shutdownDrainTimeout = Duration.ZERO;
    }

    @Data
    public static class MatchingConfig {
        /**
         * Jobs needing at most this much memory may count as lightweight.
         */
        private long lightweightMemoryMb = 2048;

        /**
         * Jobs estimated at most this long may count as lightweight.
         */
        private Duration lightweightDuration = Duration.ofMinutes(2);

        /**
         * Pool utilization percentage above which the pool monitor warns.
         */
        private double alertThresholdPercent = 90;

        /**
         * Pool monitor period in milliseconds.
         */
        private long monitorInterval = 30000;
    }

    @Data
    public static class PersistenceConfig {
        /**
         * Save and restore orchestrator state across restarts.
         */
        private boolean enabled = false;

        /**
         * JSON state file location.
         */
        private String stateFile = "crucible-state.json";

        /**
         * Period of background state saves while running.
         */
        private Duration saveInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class MonitorConfig {
        /**
         * Execution plan polling period.
         */
        private Duration planPollInterval = Duration.ofSeconds(5);

        /**
         * Where execution plans are read from.
         */
        private PlanSourceType planSource = PlanSourceType.IN_MEMORY;

        /**
         * Key prefix of the Redis plan source.
         */
        private String redisKeyPrefix = "crucible:";

        /**
         * Timeout of a single Redis round trip.
         */
        private Duration redisTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class RecoveryConfig {
        /**
         * Rolling window in which errors count towards degradation.
         */
        private Duration window = Duration.ofMinutes(10);

        /**
         * Environment failures inside the window that degrade the service.
         */
        private int environmentFailureThreshold = 1;

        /**
         * Resource exhaustion events inside the window that degrade the service.
         */
        private int resourceExhaustionThreshold = 3;

        /**
         * Recovery evaluation and maintenance period.
         */
        private Duration checkInterval = Duration.ofSeconds(10);
    }

    @Data
    public static class RunnerConfig {
        /**
         * Shell used by the local process runner.
         */
        private String shell = "/bin/bash";

        /**
         * Grace period between a polite and a forced process kill.
         */
        private Duration terminateGrace = Duration.ofSeconds(5);

        /**
         * Working directory for spawned test processes, empty for the service's own.
         */
        private String workDir = "";
    }

    public enum PlanSourceType {
        /**
         * Plans submitted through the REST API and held in memory.
         */
        IN_MEMORY,

        /**
         * Plans written to Redis hashes by the submission front end.
         */
        REDIS
    }
}
