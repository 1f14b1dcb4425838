package com.whereq.crucible.service;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.HealthState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Tracks running job deadlines and reports expired ones.
 *
 * A job's budget is the tighter of the default timeout and its own estimate
 * plus the configured margin. Expired jobs are handed to the expiry handler,
 * checked once per poll interval.
 */
@Slf4j
@Service
public class TimeoutManager {

    private final CrucibleProperties properties;

    private final Map<String, Deadline> deadlines = new ConcurrentHashMap<>();

    private final AtomicLong timeoutsDetected = new AtomicLong();

    private final AtomicLong warningsSent = new AtomicLong();

    private volatile Consumer<String> expiryHandler;

    private ScheduledExecutorService checkExecutor;

    @Autowired
    public TimeoutManager(CrucibleProperties properties) {
        this.properties = properties;
    }

    /**
     * Start periodic deadline checks
     *
     * @param handler receives the id of every job whose deadline passed
     */
    public synchronized void start(Consumer<String> handler) {
        this.expiryHandler = handler;
        if (checkExecutor != null) {
            return;
        }
        long period = properties.getScheduler().getPollInterval().toMillis();
        checkExecutor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("crucible-timeout-"));
        checkExecutor.scheduleWithFixedDelay(this::checkSafely, period, period, TimeUnit.MILLISECONDS);
        log.info("Timeout manager started (default timeout {}, margin {}, check every {}ms)",
            properties.getScheduler().getDefaultTimeout(), properties.getScheduler().getTimeoutMarginRatio(), period);
    }

    public synchronized void stop() {
        if (checkExecutor == null) {
            return;
        }
        checkExecutor.shutdownNow();
        checkExecutor = null;
        log.info("Timeout manager stopped, {} deadlines still tracked", deadlines.size());
    }

    public boolean isRunning() {
        return checkExecutor != null;
    }

    /**
     * Compute the effective timeout for a job estimate
     */
    public Duration budgetFor(Duration estimate) {
        Duration defaultTimeout = properties.getScheduler().getDefaultTimeout();
        if (estimate == null || estimate.isZero() || estimate.isNegative()) {
            return defaultTimeout;
        }
        long withMargin = (long) (estimate.toMillis() * (1.0 + properties.getScheduler().getTimeoutMarginRatio()));
        Duration estimated = Duration.ofMillis(withMargin);
        return estimated.compareTo(defaultTimeout) < 0 ? estimated : defaultTimeout;
    }

    /**
     * Start monitoring a job
     *
     * @param jobId job identifier
     * @param estimate job's estimated duration
     * @return the job's deadline
     */
    public Instant register(String jobId, Duration estimate) {
        Instant now = Instant.now();
        Duration budget = budgetFor(estimate);
        Instant deadline = now.plus(budget);
        long warnMillis = (long) (budget.toMillis() * properties.getScheduler().getTimeoutWarningRatio());
        deadlines.put(jobId, new Deadline(deadline, now.plusMillis(warnMillis)));
        log.debug("Monitoring job {} with timeout {} (deadline {})", jobId, budget, deadline);
        return deadline;
    }

    public void unregister(String jobId) {
        deadlines.remove(jobId);
    }

    public Instant deadlineOf(String jobId) {
        Deadline deadline = deadlines.get(jobId);
        return deadline != null ? deadline.expiresAt : null;
    }

    /**
     * Check all deadlines once and notify the handler of expired jobs
     *
     * @return ids of jobs that expired on this check
     */
    public List<String> checkDeadlines() {
        Instant now = Instant.now();
        List<String> expired = new ArrayList<>();

        deadlines.forEach((jobId, deadline) -> {
            if (!now.isBefore(deadline.expiresAt)) {
                expired.add(jobId);
            } else if (!deadline.warned && !now.isBefore(deadline.warnAt)) {
                deadline.warned = true;
                warningsSent.incrementAndGet();
                log.warn("Job {} is approaching its deadline ({}ms left)", jobId,
                    Duration.between(now, deadline.expiresAt).toMillis());
            }
        });

        for (String jobId : expired) {
            if (deadlines.remove(jobId) == null) {
                continue;
            }
            timeoutsDetected.incrementAndGet();
            log.warn("Job {} exceeded its deadline", jobId);
            Consumer<String> handler = expiryHandler;
            if (handler != null) {
                handler.accept(jobId);
            }
        }
        return expired;
    }

    private void checkSafely() {
        try {
            checkDeadlines();
        } catch (Exception e) {
            log.error("Error checking job deadlines", e);
        }
    }

    public int getMonitoredJobs() {
        return deadlines.size();
    }

    public long getTimeoutsDetected() {
        return timeoutsDetected.get();
    }

    public long getWarningsSent() {
        return warningsSent.get();
    }

    public ComponentHealth health() {
        return ComponentHealth.builder()
            .component("timeoutManager")
            .state(isRunning() ? HealthState.HEALTHY : HealthState.STOPPED)
            .detail("monitoredJobs", getMonitoredJobs())
            .detail("timeoutsDetected", getTimeoutsDetected())
            .detail("warningsSent", getWarningsSent())
            .build();
    }

    private static final class Deadline {
        private final Instant expiresAt;
        private final Instant warnAt;
        private volatile boolean warned;

        private Deadline(Instant expiresAt, Instant warnAt) {
            this.expiresAt = expiresAt;
            this.warnAt = warnAt;
        }
    }
}
