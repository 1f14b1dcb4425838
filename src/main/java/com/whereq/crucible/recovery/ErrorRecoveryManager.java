package com.whereq.crucible.recovery;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.HealthState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Records component and environment errors and decides when the service runs degraded.
 *
 * The service degrades when, inside the rolling window, unresolved environment
 * failures or resource exhaustion events reach their thresholds, or when any
 * unresolved CRITICAL error is present. It recovers once the condition clears.
 *
 * Every maintenance tick runs the recovery action registered for each unresolved
 * error's category and resolves the errors whose action succeeds.
 */
@Slf4j
@Service
public class ErrorRecoveryManager {

    private static final int MAX_HISTORY = 1000;

    private final CrucibleProperties properties;

    private final MeterRegistry meterRegistry;

    private final Deque<ErrorEvent> history = new ArrayDeque<>();

    private final Map<String, String> failedComponents = new ConcurrentHashMap<>();

    private final List<Runnable> maintenanceTasks = new CopyOnWriteArrayList<>();

    private final Map<ErrorCategory, RecoveryAction> recoveryActions = new ConcurrentHashMap<>();

    private volatile boolean degraded;

    private volatile String degradationReason;

    private ScheduledExecutorService maintenanceExecutor;

    @Autowired
    public ErrorRecoveryManager(CrucibleProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Start the periodic evaluation and maintenance loop
     */
    public synchronized void start() {
        if (maintenanceExecutor != null) {
            return;
        }
        long period = properties.getRecovery().getCheckInterval().toMillis();
        maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(
            new CustomizableThreadFactory("crucible-recovery-"));
        maintenanceExecutor.scheduleWithFixedDelay(this::runMaintenance, period, period, TimeUnit.MILLISECONDS);
        log.info("Error recovery manager started (window={}, check every {}ms)",
            properties.getRecovery().getWindow(), period);
    }

    public synchronized void stop() {
        if (maintenanceExecutor == null) {
            return;
        }
        maintenanceExecutor.shutdownNow();
        maintenanceExecutor = null;
        log.info("Error recovery manager stopped");
    }

    public boolean isRunning() {
        return maintenanceExecutor != null;
    }

    /**
     * Register a task run on every maintenance tick (state saves, retention cleanup)
     */
    public void addMaintenanceTask(Runnable task) {
        maintenanceTasks.add(task);
    }

    /**
     * Register the action tried on unresolved errors of a category, replacing any previous one
     */
    public void registerRecoveryAction(ErrorCategory category, RecoveryAction action) {
        recoveryActions.put(category, action);
    }

    /**
     * Run recovery actions against unresolved errors inside the window
     *
     * @return number of errors resolved
     */
    public int attemptRecovery() {
        if (recoveryActions.isEmpty()) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(properties.getRecovery().getWindow());
        List<ErrorEvent> candidates = new ArrayList<>();
        synchronized (history) {
            for (ErrorEvent event : history) {
                if (!event.isResolved() && !event.getOccurredAt().isBefore(cutoff)
                    && recoveryActions.containsKey(event.getCategory())) {
                    candidates.add(event);
                }
            }
        }

        int resolved = 0;
        for (ErrorEvent event : candidates) {
            RecoveryAction action = recoveryActions.get(event.getCategory());
            boolean recovered;
            try {
                recovered = action.attempt(event);
            } catch (Exception e) {
                log.warn("Recovery of error {} ({}) failed: {}", event.getErrorId(), event.getCategory(), e.getMessage());
                continue;
            }
            if (recovered && markResolved(event.getErrorId())) {
                log.info("Recovered from {} error {}: {}", event.getCategory(), event.getErrorId(), event.getMessage());
                resolved++;
            }
        }
        if (resolved > 0) {
            evaluate();
        }
        return resolved;
    }

    /**
     * Record an error
     *
     * @return error identifier for later resolution
     */
    public String report(ErrorCategory category, ErrorSeverity severity, String component,
                         String message, String jobId, String environmentId) {
        ErrorEvent event = ErrorEvent.builder()
            .errorId("err-" + UUID.randomUUID().toString().substring(0, 8))
            .category(category)
            .severity(severity)
            .component(component)
            .message(message)
            .jobId(jobId)
            .environmentId(environmentId)
            .occurredAt(Instant.now())
            .build();

        synchronized (history) {
            history.addLast(event);
            while (history.size() > MAX_HISTORY) {
                history.removeFirst();
            }
        }

        Counter.builder("crucible.errors")
            .tag("category", category.name())
            .tag("severity", severity.name())
            .description("Errors reported to the recovery manager")
            .register(meterRegistry)
            .increment();

        if (severity == ErrorSeverity.CRITICAL || severity == ErrorSeverity.HIGH) {
            log.error("{} error in {}: {} (job={}, environment={})",
                category, component, message, jobId, environmentId);
        } else {
            log.warn("{} error in {}: {} (job={}, environment={})",
                category, component, message, jobId, environmentId);
        }

        evaluate();
        return event.getErrorId();
    }

    /**
     * Mark an error as resolved
     *
     * @return true if the error was known and unresolved
     */
    public boolean resolve(String errorId) {
        boolean resolved = markResolved(errorId);
        if (resolved) {
            log.info("Error {} resolved", errorId);
            evaluate();
        }
        return resolved;
    }

    private boolean markResolved(String errorId) {
        synchronized (history) {
            for (ErrorEvent event : history) {
                if (event.getErrorId().equals(errorId) && !event.isResolved()) {
                    event.setResolved(true);
                    event.setResolvedAt(Instant.now());
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Record that a component threw out of its loop or probe
     */
    public void componentFailed(String component, Throwable error) {
        String previous = failedComponents.put(component, String.valueOf(error.getMessage()));
        if (previous == null) {
            report(ErrorCategory.SYSTEM_ERROR, ErrorSeverity.HIGH, component, String.valueOf(error.getMessage()), null, null);
        }
    }

    public void componentRecovered(String component) {
        if (failedComponents.remove(component) != null) {
            log.info("Component {} recovered", component);
        }
    }

    /**
     * Failure message of a component, null if it is healthy
     */
    public String componentFailure(String component) {
        return failedComponents.get(component);
    }

    /**
     * Re-evaluate degradation against the rolling window
     */
    public void evaluate() {
        Instant cutoff = Instant.now().minus(properties.getRecovery().getWindow());
        Map<ErrorCategory, Integer> counts = new EnumMap<>(ErrorCategory.class);
        boolean critical = false;

        synchronized (history) {
            Iterator<ErrorEvent> it = history.descendingIterator();
            while (it.hasNext()) {
                ErrorEvent event = it.next();
                if (event.getOccurredAt().isBefore(cutoff)) {
                    break;
                }
                if (event.isResolved()) {
                    continue;
                }
                counts.merge(event.getCategory(), 1, Integer::sum);
                critical |= event.getSeverity() == ErrorSeverity.CRITICAL;
            }
        }

        CrucibleProperties.RecoveryConfig recovery = properties.getRecovery();
        String reason = null;
        if (critical) {
            reason = "critical error reported";
        } else if (counts.getOrDefault(ErrorCategory.ENVIRONMENT_FAILURE, 0) >= recovery.getEnvironmentFailureThreshold()) {
            reason = counts.get(ErrorCategory.ENVIRONMENT_FAILURE) + " environment failures";
        } else if (counts.getOrDefault(ErrorCategory.RESOURCE_EXHAUSTION, 0) >= recovery.getResourceExhaustionThreshold()) {
            reason = counts.get(ErrorCategory.RESOURCE_EXHAUSTION) + " resource exhaustion events";
        }

        boolean nowDegraded = reason != null;
        if (nowDegraded && !degraded) {
            log.warn("Entering degraded mode: {}", reason);
        } else if (!nowDegraded && degraded) {
            log.info("Leaving degraded mode");
        }
        degraded = nowDegraded;
        degradationReason = reason;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public String getDegradationReason() {
        return degradationReason;
    }

    /**
     * Errors recorded inside the rolling window, newest last
     */
    public List<ErrorEvent> recentErrors() {
        Instant cutoff = Instant.now().minus(properties.getRecovery().getWindow());
        synchronized (history) {
            List<ErrorEvent> recent = new ArrayList<>();
            for (ErrorEvent event : history) {
                if (!event.getOccurredAt().isBefore(cutoff)) {
                    recent.add(event);
                }
            }
            return recent;
        }
    }

    public Map<String, Object> getErrorSummary() {
        List<ErrorEvent> recent = recentErrors();
        Map<String, Long> byCategory = new LinkedHashMap<>();
        for (ErrorEvent event : recent) {
            byCategory.merge(event.getCategory().name(), 1L, Long::sum);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("recentErrors", recent.size());
        summary.put("unresolved", recent.stream().filter(event -> !event.isResolved()).count());
        summary.put("byCategory", byCategory);
        summary.put("degraded", degraded);
        return summary;
    }

    public ComponentHealth health() {
        ComponentHealth.ComponentHealthBuilder builder = ComponentHealth.builder()
            .component("errorRecovery")
            .detail("window", properties.getRecovery().getWindow().toString())
            .detail("recentErrors", recentErrors().size());
        if (degraded) {
            return builder.state(HealthState.DEGRADED).message(degradationReason).build();
        }
        return builder.state(isRunning() ? HealthState.HEALTHY : HealthState.STOPPED).build();
    }

    private void runMaintenance() {
        try {
            attemptRecovery();
            evaluate();
        } catch (Exception e) {
            log.error("Error evaluating degradation", e);
        }
        boolean failed = false;
        for (Runnable task : maintenanceTasks) {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Maintenance task failed", e);
                componentFailed("maintenance", e);
                failed = true;
            }
        }
        if (!failed) {
            componentRecovered("maintenance");
        }
    }
}
