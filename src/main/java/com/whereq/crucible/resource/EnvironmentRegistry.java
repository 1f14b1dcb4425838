package com.whereq.crucible.resource;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.exception.EnvironmentConflictException;
import com.whereq.crucible.model.AllocationState;
import com.whereq.crucible.model.ComponentHealth;
import com.whereq.crucible.model.Environment;
import com.whereq.crucible.model.EnvironmentStatus;
import com.whereq.crucible.model.HealthState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Allocation table of execution environments.
 *
 * Register, deregister, allocate and release are atomic with respect to each
 * other. Available plus allocated always equals total outside the lock.
 */
@Slf4j
@Component
public class EnvironmentRegistry {

    private final CrucibleProperties properties;

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Slot> slots = new LinkedHashMap<>();

    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();

    private volatile boolean started;

    @Autowired
    public EnvironmentRegistry(CrucibleProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;

        Gauge.builder("crucible.environments.total", () -> snapshot().getTotal())
            .description("Registered environments")
            .register(meterRegistry);

        Gauge.builder("crucible.environments.allocated", () -> snapshot().getAllocated())
            .description("Environments currently running a job")
            .register(meterRegistry);

        Gauge.builder("crucible.environments.utilization", () -> snapshot().utilizationPercent())
            .description("Pool utilization percentage")
            .register(meterRegistry);
    }

    public void start() {
        started = true;
        log.info("Environment registry started: {}", getPoolSummary());
    }

    public void stop() {
        started = false;
        log.info("Environment registry stopped: {}", getPoolSummary());
    }

    /**
     * Listener invoked, outside the lock, whenever capacity may have changed
     */
    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    /**
     * Add an environment to the pool
     *
     * @param environment environment to register
     * @throws EnvironmentConflictException if the id is already registered
     */
    public void register(Environment environment) {
        if (environment == null || environment.getId() == null || environment.getProfile() == null) {
            throw new IllegalArgumentException("Environment id and hardware profile are required");
        }
        lock.lock();
        try {
            if (slots.containsKey(environment.getId())) {
                throw new EnvironmentConflictException("Environment already registered: " + environment.getId());
            }
            slots.put(environment.getId(), new Slot(environment));
        } finally {
            lock.unlock();
        }
        log.info("Registered environment {} ({} {} {}MB)", environment.getId(),
            environment.getProfile().getBackend(), environment.getProfile().getArchitecture(),
            environment.getProfile().getMemoryMb());
        fireChange();
    }

    /**
     * Remove an environment from the pool. An allocated environment is retired
     * instead: its job keeps running and the environment leaves on release.
     *
     * @param environmentId environment identifier
     * @return removal outcome
     */
    public RemovalOutcome deregister(String environmentId) {
        RemovalOutcome outcome;
        lock.lock();
        try {
            Slot slot = slots.get(environmentId);
            if (slot == null) {
                outcome = RemovalOutcome.NOT_FOUND;
            } else if (slot.state == AllocationState.ALLOCATED) {
                slot.retired = true;
                outcome = RemovalOutcome.RETIRED;
            } else {
                slots.remove(environmentId);
                outcome = RemovalOutcome.REMOVED;
            }
        } finally {
            lock.unlock();
        }

        switch (outcome) {
            case REMOVED -> log.info("Deregistered environment {}", environmentId);
            case RETIRED -> log.info("Environment {} retired, it leaves the pool when its job finishes", environmentId);
            case NOT_FOUND -> log.warn("Attempted to deregister unknown environment: {}", environmentId);
        }
        if (outcome != RemovalOutcome.NOT_FOUND) {
            fireChange();
        }
        return outcome;
    }

    /**
     * Atomically select an idle environment and allocate it to a job
     *
     * @param jobId job taking the environment
     * @param selector picks one of the idle candidates
     * @return the allocated environment, empty if the selector found none
     */
    public Optional<Environment> allocate(String jobId,
                                          Function<Collection<EnvironmentStatus>, Optional<EnvironmentStatus>> selector) {
        lock.lock();
        try {
            List<EnvironmentStatus> idle = new ArrayList<>();
            for (Slot slot : slots.values()) {
                if (slot.state == AllocationState.IDLE && !slot.retired) {
                    idle.add(slot.toStatus());
                }
            }
            if (idle.isEmpty()) {
                return Optional.empty();
            }
            Optional<EnvironmentStatus> selected = selector.apply(idle);
            if (selected.isEmpty()) {
                return Optional.empty();
            }
            Slot slot = slots.get(selected.get().getId());
            if (slot == null || slot.state != AllocationState.IDLE || slot.retired) {
                throw new IllegalStateException("Selected environment is not idle: " + selected.get().getId());
            }
            slot.state = AllocationState.ALLOCATED;
            slot.holder = jobId;
            slot.allocatedAt = Instant.now();
            log.info("Allocated environment {} to job {}", slot.environment.getId(), jobId);
            return Optional.of(slot.environment);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Allocate a specific environment
     *
     * @throws IllegalStateException if it is unknown, retired or already allocated
     */
    public Environment allocate(String environmentId, String jobId) {
        lock.lock();
        try {
            Slot slot = slots.get(environmentId);
            if (slot == null || slot.retired) {
                throw new IllegalStateException("Environment not available: " + environmentId);
            }
            if (slot.state == AllocationState.ALLOCATED) {
                throw new IllegalStateException("Environment " + environmentId
                    + " already allocated to job " + slot.holder);
            }
            slot.state = AllocationState.ALLOCATED;
            slot.holder = jobId;
            slot.allocatedAt = Instant.now();
            log.info("Allocated environment {} to job {}", environmentId, jobId);
            return slot.environment;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release an environment held by a job
     *
     * @return true if released, false if it was not held by that job
     */
    public boolean release(String environmentId, String jobId) {
        boolean retiredRemoved = false;
        lock.lock();
        try {
            Slot slot = slots.get(environmentId);
            if (slot == null || slot.state != AllocationState.ALLOCATED || !slot.holder.equals(jobId)) {
                log.warn("Attempted to release environment {} not held by job {}", environmentId, jobId);
                return false;
            }
            Instant now = Instant.now();
            slot.executionCount++;
            slot.busyTime = slot.busyTime.plus(Duration.between(slot.allocatedAt, now));
            slot.lastReleasedAt = now;
            slot.state = AllocationState.IDLE;
            slot.holder = null;
            slot.allocatedAt = null;
            if (slot.retired) {
                slots.remove(environmentId);
                retiredRemoved = true;
            }
        } finally {
            lock.unlock();
        }

        if (retiredRemoved) {
            log.info("Released environment {} from job {}, retired environment left the pool", environmentId, jobId);
        } else {
            log.info("Released environment {} from job {}", environmentId, jobId);
        }
        fireChange();
        return true;
    }

    public Optional<EnvironmentStatus> get(String environmentId) {
        lock.lock();
        try {
            Slot slot = slots.get(environmentId);
            return slot != null ? Optional.of(slot.toStatus()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * All environments, including retired ones still allocated
     */
    public List<EnvironmentStatus> list() {
        lock.lock();
        try {
            List<EnvironmentStatus> statuses = new ArrayList<>(slots.size());
            for (Slot slot : slots.values()) {
                statuses.add(slot.toStatus());
            }
            return statuses;
        } finally {
            lock.unlock();
        }
    }

    public List<EnvironmentStatus> idle() {
        return list().stream().filter(EnvironmentStatus::isIdle).toList();
    }

    public PoolSnapshot snapshot() {
        lock.lock();
        try {
            int allocated = 0;
            for (Slot slot : slots.values()) {
                if (slot.state == AllocationState.ALLOCATED) {
                    allocated++;
                }
            }
            return new PoolSnapshot(slots.size() - allocated, allocated, slots.size());
        } finally {
            lock.unlock();
        }
    }

    public ComponentHealth health() {
        if (!started) {
            return ComponentHealth.stopped("environmentRegistry");
        }
        PoolSnapshot pool = snapshot();
        return ComponentHealth.builder()
            .component("environmentRegistry")
            .state(HealthState.HEALTHY)
            .detail("total", pool.getTotal())
            .detail("available", pool.getAvailable())
            .detail("allocated", pool.getAllocated())
            .build();
    }

    /**
     * Periodic pool utilization monitoring and alerting
     */
    @Scheduled(fixedRateString = "${crucible.matching.monitor-interval:30000}")
    public void monitorPool() {
        if (!started) {
            return;
        }
        PoolSnapshot pool = snapshot();
        double threshold = properties.getMatching().getAlertThresholdPercent();
        if (pool.getTotal() > 0 && pool.utilizationPercent() > threshold) {
            log.warn("HIGH POOL UTILIZATION: {}% (threshold: {}%), {}",
                String.format("%.1f", pool.utilizationPercent()), threshold, getPoolSummary());
        }
        if (log.isDebugEnabled()) {
            list().forEach(status -> log.debug("Environment {}: {} holder={} executions={} busy={}s",
                status.getId(), status.getState(), status.getAllocatedTo(),
                status.getExecutionCount(), status.getBusyTime().toSeconds()));
        }
    }

    /**
     * Get current pool summary
     */
    public String getPoolSummary() {
        PoolSnapshot pool = snapshot();
        return String.format("Environments: %d available, %d allocated, %d total",
            pool.getAvailable(), pool.getAllocated(), pool.getTotal());
    }

    private void fireChange() {
        for (Runnable listener : changeListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Environment change listener failed", e);
            }
        }
    }

    private static final class Slot {
        private final Environment environment;
        private AllocationState state = AllocationState.IDLE;
        private String holder;
        private boolean retired;
        private Instant allocatedAt;
        private Instant lastReleasedAt;
        private long executionCount;
        private Duration busyTime = Duration.ZERO;

        private Slot(Environment environment) {
            this.environment = environment;
        }

        private EnvironmentStatus toStatus() {
            return EnvironmentStatus.builder()
                .environment(environment)
                .state(state)
                .allocatedTo(holder)
                .retired(retired)
                .lastReleasedAt(lastReleasedAt)
                .executionCount(executionCount)
                .busyTime(busyTime)
                .build();
        }
    }
}
