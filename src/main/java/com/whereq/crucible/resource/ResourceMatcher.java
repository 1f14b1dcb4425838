package com.whereq.crucible.resource;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.model.BackendKind;
import com.whereq.crucible.model.EnvironmentStatus;
import com.whereq.crucible.model.HardwareRequirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Select the best idle environment for a job's hardware requirement.
 *
 * Candidates must match the architecture exactly, provide at least the requested
 * memory and every required peripheral. Lightweight jobs prefer container backends,
 * heavy or CPU-intensive jobs prefer full-machine backends. Remaining ties go to the
 * least recently used environment.
 */
@Slf4j
@Component
public class ResourceMatcher {

    private final CrucibleProperties properties;

    @Autowired
    public ResourceMatcher(CrucibleProperties properties) {
        this.properties = properties;
    }

    /**
     * Find the best matching candidate
     *
     * @param requirement hardware requirement, null matches anything
     * @param estimatedDuration job's estimated duration
     * @param candidates environments to choose from, non-idle ones are skipped
     * @return best candidate or empty if none qualifies
     */
    public Optional<EnvironmentStatus> findMatch(HardwareRequirement requirement,
                                                 Duration estimatedDuration,
                                                 Collection<EnvironmentStatus> candidates) {
        boolean lightweight = isLightweight(requirement, estimatedDuration);

        Optional<EnvironmentStatus> match = candidates.stream()
            .filter(EnvironmentStatus::isIdle)
            .filter(candidate -> candidate.getEnvironment().getProfile().satisfies(requirement))
            .min(Comparator
                .comparingInt((EnvironmentStatus candidate) -> backendRank(candidate, lightweight))
                .thenComparing(candidate -> lastUsed(candidate))
                .thenComparing(EnvironmentStatus::getId));

        if (log.isDebugEnabled()) {
            log.debug("Match for {} (lightweight={}) among {} candidates: {}",
                describe(requirement), lightweight, candidates.size(),
                match.map(EnvironmentStatus::getId).orElse("none"));
        }
        return match;
    }

    /**
     * Whether any non-retired environment could host the requirement once it is idle
     */
    public boolean isSatisfiable(HardwareRequirement requirement, Collection<EnvironmentStatus> environments) {
        return environments.stream()
            .filter(status -> !status.isRetired())
            .anyMatch(status -> status.getEnvironment().getProfile().satisfies(requirement));
    }

    /**
     * Workload weight classification used for backend preference
     */
    public boolean isLightweight(HardwareRequirement requirement, Duration estimatedDuration) {
        CrucibleProperties.MatchingConfig matching = properties.getMatching();
        boolean shortRun = estimatedDuration == null
            || estimatedDuration.compareTo(matching.getLightweightDuration()) <= 0;
        if (requirement == null) {
            return shortRun;
        }
        return !requirement.isCpuIntensive()
            && requirement.getMemoryMb() <= matching.getLightweightMemoryMb()
            && shortRun;
    }

    private static int backendRank(EnvironmentStatus candidate, boolean lightweight) {
        BackendKind backend = candidate.getEnvironment().getProfile().getBackend();
        if (backend == null) {
            return 3;
        }
        if (lightweight) {
            return switch (backend) {
                case CONTAINER -> 0;
                case EMULATOR -> 1;
                case PHYSICAL -> 2;
            };
        }
        return switch (backend) {
            case EMULATOR -> 0;
            case PHYSICAL -> 1;
            case CONTAINER -> 2;
        };
    }

    private static Instant lastUsed(EnvironmentStatus candidate) {
        return candidate.getLastReleasedAt() != null ? candidate.getLastReleasedAt() : Instant.EPOCH;
    }

    private static String describe(HardwareRequirement requirement) {
        if (requirement == null) {
            return "any hardware";
        }
        return requirement.getArchitecture() + "/" + requirement.getMemoryMb() + "MB";
    }
}
