package com.whereq.crucible.recovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.crucible.config.CrucibleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes the orchestrator state file as JSON.
 *
 * Writes go to a temporary file that replaces the state file atomically; the
 * previous state file is kept with a {@code .bak} suffix.
 */
@Slf4j
@Component
public class OrchestratorStateStore {

    private final CrucibleProperties properties;

    private final ObjectMapper objectMapper;

    @Autowired
    public OrchestratorStateStore(CrucibleProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return properties.getPersistence().isEnabled();
    }

    public Path stateFile() {
        return Paths.get(properties.getPersistence().getStateFile()).toAbsolutePath();
    }

    /**
     * Write a snapshot
     *
     * @throws IOException if the file cannot be written
     */
    public void save(OrchestratorState state) throws IOException {
        Path target = stateFile();
        Path directory = target.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);

        if (Files.exists(target)) {
            Files.copy(target, target.resolveSibling(target.getFileName() + ".bak"), StandardCopyOption.REPLACE_EXISTING);
        }
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Saved orchestrator state to {}: {} pending jobs", target, state.getPendingJobs().size());
    }

    /**
     * Read the last snapshot, falling back to the backup when the state file is unreadable
     */
    public Optional<OrchestratorState> load() {
        Path target = stateFile();
        Optional<OrchestratorState> state = read(target);
        if (state.isEmpty()) {
            state = read(target.resolveSibling(target.getFileName() + ".bak"));
        }
        state.ifPresent(loaded -> log.info("Loaded orchestrator state saved at {}: {} pending jobs, {} processed plans",
            loaded.getSavedAt(), loaded.getPendingJobs().size(), loaded.getProcessedPlanIds().size()));
        return state;
    }

    private Optional<OrchestratorState> read(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(path.toFile(), OrchestratorState.class));
        } catch (IOException e) {
            log.error("Failed to read orchestrator state from {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
