package com.whereq.crucible.executor;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.model.Environment;
import com.whereq.crucible.model.HardwareProfile;
import com.whereq.crucible.model.TestCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Runs test scripts as local shell processes.
 *
 * The environment is described to the script through CRUCIBLE_* variables;
 * provisioning the environment itself is left to the script.
 */
@Slf4j
@Component
public class LocalProcessTestRunner implements TestRunner {

    private static final Pattern KERNEL_PANIC = Pattern.compile("Kernel panic|BUG: unable to handle");

    private final CrucibleProperties properties;

    private final Map<String, RunningProcess> processes = new ConcurrentHashMap<>();

    @Autowired
    public LocalProcessTestRunner(CrucibleProperties properties) {
        this.properties = properties;
    }

    @Override
    public RunnerOutput execute(String jobId, TestCase testCase, Environment environment) throws Exception {
        List<String> command = List.of(properties.getRunner().getShell(), "-c", testCase.getScript());

        log.info("Executing job {} on environment {}: {}", jobId, environment.getId(), testCase.getName());

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.environment().putAll(buildEnvironment(jobId, environment));
        String workDir = properties.getRunner().getWorkDir();
        if (workDir != null && !workDir.isEmpty()) {
            processBuilder.directory(new File(workDir));
        }

        long startTime = System.nanoTime();
        Process process = processBuilder.start();
        RunningProcess running = new RunningProcess(process);
        processes.put(jobId, running);

        try {
            Thread stderrReader = new Thread(
                () -> drain(process.getErrorStream(), running.stderrBuffer), "crucible-stderr-" + jobId);
            stderrReader.setDaemon(true);
            stderrReader.start();

            drain(process.getInputStream(), running.stdoutBuffer);

            int exitCode = process.waitFor();
            stderrReader.join(TimeUnit.SECONDS.toMillis(1));

            String stdout = running.stdout();
            String stderr = running.stderr();
            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);

            log.info("Job {} process exited with code {} after {}ms", jobId, exitCode, duration.toMillis());

            return RunnerOutput.builder()
                .exitCode(exitCode)
                .stdout(stdout)
                .stderr(stderr)
                .duration(duration)
                .kernelPanic(KERNEL_PANIC.matcher(stdout).find() || KERNEL_PANIC.matcher(stderr).find())
                .build();
        } catch (InterruptedException e) {
            destroy(jobId, process);
            throw e;
        } finally {
            processes.remove(jobId, running);
        }
    }

    @Override
    public void terminate(String jobId) {
        RunningProcess running = processes.get(jobId);
        if (running == null) {
            log.debug("No process to terminate for job {}", jobId);
            return;
        }
        destroy(jobId, running.process);
    }

    @Override
    public String partialOutput(String jobId) {
        RunningProcess running = processes.get(jobId);
        return running != null ? running.stdout() : "";
    }

    private void destroy(String jobId, Process process) {
        if (!process.isAlive()) {
            return;
        }
        log.info("Terminating process for job {}", jobId);
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(properties.getRunner().getTerminateGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process for job {} ignored termination, killing it", jobId);
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private Map<String, String> buildEnvironment(String jobId, Environment environment) {
        HardwareProfile profile = environment.getProfile();
        return Map.of(
            "CRUCIBLE_JOB_ID", jobId,
            "CRUCIBLE_ENV_ID", environment.getId(),
            "CRUCIBLE_ARCH", String.valueOf(profile.getArchitecture()),
            "CRUCIBLE_BACKEND", String.valueOf(profile.getBackend()),
            "CRUCIBLE_MEMORY_MB", String.valueOf(profile.getMemoryMb())
        );
    }

    private static void drain(InputStream stream, StringBuffer target) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                target.append(line).append('\n');
            }
        } catch (IOException e) {
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private static final class RunningProcess {
        private final Process process;
        private final StringBuffer stdoutBuffer = new StringBuffer();
        private final StringBuffer stderrBuffer = new StringBuffer();

        private RunningProcess(Process process) {
            this.process = process;
        }

        private String stdout() {
            return stdoutBuffer.toString();
        }

        private String stderr() {
            return stderrBuffer.toString();
        }
    }
}
