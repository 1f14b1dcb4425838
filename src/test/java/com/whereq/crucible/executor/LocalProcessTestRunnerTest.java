package com.whereq.crucible.executor;

import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.model.Environment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.whereq.crucible.support.TestFixtures.environment;
import static com.whereq.crucible.support.TestFixtures.testCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisabledOnOs(OS.WINDOWS)
class LocalProcessTestRunnerTest {

    private final Environment environment = environment("qemu-1");
    private LocalProcessTestRunner runner;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        CrucibleProperties properties = new CrucibleProperties();
        properties.getRunner().setShell("/bin/sh");
        properties.getRunner().setTerminateGrace(Duration.ofSeconds(1));
        runner = new LocalProcessTestRunner(properties);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void capturesOutputAndEnvironment() throws Exception {
        RunnerOutput output = runner.execute("job-1",
            testCase("env", "echo \"$CRUCIBLE_ENV_ID $CRUCIBLE_ARCH\"; echo warning >&2"), environment);

        assertThat(output.getExitCode()).isZero();
        assertThat(output.getStdout()).contains("qemu-1 x86_64");
        assertThat(output.getStderr()).contains("warning");
        assertThat(output.isKernelPanic()).isFalse();
        assertThat(output.getDuration()).isPositive();
    }

    @Test
    void reportsExitCodeAndKernelPanic() throws Exception {
        RunnerOutput output = runner.execute("job-2",
            testCase("panic", "echo 'Kernel panic - not syncing: VFS'; exit 3"), environment);

        assertThat(output.getExitCode()).isEqualTo(3);
        assertThat(output.isKernelPanic()).isTrue();
    }

    @Test
    void terminateStopsRunningProcess() throws Exception {
        Future<RunnerOutput> result = executor.submit(() ->
            runner.execute("job-3", testCase("sleeper", "echo started; sleep 30"), environment));

        await().atMost(Duration.ofSeconds(5)).until(() -> runner.partialOutput("job-3").contains("started"));
        runner.terminate("job-3");

        RunnerOutput output = result.get(10, TimeUnit.SECONDS);
        assertThat(output.getExitCode()).isNotZero();
        assertThat(output.getStdout()).contains("started");
        assertThat(runner.partialOutput("job-3")).isEmpty();
    }

    @Test
    void terminateUnknownJobIsNoop() {
        runner.terminate("job-missing");
        assertThat(runner.partialOutput("job-missing")).isEmpty();
    }
}
