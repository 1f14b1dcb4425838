package com.whereq.crucible.support;

import com.whereq.crucible.executor.RunnerOutput;
import com.whereq.crucible.executor.TestRunner;
import com.whereq.crucible.model.Environment;
import com.whereq.crucible.model.TestCase;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runner driven by a tiny script language, one command per ';':
 * {@code sleep <ms>}, {@code echo <text>}, {@code exit <code>}, {@code hang},
 * {@code throw <message>}, {@code panic}, and {@code flaky <n>} which exits 1
 * on the first n runs of the same test.
 *
 * Terminating a job can be slowed down to model a process that takes its grace
 * period to exit.
 */
public class SimulatedTestRunner implements TestRunner {

    private final Map<String, CountDownLatch> terminations = new ConcurrentHashMap<>();
    private final Map<String, StringBuffer> outputs = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();
    private final List<String> startOrder = new CopyOnWriteArrayList<>();
    private final List<String> terminated = new CopyOnWriteArrayList<>();
    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private volatile Duration terminateDelay = Duration.ZERO;

    @Override
    public RunnerOutput execute(String jobId, TestCase testCase, Environment environment) throws Exception {
        CountDownLatch termination = new CountDownLatch(1);
        terminations.put(jobId, termination);
        StringBuffer stdout = new StringBuffer();
        outputs.put(jobId, stdout);
        startOrder.add(testCase.getName());
        int run = runs.computeIfAbsent(testCase.getName(), name -> new AtomicInteger()).incrementAndGet();
        peak.accumulateAndGet(current.incrementAndGet(), Math::max);
        long start = System.nanoTime();
        boolean panic = false;
        try {
            for (String raw : testCase.getScript().split(";")) {
                String command = raw.trim();
                if (command.isEmpty()) {
                    continue;
                }
                String argument = command.contains(" ") ? command.substring(command.indexOf(' ') + 1) : "";
                if (command.startsWith("sleep")) {
                    if (termination.await(Long.parseLong(argument), TimeUnit.MILLISECONDS)) {
                        return output(143, stdout, start, panic);
                    }
                } else if (command.startsWith("echo")) {
                    stdout.append(argument).append('\n');
                } else if (command.startsWith("exit")) {
                    return output(Integer.parseInt(argument), stdout, start, panic);
                } else if (command.equals("hang")) {
                    termination.await();
                    return output(143, stdout, start, panic);
                } else if (command.startsWith("throw")) {
                    throw new IllegalStateException(argument);
                } else if (command.startsWith("flaky")) {
                    if (run <= Integer.parseInt(argument)) {
                        return output(1, stdout, start, panic);
                    }
                } else if (command.equals("panic")) {
                    stdout.append("Kernel panic - not syncing\n");
                    panic = true;
                }
            }
            return output(0, stdout, start, panic);
        } finally {
            current.decrementAndGet();
        }
    }

    private static RunnerOutput output(int exitCode, StringBuffer stdout, long start, boolean panic) {
        return RunnerOutput.builder()
            .exitCode(exitCode)
            .stdout(stdout.toString())
            .stderr("")
            .duration(Duration.ofNanos(System.nanoTime() - start))
            .kernelPanic(panic)
            .build();
    }

    @Override
    public void terminate(String jobId) {
        terminated.add(jobId);
        if (!terminateDelay.isZero()) {
            try {
                Thread.sleep(terminateDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        CountDownLatch latch = terminations.get(jobId);
        if (latch != null) {
            latch.countDown();
        }
    }

    @Override
    public String partialOutput(String jobId) {
        StringBuffer output = outputs.get(jobId);
        return output != null ? output.toString() : "";
    }

    public void setTerminateDelay(Duration terminateDelay) {
        this.terminateDelay = terminateDelay;
    }

    /**
     * Test names in the order their execution started
     */
    public List<String> getStartOrder() {
        return startOrder;
    }

    public List<String> getTerminated() {
        return terminated;
    }

    public int getPeakConcurrency() {
        return peak.get();
    }

    public int getCurrentConcurrency() {
        return current.get();
    }
}
