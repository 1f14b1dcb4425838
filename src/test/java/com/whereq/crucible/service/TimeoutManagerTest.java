package com.whereq.crucible.service;

import com.whereq.crucible.config.CrucibleProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class TimeoutManagerTest {

    private CrucibleProperties properties;
    private TimeoutManager timeoutManager;

    @BeforeEach
    void setUp() {
        properties = new CrucibleProperties();
        properties.getScheduler().setDefaultTimeout(Duration.ofMinutes(30));
        properties.getScheduler().setTimeoutMarginRatio(0.5);
        properties.getScheduler().setPollInterval(Duration.ofMillis(20));
        timeoutManager = new TimeoutManager(properties);
    }

    @AfterEach
    void tearDown() {
        timeoutManager.stop();
    }

    @Test
    void budgetIsEstimatePlusMarginCappedByDefault() {
        assertThat(timeoutManager.budgetFor(Duration.ofMinutes(10))).isEqualTo(Duration.ofMinutes(15));
        assertThat(timeoutManager.budgetFor(Duration.ofHours(1))).isEqualTo(Duration.ofMinutes(30));
        assertThat(timeoutManager.budgetFor(Duration.ZERO)).isEqualTo(Duration.ofMinutes(30));
        assertThat(timeoutManager.budgetFor(null)).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void registerReturnsDeadline() {
        Instant before = Instant.now();
        Instant deadline = timeoutManager.register("job-1", Duration.ofSeconds(2));

        assertThat(deadline).isBetween(before.plusMillis(2900), Instant.now().plusMillis(3100));
        assertThat(timeoutManager.deadlineOf("job-1")).isEqualTo(deadline);

        timeoutManager.unregister("job-1");
        assertThat(timeoutManager.deadlineOf("job-1")).isNull();
        assertThat(timeoutManager.getMonitoredJobs()).isZero();
    }

    @Test
    void expiredJobIsReportedExactlyOnce() {
        properties.getScheduler().setDefaultTimeout(Duration.ofMillis(50));
        List<String> expired = new CopyOnWriteArrayList<>();
        timeoutManager.start(expired::add);

        timeoutManager.register("job-1", Duration.ofMinutes(5));
        timeoutManager.register("job-2", Duration.ofMinutes(5));
        timeoutManager.unregister("job-2");

        await().atMost(Duration.ofSeconds(2)).until(() -> expired.contains("job-1"));
        assertThat(timeoutManager.checkDeadlines()).isEmpty();
        assertThat(expired).containsExactly("job-1");
        assertThat(timeoutManager.getTimeoutsDetected()).isEqualTo(1);
    }

    @Test
    void warnsOnceWhenApproachingDeadline() throws InterruptedException {
        properties.getScheduler().setDefaultTimeout(Duration.ofMillis(500));
        properties.getScheduler().setTimeoutWarningRatio(0.1);
        timeoutManager.register("job-1", Duration.ofMinutes(5));

        Thread.sleep(100);
        assertThat(timeoutManager.checkDeadlines()).isEmpty();
        assertThat(timeoutManager.checkDeadlines()).isEmpty();

        assertThat(timeoutManager.getWarningsSent()).isEqualTo(1);
    }
}
