package com.whereq.crucible.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.crucible.config.CrucibleProperties;
import com.whereq.crucible.exception.PlanSourceException;
import com.whereq.crucible.model.ExecutionPlan;
import com.whereq.crucible.model.PlanStatus;
import com.whereq.crucible.model.TestCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Plan source backed by two Redis hashes holding JSON documents:
 * {@code <prefix>plans} (plan id to plan) and {@code <prefix>testcases} (test case id to test case).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "crucible.monitor.plan-source", havingValue = "redis")
public class RedisExecutionPlanSource implements ExecutionPlanSource {

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    private final ObjectMapper objectMapper;

    private final String plansKey;

    private final String testCasesKey;

    private final Duration timeout;

    @Autowired
    public RedisExecutionPlanSource(@Qualifier("reactiveRedisTemplate") ReactiveRedisTemplate<String, String> redisTemplate,
                                    ObjectMapper objectMapper,
                                    CrucibleProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.plansKey = properties.getMonitor().getRedisKeyPrefix() + "plans";
        this.testCasesKey = properties.getMonitor().getRedisKeyPrefix() + "testcases";
        this.timeout = properties.getMonitor().getRedisTimeout();
    }

    @Override
    public List<ExecutionPlan> fetchQueuedPlans() {
        try {
            List<ExecutionPlan> plans = redisTemplate.<String, String>opsForHash()
                .values(plansKey)
                .flatMap(json -> {
                    ExecutionPlan plan = parse(json, ExecutionPlan.class);
                    return plan != null ? Mono.just(plan) : Mono.<ExecutionPlan>empty();
                })
                .filter(plan -> plan.getStatus() == PlanStatus.QUEUED)
                .collectList()
                .block(timeout);
            if (plans == null) {
                return List.of();
            }
            return plans.stream()
                .sorted(Comparator.comparing(plan -> plan.getCreatedAt() != null ? plan.getCreatedAt() : Instant.EPOCH))
                .toList();
        } catch (RuntimeException e) {
            throw new PlanSourceException("Failed to read plans from Redis key " + plansKey, e);
        }
    }

    @Override
    public Optional<TestCase> findTestCase(String testCaseId) {
        try {
            String json = redisTemplate.<String, String>opsForHash()
                .get(testCasesKey, testCaseId)
                .block(timeout);
            return json != null ? Optional.ofNullable(parse(json, TestCase.class)) : Optional.empty();
        } catch (RuntimeException e) {
            throw new PlanSourceException("Failed to read test case " + testCaseId + " from Redis", e);
        }
    }

    @Override
    public void updatePlanStatus(String planId, PlanStatus status) {
        try {
            String json = redisTemplate.<String, String>opsForHash()
                .get(plansKey, planId)
                .block(timeout);
            if (json == null) {
                log.warn("Attempted to update unknown plan: {}", planId);
                return;
            }
            ExecutionPlan plan = parse(json, ExecutionPlan.class);
            if (plan == null) {
                return;
            }
            plan.setStatus(status);
            redisTemplate.<String, String>opsForHash()
                .put(plansKey, planId, objectMapper.writeValueAsString(plan))
                .block(timeout);
            log.info("Plan {} status updated in Redis: {}", planId, status);
        } catch (JsonProcessingException e) {
            throw new PlanSourceException("Failed to serialize plan " + planId, e);
        } catch (RuntimeException e) {
            throw new PlanSourceException("Failed to update plan " + planId + " in Redis", e);
        }
    }

    @Override
    public String name() {
        return "redis";
    }

    private <T> T parse(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Skipping malformed {} document: {}", type.getSimpleName(), e.getOriginalMessage());
            return null;
        }
    }
}
