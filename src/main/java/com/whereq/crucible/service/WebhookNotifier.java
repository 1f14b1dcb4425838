package com.whereq.crucible.service;

import com.whereq.crucible.model.Job;
import com.whereq.crucible.model.JobResult;
import com.whereq.crucible.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Service for sending webhook notifications when jobs finish
 */
@Slf4j
@Service
public class WebhookNotifier {

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder webClientBuilder;

    @Autowired
    public WebhookNotifier(WebClient.Builder webClientBuilder) {
        this.webClientBuilder = webClientBuilder;
    }

    /**
     * Fire-and-forget notification for a job that reached a terminal status.
     * Does nothing unless the job asked for this status.
     */
    public void notifyTerminal(Job job) {
        if (job.getNotifications() == null || !job.getNotifications().shouldNotify(job.getStatus())) {
            return;
        }
        notify(job.getNotifications().getWebhook(), job.getJobId(), job.getStatus(), job.getResult())
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe();
    }

    /**
     * Notify webhook about job status change
     *
     * @param webhookUrl webhook URL
     * @param jobId job identifier
     * @param status job status
     * @param result job result, may be null
     * @return Mono that completes when notification sent
     */
    public Mono<Void> notify(String webhookUrl, String jobId, JobStatus status, JobResult result) {
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            return Mono.empty();
        }

        Map<String, Object> payload = buildPayload(jobId, status, result);

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                jobId, status, response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job {}: {}",
                jobId, error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail job if webhook fails
            .then();
    }

    private Map<String, Object> buildPayload(String jobId, JobStatus status, JobResult result) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("jobId", jobId);
        payload.put("status", status.name());
        payload.put("timestamp", System.currentTimeMillis());
        if (result != null) {
            payload.put("result", result);
            if (result.getErrorMessage() != null) {
                payload.put("error", result.getErrorMessage());
            }
        }
        return payload;
    }
}
