package com.whereq.crucible.recovery;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A recorded error and its resolution state
 */
@Data
@Builder
public class ErrorEvent {
    private String errorId;
    private ErrorCategory category;
    private ErrorSeverity severity;
    private String component;
    private String message;
    private String jobId;
    private String environmentId;
    private Instant occurredAt;
    private boolean resolved;
    private Instant resolvedAt;
}
