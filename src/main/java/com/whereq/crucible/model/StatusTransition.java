package com.whereq.crucible.model;

import lombok.Value;

import java.time.Instant;

/**
 * One recorded job state change
 */
@Value
public class StatusTransition {
    String jobId;
    JobStatus from;
    JobStatus to;
    Instant at;
    String detail;
}
