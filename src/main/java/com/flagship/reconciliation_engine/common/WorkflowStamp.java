package com.flagship.reconciliation_engine.common;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Who moved a document into which status, and when.
 */
@Value
@Builder
@Jacksonized
public class WorkflowStamp {
    String status;
    String action;
    String actorId;
    Instant at;
}
