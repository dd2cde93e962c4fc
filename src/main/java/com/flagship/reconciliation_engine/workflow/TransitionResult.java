package com.flagship.reconciliation_engine.workflow;

import lombok.Value;

import java.util.UUID;

@Value
public class TransitionResult<S extends Enum<S>> {
    UUID documentId;
    S previousStatus;
    S newStatus;
    SideEffectOutcome sideEffectOutcome;
}
