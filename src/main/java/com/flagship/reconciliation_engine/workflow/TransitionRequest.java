package com.flagship.reconciliation_engine.workflow;

import com.flagship.reconciliation_engine.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class TransitionRequest<S extends Enum<S>> {
    UUID documentId;
    S requestedStatus;
    String actorId;
    /** Only read on submission. */
    PaymentMetadata payment;
    /** Required to acknowledge a filing. */
    String acknowledgementNumber;

    /**
     * @throws ValidationException if the request has no target or no actor
     */
    public void validate() {
        if (requestedStatus == null) {
            throw new ValidationException("Requested status is required",
                Map.of("requestedStatus", "must not be null"));
        }
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Every transition must name the acting user",
                Map.of("actorId", "must not be blank"));
        }
    }

    public boolean hasPostablePayment() {
        return payment != null && payment.isPostable();
    }
}
