package com.flagship.reconciliation_engine.filing;

import com.flagship.reconciliation_engine.workflow.DocumentStateMachine;
import com.flagship.reconciliation_engine.workflow.SideEffect;
import com.flagship.reconciliation_engine.workflow.TransitionDecision;
import com.flagship.reconciliation_engine.workflow.TransitionRequest;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;

import static com.flagship.reconciliation_engine.filing.FilingStatus.*;

/**
 * Guards for the filing lifecycle.
 *
 * Acknowledging requires the authority's acknowledgement number. Submitting
 * with a postable payment asks for the deposit to be posted to the ledger;
 * malformed payment details are rejected before anything changes.
 */
@Component
public class FilingWorkflow {

    static final DocumentStateMachine<FilingStatus> STATE_MACHINE = DocumentStateMachine.of(
        FilingStatus.class,
        Map.of(
            PREPARED, EnumSet.of(DRAFT),
            REVIEWED, EnumSet.of(PREPARED),
            SUBMITTED, EnumSet.of(REVIEWED),
            ACKNOWLEDGED, EnumSet.of(SUBMITTED),
            AMENDED, EnumSet.of(SUBMITTED, ACKNOWLEDGED)
        ),
        EnumSet.of(DRAFT, PREPARED)
    );

    public TransitionDecision<FilingStatus> decide(FilingDocument document, TransitionRequest<FilingStatus> request) {
        request.validate();
        FilingStatus from = document.getStatus();
        FilingStatus to = request.getRequestedStatus();

        if (from == to) {
            return TransitionDecision.deny(from, to, "Filing is already " + from);
        }
        if (!STATE_MACHINE.isTransitionAllowed(from, to)) {
            return TransitionDecision.deny(from, to,
                String.format("Allowed from %s: %s", from, STATE_MACHINE.getAllowedTransitions(from)));
        }
        if (to == ACKNOWLEDGED
            && (request.getAcknowledgementNumber() == null || request.getAcknowledgementNumber().isBlank())) {
            return TransitionDecision.deny(from, to, "An acknowledgement number is required");
        }
        if (to == SUBMITTED && request.getPayment() != null) {
            request.getPayment().validate();
        }
        if (to == SUBMITTED && request.hasPostablePayment()) {
            return TransitionDecision.allow(from, to, SideEffect.POST_WHT_DEPOSIT);
        }
        return TransitionDecision.allow(from, to, SideEffect.NONE);
    }

    public boolean isEditable(FilingStatus status) {
        return STATE_MACHINE.isEditable(status);
    }
}
