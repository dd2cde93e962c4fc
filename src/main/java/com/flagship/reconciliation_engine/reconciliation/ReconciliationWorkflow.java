package com.flagship.reconciliation_engine.reconciliation;

import com.flagship.reconciliation_engine.balance.ReconciliationBalances;
import com.flagship.reconciliation_engine.workflow.DocumentStateMachine;
import com.flagship.reconciliation_engine.workflow.SideEffect;
import com.flagship.reconciliation_engine.workflow.TransitionDecision;
import com.flagship.reconciliation_engine.workflow.TransitionRequest;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;

import static com.flagship.reconciliation_engine.reconciliation.ReconciliationStatus.*;

/**
 * Guards for the reconciliation lifecycle.
 *
 * <pre>
 * DRAFT -> IN_PROGRESS -> COMPLETED -> APPROVED
 * </pre>
 * No step can be skipped or undone. Completing also requires the recomputed
 * document to be reconciled.
 */
@Component
public class ReconciliationWorkflow {

    static final DocumentStateMachine<ReconciliationStatus> STATE_MACHINE = DocumentStateMachine.of(
        ReconciliationStatus.class,
        Map.of(
            IN_PROGRESS, EnumSet.of(DRAFT),
            COMPLETED, EnumSet.of(IN_PROGRESS),
            APPROVED, EnumSet.of(COMPLETED)
        ),
        EnumSet.of(DRAFT, IN_PROGRESS)
    );

    public TransitionDecision<ReconciliationStatus> decide(ReconciliationDocument document,
                                                           TransitionRequest<ReconciliationStatus> request) {
        request.validate();
        ReconciliationStatus from = document.getStatus();
        ReconciliationStatus to = request.getRequestedStatus();

        if (from == to) {
            return TransitionDecision.deny(from, to, "Reconciliation is already " + from);
        }
        if (!STATE_MACHINE.isTransitionAllowed(from, to)) {
            return TransitionDecision.deny(from, to,
                String.format("Allowed from %s: %s", from, STATE_MACHINE.getAllowedTransitions(from)));
        }
        if (to == COMPLETED && !document.isReconciled()) {
            return TransitionDecision.deny(from, to, unreconciledReason(document));
        }
        return TransitionDecision.allow(from, to, SideEffect.NONE);
    }

    public boolean isEditable(ReconciliationStatus status) {
        return STATE_MACHINE.isEditable(status);
    }

    private String unreconciledReason(ReconciliationDocument document) {
        if (!document.isRecomputed()) {
            return "Document has not been recomputed";
        }
        ReconciliationBalances balances = document.getSummary().getBalances();
        if (!balances.isLedgerBalanceKnown()) {
            return "Closing ledger balance has not been fetched";
        }
        return "Variance of " + balances.getVariance() + " is outside tolerance";
    }
}
