package com.flagship.reconciliation_engine.workflow;

import com.flagship.reconciliation_engine.exception.InvalidTransitionException;
import lombok.Value;

/**
 * Outcome of evaluating a requested transition. Computed, never stored.
 */
@Value
public class TransitionDecision<S extends Enum<S>> {
    boolean allowed;
    S from;
    S to;
    String reason;
    SideEffect sideEffect;

    public static <S extends Enum<S>> TransitionDecision<S> allow(S from, S to, SideEffect sideEffect) {
        return new TransitionDecision<>(true, from, to, null, sideEffect);
    }

    public static <S extends Enum<S>> TransitionDecision<S> deny(S from, S to, String reason) {
        return new TransitionDecision<>(false, from, to, reason, SideEffect.NONE);
    }

    /**
     * @throws InvalidTransitionException if the decision is a denial
     */
    public TransitionDecision<S> orThrow() {
        if (!allowed) {
            throw new InvalidTransitionException(from, to, reason);
        }
        return this;
    }
}
