package com.flagship.reconciliation_engine.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Transition table for one document lifecycle.
 *
 * Built from target -> allowed predecessors, which is how the lifecycles are
 * usually stated. A status with no outgoing transition is terminal. Same-status
 * requests are never allowed: every transition must move the document.
 *
 * @param <S> status enum
 */
public class DocumentStateMachine<S extends Enum<S>> {

    private final Map<S, Set<S>> allowedTargets;
    private final Set<S> editableStatuses;

    private DocumentStateMachine(Class<S> statusType, Map<S, Set<S>> predecessors, Set<S> editableStatuses) {
        Map<S, Set<S>> targets = new EnumMap<>(statusType);
        for (S status : statusType.getEnumConstants()) {
            targets.put(status, EnumSet.noneOf(statusType));
        }
        predecessors.forEach((target, froms) -> froms.forEach(from -> targets.get(from).add(target)));
        targets.replaceAll((status, set) -> Collections.unmodifiableSet(set));

        this.allowedTargets = Collections.unmodifiableMap(targets);
        this.editableStatuses = Collections.unmodifiableSet(EnumSet.copyOf(editableStatuses));
    }

    public static <S extends Enum<S>> DocumentStateMachine<S> of(Class<S> statusType,
                                                                 Map<S, Set<S>> predecessors,
                                                                 Set<S> editableStatuses) {
        return new DocumentStateMachine<>(statusType, predecessors, editableStatuses);
    }

    public boolean isTransitionAllowed(S from, S to) {
        if (from == null || to == null || from == to) {
            return false;
        }
        return allowedTargets.get(from).contains(to);
    }

    public Set<S> getAllowedTransitions(S from) {
        return allowedTargets.getOrDefault(from, Set.of());
    }

    public boolean isTerminal(S status) {
        return getAllowedTransitions(status).isEmpty();
    }

    /**
     * Whether source records and adjustments may still change in this status.
     */
    public boolean isEditable(S status) {
        return editableStatuses.contains(status);
    }
}
