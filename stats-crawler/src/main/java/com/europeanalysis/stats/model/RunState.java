package com.europeanalysis.stats.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one ingestion run.
 *
 * PENDING → FETCHING → NORMALIZING → PERSISTING loops back to FETCHING for
 * every further page and ends in COMPLETED. FAILED and CANCELLED are reachable
 * from every non-terminal state.
 */
public enum RunState {
    PENDING,
    FETCHING,
    NORMALIZING,
    PERSISTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<RunState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(FETCHING);
            // an exhausted or empty page sequence completes straight from FETCHING
            case FETCHING -> EnumSet.of(NORMALIZING, COMPLETED);
            case NORMALIZING -> EnumSet.of(PERSISTING);
            case PERSISTING -> EnumSet.of(FETCHING, COMPLETED);
            default -> EnumSet.noneOf(RunState.class);
        };
    }
}
