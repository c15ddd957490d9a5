package com.datafetch.domain.model;

/**
 * Lifecycle of a fetch job. SUCCEEDED, FAILED and CANCELLED are terminal.
 */
public enum JobState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
