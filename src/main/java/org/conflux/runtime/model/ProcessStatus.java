package org.conflux.runtime.model;

/**
 * Status of a chain step. A step moves {@code PENDING -> IN_PROGRESS -> COMPLETED|FAILED},
 * visiting each state at most once. A step whose chain fails before it starts stays {@code PENDING}.
 */
public enum ProcessStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    /**
     * Returns whether a step in this status may move to {@code next}.
     */
    public boolean canTransitionTo(ProcessStatus next) {
        return switch (this) {
            case PENDING -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
