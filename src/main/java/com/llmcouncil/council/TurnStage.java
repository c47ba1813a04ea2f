package com.llmcouncil.council;

/**
 * Lifecycle of one council turn. Stages advance strictly in order; {@link #ABORTED} can be
 * entered from any non-terminal state.
 */
public enum TurnStage {
    IDLE,
    STAGE1_RUNNING,
    STAGE2_RUNNING,
    STAGE3_RUNNING,
    COMPLETE,
    ABORTED;

    public boolean terminal() {
        return this == COMPLETE || this == ABORTED;
    }

    public boolean canAdvanceTo(TurnStage next) {
        if (terminal() || next == null) {
            return false;
        }
        if (next == ABORTED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }

    /**
     * @return {@code next}
     * @throws IllegalStateException when the transition is not allowed
     */
    public TurnStage advanceTo(TurnStage next) {
        if (!canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal turn transition " + this + " -> " + next);
        }
        return next;
    }
}
