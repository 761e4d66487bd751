package org.snek.runtime.model;

import java.util.Optional;

/**
 * Result of a single {@link Snake#step(Grid)}.
 */
public enum MoveOutcome {
    /** The snake advanced one cell. */
    MOVED(null),
    /** The snake advanced onto a fruit and grew by one segment. */
    MOVED_AND_GREW(null),
    /** The target cell lies outside the board; nothing was changed. */
    OUT_OF_BOUNDS(TerminationCause.OUT_OF_BOUNDS),
    /** The target cell is part of the snake; nothing was changed. */
    SELF_COLLISION(TerminationCause.SELF_COLLISION);

    private final TerminationCause cause;

    MoveOutcome(TerminationCause cause) {
        this.cause = cause;
    }

    /**
     * @return The terminal cause for failed moves, empty for successful ones.
     */
    public Optional<TerminationCause> terminationCause() {
        return Optional.ofNullable(cause);
    }
}
