package org.snek.runtime;

/**
 * Lifecycle of a single run. {@link #END} is terminal.
 */
public enum GameState {
    /** Waiting for the first direction; the snake does not move. */
    START,
    /** The snake moves and fruit spawns on every elapsed interval. */
    IN_PROGRESS,
    /** The snake left the board or ran into itself. */
    END
}
