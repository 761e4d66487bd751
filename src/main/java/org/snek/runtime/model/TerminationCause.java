package org.snek.runtime.model;

/**
 * Why a run ended. Both causes are terminal.
 */
public enum TerminationCause {
    OUT_OF_BOUNDS("cannot go outside the eating-ground"),
    SELF_COLLISION("collided with the snake's own body");

    private final String message;

    TerminationCause(String message) {
        this.message = message;
    }

    /**
     * @return A short human-readable description, suitable for a status line.
     */
    public String message() {
        return message;
    }
}
