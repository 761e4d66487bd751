package org.snek.runtime.model;

/**
 * Result of a direction-change request.
 */
public enum TurnOutcome {
    ACCEPTED(null),
    REJECTED_OPPOSITE("cannot turn the opposite direction"),
    /** The run is over; the request was not looked at. */
    IGNORED_GAME_OVER(null);

    private final String hint;

    TurnOutcome(String hint) {
        this.hint = hint;
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }

    /**
     * @return A message for the player when the request was refused, otherwise {@code null}.
     */
    public String hint() {
        return hint;
    }
}
