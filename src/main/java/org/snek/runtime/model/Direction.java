package org.snek.runtime.model;

/**
 * The heading of the snake. {@link #NONE} is the heading before the first input
 * and contributes no movement.
 */
public enum Direction {
    NONE(0, 0),
    LEFT(-1, 0),
    RIGHT(1, 0),
    UP(0, -1),
    DOWN(0, 1);

    public final int dx;
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    /**
     * Returns the reverse heading. {@link #NONE} is its own opposite.
     *
     * @return The direction pointing the other way.
     */
    public Direction opposite() {
        return switch (this) {
            case NONE -> NONE;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case UP -> DOWN;
            case DOWN -> UP;
        };
    }

    /**
     * Checks whether the other direction is the exact 180° reversal of this one.
     * Never true when either side is {@link #NONE}.
     *
     * @param other The direction to compare with.
     * @return {@code true} if the two directions point in opposite ways.
     */
    public boolean isOpposite(Direction other) {
        return this != NONE && other != NONE && other == opposite();
    }

    /**
     * Parses a single-letter or full-name direction token, case-insensitive
     * (e.g. {@code "L"}, {@code "left"}).
     *
     * @param token The token to parse.
     * @return The matching direction.
     * @throws IllegalArgumentException if the token names no movement direction.
     */
    public static Direction fromToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Direction token must not be empty.");
        }
        String t = token.trim().toUpperCase();
        for (Direction d : values()) {
            if (d != NONE && (d.name().equals(t) || d.name().substring(0, 1).equals(t))) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + token);
    }
}
