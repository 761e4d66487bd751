package org.snek.runtime.model;

/**
 * An immutable cell coordinate on the board, 0-indexed from the top-left corner.
 * <p>
 * A position is not tied to any grid: coordinates may be negative or larger than
 * the board. Use {@link Grid#contains(Position)} to check whether a position is addressable.
 *
 * @param x The horizontal coordinate (column).
 * @param y The vertical coordinate (row).
 */
public record Position(int x, int y) {

    /**
     * Returns the neighbouring position one unit along the given direction.
     * {@link Direction#NONE} yields this position.
     *
     * @param direction The direction to move in.
     * @return The translated position.
     */
    public Position translate(Direction direction) {
        return new Position(x + direction.dx, y + direction.dy);
    }

    /**
     * Returns the neighbouring position one unit against the given direction.
     *
     * @param direction The direction of travel.
     * @return The position directly behind this one.
     */
    public Position behind(Direction direction) {
        return new Position(x - direction.dx, y - direction.dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
