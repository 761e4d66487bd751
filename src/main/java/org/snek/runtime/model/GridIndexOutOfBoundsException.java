package org.snek.runtime.model;

/**
 * Thrown when a position outside the board is read or written.
 * <p>
 * Movement code checks bounds before touching the grid, so this exception signals a
 * programming error rather than a game event.
 */
public class GridIndexOutOfBoundsException extends IndexOutOfBoundsException {

    /**
     * Creates a new exception for the given position and board size.
     *
     * @param position The offending position.
     * @param width The board width.
     * @param height The board height.
     */
    public GridIndexOutOfBoundsException(Position position, int width, int height) {
        super("Position " + position + " is outside the " + width + "x" + height + " grid");
    }

    /**
     * Creates a new exception for a flat index.
     *
     * @param index The offending index.
     * @param size The number of cells.
     */
    public GridIndexOutOfBoundsException(int index, int size) {
        super("Index " + index + " is outside [0, " + size + ")");
    }
}
