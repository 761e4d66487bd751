package org.snek.runtime.model;

/**
 * Read-only access to the board. Handed out by the game controller to anything that
 * only needs to look at cells (drawing, text dumps, tests) so that the grid itself
 * stays exclusively owned by the simulation.
 */
public interface IGridReader {

    /**
     * Reads the cell state at the given position.
     *
     * @param position The position to read.
     * @return The cell state.
     * @throws GridIndexOutOfBoundsException if the position is outside the board.
     */
    Cell get(Position position);

    /**
     * Returns the fruit identity stored at the given position.
     *
     * @param position The position to read.
     * @return The fruit kind, or {@code null} if the cell holds no fruit.
     */
    FruitKind fruitKind(Position position);

    int width();

    int height();

    /**
     * @return The number of cells, {@code width() * height()}.
     */
    int size();

    /**
     * Checks whether a position is addressable on this board.
     *
     * @param position The position to check.
     * @return {@code true} if both coordinates are inside the board.
     */
    boolean contains(Position position);

    /**
     * Counts the cells currently in the given state.
     *
     * @param state The state to count.
     * @return The number of matching cells.
     */
    int count(Cell state);

    /**
     * Renders the board as text, one line per row, using {@link Cell#symbol()}.
     *
     * @return The board dump.
     */
    default String render() {
        StringBuilder sb = new StringBuilder((width() + 1) * height());
        for (int y = 0; y < height(); y++) {
            for (int x = 0; x < width(); x++) {
                sb.append(get(new Position(x, y)).symbol());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
