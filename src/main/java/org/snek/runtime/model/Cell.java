package org.snek.runtime.model;

/**
 * Occupancy state of a single grid cell.
 */
public enum Cell {
    VACANT('.'),
    OCCUPIED_SNAKE('#'),
    OCCUPIED_FRUIT('*');

    private final char symbol;

    Cell(char symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The character used for this state in text dumps of the board.
     */
    public char symbol() {
        return symbol;
    }
}
