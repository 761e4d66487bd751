package org.snek.runtime.model;

import java.util.Arrays;

/**
 * The fixed-size board, a dense row-major store of {@link Cell} states.
 * <p>
 * The grid is passive: it enforces bounds but no occupancy policy. Which state may
 * replace which is decided by {@link Snake} and the fruit spawner.
 */
public class Grid implements IGridReader {
    private final int width;
    private final int height;
    private final Cell[] cells;
    private final FruitKind[] fruits;

    /**
     * Creates an empty board where every cell is {@link Cell#VACANT}.
     *
     * @param width The number of columns, must be positive.
     * @param height The number of rows, must be positive.
     * @throws IllegalArgumentException if a dimension is not positive or the cell count exceeds {@code int}.
     */
    public Grid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        final int cellCount;
        try {
            cellCount = Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid too large: " + width + "x" + height, e);
        }
        this.width = width;
        this.height = height;
        this.cells = new Cell[cellCount];
        Arrays.fill(this.cells, Cell.VACANT);
        this.fruits = new FruitKind[cellCount];
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int size() {
        return cells.length;
    }

    @Override
    public boolean contains(Position position) {
        return position.x() >= 0 && position.x() < width
            && position.y() >= 0 && position.y() < height;
    }

    private int getFlatIndex(Position position) {
        if (!contains(position)) {
            throw new GridIndexOutOfBoundsException(position, width, height);
        }
        return position.x() + position.y() * width;
    }

    /**
     * Converts a flat row-major index back to a position.
     *
     * @param index The flat index in {@code [0, size())}.
     * @return The position of that cell.
     */
    public Position positionOf(int index) {
        if (index < 0 || index >= cells.length) {
            throw new GridIndexOutOfBoundsException(index, cells.length);
        }
        return new Position(index % width, index / width);
    }

    @Override
    public Cell get(Position position) {
        return cells[getFlatIndex(position)];
    }

    /**
     * Reads a cell by flat index.
     *
     * @param index The flat index in {@code [0, size())}.
     * @return The cell state.
     */
    public Cell get(int index) {
        if (index < 0 || index >= cells.length) {
            throw new GridIndexOutOfBoundsException(index, cells.length);
        }
        return cells[index];
    }

    /**
     * Sets the cell state at the given position. Any fruit identity at that cell is
     * dropped unless the new state is {@link Cell#OCCUPIED_FRUIT}.
     *
     * @param position The position to write.
     * @param state The new state.
     */
    public void set(Position position, Cell state) {
        int index = getFlatIndex(position);
        cells[index] = state;
        if (state != Cell.OCCUPIED_FRUIT) {
            fruits[index] = null;
        }
    }

    /**
     * Marks a cell as holding fruit of the given kind.
     *
     * @param position The position to write.
     * @param kind The fruit identity.
     */
    public void placeFruit(Position position, FruitKind kind) {
        int index = getFlatIndex(position);
        cells[index] = Cell.OCCUPIED_FRUIT;
        fruits[index] = kind;
    }

    @Override
    public FruitKind fruitKind(Position position) {
        return fruits[getFlatIndex(position)];
    }

    @Override
    public int count(Cell state) {
        int n = 0;
        for (Cell cell : cells) {
            if (cell == state) {
                n++;
            }
        }
        return n;
    }

    public int vacantCount() {
        return count(Cell.VACANT);
    }
}
