package org.snek.runtime.model;

import org.snek.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The snake: a head position, an ordered body (nearest-to-head first) and a heading.
 * <p>
 * The snake owns the movement and growth rules and writes its occupancy into the
 * {@link Grid} as a side effect. It never keeps a reference to the grid: the owner
 * passes the grid into every mutating call, so there is exactly one holder of the board.
 * <p>
 * Invariant: the head and every body segment sit on distinct cells, all marked
 * {@link Cell#OCCUPIED_SNAKE}, and no other cell carries that state.
 */
public class Snake {
    private Position head;
    private final List<Position> body = new ArrayList<>();
    private Direction heading = Direction.NONE;

    /**
     * Places a new snake of length one on the given cell. The caller guarantees the
     * cell is vacant.
     *
     * @param grid The board to write into.
     * @param head The initial head position.
     */
    Snake(Grid grid, Position head) {
        grid.set(head, Cell.OCCUPIED_SNAKE);
        this.head = head;
    }

    /**
     * Creates a snake whose head is chosen uniformly at random over the whole board.
     * The board is expected to be empty; no collision check is made.
     *
     * @param grid The board to place the snake on.
     * @param random The source of randomness.
     * @return The new snake, heading {@link Direction#NONE} with an empty body.
     */
    public static Snake spawn(Grid grid, IRandomProvider random) {
        Position start = grid.positionOf(random.nextInt(grid.size()));
        return new Snake(grid, start);
    }

    /**
     * Creates a snake with its head on the given cell.
     *
     * @param grid The board to place the snake on.
     * @param head The head position, must be inside the board.
     * @return The new snake.
     */
    public static Snake at(Grid grid, Position head) {
        return new Snake(grid, head);
    }

    /**
     * Changes the heading. A 180° reversal of a moving snake is the only refused change;
     * while the heading is {@link Direction#NONE} every direction is accepted.
     * No movement happens here.
     *
     * @param requested The new heading.
     * @return {@link TurnOutcome#ACCEPTED} or {@link TurnOutcome#REJECTED_OPPOSITE}.
     */
    public TurnOutcome setDirection(Direction requested) {
        if (requested == Direction.NONE) {
            throw new IllegalArgumentException("NONE is not a valid direction request");
        }
        if (heading.isOpposite(requested)) {
            return TurnOutcome.REJECTED_OPPOSITE;
        }
        heading = requested;
        return TurnOutcome.ACCEPTED;
    }

    /**
     * Advances the snake one cell along its heading.
     * <p>
     * A target outside the board fails with {@link MoveOutcome#OUT_OF_BOUNDS}, a target
     * on the snake itself with {@link MoveOutcome#SELF_COLLISION}; in both cases nothing
     * is changed. Otherwise the head moves to the target and every segment moves into the
     * slot its predecessor held before this step. A fruit on the target is consumed and
     * the snake grows by one segment in the same step.
     *
     * @param grid The board.
     * @return The outcome of the move.
     * @throws IllegalStateException if the heading is {@link Direction#NONE}.
     */
    public MoveOutcome step(Grid grid) {
        if (heading == Direction.NONE) {
            throw new IllegalStateException("Cannot step without a heading");
        }
        Position target = head.translate(heading);
        if (!grid.contains(target)) {
            return MoveOutcome.OUT_OF_BOUNDS;
        }
        Cell targetCell = grid.get(target);
        if (targetCell == Cell.OCCUPIED_SNAKE) {
            return MoveOutcome.SELF_COLLISION;
        }
        boolean ateFruit = targetCell == Cell.OCCUPIED_FRUIT;

        Position previous = head;
        relocate(grid, head, target);
        head = target;

        for (int i = 0; i < body.size(); i++) {
            Position before = body.get(i);
            relocate(grid, before, previous);
            body.set(i, previous);
            previous = before;
        }

        if (ateFruit) {
            // previous is now the slot the old tail gave up
            grow(grid, previous);
            return MoveOutcome.MOVED_AND_GREW;
        }
        return MoveOutcome.MOVED;
    }

    /**
     * Appends a segment one cell behind the current tail, against the heading.
     *
     * @param grid The board.
     * @throws IllegalStateException if the heading is {@link Direction#NONE} or the cell
     *         behind the tail is outside the board or not vacant.
     */
    public void addBody(Grid grid) {
        if (heading == Direction.NONE) {
            throw new IllegalStateException("Cannot grow without a heading");
        }
        Position candidate = tail().behind(heading);
        if (!isFree(grid, candidate)) {
            throw new IllegalStateException("No room behind tail " + tail() + " heading " + heading);
        }
        append(grid, candidate);
    }

    private void grow(Grid grid, Position vacatedTail) {
        Position candidate = tail().behind(heading);
        // right after a turn the cell behind the tail can be off the board or taken
        append(grid, isFree(grid, candidate) ? candidate : vacatedTail);
    }

    private void append(Grid grid, Position position) {
        grid.set(position, Cell.OCCUPIED_SNAKE);
        body.add(position);
    }

    private static boolean isFree(Grid grid, Position position) {
        return grid.contains(position) && grid.get(position) == Cell.VACANT;
    }

    private static void relocate(Grid grid, Position from, Position to) {
        grid.set(from, Cell.VACANT);
        grid.set(to, Cell.OCCUPIED_SNAKE);
    }

    public Direction direction() {
        return heading;
    }

    public Position head() {
        return head;
    }

    /**
     * @return The last segment, or the head when the body is empty.
     */
    public Position tail() {
        return body.isEmpty() ? head : body.get(body.size() - 1);
    }

    /**
     * @return The body segments from nearest-to-head to tail, unmodifiable.
     */
    public List<Position> body() {
        return Collections.unmodifiableList(body);
    }

    /**
     * @return The number of cells covered, head included.
     */
    public int length() {
        return body.size() + 1;
    }

    /**
     * @return The head followed by all body segments.
     */
    public List<Position> occupiedPositions() {
        List<Position> all = new ArrayList<>(body.size() + 1);
        all.add(head);
        all.addAll(body);
        return all;
    }
}
