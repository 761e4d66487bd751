package org.snek.runtime.worldgen;

import org.snek.runtime.model.Grid;
import org.snek.runtime.model.Position;

import java.util.Optional;

/**
 * A strategy for putting new fruit on the board.
 */
public interface IFruitSpawner {
    /**
     * Called by the game controller on every spawn tick.
     *
     * @param grid The board to modify.
     * @return The cell that received fruit, or empty if nothing was placed.
     */
    Optional<Position> spawn(Grid grid);
}
