package org.snek.runtime.worldgen;

import org.snek.runtime.model.Cell;
import org.snek.runtime.model.FruitKind;
import org.snek.runtime.model.Grid;
import org.snek.runtime.model.Position;
import org.snek.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Places one fruit on a vacant cell chosen uniformly at random.
 * <p>
 * Cells are drawn uniformly over the whole board until a vacant one turns up. Fruit
 * density stays low compared to the board size, so this terminates quickly in practice.
 * A board without any vacant cell is detected up front and skipped.
 */
public class FruitSpawner implements IFruitSpawner {

    private static final Logger LOG = LoggerFactory.getLogger(FruitSpawner.class);
    private static final FruitKind[] PALETTE = FruitKind.values();

    private final IRandomProvider random;

    /**
     * Creates a spawner.
     *
     * @param randomProvider Source of randomness for both the cell and the fruit kind.
     */
    public FruitSpawner(IRandomProvider randomProvider) {
        this.random = randomProvider;
    }

    @Override
    public Optional<Position> spawn(Grid grid) {
        if (grid.vacantCount() == 0) {
            LOG.debug("No vacant cell left on the {}x{} grid, skipping fruit spawn", grid.width(), grid.height());
            return Optional.empty();
        }

        int index;
        do {
            index = random.nextInt(grid.size());
        } while (grid.get(index) != Cell.VACANT);

        Position position = grid.positionOf(index);
        FruitKind kind = PALETTE[random.nextInt(PALETTE.length)];
        grid.placeFruit(position, kind);
        LOG.debug("Spawned {} fruit at {}", kind, position);
        return Optional.of(position);
    }
}
