package org.snek.runtime.worldgen;

import org.snek.runtime.internal.services.SeededRandomProvider;
import org.snek.runtime.model.Cell;
import org.snek.runtime.model.FruitKind;
import org.snek.runtime.model.Grid;
import org.snek.runtime.model.Position;
import org.snek.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class FruitSpawnerTest {

    @Mock
    private IRandomProvider random;

    @Test
    void resamplesUntilAVacantCellIsDrawn() {
        Grid grid = new Grid(3, 3);
        grid.set(new Position(1, 1), Cell.OCCUPIED_SNAKE);
        grid.placeFruit(new Position(2, 0), FruitKind.RED);
        // index 4 is the snake, index 2 is fruit, index 7 is (1,2)
        when(random.nextInt(9)).thenReturn(4, 2, 7);
        when(random.nextInt(FruitKind.values().length)).thenReturn(2);

        Optional<Position> spawned = new FruitSpawner(random).spawn(grid);

        assertThat(spawned).contains(new Position(1, 2));
        assertThat(grid.get(new Position(1, 2))).isEqualTo(Cell.OCCUPIED_FRUIT);
        assertThat(grid.fruitKind(new Position(1, 2))).isEqualTo(FruitKind.ORANGE);
        assertThat(grid.get(new Position(1, 1))).isEqualTo(Cell.OCCUPIED_SNAKE);
        verify(random, times(3)).nextInt(9);
    }

    @Test
    void singleVacancyIsAlwaysFound() {
        for (long seed = 0; seed < 20; seed++) {
            Grid grid = new Grid(3, 3);
            for (int i = 0; i < grid.size(); i++) {
                if (i != 5) {
                    grid.set(grid.positionOf(i), Cell.OCCUPIED_SNAKE);
                }
            }

            Optional<Position> spawned = new FruitSpawner(new SeededRandomProvider(seed)).spawn(grid);

            assertThat(spawned).contains(new Position(2, 1));
            assertThat(grid.vacantCount()).isZero();
            assertThat(grid.count(Cell.OCCUPIED_FRUIT)).isEqualTo(1);
        }
    }

    @Test
    void fullGridIsSkipped() {
        Grid grid = new Grid(2, 2);
        for (int i = 0; i < grid.size(); i++) {
            grid.set(grid.positionOf(i), Cell.OCCUPIED_SNAKE);
        }

        Optional<Position> spawned = new FruitSpawner(random).spawn(grid);

        assertThat(spawned).isEmpty();
        assertThat(grid.count(Cell.OCCUPIED_SNAKE)).isEqualTo(4);
        verify(random, never()).nextInt(anyInt());
    }
}
