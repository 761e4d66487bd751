package org.snek.runtime;

import org.snek.runtime.internal.services.SeededRandomProvider;
import org.snek.runtime.model.Direction;
import org.snek.runtime.model.Grid;
import org.snek.runtime.model.IGridReader;
import org.snek.runtime.model.MoveOutcome;
import org.snek.runtime.model.Position;
import org.snek.runtime.model.Snake;
import org.snek.runtime.model.TerminationCause;
import org.snek.runtime.model.TurnOutcome;
import org.snek.runtime.spi.IRandomProvider;
import org.snek.runtime.worldgen.FruitSpawner;
import org.snek.runtime.worldgen.IFruitSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Drives a single game: owns the board and the snake, accounts elapsed time and moves
 * the game through {@link GameState#START}, {@link GameState#IN_PROGRESS} and
 * {@link GameState#END}.
 * <p>
 * The controller is driven entirely from outside with two kinds of events: direction
 * requests and time advances. It has no threads or timers of its own and is not
 * thread-safe. Direction requests take effect immediately, so a request made before an
 * {@link #advance(double)} is honoured by the move that advance may trigger.
 * <p>
 * Time is accounted with two accumulators, one for movement and one for fruit spawns.
 * When an accumulator reaches its interval the action fires once and the accumulator
 * is reset to zero; the excess is dropped.
 */
public class GameController {
    private static final Logger LOG = LoggerFactory.getLogger(GameController.class);

    private final GameSettings settings;
    private final Grid grid;
    private final Snake snake;
    private final IFruitSpawner fruitSpawner;

    private GameState state = GameState.START;
    private TerminationCause terminationCause;
    private String lastMessage;

    private double movementElapsed = 0.0;
    private double spawnElapsed = 0.0;
    private long tickCount = 0L;

    /**
     * Creates a game on a board of the given size with default cadence and a time-based seed.
     *
     * @param width Board width in cells.
     * @param height Board height in cells.
     */
    public GameController(int width, int height) {
        this(GameSettings.of(width, height));
    }

    /**
     * Creates a game from settings, seeding all randomness from {@link GameSettings#effectiveSeed()}.
     *
     * @param settings The game settings.
     */
    public GameController(GameSettings settings) {
        this(settings, new SeededRandomProvider(settings.effectiveSeed()));
    }

    /**
     * Creates a game using the given randomness. Snake placement and fruit placement draw
     * from independent sub-streams of the provider.
     *
     * @param settings The game settings.
     * @param randomProvider The root source of randomness.
     */
    public GameController(GameSettings settings, IRandomProvider randomProvider) {
        this.settings = settings;
        this.grid = new Grid(settings.width(), settings.height());
        this.snake = Snake.spawn(grid, randomProvider.deriveFor("snake", 0L));
        this.fruitSpawner = new FruitSpawner(randomProvider.deriveFor("fruit", 0L));
        LOG.debug("New {}x{} game, snake at {}", settings.width(), settings.height(), snake.head());
    }

    /**
     * Creates a game around an already populated board. The snake must have been placed
     * on {@code grid}.
     */
    GameController(GameSettings settings, Grid grid, Snake snake, IFruitSpawner fruitSpawner) {
        this.settings = settings;
        this.grid = grid;
        this.snake = snake;
        this.fruitSpawner = fruitSpawner;
    }

    /**
     * Forwards a direction request from the player to the snake.
     * <p>
     * The first accepted request starts the game. A reversal is refused without
     * consequence beyond a hint in {@link #lastMessage()}. Once the game has ended every
     * request is ignored.
     *
     * @param direction The requested heading.
     * @return The outcome of the request.
     */
    public TurnOutcome requestDirection(Direction direction) {
        if (state == GameState.END) {
            LOG.debug("Ignoring direction {} after game end", direction);
            return TurnOutcome.IGNORED_GAME_OVER;
        }
        TurnOutcome outcome = snake.setDirection(direction);
        if (!outcome.isAccepted()) {
            lastMessage = outcome.hint();
            LOG.debug("Rejected direction {} while heading {}", direction, snake.direction());
            return outcome;
        }
        if (state == GameState.START) {
            state = GameState.IN_PROGRESS;
            LOG.info("Game started, heading {} from {}", direction, snake.head());
        }
        return outcome;
    }

    /**
     * Feeds elapsed wall time into the game. Outside {@link GameState#IN_PROGRESS} the
     * time is discarded. Otherwise a fruit spawn is attempted when the spawn interval has
     * elapsed, then the snake moves when the movement interval has elapsed.
     *
     * @param deltaSeconds The time since the previous call, non-negative and finite.
     * @throws IllegalArgumentException if the delta is negative, NaN or infinite.
     */
    public void advance(double deltaSeconds) {
        if (!(deltaSeconds >= 0) || Double.isInfinite(deltaSeconds)) {
            throw new IllegalArgumentException("Time delta must be a non-negative finite number: " + deltaSeconds);
        }
        if (state != GameState.IN_PROGRESS) {
            return;
        }

        movementElapsed += deltaSeconds;
        spawnElapsed += deltaSeconds;

        if (spawnElapsed >= settings.spawnIntervalSeconds()) {
            fruitSpawner.spawn(grid);
            spawnElapsed = 0.0;
        }

        if (movementElapsed >= settings.moveIntervalSeconds()) {
            MoveOutcome outcome = snake.step(grid);
            tickCount++;
            movementElapsed = 0.0;
            if (outcome == MoveOutcome.MOVED_AND_GREW) {
                LOG.debug("Tick={} ate fruit at {}, length {}", tickCount, snake.head(), snake.length());
            }
            outcome.terminationCause().ifPresent(this::end);
        }
    }

    private void end(TerminationCause cause) {
        terminationCause = cause;
        state = GameState.END;
        lastMessage = cause.message() + " - over!";
        LOG.info("Game over after {} ticks: {} (length {})", tickCount, cause.message(), snake.length());
    }

    public GameState state() {
        return state;
    }

    /**
     * @return A read-only view of the board for drawing.
     */
    public IGridReader grid() {
        return grid;
    }

    public Position snakeHead() {
        return snake.head();
    }

    /**
     * @return The cells covered by the snake, head first.
     */
    public List<Position> snakePositions() {
        return snake.occupiedPositions();
    }

    public int snakeLength() {
        return snake.length();
    }

    public Direction snakeDirection() {
        return snake.direction();
    }

    /**
     * @return The reason the game ended, empty while it is still running.
     */
    public Optional<TerminationCause> terminationCause() {
        return Optional.ofNullable(terminationCause);
    }

    /**
     * @return The most recent player-facing hint (a refused turn or the game-over reason), if any.
     */
    public Optional<String> lastMessage() {
        return Optional.ofNullable(lastMessage);
    }

    /**
     * @return The number of movement ticks executed so far.
     */
    public long tickCount() {
        return tickCount;
    }

    public GameSettings settings() {
        return settings;
    }
}
