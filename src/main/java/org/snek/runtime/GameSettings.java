package org.snek.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable parameters of a game: board size, tick cadence and the optional seed.
 *
 * @param width Board width in cells.
 * @param height Board height in cells.
 * @param moveIntervalSeconds Accumulated time between two snake moves.
 * @param spawnIntervalSeconds Accumulated time between two fruit spawns.
 * @param seed Seed for all randomness, or {@code null} for a time-based seed.
 */
public record GameSettings(int width, int height, double moveIntervalSeconds, double spawnIntervalSeconds, Long seed) {

    public static final int DEFAULT_WIDTH = 19;
    public static final int DEFAULT_HEIGHT = 15;
    public static final double DEFAULT_MOVE_INTERVAL = 0.25;
    public static final double DEFAULT_SPAWN_INTERVAL = 5.0;

    private static final String ROOT_PATH = "snek";

    public GameSettings {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid too large: " + width + "x" + height);
        }
        if (!(moveIntervalSeconds > 0) || Double.isInfinite(moveIntervalSeconds)) {
            throw new IllegalArgumentException("Move interval must be a positive number of seconds: " + moveIntervalSeconds);
        }
        if (!(spawnIntervalSeconds > 0) || Double.isInfinite(spawnIntervalSeconds)) {
            throw new IllegalArgumentException("Spawn interval must be a positive number of seconds: " + spawnIntervalSeconds);
        }
    }

    /**
     * Default cadence on a board of the given size, with a time-based seed.
     */
    public static GameSettings of(int width, int height) {
        return new GameSettings(width, height, DEFAULT_MOVE_INTERVAL, DEFAULT_SPAWN_INTERVAL, null);
    }

    public static GameSettings defaults() {
        return of(DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    /**
     * Reads the {@code snek} block of the application configuration.
     * <pre>
     * snek {
     *   grid { width = 19, height = 15 }
     *   timing { move-interval = 0.25, spawn-interval = 5.0 }
     *   seed = null
     * }
     * </pre>
     * Missing keys fall back to the built-in defaults.
     *
     * @param config The resolved application configuration.
     * @return The settings.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static GameSettings fromConfig(Config config) {
        Config c = config.hasPath(ROOT_PATH) ? config.getConfig(ROOT_PATH) : ConfigFactory.empty();
        int width = c.hasPath("grid.width") ? c.getInt("grid.width") : DEFAULT_WIDTH;
        int height = c.hasPath("grid.height") ? c.getInt("grid.height") : DEFAULT_HEIGHT;
        double move = c.hasPath("timing.move-interval") ? c.getDouble("timing.move-interval") : DEFAULT_MOVE_INTERVAL;
        double spawn = c.hasPath("timing.spawn-interval") ? c.getDouble("timing.spawn-interval") : DEFAULT_SPAWN_INTERVAL;
        // hasPath is false for an explicit null
        Long seed = c.hasPath("seed") ? c.getLong("seed") : null;
        return new GameSettings(width, height, move, spawn, seed);
    }

    public GameSettings withSize(int newWidth, int newHeight) {
        return new GameSettings(newWidth, newHeight, moveIntervalSeconds, spawnIntervalSeconds, seed);
    }

    public GameSettings withSeed(Long newSeed) {
        return new GameSettings(width, height, moveIntervalSeconds, spawnIntervalSeconds, newSeed);
    }

    /**
     * @return The configured seed, or a time-based one when none is configured.
     */
    public long effectiveSeed() {
        return seed != null ? seed : System.nanoTime();
    }
}
