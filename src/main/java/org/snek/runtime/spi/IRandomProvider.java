package org.snek.runtime.spi;

/**
 * Provides deterministic randomness scoped to a single game.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams, so that
 * snake placement and fruit placement do not disturb each other's sequence.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     *
     * @param scope a stable, descriptive scope name (e.g., "snake", "fruit")
     * @param key a stable numeric key
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
