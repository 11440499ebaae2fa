package com.example.battlecore.util;

/**
 * Source of uniformly distributed integers for every roll the engine makes.
 * Injected so a battle can be replayed from a seed.
 */
public interface RandomSource {

    /**
     * Draw an integer uniformly from the inclusive range [min, maxInclusive].
     */
    int nextInt(int min, int maxInclusive);

    /**
     * Roll a single die with the given number of sides (1..sides).
     */
    default int roll(int sides) {
        return nextInt(1, sides);
    }
}
