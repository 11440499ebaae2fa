package com.example.battlecore.util;

import java.util.Random;

/**
 * {@link RandomSource} backed by {@link java.util.Random}.
 * Two instances created with the same seed produce the same sequence.
 */
public class SeededRandomSource implements RandomSource {

    private final Random random;
    private final long seed;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public SeededRandomSource() {
        this(System.nanoTime());
    }

    public long getSeed() { return seed; }

    @Override
    public int nextInt(int min, int maxInclusive) {
        if (maxInclusive < min) {
            throw new IllegalArgumentException("Empty range [" + min + ", " + maxInclusive + "]");
        }
        return min + random.nextInt(maxInclusive - min + 1);
    }
}
