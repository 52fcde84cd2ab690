package org.cascadeslot.service.random;

import java.util.Random;

/**
 * Aléa reproductible : même graine, même séquence de tirages.
 * Sert aux tests et aux simulations rejouables.
 */
public class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public synchronized double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public synchronized int nextInt(int min, int max) {
        if (min >= max) return min;
        return min + random.nextInt(max - min);
    }
}
