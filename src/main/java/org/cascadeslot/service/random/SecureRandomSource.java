package org.cascadeslot.service.random;

import java.security.SecureRandom;

public class SecureRandomSource implements RandomSource {

    private final SecureRandom random = new SecureRandom();

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int min, int max) {
        if (min >= max) return min;
        return min + random.nextInt(max - min);
    }
}
