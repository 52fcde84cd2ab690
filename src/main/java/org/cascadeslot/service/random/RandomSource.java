package org.cascadeslot.service.random;

/**
 * Source d'aléa injectée dans le moteur. Les implémentations doivent supporter
 * des appels concurrents sans verrou côté appelant.
 */
public interface RandomSource {

    /** Uniforme dans [0, 1). */
    double nextDouble();

    /** Uniforme dans [min, max) ; renvoie {@code min} si {@code min >= max}. */
    int nextInt(int min, int max);
}
