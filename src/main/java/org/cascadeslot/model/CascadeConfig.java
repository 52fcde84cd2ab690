package org.cascadeslot.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@Builder(toBuilder = true)
public class CascadeConfig {
    private final int gridWidth;
    private final int gridHeight;
    private final int minMatch;
    private final int maxCascades;
    private final List<Double> cascadeMultipliers;
    private final boolean adjacentOnly;
    @Builder.Default
    private final MatchStrategy matchStrategy = MatchStrategy.WAYS;
    /** Nombre maximal de grilles initiales tirées pour suivre une orientation du contrôleur RTP. */
    @Builder.Default
    private final int leanAttempts = 2;

    /** Étapes numérotées à partir de 1 ; hors table le multiplicateur vaut 1. */
    public double multiplierForStep(int step) {
        if (cascadeMultipliers == null || step < 1 || step > cascadeMultipliers.size()) return 1.0;
        return cascadeMultipliers.get(step - 1);
    }

    public static CascadeConfig defaults() {
        return CascadeConfig.builder()
                .gridWidth(5)
                .gridHeight(4)
                .minMatch(3)
                .maxCascades(10)
                .cascadeMultipliers(List.of(1.0, 2.0, 3.0, 5.0, 8.0, 12.0, 18.0, 25.0, 35.0, 50.0))
                .adjacentOnly(true)
                .build();
    }
}
