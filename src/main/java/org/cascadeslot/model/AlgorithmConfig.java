package org.cascadeslot.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Paramètres de base du jeu : dimensions, poids par rouleau, table de gains, RTP cible, bornes de mise.
 * <p>
 * {@code symbolWeights.get(reel).get(symbol)} donne le poids du symbole sur ce rouleau.
 * {@code payTable.get(symbol).get(n - 1)} donne le gain (en unités) pour n symboles ;
 * le gain crédité vaut {@code unités × mise / payTableBetBase}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class AlgorithmConfig {
    private final int reelCount;
    private final int rowCount;
    private final int symbolCount;

    private final double targetRtp;
    private final double minRtp;
    private final double maxRtp;

    private final List<List<Integer>> symbolWeights;
    private final Map<Integer, List<Long>> payTable;

    private final long minBet;
    private final long maxBet;
    @Builder.Default
    private final long payTableBetBase = 100;

    public static AlgorithmConfig mahjongDefaults() {
        Map<Integer, List<Long>> pay = new LinkedHashMap<>();
        pay.put(0, List.of(0L, 0L, 20L, 60L, 200L));
        pay.put(1, List.of(0L, 0L, 25L, 75L, 250L));
        pay.put(2, List.of(0L, 0L, 30L, 90L, 300L));
        pay.put(3, List.of(0L, 0L, 15L, 45L, 150L));
        pay.put(4, List.of(0L, 0L, 12L, 36L, 120L));
        pay.put(5, List.of(0L, 0L, 10L, 30L, 100L));
        pay.put(6, List.of(0L, 0L, 8L, 24L, 80L));
        pay.put(7, List.of(0L, 0L, 6L, 18L, 60L));

        return AlgorithmConfig.builder()
                .reelCount(5)
                .rowCount(4)
                .symbolCount(8)
                .targetRtp(0.96)
                .minRtp(0.94)
                .maxRtp(0.98)
                .symbolWeights(List.of(
                        List.of(18, 16, 14, 12, 12, 10, 8, 6),
                        List.of(16, 18, 14, 12, 12, 10, 8, 6),
                        List.of(14, 16, 18, 12, 12, 10, 8, 6),
                        List.of(12, 14, 16, 18, 12, 10, 8, 6),
                        List.of(12, 12, 14, 16, 18, 12, 8, 6)))
                .payTable(pay)
                .minBet(10)
                .maxBet(10_000)
                // base game en ways avant pilotage : ~2.6x la cible avec une base de 100
                .payTableBetBase(250)
                .build();
    }
}
