package org.cascadeslot.config;

import lombok.extern.slf4j.Slf4j;
import org.cascadeslot.model.AlgorithmConfig;
import org.cascadeslot.model.BonusTriggerConfig;
import org.cascadeslot.model.CascadeConfig;
import org.cascadeslot.model.GoldenWildConfig;
import org.cascadeslot.service.SlotEngine;
import org.cascadeslot.service.random.RandomSource;
import org.cascadeslot.service.random.SecureRandomSource;
import org.cascadeslot.service.random.SeededRandomSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Configuration
public class SlotEngineConfiguration {

    @Bean
    public RandomSource randomSource(SlotProperties props) {
        Long seed = props.getRandom().getSeed();
        if (seed == null) return new SecureRandomSource();
        log.info("Aléa déterministe, graine {}", seed);
        return new SeededRandomSource(seed);
    }

    @Bean
    public SlotEngine slotEngine(SlotProperties props, RandomSource randomSource) {
        return new SlotEngine(
                toAlgorithmConfig(props.getAlgorithm()),
                toCascadeConfig(props),
                toGoldenWildConfig(props.getGolden()),
                toBonusTriggerConfig(props.getBonus()),
                randomSource,
                props.getRtp().getController());
    }

    static AlgorithmConfig toAlgorithmConfig(SlotProperties.Algorithm p) {
        AlgorithmConfig d = AlgorithmConfig.mahjongDefaults();
        Map<Integer, List<Long>> pay = d.getPayTable();
        if (p.getPayTable() != null && !p.getPayTable().isEmpty()) {
            pay = new LinkedHashMap<>();
            for (Map.Entry<String, List<Long>> e : p.getPayTable().entrySet()) {
                pay.put(Integer.valueOf(e.getKey().trim()), List.copyOf(e.getValue()));
            }
        }
        return d.toBuilder()
                .reelCount(or(p.getReelCount(), d.getReelCount()))
                .rowCount(or(p.getRowCount(), d.getRowCount()))
                .symbolCount(or(p.getSymbolCount(), d.getSymbolCount()))
                .targetRtp(or(p.getTargetRtp(), d.getTargetRtp()))
                .minRtp(or(p.getMinRtp(), d.getMinRtp()))
                .maxRtp(or(p.getMaxRtp(), d.getMaxRtp()))
                .symbolWeights(p.getSymbolWeights() != null ? p.getSymbolWeights() : d.getSymbolWeights())
                .payTable(pay)
                .minBet(or(p.getMinBet(), d.getMinBet()))
                .maxBet(or(p.getMaxBet(), d.getMaxBet()))
                .payTableBetBase(or(p.getPayTableBetBase(), d.getPayTableBetBase()))
                .build();
    }

    static CascadeConfig toCascadeConfig(SlotProperties props) {
        SlotProperties.Cascade p = props.getCascade();
        AlgorithmConfig algo = toAlgorithmConfig(props.getAlgorithm());
        CascadeConfig d = CascadeConfig.defaults();
        return d.toBuilder()
                .gridWidth(algo.getReelCount())
                .gridHeight(algo.getRowCount())
                .minMatch(or(p.getMinMatch(), d.getMinMatch()))
                .maxCascades(or(p.getMaxCascades(), d.getMaxCascades()))
                .cascadeMultipliers(p.getMultipliers() != null ? p.getMultipliers() : d.getCascadeMultipliers())
                .adjacentOnly(or(p.getAdjacentOnly(), d.isAdjacentOnly()))
                .matchStrategy(or(p.getMatchStrategy(), d.getMatchStrategy()))
                .leanAttempts(or(p.getLeanAttempts(), d.getLeanAttempts()))
                .build();
    }

    static GoldenWildConfig toGoldenWildConfig(SlotProperties.Golden p) {
        GoldenWildConfig d = GoldenWildConfig.defaults();
        return d.toBuilder()
                .enabled(or(p.getEnabled(), d.isEnabled()))
                .goldenProbability(or(p.getProbability(), d.getGoldenProbability()))
                .goldenEnabledSymbols(p.getSymbols() != null ? p.getSymbols() : d.getGoldenEnabledSymbols())
                .wildSymbolId(or(p.getWildSymbolId(), d.getWildSymbolId()))
                .build();
    }

    static BonusTriggerConfig toBonusTriggerConfig(SlotProperties.Bonus p) {
        BonusTriggerConfig d = BonusTriggerConfig.defaults();
        return d.toBuilder()
                .enabled(p.isEnabled())
                .normalSpawnProbability(or(p.getNormalSpawnProbability(), d.getNormalSpawnProbability()))
                .superSpawnProbability(or(p.getSuperSpawnProbability(), d.getSuperSpawnProbability()))
                .build();
    }

    private static <T> T or(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
