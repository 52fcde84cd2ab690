package org.cascadeslot.service;

import org.cascadeslot.exception.InvalidConfigException;
import org.cascadeslot.model.AlgorithmConfig;
import org.cascadeslot.model.BonusTriggerConfig;
import org.cascadeslot.model.CascadeConfig;
import org.cascadeslot.model.GoldenWildConfig;

import java.util.List;
import java.util.Map;

public final class ConfigValidator {
    private ConfigValidator(){}

    public static final int MIN_REELS = 3, MAX_REELS = 7;
    public static final int MIN_ROWS = 3, MAX_ROWS = 5;
    public static final double MIN_TARGET_RTP = 0.8, MAX_TARGET_RTP = 0.99;

    public static void validate(AlgorithmConfig algo, CascadeConfig cascade,
                                GoldenWildConfig golden, BonusTriggerConfig bonus) {
        if (algo == null || cascade == null || golden == null || bonus == null) {
            throw new InvalidConfigException("Configuration incomplète");
        }
        validateAlgorithm(algo);
        validateCascade(cascade, algo);
        validateGolden(golden, algo);
        validateBonus(bonus, algo, golden);
    }

    public static void validateTargetRtp(double rtp) {
        if (Double.isNaN(rtp) || rtp < MIN_TARGET_RTP || rtp > MAX_TARGET_RTP) {
            throw new InvalidConfigException("RTP cible hors bornes [0.8, 0.99]",
                    InvalidConfigException.INVALID_RTP, Map.of("targetRtp", rtp));
        }
    }

    static void validateAlgorithm(AlgorithmConfig c) {
        if (c.getReelCount() < MIN_REELS || c.getReelCount() > MAX_REELS) {
            throw new InvalidConfigException("Nombre de rouleaux invalide", Map.of("reelCount", c.getReelCount()));
        }
        if (c.getRowCount() < MIN_ROWS || c.getRowCount() > MAX_ROWS) {
            throw new InvalidConfigException("Nombre de lignes invalide", Map.of("rowCount", c.getRowCount()));
        }
        if (c.getSymbolCount() < 1) {
            throw new InvalidConfigException("symbolCount doit être >= 1", Map.of("symbolCount", c.getSymbolCount()));
        }
        validateTargetRtp(c.getTargetRtp());
        if (c.getMinRtp() > c.getTargetRtp() || c.getMaxRtp() < c.getTargetRtp()) {
            throw new InvalidConfigException("minRtp <= targetRtp <= maxRtp non respecté",
                    InvalidConfigException.INVALID_RTP,
                    Map.of("minRtp", c.getMinRtp(), "targetRtp", c.getTargetRtp(), "maxRtp", c.getMaxRtp()));
        }

        List<List<Integer>> weights = c.getSymbolWeights();
        if (weights == null || weights.size() != c.getReelCount()) {
            throw new InvalidConfigException("Un tableau de poids par rouleau est attendu",
                    InvalidConfigException.INVALID_REEL_STRIPS,
                    Map.of("expected", c.getReelCount(), "actual", weights == null ? 0 : weights.size()));
        }
        for (int r = 0; r < weights.size(); r++) {
            List<Integer> row = weights.get(r);
            if (row == null || row.isEmpty()) {
                throw new InvalidConfigException("Poids manquants pour le rouleau " + r,
                        InvalidConfigException.INVALID_REEL_STRIPS, Map.of("reel", r));
            }
            // un poids par id ordinaire
            if (row.size() != c.getSymbolCount()) {
                throw new InvalidConfigException("Le rouleau " + r + " doit avoir un poids par symbole",
                        InvalidConfigException.INVALID_REEL_STRIPS,
                        Map.of("reel", r, "expected", c.getSymbolCount(), "actual", row.size()));
            }
            for (Integer w : row) {
                if (w == null || w < 0) {
                    throw new InvalidConfigException("Poids négatif sur le rouleau " + r,
                            InvalidConfigException.INVALID_REEL_STRIPS, Map.of("reel", r));
                }
            }
        }

        Map<Integer, List<Long>> pay = c.getPayTable();
        if (pay == null || pay.isEmpty()) {
            throw new InvalidConfigException("Table de gains vide", InvalidConfigException.INVALID_PAY_TABLE, null);
        }
        for (Map.Entry<Integer, List<Long>> e : pay.entrySet()) {
            if (e.getKey() == null || e.getValue() == null || e.getValue().isEmpty()) {
                throw new InvalidConfigException("Entrée de table de gains invalide",
                        InvalidConfigException.INVALID_PAY_TABLE, Map.of("symbol", String.valueOf(e.getKey())));
            }
            for (Long v : e.getValue()) {
                if (v == null || v < 0) {
                    throw new InvalidConfigException("Gain négatif pour le symbole " + e.getKey(),
                            InvalidConfigException.INVALID_PAY_TABLE, Map.of("symbol", e.getKey()));
                }
            }
        }

        if (c.getMinBet() <= 0 || c.getMaxBet() < c.getMinBet()) {
            throw new InvalidConfigException("Bornes de mise invalides",
                    Map.of("minBet", c.getMinBet(), "maxBet", c.getMaxBet()));
        }
        if (c.getPayTableBetBase() <= 0) {
            throw new InvalidConfigException("payTableBetBase doit être > 0");
        }
    }

    static void validateCascade(CascadeConfig c, AlgorithmConfig algo) {
        if (c.getGridWidth() != algo.getReelCount() || c.getGridHeight() != algo.getRowCount()) {
            throw new InvalidConfigException("Dimensions de grille incohérentes avec les rouleaux",
                    Map.of("gridWidth", c.getGridWidth(), "gridHeight", c.getGridHeight(),
                            "reelCount", algo.getReelCount(), "rowCount", algo.getRowCount()));
        }
        if (c.getMinMatch() < 2) {
            throw new InvalidConfigException("minMatch doit être >= 2", Map.of("minMatch", c.getMinMatch()));
        }
        if (c.getMaxCascades() < 1) {
            throw new InvalidConfigException("maxCascades doit être >= 1", Map.of("maxCascades", c.getMaxCascades()));
        }
        if (c.getLeanAttempts() < 1) {
            throw new InvalidConfigException("leanAttempts doit être >= 1", Map.of("leanAttempts", c.getLeanAttempts()));
        }
        if (c.getMatchStrategy() == null) {
            throw new InvalidConfigException("matchStrategy manquant");
        }
        if (c.getCascadeMultipliers() != null) {
            for (Double m : c.getCascadeMultipliers()) {
                if (m == null || m <= 0) {
                    throw new InvalidConfigException("Multiplicateur de cascade invalide");
                }
            }
        }
    }

    static void validateGolden(GoldenWildConfig g, AlgorithmConfig algo) {
        if (g.getGoldenProbability() < 0 || g.getGoldenProbability() > 1) {
            throw new InvalidConfigException("Probabilité dorée hors [0, 1]",
                    Map.of("goldenProbability", g.getGoldenProbability()));
        }
        if (isOrdinary(g.getWildSymbolId(), algo)) {
            throw new InvalidConfigException("L'id du wild chevauche les symboles ordinaires",
                    Map.of("wildSymbolId", g.getWildSymbolId()));
        }
    }

    static void validateBonus(BonusTriggerConfig b, AlgorithmConfig algo, GoldenWildConfig g) {
        if (!b.isEnabled()) return;
        int normal = b.getBonusWildSymbolId(), sup = b.getSuperBonusSymbolId();
        if (isOrdinary(normal, algo) || isOrdinary(sup, algo) || normal == sup
                || normal == g.getWildSymbolId() || sup == g.getWildSymbolId()) {
            throw new InvalidConfigException("Ids de symboles bonus invalides",
                    Map.of("bonusWildSymbolId", normal, "superBonusSymbolId", sup));
        }
        double total = b.getNormalSpawnProbability() + b.getSuperSpawnProbability();
        if (b.getNormalSpawnProbability() < 0 || b.getSuperSpawnProbability() < 0 || total > 1) {
            throw new InvalidConfigException("Probabilités d'apparition des bonus invalides");
        }
        if (b.getNormalMinCount() < 1 || b.getSuperMinCount() < 1) {
            throw new InvalidConfigException("Seuils de déclenchement bonus invalides");
        }
    }

    private static boolean isOrdinary(int id, AlgorithmConfig algo) {
        return id >= 0 && id < algo.getSymbolCount();
    }
}
