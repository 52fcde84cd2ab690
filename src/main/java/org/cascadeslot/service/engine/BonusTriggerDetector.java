package org.cascadeslot.service.engine;

import org.cascadeslot.model.BonusTrigger;
import org.cascadeslot.model.BonusTriggerConfig;
import org.cascadeslot.model.BonusType;
import org.cascadeslot.model.GridPosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Détection des tours gratuits sur la grille initiale ; le super bonus passe en premier. */
public class BonusTriggerDetector {

    private final BonusTriggerConfig config;

    public BonusTriggerDetector(BonusTriggerConfig config) {
        this.config = config;
    }

    public Optional<BonusTrigger> detect(int[][] grid) {
        if (!config.isEnabled() || grid == null) return Optional.empty();

        List<GridPosition> supers = positionsOf(grid, config.getSuperBonusSymbolId());
        if (supers.size() >= config.getSuperMinCount()) {
            return Optional.of(new BonusTrigger(BonusType.SUPER, config.getSuperBonusSymbolId(), supers.size(), supers,
                    config.getSuperRounds(), config.getSuperMultiplier(), config.getSuperBonusPool(), copy(grid)));
        }

        List<GridPosition> normals = positionsOf(grid, config.getBonusWildSymbolId());
        if (normals.size() >= config.getNormalMinCount()) {
            int extra = normals.size() - config.getNormalMinCount();
            int rounds = config.getNormalBaseRounds() + extra * config.getRoundsPerExtraSymbol();
            return Optional.of(new BonusTrigger(BonusType.NORMAL, config.getBonusWildSymbolId(), normals.size(), normals,
                    rounds, config.getNormalMultiplier(), 0L, copy(grid)));
        }
        return Optional.empty();
    }

    private static List<GridPosition> positionsOf(int[][] grid, int symbol) {
        List<GridPosition> out = new ArrayList<>();
        for (int r = 0; r < grid.length; r++) {
            for (int c = 0; c < grid[r].length; c++) {
                if (grid[r][c] == symbol) out.add(new GridPosition(r, c));
            }
        }
        return out;
    }

    private static int[][] copy(int[][] grid) {
        int[][] out = new int[grid.length][];
        for (int r = 0; r < grid.length; r++) out[r] = grid[r].clone();
        return out;
    }
}
