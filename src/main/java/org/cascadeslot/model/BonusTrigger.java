package org.cascadeslot.model;

import java.util.List;

public record BonusTrigger(BonusType type,
                           int symbolId,
                           int symbolCount,
                           List<GridPosition> positions,
                           int freeRounds,
                           double multiplier,
                           long bonusPool,
                           int[][] triggerGrid) {
    public BonusTrigger {
        positions = List.copyOf(positions);
    }
}
