package org.cascadeslot.service.engine;

import lombok.Builder;
import lombok.Getter;
import org.cascadeslot.model.CascadeStep;
import org.cascadeslot.model.GoldenSymbolInfo;
import org.cascadeslot.model.GridPosition;
import org.cascadeslot.model.WildTransition;

import java.util.List;

/** Résultat brut d'une chaîne de cascades, gains en unités de la table. */
@Getter
@Builder
public class CascadeOutcome {
    private final int[][] initialGrid;
    private final int[][] finalGrid;
    private final List<CascadeStep> steps;
    private final long totalUnits;
    private final int cascadeCount;
    private final int totalRemoved;
    private final double finalMultiplier;
    private final List<GoldenSymbolInfo> goldenSymbols;
    private final List<WildTransition> wildTransitions;
    private final List<GridPosition> finalWildPositions;

    public boolean hasWin() {
        return totalUnits > 0;
    }
}
