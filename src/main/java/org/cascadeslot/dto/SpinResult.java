package org.cascadeslot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import org.cascadeslot.model.BonusTrigger;
import org.cascadeslot.model.CascadeStep;
import org.cascadeslot.model.GoldenSymbolInfo;
import org.cascadeslot.model.GridPosition;
import org.cascadeslot.model.WildTransition;
import org.cascadeslot.model.WinType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Résultat d'un spin. Les grilles sont en [ligne][colonne] ; une cellule wild vaut la sentinelle wild.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpinResult {
    private final String resultId;
    private final String sessionId;
    private final long betAmount;
    private final long totalWin;
    private final long rawWin;
    private final double compensation;
    private final boolean win;
    private final WinType winType;
    private final double multiplier;

    private final int cascadeCount;
    private final int totalRemoved;
    private final double finalMultiplier;
    private final List<CascadeStep> steps;
    private final int[][] initialGrid;
    private final int[][] finalGrid;

    private final List<GoldenSymbolInfo> goldenSymbols;
    private final List<WildTransition> wildTransitions;
    private final int finalWildCount;
    private final List<GridPosition> wildPositions;

    private final BonusTrigger bonusTrigger;
    private final Map<String, Object> metadata;
    private final Instant timestamp;
}
