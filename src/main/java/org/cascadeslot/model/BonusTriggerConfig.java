package org.cascadeslot.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Symboles bonus posés dans la grille initiale et règles de déclenchement des tours gratuits.
 * Le super bonus est prioritaire sur le bonus normal.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class BonusTriggerConfig {
    @Builder.Default private final boolean enabled = true;

    @Builder.Default private final int bonusWildSymbolId = SymbolIds.BONUS_WILD;
    @Builder.Default private final double normalSpawnProbability = 0.02;
    @Builder.Default private final int normalMinCount = 3;
    @Builder.Default private final int normalBaseRounds = 15;
    @Builder.Default private final int roundsPerExtraSymbol = 5;
    @Builder.Default private final double normalMultiplier = 1.5;

    @Builder.Default private final int superBonusSymbolId = SymbolIds.SUPER_BONUS;
    @Builder.Default private final double superSpawnProbability = 0.01;
    @Builder.Default private final int superMinCount = 5;
    @Builder.Default private final int superRounds = 30;
    @Builder.Default private final double superMultiplier = 3.0;
    @Builder.Default private final long superBonusPool = 10_000;

    public static BonusTriggerConfig defaults() {
        return BonusTriggerConfig.builder().build();
    }

    public static BonusTriggerConfig disabled() {
        return BonusTriggerConfig.builder().enabled(false).build();
    }
}
