package org.cascadeslot.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

@Getter
@ToString
@Builder(toBuilder = true)
public class GoldenWildConfig {
    @Builder.Default
    private final boolean enabled = true;
    private final double goldenProbability;
    private final Set<Integer> goldenEnabledSymbols;
    @Builder.Default
    private final int wildSymbolId = SymbolIds.DEFAULT_WILD;

    public boolean isEligible(int symbol) {
        return enabled && goldenEnabledSymbols != null && goldenEnabledSymbols.contains(symbol);
    }

    public static GoldenWildConfig defaults() {
        return GoldenWildConfig.builder()
                .goldenProbability(0.12)
                .goldenEnabledSymbols(Set.of(0, 1, 2, 3, 4))
                .build();
    }
}
