package org.cascadeslot.model;

import java.util.List;

/**
 * Gain "1024 ways" : {@code length} colonnes consécutives depuis la gauche,
 * {@code count} cellules au total.
 */
public record LineMatch(int symbolId, List<GridPosition> positions, int length, int count, long payout) {
    public LineMatch {
        positions = List.copyOf(positions);
    }

    public MatchGroup toGroup() {
        return new MatchGroup(symbolId, positions, count, payout);
    }
}
