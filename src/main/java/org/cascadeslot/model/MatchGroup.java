package org.cascadeslot.model;

import java.util.List;

/** Groupe retiré lors d'une étape ; payout exprimé en unités de la table de gains. */
public record MatchGroup(int symbolId, List<GridPosition> positions, int count, long payout) {
    public MatchGroup {
        positions = List.copyOf(positions);
    }
}
