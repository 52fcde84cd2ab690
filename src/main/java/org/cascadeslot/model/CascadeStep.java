package org.cascadeslot.model;

import java.util.List;

public record CascadeStep(int stepNumber,
                          List<MatchGroup> groups,
                          long stepWin,
                          double multiplier,
                          int removedCount,
                          int[][] gridBefore,
                          int[][] gridAfterRemove,
                          int[][] gridAfter) {
    public CascadeStep {
        groups = List.copyOf(groups);
    }
}
