package org.cascadeslot.model;

public record WildTransition(int step, GridPosition position, int fromSymbol,
                             boolean toWild, boolean usedInMatch, boolean disappeared) {

    public static WildTransition converted(int step, GridPosition position, int fromSymbol) {
        return new WildTransition(step, position, fromSymbol, true, false, false);
    }

    public static WildTransition consumed(int step, GridPosition position, int fromSymbol) {
        return new WildTransition(step, position, fromSymbol, false, true, true);
    }
}
