package org.cascadeslot.model;

public final class SymbolIds {
    private SymbolIds(){}

    public static final int DEFAULT_WILD = -1;
    public static final int BONUS_WILD = 9;
    public static final int SUPER_BONUS = 10;
    public static final int GOLDEN_OFFSET = 16;

    // purement pour le rendu : 16 + id de base
    public static int goldenDisplayId(int baseSymbol) {
        return GOLDEN_OFFSET + baseSymbol;
    }
}
