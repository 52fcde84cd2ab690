package org.cascadeslot.model;

import lombok.Getter;

/**
 * Symbole doré tiré dans la grille initiale. {@code becameWild} passe à vrai
 * une seule fois, quand le symbole est pris dans un groupe.
 */
@Getter
public class GoldenSymbolInfo {
    private final GridPosition initialPosition;
    private final int originalSymbol;
    private final int goldenDisplayId;
    private final boolean golden = true;
    private boolean becameWild;

    public GoldenSymbolInfo(GridPosition initialPosition, int originalSymbol) {
        this.initialPosition = initialPosition;
        this.originalSymbol = originalSymbol;
        this.goldenDisplayId = SymbolIds.goldenDisplayId(originalSymbol);
    }

    public void markBecameWild() {
        this.becameWild = true;
    }
}
