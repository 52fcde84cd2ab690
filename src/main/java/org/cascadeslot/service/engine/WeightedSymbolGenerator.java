package org.cascadeslot.service.engine;

import org.cascadeslot.model.GoldenWildConfig;
import org.cascadeslot.service.random.RandomSource;

import java.util.List;

/**
 * Tirage pondéré par colonne (somme cumulée), plus le test de promotion dorée.
 */
public class WeightedSymbolGenerator {

    private final int[][] weights;
    private final int[] totals;
    private final GoldenWildConfig golden;
    private final RandomSource random;

    public WeightedSymbolGenerator(List<List<Integer>> symbolWeights, GoldenWildConfig golden, RandomSource random) {
        this.weights = new int[symbolWeights.size()][];
        this.totals = new int[symbolWeights.size()];
        for (int c = 0; c < symbolWeights.size(); c++) {
            List<Integer> row = symbolWeights.get(c);
            weights[c] = new int[row.size()];
            int sum = 0;
            for (int i = 0; i < row.size(); i++) {
                int w = row.get(i) == null ? 0 : Math.max(0, row.get(i));
                weights[c][i] = w;
                sum += w;
            }
            totals[c] = sum;
        }
        this.golden = golden;
        this.random = random;
    }

    public int nextSymbol(int column) {
        if (column < 0 || column >= weights.length) return 0;
        int total = totals[column];
        if (total <= 0) return 0;
        int v = random.nextInt(0, total);
        int cum = 0;
        int[] w = weights[column];
        for (int i = 0; i < w.length; i++) {
            cum += w[i];
            if (v < cum) return i;
        }
        return w.length - 1;
    }

    /** Second tirage, uniquement pour un symbole éligible : aucun aléa consommé sinon. */
    public boolean rollGolden(int symbol) {
        if (!golden.isEligible(symbol)) return false;
        return random.nextDouble() < golden.getGoldenProbability();
    }
}
