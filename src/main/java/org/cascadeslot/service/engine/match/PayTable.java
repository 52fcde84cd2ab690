package org.cascadeslot.service.engine.match;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;

/** Copie figée de la table de gains : symbole → gains pour 1..n symboles, en unités. */
public class PayTable {

    private final TreeMap<Integer, long[]> table = new TreeMap<>();

    public PayTable(Map<Integer, List<Long>> source) {
        if (source == null) return;
        for (Map.Entry<Integer, List<Long>> e : source.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            long[] row = new long[e.getValue().size()];
            for (int i = 0; i < row.length; i++) {
                Long v = e.getValue().get(i);
                row[i] = v == null ? 0L : v;
            }
            table.put(e.getKey(), row);
        }
    }

    /** Ids en ordre croissant. */
    public NavigableSet<Integer> symbols() {
        return Collections.unmodifiableNavigableSet(table.navigableKeySet());
    }

    /** Gain pour {@code count} symboles, borné à la dernière entrée de la ligne. 0 si symbole absent. */
    public long payoutClamped(int symbol, int count) {
        long[] row = table.get(symbol);
        if (row == null || row.length == 0 || count <= 0) return 0L;
        return row[Math.min(count, row.length) - 1];
    }

    /** Gain exact pour {@code n} ; 0 si la ligne est plus courte. */
    public long entry(int symbol, int n) {
        long[] row = table.get(symbol);
        if (row == null || n <= 0 || n > row.length) return 0L;
        return row[n - 1];
    }
}
