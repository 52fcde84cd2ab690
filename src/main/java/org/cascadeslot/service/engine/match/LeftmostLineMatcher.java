package org.cascadeslot.service.engine.match;

import org.cascadeslot.model.GridPosition;
import org.cascadeslot.model.LineMatch;
import org.cascadeslot.model.MatchGroup;
import org.cascadeslot.service.engine.Grid;

import java.util.ArrayList;
import java.util.List;

/**
 * 1024 ways : pour chaque symbole de la table, colonnes consécutives depuis la gauche
 * contenant le symbole ou un wild. Tous les symboles qualifiés paient en même temps.
 * <p>
 * gain = base[longueur - 1] × cellules / longueur
 */
public class LeftmostLineMatcher implements MatchEngine {

    public static final int MIN_LENGTH = 3;

    private final PayTable payTable;

    public LeftmostLineMatcher(PayTable payTable) {
        this.payTable = payTable;
    }

    @Override
    public List<MatchGroup> findMatches(Grid grid) {
        List<MatchGroup> groups = new ArrayList<>();
        for (LineMatch m : findLines(grid)) groups.add(m.toGroup());
        return groups;
    }

    public List<LineMatch> findLines(Grid grid) {
        List<LineMatch> out = new ArrayList<>();
        for (int symbol : payTable.symbols()) {
            if (symbol == grid.wildSymbol()) continue;
            LineMatch m = walk(grid, symbol);
            if (m != null) out.add(m);
        }
        return out;
    }

    private LineMatch walk(Grid grid, int symbol) {
        List<GridPosition> positions = new ArrayList<>();
        int length = 0;
        for (int c = 0; c < grid.columns(); c++) {
            int before = positions.size();
            for (int r = 0; r < grid.rows(); r++) {
                if (grid.matches(r, c, symbol)) positions.add(new GridPosition(r, c));
            }
            if (positions.size() == before) break;
            length++;
        }
        if (length < MIN_LENGTH) return null;

        int count = positions.size();
        long payout = (long) (payTable.entry(symbol, length) * (double) count / length);
        return new LineMatch(symbol, positions, length, count, payout);
    }
}
