package org.cascadeslot.service.engine.match;

import org.cascadeslot.model.GridPosition;
import org.cascadeslot.model.MatchGroup;
import org.cascadeslot.service.engine.Grid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Groupes de cellules connexes (flood fill en profondeur) portant le même symbole ou un wild.
 * <p>
 * Un groupe qui démarre sur un wild prend le symbole du premier voisin ordinaire
 * (haut, bas, gauche, droite). Un groupe composé uniquement de wilds est compté comme symbole 0.
 * Les symboles bonus et les cellules vides ne rejoignent jamais un groupe.
 */
public class AdjacencyMatcher implements MatchEngine {

    static final int WILD_ONLY_SYMBOL = 0;

    private static final int[][] ORTHOGONAL = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
    private static final int[][] ALL_DIRECTIONS = {
            {-1, 0}, {1, 0}, {0, -1}, {0, 1},
            {-1, -1}, {-1, 1}, {1, -1}, {1, 1}
    };

    private final PayTable payTable;
    private final int symbolCount;
    private final int minMatch;
    private final int[][] directions;

    public AdjacencyMatcher(PayTable payTable, int symbolCount, int minMatch, boolean adjacentOnly) {
        this.payTable = payTable;
        this.symbolCount = symbolCount;
        this.minMatch = minMatch;
        this.directions = adjacentOnly ? ORTHOGONAL : ALL_DIRECTIONS;
    }

    @Override
    public List<MatchGroup> findMatches(Grid grid) {
        List<MatchGroup> groups = new ArrayList<>();
        boolean[][] visited = new boolean[grid.rows()][grid.columns()];

        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.columns(); c++) {
                if (visited[r][c] || !joinable(grid, r, c)) continue;

                int target = grid.isWild(r, c) ? resolveWildSeed(grid, r, c) : grid.symbolAt(r, c);
                List<GridPosition> component = flood(grid, r, c, target, visited);
                if (component.size() < minMatch) continue;

                long payout = payTable.payoutClamped(target, component.size());
                groups.add(new MatchGroup(target, component, component.size(), payout));
            }
        }
        return groups;
    }

    private boolean joinable(Grid grid, int r, int c) {
        if (grid.isWild(r, c)) return true;
        return grid.hasSymbol(r, c) && ordinary(grid.symbolAt(r, c));
    }

    private boolean ordinary(int symbol) {
        return symbol >= 0 && symbol < symbolCount;
    }

    private int resolveWildSeed(Grid grid, int r, int c) {
        for (int[] d : ORTHOGONAL) {
            int nr = r + d[0], nc = c + d[1];
            if (!grid.inBounds(nr, nc) || !grid.hasSymbol(nr, nc)) continue;
            int s = grid.symbolAt(nr, nc);
            if (ordinary(s)) return s;
        }
        return WILD_ONLY_SYMBOL;
    }

    private List<GridPosition> flood(Grid grid, int r0, int c0, int target, boolean[][] visited) {
        List<GridPosition> out = new ArrayList<>();
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{r0, c0});
        visited[r0][c0] = true;
        while (!stack.isEmpty()) {
            int[] cur = stack.pop();
            out.add(new GridPosition(cur[0], cur[1]));
            for (int[] d : directions) {
                int nr = cur[0] + d[0], nc = cur[1] + d[1];
                if (!grid.inBounds(nr, nc) || visited[nr][nc]) continue;
                if (!joinable(grid, nr, nc) || !grid.matches(nr, nc, target)) continue;
                visited[nr][nc] = true;
                stack.push(new int[]{nr, nc});
            }
        }
        return out;
    }
}
