package org.cascadeslot.service.engine;

import lombok.extern.slf4j.Slf4j;
import org.cascadeslot.model.GoldenSymbolInfo;
import org.cascadeslot.model.GridPosition;
import org.cascadeslot.model.WildTransition;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Cycle de vie doré → wild → consommé.
 * <ol>
 *   <li>{@link #convertGoldens} : avant tout effacement, chaque cellule dorée marquée devient un wild
 *       et sort des cellules à effacer ;</li>
 *   <li>{@link #removeMarked} : les cellules restantes sont vidées ; un wild effacé est consommé.</li>
 * </ol>
 * Une cellule dorée ne se convertit qu'une fois : la conversion retire sa marque dorée.
 */
@Slf4j
public class WildLifecycleManager {

    public List<WildTransition> convertGoldens(int step, Grid grid, Set<GridPosition> marked,
                                               List<GoldenSymbolInfo> goldens, WildTracker tracker) {
        List<WildTransition> out = new ArrayList<>();
        Iterator<GridPosition> it = marked.iterator();
        while (it.hasNext()) {
            GridPosition p = it.next();
            int idx = grid.goldenIndex(p.row(), p.reel());
            if (idx == Grid.NO_GOLDEN) continue;
            GoldenSymbolInfo info = goldens.get(idx);
            grid.clearGolden(p.row(), p.reel());
            if (info.isBecameWild()) continue;

            int from = info.getOriginalSymbol();
            grid.setWild(p.row(), p.reel());
            info.markBecameWild();
            tracker.register(p, from);
            out.add(WildTransition.converted(step, p, from));
            it.remove();
            log.debug("Étape {} : symbole doré {} en {} devenu wild", step, from, p);
        }
        return out;
    }

    public List<WildTransition> removeMarked(int step, Grid grid, Set<GridPosition> marked, WildTracker tracker) {
        List<WildTransition> out = new ArrayList<>();
        for (GridPosition p : marked) {
            if (grid.isWild(p.row(), p.reel())) {
                Integer src = tracker.consume(p);
                out.add(WildTransition.consumed(step, p, src == null ? grid.wildSymbol() : src));
            }
            grid.clear(p.row(), p.reel());
        }
        return out;
    }
}
