package org.cascadeslot.service.engine;

import org.cascadeslot.model.GridPosition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wilds actifs pendant un spin : position, symbole d'origine, et wilds créés à l'étape en cours.
 * Vit le temps d'un appel, jamais partagé.
 */
public class WildTracker {

    private final Set<GridPosition> activeWilds = new LinkedHashSet<>();
    private final Map<GridPosition, Integer> wildSources = new HashMap<>();
    private final Set<GridPosition> newWilds = new HashSet<>();

    public void beginStep() {
        newWilds.clear();
    }

    public void register(GridPosition pos, int fromSymbol) {
        activeWilds.add(pos);
        wildSources.put(pos, fromSymbol);
        newWilds.add(pos);
    }

    public boolean isActive(GridPosition pos) {
        return activeWilds.contains(pos);
    }

    public boolean isNew(GridPosition pos) {
        return newWilds.contains(pos);
    }

    /** Retire le wild et renvoie son symbole d'origine (null s'il n'était pas suivi). */
    public Integer consume(GridPosition pos) {
        activeWilds.remove(pos);
        newWilds.remove(pos);
        return wildSources.remove(pos);
    }

    /** Réindexe les wilds déplacés par la gravité. */
    public void rekey(List<Grid.CellMove> moves) {
        if (moves.isEmpty()) return;
        List<GridPosition> targets = new ArrayList<>();
        List<Integer> sources = new ArrayList<>();
        List<Boolean> fresh = new ArrayList<>();
        for (Grid.CellMove m : moves) {
            GridPosition from = new GridPosition(m.fromRow(), m.column());
            if (!activeWilds.contains(from)) continue;
            targets.add(new GridPosition(m.toRow(), m.column()));
            sources.add(wildSources.get(from));
            fresh.add(newWilds.contains(from));
            activeWilds.remove(from);
            wildSources.remove(from);
            newWilds.remove(from);
        }
        for (int i = 0; i < targets.size(); i++) {
            GridPosition to = targets.get(i);
            activeWilds.add(to);
            wildSources.put(to, sources.get(i));
            if (fresh.get(i)) newWilds.add(to);
        }
    }

    public List<GridPosition> activeWilds() {
        return new ArrayList<>(activeWilds);
    }

    public Integer sourceOf(GridPosition pos) {
        return wildSources.get(pos);
    }

    public int size() {
        return activeWilds.size();
    }
}
