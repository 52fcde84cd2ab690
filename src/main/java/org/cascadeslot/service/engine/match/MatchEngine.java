package org.cascadeslot.service.engine.match;

import org.cascadeslot.model.MatchGroup;
import org.cascadeslot.service.engine.Grid;

import java.util.List;

public interface MatchEngine {

    /** Groupes gagnants de la grille, sans la modifier. Liste vide si rien ne paie. */
    List<MatchGroup> findMatches(Grid grid);
}
