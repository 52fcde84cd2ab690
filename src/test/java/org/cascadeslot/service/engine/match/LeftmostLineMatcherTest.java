package org.cascadeslot.service.engine.match;

import org.cascadeslot.model.LineMatch;
import org.cascadeslot.model.MatchGroup;
import org.cascadeslot.service.engine.Grid;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LeftmostLineMatcherTest {

    private static final int W = -1;

    private static PayTable table() {
        Map<Integer, List<Long>> pay = new LinkedHashMap<>();
        pay.put(W, List.of(0L, 0L, 999L));
        pay.put(0, List.of(0L, 0L, 20L, 60L, 200L));
        pay.put(1, List.of(0L, 0L, 25L, 75L, 250L));
        pay.put(2, List.of(0L, 0L, 30L));
        return new PayTable(pay);
    }

    private final LeftmostLineMatcher matcher = new LeftmostLineMatcher(table());

    // -------------------------------------------------------
    // TEST 1 — trois colonnes consécutives depuis la gauche
    // -------------------------------------------------------
    @Test
    void findLines_troisColonnes_gainProportionnelAuNombreDeCellules() {
        Grid g = Grid.of(new int[][]{
                {0, 0, 0, 5, 6},
                {3, 0, 4, 5, 6},
                {4, 5, 6, 7, 3},
                {5, 6, 7, 3, 4}
        }, W);

        List<LineMatch> lines = matcher.findLines(g);

        assertThat(lines).hasSize(1);
        LineMatch m = lines.get(0);
        assertThat(m.symbolId()).isZero();
        assertThat(m.length()).isEqualTo(3);
        assertThat(m.count()).isEqualTo(4);
        // 20 * 4 / 3
        assertThat(m.payout()).isEqualTo(26L);
    }

    // -------------------------------------------------------
    // TEST 2 — le wild remplace n'importe quel symbole, la sentinelle n'est pas candidate
    // -------------------------------------------------------
    @Test
    void findLines_wildSubstitueEtSentinelleIgnoree() {
        Grid g = Grid.of(new int[][]{
                {1, W, 1, 1, 7},
                {3, 4, 5, 6, 7},
                {4, 5, 6, 7, 3}
        }, W);

        List<LineMatch> lines = matcher.findLines(g);

        assertThat(lines).extracting(LineMatch::symbolId).containsExactly(1);
        assertThat(lines.get(0).length()).isEqualTo(4);
        assertThat(lines.get(0).count()).isEqualTo(4);
        assertThat(lines.get(0).payout()).isEqualTo(75L);
    }

    // -------------------------------------------------------
    // TEST 3 — rien en colonne 0 : pas de gain même avec 4 colonnes ensuite
    // -------------------------------------------------------
    @Test
    void findLines_absentDeLaPremiereColonne_aucunGain() {
        Grid g = Grid.of(new int[][]{
                {3, 0, 0, 0, 0},
                {4, 5, 6, 7, 3},
                {5, 6, 7, 3, 4}
        }, W);

        assertThat(matcher.findLines(g)).isEmpty();
    }

    // -------------------------------------------------------
    // TEST 4 — plusieurs symboles paient en même temps, ordre croissant
    // -------------------------------------------------------
    @Test
    void findMatches_plusieursSymbolesPaientEnsemble() {
        Grid g = Grid.of(new int[][]{
                {1, 1, 1, 4, 5},
                {0, 0, 0, 0, 6},
                {4, 5, 6, 7, 3}
        }, W);

        List<MatchGroup> groups = matcher.findMatches(g);

        assertThat(groups).extracting(MatchGroup::symbolId).containsExactly(0, 1);
        assertThat(groups.get(0).payout()).isEqualTo(60L);
        assertThat(groups.get(1).payout()).isEqualTo(25L);
    }

    // -------------------------------------------------------
    // TEST 5 — ligne de gains plus courte que la longueur : gain nul mais groupe retenu
    // -------------------------------------------------------
    @Test
    void findLines_tableTropCourte_gainNul() {
        Grid g = Grid.of(new int[][]{
                {2, 2, 2, 2, 5},
                {3, 4, 5, 6, 7},
                {4, 5, 6, 7, 3}
        }, W);

        List<LineMatch> lines = matcher.findLines(g);

        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).length()).isEqualTo(4);
        assertThat(lines.get(0).payout()).isZero();
    }

    @Test
    void findLines_deuxColonnesSeulement_pasDeGain() {
        Grid g = Grid.of(new int[][]{
                {1, 1, 3, 4, 5},
                {3, 4, 5, 6, 7},
                {4, 5, 6, 7, 3}
        }, W);

        assertThat(matcher.findLines(g)).isEmpty();
    }
}
