package org.cascadeslot.service.engine;

import org.cascadeslot.model.AlgorithmConfig;
import org.cascadeslot.model.BonusTriggerConfig;
import org.cascadeslot.model.CascadeConfig;
import org.cascadeslot.model.CascadeStep;
import org.cascadeslot.model.DrawLean;
import org.cascadeslot.model.GoldenSymbolInfo;
import org.cascadeslot.model.GridPosition;
import org.cascadeslot.model.MatchGroup;
import org.cascadeslot.model.MatchStrategy;
import org.cascadeslot.model.GoldenWildConfig;
import org.cascadeslot.model.WildTransition;
import org.cascadeslot.service.engine.match.AdjacencyMatcher;
import org.cascadeslot.service.engine.match.LeftmostLineMatcher;
import org.cascadeslot.service.engine.match.MatchEngine;
import org.cascadeslot.service.engine.match.PayTable;
import org.cascadeslot.service.random.RandomSource;
import org.cascadeslot.service.random.SeededRandomSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CascadeOrchestratorTest {

    private static final int W = -1;

    @Mock
    private RandomSource random;

    @Mock
    private MatchEngine mockMatcher;

    private final AlgorithmConfig algo = AlgorithmConfig.mahjongDefaults();
    private final PayTable payTable = new PayTable(algo.getPayTable());
    private final CascadeConfig cluster = CascadeConfig.defaults().toBuilder().matchStrategy(MatchStrategy.CLUSTER).build();
    private final GoldenWildConfig golden = GoldenWildConfig.defaults();

    // un poids par symbole : nextInt(0, 8) = v donne le symbole v
    private static List<List<Integer>> uniformWeights() {
        List<Integer> row = Collections.nCopies(8, 1);
        return List.of(row, row, row, row, row);
    }

    private CascadeOrchestrator clusterOrchestrator(RandomSource rnd, GoldenWildConfig g) {
        WeightedSymbolGenerator gen = new WeightedSymbolGenerator(uniformWeights(), g, rnd);
        return new CascadeOrchestrator(cluster, BonusTriggerConfig.disabled(), W, gen,
                new AdjacencyMatcher(payTable, 8, 3, true), new WildLifecycleManager(), rnd);
    }

    private CascadeOrchestrator waysOrchestrator(RandomSource rnd) {
        CascadeConfig ways = CascadeConfig.defaults();
        WeightedSymbolGenerator gen = new WeightedSymbolGenerator(algo.getSymbolWeights(), golden, rnd);
        return new CascadeOrchestrator(ways, BonusTriggerConfig.defaults(), W, gen,
                new LeftmostLineMatcher(payTable), new WildLifecycleManager(), rnd);
    }

    // -------------------------------------------------------
    // TEST 1 — trois 0 en colonne 0 : une étape, gain 20 x multiplicateur[1]
    // -------------------------------------------------------
    @Test
    void run_troisZerosVerticaux_uneEtapeGainVingt() {
        Grid grid = Grid.of(new int[][]{
                {0, 1, 2, 3, 4},
                {0, 2, 3, 4, 5},
                {0, 3, 4, 5, 6},
                {1, 4, 5, 6, 7}
        }, W);
        when(random.nextInt(0, 8)).thenReturn(5, 6, 7);

        CascadeOutcome out = clusterOrchestrator(random, golden).run(grid, new ArrayList<>());

        assertThat(out.getCascadeCount()).isEqualTo(1);
        CascadeStep step = out.getSteps().get(0);
        assertThat(step.stepNumber()).isEqualTo(1);
        assertThat(step.groups()).hasSize(1);
        assertThat(step.groups().get(0).count()).isEqualTo(3);
        assertThat(step.multiplier()).isEqualTo(1.0);
        assertThat(step.stepWin()).isEqualTo(20L);
        assertThat(out.getTotalUnits()).isEqualTo(20L);
        assertThat(out.getTotalRemoved()).isEqualTo(3);

        assertThat(step.gridAfterRemove()[0][0]).isEqualTo(W);
        assertThat(step.gridAfter()[0]).containsExactly(5, 1, 2, 3, 4);
        assertThat(step.gridAfter()[1]).containsExactly(6, 2, 3, 4, 5);
        assertThat(step.gridAfter()[2]).containsExactly(7, 3, 4, 5, 6);
        assertThat(step.gridAfter()[3]).containsExactly(1, 4, 5, 6, 7);
        assertThat(out.getInitialGrid()[0][0]).isZero();
        assertThat(grid.emptyCount()).isZero();
    }

    // -------------------------------------------------------
    // TEST 2 — doré en (1,2) pris à l'étape 1 : wild, pas vide
    // -------------------------------------------------------
    @Test
    void run_doreConsommeEtapeUn_devientWildEtReste() {
        Grid grid = Grid.of(new int[][]{
                {1, 2, 3, 4, 5},
                {0, 0, 0, 5, 6},
                {2, 3, 4, 6, 7},
                {3, 4, 5, 7, 1}
        }, W);
        List<GoldenSymbolInfo> goldens = new ArrayList<>();
        goldens.add(new GoldenSymbolInfo(new GridPosition(1, 2), 0));
        grid.setGolden(1, 2, 0);
        when(random.nextInt(0, 8)).thenReturn(6, 7);

        CascadeOutcome out = clusterOrchestrator(random, golden).run(grid, goldens);

        assertThat(out.getWildTransitions()).contains(
                new WildTransition(1, new GridPosition(1, 2), 0, true, false, false));
        assertThat(out.getCascadeCount()).isEqualTo(1);
        assertThat(out.getTotalRemoved()).isEqualTo(2);
        assertThat(grid.isWild(1, 2)).isTrue();
        assertThat(out.getFinalWildPositions()).containsExactly(new GridPosition(1, 2));
        assertThat(out.getGoldenSymbols().get(0).isBecameWild()).isTrue();
        assertThat(out.getFinalGrid()[1]).containsExactly(1, 2, W, 5, 6);
        assertThat(out.getFinalGrid()[0]).containsExactly(6, 7, 3, 4, 5);
        // remplissage : jamais de tirage doré
        verify(random, never()).nextDouble();
    }

    // -------------------------------------------------------
    // TEST 3 — la boucle s'arrête à maxCascades
    // -------------------------------------------------------
    @Test
    void run_sArreteAMaxCascades() {
        CascadeConfig cfg = CascadeConfig.defaults().toBuilder().maxCascades(4).build();
        MatchGroup always = new MatchGroup(0, List.of(new GridPosition(0, 0)), 1, 1L);
        when(mockMatcher.findMatches(any())).thenReturn(List.of(always));
        when(random.nextInt(anyInt(), anyInt())).thenReturn(0);
        WeightedSymbolGenerator gen = new WeightedSymbolGenerator(uniformWeights(), golden, random);
        CascadeOrchestrator orch = new CascadeOrchestrator(cfg, BonusTriggerConfig.disabled(), W, gen,
                mockMatcher, new WildLifecycleManager(), random);

        CascadeOutcome out = orch.run(Grid.of(new int[5][4], W), new ArrayList<>());

        assertThat(out.getCascadeCount()).isEqualTo(4);
        // 1 + 2 + 3 + 5
        assertThat(out.getTotalUnits()).isEqualTo(11L);
        assertThat(out.getFinalMultiplier()).isEqualTo(5.0);
        verify(mockMatcher, times(4)).findMatches(any());
    }

    // -------------------------------------------------------
    // TEST 4 — orientation vers le gain : nouvelle grille si la première ne paie pas
    // -------------------------------------------------------
    @Test
    void run_orienteVersLeGain_retireUneGrilleSansGain() {
        MatchGroup g = new MatchGroup(0, List.of(new GridPosition(0, 0)), 1, 0L);
        when(mockMatcher.findMatches(any())).thenReturn(List.of(), List.of(g), List.of(g), List.of());
        when(random.nextInt(anyInt(), anyInt())).thenReturn(3);
        CascadeConfig cfg = CascadeConfig.defaults();
        WeightedSymbolGenerator gen = new WeightedSymbolGenerator(uniformWeights(),
                golden.toBuilder().enabled(false).build(), random);
        CascadeOrchestrator orch = new CascadeOrchestrator(cfg, BonusTriggerConfig.disabled(), W, gen,
                mockMatcher, new WildLifecycleManager(), random);

        CascadeOutcome out = orch.run(DrawLean.TOWARD_WIN);

        assertThat(out.getCascadeCount()).isEqualTo(1);
        verify(mockMatcher, times(4)).findMatches(any());
        // deux grilles initiales de 20 cellules + 1 remplissage
        verify(random, times(41)).nextInt(anyInt(), anyInt());
    }

    @Test
    void run_orienteVersLaPerte_garderLaPremiereGrilleSansGain() {
        when(mockMatcher.findMatches(any())).thenReturn(List.of());
        when(random.nextInt(anyInt(), anyInt())).thenReturn(3);
        WeightedSymbolGenerator gen = new WeightedSymbolGenerator(uniformWeights(),
                golden.toBuilder().enabled(false).build(), random);
        CascadeOrchestrator orch = new CascadeOrchestrator(CascadeConfig.defaults(), BonusTriggerConfig.disabled(), W,
                gen, mockMatcher, new WildLifecycleManager(), random);

        CascadeOutcome out = orch.run(DrawLean.TOWARD_LOSS);

        assertThat(out.getCascadeCount()).isZero();
        assertThat(out.hasWin()).isFalse();
        verify(mockMatcher, times(2)).findMatches(any());
        verify(random, times(20)).nextInt(anyInt(), anyInt());
    }

    // -------------------------------------------------------
    // TEST 5 — grille initiale : bonus avant le tirage pondéré
    // -------------------------------------------------------
    @Test
    void drawInitialGrid_tirageBonusAvantLeSymbole() {
        WeightedSymbolGenerator gen = new WeightedSymbolGenerator(uniformWeights(), golden, random);
        CascadeOrchestrator orch = new CascadeOrchestrator(CascadeConfig.defaults(), BonusTriggerConfig.defaults(), W,
                gen, mockMatcher, new WildLifecycleManager(), random);
        when(random.nextDouble()).thenReturn(0.005);

        Grid g = orch.drawInitialGrid(new ArrayList<>());

        for (int r = 0; r < g.rows(); r++) {
            for (int c = 0; c < g.columns(); c++) {
                assertThat(g.symbolAt(r, c)).isEqualTo(10);
            }
        }
        verify(random, never()).nextInt(anyInt(), anyInt());
    }

    @Test
    void drawInitialGrid_symboleDoreEnregistre() {
        WeightedSymbolGenerator gen = new WeightedSymbolGenerator(uniformWeights(), golden, random);
        CascadeOrchestrator orch = new CascadeOrchestrator(CascadeConfig.defaults(), BonusTriggerConfig.disabled(), W,
                gen, mockMatcher, new WildLifecycleManager(), random);
        // symbole 2 partout, éligible ; premier tirage doré réussi puis échecs
        when(random.nextInt(0, 8)).thenReturn(2);
        when(random.nextDouble()).thenReturn(0.01, 0.9);

        List<GoldenSymbolInfo> goldens = new ArrayList<>();
        Grid g = orch.drawInitialGrid(goldens);

        assertThat(goldens).hasSize(1);
        assertThat(goldens.get(0).getInitialPosition()).isEqualTo(new GridPosition(0, 0));
        assertThat(goldens.get(0).getOriginalSymbol()).isEqualTo(2);
        assertThat(goldens.get(0).getGoldenDisplayId()).isEqualTo(18);
        assertThat(g.goldenIndex(0, 0)).isZero();
        assertThat(g.goldenIndex(0, 1)).isEqualTo(Grid.NO_GOLDEN);
    }

    // -------------------------------------------------------
    // TEST 6 — propriétés sur des spins aléatoires réels
    // -------------------------------------------------------
    @Test
    void run_proprietesSurCentGrillesAleatoires() {
        for (long seed = 1; seed <= 100; seed++) {
            CascadeOrchestrator orch = waysOrchestrator(new SeededRandomSource(seed));
            List<GoldenSymbolInfo> goldens = new ArrayList<>();
            Grid grid = orch.drawInitialGrid(goldens);

            CascadeOutcome out = orch.run(grid, goldens);

            // conservation : aucune case vide après remplissage
            assertThat(grid.emptyCount()).isZero();
            assertThat(out.getCascadeCount()).isLessThanOrEqualTo(10);
            for (CascadeStep s : out.getSteps()) {
                assertThat(s.groups()).allSatisfy(m -> assertThat(m.count()).isGreaterThanOrEqualTo(3));
            }
            long toWild = out.getWildTransitions().stream().filter(WildTransition::toWild).count();
            long converted = out.getGoldenSymbols().stream().filter(GoldenSymbolInfo::isBecameWild).count();
            assertThat(toWild).isEqualTo(converted).isLessThanOrEqualTo(goldens.size());
            long consumed = out.getWildTransitions().stream().filter(WildTransition::disappeared).count();
            assertThat(out.getFinalWildPositions()).hasSize((int) (toWild - consumed));
            for (GridPosition p : out.getFinalWildPositions()) {
                assertThat(grid.isWild(p.row(), p.reel())).isTrue();
            }
        }
    }

    // -------------------------------------------------------
    // TEST 7 — même graine, même résultat
    // -------------------------------------------------------
    @Test
    void run_memeGraine_memeResultat() {
        CascadeOutcome a = waysOrchestrator(new SeededRandomSource(99L)).run(DrawLean.NONE);
        CascadeOutcome b = waysOrchestrator(new SeededRandomSource(99L)).run(DrawLean.NONE);

        assertThat(a.getInitialGrid()).isDeepEqualTo(b.getInitialGrid());
        assertThat(a.getFinalGrid()).isDeepEqualTo(b.getFinalGrid());
        assertThat(a.getTotalUnits()).isEqualTo(b.getTotalUnits());
        assertThat(a.getCascadeCount()).isEqualTo(b.getCascadeCount());
    }

    @Test
    void run_grilleToutDore_lesWildsRestentPuisSontConsommes() {
        GoldenWildConfig allGolden = GoldenWildConfig.builder()
                .goldenProbability(1.0)
                .goldenEnabledSymbols(Set.of(0))
                .build();
        List<List<Integer>> onlyZero = Collections.nCopies(5, List.of(1));
        SeededRandomSource rnd = new SeededRandomSource(5L);
        CascadeConfig cfg = CascadeConfig.defaults().toBuilder().maxCascades(2).build();
        CascadeOrchestrator orch = new CascadeOrchestrator(cfg, BonusTriggerConfig.disabled(), W,
                new WeightedSymbolGenerator(onlyZero, allGolden, rnd),
                new LeftmostLineMatcher(new PayTable(Map.of(0, List.of(0L, 0L, 20L, 60L, 200L)))),
                new WildLifecycleManager(), rnd);

        CascadeOutcome out = orch.run(DrawLean.NONE);

        // étape 1 : les 20 dorés deviennent wilds, rien n'est effacé ; étape 2 : les 20 wilds partent
        assertThat(out.getCascadeCount()).isEqualTo(2);
        assertThat(out.getSteps().get(0).removedCount()).isZero();
        assertThat(out.getSteps().get(1).removedCount()).isEqualTo(20);
        assertThat(out.getWildTransitions().stream().filter(WildTransition::toWild).count()).isEqualTo(20);
        assertThat(out.getWildTransitions().stream().filter(WildTransition::disappeared).count()).isEqualTo(20);
        assertThat(out.getFinalWildPositions()).isEmpty();
        // 200 * 20 / 5 = 800 par étape, x1 puis x2
        assertThat(out.getTotalUnits()).isEqualTo(800L + 1600L);
    }
}
