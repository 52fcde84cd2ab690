package org.cascadeslot.service.engine;

import lombok.extern.slf4j.Slf4j;
import org.cascadeslot.model.BonusTriggerConfig;
import org.cascadeslot.model.CascadeConfig;
import org.cascadeslot.model.CascadeStep;
import org.cascadeslot.model.DrawLean;
import org.cascadeslot.model.GoldenSymbolInfo;
import org.cascadeslot.model.GridPosition;
import org.cascadeslot.model.MatchGroup;
import org.cascadeslot.model.WildTransition;
import org.cascadeslot.service.engine.match.MatchEngine;
import org.cascadeslot.service.random.RandomSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Boucle de cascade : MATCHING → REMOVING → REFILLING → MATCHING … → IDLE.
 * S'arrête quand une étape ne trouve aucun groupe ou après {@code maxCascades} étapes.
 * Sans état entre deux appels.
 */
@Slf4j
public class CascadeOrchestrator {

    private final CascadeConfig cascade;
    private final BonusTriggerConfig bonus;
    private final WeightedSymbolGenerator generator;
    private final MatchEngine matcher;
    private final WildLifecycleManager wilds;
    private final RandomSource random;
    private final int wildSymbol;

    public CascadeOrchestrator(CascadeConfig cascade, BonusTriggerConfig bonus, int wildSymbol,
                               WeightedSymbolGenerator generator, MatchEngine matcher,
                               WildLifecycleManager wilds, RandomSource random) {
        this.cascade = cascade;
        this.bonus = bonus;
        this.wildSymbol = wildSymbol;
        this.generator = generator;
        this.matcher = matcher;
        this.wilds = wilds;
        this.random = random;
    }

    public CascadeOutcome run(DrawLean lean) {
        DrawLean l = lean == null ? DrawLean.NONE : lean;
        int attempts = l == DrawLean.NONE ? 1 : cascade.getLeanAttempts();

        Grid grid = null;
        List<GoldenSymbolInfo> goldens = null;
        for (int i = 0; i < attempts; i++) {
            goldens = new ArrayList<>();
            grid = drawInitialGrid(goldens);
            if (l == DrawLean.NONE) break;
            boolean hit = !matcher.findMatches(grid).isEmpty();
            if (hit == (l == DrawLean.TOWARD_WIN)) break;
        }
        return run(grid, goldens);
    }

    /** Déroule la cascade depuis une grille donnée ; {@code goldens} est indexé par la couche dorée de la grille. */
    public CascadeOutcome run(Grid grid, List<GoldenSymbolInfo> goldens) {
        int[][] initial = grid.snapshot();
        WildTracker tracker = new WildTracker();
        List<CascadeStep> steps = new ArrayList<>();
        List<WildTransition> transitions = new ArrayList<>();

        CascadePhase phase = CascadePhase.MATCHING;
        int step = 0;
        long totalUnits = 0;
        int totalRemoved = 0;
        double lastMultiplier = 1.0;

        List<MatchGroup> groups = List.of();
        Set<GridPosition> marked = Set.of();
        int[][] before = null, afterRemove = null;

        while (phase != CascadePhase.IDLE) {
            switch (phase) {
                case MATCHING -> {
                    groups = step >= cascade.getMaxCascades() ? List.of() : matcher.findMatches(grid);
                    if (groups.isEmpty()) {
                        phase = CascadePhase.IDLE;
                    } else {
                        step++;
                        before = grid.snapshot();
                        phase = CascadePhase.REMOVING;
                    }
                }
                case REMOVING -> {
                    tracker.beginStep();
                    marked = new LinkedHashSet<>();
                    for (MatchGroup g : groups) marked.addAll(g.positions());
                    transitions.addAll(wilds.convertGoldens(step, grid, marked, goldens, tracker));
                    transitions.addAll(wilds.removeMarked(step, grid, marked, tracker));
                    afterRemove = grid.snapshot();
                    phase = CascadePhase.REFILLING;
                }
                case REFILLING -> {
                    refill(grid, tracker);
                    double mult = cascade.multiplierForStep(step);
                    long sum = 0;
                    for (MatchGroup g : groups) sum += g.payout();
                    long stepWin = (long) (sum * mult);
                    totalUnits += stepWin;
                    totalRemoved += marked.size();
                    lastMultiplier = mult;
                    steps.add(new CascadeStep(step, groups, stepWin, mult, marked.size(),
                            before, afterRemove, grid.snapshot()));
                    log.debug("Cascade étape {} : {} groupe(s), {} retirée(s), gain {} x{}",
                            step, groups.size(), marked.size(), stepWin, mult);
                    phase = CascadePhase.MATCHING;
                }
                default -> phase = CascadePhase.IDLE;
            }
        }

        return CascadeOutcome.builder()
                .initialGrid(initial)
                .finalGrid(grid.snapshot())
                .steps(steps)
                .totalUnits(totalUnits)
                .cascadeCount(steps.size())
                .totalRemoved(totalRemoved)
                .finalMultiplier(lastMultiplier)
                .goldenSymbols(goldens)
                .wildTransitions(transitions)
                .finalWildPositions(tracker.activeWilds())
                .build();
    }

    /**
     * Grille initiale : par cellule, un tirage décide d'abord d'un symbole bonus (si activé),
     * sinon tirage pondéré puis test doré.
     */
    Grid drawInitialGrid(List<GoldenSymbolInfo> goldens) {
        Grid grid = new Grid(cascade.getGridHeight(), cascade.getGridWidth(), wildSymbol);
        double superP = bonus.getSuperSpawnProbability();
        double bonusP = superP + bonus.getNormalSpawnProbability();
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.columns(); c++) {
                if (bonus.isEnabled()) {
                    double roll = random.nextDouble();
                    if (roll < superP) {
                        grid.setSymbol(r, c, bonus.getSuperBonusSymbolId());
                        continue;
                    }
                    if (roll < bonusP) {
                        grid.setSymbol(r, c, bonus.getBonusWildSymbolId());
                        continue;
                    }
                }
                int s = generator.nextSymbol(c);
                grid.setSymbol(r, c, s);
                if (generator.rollGolden(s)) {
                    goldens.add(new GoldenSymbolInfo(new GridPosition(r, c), s));
                    grid.setGolden(r, c, goldens.size() - 1);
                }
            }
        }
        return grid;
    }

    // gravité puis remplissage par le haut ; jamais doré ni bonus
    private void refill(Grid grid, WildTracker tracker) {
        for (int c = 0; c < grid.columns(); c++) {
            tracker.rekey(grid.collapseColumn(c));
            for (int r = 0; r < grid.rows() && grid.isEmpty(r, c); r++) {
                grid.setSymbol(r, c, generator.nextSymbol(c));
            }
        }
    }
}
