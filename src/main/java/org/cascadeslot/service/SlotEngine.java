package org.cascadeslot.service;

import lombok.extern.slf4j.Slf4j;
import org.cascadeslot.dto.SimulationReport;
import org.cascadeslot.dto.SpinRequest;
import org.cascadeslot.dto.SpinResult;
import org.cascadeslot.dto.StatisticsSnapshot;
import org.cascadeslot.exception.InvalidBetException;
import org.cascadeslot.exception.SessionNotFoundException;
import org.cascadeslot.model.AlgorithmConfig;
import org.cascadeslot.model.BonusTrigger;
import org.cascadeslot.model.BonusTriggerConfig;
import org.cascadeslot.model.CascadeConfig;
import org.cascadeslot.model.DrawLean;
import org.cascadeslot.model.GoldenWildConfig;
import org.cascadeslot.model.MatchStrategy;
import org.cascadeslot.model.RtpControllerType;
import org.cascadeslot.model.WinType;
import org.cascadeslot.service.engine.BonusTriggerDetector;
import org.cascadeslot.service.engine.CascadeOrchestrator;
import org.cascadeslot.service.engine.CascadeOutcome;
import org.cascadeslot.service.engine.WeightedSymbolGenerator;
import org.cascadeslot.service.engine.WildLifecycleManager;
import org.cascadeslot.service.engine.match.AdjacencyMatcher;
import org.cascadeslot.service.engine.match.LeftmostLineMatcher;
import org.cascadeslot.service.engine.match.MatchEngine;
import org.cascadeslot.service.engine.match.PayTable;
import org.cascadeslot.service.random.RandomSource;
import org.cascadeslot.service.rtp.DynamicRtpController;
import org.cascadeslot.service.rtp.FixedOddsRtpController;
import org.cascadeslot.service.rtp.RtpController;
import org.cascadeslot.service.stats.EngineStatistics;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleFunction;

/**
 * Point d'entrée du moteur : un spin = validation de la mise, orientation du tirage par le
 * contrôleur RTP, cascade complète, conversion en crédits, compensation, enregistrement.
 * <p>
 * Un seul verrou (le moniteur de l'instance) couvre tout le spin : l'historique RTP et les
 * statistiques ne voient jamais un spin à moitié appliqué.
 */
@Slf4j
public class SlotEngine {

    public static final String DEFAULT_SESSION = "default";
    public static final String SIMULATION_SESSION = "simulation";

    private final RandomSource random;
    private final Clock clock;
    private final DoubleFunction<RtpController> controllerFactory;
    private final EngineStatistics statistics = new EngineStatistics();
    private final Map<String, EngineStatistics> sessions = new ConcurrentHashMap<>();

    private AlgorithmConfig algorithm;
    private CascadeConfig cascade;
    private GoldenWildConfig golden;
    private BonusTriggerConfig bonus;
    private CascadeOrchestrator orchestrator;
    private BonusTriggerDetector bonusDetector;
    private RtpController rtp;

    public SlotEngine(AlgorithmConfig algorithm, CascadeConfig cascade, GoldenWildConfig golden,
                      BonusTriggerConfig bonus, RandomSource random, RtpControllerType controllerType) {
        this(algorithm, cascade, golden, bonus, random, controllerType, Clock.systemUTC());
    }

    public SlotEngine(AlgorithmConfig algorithm, CascadeConfig cascade, GoldenWildConfig golden,
                      BonusTriggerConfig bonus, RandomSource random, RtpControllerType controllerType, Clock clock) {
        this(algorithm, cascade, golden, bonus, random, defaultControllerFactory(controllerType, random, clock), clock);
    }

    public SlotEngine(AlgorithmConfig algorithm, CascadeConfig cascade, GoldenWildConfig golden,
                      BonusTriggerConfig bonus, RandomSource random, DoubleFunction<RtpController> controllerFactory) {
        this(algorithm, cascade, golden, bonus, random, controllerFactory, Clock.systemUTC());
    }

    public SlotEngine(AlgorithmConfig algorithm, CascadeConfig cascade, GoldenWildConfig golden,
                      BonusTriggerConfig bonus, RandomSource random, DoubleFunction<RtpController> controllerFactory,
                      Clock clock) {
        ConfigValidator.validate(algorithm, cascade, golden, bonus);
        this.random = random;
        this.clock = clock;
        this.controllerFactory = controllerFactory;
        apply(algorithm, cascade, golden, bonus);
        this.rtp = controllerFactory.apply(algorithm.getTargetRtp());
        log.info("Moteur prêt : grille {}x{}, {} symboles, stratégie {}, RTP cible {}",
                cascade.getGridWidth(), cascade.getGridHeight(), algorithm.getSymbolCount(),
                cascade.getMatchStrategy(), algorithm.getTargetRtp());
    }

    public static DoubleFunction<RtpController> defaultControllerFactory(RtpControllerType type, RandomSource random,
                                                                        Clock clock) {
        if (type == RtpControllerType.FIXED) return target -> new FixedOddsRtpController(target, clock);
        return target -> new DynamicRtpController(target, random, clock);
    }

    public synchronized SpinResult spin(SpinRequest request) {
        if (request == null) throw new InvalidBetException("Requête de spin absente");
        long bet = request.getBetAmount();
        if (bet < algorithm.getMinBet() || bet > algorithm.getMaxBet()) {
            log.warn("Mise refusée : {} hors [{}, {}]", bet, algorithm.getMinBet(), algorithm.getMaxBet());
            throw new InvalidBetException("Mise hors bornes",
                    Map.of("betAmount", bet, "minBet", algorithm.getMinBet(), "maxBet", algorithm.getMaxBet()));
        }
        String sessionId = (request.getSessionId() == null || request.getSessionId().isBlank())
                ? DEFAULT_SESSION : request.getSessionId();

        DrawLean lean = rtp.isSteering() ? leanFor(rtp.shouldBias(bet), rtp.realizedRtp(), rtp.getTargetRtp())
                : DrawLean.NONE;

        CascadeOutcome outcome = orchestrator.run(lean);

        long rawWin = outcome.getTotalUnits() * bet / algorithm.getPayTableBetBase();
        double compensation = rawWin > 0 ? rtp.payoutFactor() : 1.0;
        long totalWin = (long) Math.floor(rawWin * compensation);

        Optional<BonusTrigger> trigger = bonusDetector.detect(outcome.getInitialGrid());
        WinType winType = WinType.classify(totalWin, bet);

        rtp.recordOutcome(bet, totalWin);
        statistics.recordSpin(bet, totalWin, outcome.getCascadeCount(), winType, trigger.isPresent());
        sessions.computeIfAbsent(sessionId, k -> new EngineStatistics())
                .recordSpin(bet, totalWin, outcome.getCascadeCount(), winType, trigger.isPresent());

        log.debug("Spin {} mise={} lean={} cascades={} brut={} x{} gain={}",
                sessionId, bet, lean, outcome.getCascadeCount(), rawWin, compensation, totalWin);

        return SpinResult.builder()
                .resultId(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .betAmount(bet)
                .totalWin(totalWin)
                .rawWin(rawWin)
                .compensation(compensation)
                .win(totalWin > 0)
                .winType(winType)
                .multiplier((double) totalWin / bet)
                .cascadeCount(outcome.getCascadeCount())
                .totalRemoved(outcome.getTotalRemoved())
                .finalMultiplier(outcome.getFinalMultiplier())
                .steps(outcome.getSteps())
                .initialGrid(outcome.getInitialGrid())
                .finalGrid(outcome.getFinalGrid())
                .goldenSymbols(outcome.getGoldenSymbols())
                .wildTransitions(outcome.getWildTransitions())
                .finalWildCount(outcome.getFinalWildPositions().size())
                .wildPositions(outcome.getFinalWildPositions())
                .bonusTrigger(trigger.orElse(null))
                .metadata(request.getMetadata())
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Le tirage n'est orienté que dans le sens qui rapproche du RTP cible : vers le gain si
     * {@code shouldBias} et sous la cible, vers la perte si refus et au-dessus ; sinon aucun.
     */
    static DrawLean leanFor(boolean bias, double realizedRtp, double targetRtp) {
        if (bias && realizedRtp < targetRtp) return DrawLean.TOWARD_WIN;
        if (!bias && realizedRtp > targetRtp) return DrawLean.TOWARD_LOSS;
        return DrawLean.NONE;
    }

    public synchronized void configureAlgorithm(AlgorithmConfig newAlgorithm) {
        configureAlgorithm(newAlgorithm, null, null, null);
    }

    /** Les paramètres {@code null} gardent la valeur courante. Rien n'est modifié si la validation échoue. */
    public synchronized void configureAlgorithm(AlgorithmConfig newAlgorithm, CascadeConfig newCascade,
                                                GoldenWildConfig newGolden, BonusTriggerConfig newBonus) {
        AlgorithmConfig a = newAlgorithm != null ? newAlgorithm : algorithm;
        CascadeConfig c = newCascade != null ? newCascade : cascade;
        GoldenWildConfig g = newGolden != null ? newGolden : golden;
        BonusTriggerConfig b = newBonus != null ? newBonus : bonus;
        ConfigValidator.validate(a, c, g, b);

        boolean retarget = Double.compare(a.getTargetRtp(), algorithm.getTargetRtp()) != 0;
        apply(a, c, g, b);
        if (retarget) {
            rtp = controllerFactory.apply(a.getTargetRtp());
            log.info("RTP cible changé : {} (historique RTP réinitialisé)", a.getTargetRtp());
        }
        log.info("Moteur reconfiguré : grille {}x{}, stratégie {}", c.getGridWidth(), c.getGridHeight(), c.getMatchStrategy());
    }

    public synchronized void setTargetRtp(double targetRtp) {
        ConfigValidator.validateTargetRtp(targetRtp);
        rtp.setTargetRtp(targetRtp);
        algorithm = algorithm.toBuilder()
                .targetRtp(targetRtp)
                .minRtp(Math.min(algorithm.getMinRtp(), targetRtp))
                .maxRtp(Math.max(algorithm.getMaxRtp(), targetRtp))
                .build();
        log.info("RTP cible mis à jour : {}", targetRtp);
    }

    public synchronized StatisticsSnapshot getStatistics() {
        return statistics.snapshot().toBuilder().rtp(rtp.statistics()).build();
    }

    public synchronized void resetStatistics() {
        statistics.reset();
        sessions.clear();
        rtp.reset();
        log.info("Statistiques réinitialisées");
    }

    public StatisticsSnapshot getSessionStatistics(String sessionId) {
        EngineStatistics s = sessionId == null ? null : sessions.get(sessionId);
        if (s == null) throw new SessionNotFoundException(sessionId);
        return s.snapshot().toBuilder().sessionId(sessionId).build();
    }

    /**
     * Enchaîne {@code spinCount} spins sur la session {@value #SIMULATION_SESSION}.
     * Les spins passent par le chemin normal : ils alimentent l'historique RTP et les statistiques.
     */
    public SimulationReport simulate(long betAmount, int spinCount) {
        if (spinCount <= 0) throw new IllegalArgumentException("spinCount doit être > 0");
        long start = System.currentTimeMillis();
        EngineStatistics run = new EngineStatistics();
        for (int i = 0; i < spinCount; i++) {
            SpinResult r = spin(SpinRequest.of(SIMULATION_SESSION, betAmount));
            run.recordSpin(r.getBetAmount(), r.getTotalWin(), r.getCascadeCount(), r.getWinType(),
                    r.getBonusTrigger() != null);
        }
        StatisticsSnapshot s = run.snapshot();
        double target = getAlgorithmConfig().getTargetRtp();
        double actual = s.getCurrentRtp();
        double deviation = actual - target;
        double confidence = Math.max(0.0, 1.0 - Math.abs(deviation) * 10) * Math.min(1.0, spinCount / 10_000.0);

        SimulationReport report = SimulationReport.builder()
                .spinCount(spinCount)
                .betAmount(betAmount)
                .totalBet(s.getTotalBet())
                .totalWin(s.getTotalWin())
                .netResult(s.getTotalWin() - s.getTotalBet())
                .winCount(s.getWinCount())
                .winRate(s.getWinFrequency())
                .averageWin(s.getWinCount() == 0 ? 0.0 : (double) s.getTotalWin() / s.getWinCount())
                .bigWinCount(s.getBigWinCount())
                .maxWin(s.getMaxWin())
                .bonusTriggers(s.getBonusTriggers())
                .winDistribution(s.getWinTypeDistribution())
                .cascadeDistribution(s.getCascadeDistribution())
                .targetRtp(target)
                .actualRtp(actual)
                .deviation(deviation)
                .confidence(confidence)
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
        log.info("Simulation terminée : {} spins, RTP {} (cible {}), confiance {}",
                spinCount, actual, target, confidence);
        return report;
    }

    public synchronized AlgorithmConfig getAlgorithmConfig() { return algorithm; }
    public synchronized CascadeConfig getCascadeConfig() { return cascade; }
    public synchronized GoldenWildConfig getGoldenWildConfig() { return golden; }
    public synchronized BonusTriggerConfig getBonusTriggerConfig() { return bonus; }
    public synchronized RtpController getRtpController() { return rtp; }

    private void apply(AlgorithmConfig a, CascadeConfig c, GoldenWildConfig g, BonusTriggerConfig b) {
        PayTable payTable = new PayTable(a.getPayTable());
        MatchEngine matcher = c.getMatchStrategy() == MatchStrategy.CLUSTER
                ? new AdjacencyMatcher(payTable, a.getSymbolCount(), c.getMinMatch(), c.isAdjacentOnly())
                : new LeftmostLineMatcher(payTable);
        WeightedSymbolGenerator generator = new WeightedSymbolGenerator(a.getSymbolWeights(), g, random);

        this.orchestrator = new CascadeOrchestrator(c, b, g.getWildSymbolId(), generator, matcher,
                new WildLifecycleManager(), random);
        this.bonusDetector = new BonusTriggerDetector(b);
        this.algorithm = a;
        this.cascade = c;
        this.golden = g;
        this.bonus = b;
    }
}
