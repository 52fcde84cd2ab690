package org.cascadeslot.service.rtp;

import lombok.extern.slf4j.Slf4j;
import org.cascadeslot.exception.RtpRetargetingNotSupportedException;
import org.cascadeslot.service.random.RandomSource;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Contrôleur RTP à deux fenêtres (courte : 15 min / 100 tirages, longue : 24 h / 1000 tirages).
 * La cible est fixée à la construction ; pour la changer, le moteur reconstruit le contrôleur.
 * <p>
 * La compensation par tranche ne dépend que de l'écart courant : seule, elle laisse un écart
 * résiduel dès que le jeu de base ne paie pas exactement la cible. Une dérive cumulée
 * {@code somme(cible - gain / mise)} corrige ce résidu : le facteur appliqué vaut
 * {@code exp(DRIFT_GAIN × dérive)}, borné à [{@value #MIN_DRIFT_CORRECTION}, {@value #MAX_DRIFT_CORRECTION}].
 * Sur N tirages à mise fixe, l'écart entre RTP cumulé et cible vaut exactement {@code -dérive / N}.
 */
@Slf4j
public class DynamicRtpController implements RtpController {

    public static final double COMPENSATION_FACTOR = 1.5;
    public static final double VOLATILITY_FACTOR = 0.1;
    public static final double SHORT_WEIGHT = 0.3, LONG_WEIGHT = 0.7;
    public static final Duration SHORT_WINDOW = Duration.ofMinutes(15);
    public static final Duration LONG_WINDOW = Duration.ofHours(24);
    public static final int SHORT_SAMPLES = 100, LONG_SAMPLES = 1000;
    public static final int MIN_VOLATILITY_SAMPLES = 10;
    public static final double DRIFT_GAIN = 0.002;
    public static final double MIN_DRIFT_CORRECTION = 0.25, MAX_DRIFT_CORRECTION = 4.0;

    private final double targetRtp;
    private final double minRtp;
    private final double maxRtp;
    private final RandomSource random;
    private final Clock clock;
    private final RtpHistory shortTerm;
    private final RtpHistory longTerm;
    private boolean outOfBand;
    private double drift;

    public DynamicRtpController(double targetRtp, RandomSource random) {
        this(targetRtp, random, Clock.systemUTC());
    }

    public DynamicRtpController(double targetRtp, RandomSource random, Clock clock) {
        this.targetRtp = targetRtp;
        this.minRtp = targetRtp * 0.85;
        this.maxRtp = targetRtp * 1.15;
        this.random = random;
        this.clock = clock;
        this.shortTerm = new RtpHistory(SHORT_WINDOW, SHORT_SAMPLES, clock);
        this.longTerm = new RtpHistory(LONG_WINDOW, LONG_SAMPLES, clock);
    }

    @Override
    public synchronized void recordOutcome(long bet, long win) {
        shortTerm.add(bet, win);
        longTerm.add(bet, win);
        if (bet > 0) drift += targetRtp - (double) win / bet;
        double rtp = longTerm.rtp(targetRtp);
        boolean out = longTerm.size() >= LONG_SAMPLES && (rtp < minRtp || rtp > maxRtp);
        // un seul message par sortie de bande
        if (out && !outOfBand) {
            log.warn("RTP long terme {} hors de la bande [{}, {}]", rtp, minRtp, maxRtp);
        }
        outOfBand = out;
    }

    @Override
    public double realizedRtp() {
        return SHORT_WEIGHT * shortTerm.rtp(targetRtp) + LONG_WEIGHT * longTerm.rtp(targetRtp);
    }

    @Override
    public boolean shouldBias(long bet) {
        double weighted = realizedRtp();
        double p = targetRtp;
        if (weighted < targetRtp) {
            p += (targetRtp - weighted) * COMPENSATION_FACTOR;
        } else if (weighted > targetRtp) {
            p -= (weighted - targetRtp) * COMPENSATION_FACTOR * 0.5;
        }

        // grosses mises : légère pénalité
        p *= 1.0 - (bet / 1_000_000.0) * 0.05;
        p += VOLATILITY_FACTOR * (0.5 - random.nextDouble());
        p = Math.max(0.1, Math.min(0.9, p));
        return random.nextDouble() < p;
    }

    @Override
    public double compensationMultiplier(double currentRtp, double target) {
        double dev = (target - currentRtp) / target;
        double m;
        if (dev > 0.1) m = 1.0 + dev * 2.0;
        else if (dev > 0.05) m = 1.0 + dev * 1.5;
        else if (dev > -0.05) m = 1.0 + dev;
        else if (dev > -0.1) m = 1.0 + dev * 0.5;
        else m = 1.0 + dev * 0.3;
        return clampFactor(m);
    }

    @Override
    public double volatilityAdjustment() {
        if (shortTerm.size() < MIN_VOLATILITY_SAMPLES) return 1.0;
        double std = shortTerm.ratioStdDev();
        if (std > 0.1) return 0.8;
        if (std < 0.05) return 1.2;
        return 1.0;
    }

    /** Facteur intégral : au-dessus de 1 tant que le cumul a moins payé que la cible. */
    public synchronized double driftCorrection() {
        double f = Math.exp(DRIFT_GAIN * drift);
        return Math.max(MIN_DRIFT_CORRECTION, Math.min(MAX_DRIFT_CORRECTION, f));
    }

    @Override
    public double payoutFactor() {
        double comp = compensationMultiplier(realizedRtp(), targetRtp);
        return driftCorrection() * clampFactor(1.0 + (comp - 1.0) * volatilityAdjustment());
    }

    @Override
    public double getTargetRtp() {
        return targetRtp;
    }

    @Override
    public void setTargetRtp(double rtp) {
        throw new RtpRetargetingNotSupportedException(
                "Le contrôleur dynamique ne change pas de cible à chaud ; reconfigurer le moteur",
                Map.of("currentTarget", targetRtp, "requested", rtp));
    }

    @Override
    public boolean isSteering() {
        return true;
    }

    @Override
    public RtpStatistics statistics() {
        return RtpStatistics.builder()
                .controller("DYNAMIC")
                .targetRtp(targetRtp)
                .minRtp(minRtp)
                .maxRtp(maxRtp)
                .shortTermRtp(shortTerm.rtp(targetRtp))
                .longTermRtp(longTerm.rtp(targetRtp))
                .weightedRtp(realizedRtp())
                .shortTermSamples(shortTerm.size())
                .longTermSamples(longTerm.size())
                .driftCorrection(driftCorrection())
                .lastUpdate(clock.instant())
                .build();
    }

    @Override
    public synchronized void reset() {
        shortTerm.clear();
        longTerm.clear();
        outOfBand = false;
        drift = 0;
    }

    static double clampFactor(double m) {
        return Math.max(0.5, Math.min(2.0, m));
    }
}
