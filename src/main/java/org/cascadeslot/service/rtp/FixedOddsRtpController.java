package org.cascadeslot.service.rtp;

import java.time.Clock;
import java.time.Duration;

/**
 * Cotes fixes : observe le RTP sur une fenêtre longue sans jamais orienter ni corriger les gains.
 * Accepte un changement de cible à chaud (purement informatif).
 */
public class FixedOddsRtpController implements RtpController {

    private volatile double targetRtp;
    private final Clock clock;
    private final RtpHistory history;

    public FixedOddsRtpController(double targetRtp) {
        this(targetRtp, Clock.systemUTC());
    }

    public FixedOddsRtpController(double targetRtp, Clock clock) {
        this.targetRtp = targetRtp;
        this.clock = clock;
        this.history = new RtpHistory(Duration.ofHours(24), DynamicRtpController.LONG_SAMPLES, clock);
    }

    @Override public void recordOutcome(long bet, long win) { history.add(bet, win); }
    @Override public double realizedRtp() { return history.rtp(targetRtp); }
    @Override public boolean shouldBias(long bet) { return false; }
    @Override public double compensationMultiplier(double currentRtp, double target) { return 1.0; }
    @Override public double volatilityAdjustment() { return 1.0; }
    @Override public double payoutFactor() { return 1.0; }
    @Override public double getTargetRtp() { return targetRtp; }
    @Override public void setTargetRtp(double rtp) { this.targetRtp = rtp; }
    @Override public boolean isSteering() { return false; }
    @Override public void reset() { history.clear(); }

    @Override
    public RtpStatistics statistics() {
        double rtp = history.rtp(targetRtp);
        return RtpStatistics.builder()
                .controller("FIXED")
                .targetRtp(targetRtp)
                .minRtp(targetRtp)
                .maxRtp(targetRtp)
                .shortTermRtp(rtp)
                .longTermRtp(rtp)
                .weightedRtp(rtp)
                .shortTermSamples(history.size())
                .longTermSamples(history.size())
                .driftCorrection(1.0)
                .lastUpdate(clock.instant())
                .build();
    }
}
