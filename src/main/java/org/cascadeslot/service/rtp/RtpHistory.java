package org.cascadeslot.service.rtp;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fenêtre glissante d'échantillons. Éviction par nombre d'abord, puis par âge.
 * Les totaux sont maintenus à l'ajout et au retrait, la lecture du RTP est O(1).
 */
public class RtpHistory {

    private final Duration window;
    private final int maxSamples;
    private final Clock clock;
    private final Deque<RtpSample> samples = new ArrayDeque<>();
    private long totalBet;
    private long totalWin;

    public RtpHistory(Duration window, int maxSamples, Clock clock) {
        if (maxSamples <= 0) throw new IllegalArgumentException("maxSamples doit être > 0");
        this.window = window;
        this.maxSamples = maxSamples;
        this.clock = clock;
    }

    public synchronized void add(long bet, long win) {
        samples.addLast(new RtpSample(clock.instant(), bet, win));
        totalBet += bet;
        totalWin += win;
        evict();
    }

    /** RTP de la fenêtre ; {@code fallback} quand aucune mise n'y figure. */
    public synchronized double rtp(double fallback) {
        evict();
        return totalBet == 0 ? fallback : (double) totalWin / totalBet;
    }

    public synchronized int size() {
        evict();
        return samples.size();
    }

    /** Écart type des ratios gain/mise de chaque échantillon. */
    public synchronized double ratioStdDev() {
        evict();
        int n = samples.size();
        if (n == 0) return 0.0;
        double sum = 0;
        for (RtpSample s : samples) sum += s.ratio();
        double mean = sum / n;
        double var = 0;
        for (RtpSample s : samples) {
            double d = s.ratio() - mean;
            var += d * d;
        }
        return Math.sqrt(var / n);
    }

    public synchronized void clear() {
        samples.clear();
        totalBet = 0;
        totalWin = 0;
    }

    private void evict() {
        while (samples.size() > maxSamples) drop();
        Instant cutoff = clock.instant().minus(window);
        while (!samples.isEmpty() && samples.peekFirst().timestamp().isBefore(cutoff)) drop();
    }

    private void drop() {
        RtpSample s = samples.removeFirst();
        totalBet -= s.bet();
        totalWin -= s.win();
    }
}
