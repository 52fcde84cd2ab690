package org.cascadeslot.service.stats;

import org.cascadeslot.dto.StatisticsSnapshot;
import org.cascadeslot.model.WinType;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;

/**
 * Compteurs cumulés (global ou par session). Modifiés uniquement par {@link #recordSpin} et {@link #reset}.
 */
public class EngineStatistics {

    /** Un gros gain dépasse 10 fois la mise. */
    public static final long BIG_WIN_FACTOR = 10;

    private final AtomicLong spinCount = new AtomicLong();
    private final AtomicLong totalBet = new AtomicLong();
    private final AtomicLong totalWin = new AtomicLong();
    private final AtomicLong winCount = new AtomicLong();
    private final AtomicLong bigWinCount = new AtomicLong();
    private final AtomicLong bonusTriggers = new AtomicLong();
    private final LongAccumulator maxWin = new LongAccumulator(Math::max, 0L);
    private final Map<Integer, AtomicLong> cascades = new ConcurrentHashMap<>();
    private final Map<WinType, AtomicLong> winTypes = new ConcurrentHashMap<>();

    public void recordSpin(long bet, long win, int cascadeCount, WinType winType, boolean bonusTriggered) {
        spinCount.incrementAndGet();
        totalBet.addAndGet(bet);
        totalWin.addAndGet(win);
        if (win > 0) winCount.incrementAndGet();
        if (win > bet * BIG_WIN_FACTOR) bigWinCount.incrementAndGet();
        if (bonusTriggered) bonusTriggers.incrementAndGet();
        maxWin.accumulate(win);
        cascades.computeIfAbsent(cascadeCount, k -> new AtomicLong()).incrementAndGet();
        winTypes.computeIfAbsent(winType, k -> new AtomicLong()).incrementAndGet();
    }

    public void reset() {
        spinCount.set(0);
        totalBet.set(0);
        totalWin.set(0);
        winCount.set(0);
        bigWinCount.set(0);
        bonusTriggers.set(0);
        maxWin.reset();
        cascades.clear();
        winTypes.clear();
    }

    public long getSpinCount() { return spinCount.get(); }
    public long getTotalBet() { return totalBet.get(); }
    public long getTotalWin() { return totalWin.get(); }

    public double currentRtp() {
        long bet = totalBet.get();
        return bet == 0 ? 0.0 : (double) totalWin.get() / bet;
    }

    public StatisticsSnapshot snapshot() {
        long spins = spinCount.get();
        Map<Integer, Long> cascadeDist = new TreeMap<>();
        cascades.forEach((k, v) -> cascadeDist.put(k, v.get()));
        Map<WinType, Long> typeDist = new TreeMap<>();
        winTypes.forEach((k, v) -> typeDist.put(k, v.get()));

        return StatisticsSnapshot.builder()
                .spinCount(spins)
                .totalBet(totalBet.get())
                .totalWin(totalWin.get())
                .currentRtp(currentRtp())
                .winCount(winCount.get())
                .winFrequency(spins == 0 ? 0.0 : (double) winCount.get() / spins)
                .bigWinCount(bigWinCount.get())
                .bonusTriggers(bonusTriggers.get())
                .maxWin(maxWin.get())
                .cascadeDistribution(cascadeDist)
                .winTypeDistribution(typeDist)
                .build();
    }
}
