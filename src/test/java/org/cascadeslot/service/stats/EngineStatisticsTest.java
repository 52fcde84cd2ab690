package org.cascadeslot.service.stats;

import org.cascadeslot.dto.StatisticsSnapshot;
import org.cascadeslot.model.WinType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EngineStatisticsTest {

    @Test
    void recordSpin_cumuleTotauxEtDistributions() {
        EngineStatistics stats = new EngineStatistics();
        stats.recordSpin(100, 0, 0, WinType.NONE, false);
        stats.recordSpin(100, 250, 2, WinType.SMALL, false);
        stats.recordSpin(100, 2500, 3, WinType.BIG, true);

        StatisticsSnapshot s = stats.snapshot();

        assertThat(s.getSpinCount()).isEqualTo(3);
        assertThat(s.getTotalBet()).isEqualTo(300);
        assertThat(s.getTotalWin()).isEqualTo(2750);
        assertThat(s.getCurrentRtp()).isCloseTo(2750 / 300.0, within(1e-9));
        assertThat(s.getWinCount()).isEqualTo(2);
        assertThat(s.getWinFrequency()).isCloseTo(2 / 3.0, within(1e-9));
        assertThat(s.getBigWinCount()).isEqualTo(1);
        assertThat(s.getBonusTriggers()).isEqualTo(1);
        assertThat(s.getMaxWin()).isEqualTo(2500);
        assertThat(s.getCascadeDistribution()).containsEntry(0, 1L).containsEntry(2, 1L).containsEntry(3, 1L);
        assertThat(s.getWinTypeDistribution()).containsEntry(WinType.BIG, 1L).doesNotContainKey(WinType.JACKPOT);
    }

    @Test
    void reset_remetToutAZero() {
        EngineStatistics stats = new EngineStatistics();
        stats.recordSpin(100, 5000, 4, WinType.BIG, true);
        stats.reset();

        StatisticsSnapshot s = stats.snapshot();
        assertThat(s.getSpinCount()).isZero();
        assertThat(s.getMaxWin()).isZero();
        assertThat(s.getCurrentRtp()).isZero();
        assertThat(s.getCascadeDistribution()).isEmpty();
    }

    @Test
    void grosGain_auDelaDeDixFoisLaMise() {
        EngineStatistics stats = new EngineStatistics();
        stats.recordSpin(100, 1000, 1, WinType.MEDIUM, false);
        stats.recordSpin(100, 1001, 1, WinType.MEDIUM, false);
        assertThat(stats.snapshot().getBigWinCount()).isEqualTo(1);
    }
}
