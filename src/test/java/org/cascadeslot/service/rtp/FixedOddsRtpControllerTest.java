package org.cascadeslot.service.rtp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FixedOddsRtpControllerTest {

    @Test
    void neCorrigeJamais_maisObserve() {
        FixedOddsRtpController c = new FixedOddsRtpController(0.9);
        c.recordOutcome(100, 50);
        c.recordOutcome(100, 150);

        assertThat(c.isSteering()).isFalse();
        assertThat(c.shouldBias(100)).isFalse();
        assertThat(c.payoutFactor()).isEqualTo(1.0);
        assertThat(c.compensationMultiplier(0.1, 0.9)).isEqualTo(1.0);
        assertThat(c.realizedRtp()).isCloseTo(1.0, within(1e-9));
        assertThat(c.statistics().getController()).isEqualTo("FIXED");
    }

    @Test
    void setTargetRtp_accepteAChaud() {
        FixedOddsRtpController c = new FixedOddsRtpController(0.9);
        c.setTargetRtp(0.95);
        assertThat(c.getTargetRtp()).isEqualTo(0.95);
        assertThat(c.realizedRtp()).isEqualTo(0.95);
    }
}
