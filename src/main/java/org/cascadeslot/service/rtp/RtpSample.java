package org.cascadeslot.service.rtp;

import java.time.Instant;

public record RtpSample(Instant timestamp, long bet, long win) {

    public double ratio() {
        return bet == 0 ? 0.0 : (double) win / bet;
    }
}
