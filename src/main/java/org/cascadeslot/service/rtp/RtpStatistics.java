package org.cascadeslot.service.rtp;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RtpStatistics {
    private final String controller;
    private final double targetRtp;
    private final double minRtp;
    private final double maxRtp;
    private final double shortTermRtp;
    private final double longTermRtp;
    private final double weightedRtp;
    private final int shortTermSamples;
    private final int longTermSamples;
    private final double driftCorrection;
    private final Instant lastUpdate;
}
