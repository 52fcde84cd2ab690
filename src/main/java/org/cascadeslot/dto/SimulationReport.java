package org.cascadeslot.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import org.cascadeslot.model.WinType;

import java.util.Map;

@Getter
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SimulationReport {
    private final int spinCount;
    private final long betAmount;
    private final long totalBet;
    private final long totalWin;
    private final long netResult;
    private final long winCount;
    private final double winRate;
    private final double averageWin;
    private final long bigWinCount;
    private final long maxWin;
    private final long bonusTriggers;
    private final Map<WinType, Long> winDistribution;
    private final Map<Integer, Long> cascadeDistribution;
    private final double targetRtp;
    private final double actualRtp;
    private final double deviation;
    private final double confidence;
    private final long elapsedMillis;
}
