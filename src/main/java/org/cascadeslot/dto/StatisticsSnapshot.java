package org.cascadeslot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;
import org.cascadeslot.model.WinType;
import org.cascadeslot.service.rtp.RtpStatistics;

import java.util.Map;

@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StatisticsSnapshot {
    private final String sessionId;
    private final long spinCount;
    private final long totalBet;
    private final long totalWin;
    private final double currentRtp;
    private final long winCount;
    private final double winFrequency;
    private final long bigWinCount;
    private final long bonusTriggers;
    private final long maxWin;
    private final Map<Integer, Long> cascadeDistribution;
    private final Map<WinType, Long> winTypeDistribution;
    private final RtpStatistics rtp;
}
