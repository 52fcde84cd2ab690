package org.cascadeslot.config;

import lombok.Data;
import org.cascadeslot.model.MatchStrategy;
import org.cascadeslot.model.RtpControllerType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration {@code slot.*} (voir application.yml). Un champ laissé vide reprend
 * la valeur du preset mahjong.
 */
@Data
@ConfigurationProperties(prefix = "slot")
public class SlotProperties {

    private Algorithm algorithm = new Algorithm();
    private Cascade cascade = new Cascade();
    private Golden golden = new Golden();
    private Bonus bonus = new Bonus();
    private Random random = new Random();
    private Rtp rtp = new Rtp();
    private Simulation simulation = new Simulation();

    @Data
    public static class Algorithm {
        private Integer reelCount;
        private Integer rowCount;
        private Integer symbolCount;
        private Double targetRtp;
        private Double minRtp;
        private Double maxRtp;
        private List<List<Integer>> symbolWeights;
        /** Clés = id de symbole. */
        private Map<String, List<Long>> payTable = new LinkedHashMap<>();
        private Long minBet;
        private Long maxBet;
        private Long payTableBetBase;
    }

    @Data
    public static class Cascade {
        private Integer minMatch;
        private Integer maxCascades;
        private List<Double> multipliers;
        private Boolean adjacentOnly;
        private MatchStrategy matchStrategy;
        private Integer leanAttempts;
    }

    @Data
    public static class Golden {
        private Boolean enabled;
        private Double probability;
        private Set<Integer> symbols;
        private Integer wildSymbolId;
    }

    @Data
    public static class Bonus {
        private boolean enabled = true;
        private Double normalSpawnProbability;
        private Double superSpawnProbability;
    }

    @Data
    public static class Random {
        /** Absent : SecureRandom. */
        private Long seed;
    }

    @Data
    public static class Rtp {
        private RtpControllerType controller = RtpControllerType.DYNAMIC;
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private int spins = 10_000;
        private long bet = 100;
    }
}
