package com.pokerplayer.strength.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable pre-flop classification limits, bound from {@code poker.strength.*}.
 */
@Data
@ConfigurationProperties(prefix = "poker.strength")
public class StrengthProperties {

    private int strongPocketPairMin = 10;
    private int decentHighCardMin = 9;
    private int decentSuitedGapMax = 2;
    private int weakPlayableConnectedGapMax = 1;
    private int weakPlayableHighCardMin = 11;
    private int weakPlayableBothMin = 8;
    private int marginalHighCardMin = 10;
    private int marginalSuitedGapMax = 3;
    private int marginalGapMax = 2;

    private HeadsUp headsUp = new HeadsUp();

    /**
     * Limits that loosen when only two players are left.
     */
    @Data
    public static class HeadsUp {
        private int decentHighCardMin = 8;
        private int decentSuitedGapMax = 3;
        private int weakPlayableConnectedGapMax = 2;
        private int weakPlayableBothMin = 7;
    }

    public ClassifierThresholds toThresholds() {
        PreflopThresholds regular = PreflopThresholds.builder()
                .strongPocketPairMin(strongPocketPairMin)
                .decentHighCardMin(decentHighCardMin)
                .decentSuitedGapMax(decentSuitedGapMax)
                .weakPlayableConnectedGapMax(weakPlayableConnectedGapMax)
                .weakPlayableHighCardMin(weakPlayableHighCardMin)
                .weakPlayableBothMin(weakPlayableBothMin)
                .marginalHighCardMin(marginalHighCardMin)
                .marginalSuitedGapMax(marginalSuitedGapMax)
                .marginalGapMax(marginalGapMax)
                .build();

        PreflopThresholds widened = regular.toBuilder()
                .decentHighCardMin(headsUp.getDecentHighCardMin())
                .decentSuitedGapMax(headsUp.getDecentSuitedGapMax())
                .weakPlayableConnectedGapMax(headsUp.getWeakPlayableConnectedGapMax())
                .weakPlayableBothMin(headsUp.getWeakPlayableBothMin())
                .build();

        return new ClassifierThresholds(regular, widened);
    }
}
