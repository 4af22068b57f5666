package com.ssau.aips.pipeline.config;

import java.util.Properties;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ScoringConfig {

    private static final String PREFIX = "pipeline.scoring.";

    @Builder.Default
    int gazeWeight = 20;
    @Builder.Default
    int sustainedDeviationWeight = 10;
    @Builder.Default
    double sustainedDeviationSeconds = 10.0;
    @Builder.Default
    int forbiddenItemWeight = 30;
    @Builder.Default
    int multiplePersonsWeight = 40;
    @Builder.Default
    int repeatedDeviationWeight = 10;
    @Builder.Default
    int repeatedObjectWeight = 10;

    @Builder.Default
    int lowMax = 30;
    @Builder.Default
    int mediumMax = 70;
    @Builder.Default
    int highMax = 100;

    // 0 leaves the score uncapped
    @Builder.Default
    int scoreCap = 0;

    public static ScoringConfig defaults() {
        return ScoringConfig.builder().build();
    }

    public ScoringConfig validate() {
        requireNonNegative("gazeWeight", gazeWeight);
        requireNonNegative("sustainedDeviationWeight", sustainedDeviationWeight);
        requireNonNegative("forbiddenItemWeight", forbiddenItemWeight);
        requireNonNegative("multiplePersonsWeight", multiplePersonsWeight);
        requireNonNegative("repeatedDeviationWeight", repeatedDeviationWeight);
        requireNonNegative("repeatedObjectWeight", repeatedObjectWeight);
        requireNonNegative("scoreCap", scoreCap);
        if (sustainedDeviationSeconds < 0) {
            throw new IllegalArgumentException("sustainedDeviationSeconds must be >= 0");
        }
        if (lowMax < 1 || lowMax >= mediumMax || mediumMax >= highMax) {
            throw new IllegalArgumentException(String.format(
                "Alert thresholds must satisfy 1 <= low < medium < high, got %d/%d/%d", lowMax, mediumMax, highMax));
        }
        return this;
    }

    static ScoringConfig fromProperties(Properties props) {
        ScoringConfig d = defaults();
        return ScoringConfig.builder()
            .gazeWeight(intProp(props, "gaze.weight", d.gazeWeight))
            .sustainedDeviationWeight(intProp(props, "sustained.deviation.weight", d.sustainedDeviationWeight))
            .sustainedDeviationSeconds(Double.parseDouble(props.getProperty(
                PREFIX + "sustained.deviation.seconds", String.valueOf(d.sustainedDeviationSeconds))))
            .forbiddenItemWeight(intProp(props, "forbidden.item.weight", d.forbiddenItemWeight))
            .multiplePersonsWeight(intProp(props, "multiple.persons.weight", d.multiplePersonsWeight))
            .repeatedDeviationWeight(intProp(props, "repeated.deviation.weight", d.repeatedDeviationWeight))
            .repeatedObjectWeight(intProp(props, "repeated.object.weight", d.repeatedObjectWeight))
            .lowMax(intProp(props, "alert.low.max", d.lowMax))
            .mediumMax(intProp(props, "alert.medium.max", d.mediumMax))
            .highMax(intProp(props, "alert.high.max", d.highMax))
            .scoreCap(intProp(props, "score.cap", d.scoreCap))
            .build()
            .validate();
    }

    private static int intProp(Properties props, String key, int fallback) {
        return Integer.parseInt(props.getProperty(PREFIX + key, String.valueOf(fallback)).trim());
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
    }
}
