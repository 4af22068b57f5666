package com.ssau.aips.pipeline.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.ssau.aips.pipeline.config.ScoringConfig;
import com.ssau.aips.pipeline.model.AlertLevel;
import com.ssau.aips.pipeline.model.BehaviorSnapshot;
import com.ssau.aips.pipeline.model.ForbiddenItem;
import com.ssau.aips.pipeline.model.GazeResult;
import com.ssau.aips.pipeline.model.ObjectSignal;
import com.ssau.aips.pipeline.model.RiskAssessment;
import com.ssau.aips.pipeline.model.ViolationCategory;

public class RiskScorer {

    public static final String GAZE = "gaze";
    public static final String SUSTAINED_GAZE = "sustained_gaze";
    public static final String FORBIDDEN_ITEMS = "forbidden_items";
    public static final String MULTIPLE_PERSONS = "multiple_persons";
    public static final String REPEATED_DEVIATIONS = "repeated_deviations";
    public static final String REPEATED_OBJECTS = "repeated_objects";

    public RiskAssessment score(GazeResult gaze, ObjectSignal objects, BehaviorSnapshot behavior,
                                ScoringConfig config) {
        List<String> violations = new ArrayList<>();
        Map<String, Integer> details = new LinkedHashMap<>();
        Set<ViolationCategory> categories = EnumSet.noneOf(ViolationCategory.class);

        int gazePoints = 0;
        int sustainedPoints = 0;
        if (gaze.isDeviation()) {
            gazePoints = config.getGazeWeight();
            violations.add("Gaze deviation detected");
            categories.add(ViolationCategory.GAZE);
            if (gaze.getDeviationDuration() >= config.getSustainedDeviationSeconds()) {
                sustainedPoints = config.getSustainedDeviationWeight();
                violations.add(String.format(Locale.ROOT, "Sustained gaze deviation: %.1fs",
                    gaze.getDeviationDuration()));
                categories.add(ViolationCategory.SUSTAINED_GAZE);
            }
        }
        details.put(GAZE, gazePoints);
        details.put(SUSTAINED_GAZE, sustainedPoints);

        int itemPoints = 0;
        for (ForbiddenItem item : objects.getForbiddenItems()) {
            itemPoints += config.getForbiddenItemWeight();
            violations.add("Forbidden item: " + item.label());
            categories.add(ViolationCategory.FORBIDDEN_ITEM);
        }
        details.put(FORBIDDEN_ITEMS, itemPoints);

        int personPoints = 0;
        if (objects.getPersonCount() > 1) {
            personPoints = config.getMultiplePersonsWeight();
            violations.add("Multiple persons: " + objects.getPersonCount());
            categories.add(ViolationCategory.MULTIPLE_PERSONS);
        }
        details.put(MULTIPLE_PERSONS, personPoints);

        int deviationPatternPoints = behavior.getRepeatedDeviations() * config.getRepeatedDeviationWeight();
        int objectPatternPoints = behavior.getRepeatedObjects() * config.getRepeatedObjectWeight();
        details.put(REPEATED_DEVIATIONS, deviationPatternPoints);
        details.put(REPEATED_OBJECTS, objectPatternPoints);
        if (deviationPatternPoints + objectPatternPoints > 0) {
            categories.add(ViolationCategory.BEHAVIOR_PATTERN);
        }

        int score = 0;
        for (int points : details.values()) {
            score += points;
        }
        if (config.getScoreCap() > 0) {
            score = Math.min(score, config.getScoreCap());
        }

        AlertLevel level = classify(score, config);
        return RiskAssessment.builder()
            .riskScore(score)
            .violations(List.copyOf(violations))
            .alertLevel(level)
            .recommendations(recommend(level, categories, behavior))
            .details(Collections.unmodifiableMap(details))
            .categories(Collections.unmodifiableSet(categories))
            .build();
    }

    public static AlertLevel classify(int score, ScoringConfig config) {
        if (score <= 0) {
            return AlertLevel.NONE;
        }
        if (score <= config.getLowMax()) {
            return AlertLevel.LOW;
        }
        if (score <= config.getMediumMax()) {
            return AlertLevel.MEDIUM;
        }
        if (score <= config.getHighMax()) {
            return AlertLevel.HIGH;
        }
        return AlertLevel.CRITICAL;
    }

    static List<String> recommend(AlertLevel level, Set<ViolationCategory> categories, BehaviorSnapshot behavior) {
        Set<String> out = new LinkedHashSet<>();
        switch (level) {
            case CRITICAL:
                out.add("Immediate intervention required");
                out.add("Flag session for manual review");
                out.add("Consider terminating session");
                break;
            case HIGH:
                out.add("Issue warning to candidate");
                out.add("Increase monitoring intensity");
                out.add("Log incident for review");
                break;
            case MEDIUM:
                out.add("Monitor situation closely");
                out.add("Log for pattern analysis");
                break;
            default:
                out.add("Continue normal monitoring");
                break;
        }

        if (categories.contains(ViolationCategory.GAZE)) {
            out.add("Remind candidate to keep eyes on screen");
        }
        if (categories.contains(ViolationCategory.MULTIPLE_PERSONS)) {
            out.add("Verify candidate identity");
            out.add("Request room scan");
        }
        if (categories.contains(ViolationCategory.FORBIDDEN_ITEM)) {
            out.add("Request removal of prohibited items");
            out.add("Verify workspace compliance");
        }
        if (behavior.getFindings().contains(BehaviorWindow.FREQUENT_DEVIATIONS)) {
            out.add("Investigate frequent attention shifts");
        }
        if (behavior.getFindings().contains(BehaviorWindow.REPEATED_OBJECTS)) {
            out.add("Persistent object violation - escalate");
        }
        return List.copyOf(out);
    }
}
