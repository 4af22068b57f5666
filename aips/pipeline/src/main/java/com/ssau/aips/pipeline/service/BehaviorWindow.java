package com.ssau.aips.pipeline.service;

import java.util.ArrayList;
import java.util.List;

import com.ssau.aips.pipeline.model.BehaviorRecord;
import com.ssau.aips.pipeline.model.BehaviorSnapshot;

public class BehaviorWindow {

    static final String FREQUENT_DEVIATIONS = "Frequent gaze deviations";
    static final String REPEATED_OBJECTS = "Repeated forbidden object detections";
    static final String MULTIPLE_PERSONS = "Multiple persons frequently present";
    static final String NORMAL = "Normal behavior";

    public BehaviorSnapshot update(BehaviorWindowState state, BehaviorRecord record, int windowSize) {
        state.append(record, windowSize);
        return snapshot(state, windowSize);
    }

    public BehaviorSnapshot snapshot(BehaviorWindowState state, int windowSize) {
        int frames = 0;
        int deviations = 0;
        int objectRuns = 0;
        long persons = 0;
        boolean inRun = false;
        for (BehaviorRecord record : state.view()) {
            frames++;
            if (record.gazeDeviation()) {
                deviations++;
            }
            // a streak of item frames counts once
            if (record.hasForbiddenItems()) {
                if (!inRun) {
                    objectRuns++;
                }
                inRun = true;
            } else {
                inRun = false;
            }
            persons += record.personCount();
        }
        if (frames == 0) {
            return BehaviorSnapshot.empty();
        }

        double avgPersons = (double) persons / frames;
        return BehaviorSnapshot.builder()
            .repeatedDeviations(deviations)
            .repeatedObjects(objectRuns)
            .avgPersonCount(avgPersons)
            .patternScore(patternScore(deviations, objectRuns, avgPersons, windowSize))
            .windowFrames(frames)
            .findings(findings(deviations, objectRuns, avgPersons, windowSize))
            .build();
    }

    static double patternScore(int deviations, int objectRuns, double avgPersons, int windowSize) {
        double deviationRatio = (double) deviations / windowSize;
        double objectRatio = (double) objectRuns / windowSize;
        double score = deviationRatio * 30.0
            + objectRatio * 40.0
            + Math.max(0.0, avgPersons - 1.0) * 30.0;
        return Math.max(0.0, Math.min(100.0, score));
    }

    private static List<String> findings(int deviations, int objectRuns, double avgPersons, int windowSize) {
        List<String> findings = new ArrayList<>(3);
        if (deviations > windowSize * 0.3) {
            findings.add(FREQUENT_DEVIATIONS);
        }
        if (objectRuns > windowSize * 0.2) {
            findings.add(REPEATED_OBJECTS);
        }
        if (avgPersons > 1.5) {
            findings.add(MULTIPLE_PERSONS);
        }
        if (findings.isEmpty()) {
            findings.add(NORMAL);
        }
        return List.copyOf(findings);
    }
}
