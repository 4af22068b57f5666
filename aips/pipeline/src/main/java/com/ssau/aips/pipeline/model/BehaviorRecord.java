package com.ssau.aips.pipeline.model;

import java.util.List;

public record BehaviorRecord(double timestamp, boolean gazeDeviation, List<String> forbiddenItems, int personCount) {

    public BehaviorRecord {
        forbiddenItems = List.copyOf(forbiddenItems);
    }

    public boolean hasForbiddenItems() {
        return !forbiddenItems.isEmpty();
    }
}
