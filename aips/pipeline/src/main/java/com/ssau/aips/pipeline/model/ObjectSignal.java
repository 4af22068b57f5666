package com.ssau.aips.pipeline.model;

import java.util.List;

import lombok.Value;

@Value
public class ObjectSignal {

    private static final ObjectSignal EMPTY = new ObjectSignal(0, List.of(), List.of());

    int personCount;
    List<ForbiddenItem> forbiddenItems;
    List<Detection> allDetections;

    public ObjectSignal(int personCount, List<ForbiddenItem> forbiddenItems, List<Detection> allDetections) {
        this.personCount = personCount;
        this.forbiddenItems = List.copyOf(forbiddenItems);
        this.allDetections = List.copyOf(allDetections);
    }

    public static ObjectSignal empty() {
        return EMPTY;
    }
}
