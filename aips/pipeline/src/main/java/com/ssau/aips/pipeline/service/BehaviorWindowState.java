package com.ssau.aips.pipeline.service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.ssau.aips.pipeline.model.BehaviorRecord;

public class BehaviorWindowState {

    private final Deque<BehaviorRecord> records = new ArrayDeque<>();

    void append(BehaviorRecord record, int capacity) {
        records.addLast(record);
        while (records.size() > capacity) {
            records.removeFirst();
        }
    }

    public int size() {
        return records.size();
    }

    public List<BehaviorRecord> records() {
        return List.copyOf(records);
    }

    Iterable<BehaviorRecord> view() {
        return records;
    }
}
