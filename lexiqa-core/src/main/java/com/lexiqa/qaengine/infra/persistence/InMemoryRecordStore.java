package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.RecordStore;
import com.lexiqa.qaengine.api.model.TextRecord;

import java.util.List;

/**
 * Record store backed by a list, for records submitted inline rather than as a file.
 * Persisting replaces the held list.
 */
public class InMemoryRecordStore implements RecordStore {

    private final String sourceId;
    private volatile List<TextRecord> records;

    public InMemoryRecordStore(String sourceId, List<TextRecord> records) {
        this.sourceId = sourceId;
        this.records = List.copyOf(records);
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public List<TextRecord> list() {
        return records;
    }

    @Override
    public String persist(List<TextRecord> updated) {
        this.records = List.copyOf(updated);
        return "memory:" + sourceId;
    }
}
