package com.lexiqa.qaengine.runtime.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative counters of a {@link MatchEngine}. Safe to update from worker threads.
 */
public final class EngineMetrics {

    private final AtomicLong findBatches = new AtomicLong();
    private final AtomicLong replaceBatches = new AtomicLong();
    private final AtomicLong editBatches = new AtomicLong();
    private final AtomicLong recordsScanned = new AtomicLong();
    private final AtomicLong matchesFound = new AtomicLong();
    private final AtomicLong replacements = new AtomicLong();
    private final AtomicLong recordsModified = new AtomicLong();
    private final AtomicLong rulesSkipped = new AtomicLong();
    private final AtomicLong editsApplied = new AtomicLong();
    private final AtomicLong unknownEditIds = new AtomicLong();
    private final AtomicLong totalBatchNanos = new AtomicLong();

    void recordFind(int records, int matches, int skippedRules, long nanos) {
        findBatches.incrementAndGet();
        recordsScanned.addAndGet(records);
        matchesFound.addAndGet(matches);
        rulesSkipped.addAndGet(skippedRules);
        totalBatchNanos.addAndGet(nanos);
    }

    void recordReplace(int records, int replaced, int modified, int skippedRules, long nanos) {
        replaceBatches.incrementAndGet();
        recordsScanned.addAndGet(records);
        replacements.addAndGet(replaced);
        recordsModified.addAndGet(modified);
        rulesSkipped.addAndGet(skippedRules);
        totalBatchNanos.addAndGet(nanos);
    }

    void recordEdits(int applied, int unknown) {
        editBatches.incrementAndGet();
        editsApplied.addAndGet(applied);
        unknownEditIds.addAndGet(unknown);
    }

    public long getMatchesFound() {
        return matchesFound.get();
    }

    public long getReplacements() {
        return replacements.get();
    }

    public long getRecordsScanned() {
        return recordsScanned.get();
    }

    public Map<String, Object> getSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        long batches = findBatches.get() + replaceBatches.get();
        snapshot.put("findBatches", findBatches.get());
        snapshot.put("replaceBatches", replaceBatches.get());
        snapshot.put("editBatches", editBatches.get());
        snapshot.put("recordsScanned", recordsScanned.get());
        snapshot.put("matchesFound", matchesFound.get());
        snapshot.put("replacements", replacements.get());
        snapshot.put("recordsModified", recordsModified.get());
        snapshot.put("invalidRulesSkipped", rulesSkipped.get());
        snapshot.put("editsApplied", editsApplied.get());
        snapshot.put("unknownEditIds", unknownEditIds.get());
        snapshot.put("avgBatchTimeMs", batches == 0 ? 0.0 : totalBatchNanos.get() / 1_000_000.0 / batches);
        return Collections.unmodifiableMap(snapshot);
    }
}
