/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.api;

import com.lexiqa.qaengine.api.model.BatchFindResult;
import com.lexiqa.qaengine.api.model.EditOutcome;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.RecordEdit;
import com.lexiqa.qaengine.api.model.ReplaceOutcome;
import com.lexiqa.qaengine.api.model.TextRecord;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;

import java.util.List;

/**
 * Contract for running a profile over a batch of text records.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IQaEngine engine = // obtain from factory
 *
 * BatchFindResult found = engine.find(profile, "chapter1.xlf", records);
 * for (MatchReport m : found.matches()) {
 *     System.out.println(m.recordId() + ": " + m.ruleName() + " at " + m.start());
 * }
 *
 * ReplaceOutcome fixed = engine.replace(profile, records);
 * store.persist(fixed.records());
 * }</pre>
 *
 * <h2>Ordering</h2>
 * <p>Within a record, enabled rules run strictly one after another in ascending
 * order. Records are independent and may be processed concurrently, but every
 * result is reported in record order regardless of scheduling.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be thread-safe. Inputs are never mutated.
 */
public interface IQaEngine {

    /**
     * Reports every accepted match of every enabled rule without changing any record.
     *
     * @param profile  the profile to run
     * @param sourceId identifier of the document the records came from
     * @param records  records in store order
     * @return match reports and diagnostics
     */
    BatchFindResult find(Profile profile, String sourceId, List<TextRecord> records);

    /**
     * Same as {@link #find(Profile, String, List)} for an already compiled profile.
     */
    BatchFindResult find(CompiledProfile profile, String sourceId, List<TextRecord> records);

    /**
     * Rewrites records by applying enabled rules in order, each rule seeing the
     * previous rule's output.
     *
     * <p>All or nothing: either every record is processed and the full set is
     * returned, or the call fails with no partial result.
     *
     * @param profile the profile to run
     * @param records records in store order
     * @return all records (rewritten where a rule applied) and the replacement tally
     */
    ReplaceOutcome replace(Profile profile, List<TextRecord> records);

    /**
     * Same as {@link #replace(Profile, List)} for an already compiled profile.
     */
    ReplaceOutcome replace(CompiledProfile profile, List<TextRecord> records);

    /**
     * Overwrites the target text of the records named by the edits. No pattern matching.
     * Edits naming unknown ids are reported and do not stop the remaining edits.
     *
     * @param records records in store order
     * @param edits   edits in application order
     * @return updated records and per-edit failures
     */
    EditOutcome applyEdits(List<TextRecord> records, List<RecordEdit> edits);
}
