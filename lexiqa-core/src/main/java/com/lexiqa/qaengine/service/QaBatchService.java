/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.service;

import com.lexiqa.qaengine.api.IQaEngine;
import com.lexiqa.qaengine.api.RecordStore;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.BatchFindResult;
import com.lexiqa.qaengine.api.model.BatchReplaceResult;
import com.lexiqa.qaengine.api.model.EditOutcome;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.RecordEdit;
import com.lexiqa.qaengine.api.model.ReplaceOutcome;
import com.lexiqa.qaengine.api.model.TextRecord;
import com.lexiqa.qaengine.infra.persistence.BackupManager;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Connects the engine to record stores: reads the records, runs the batch and writes
 * the result back when it changed anything.
 *
 * <p>With a {@link BackupManager}, the file a store is about to overwrite is backed up
 * first and its old backups are pruned. A failed backup aborts the write.
 */
public class QaBatchService {
    private static final Logger logger = Logger.getLogger(QaBatchService.class.getName());

    private final IQaEngine engine;
    private final Tracer tracer;
    private final BackupManager backups;

    public QaBatchService(IQaEngine engine, Tracer tracer) {
        this(engine, tracer, null);
    }

    /**
     * @param backups backs up overwritten files, or {@code null} to write without backups
     */
    public QaBatchService(IQaEngine engine, Tracer tracer, BackupManager backups) {
        this.engine = Objects.requireNonNull(engine, "IQaEngine cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.backups = backups;
    }

    /**
     * Same engine and tracer, without backups.
     */
    public QaBatchService withoutBackups() {
        return backups == null ? this : new QaBatchService(engine, tracer, null);
    }

    public BatchFindResult batchFind(Profile profile, RecordStore store) throws IOException {
        List<TextRecord> records = store.list();
        BatchFindResult result = engine.find(profile, store.sourceId(), records);
        logFind(result, records.size());
        return result;
    }

    public BatchFindResult batchFind(CompiledProfile profile, RecordStore store) throws IOException {
        List<TextRecord> records = store.list();
        BatchFindResult result = engine.find(profile, store.sourceId(), records);
        logFind(result, records.size());
        return result;
    }

    /**
     * Runs replace mode and persists the records if at least one span was replaced.
     * The returned result carries the location written to, or an empty location.
     */
    public BatchReplaceResult batchReplace(Profile profile, RecordStore store) throws IOException {
        List<TextRecord> records = store.list();
        return persistIfChanged(engine.replace(profile, records), store);
    }

    public BatchReplaceResult batchReplace(CompiledProfile profile, RecordStore store) throws IOException {
        List<TextRecord> records = store.list();
        return persistIfChanged(engine.replace(profile, records), store);
    }

    /**
     * Applies manual edits and persists the records if at least one edit found its record.
     */
    public EditOutcome applyEdits(RecordStore store, List<RecordEdit> edits) throws IOException {
        EditOutcome outcome = engine.applyEdits(store.list(), edits);
        if (outcome.applied() > 0) {
            String location = persist(store, outcome.records());
            logger.info("Applied " + outcome.applied() + " edits to " + store.sourceId() + ", saved to " + location);
        }
        if (outcome.hasFailures()) {
            logger.warning(outcome.failures().size() + " edits named unknown records in " + store.sourceId());
        }
        return outcome;
    }

    private BatchReplaceResult persistIfChanged(ReplaceOutcome outcome, RecordStore store) throws IOException {
        BatchReplaceResult result = outcome.result();
        if (result.totalReplacements() == 0) {
            logger.info("No replacements in " + store.sourceId() + ", nothing saved");
            return result;
        }
        String location = persist(store, outcome.records());
        logger.info(String.format("Replaced %d spans in %d records of %s, saved to %s",
                result.totalReplacements(), result.modifiedRecords(), store.sourceId(), location));
        return result.withOutputLocation(location);
    }

    private String persist(RecordStore store, List<TextRecord> records) throws IOException {
        Span span = tracer.spanBuilder("persist-records").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source", store.sourceId());
            span.setAttribute("records", records.size());
            Optional<Path> overwritten = store.overwrittenDocument();
            if (backups != null && overwritten.isPresent()) {
                Path backup = backups.backupAndPrune(overwritten.get());
                span.setAttribute("backup", backup.toString());
            }
            return store.persist(records);
        } catch (ResourceNotFoundException e) {
            span.recordException(e);
            throw new IOException("Could not back up " + store.sourceId() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void logFind(BatchFindResult result, int recordCount) {
        logger.info(String.format("Profile '%s' found %d matches in %d records of %s",
                result.profileName(), result.totalMatches(), recordCount, result.sourceId()));
    }
}
