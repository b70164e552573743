/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.runtime.evaluation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.lexiqa.qaengine.api.IProfileCompiler;
import com.lexiqa.qaengine.api.IQaEngine;
import com.lexiqa.qaengine.api.exceptions.InvalidPatternException;
import com.lexiqa.qaengine.api.model.BatchFindResult;
import com.lexiqa.qaengine.api.model.BatchReplaceResult;
import com.lexiqa.qaengine.api.model.Diagnostic;
import com.lexiqa.qaengine.api.model.EditOutcome;
import com.lexiqa.qaengine.api.model.MatchReport;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.RecordEdit;
import com.lexiqa.qaengine.api.model.ReplaceOutcome;
import com.lexiqa.qaengine.api.model.RuleTally;
import com.lexiqa.qaengine.api.model.TextRecord;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;
import com.lexiqa.qaengine.runtime.model.CompiledRule;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.MatchResult;

/**
 * Runs profiles over batches of text records.
 *
 * <h2>Execution model</h2>
 * <ul>
 *   <li>Within a record, rules run strictly in ascending order. In replace mode each
 *       rule receives the previous rule's output.</li>
 *   <li>Records are independent. Batches of at least {@code parallelThreshold} records
 *       are split into chunks and processed on a fixed worker pool. Each task writes
 *       only to its own slots of an index-addressed result array, so output order is
 *       record order whatever the completion order.</li>
 *   <li>Compiled patterns are immutable and shared by all workers.</li>
 *   <li>Records with an empty target are skipped.</li>
 * </ul>
 *
 * <h2>Failure model</h2>
 * <p>Rules that failed to compile are skipped and reported as diagnostics. Any other
 * failure while processing a record fails the whole call with {@link BatchExecutionException};
 * no partially rewritten batch is ever returned.
 *
 * <h2>Thread Safety</h2>
 * <p>This class is thread-safe. Input records are never mutated.
 */
public final class MatchEngine implements IQaEngine, AutoCloseable {
    private static final Logger logger = Logger.getLogger(MatchEngine.class.getName());

    public static final int DEFAULT_PARALLEL_THRESHOLD = 256;

    private static final int CHUNKS_PER_WORKER = 4;

    private final IProfileCompiler compiler;
    private final Tracer tracer;
    private final ExecutorService workers;
    private final int workerCount;
    private final int parallelThreshold;
    private final EngineMetrics metrics = new EngineMetrics();

    public MatchEngine(IProfileCompiler compiler, Tracer tracer) {
        this(compiler, tracer, Runtime.getRuntime().availableProcessors(), DEFAULT_PARALLEL_THRESHOLD);
    }

    /**
     * @param compiler          compiles profiles handed in uncompiled
     * @param tracer            OpenTelemetry tracer
     * @param workerCount       worker threads; 1 or less processes every batch on the calling thread
     * @param parallelThreshold smallest batch processed on the worker pool
     */
    public MatchEngine(IProfileCompiler compiler, Tracer tracer, int workerCount, int parallelThreshold) {
        this.compiler = Objects.requireNonNull(compiler, "Compiler cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.workerCount = Math.max(1, workerCount);
        this.parallelThreshold = Math.max(1, parallelThreshold);
        this.workers = this.workerCount > 1
                ? Executors.newFixedThreadPool(this.workerCount, new ThreadFactoryBuilder()
                        .setNameFormat("qa-engine-worker-%d")
                        .setDaemon(true)
                        .build())
                : null;
        logger.info(String.format("MatchEngine initialized: workers=%d, parallelThreshold=%d",
                this.workerCount, this.parallelThreshold));
    }

    @Override
    public BatchFindResult find(Profile profile, String sourceId, List<TextRecord> records) {
        return find(compiler.compile(profile), sourceId, records);
    }

    @Override
    public BatchFindResult find(CompiledProfile profile, String sourceId, List<TextRecord> records) {
        Span span = tracer.spanBuilder("batch-find").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            span.setAttribute("profile.name", profile.name());
            span.setAttribute("records", records.size());

            List<List<MatchReport>> perRecord = runPerRecord(records, record -> findInRecord(profile, record));
            List<MatchReport> matches = new ArrayList<>();
            perRecord.forEach(matches::addAll);

            long duration = System.nanoTime() - start;
            metrics.recordFind(records.size(), matches.size(), profile.diagnostics().size(), duration);
            span.setAttribute("matches", matches.size());
            logger.info(String.format("Find with profile '%s' on '%s': %d matches in %d records (%.2f ms)",
                    profile.name(), sourceId, matches.size(), records.size(), duration / 1_000_000.0));

            return BatchFindResult.of(profile.name(), sourceId, matches, profile.diagnostics());
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public ReplaceOutcome replace(Profile profile, List<TextRecord> records) {
        return replace(compiler.compile(profile), records);
    }

    @Override
    public ReplaceOutcome replace(CompiledProfile profile, List<TextRecord> records) {
        Span span = tracer.spanBuilder("batch-replace").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            span.setAttribute("profile.name", profile.name());
            span.setAttribute("records", records.size());

            List<RecordReplacement> perRecord = runPerRecord(records, record -> replaceInRecord(profile, record));

            List<CompiledRule> rules = profile.rules();
            int[] replacedByRule = new int[rules.size()];
            int[] recordsByRule = new int[rules.size()];
            List<TextRecord> output = new ArrayList<>(perRecord.size());
            int modified = 0;
            int total = 0;
            for (RecordReplacement result : perRecord) {
                output.add(result.record());
                if (result.modified()) {
                    modified++;
                }
                for (int i = 0; i < rules.size(); i++) {
                    int count = result.countsByRule()[i];
                    replacedByRule[i] += count;
                    total += count;
                    if (count > 0) {
                        recordsByRule[i]++;
                    }
                }
            }
            List<RuleTally> tallies = new ArrayList<>(rules.size());
            for (int i = 0; i < rules.size(); i++) {
                tallies.add(new RuleTally(rules.get(i).name(), rules.get(i).order(), replacedByRule[i], recordsByRule[i]));
            }

            long duration = System.nanoTime() - start;
            metrics.recordReplace(records.size(), total, modified, profile.diagnostics().size(), duration);
            span.setAttribute("replacements", total);
            span.setAttribute("modifiedRecords", modified);
            logger.info(String.format("Replace with profile '%s': %d replacements in %d of %d records (%.2f ms)",
                    profile.name(), total, modified, records.size(), duration / 1_000_000.0));

            BatchReplaceResult result = BatchReplaceResult.of(modified, total, tallies, profile.diagnostics());
            return new ReplaceOutcome(output, result);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public EditOutcome applyEdits(List<TextRecord> records, List<RecordEdit> edits) {
        Span span = tracer.spanBuilder("apply-edits").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("records", records.size());
            span.setAttribute("edits", edits.size());

            Map<String, Integer> positions = new HashMap<>();
            for (int i = 0; i < records.size(); i++) {
                positions.putIfAbsent(records.get(i).id(), i);
            }
            List<TextRecord> output = new ArrayList<>(records);
            List<Diagnostic> failures = new ArrayList<>();
            int applied = 0;
            for (RecordEdit edit : edits) {
                Integer position = positions.get(edit.id());
                if (position == null) {
                    logger.warning("Edit for unknown record id '" + edit.id() + "' ignored");
                    failures.add(Diagnostic.unknownRecord(edit.id()));
                    continue;
                }
                output.set(position, output.get(position).withTarget(edit.target()));
                applied++;
            }

            metrics.recordEdits(applied, failures.size());
            span.setAttribute("applied", applied);
            span.setAttribute("unknownIds", failures.size());
            return new EditOutcome(output, applied, failures);
        } finally {
            span.end();
        }
    }

    /**
     * Applies one rule to a sample text, for trying a rule out before saving it.
     *
     * @throws InvalidPatternException if the rule does not compile
     */
    public RuleApplication preview(PatternRule rule, String sample) throws InvalidPatternException {
        if (!rule.hasPattern() || sample == null || sample.isEmpty()) {
            return new RuleApplication(sample == null ? "" : sample, 0);
        }
        return RuleMatcher.replaceAll(compiler.compileRule(rule), sample);
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }

    public Map<String, Object> getDetailedMetrics() {
        Map<String, Object> all = new HashMap<>(metrics.getSnapshot());
        all.put("workers", workerCount);
        all.put("parallelThreshold", parallelThreshold);
        all.put("patternCache", compiler.getCacheMetrics());
        return all;
    }

    @Override
    public void close() {
        if (workers != null) {
            workers.shutdown();
        }
    }

    private List<MatchReport> findInRecord(CompiledProfile profile, TextRecord record) {
        if (!record.hasTarget()) {
            return List.of();
        }
        String target = record.target();
        List<MatchReport> reports = new ArrayList<>();
        for (CompiledRule rule : profile.rules()) {
            PatternRule source = rule.rule();
            for (MatchResult match : RuleMatcher.findAll(rule, target)) {
                int start = target.codePointCount(0, match.start());
                int end = start + target.codePointCount(match.start(), match.end());
                reports.add(new MatchReport(
                        record.id(),
                        source.name(),
                        source.order(),
                        source.category(),
                        source.description(),
                        record.source(),
                        target,
                        match.group(),
                        start,
                        end,
                        source.pattern(),
                        source.replacement(),
                        rule.replacement().expand(match)));
            }
        }
        return reports;
    }

    private RecordReplacement replaceInRecord(CompiledProfile profile, TextRecord record) {
        List<CompiledRule> rules = profile.rules();
        int[] counts = new int[rules.size()];
        if (!record.hasTarget()) {
            return new RecordReplacement(record, false, counts);
        }
        String text = record.target();
        for (int i = 0; i < rules.size(); i++) {
            RuleApplication application = RuleMatcher.replaceAll(rules.get(i), text);
            counts[i] = application.replacements();
            text = application.text();
        }
        boolean modified = !text.equals(record.target());
        return new RecordReplacement(modified ? record.withTarget(text) : record, modified, counts);
    }

    private <T> List<T> runPerRecord(List<TextRecord> records, Function<TextRecord, T> task) {
        int size = records.size();
        if (workers == null || size < parallelThreshold) {
            List<T> results = new ArrayList<>(size);
            for (TextRecord record : records) {
                try {
                    results.add(task.apply(record));
                } catch (RuntimeException e) {
                    throw new BatchExecutionException(
                            "Batch processing failed on record '" + record.id() + "': " + e.getMessage(), e);
                }
            }
            return results;
        }

        Object[] slots = new Object[size];
        int chunkSize = Math.max(1, (size + workerCount * CHUNKS_PER_WORKER - 1) / (workerCount * CHUNKS_PER_WORKER));
        List<Future<?>> futures = new ArrayList<>();
        for (int from = 0; from < size; from += chunkSize) {
            int chunkStart = from;
            int chunkEnd = Math.min(size, from + chunkSize);
            futures.add(workers.submit(() -> {
                for (int i = chunkStart; i < chunkEnd; i++) {
                    slots[i] = task.apply(records.get(i));
                }
            }));
        }
        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            logger.log(Level.SEVERE, "Batch task failed, discarding batch", e.getCause());
            throw new BatchExecutionException("Batch processing failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new BatchExecutionException("Interrupted while processing batch", e);
        }

        List<T> results = new ArrayList<>(size);
        for (Object slot : slots) {
            @SuppressWarnings("unchecked")
            T value = (T) slot;
            results.add(value);
        }
        return results;
    }

    private record RecordReplacement(TextRecord record, boolean modified, int[] countsByRule) {
    }
}
