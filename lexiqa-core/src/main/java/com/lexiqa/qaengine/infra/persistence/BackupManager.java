/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.infra.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Timestamped copies of a document, taken before it is overwritten.
 *
 * <h2>Naming</h2>
 * <ul>
 *   <li>No backup directory: {@code <stem>_backup_<yyyyMMdd_HHmmss_SSS><ext>} next to the file</li>
 *   <li>With a backup directory: {@code <stem>_<yyyyMMdd_HHmmss_SSS><ext>} inside it</li>
 * </ul>
 * A numeric suffix is added when two backups land on the same millisecond. The timestamp
 * sorts lexically, so the newest backup is the greatest name.
 *
 * <p>After each backup taken through {@link #backupAndPrune(Path)} only the newest
 * {@code keepCount} backups of that file are kept.
 */
public class BackupManager {
    private static final Logger logger = Logger.getLogger(BackupManager.class.getName());

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final String STAMP_REGEX = "(\\d{8}_\\d{6}_\\d{3})(?:_(\\d+))?";

    private final Path backupDirectory;
    private final int keepCount;
    private final Tracer tracer;
    private final Clock clock;

    /**
     * @param backupDirectory directory collecting all backups, or {@code null} to keep each
     *                        backup next to its file
     */
    public BackupManager(Path backupDirectory, int keepCount, Tracer tracer) {
        this(backupDirectory, keepCount, tracer, Clock.systemDefaultZone());
    }

    BackupManager(Path backupDirectory, int keepCount, Tracer tracer, Clock clock) {
        if (keepCount < 1) {
            throw new IllegalArgumentException("keepCount must be at least 1: " + keepCount);
        }
        this.backupDirectory = backupDirectory;
        this.keepCount = keepCount;
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Copies {@code file} to a new backup.
     *
     * @return path of the backup
     * @throws ResourceNotFoundException if {@code file} does not exist
     */
    public Path createBackup(Path file) throws ResourceNotFoundException, IOException {
        if (!Files.isRegularFile(file)) {
            throw new ResourceNotFoundException("File to back up", file.toString());
        }
        Span span = tracer.spanBuilder("create-backup").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute(AttributeKey.stringKey("backup.source"), file.toString());
            Path root = rootFor(file);
            Files.createDirectories(root);
            String base = prefixFor(file) + STAMP.format(LocalDateTime.now(clock));
            String extension = extensionOf(file);
            Path backup = root.resolve(base + extension);
            for (int n = 1; Files.exists(backup); n++) {
                backup = root.resolve(base + "_" + n + extension);
            }
            Files.copy(file, backup, StandardCopyOption.COPY_ATTRIBUTES);
            span.setAttribute(AttributeKey.stringKey("backup.path"), backup.toString());
            Path created = backup;
            logger.info(() -> "Backup created: " + created);
            return backup;
        } catch (IOException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Backs up {@code file} and deletes its backups beyond the newest {@code keepCount}.
     */
    public Path backupAndPrune(Path file) throws ResourceNotFoundException, IOException {
        Path backup = createBackup(file);
        cleanup(file);
        return backup;
    }

    /**
     * @return backups of {@code file}, newest first
     */
    public List<Path> listBackups(Path file) throws IOException {
        Path root = rootFor(file);
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        Pattern names = Pattern.compile(Pattern.quote(prefixFor(file)) + STAMP_REGEX
                + Pattern.quote(extensionOf(file)));
        List<Path> backups = new ArrayList<>();
        try (Stream<Path> entries = Files.list(root)) {
            entries.filter(Files::isRegularFile)
                    .filter(p -> names.matcher(p.getFileName().toString()).matches())
                    .forEach(backups::add);
        }
        backups.sort(Comparator.comparing((Path p) -> sortKey(p, names)).reversed());
        return backups;
    }

    /**
     * Copies {@code backup} over {@code target}. An existing target is backed up first,
     * so a restore can itself be undone.
     *
     * @return the backup taken of the replaced target, or {@code null} if there was no target
     * @throws ResourceNotFoundException if {@code backup} does not exist
     */
    public Path restore(Path backup, Path target) throws ResourceNotFoundException, IOException {
        if (!Files.isRegularFile(backup)) {
            throw new ResourceNotFoundException("Backup", backup.toString());
        }
        Span span = tracer.spanBuilder("restore-backup").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute(AttributeKey.stringKey("backup.path"), backup.toString());
            span.setAttribute(AttributeKey.stringKey("backup.target"), target.toString());
            Path previous = Files.isRegularFile(target) ? createBackup(target) : null;
            Files.copy(backup, target, StandardCopyOption.REPLACE_EXISTING);
            logger.info(() -> "Backup restored: " + backup + " -> " + target);
            return previous;
        } catch (IOException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Restores the newest backup of {@code file}.
     *
     * @return the backup that was restored
     * @throws ResourceNotFoundException if {@code file} has no backup
     */
    public Path restoreLatest(Path file) throws ResourceNotFoundException, IOException {
        List<Path> backups = listBackups(file);
        if (backups.isEmpty()) {
            throw new ResourceNotFoundException("Backup of " + file.getFileName(), rootFor(file).toString());
        }
        Path latest = backups.get(0);
        restore(latest, file);
        return latest;
    }

    /**
     * Deletes the backups of {@code file} beyond the newest {@code keepCount}.
     *
     * @return number of backups deleted
     */
    public int cleanup(Path file) throws IOException {
        List<Path> backups = listBackups(file);
        if (backups.size() <= keepCount) {
            return 0;
        }
        int deleted = 0;
        for (Path old : backups.subList(keepCount, backups.size())) {
            if (Files.deleteIfExists(old)) {
                deleted++;
            }
        }
        int count = deleted;
        logger.fine(() -> "Deleted " + count + " old backups of " + file);
        return deleted;
    }

    public BackupInfo describe(Path backup) throws ResourceNotFoundException, IOException {
        if (!Files.isRegularFile(backup)) {
            throw new ResourceNotFoundException("Backup", backup.toString());
        }
        return new BackupInfo(backup.toAbsolutePath().toString(), backup.getFileName().toString(),
                Files.size(backup), Files.getLastModifiedTime(backup).toInstant().toString());
    }

    public int getKeepCount() {
        return keepCount;
    }

    private Path rootFor(Path file) {
        if (backupDirectory != null) {
            return backupDirectory;
        }
        Path parent = file.toAbsolutePath().getParent();
        return parent == null ? file.toAbsolutePath().getRoot() : parent;
    }

    private String prefixFor(Path file) {
        return stemOf(file) + (backupDirectory != null ? "_" : "_backup_");
    }

    static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    // Timestamp, then the same-millisecond suffix numerically, so _2 sorts before _10.
    private static String sortKey(Path backup, Pattern names) {
        Matcher matcher = names.matcher(backup.getFileName().toString());
        if (!matcher.matches()) {
            return "";
        }
        String suffix = matcher.group(2) == null ? "0" : matcher.group(2);
        return matcher.group(1) + "_" + "0".repeat(Math.max(0, 9 - suffix.length())) + suffix;
    }

    /**
     * What {@code backup list} reports for one backup.
     */
    public record BackupInfo(
            @JsonProperty("path") String path,
            @JsonProperty("name") String name,
            @JsonProperty("size") long size,
            @JsonProperty("modified") String modified) {
    }
}
