package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackupManagerTest {

    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");

    @TempDir
    Path tempDir;

    private Path records;
    private StepClock clock;

    @BeforeEach
    void setUp() throws Exception {
        records = tempDir.resolve("records.json");
        Files.writeString(records, "v1");
        clock = new StepClock(Instant.parse("2025-03-14T09:26:53.589Z"));
    }

    @Test
    void shouldPlaceBackupNextToFile() throws Exception {
        BackupManager manager = new BackupManager(null, 10, TRACER, clock);

        Path backup = manager.createBackup(records);

        assertThat(backup.getParent()).isEqualTo(tempDir);
        assertThat(backup.getFileName().toString()).isEqualTo("records_backup_20250314_092653_589.json");
        assertThat(Files.readString(backup)).isEqualTo("v1");
    }

    @Test
    void shouldPlaceBackupInBackupDirectory() throws Exception {
        Path dir = tempDir.resolve("backups");
        BackupManager manager = new BackupManager(dir, 10, TRACER, clock);

        Path backup = manager.createBackup(records);

        assertThat(backup).isEqualTo(dir.resolve("records_20250314_092653_589.json"));
        assertThat(manager.listBackups(records)).containsExactly(backup);
    }

    @Test
    void shouldNotOverwriteBackupTakenInSameMillisecond() throws Exception {
        BackupManager manager = new BackupManager(null, 20, TRACER, Clock.fixed(clock.instant(), ZoneOffset.UTC));
        Path first = manager.createBackup(records);
        Files.writeString(records, "v2");
        Path second = manager.createBackup(records);
        for (int i = 3; i <= 11; i++) {
            manager.createBackup(records);
        }

        assertThat(second.getFileName().toString()).isEqualTo("records_backup_20250314_092653_589_1.json");
        assertThat(Files.readString(first)).isEqualTo("v1");
        assertThat(Files.readString(second)).isEqualTo("v2");
        List<Path> listed = manager.listBackups(records);
        assertThat(listed).hasSize(11);
        assertThat(listed.get(0).getFileName().toString()).endsWith("_589_10.json");
        assertThat(listed.get(listed.size() - 1)).isEqualTo(first);
    }

    @Test
    void shouldListNewestFirstAndIgnoreOtherFiles() throws Exception {
        BackupManager manager = new BackupManager(null, 10, TRACER, clock);
        Path older = manager.createBackup(records);
        Path newer = manager.createBackup(records);
        Files.writeString(tempDir.resolve("records_backup_notes.json"), "");
        Files.writeString(tempDir.resolve("other_backup_20250314_092653_589.json"), "");
        Files.writeString(tempDir.resolve("records_backup_20250314_092653_589.xml"), "");

        assertThat(manager.listBackups(records)).containsExactly(newer, older);
    }

    @Test
    void shouldKeepOnlyNewestBackups() throws Exception {
        BackupManager manager = new BackupManager(null, 2, TRACER, clock);
        Path first = manager.backupAndPrune(records);
        Path second = manager.backupAndPrune(records);
        Path third = manager.backupAndPrune(records);

        assertThat(manager.listBackups(records)).containsExactly(third, second);
        assertThat(first).doesNotExist();
        assertThat(manager.cleanup(records)).isZero();
    }

    @Test
    void shouldBackUpCurrentFileBeforeRestoring() throws Exception {
        BackupManager manager = new BackupManager(null, 10, TRACER, clock);
        Path backup = manager.createBackup(records);
        Files.writeString(records, "v2");

        Path previous = manager.restore(backup, records);

        assertThat(Files.readString(records)).isEqualTo("v1");
        assertThat(Files.readString(previous)).isEqualTo("v2");
        assertThat(manager.listBackups(records)).containsExactly(previous, backup);
    }

    @Test
    void shouldRestoreIntoMissingTargetWithoutBackup() throws Exception {
        BackupManager manager = new BackupManager(null, 10, TRACER, clock);
        Path backup = manager.createBackup(records);
        Files.delete(records);

        assertThat(manager.restore(backup, records)).isNull();
        assertThat(Files.readString(records)).isEqualTo("v1");
    }

    @Test
    void shouldRestoreLatestBackup() throws Exception {
        BackupManager manager = new BackupManager(null, 10, TRACER, clock);
        manager.createBackup(records);
        Files.writeString(records, "v2");
        Path latest = manager.createBackup(records);
        Files.writeString(records, "v3");

        assertThat(manager.restoreLatest(records)).isEqualTo(latest);
        assertThat(Files.readString(records)).isEqualTo("v2");
    }

    @Test
    void shouldReportMissingFiles() {
        BackupManager manager = new BackupManager(null, 10, TRACER, clock);

        assertThatThrownBy(() -> manager.createBackup(tempDir.resolve("missing.json")))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> manager.restore(tempDir.resolve("missing_backup.json"), records))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> manager.restoreLatest(records))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> new BackupManager(null, 0, TRACER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDescribeBackup() throws Exception {
        BackupManager manager = new BackupManager(null, 10, TRACER, clock);
        Path backup = manager.createBackup(records);

        BackupManager.BackupInfo info = manager.describe(backup);

        assertThat(info.name()).isEqualTo(backup.getFileName().toString());
        assertThat(info.size()).isEqualTo(2);
        assertThat(info.path()).isEqualTo(backup.toAbsolutePath().toString());
        assertThat(info.modified()).isNotEmpty();
    }

    /**
     * Advances one second on every read, so consecutive backups get distinct names.
     */
    private static final class StepClock extends Clock {
        private Instant next;

        StepClock(Instant start) {
            this.next = start.minusSeconds(1);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            next = next.plus(Duration.ofSeconds(1));
            return next;
        }
    }
}
