package com.lexiqa.qaengine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexiqa.qaengine.api.RecordStore;
import com.lexiqa.qaengine.api.model.BatchFindResult;
import com.lexiqa.qaengine.api.model.BatchReplaceResult;
import com.lexiqa.qaengine.api.model.EditOutcome;
import com.lexiqa.qaengine.api.model.ErrorKind;
import com.lexiqa.qaengine.api.model.MatchReport;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.RecordEdit;
import com.lexiqa.qaengine.api.model.TextRecord;
import com.lexiqa.qaengine.compiler.ProfileCompiler;
import com.lexiqa.qaengine.infra.persistence.BackupManager;
import com.lexiqa.qaengine.infra.persistence.InMemoryRecordStore;
import com.lexiqa.qaengine.infra.persistence.JsonRecordStore;
import com.lexiqa.qaengine.infra.persistence.ProfileStore;
import com.lexiqa.qaengine.runtime.evaluation.MatchEngine;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class QaBatchServiceTest {

    private static final Tracer TRACER = OpenTelemetry.noop().getTracer("test");

    @TempDir
    Path tempDir;

    private MatchEngine engine;
    private QaBatchService service;
    private Profile profile;

    @BeforeEach
    void setUp() throws Exception {
        engine = new MatchEngine(new ProfileCompiler(TRACER), TRACER);
        service = new QaBatchService(engine, TRACER);
        Path profilePath = copyFixture("norwegian_qa_profile.xml");
        profile = new ProfileStore(TRACER).load(profilePath);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private Path copyFixture(String name) throws Exception {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void shouldFindWithoutPersisting() throws Exception {
        RecordStore store = spy(new JsonRecordStore(copyFixture("records.json")));

        BatchFindResult result = service.batchFind(profile, store);

        assertThat(result.sourceId()).isEqualTo("records.json");
        assertThat(result.profileName()).isEqualTo("Norwegian & Nordic");
        assertThat(result.matchesFor("1")).extracting(MatchReport::ruleName)
                .containsExactly("Space before unit", "Double space");
        assertThat(result.matchesFor("2")).hasSize(1);
        assertThat(result.totalMatches()).isEqualTo(3);
        verify(store, never()).persist(anyList());
    }

    @Test
    void shouldReplaceAndPersistChangedRecords() throws Exception {
        Path recordsPath = copyFixture("records.json");
        Path output = tempDir.resolve("fixed.json");
        JsonRecordStore store = new JsonRecordStore(recordsPath, output, new ObjectMapper());

        BatchReplaceResult result = service.batchReplace(profile, store);

        assertThat(result.success()).isTrue();
        assertThat(result.totalReplacements()).isEqualTo(2);
        assertThat(result.modifiedRecords()).isEqualTo(2);
        assertThat(result.outputLocation()).isEqualTo(output.toAbsolutePath().toString());

        List<TextRecord> saved = new JsonRecordStore(output).list();
        assertThat(saved).extracting(TextRecord::target)
                .containsExactly("Pris: 10 EUR", "Hei verden", "Ingenting å fikse", "");
        assertThat(saved.get(1).metadata()).containsEntry("state", "translated");
    }

    @Test
    void shouldNotPersistWhenNothingWasReplaced() throws Exception {
        RecordStore store = spy(new InMemoryRecordStore("clean", List.of(TextRecord.of("1", "Alt er fint"))));

        BatchReplaceResult result = service.batchReplace(profile, store);

        assertThat(result.success()).isFalse();
        assertThat(result.totalReplacements()).isZero();
        assertThat(result.outputLocation()).isEmpty();
        verify(store, never()).persist(anyList());
    }

    @Test
    void shouldReplaceWithCompiledProfile() throws Exception {
        Profile single = new Profile("Quotes", "", "nb",
                List.of(PatternRule.builder().order(1).pattern("\"([^\"]*)\"").replacement("«$1»").build()), 0, 0);
        InMemoryRecordStore store = new InMemoryRecordStore("mem", List.of(TextRecord.of("a", "Han sa \"hei\"")));

        BatchReplaceResult result = service.batchReplace(new ProfileCompiler(TRACER).compile(single), store);

        assertThat(result.outputLocation()).isEqualTo("memory:mem");
        assertThat(store.list()).extracting(TextRecord::target).containsExactly("Han sa «hei»");
    }

    @Test
    void shouldApplyEditsAndReportUnknownIds() throws Exception {
        InMemoryRecordStore store = new InMemoryRecordStore("mem",
                List.of(TextRecord.of("1", "gammel"), TextRecord.of("2", "uendret")));

        EditOutcome outcome = service.applyEdits(store,
                List.of(new RecordEdit("1", "ny"), new RecordEdit("99", "ingen")));

        assertThat(outcome.applied()).isEqualTo(1);
        assertThat(outcome.failures()).singleElement()
                .satisfies(d -> {
                    assertThat(d.kind()).isEqualTo(ErrorKind.UNKNOWN_RECORD_ID);
                    assertThat(d.subject()).isEqualTo("99");
                });
        assertThat(store.list()).extracting(TextRecord::target).containsExactly("ny", "uendret");
    }

    @Test
    void shouldNotPersistWhenNoEditApplies() throws Exception {
        RecordStore store = spy(new InMemoryRecordStore("mem", List.of(TextRecord.of("1", "tekst"))));

        EditOutcome outcome = service.applyEdits(store, List.of(new RecordEdit("2", "x")));

        assertThat(outcome.applied()).isZero();
        assertThat(outcome.hasFailures()).isTrue();
        verify(store, never()).persist(anyList());
    }

    @Test
    void shouldLeaveRestorableBackupWhenReplacingOverInput() throws Exception {
        Path recordsPath = copyFixture("records.json");
        String original = Files.readString(recordsPath);
        BackupManager backups = new BackupManager(null, 10, TRACER);
        QaBatchService backedUp = new QaBatchService(engine, TRACER, backups);

        BatchReplaceResult result = backedUp.batchReplace(profile, new JsonRecordStore(recordsPath));

        assertThat(result.totalReplacements()).isEqualTo(2);
        assertThat(Files.readString(recordsPath)).isNotEqualTo(original);
        List<Path> saved = backups.listBackups(recordsPath);
        assertThat(saved).singleElement()
                .satisfies(b -> assertThat(b.getFileName().toString()).startsWith("records_backup_"));
        assertThat(Files.readString(saved.get(0))).isEqualTo(original);

        backups.restoreLatest(recordsPath);

        assertThat(Files.readString(recordsPath)).isEqualTo(original);
        assertThat(new JsonRecordStore(recordsPath).list()).extracting(TextRecord::target)
                .containsExactly("Pris: 10  EUR", "Hei  verden", "Ingenting å fikse", "");
    }

    @Test
    void shouldNotBackUpNewOutputFile() throws Exception {
        Path recordsPath = copyFixture("records.json");
        Path output = tempDir.resolve("out").resolve("fixed.json");
        BackupManager backups = new BackupManager(null, 10, TRACER);

        new QaBatchService(engine, TRACER, backups)
                .batchReplace(profile, new JsonRecordStore(recordsPath, output, new ObjectMapper()));

        assertThat(backups.listBackups(recordsPath)).isEmpty();
        assertThat(backups.listBackups(output)).isEmpty();
    }

    @Test
    void shouldSkipBackupsWhenDisabled() throws Exception {
        Path recordsPath = copyFixture("records.json");
        BackupManager backups = new BackupManager(null, 10, TRACER);

        new QaBatchService(engine, TRACER, backups).withoutBackups()
                .batchReplace(profile, new JsonRecordStore(recordsPath));

        assertThat(backups.listBackups(recordsPath)).isEmpty();
    }

    @Test
    void shouldBackUpBeforeApplyingEdits() throws Exception {
        Path recordsPath = copyFixture("records.json");
        BackupManager backups = new BackupManager(tempDir.resolve("backups"), 10, TRACER);

        new QaBatchService(engine, TRACER, backups)
                .applyEdits(new JsonRecordStore(recordsPath), List.of(new RecordEdit("3", "Fikset")));

        assertThat(backups.listBackups(recordsPath)).singleElement()
                .satisfies(b -> assertThat(b.getParent()).isEqualTo(tempDir.resolve("backups")));
    }
}
