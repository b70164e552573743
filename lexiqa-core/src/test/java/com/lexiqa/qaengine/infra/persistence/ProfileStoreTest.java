package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileStoreTest {

    @TempDir
    Path tempDir;

    private ProfileStore store;
    private Profile profile;

    @BeforeEach
    void setUp() {
        store = new ProfileStore(OpenTelemetry.noop().getTracer("test"));
        profile = new Profile("My Norwegian Checks", "d", "nb-NO",
                List.of(PatternRule.builder().order(1).name("r").pattern("a").replacement("b").build()),
                86_400L, 172_800L);
    }

    @Test
    void shouldSaveIntoMissingDirectoriesAndLoadBack() throws Exception {
        Path path = tempDir.resolve("a").resolve("b").resolve("p_qa_profile.xml");

        store.save(profile, path);

        assertThat(store.load(path)).isEqualTo(profile);
    }

    @Test
    void shouldOverwriteExistingDocument() throws Exception {
        Path path = tempDir.resolve("p_qa_profile.xml");
        store.save(profile, path);

        Profile updated = profile.withRule(PatternRule.builder().order(2).pattern("c").build());
        store.save(updated, path);

        assertThat(store.load(path).rules()).hasSize(2);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void shouldReportMissingProfile() {
        assertThatThrownBy(() -> store.load(tempDir.resolve("missing_qa_profile.xml")))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageStartingWith("Profile not found");
    }

    @Test
    void shouldImportUnderNameDerivedFromProfileName() throws Exception {
        Path source = tempDir.resolve("export.xml");
        store.save(profile, source);
        Path profilesDir = tempDir.resolve("profiles");

        Path imported = store.importInto(source, profilesDir);

        assertThat(imported.getFileName().toString()).isEqualTo("my_norwegian_checks_qa_profile.xml");
        assertThat(store.load(imported)).isEqualTo(profile);
    }

    @Test
    void shouldDeriveFallbackFileNameForEmptyName() {
        assertThat(store.fileNameFor("   ", Instant.ofEpochSecond(1234)))
                .isEqualTo("imported_profile_1234_qa_profile.xml");
        assertThat(store.fileNameFor("a/b\\c", Instant.EPOCH)).isEqualTo("a_b_c_qa_profile.xml");
    }

    @Test
    void shouldExportAndDelete() throws Exception {
        Path target = tempDir.resolve("shared").resolve("profile.xml");

        store.exportTo(profile, target);

        assertThat(store.load(target)).isEqualTo(profile);
        assertThat(store.delete(target)).isTrue();
        assertThat(store.delete(target)).isFalse();
    }

    @Test
    void shouldRefuseToSaveControlCharactersAndLeaveExistingDocument() throws Exception {
        Path path = tempDir.resolve("p_qa_profile.xml");
        store.save(profile, path);
        Profile broken = profile.withRule(PatternRule.builder().order(2).name("bell\u0001name").pattern("x").build());

        assertThatThrownBy(() -> store.save(broken, path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Check 2 field name")
                .hasMessageContaining("U+0001");

        assertThat(store.load(path)).isEqualTo(profile);
    }

    @Test
    void shouldRefuseUnpairedSurrogatesAndNonCharacters() {
        Path path = tempDir.resolve("p_qa_profile.xml");

        assertThatThrownBy(() -> store.save(
                new Profile("half \uD83D", "", "", List.of(), 0L, 0L), path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Profile field name")
                .hasMessageContaining("U+D83D");
        assertThatThrownBy(() -> store.save(
                new Profile("n", "\uFFFE", "", List.of(), 0L, 0L), path))
                .hasMessageContaining("Profile field description")
                .hasMessageContaining("U+FFFE");
        assertThat(path).doesNotExist();
    }

    @Test
    void shouldKeepTabsAndSupplementaryCharacters() throws Exception {
        Path path = tempDir.resolve("p_qa_profile.xml");
        Profile textual = new Profile("tab\there \uD83D\uDE00", "line\nbreak", "nb-NO", List.of(), 0L, 0L);

        store.save(textual, path);

        assertThat(store.load(path)).isEqualTo(textual);
    }
}
