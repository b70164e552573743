package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.ProfileInfo;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileDiscoveryTest {

    @TempDir
    Path tempDir;

    private final ProfileStore store = new ProfileStore(OpenTelemetry.noop().getTracer("test"));

    @Test
    void shouldListOnlyProfileDocumentsSortedByFileName() throws Exception {
        store.save(new Profile("Zeta", "last", "sv", List.of(), 0, 0), tempDir.resolve("b_qa_profile.xml"));
        store.save(new Profile("Alpha", "first", "nb", List.of(
                PatternRule.builder().order(1).pattern("x").build(),
                PatternRule.builder().order(2).pattern("y").build()), 0, 0), tempDir.resolve("a_qa_profile.xml"));
        Files.writeString(tempDir.resolve("notes.xml"), "<qa_profile/>");

        List<ProfileInfo> profiles = new ProfileDiscovery(tempDir, ProfileStore.DEFAULT_SUFFIX).discover();

        assertThat(profiles).extracting(ProfileInfo::name).containsExactly("Alpha", "Zeta");
        assertThat(profiles.get(0).ruleCount()).isEqualTo(2);
        assertThat(profiles.get(0).language()).isEqualTo("nb");
        assertThat(profiles.get(0).parsed()).isTrue();
        assertThat(profiles.get(0).path()).endsWith("a_qa_profile.xml");
    }

    @Test
    void shouldRecoverMetadataFromBrokenDocument() throws Exception {
        Files.writeString(tempDir.resolve("broken_qa_profile.xml"), """
                <qa_profile>
                  <metadata>
                    <name> Fish &amp; Chips </name>
                    <description>half written</description>
                  </metadata>
                  <checks><check order="1">
                """);

        List<ProfileInfo> profiles = new ProfileDiscovery(tempDir, ProfileStore.DEFAULT_SUFFIX).discover();

        assertThat(profiles).singleElement().satisfies(info -> {
            assertThat(info.name()).isEqualTo("Fish & Chips");
            assertThat(info.description()).isEqualTo("half written");
            assertThat(info.language()).isEmpty();
            assertThat(info.ruleCount()).isEqualTo(-1);
            assertThat(info.parsed()).isFalse();
        });
    }

    @Test
    void shouldFallBackToFileNameWhenNoNameCanBeRecovered() throws Exception {
        Files.writeString(tempDir.resolve("garbage_qa_profile.xml"), "not xml at all");

        List<ProfileInfo> profiles = new ProfileDiscovery(tempDir, ProfileStore.DEFAULT_SUFFIX).discover();

        assertThat(profiles).singleElement()
                .satisfies(info -> assertThat(info.name()).isEqualTo("garbage_qa_profile.xml"));
    }

    @Test
    void shouldReturnEmptyListForMissingDirectory() throws Exception {
        assertThat(new ProfileDiscovery(tempDir.resolve("absent"), ProfileStore.DEFAULT_SUFFIX).discover()).isEmpty();
    }
}
