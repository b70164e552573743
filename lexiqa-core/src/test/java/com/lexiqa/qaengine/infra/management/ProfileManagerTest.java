package com.lexiqa.qaengine.infra.management;

import com.lexiqa.qaengine.api.IProfileCompiler;
import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.infra.persistence.ProfileStore;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfileManagerTest {

    @Mock
    private IProfileCompiler compiler;

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    @Mock
    private CompiledProfile compiledProfile;

    @TempDir
    Path tempDir;

    private Path profilePath;
    private ProfileStore store;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        lenient().when(spanBuilder.startSpan()).thenReturn(span);
        lenient().when(span.makeCurrent()).thenReturn(scope);

        store = new ProfileStore(tracer);
        profilePath = tempDir.resolve("default_qa_profile.xml");
        writeProfile("v1", Instant.parse("2024-01-01T00:00:00Z"));
    }

    private void writeProfile(String name, Instant modified) throws Exception {
        Profile profile = new Profile(name, "", "nb",
                List.of(PatternRule.builder().order(1).pattern("a").replacement("b").build()), 0, 0);
        store.save(profile, profilePath);
        Files.setLastModifiedTime(profilePath, FileTime.from(modified));
    }

    private ProfileManager newManager() throws Exception {
        return new ProfileManager(profilePath, tracer, compiler, store, Duration.ofSeconds(1));
    }

    private static void checkForUpdates(ProfileManager manager) throws Exception {
        Method checkMethod = ProfileManager.class.getDeclaredMethod("checkForUpdates");
        checkMethod.setAccessible(true);
        checkMethod.invoke(manager);
    }

    @Test
    void shouldLoadProfileOnInitialization() throws Exception {
        when(compiler.compile(any(Profile.class))).thenReturn(compiledProfile);

        ProfileManager manager = newManager();

        assertThat(manager.getActiveProfile()).isSameAs(compiledProfile);
        ArgumentCaptor<Profile> loaded = ArgumentCaptor.forClass(Profile.class);
        verify(compiler).compile(loaded.capture());
        assertThat(loaded.getValue().name()).isEqualTo("v1");
        verify(compiler).setTracer(tracer);
    }

    @Test
    void shouldThrowIfProfileIsMissing() throws Exception {
        Files.delete(profilePath);

        assertThatThrownBy(this::newManager).isInstanceOf(ResourceNotFoundException.class);
        verify(compiler, never()).compile(any(Profile.class));
    }

    @Test
    void shouldThrowIfInitialDocumentIsMalformed() throws Exception {
        Files.writeString(profilePath, "<qa_profile><checks>");

        assertThatThrownBy(this::newManager).isInstanceOf(DocumentParseException.class);
    }

    @Test
    void shouldReloadProfileWhenFileChanges() throws Exception {
        when(compiler.compile(any(Profile.class))).thenReturn(compiledProfile);
        ProfileManager manager = newManager();

        CompiledProfile newProfile = mock(CompiledProfile.class);
        when(compiler.compile(any(Profile.class))).thenReturn(newProfile);
        writeProfile("v2", Instant.parse("2024-01-02T00:00:00Z"));

        checkForUpdates(manager);

        assertThat(manager.getActiveProfile()).isSameAs(newProfile);
        verify(compiler, times(2)).compile(any(Profile.class));
        manager.shutdown();
    }

    @Test
    void shouldNotReloadUnchangedFile() throws Exception {
        when(compiler.compile(any(Profile.class))).thenReturn(compiledProfile);
        ProfileManager manager = newManager();

        checkForUpdates(manager);

        verify(compiler, times(1)).compile(any(Profile.class));
    }

    @Test
    void shouldKeepPreviousProfileIfReloadFails() throws Exception {
        when(compiler.compile(any(Profile.class))).thenReturn(compiledProfile);
        ProfileManager manager = newManager();

        Files.writeString(profilePath, "<qa_profile><checks><check order=\"x\"/></checks></qa_profile>");
        Files.setLastModifiedTime(profilePath, FileTime.from(Instant.parse("2024-01-03T00:00:00Z")));

        checkForUpdates(manager);

        assertThat(manager.getActiveProfile()).isSameAs(compiledProfile);
        verify(compiler, times(1)).compile(any(Profile.class));
    }

    @Test
    void shouldKeepPreviousProfileIfFileDisappears() throws Exception {
        when(compiler.compile(any(Profile.class))).thenReturn(compiledProfile);
        ProfileManager manager = newManager();

        Files.delete(profilePath);
        checkForUpdates(manager);

        assertThat(manager.getActiveProfile()).isSameAs(compiledProfile);
    }

    @Test
    void shouldReloadOnDemand() throws Exception {
        when(compiler.compile(any(Profile.class))).thenReturn(compiledProfile);
        ProfileManager manager = newManager();
        CompiledProfile forced = mock(CompiledProfile.class);
        when(compiler.compile(any(Profile.class))).thenReturn(forced);

        assertThat(manager.reload()).isSameAs(forced);
        assertThat(manager.getActiveProfile()).isSameAs(forced);
    }
}
