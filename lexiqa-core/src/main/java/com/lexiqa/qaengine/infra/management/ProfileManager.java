package com.lexiqa.qaengine.infra.management;

import com.lexiqa.qaengine.api.IProfileCompiler;
import com.lexiqa.qaengine.api.exceptions.QaEngineException;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.infra.persistence.ProfileStore;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a compiled profile in sync with its document on disk.
 *
 * <p>The document is loaded and compiled once on construction; a failure there is
 * thrown to the caller. After {@link #start()} the file's modification time is polled,
 * and a newer document is loaded, compiled and swapped in. A reload that fails leaves
 * the previous profile active.
 */
public class ProfileManager {
    private static final Logger logger = Logger.getLogger(ProfileManager.class.getName());

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(10);

    private final Path profilePath;
    private final IProfileCompiler compiler;
    private final ProfileStore store;
    private final Duration checkInterval;

    /**
     * The active profile. A batch takes one snapshot and keeps it, so a reload
     * never changes the rules halfway through.
     */
    private final AtomicReference<CompiledProfile> activeProfile = new AtomicReference<>();
    private final ScheduledExecutorService monitoringExecutor;
    private final Tracer tracer;

    private volatile long lastModifiedTime = -1;

    public ProfileManager(Path profilePath, Tracer tracer, IProfileCompiler compiler)
            throws QaEngineException, IOException {
        this(profilePath, tracer, compiler, new ProfileStore(tracer), DEFAULT_CHECK_INTERVAL);
    }

    public ProfileManager(Path profilePath, Tracer tracer, IProfileCompiler compiler,
                          ProfileStore store, Duration checkInterval) throws QaEngineException, IOException {
        this.profilePath = profilePath;
        this.tracer = tracer;
        this.compiler = compiler;
        this.store = store;
        this.checkInterval = checkInterval;
        this.compiler.setTracer(tracer);
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Profile-File-Monitor");
            t.setDaemon(true);
            return t;
        });

        reloadProfileInternal();
    }

    public CompiledProfile getActiveProfile() {
        return activeProfile.get();
    }

    public Path getProfilePath() {
        return profilePath;
    }

    public void start() {
        long millis = checkInterval.toMillis();
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, millis, millis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    /**
     * Reloads the document now, regardless of its modification time.
     *
     * @throws QaEngineException if the document is missing or malformed; the active profile is kept
     * @throws IOException       if the document cannot be read; the active profile is kept
     */
    public CompiledProfile reload() throws QaEngineException, IOException {
        reloadProfileInternal();
        return activeProfile.get();
    }

    private void checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-profile-updates").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("profileFile", profilePath.toString());
            long currentModifiedTime = Files.getLastModifiedTime(profilePath).toMillis();
            if (currentModifiedTime > lastModifiedTime) {
                span.addEvent("Change detected. Triggering reload.");
                logger.info("Change detected in profile " + profilePath + ". Attempting to reload...");
                loadProfile();
            }
        } catch (IOException e) {
            span.recordException(e);
            logger.log(Level.WARNING, "Could not check profile file for modifications.", e);
        } catch (RuntimeException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "An unexpected error occurred during profile reload check.", e);
        } finally {
            span.end();
        }
    }

    private void loadProfile() {
        try {
            reloadProfileInternal();
        } catch (QaEngineException | IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to load new profile. Previous profile remains active.", e);
        }
    }

    private void reloadProfileInternal() throws QaEngineException, IOException {
        Span span = tracer.spanBuilder("load-new-profile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            if (!Files.isRegularFile(profilePath)) {
                throw new ResourceNotFoundException("Profile", profilePath.toString());
            }
            long modifiedTime = Files.getLastModifiedTime(profilePath).toMillis();
            Profile profile = store.load(profilePath);
            CompiledProfile compiled = compiler.compile(profile);
            activeProfile.set(compiled);
            this.lastModifiedTime = modifiedTime;
            span.setAttribute("profile.rules", compiled.getNumRules());
            span.setAttribute("profile.skippedRules", compiled.diagnostics().size());
            logger.info("Loaded profile '" + compiled.name() + "' with " + compiled.getNumRules()
                    + " active checks from " + profilePath);
        } catch (QaEngineException | IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
