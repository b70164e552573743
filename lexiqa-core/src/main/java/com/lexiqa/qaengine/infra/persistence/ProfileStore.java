/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.Profile;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Loads, saves, imports, exports and deletes profile documents.
 */
public class ProfileStore {

    private static final Logger logger = Logger.getLogger(ProfileStore.class.getName());

    public static final String DEFAULT_SUFFIX = "_qa_profile.xml";

    private final ProfileDocumentReader reader = new ProfileDocumentReader();
    private final ProfileDocumentWriter writer = new ProfileDocumentWriter();
    private final Tracer tracer;
    private final String suffix;

    public ProfileStore(Tracer tracer) {
        this(tracer, DEFAULT_SUFFIX);
    }

    public ProfileStore(Tracer tracer, String suffix) {
        this.tracer = tracer;
        this.suffix = suffix;
    }

    /**
     * @throws ResourceNotFoundException if the file does not exist
     * @throws DocumentParseException    if the file is not a valid profile document
     * @throws IOException               if the file cannot be read
     */
    public Profile load(Path path) throws ResourceNotFoundException, DocumentParseException, IOException {
        Span span = tracer.spanBuilder("load-profile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute(AttributeKey.stringKey("profile.path"), path.toString());
            if (!Files.isRegularFile(path)) {
                throw new ResourceNotFoundException("Profile", path.toString());
            }
            Profile profile;
            try (InputStream in = Files.newInputStream(path)) {
                profile = reader.read(in, path.getFileName().toString());
            }
            span.setAttribute(AttributeKey.longKey("profile.rules"), (long) profile.rules().size());
            logger.fine(() -> "Loaded profile '" + profile.name() + "' with " + profile.rules().size()
                    + " checks from " + path);
            return profile;
        } catch (ResourceNotFoundException | DocumentParseException | IOException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    public void save(Profile profile, Path path) throws IOException {
        Span span = tracer.spanBuilder("save-profile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute(AttributeKey.stringKey("profile.path"), path.toString());
            DocumentFiles.writeAtomically(path, writer.toXml(profile));
            logger.fine(() -> "Saved profile '" + profile.name() + "' to " + path);
        } catch (IOException | IllegalArgumentException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Copies a profile document into {@code profilesDirectory} under a file name derived
     * from the profile's name. An existing file of that name is overwritten.
     *
     * @return path of the imported document
     */
    public Path importInto(Path source, Path profilesDirectory)
            throws ResourceNotFoundException, DocumentParseException, IOException {
        Profile profile = load(source);
        Path target = profilesDirectory.resolve(fileNameFor(profile.name(), Instant.now()));
        save(profile, target);
        logger.info(() -> "Imported profile '" + profile.name() + "' from " + source + " to " + target);
        return target;
    }

    public void exportTo(Profile profile, Path target) throws IOException {
        save(profile, target);
        logger.info(() -> "Exported profile '" + profile.name() + "' to " + target);
    }

    /**
     * @return true if a file was deleted
     */
    public boolean delete(Path path) throws IOException {
        boolean deleted = Files.deleteIfExists(path);
        if (deleted) {
            logger.info(() -> "Deleted profile " + path);
        }
        return deleted;
    }

    /**
     * File name for a profile: lower-cased name, whitespace runs and path separators
     * replaced by underscores, followed by the profile suffix.
     */
    public String fileNameFor(String profileName, Instant now) {
        String base = profileName == null ? "" : profileName.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[\\s/\\\\:]+", "_");
        if (base.isEmpty() || base.chars().allMatch(c -> c == '_' || c == '.')) {
            base = "imported_profile_" + now.getEpochSecond();
        }
        return base + suffix;
    }

    public String getSuffix() {
        return suffix;
    }
}
