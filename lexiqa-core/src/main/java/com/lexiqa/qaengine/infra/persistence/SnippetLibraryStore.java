/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.infra.persistence;

import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.SnippetLibrary;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Persists the per-user snippet library at a fixed location and moves libraries
 * in and out of arbitrary files.
 */
public class SnippetLibraryStore {

    private static final Logger logger = Logger.getLogger(SnippetLibraryStore.class.getName());

    private final SnippetLibraryReader reader = new SnippetLibraryReader();
    private final SnippetLibraryWriter writer = new SnippetLibraryWriter();
    private final Path location;
    private final Tracer tracer;

    public SnippetLibraryStore(Path location, Tracer tracer) {
        this.location = location;
        this.tracer = tracer;
    }

    /**
     * Loads the library from the default location, or returns {@link SnippetLibrary#defaults()}
     * when no library has been saved yet.
     */
    public SnippetLibrary load() throws DocumentParseException, IOException {
        if (!Files.exists(location)) {
            logger.info(() -> "No snippet library at " + location + ", starting from defaults");
            return SnippetLibrary.defaults();
        }
        return read(location);
    }

    public void save(SnippetLibrary library) throws IOException {
        write(library, location);
    }

    /**
     * Reads a library from any file without touching the default location.
     */
    public SnippetLibrary importFrom(Path source)
            throws ResourceNotFoundException, DocumentParseException, IOException {
        if (!Files.isRegularFile(source)) {
            throw new ResourceNotFoundException("Snippet library", source.toString());
        }
        SnippetLibrary library = read(source);
        logger.info(() -> "Imported " + library.size() + " snippets from " + source);
        return library;
    }

    public void exportTo(SnippetLibrary library, Path target) throws IOException {
        write(library, target);
        logger.info(() -> "Exported " + library.size() + " snippets to " + target);
    }

    public Path location() {
        return location;
    }

    private SnippetLibrary read(Path path) throws DocumentParseException, IOException {
        Span span = tracer.spanBuilder("load-library").startSpan();
        try (Scope scope = span.makeCurrent(); InputStream in = Files.newInputStream(path)) {
            span.setAttribute(AttributeKey.stringKey("library.path"), path.toString());
            SnippetLibrary library = reader.read(in, path.getFileName().toString());
            span.setAttribute(AttributeKey.longKey("library.entries"), (long) library.size());
            return library;
        } catch (DocumentParseException | IOException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private void write(SnippetLibrary library, Path path) throws IOException {
        Span span = tracer.spanBuilder("save-library").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute(AttributeKey.stringKey("library.path"), path.toString());
            DocumentFiles.writeAtomically(path, writer.toXml(library));
        } catch (IOException | IllegalArgumentException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }
}
