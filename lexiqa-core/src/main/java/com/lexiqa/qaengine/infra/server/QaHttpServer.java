/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.infra.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexiqa.qaengine.api.RecordStore;
import com.lexiqa.qaengine.api.exceptions.DocumentParseException;
import com.lexiqa.qaengine.api.exceptions.QaEngineException;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.BatchReplaceResult;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.SnippetLibrary;
import com.lexiqa.qaengine.api.model.TextRecord;
import com.lexiqa.qaengine.infra.management.ProfileManager;
import com.lexiqa.qaengine.infra.persistence.InMemoryRecordStore;
import com.lexiqa.qaengine.infra.persistence.JsonRecordStore;
import com.lexiqa.qaengine.infra.persistence.ProfileDiscovery;
import com.lexiqa.qaengine.infra.persistence.ProfileStore;
import com.lexiqa.qaengine.infra.persistence.SnippetLibraryStore;
import com.lexiqa.qaengine.runtime.evaluation.MatchEngine;
import com.lexiqa.qaengine.runtime.model.CompiledProfile;
import com.lexiqa.qaengine.service.QaBatchService;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight JSON front end for batch runs.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /find - report matches, records unchanged</li>
 *   <li>POST /replace - rewrite records, persisted when anything was replaced</li>
 *   <li>POST /edits - apply manual edits</li>
 *   <li>GET /profiles - profiles of the profiles directory</li>
 *   <li>GET /library - the snippet library, or matching entries with {@code ?q=}</li>
 *   <li>GET /health - health check</li>
 *   <li>GET /metrics - engine metrics</li>
 * </ul>
 *
 * <p>Missing resources answer 404, malformed input 400. Every batch runs against one
 * profile snapshot, so a hot reload during a request does not affect it.
 */
public class QaHttpServer {
    private static final Logger logger = Logger.getLogger(QaHttpServer.class.getName());

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final Tracer tracer;
    private final ObjectMapper objectMapper;
    private final QaBatchService batchService;
    private final MatchEngine engine;
    private final ProfileManager profileManager;
    private final ProfileStore profileStore;
    private final ProfileDiscovery discovery;
    private final SnippetLibraryStore libraryStore;

    /**
     * @param profileManager monitored default profile, or null when requests must name a profile
     */
    public QaHttpServer(int port, QaBatchService batchService, MatchEngine engine, ProfileManager profileManager,
                        ProfileStore profileStore, ProfileDiscovery discovery, SnippetLibraryStore libraryStore,
                        Tracer tracer) throws IOException {
        this.batchService = Objects.requireNonNull(batchService, "QaBatchService cannot be null");
        this.engine = Objects.requireNonNull(engine, "MatchEngine cannot be null");
        this.profileManager = profileManager;
        this.profileStore = Objects.requireNonNull(profileStore, "ProfileStore cannot be null");
        this.discovery = Objects.requireNonNull(discovery, "ProfileDiscovery cannot be null");
        this.libraryStore = Objects.requireNonNull(libraryStore, "SnippetLibraryStore cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.objectMapper = new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 0);

        this.server.createContext("/find", new FindHandler());
        this.server.createContext("/replace", new ReplaceHandler());
        this.server.createContext("/edits", new EditsHandler());
        this.server.createContext("/profiles", new ProfilesHandler());
        this.server.createContext("/library", new LibraryHandler());
        this.server.createContext("/health", new HealthHandler());
        this.server.createContext("/metrics", new MetricsHandler());

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(Math.max(2, coreCount));
        this.server.setExecutor(executor);
    }

    public void start() {
        if (profileManager != null) {
            profileManager.start();
        }
        server.start();
        logger.info("Lexiqa QA server started on port " + getPort()
                + ". Endpoints: /find /replace /edits (POST), /profiles /library /health /metrics (GET)");
    }

    public void stop(int delaySeconds) {
        logger.info("Stopping server...");
        if (profileManager != null) {
            profileManager.shutdown();
        }
        server.stop(delaySeconds);
        executor.shutdown();
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Shared shape of the POST handlers: method check, request parsing, span, error mapping.
     */
    private abstract class BatchHandler implements HttpHandler {
        private final String spanName;

        BatchHandler(String spanName) {
            this.spanName = spanName;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }
            Span span = tracer.spanBuilder(spanName).startSpan();
            try (Scope scope = span.makeCurrent()) {
                QaRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, QaRequest.class);
                }
                sendResponse(exchange, 200, objectMapper.writeValueAsString(process(request)));
            } catch (ResourceNotFoundException e) {
                span.recordException(e);
                sendError(exchange, 404, e.getMessage(), e.getKind().name());
            } catch (DocumentParseException e) {
                span.recordException(e);
                sendError(exchange, 400, e.getMessage(), e.getKind().name());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                span.recordException(e);
                sendError(exchange, 400, e.getMessage(), "BAD_REQUEST");
            } catch (Exception e) {
                span.recordException(e);
                logger.log(Level.SEVERE, "Error during " + spanName, e);
                sendError(exchange, 500, "Internal Server Error", "INTERNAL");
            } finally {
                span.end();
            }
        }

        abstract Object process(QaRequest request) throws QaEngineException, IOException;
    }

    class FindHandler extends BatchHandler {
        FindHandler() {
            super("http-find");
        }

        @Override
        Object process(QaRequest request) throws QaEngineException, IOException {
            RecordStore store = recordStore(request);
            if (request.profilePath() != null) {
                return batchService.batchFind(profileStore.load(Paths.get(request.profilePath())), store);
            }
            return batchService.batchFind(activeProfile(), store);
        }
    }

    class ReplaceHandler extends BatchHandler {
        ReplaceHandler() {
            super("http-replace");
        }

        @Override
        Object process(QaRequest request) throws QaEngineException, IOException {
            RecordStore store = recordStore(request);
            BatchReplaceResult result;
            if (request.profilePath() != null) {
                Profile profile = profileStore.load(Paths.get(request.profilePath()));
                result = batchService.batchReplace(profile, store);
            } else {
                result = batchService.batchReplace(activeProfile(), store);
            }
            return new ReplaceResponse(result, request.hasInlineRecords() ? store.list() : null);
        }
    }

    class EditsHandler extends BatchHandler {
        EditsHandler() {
            super("http-edits");
        }

        @Override
        Object process(QaRequest request) throws QaEngineException, IOException {
            if (request.edits() == null) {
                throw new IllegalArgumentException("Request has no edits");
            }
            return batchService.applyEdits(recordStore(request), request.edits());
        }
    }

    class ProfilesHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }
            try {
                sendResponse(exchange, 200, objectMapper.writeValueAsString(discovery.discover()));
            } catch (IOException e) {
                logger.log(Level.WARNING, "Could not list profiles", e);
                sendError(exchange, 500, e.getMessage(), "IO_ERROR");
            }
        }
    }

    class LibraryHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }
            try {
                SnippetLibrary library = libraryStore.load();
                String query = queryParameter(exchange.getRequestURI().getRawQuery(), "q");
                Object body = query == null ? library : library.search(query);
                sendResponse(exchange, 200, objectMapper.writeValueAsString(body));
            } catch (DocumentParseException e) {
                sendError(exchange, 500, e.getMessage(), e.getKind().name());
            } catch (IOException e) {
                logger.log(Level.WARNING, "Could not load snippet library", e);
                sendError(exchange, 500, e.getMessage(), "IO_ERROR");
            }
        }
    }

    class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }
            if (profileManager == null || profileManager.getActiveProfile() != null) {
                sendResponse(exchange, 200, "{\"status\":\"UP\"}");
            } else {
                sendResponse(exchange, 503, "{\"status\":\"DOWN\", \"reason\":\"Profile not loaded\"}");
            }
        }
    }

    class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }
            Map<String, Object> metrics = engine.getDetailedMetrics();
            sendResponse(exchange, 200, objectMapper.writeValueAsString(metrics));
        }
    }

    /**
     * Replace response; {@code records} is present only for inline requests.
     */
    public record ReplaceResponse(BatchReplaceResult result, List<TextRecord> records) {
    }

    private RecordStore recordStore(QaRequest request) throws ResourceNotFoundException {
        if (request.hasInlineRecords()) {
            return new InMemoryRecordStore("inline", request.records());
        }
        if (request.recordsPath() == null) {
            throw new IllegalArgumentException("Request needs either records or records_path");
        }
        Path input = Paths.get(request.recordsPath());
        if (!Files.isRegularFile(input)) {
            throw new ResourceNotFoundException("Record file", input.toString());
        }
        Path output = request.outputPath() == null ? input : Paths.get(request.outputPath());
        return new JsonRecordStore(input, output, objectMapper);
    }

    private CompiledProfile activeProfile() throws ResourceNotFoundException {
        if (profileManager == null) {
            throw new ResourceNotFoundException("Profile", "no profile_path given and no default profile configured");
        }
        return profileManager.getActiveProfile();
    }

    static String queryParameter(String rawQuery, String name) {
        if (rawQuery == null) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (key.equals(name)) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private void sendError(HttpExchange exchange, int statusCode, String message, String kind) throws IOException {
        sendResponse(exchange, statusCode, objectMapper.writeValueAsString(new ErrorResponse(message, kind)));
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
