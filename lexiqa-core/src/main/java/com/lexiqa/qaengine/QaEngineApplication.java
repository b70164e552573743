package com.lexiqa.qaengine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lexiqa.qaengine.api.exceptions.InvalidPatternException;
import com.lexiqa.qaengine.api.exceptions.QaEngineException;
import com.lexiqa.qaengine.api.exceptions.ResourceNotFoundException;
import com.lexiqa.qaengine.api.model.PatternRule;
import com.lexiqa.qaengine.api.model.Profile;
import com.lexiqa.qaengine.api.model.SnippetEntry;
import com.lexiqa.qaengine.api.model.SnippetLibrary;
import com.lexiqa.qaengine.compiler.PatternCache;
import com.lexiqa.qaengine.compiler.PatternValidation;
import com.lexiqa.qaengine.compiler.ProfileCompiler;
import com.lexiqa.qaengine.compiler.analysis.ProfileAnalyzer;
import com.lexiqa.qaengine.infra.config.QaEngineConfig;
import com.lexiqa.qaengine.infra.library.BuiltInSnippets;
import com.lexiqa.qaengine.infra.management.ProfileManager;
import com.lexiqa.qaengine.infra.persistence.BackupManager;
import com.lexiqa.qaengine.infra.persistence.EditDocumentReader;
import com.lexiqa.qaengine.infra.persistence.JsonRecordStore;
import com.lexiqa.qaengine.infra.persistence.ProfileDiscovery;
import com.lexiqa.qaengine.infra.persistence.ProfileStore;
import com.lexiqa.qaengine.infra.persistence.SnippetLibraryStore;
import com.lexiqa.qaengine.infra.server.QaHttpServer;
import com.lexiqa.qaengine.infra.telemetry.TracingService;
import com.lexiqa.qaengine.runtime.evaluation.MatchEngine;
import com.lexiqa.qaengine.service.QaBatchService;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point.
 *
 * <pre>
 * serve                                           HTTP server (default)
 * batch-find    &lt;records.json&gt; &lt;profile.xml&gt;
 * batch-replace &lt;records.json&gt; &lt;profile.xml&gt; [--output &lt;file&gt;] [--no-backup]
 * apply-edits   &lt;records.json&gt; &lt;edits.json&gt;  [--output &lt;file&gt;] [--no-backup]
 * find          &lt;records.json&gt; &lt;pattern&gt; [--exclude &lt;pattern&gt;] [--case-sensitive]
 * replace       &lt;records.json&gt; &lt;pattern&gt; &lt;replacement&gt; [--exclude &lt;pattern&gt;] [--case-sensitive]
 *               [--output &lt;file&gt;] [--no-backup]
 * preview       &lt;pattern&gt; &lt;replacement&gt; &lt;sample&gt; [--exclude &lt;pattern&gt;] [--case-sensitive]
 * analyze       &lt;profile.xml&gt;
 * profiles      [list]
 * profiles      create &lt;name&gt; [--description &lt;text&gt;] [--language &lt;code&gt;]
 * backup        list|restore|cleanup &lt;file&gt; [--backup &lt;backup file&gt;] [--keep &lt;n&gt;]
 * patterns      list [--category &lt;name&gt;] | search &lt;query&gt; | show &lt;name or id&gt;
 * patterns      add &lt;name&gt; &lt;pattern&gt; [--replacement r] [--description d] [--category c]
 * patterns      add-category &lt;name&gt; | remove &lt;name or id&gt; | install-builtins
 * patterns      import &lt;file&gt; [--replace] | export &lt;file&gt;
 * patterns      apply &lt;name or id&gt; &lt;records.json&gt; [--output &lt;file&gt;] [--no-backup]
 * </pre>
 *
 * Commands print their result as JSON on standard output. Commands that overwrite an
 * existing record file back it up first unless {@code --no-backup} is given.
 */
public class QaEngineApplication {
    private static final Logger logger = Logger.getLogger(QaEngineApplication.class.getName());

    private static final String OUTPUT = "--output";
    private static final String NO_BACKUP = "--no-backup";
    private static final String EXCLUDE = "--exclude";
    private static final String CASE_SENSITIVE = "--case-sensitive";

    private final QaEngineConfig config;
    private final Tracer tracer;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ProfileCompiler compiler;
    private final MatchEngine engine;
    private final ProfileStore profileStore;
    private final SnippetLibraryStore libraryStore;
    private final BackupManager backupManager;
    private final QaBatchService batchService;

    private QaHttpServer httpServer;
    private ProfileManager profileManager;

    public QaEngineApplication(QaEngineConfig config, Tracer tracer) {
        this.config = config;
        this.tracer = tracer;
        this.compiler = new ProfileCompiler(tracer, new PatternCache(config.getPatternCacheSize()));
        this.engine = new MatchEngine(compiler, tracer, config.getWorkerCount(), config.getParallelThreshold());
        this.profileStore = new ProfileStore(tracer, config.getProfileSuffix());
        this.libraryStore = new SnippetLibraryStore(config.getLibraryPath(), tracer);
        this.backupManager = new BackupManager(config.getBackupDirectory().orElse(null), config.getBackupKeep(), tracer);
        this.batchService = new QaBatchService(engine, tracer, backupManager);
    }

    public static void main(String[] args) {
        configureLogging();
        String command = args.length == 0 ? "serve" : args[0];
        String[] rest = args.length == 0 ? args : Arrays.copyOfRange(args, 1, args.length);
        try {
            QaEngineConfig config = QaEngineConfig.load();
            if ("serve".equals(command)) {
                QaEngineApplication app = new QaEngineApplication(config, TracingService.getInstance().getTracer());
                app.serve();
                Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "lexiqa-shutdown-hook"));
                Thread.currentThread().join();
            } else {
                QaEngineApplication app = new QaEngineApplication(config, TracingService.noop().getTracer());
                try {
                    System.out.println(app.run(command, rest));
                } finally {
                    app.shutdown();
                }
            }
        } catch (QaEngineException e) {
            logger.severe(e.getKind() + ": " + e.getMessage());
            System.exit(2);
        } catch (IllegalArgumentException e) {
            logger.severe(e.getMessage());
            System.exit(64);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Command '" + command + "' failed: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Runs one command and returns its JSON output.
     */
    String run(String command, String[] args) throws QaEngineException, IOException {
        return switch (command) {
            case "batch-find" -> {
                CommandArgs cmd = CommandArgs.parse(args, Set.of(), Set.of())
                        .require(2, "batch-find <records.json> <profile.xml>");
                Profile profile = profileStore.load(Paths.get(cmd.positional(1)));
                yield json(batchService.batchFind(profile, recordStore(cmd)));
            }
            case "batch-replace" -> {
                CommandArgs cmd = CommandArgs.parse(args, Set.of(OUTPUT), Set.of(NO_BACKUP))
                        .require(2, "batch-replace <records.json> <profile.xml> [--output <file>] [--no-backup]");
                Profile profile = profileStore.load(Paths.get(cmd.positional(1)));
                yield json(service(cmd).batchReplace(profile, recordStore(cmd)));
            }
            case "apply-edits" -> {
                CommandArgs cmd = CommandArgs.parse(args, Set.of(OUTPUT), Set.of(NO_BACKUP))
                        .require(2, "apply-edits <records.json> <edits.json> [--output <file>] [--no-backup]");
                EditDocumentReader edits = new EditDocumentReader(objectMapper);
                yield json(service(cmd).applyEdits(recordStore(cmd), edits.read(Paths.get(cmd.positional(1)))));
            }
            case "find" -> {
                CommandArgs cmd = CommandArgs.parse(args, Set.of(EXCLUDE), Set.of(CASE_SENSITIVE))
                        .require(2, "find <records.json> <pattern> [--exclude <pattern>] [--case-sensitive]");
                Profile profile = singleRuleProfile(cmd.positional(1), "", cmd);
                yield json(batchService.batchFind(profile, recordStore(cmd)));
            }
            case "replace" -> {
                CommandArgs cmd = CommandArgs.parse(args, Set.of(OUTPUT, EXCLUDE), Set.of(CASE_SENSITIVE, NO_BACKUP))
                        .require(3, "replace <records.json> <pattern> <replacement> [--exclude <pattern>]"
                                + " [--case-sensitive] [--output <file>] [--no-backup]");
                Profile profile = singleRuleProfile(cmd.positional(1), cmd.positional(2), cmd);
                yield json(service(cmd).batchReplace(profile, recordStore(cmd)));
            }
            case "preview" -> {
                CommandArgs cmd = CommandArgs.parse(args, Set.of(EXCLUDE), Set.of(CASE_SENSITIVE))
                        .require(3, "preview <pattern> <replacement> <sample> [--exclude <pattern>] [--case-sensitive]");
                yield json(engine.preview(rule(cmd.positional(0), cmd.positional(1), cmd), cmd.positional(2)));
            }
            case "analyze" -> {
                CommandArgs cmd = CommandArgs.parse(args, Set.of(), Set.of()).require(1, "analyze <profile.xml>");
                yield json(new ProfileAnalyzer(compiler).analyze(profileStore.load(Paths.get(cmd.positional(0)))));
            }
            case "profiles" -> profiles(args);
            case "backup" -> backup(args);
            case "patterns" -> patterns(args);
            default -> throw new IllegalArgumentException("Unknown command: " + command);
        };
    }

    private String profiles(String[] args) throws IOException {
        CommandArgs cmd = CommandArgs.parse(args, Set.of("--description", "--language"), Set.of());
        String action = cmd.positionalCount() == 0 ? "list" : cmd.positional(0);
        switch (action) {
            case "list":
                return json(new ProfileDiscovery(config.getProfilesDirectory(), config.getProfileSuffix()).discover());
            case "create": {
                cmd.require(2, "profiles create <name> [--description <text>] [--language <code>]");
                Profile profile = Profile.create(cmd.positional(1),
                        cmd.option("--description").orElse(""), cmd.option("--language").orElse(""));
                Path target = config.getProfilesDirectory().resolve(profileStore.fileNameFor(profile.name(), Instant.now()));
                if (Files.exists(target)) {
                    throw new IllegalArgumentException("Profile already exists: " + target);
                }
                profileStore.save(profile, target);
                return json(result("path", target.toAbsolutePath().toString(), "name", profile.name()));
            }
            default:
                throw new IllegalArgumentException("Unknown profiles action: " + action);
        }
    }

    private String backup(String[] args) throws QaEngineException, IOException {
        CommandArgs cmd = CommandArgs.parse(args, Set.of("--backup", "--keep"), Set.of())
                .require(2, "backup list|restore|cleanup <file> [--backup <backup file>] [--keep <n>]");
        Path file = Paths.get(cmd.positional(1));
        switch (cmd.positional(0)) {
            case "list": {
                List<BackupManager.BackupInfo> infos = new ArrayList<>();
                for (Path backup : backupManager.listBackups(file)) {
                    infos.add(backupManager.describe(backup));
                }
                return json(infos);
            }
            case "restore": {
                Optional<String> chosen = cmd.option("--backup");
                Path restored;
                if (chosen.isPresent()) {
                    restored = Paths.get(chosen.get());
                    backupManager.restore(restored, file);
                } else {
                    restored = backupManager.restoreLatest(file);
                }
                return json(result("restored", restored.toAbsolutePath().toString(),
                        "target", file.toAbsolutePath().toString()));
            }
            case "cleanup": {
                int keep = cmd.intOption("--keep").orElse(config.getBackupKeep());
                BackupManager pruner = keep == backupManager.getKeepCount() ? backupManager
                        : new BackupManager(config.getBackupDirectory().orElse(null), keep, tracer);
                return json(result("deleted", pruner.cleanup(file), "kept", pruner.listBackups(file).size()));
            }
            default:
                throw new IllegalArgumentException("Unknown backup action: " + cmd.positional(0));
        }
    }

    private String patterns(String[] args) throws QaEngineException, IOException {
        CommandArgs cmd = CommandArgs.parse(args,
                Set.of("--category", "--replacement", "--description", OUTPUT),
                Set.of("--replace", NO_BACKUP))
                .require(1, "patterns list|search|show|add|add-category|remove|import|export|install-builtins|apply");
        String action = cmd.positional(0);
        SnippetLibrary library = libraryStore.load();
        switch (action) {
            case "list":
                return cmd.option("--category").isPresent()
                        ? json(library.entriesIn(cmd.option("--category").get()))
                        : json(library);
            case "search":
                cmd.require(2, "patterns search <query>");
                return json(library.search(cmd.positional(1)));
            case "show":
                cmd.require(2, "patterns show <name or id>");
                return json(snippet(library, cmd.positional(1)));
            case "add": {
                cmd.require(3, "patterns add <name> <pattern> [--replacement r] [--description d] [--category c]");
                String name = cmd.positional(1);
                if (library.findByName(name).isPresent()) {
                    throw new IllegalArgumentException("A snippet named '" + name + "' already exists");
                }
                PatternValidation validation = compiler.validatePattern(cmd.positional(2), false);
                if (!validation.valid()) {
                    throw new IllegalArgumentException("Invalid pattern '" + cmd.positional(2) + "': "
                            + validation.message());
                }
                String category = cmd.option("--category").orElse(PatternRule.DEFAULT_CATEGORY);
                SnippetEntry entry = new SnippetEntry(UUID.randomUUID().toString(), name,
                        cmd.option("--description").orElse(""), cmd.positional(2),
                        cmd.option("--replacement").orElse(""), category);
                libraryStore.save(library.withEntry(category, entry));
                return json(entry);
            }
            case "add-category": {
                cmd.require(2, "patterns add-category <name>");
                String name = cmd.positional(1);
                if (library.categoryNames().contains(name)) {
                    throw new IllegalArgumentException("Category already exists: " + name);
                }
                SnippetLibrary updated = library.withCategory(name);
                libraryStore.save(updated);
                return json(updated.categoryNames());
            }
            case "remove": {
                cmd.require(2, "patterns remove <name or id>");
                SnippetEntry entry = snippet(library, cmd.positional(1));
                libraryStore.save(library.withoutEntry(entry.id()));
                return json(entry);
            }
            case "import": {
                cmd.require(2, "patterns import <file> [--replace]");
                SnippetLibrary imported = libraryStore.importFrom(Paths.get(cmd.positional(1)));
                SnippetLibrary updated = cmd.has("--replace") ? imported : library.merge(imported);
                libraryStore.save(updated);
                return json(result("imported", imported.size(), "entries", updated.size()));
            }
            case "export": {
                cmd.require(2, "patterns export <file>");
                Path target = Paths.get(cmd.positional(1));
                libraryStore.exportTo(library, target);
                return json(result("path", target.toAbsolutePath().toString(), "entries", library.size()));
            }
            case "install-builtins": {
                SnippetLibrary updated = BuiltInSnippets.installInto(library);
                libraryStore.save(updated);
                return json(result("installed", updated.size() - library.size(), "entries", updated.size()));
            }
            case "apply": {
                cmd.require(3, "patterns apply <name or id> <records.json> [--output <file>] [--no-backup]");
                SnippetEntry entry = snippet(library, cmd.positional(1));
                Profile profile = Profile.create(entry.name(), entry.description(), "").withRule(entry.toRule(1));
                return json(service(cmd).batchReplace(profile, recordStore(cmd.positional(2), cmd)));
            }
            default:
                throw new IllegalArgumentException("Unknown patterns action: " + action);
        }
    }

    void serve() throws QaEngineException, IOException {
        logger.info("Starting Lexiqa QA engine: " + config);
        if (config.getDefaultProfile().isPresent()) {
            profileManager = new ProfileManager(config.getDefaultProfile().get(), tracer, compiler,
                    profileStore, config.getReloadInterval());
        }
        httpServer = new QaHttpServer(config.getServerPort(), batchService, engine, profileManager, profileStore,
                new ProfileDiscovery(config.getProfilesDirectory(), config.getProfileSuffix()),
                libraryStore, tracer);
        httpServer.start();
        logger.info("Lexiqa QA engine is ready to serve requests on port " + httpServer.getPort());
    }

    void shutdown() {
        if (httpServer != null) {
            httpServer.stop(1);
        }
        engine.close();
        logger.fine("Lexiqa QA engine shutdown complete");
    }

    private JsonRecordStore recordStore(CommandArgs cmd) throws QaEngineException {
        return recordStore(cmd.positional(0), cmd);
    }

    private JsonRecordStore recordStore(String location, CommandArgs cmd) throws QaEngineException {
        Path input = Paths.get(location);
        if (!Files.isRegularFile(input)) {
            throw new ResourceNotFoundException("Record file", input.toString());
        }
        Path output = cmd.option(OUTPUT).map(Paths::get).orElse(input);
        return new JsonRecordStore(input, output, objectMapper);
    }

    private QaBatchService service(CommandArgs cmd) {
        return cmd.has(NO_BACKUP) ? batchService.withoutBackups() : batchService;
    }

    private PatternRule rule(String pattern, String replacement, CommandArgs cmd) {
        return PatternRule.builder()
                .order(1)
                .name(pattern)
                .pattern(pattern)
                .replacement(replacement)
                .caseSensitive(cmd.has(CASE_SENSITIVE))
                .excludePattern(cmd.option(EXCLUDE).orElse(""))
                .build();
    }

    /**
     * Wraps one pattern in a profile. A pattern that does not compile fails here rather
     * than being reported as a skipped rule.
     */
    private Profile singleRuleProfile(String pattern, String replacement, CommandArgs cmd)
            throws InvalidPatternException {
        PatternRule rule = rule(pattern, replacement, cmd);
        compiler.compileRule(rule);
        return Profile.create(pattern, "", "").withRule(rule);
    }

    private static SnippetEntry snippet(SnippetLibrary library, String nameOrId) throws ResourceNotFoundException {
        return library.findById(nameOrId)
                .or(() -> library.findByName(nameOrId))
                .orElseThrow(() -> new ResourceNotFoundException("Snippet", nameOrId));
    }

    private static Map<String, Object> result(String key, Object value, String otherKey, Object otherValue) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(key, value);
        result.put(otherKey, otherValue);
        return result;
    }

    private String json(Object value) throws IOException {
        return objectMapper.writeValueAsString(value);
    }

    private static void configureLogging() {
        try (InputStream is = QaEngineApplication.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.warning("Could not load logging.properties: " + e.getMessage());
        }
    }
}
