/*
 * Copyright (c) 2025 Lexiqa QA Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexiqa.qaengine.infra.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Engine configuration.
 *
 * <p>Every setting is resolved from, in increasing precedence:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code lexiqa.properties} on the classpath</li>
 *   <li>{@code lexiqa.properties} in the working directory, key by key over the classpath copy</li>
 *   <li>environment variables: the key upper-cased with {@code .} and {@code -} as {@code _},
 *       e.g. {@code LEXIQA_ENGINE_WORKERS}</li>
 *   <li>system properties under the key itself</li>
 * </ol>
 *
 * <p>Example {@code lexiqa.properties}:
 * <pre>
 * lexiqa.profiles.dir=/srv/lexiqa/profiles
 * lexiqa.library.path=/srv/lexiqa/library.xml
 * lexiqa.engine.workers=8
 * lexiqa.engine.parallel-threshold=256
 * lexiqa.server.port=8080
 * lexiqa.backup.keep=10
 * </pre>
 *
 * <p>Invalid numeric values are logged and ignored, leaving the lower layer in effect.
 */
public final class QaEngineConfig {

    private static final Logger logger = Logger.getLogger(QaEngineConfig.class.getName());

    public static final String PROPERTIES_FILE = "lexiqa.properties";

    public static final String KEY_PROFILES_DIR = "lexiqa.profiles.dir";
    public static final String KEY_PROFILE_SUFFIX = "lexiqa.profiles.suffix";
    public static final String KEY_LIBRARY_PATH = "lexiqa.library.path";
    public static final String KEY_WORKERS = "lexiqa.engine.workers";
    public static final String KEY_PARALLEL_THRESHOLD = "lexiqa.engine.parallel-threshold";
    public static final String KEY_PATTERN_CACHE_SIZE = "lexiqa.compiler.pattern-cache-size";
    public static final String KEY_SERVER_PORT = "lexiqa.server.port";
    public static final String KEY_DEFAULT_PROFILE = "lexiqa.profile.default";
    public static final String KEY_RELOAD_INTERVAL = "lexiqa.profile.reload-interval-seconds";
    public static final String KEY_BACKUP_KEEP = "lexiqa.backup.keep";
    public static final String KEY_BACKUP_DIR = "lexiqa.backup.dir";

    private final Path profilesDirectory;
    private final String profileSuffix;
    private final Path libraryPath;
    private final int workerCount;
    private final int parallelThreshold;
    private final int patternCacheSize;
    private final int serverPort;
    private final Path defaultProfile;
    private final Duration reloadInterval;
    private final int backupKeep;
    private final Path backupDirectory;

    private QaEngineConfig(Builder builder) {
        this.profilesDirectory = builder.profilesDirectory;
        this.profileSuffix = builder.profileSuffix;
        this.libraryPath = builder.libraryPath;
        this.workerCount = builder.workerCount;
        this.parallelThreshold = builder.parallelThreshold;
        this.patternCacheSize = builder.patternCacheSize;
        this.serverPort = builder.serverPort;
        this.defaultProfile = builder.defaultProfile;
        this.reloadInterval = builder.reloadInterval;
        this.backupKeep = builder.backupKeep;
        this.backupDirectory = builder.backupDirectory;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@value #PROPERTIES_FILE} and applies environment and system property overrides.
     */
    public static QaEngineConfig load() {
        return load(readProperties(PROPERTIES_FILE), System.getenv(), System.getProperties());
    }

    static QaEngineConfig load(Properties file, Map<String, String> env, Properties system) {
        Builder builder = builder();
        builder.apply(file::getProperty);
        builder.apply(key -> env.get(envName(key)));
        builder.apply(system::getProperty);
        return builder.build();
    }

    /**
     * Environment variable name for a key: {@code lexiqa.engine.parallel-threshold}
     * becomes {@code LEXIQA_ENGINE_PARALLEL_THRESHOLD}.
     */
    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    static Properties readProperties(String location) {
        return readProperties(location, Paths.get(location));
    }

    /**
     * Reads the classpath resource, then overlays the file, so a file next to the
     * process overrides individual keys of the packaged defaults.
     */
    static Properties readProperties(String resource, Path file) {
        Properties props = new Properties();
        try (InputStream is = QaEngineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + resource);
            }
        } catch (IOException e) {
            logger.warning("Could not read classpath resource " + resource + ": " + e.getMessage());
        }
        if (Files.isRegularFile(file)) {
            Properties overrides = new Properties();
            try (InputStream is = Files.newInputStream(file)) {
                overrides.load(is);
                props.putAll(overrides);
                logger.fine("Loaded " + overrides.size() + " properties from file: " + file.toAbsolutePath());
            } catch (IOException e) {
                logger.warning("Could not read properties file " + file + ": " + e.getMessage());
            }
        }
        return props;
    }

    private void validate() {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1: " + workerCount);
        }
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold must be positive: " + parallelThreshold);
        }
        if (patternCacheSize < 1) {
            throw new IllegalArgumentException("patternCacheSize must be positive: " + patternCacheSize);
        }
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("serverPort out of range: " + serverPort);
        }
        if (reloadInterval.isNegative() || reloadInterval.isZero()) {
            throw new IllegalArgumentException("reloadInterval must be positive: " + reloadInterval);
        }
        if (backupKeep < 1) {
            throw new IllegalArgumentException("backupKeep must be at least 1: " + backupKeep);
        }
        if (profileSuffix.isEmpty()) {
            throw new IllegalArgumentException("profileSuffix cannot be empty");
        }
    }

    public Path getProfilesDirectory() {
        return profilesDirectory;
    }

    public String getProfileSuffix() {
        return profileSuffix;
    }

    public Path getLibraryPath() {
        return libraryPath;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public int getPatternCacheSize() {
        return patternCacheSize;
    }

    public int getServerPort() {
        return serverPort;
    }

    /**
     * Profile the server monitors, if one is configured.
     */
    public Optional<Path> getDefaultProfile() {
        return Optional.ofNullable(defaultProfile);
    }

    public Duration getReloadInterval() {
        return reloadInterval;
    }

    /**
     * Number of backups kept per file; older ones are deleted after each new backup.
     */
    public int getBackupKeep() {
        return backupKeep;
    }

    /**
     * Directory collecting backups, or empty to keep them next to the file they copy.
     */
    public Optional<Path> getBackupDirectory() {
        return Optional.ofNullable(backupDirectory);
    }

    @Override
    public String toString() {
        return "QaEngineConfig{profilesDirectory=" + profilesDirectory
                + ", profileSuffix=" + profileSuffix
                + ", libraryPath=" + libraryPath
                + ", workerCount=" + workerCount
                + ", parallelThreshold=" + parallelThreshold
                + ", patternCacheSize=" + patternCacheSize
                + ", serverPort=" + serverPort
                + ", defaultProfile=" + defaultProfile
                + ", reloadInterval=" + reloadInterval
                + ", backupKeep=" + backupKeep
                + ", backupDirectory=" + backupDirectory + '}';
    }

    public static final class Builder {
        private static final Path HOME = Paths.get(System.getProperty("user.home"), ".lexiqa");

        private Path profilesDirectory = HOME.resolve("profiles");
        private String profileSuffix = "_qa_profile.xml";
        private Path libraryPath = HOME.resolve("library.xml");
        private int workerCount = Runtime.getRuntime().availableProcessors();
        private int parallelThreshold = 256;
        private int patternCacheSize = 1024;
        private int serverPort = 8080;
        private Path defaultProfile;
        private Duration reloadInterval = Duration.ofSeconds(10);
        private int backupKeep = 10;
        private Path backupDirectory;

        private Builder() {
        }

        public Builder profilesDirectory(Path profilesDirectory) {
            this.profilesDirectory = profilesDirectory;
            return this;
        }

        public Builder profileSuffix(String profileSuffix) {
            this.profileSuffix = profileSuffix;
            return this;
        }

        public Builder libraryPath(Path libraryPath) {
            this.libraryPath = libraryPath;
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        public Builder patternCacheSize(int patternCacheSize) {
            this.patternCacheSize = patternCacheSize;
            return this;
        }

        public Builder serverPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder defaultProfile(Path defaultProfile) {
            this.defaultProfile = defaultProfile;
            return this;
        }

        public Builder reloadInterval(Duration reloadInterval) {
            this.reloadInterval = reloadInterval;
            return this;
        }

        public Builder backupKeep(int backupKeep) {
            this.backupKeep = backupKeep;
            return this;
        }

        public Builder backupDirectory(Path backupDirectory) {
            this.backupDirectory = backupDirectory;
            return this;
        }

        public QaEngineConfig build() {
            return new QaEngineConfig(this);
        }

        /**
         * Overlays every key {@code source} knows about.
         */
        void apply(Function<String, String> source) {
            value(source, KEY_PROFILES_DIR).ifPresent(v -> profilesDirectory = Paths.get(v));
            value(source, KEY_PROFILE_SUFFIX).ifPresent(v -> profileSuffix = v);
            value(source, KEY_LIBRARY_PATH).ifPresent(v -> libraryPath = Paths.get(v));
            intValue(source, KEY_WORKERS).ifPresent(v -> workerCount = v);
            intValue(source, KEY_PARALLEL_THRESHOLD).ifPresent(v -> parallelThreshold = v);
            intValue(source, KEY_PATTERN_CACHE_SIZE).ifPresent(v -> patternCacheSize = v);
            intValue(source, KEY_SERVER_PORT).ifPresent(v -> serverPort = v);
            value(source, KEY_DEFAULT_PROFILE).ifPresent(v -> defaultProfile = Paths.get(v));
            intValue(source, KEY_RELOAD_INTERVAL).ifPresent(v -> reloadInterval = Duration.ofSeconds(v));
            intValue(source, KEY_BACKUP_KEEP).ifPresent(v -> backupKeep = v);
            value(source, KEY_BACKUP_DIR).ifPresent(v -> backupDirectory = Paths.get(v));
        }

        private static Optional<String> value(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> intValue(Function<String, String> source, String key) {
            return value(source, key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
