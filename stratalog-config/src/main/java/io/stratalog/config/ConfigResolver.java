/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.stratalog.config;

import io.stratalog.LevelResolver;
import io.stratalog.LogConfig;
import io.stratalog.LogContext;
import io.stratalog.LogHandle;
import io.stratalog.LogRegistry;
import io.stratalog.eventing.LogLevel;
import io.stratalog.sinks.ConsoleStream;
import io.stratalog.sinks.TimestampMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link LogConfig} from layered sources. Later layers win:
 * <ol>
 *   <li>built-in defaults ({@link LogConfig#builder()}, except that exit-on-critical is on)</li>
 *   <li>the configuration file</li>
 *   <li>environment variables</li>
 *   <li>command line options</li>
 *   <li>explicit overrides passed by the caller</li>
 * </ol>
 *
 * <p>The configuration file is the explicit path if one is given, else {@code --log-config},
 * else {@value ConfigKey#CONFIG_FILE_ENV}.
 *
 * <h2>Failure Handling</h2>
 * Resolution never fails. An unreadable file contributes nothing, and a value that cannot
 * be coerced is replaced by the same key from the next lower layer, or the default. Each
 * such fallback is recorded as a warning on the {@link Resolution}, and
 * {@link Resolution#initialize(LogRegistry)} writes those warnings as WARNING records on
 * {@value #CONFIG_LOGGER} once logging is up.
 *
 * <p>The two level maps, {@code module_levels} and {@code external_loggers}, are merged
 * across all layers entry by entry rather than replaced. {@code disable_rotation} beats
 * {@code rotation_size_bytes}, which beats {@code rotation_size_mb}, whatever layer each
 * comes from.
 *
 * @since 1.0.0
 */
public final class ConfigResolver {

    private static final Logger logger = LogManager.getLogger(ConfigResolver.class);

    /** Logger name the resolution warnings are written under. */
    public static final String CONFIG_LOGGER = LevelResolver.CONFIG_NOTICE_LOGGER;

    private static final long MIB = 1024L * 1024L;

    private final EnvConfigLoader environment;

    public ConfigResolver() {
        this(new EnvConfigLoader());
    }

    public ConfigResolver(EnvConfigLoader environment) {
        this.environment = environment;
    }

    public Resolution resolve() {
        return resolve(null, null, Map.of());
    }

    public Resolution resolve(LoggingOptions options) {
        return resolve(null, options, Map.of());
    }

    /**
     * @param configFile an explicit configuration file, or null
     * @param options parsed command line options, or null
     * @param overrides values that win over every other layer, keyed like a configuration file
     * @return the resolved snapshot with any warnings
     */
    public Resolution resolve(Path configFile, LoggingOptions options, Map<String, ?> overrides) {
        List<String> warnings = new ArrayList<>();
        List<Layer> layers = new ArrayList<>(4);

        Optional<Path> file = Optional.ofNullable(configFile)
            .or(() -> options == null ? Optional.empty() : options.getConfigFile())
            .or(() -> environment.configFile().map(Path::of));
        if (file.isPresent()) {
            try {
                layers.add(new Layer("file " + file.get(), ConfigFileLoader.load(file.get())));
            } catch (ConfigurationException e) {
                warnings.add(e.getMessage() + "; using the remaining sources");
            }
        }
        layers.add(new Layer("environment", environment.load()));
        if (options != null) {
            layers.add(new Layer("command line", options.toValues()));
        }
        if (overrides != null && !overrides.isEmpty()) {
            layers.add(new Layer("overrides", new LinkedHashMap<>(overrides)));
        }

        for (Layer layer : layers) {
            for (String name : layer.values.keySet()) {
                if (ConfigKey.fromName(name).isEmpty()) {
                    warnings.add(layer.name + ": unknown key '" + name + "' ignored");
                }
            }
        }

        Map<ConfigKey, Object> resolved = new EnumMap<>(ConfigKey.class);
        Map<String, LogLevel> levelOverrides = new LinkedHashMap<>();
        for (ConfigKey key : ConfigKey.values()) {
            if (key.isLevelMap()) {
                mergeLevels(key, layers, levelOverrides, warnings);
            } else {
                resolveScalar(key, layers, warnings).ifPresent(v -> resolved.put(key, v));
            }
        }

        LogConfig config;
        try {
            config = apply(resolved, levelOverrides).build();
        } catch (IllegalArgumentException e) {
            warnings.add("invalid combination of settings (" + e.getMessage() + "); using defaults");
            config = defaults().build();
        }
        for (String warning : warnings) {
            logger.debug("Configuration warning: {}", warning);
        }
        return new Resolution(config, warnings);
    }

    private Optional<Object> resolveScalar(ConfigKey key, List<Layer> layers, List<String> warnings) {
        for (int i = layers.size() - 1; i >= 0; i--) {
            Layer layer = layers.get(i);
            Object raw = layer.values.get(key.getName());
            if (raw == null) {
                continue;
            }
            try {
                return Optional.of(coerce(key, raw));
            } catch (ConfigurationException e) {
                warnings.add(layer.name + ": " + e.getMessage() + "; falling back");
            }
        }
        return Optional.empty();
    }

    private void mergeLevels(ConfigKey key, List<Layer> layers, Map<String, LogLevel> into, List<String> warnings) {
        for (Layer layer : layers) {
            Object raw = layer.values.get(key.getName());
            if (raw == null) {
                continue;
            }
            try {
                ConfigValues.toLevelMap(key, raw, into);
            } catch (ConfigurationException e) {
                warnings.add(layer.name + ": " + e.getMessage());
            }
        }
    }

    private static Object coerce(ConfigKey key, Object raw) throws ConfigurationException {
        switch (key) {
            case LOG_DIR:
                return ConfigValues.toText(key, raw);
            case DATEFMT:
                String pattern = ConfigValues.toText(key, raw);
                try {
                    DateTimeFormatter.ofPattern(pattern);
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(key.getName(), "'" + raw + "' is not a date pattern", e);
                }
                return pattern;
            case LOG_FILENAME:
                String filename = ConfigValues.toText(key, raw).trim();
                if (filename.contains("/") || filename.contains("\\")) {
                    throw new ConfigurationException(key.getName(), "'" + raw + "' must be a file name, not a path", null);
                }
                return filename;
            case DEFAULT_LEVEL:
                return ConfigValues.toLevel(key, raw);
            case ROTATION_SIZE_MB:
                return ConfigValues.toDouble(key, raw, 0);
            case ROTATION_SIZE_BYTES:
            case LOCK_TIMEOUT_MS:
            case SHUTDOWN_GRACE_MS:
                return ConfigValues.toLong(key, raw, 0);
            case BACKUP_COUNT:
                return ConfigValues.toInt(key, raw, 0);
            case QUEUE_CAPACITY:
            case FLUSH_EVERY:
                return ConfigValues.toInt(key, raw, 1);
            case TIMESTAMP_MODE:
                try {
                    return TimestampMode.fromString(ConfigValues.toText(key, raw));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(key.getName(), e.getMessage(), e);
                }
            case CONSOLE_STREAM:
                try {
                    return ConsoleStream.fromString(ConfigValues.toText(key, raw));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException(key.getName(), e.getMessage(), e);
                }
            default:
                return ConfigValues.toBoolean(key, raw);
        }
    }

    private static LogConfig.Builder defaults() {
        return LogConfig.builder().exitOnCritical(true);
    }

    private static LogConfig.Builder apply(Map<ConfigKey, Object> values, Map<String, LogLevel> levelOverrides) {
        LogConfig.Builder builder = defaults().levelOverrides(levelOverrides);
        values.forEach((key, value) -> {
            switch (key) {
                case LOG_DIR:
                    builder.logDirectory(Path.of((String) value));
                    break;
                case LOG_FILENAME:
                    builder.baseFilename((String) value);
                    break;
                case DEFAULT_LEVEL:
                    builder.defaultLevel((LogLevel) value);
                    break;
                case BACKUP_COUNT:
                    builder.backupCount((Integer) value);
                    break;
                case COLORED_CONSOLE:
                    builder.coloredConsole((Boolean) value);
                    break;
                case COLORED_FILE:
                    builder.coloredFile((Boolean) value);
                    break;
                case EXIT_ON_CRITICAL:
                    builder.exitOnCritical((Boolean) value);
                    break;
                case MULTIPROCESS_SAFE:
                    builder.multiprocessSafe((Boolean) value);
                    break;
                case QUEUE_CAPACITY:
                    builder.queueCapacity((Integer) value);
                    break;
                case FLUSH_EVERY:
                    builder.flushEveryRecords((Integer) value);
                    break;
                case SYNC_ON_FLUSH:
                    builder.syncOnFlush((Boolean) value);
                    break;
                case LOCK_TIMEOUT_MS:
                    builder.lockTimeout(Duration.ofMillis((Long) value));
                    break;
                case SHUTDOWN_GRACE_MS:
                    builder.shutdownGrace(Duration.ofMillis((Long) value));
                    break;
                case TIMESTAMP_MODE:
                    builder.timestampMode((TimestampMode) value);
                    break;
                case DATEFMT:
                    builder.datePattern((String) value);
                    break;
                case CONSOLE:
                    builder.consoleEnabled((Boolean) value);
                    break;
                case CONSOLE_STREAM:
                    builder.consoleStream((ConsoleStream) value);
                    break;
                case INCLUDE_SOURCE:
                    builder.includeSourceLocation((Boolean) value);
                    break;
                case COLOR_WHOLE_LINE:
                    builder.colorWholeLine((Boolean) value);
                    break;
                default:
                    // rotation keys are combined below
                    break;
            }
        });
        if (Boolean.TRUE.equals(values.get(ConfigKey.DISABLE_ROTATION))) {
            builder.rotationThresholdBytes(0);
        } else if (values.containsKey(ConfigKey.ROTATION_SIZE_BYTES)) {
            builder.rotationThresholdBytes((Long) values.get(ConfigKey.ROTATION_SIZE_BYTES));
        } else if (values.containsKey(ConfigKey.ROTATION_SIZE_MB)) {
            builder.rotationThresholdBytes(Math.round((Double) values.get(ConfigKey.ROTATION_SIZE_MB) * MIB));
        }
        return builder;
    }

    private static final class Layer {
        final String name;
        final Map<String, Object> values;

        Layer(String name, Map<String, Object> values) {
            this.name = name;
            this.values = values;
        }
    }

    /**
     * A resolved snapshot and the warnings collected while resolving it.
     */
    public static final class Resolution {
        private final LogConfig config;
        private final List<String> warnings;

        Resolution(LogConfig config, List<String> warnings) {
            this.config = config;
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public LogConfig getConfig() {
            return config;
        }

        public List<String> getWarnings() {
            return warnings;
        }

        /**
         * Initializes {@code registry} with the snapshot, then writes each warning as a
         * WARNING record on {@value ConfigResolver#CONFIG_LOGGER}.
         *
         * @param registry the registry to initialize
         * @return the active context
         */
        public LogContext initialize(LogRegistry registry) {
            LogContext context = registry.initialize(config);
            LogHandle handle = registry.getLogger(CONFIG_LOGGER);
            for (String warning : warnings) {
                handle.warning("{}", warning);
            }
            return context;
        }

        public LogContext initialize() {
            return initialize(LogRegistry.global());
        }
    }
}
