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

import java.util.List;
import java.util.Optional;

/**
 * Every key a configuration file, the environment or the command line may set, with the
 * environment variables that supply it. Aliases are tried in order and the first variable
 * that is set wins.
 *
 * <p>Keys use the snake_case names of the file format, so a YAML file such as
 * <pre>{@code
 * log_dir: /var/log/ingest
 * default_level: DEBUG
 * rotation_size_mb: 50
 * module_levels:
 *   io.netty: WARNING
 * }</pre>
 * maps one to one onto these constants.
 *
 * @since 1.0.0
 */
public enum ConfigKey {
    LOG_DIR("log_dir", "STRATALOG_LOG_DIR", "LOGGING_DIR", "LOG_DIR", "LOG_PATH", "LOGGING_PATH"),
    LOG_FILENAME("log_filename", "STRATALOG_LOG_FILENAME", "LOG_FILENAME", "LOGGING_FILENAME"),
    DEFAULT_LEVEL("default_level", "STRATALOG_LEVEL", "LOG_LEVEL", "LOGGING_LEVEL", "LOGGING_VERBOSE", "LOG_VERBOSE"),
    ROTATION_SIZE_MB("rotation_size_mb", "STRATALOG_ROTATION_SIZE_MB", "LOG_ROTATION_SIZE", "LOG_ROTATION_SIZE_MB",
        "LOGGING_ROTATION_SIZE", "LOG_MAX_SIZE"),
    ROTATION_SIZE_BYTES("rotation_size_bytes", "STRATALOG_ROTATION_SIZE_BYTES"),
    DISABLE_ROTATION("disable_rotation", "STRATALOG_DISABLE_ROTATION", "LOG_DISABLE_ROTATION"),
    BACKUP_COUNT("backup_count", "STRATALOG_BACKUP_COUNT", "LOG_BACKUP_COUNT", "LOGGING_BACKUP_COUNT", "LOG_BACKUP"),
    COLORED_CONSOLE("colored_console", "STRATALOG_COLORED_CONSOLE", "LOG_COLORED_CONSOLE", "LOGGING_COLORED", "LOG_COLOR"),
    COLORED_FILE("colored_file", "STRATALOG_COLORED_FILE", "LOG_COLORED_FILE"),
    EXIT_ON_CRITICAL("exit_on_critical", "STRATALOG_EXIT_ON_CRITICAL", "LOG_EXIT_ON_CRITICAL", "LOGGING_EXIT_ON_CRITICAL"),
    MULTIPROCESS_SAFE("multiprocess_safe", "STRATALOG_MULTIPROCESS_SAFE", "LOG_MULTIPROCESS_SAFE"),
    QUEUE_CAPACITY("queue_capacity", "STRATALOG_QUEUE_CAPACITY"),
    FLUSH_EVERY("flush_every", "STRATALOG_FLUSH_EVERY"),
    SYNC_ON_FLUSH("sync_on_flush", "STRATALOG_SYNC_ON_FLUSH"),
    LOCK_TIMEOUT_MS("lock_timeout_ms", "STRATALOG_LOCK_TIMEOUT_MS"),
    SHUTDOWN_GRACE_MS("shutdown_grace_ms", "STRATALOG_SHUTDOWN_GRACE_MS"),
    TIMESTAMP_MODE("timestamp_mode", "STRATALOG_TIMESTAMP_MODE"),
    DATEFMT("datefmt", "STRATALOG_DATEFMT", "LOG_DATEFMT"),
    CONSOLE("console", "STRATALOG_CONSOLE"),
    CONSOLE_STREAM("console_stream", "STRATALOG_CONSOLE_STREAM"),
    INCLUDE_SOURCE("include_source", "STRATALOG_INCLUDE_SOURCE"),
    COLOR_WHOLE_LINE("color_whole_line", "STRATALOG_COLOR_WHOLE_LINE"),
    MODULE_LEVELS("module_levels"),
    EXTERNAL_LOGGERS("external_loggers");

    /** Environment variable naming a configuration file when no file is given explicitly. */
    public static final String CONFIG_FILE_ENV = "STRATALOG_CONFIG";

    private final String name;
    private final List<String> envAliases;

    ConfigKey(String name, String... envAliases) {
        this.name = name;
        this.envAliases = List.of(envAliases);
    }

    /**
     * @return the snake_case key used in configuration files
     */
    public String getName() {
        return name;
    }

    /**
     * @return the environment variables for this key, highest priority first; empty for map-valued keys
     */
    public List<String> getEnvAliases() {
        return envAliases;
    }

    public boolean isLevelMap() {
        return this == MODULE_LEVELS || this == EXTERNAL_LOGGERS;
    }

    public static Optional<ConfigKey> fromName(String name) {
        for (ConfigKey key : values()) {
            if (key.name.equals(name)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
