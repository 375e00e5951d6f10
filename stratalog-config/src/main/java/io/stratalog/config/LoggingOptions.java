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

import io.stratalog.eventing.LogLevel;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared logging options for commands. Include it with {@code @CommandLine.Mixin} and pass
 * it to {@link ConfigResolver#resolve(Path, LoggingOptions, Map)}; only options the user
 * actually gave override lower layers.
 *
 * <pre>{@code
 * @CommandLine.Mixin
 * private LoggingOptions loggingOptions = new LoggingOptions();
 * }</pre>
 */
public final class LoggingOptions {

    @CommandLine.Option(
        names = {"--log-config", "--log-conf", "--logging-config"},
        paramLabel = "PATH",
        description = "Logging configuration file (.yaml, .yml or .json)"
    )
    private Path configFile;

    @CommandLine.Option(
        names = {"--log-level"},
        paramLabel = "LEVEL",
        description = "Default log level: DEBUG, INFO, WARNING, ERROR, CRITICAL",
        converter = LevelConverter.class
    )
    private LogLevel level;

    @CommandLine.Option(names = {"--log-dir"}, paramLabel = "PATH", description = "Directory for log files")
    private Path logDirectory;

    @CommandLine.Option(names = {"--log-filename"}, paramLabel = "NAME", description = "Active log file name")
    private String logFilename;

    @CommandLine.Option(names = {"--colored-file"}, description = "Keep ANSI colors in the log file")
    private Boolean coloredFile;

    @CommandLine.Option(names = {"--no-color", "--no-colors"}, description = "Disable console colors")
    private Boolean noColor;

    @CommandLine.Option(names = {"--exit-on-critical"}, description = "Exit the process after a CRITICAL record")
    private Boolean exitOnCritical;

    @CommandLine.Option(names = {"--disable-rotation"}, description = "Never rotate the log file")
    private Boolean disableRotation;

    @CommandLine.Option(names = {"--rotation-size"}, paramLabel = "MB", description = "Rotate after this many megabytes")
    private Double rotationSizeMb;

    @CommandLine.Option(names = {"--backup-count"}, paramLabel = "N", description = "Rotated files to keep")
    private Integer backupCount;

    public Optional<Path> getConfigFile() {
        return Optional.ofNullable(configFile);
    }

    /**
     * @return the values given on the command line, keyed like a configuration file
     */
    public Map<String, Object> toValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        if (level != null) {
            values.put(ConfigKey.DEFAULT_LEVEL.getName(), level.name());
        }
        if (logDirectory != null) {
            values.put(ConfigKey.LOG_DIR.getName(), logDirectory.toString());
        }
        if (logFilename != null) {
            values.put(ConfigKey.LOG_FILENAME.getName(), logFilename);
        }
        if (Boolean.TRUE.equals(coloredFile)) {
            values.put(ConfigKey.COLORED_FILE.getName(), true);
        }
        if (Boolean.TRUE.equals(noColor)) {
            values.put(ConfigKey.COLORED_CONSOLE.getName(), false);
        }
        if (Boolean.TRUE.equals(exitOnCritical)) {
            values.put(ConfigKey.EXIT_ON_CRITICAL.getName(), true);
        }
        if (Boolean.TRUE.equals(disableRotation)) {
            values.put(ConfigKey.DISABLE_ROTATION.getName(), true);
        }
        if (rotationSizeMb != null) {
            values.put(ConfigKey.ROTATION_SIZE_MB.getName(), rotationSizeMb);
        }
        if (backupCount != null) {
            values.put(ConfigKey.BACKUP_COUNT.getName(), backupCount);
        }
        return values;
    }

    public static final class LevelConverter implements CommandLine.ITypeConverter<LogLevel> {
        @Override
        public LogLevel convert(String value) {
            try {
                return LogLevel.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
