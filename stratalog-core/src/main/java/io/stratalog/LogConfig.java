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

package io.stratalog;

import io.stratalog.eventing.LogLevel;
import io.stratalog.sinks.ConsoleStream;
import io.stratalog.sinks.TimestampMode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, fully resolved logging configuration. A snapshot is built once (normally by
 * the configuration resolver in {@code stratalog-config}) and passed to
 * {@link LogRegistry#initialize(LogConfig)}. Every component created for that
 * initialization reads this one snapshot for its whole lifetime.
 *
 * <p>Snapshots have value semantics: initializing twice with equal snapshots is a no-op,
 * while initializing with a different snapshot replaces the active delivery context.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>level INFO, no per-logger overrides</li>
 *   <li>{@code logs/app.log}, rotation at 10 MiB, 5 backups</li>
 *   <li>colored console on stdout, plain file, exit-on-critical off</li>
 *   <li>cross-process safe rotation, 4096 queued records, flush every record</li>
 *   <li>5 second rotation lock timeout, 2 second shutdown grace</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * LogConfig config = LogConfig.builder()
 *     .logDirectory(Path.of("/var/log/app"))
 *     .baseFilename("worker.log")
 *     .defaultLevel(LogLevel.DEBUG)
 *     .levelOverride("org.noisy", LogLevel.WARNING)
 *     .rotationThresholdBytes(50L * 1024 * 1024)
 *     .backupCount(3)
 *     .build();
 * StrataLog.initialize(config);
 * }</pre>
 *
 * @see LevelResolver
 * @since 1.0.0
 */
public final class LogConfig {

    public static final long DEFAULT_ROTATION_THRESHOLD = 10L * 1024 * 1024;
    public static final int DEFAULT_BACKUP_COUNT = 5;
    public static final int DEFAULT_QUEUE_CAPACITY = 4096;
    public static final String DEFAULT_DATE_PATTERN = "yyyy-MM-dd HH:mm:ss.SSSSSS";

    private final LogLevel defaultLevel;
    private final Map<String, LogLevel> levelOverrides;
    private final Path logDirectory;
    private final String baseFilename;
    private final long rotationThresholdBytes;
    private final int backupCount;
    private final boolean coloredConsole;
    private final boolean coloredFile;
    private final boolean exitOnCritical;
    private final boolean consoleEnabled;
    private final ConsoleStream consoleStream;
    private final boolean multiprocessSafe;
    private final int queueCapacity;
    private final int flushEveryRecords;
    private final boolean syncOnFlush;
    private final Duration lockTimeout;
    private final Duration shutdownGrace;
    private final TimestampMode timestampMode;
    private final String datePattern;
    private final boolean includeSourceLocation;
    private final boolean colorWholeLine;

    private LogConfig(Builder b) {
        this.defaultLevel = b.defaultLevel;
        this.levelOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(b.levelOverrides));
        this.logDirectory = b.logDirectory;
        this.baseFilename = b.baseFilename;
        this.rotationThresholdBytes = b.rotationThresholdBytes;
        this.backupCount = b.backupCount;
        this.coloredConsole = b.coloredConsole;
        this.coloredFile = b.coloredFile;
        this.exitOnCritical = b.exitOnCritical;
        this.consoleEnabled = b.consoleEnabled;
        this.consoleStream = b.consoleStream;
        this.multiprocessSafe = b.multiprocessSafe;
        this.queueCapacity = b.queueCapacity;
        this.flushEveryRecords = b.flushEveryRecords;
        this.syncOnFlush = b.syncOnFlush;
        this.lockTimeout = b.lockTimeout;
        this.shutdownGrace = b.shutdownGrace;
        this.timestampMode = b.timestampMode;
        this.datePattern = b.datePattern;
        this.includeSourceLocation = b.includeSourceLocation;
        this.colorWholeLine = b.colorWholeLine;
    }

    /**
     * @return a builder preloaded with the built-in defaults
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a snapshot holding only the built-in defaults
     */
    public static LogConfig defaults() {
        return builder().build();
    }

    /**
     * @return a builder preloaded with this snapshot's values
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public LogLevel getDefaultLevel() {
        return defaultLevel;
    }

    /**
     * @return logger-name prefix to level overrides, in insertion order
     */
    public Map<String, LogLevel> getLevelOverrides() {
        return levelOverrides;
    }

    public Path getLogDirectory() {
        return logDirectory;
    }

    public String getBaseFilename() {
        return baseFilename;
    }

    /**
     * @return the active log file, {@code logDirectory/baseFilename}
     */
    public Path getLogFile() {
        return logDirectory.resolve(baseFilename);
    }

    /**
     * @return the size that triggers rotation, or 0 when rotation is disabled
     */
    public long getRotationThresholdBytes() {
        return rotationThresholdBytes;
    }

    public boolean isRotationEnabled() {
        return rotationThresholdBytes > 0;
    }

    public int getBackupCount() {
        return backupCount;
    }

    public boolean isColoredConsole() {
        return coloredConsole;
    }

    public boolean isColoredFile() {
        return coloredFile;
    }

    public boolean isExitOnCritical() {
        return exitOnCritical;
    }

    public boolean isConsoleEnabled() {
        return consoleEnabled;
    }

    public ConsoleStream getConsoleStream() {
        return consoleStream;
    }

    public boolean isMultiprocessSafe() {
        return multiprocessSafe;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getFlushEveryRecords() {
        return flushEveryRecords;
    }

    public boolean isSyncOnFlush() {
        return syncOnFlush;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public TimestampMode getTimestampMode() {
        return timestampMode;
    }

    public String getDatePattern() {
        return datePattern;
    }

    public boolean isIncludeSourceLocation() {
        return includeSourceLocation;
    }

    public boolean isColorWholeLine() {
        return colorWholeLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogConfig)) {
            return false;
        }
        LogConfig that = (LogConfig) o;
        return rotationThresholdBytes == that.rotationThresholdBytes
            && backupCount == that.backupCount
            && coloredConsole == that.coloredConsole
            && coloredFile == that.coloredFile
            && exitOnCritical == that.exitOnCritical
            && consoleEnabled == that.consoleEnabled
            && multiprocessSafe == that.multiprocessSafe
            && queueCapacity == that.queueCapacity
            && flushEveryRecords == that.flushEveryRecords
            && syncOnFlush == that.syncOnFlush
            && includeSourceLocation == that.includeSourceLocation
            && colorWholeLine == that.colorWholeLine
            && defaultLevel == that.defaultLevel
            && levelOverrides.equals(that.levelOverrides)
            && logDirectory.equals(that.logDirectory)
            && baseFilename.equals(that.baseFilename)
            && consoleStream == that.consoleStream
            && lockTimeout.equals(that.lockTimeout)
            && shutdownGrace.equals(that.shutdownGrace)
            && timestampMode == that.timestampMode
            && datePattern.equals(that.datePattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultLevel, levelOverrides, logDirectory, baseFilename, rotationThresholdBytes,
            backupCount, coloredConsole, coloredFile, exitOnCritical, consoleEnabled, consoleStream,
            multiprocessSafe, queueCapacity, flushEveryRecords, syncOnFlush, lockTimeout, shutdownGrace,
            timestampMode, datePattern, includeSourceLocation, colorWholeLine);
    }

    @Override
    public String toString() {
        return "LogConfig{" +
            "defaultLevel=" + defaultLevel +
            ", levelOverrides=" + levelOverrides +
            ", logFile=" + getLogFile() +
            ", rotationThresholdBytes=" + rotationThresholdBytes +
            ", backupCount=" + backupCount +
            ", coloredConsole=" + coloredConsole +
            ", coloredFile=" + coloredFile +
            ", exitOnCritical=" + exitOnCritical +
            ", consoleEnabled=" + consoleEnabled +
            ", consoleStream=" + consoleStream +
            ", multiprocessSafe=" + multiprocessSafe +
            ", queueCapacity=" + queueCapacity +
            ", flushEveryRecords=" + flushEveryRecords +
            ", syncOnFlush=" + syncOnFlush +
            ", lockTimeout=" + lockTimeout +
            ", shutdownGrace=" + shutdownGrace +
            ", timestampMode=" + timestampMode +
            ", datePattern='" + datePattern + '\'' +
            ", includeSourceLocation=" + includeSourceLocation +
            ", colorWholeLine=" + colorWholeLine +
            '}';
    }

    /**
     * Mutable builder for {@link LogConfig}. Not thread-safe; {@link #build()} validates
     * and copies, so a built snapshot is never affected by later builder calls.
     */
    public static final class Builder {
        private LogLevel defaultLevel = LogLevel.INFO;
        private final Map<String, LogLevel> levelOverrides = new LinkedHashMap<>();
        private Path logDirectory = Path.of("logs");
        private String baseFilename = "app.log";
        private long rotationThresholdBytes = DEFAULT_ROTATION_THRESHOLD;
        private int backupCount = DEFAULT_BACKUP_COUNT;
        private boolean coloredConsole = true;
        private boolean coloredFile = false;
        private boolean exitOnCritical = false;
        private boolean consoleEnabled = true;
        private ConsoleStream consoleStream = ConsoleStream.STDOUT;
        private boolean multiprocessSafe = true;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private int flushEveryRecords = 1;
        private boolean syncOnFlush = false;
        private Duration lockTimeout = Duration.ofSeconds(5);
        private Duration shutdownGrace = Duration.ofSeconds(2);
        private TimestampMode timestampMode = TimestampMode.HUMAN;
        private String datePattern = DEFAULT_DATE_PATTERN;
        private boolean includeSourceLocation = true;
        private boolean colorWholeLine = false;

        private Builder() {
        }

        private Builder(LogConfig c) {
            this.defaultLevel = c.defaultLevel;
            this.levelOverrides.putAll(c.levelOverrides);
            this.logDirectory = c.logDirectory;
            this.baseFilename = c.baseFilename;
            this.rotationThresholdBytes = c.rotationThresholdBytes;
            this.backupCount = c.backupCount;
            this.coloredConsole = c.coloredConsole;
            this.coloredFile = c.coloredFile;
            this.exitOnCritical = c.exitOnCritical;
            this.consoleEnabled = c.consoleEnabled;
            this.consoleStream = c.consoleStream;
            this.multiprocessSafe = c.multiprocessSafe;
            this.queueCapacity = c.queueCapacity;
            this.flushEveryRecords = c.flushEveryRecords;
            this.syncOnFlush = c.syncOnFlush;
            this.lockTimeout = c.lockTimeout;
            this.shutdownGrace = c.shutdownGrace;
            this.timestampMode = c.timestampMode;
            this.datePattern = c.datePattern;
            this.includeSourceLocation = c.includeSourceLocation;
            this.colorWholeLine = c.colorWholeLine;
        }

        public Builder defaultLevel(LogLevel level) {
            this.defaultLevel = Objects.requireNonNull(level, "defaultLevel");
            return this;
        }

        /**
         * Sets the threshold for every logger whose name equals {@code prefix} or starts
         * with {@code prefix + "."}. The longest matching prefix wins.
         *
         * @param prefix the dotted logger name prefix
         * @param level the threshold for matching loggers
         * @return this builder
         */
        public Builder levelOverride(String prefix, LogLevel level) {
            this.levelOverrides.put(Objects.requireNonNull(prefix, "prefix"), Objects.requireNonNull(level, "level"));
            return this;
        }

        public Builder levelOverrides(Map<String, LogLevel> overrides) {
            overrides.forEach(this::levelOverride);
            return this;
        }

        public Builder clearLevelOverrides() {
            this.levelOverrides.clear();
            return this;
        }

        public Builder logDirectory(Path directory) {
            this.logDirectory = Objects.requireNonNull(directory, "logDirectory");
            return this;
        }

        public Builder baseFilename(String filename) {
            this.baseFilename = Objects.requireNonNull(filename, "baseFilename");
            return this;
        }

        /**
         * @param bytes the rotation threshold, or 0 to disable rotation
         * @return this builder
         */
        public Builder rotationThresholdBytes(long bytes) {
            this.rotationThresholdBytes = bytes;
            return this;
        }

        public Builder backupCount(int count) {
            this.backupCount = count;
            return this;
        }

        public Builder coloredConsole(boolean colored) {
            this.coloredConsole = colored;
            return this;
        }

        public Builder coloredFile(boolean colored) {
            this.coloredFile = colored;
            return this;
        }

        public Builder exitOnCritical(boolean exit) {
            this.exitOnCritical = exit;
            return this;
        }

        public Builder consoleEnabled(boolean enabled) {
            this.consoleEnabled = enabled;
            return this;
        }

        public Builder consoleStream(ConsoleStream stream) {
            this.consoleStream = Objects.requireNonNull(stream, "consoleStream");
            return this;
        }

        public Builder multiprocessSafe(boolean safe) {
            this.multiprocessSafe = safe;
            return this;
        }

        public Builder queueCapacity(int capacity) {
            this.queueCapacity = capacity;
            return this;
        }

        public Builder flushEveryRecords(int records) {
            this.flushEveryRecords = records;
            return this;
        }

        public Builder syncOnFlush(boolean sync) {
            this.syncOnFlush = sync;
            return this;
        }

        public Builder lockTimeout(Duration timeout) {
            this.lockTimeout = Objects.requireNonNull(timeout, "lockTimeout");
            return this;
        }

        public Builder shutdownGrace(Duration grace) {
            this.shutdownGrace = Objects.requireNonNull(grace, "shutdownGrace");
            return this;
        }

        public Builder timestampMode(TimestampMode mode) {
            this.timestampMode = Objects.requireNonNull(mode, "timestampMode");
            return this;
        }

        public Builder datePattern(String pattern) {
            this.datePattern = Objects.requireNonNull(pattern, "datePattern");
            return this;
        }

        public Builder includeSourceLocation(boolean include) {
            this.includeSourceLocation = include;
            return this;
        }

        public Builder colorWholeLine(boolean whole) {
            this.colorWholeLine = whole;
            return this;
        }

        /**
         * Validates the collected values and creates the snapshot.
         *
         * @return the immutable snapshot
         * @throws IllegalArgumentException if a value is out of range
         */
        public LogConfig build() {
            if (rotationThresholdBytes < 0) {
                throw new IllegalArgumentException("rotationThresholdBytes must be >= 0, got " + rotationThresholdBytes);
            }
            if (backupCount < 0) {
                throw new IllegalArgumentException("backupCount must be >= 0, got " + backupCount);
            }
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("queueCapacity must be >= 1, got " + queueCapacity);
            }
            if (flushEveryRecords < 1) {
                throw new IllegalArgumentException("flushEveryRecords must be >= 1, got " + flushEveryRecords);
            }
            if (lockTimeout.isNegative() || shutdownGrace.isNegative()) {
                throw new IllegalArgumentException("timeouts must not be negative");
            }
            if (baseFilename.isBlank() || baseFilename.contains("/") || baseFilename.contains("\\")) {
                throw new IllegalArgumentException("baseFilename must be a plain file name, got '" + baseFilename + "'");
            }
            return new LogConfig(this);
        }
    }
}
