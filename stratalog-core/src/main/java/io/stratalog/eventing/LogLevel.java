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

package io.stratalog.eventing;

import java.util.Locale;

/**
 * Severity of a {@link LogRecord}. Levels are totally ordered by their numeric value:
 * {@code DEBUG < INFO < WARNING < ERROR < CRITICAL}.
 *
 * <p>Filtering Rule:
 * A record at level {@code L} passes a threshold {@code T} iff {@code L.isAtLeast(T)}.
 * Thresholds are resolved per logger name by {@code io.stratalog.LevelResolver}.
 *
 * <p>Console Presentation:
 * Each level carries the ANSI escape sequence used when colored output is enabled.
 * The sequence is applied to the level token only, unless whole-line coloring is configured.
 *
 * @see LogRecord
 * @since 1.0.0
 */
public enum LogLevel {
    /**
     * Detailed diagnostic output, normally disabled in production.
     */
    DEBUG(10, "\u001b[94m"),

    /**
     * Routine operational messages.
     */
    INFO(20, "\u001b[92m"),

    /**
     * Something unexpected happened but processing continues.
     */
    WARNING(30, "\u001b[93m"),

    /**
     * An operation failed.
     */
    ERROR(40, "\u001b[91m"),

    /**
     * The application cannot continue safely. May terminate the process when
     * exit-on-critical is configured.
     */
    CRITICAL(50, "\u001b[91m\u001b[1m");

    /**
     * ANSI sequence that restores the default terminal rendition.
     */
    public static final String ANSI_RESET = "\u001b[0m";

    private final int severity;
    private final String ansiColor;

    LogLevel(int severity, String ansiColor) {
        this.severity = severity;
        this.ansiColor = ansiColor;
    }

    /**
     * Returns the numeric severity. Higher values are more severe.
     *
     * @return the severity value
     */
    public int getSeverity() {
        return severity;
    }

    /**
     * Returns the ANSI escape sequence used to colorize this level.
     *
     * @return the escape sequence, never null
     */
    public String getAnsiColor() {
        return ansiColor;
    }

    /**
     * Returns true if this level is at least as severe as the given threshold.
     *
     * @param threshold the minimum level
     * @return true if a record at this level passes the threshold
     */
    public boolean isAtLeast(LogLevel threshold) {
        return severity >= threshold.severity;
    }

    /**
     * Parses a level name case-insensitively. {@code WARN} is accepted as an alias
     * for {@link #WARNING}.
     *
     * @param value the level name
     * @return the matching level
     * @throws IllegalArgumentException if the value is null or names no level
     */
    public static LogLevel parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("log level must not be null");
        }
        String upper = value.trim().toUpperCase(Locale.ROOT);
        if (upper.equals("WARN")) {
            return WARNING;
        }
        try {
            return LogLevel.valueOf(upper);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level '" + value
                + "', expected one of DEBUG, INFO, WARNING, ERROR, CRITICAL", e);
        }
    }
}
