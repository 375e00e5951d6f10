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

package io.stratalog.sinks;

import io.stratalog.LogConfig;
import io.stratalog.eventing.LogLevel;
import io.stratalog.eventing.LogRecord;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders a {@link LogRecord} into one line of text with a fixed field order:
 *
 * <pre>timestamp - file:line - pid - tid - logger - [LEVEL] - message</pre>
 *
 * <p>For example:
 * <pre>2024-03-01 14:32:15.123456 - Worker.java:42 - 81231 - 17 - app.worker - [INFO] - batch 7 done</pre>
 *
 * <p>When a record carries a throwable, its stack trace follows the message on the
 * subsequent lines of the same rendered text, so the whole record is still written in a
 * single append.
 *
 * <h2>Color</h2>
 * <p>With color enabled the level token is wrapped in the ANSI sequence of its
 * {@link LogLevel}; with whole-line coloring the entire line is wrapped instead. Whether
 * color is appropriate for a given stream is decided by the sink, not here.</p>
 *
 * <p>Instances are immutable and hold no shared state, so formatting is a pure function
 * of the record.
 *
 * @since 1.0.0
 */
public final class RecordFormatter {

    private static final String SEPARATOR = " - ";

    private final TimestampMode timestampMode;
    private final DateTimeFormatter dateFormatter;
    private final boolean includeSource;
    private final boolean colored;
    private final boolean colorWholeLine;

    public RecordFormatter(TimestampMode timestampMode,
                           String datePattern,
                           boolean includeSource,
                           boolean colored,
                           boolean colorWholeLine) {
        this.timestampMode = timestampMode;
        this.dateFormatter = DateTimeFormatter.ofPattern(datePattern).withZone(ZoneId.systemDefault());
        this.includeSource = includeSource;
        this.colored = colored;
        this.colorWholeLine = colorWholeLine;
    }

    /**
     * Creates a formatter using the presentation settings of a config snapshot.
     *
     * @param config the snapshot
     * @param colored whether ANSI color should be applied
     * @return the formatter
     */
    public static RecordFormatter fromConfig(LogConfig config, boolean colored) {
        return new RecordFormatter(config.getTimestampMode(), config.getDatePattern(),
            config.isIncludeSourceLocation(), colored, config.isColorWholeLine());
    }

    public boolean isColored() {
        return colored;
    }

    /**
     * @param record the record to render
     * @return the rendered text, without a trailing line separator
     */
    public String format(LogRecord record) {
        StringBuilder sb = new StringBuilder(128 + record.message.length());
        if (colored && colorWholeLine) {
            sb.append(record.level.getAnsiColor());
        }
        appendTimestamp(sb, record);
        sb.append(SEPARATOR);
        if (includeSource) {
            sb.append(record.source.fileName).append(':').append(record.source.lineNumber).append(SEPARATOR);
        }
        sb.append(record.processId).append(SEPARATOR);
        sb.append(record.threadId).append(SEPARATOR);
        sb.append(record.loggerName).append(SEPARATOR);
        sb.append('[');
        if (colored && !colorWholeLine) {
            sb.append(record.level.getAnsiColor()).append(record.level.name()).append(LogLevel.ANSI_RESET);
        } else {
            sb.append(record.level.name());
        }
        sb.append(']').append(SEPARATOR);
        sb.append(record.message);
        if (record.thrown != null) {
            sb.append(System.lineSeparator()).append(stackTraceOf(record.thrown));
        }
        if (colored && colorWholeLine) {
            sb.append(LogLevel.ANSI_RESET);
        }
        return sb.toString();
    }

    private void appendTimestamp(StringBuilder sb, LogRecord record) {
        if (timestampMode == TimestampMode.NUMERIC) {
            long micros = record.timestamp.getNano() / 1_000;
            sb.append(record.timestamp.getEpochSecond()).append('.');
            String fraction = Long.toString(micros);
            for (int i = fraction.length(); i < 6; i++) {
                sb.append('0');
            }
            sb.append(fraction);
        } else {
            dateFormatter.formatTo(record.timestamp, sb);
        }
    }

    private static String stackTraceOf(Throwable thrown) {
        StringWriter out = new StringWriter();
        try (PrintWriter pw = new PrintWriter(out)) {
            thrown.printStackTrace(pw);
        }
        String text = out.toString();
        // drop the trailing separator printStackTrace always adds
        return text.endsWith(System.lineSeparator())
            ? text.substring(0, text.length() - System.lineSeparator().length())
            : text;
    }
}
