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
import io.stratalog.eventing.SourceLocation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class RecordFormatterTest {

    private static final Instant TIMESTAMP = LocalDateTime.of(2024, 3, 1, 14, 32, 15, 123_456_000)
        .atZone(ZoneId.systemDefault()).toInstant();

    private static LogRecord record(LogLevel level, Throwable thrown) {
        return new LogRecord(TIMESTAMP, level, "app.worker", "batch 7 done", 4242, 17, "worker-1",
            new SourceLocation("Worker.java", 42, "app.Worker", "run"), thrown);
    }

    @Test
    void rendersFieldsInFixedOrder() {
        RecordFormatter formatter = RecordFormatter.fromConfig(LogConfig.defaults(), false);
        assertThat(formatter.format(record(LogLevel.INFO, null)))
            .isEqualTo("2024-03-01 14:32:15.123456 - Worker.java:42 - 4242 - 17 - app.worker - [INFO] - batch 7 done");
    }

    @Test
    void sourceLocationCanBeOmitted() {
        RecordFormatter formatter = new RecordFormatter(TimestampMode.HUMAN, LogConfig.DEFAULT_DATE_PATTERN,
            false, false, false);
        assertThat(formatter.format(record(LogLevel.INFO, null)))
            .isEqualTo("2024-03-01 14:32:15.123456 - 4242 - 17 - app.worker - [INFO] - batch 7 done");
    }

    @Test
    void numericTimestampsUseEpochSecondsWithMicros() {
        RecordFormatter formatter = new RecordFormatter(TimestampMode.NUMERIC, LogConfig.DEFAULT_DATE_PATTERN,
            false, false, false);
        LogRecord record = new LogRecord(Instant.ofEpochSecond(1_700_000_000L, 5_000), LogLevel.DEBUG, "n", "m",
            1, 2, "t", null, null);
        assertThat(formatter.format(record)).startsWith("1700000000.000005 - 1 - 2 - n - [DEBUG] - m");
    }

    @Test
    void colorWrapsOnlyTheLevelToken() {
        RecordFormatter formatter = RecordFormatter.fromConfig(LogConfig.defaults(), true);
        String line = formatter.format(record(LogLevel.WARNING, null));
        assertThat(line).contains("[" + LogLevel.WARNING.getAnsiColor() + "WARNING" + LogLevel.ANSI_RESET + "]");
        assertThat(line).startsWith("2024-03-01");
        assertThat(line).endsWith("batch 7 done");
    }

    @Test
    void wholeLineColoring() {
        RecordFormatter formatter = new RecordFormatter(TimestampMode.HUMAN, LogConfig.DEFAULT_DATE_PATTERN,
            true, true, true);
        String line = formatter.format(record(LogLevel.CRITICAL, null));
        assertThat(line).startsWith(LogLevel.CRITICAL.getAnsiColor());
        assertThat(line).endsWith(LogLevel.ANSI_RESET);
        assertThat(line).contains("[CRITICAL]");
    }

    @Test
    void plainFormatterNeverEmitsEscapes() {
        RecordFormatter formatter = RecordFormatter.fromConfig(LogConfig.defaults(), false);
        for (LogLevel level : LogLevel.values()) {
            assertThat(formatter.format(record(level, null))).doesNotContain("\u001b[");
        }
    }

    @Test
    void stackTraceFollowsMessageInSameRecord() {
        RecordFormatter formatter = RecordFormatter.fromConfig(LogConfig.defaults(), false);
        String text = formatter.format(record(LogLevel.ERROR, new IllegalStateException("boom")));
        String[] lines = text.split(System.lineSeparator());
        assertThat(lines[0]).endsWith("[ERROR] - batch 7 done");
        assertThat(lines[1]).isEqualTo("java.lang.IllegalStateException: boom");
        assertThat(text).doesNotEndWith(System.lineSeparator());
    }
}
