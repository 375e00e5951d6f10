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

import java.time.Instant;
import java.util.Objects;

/**
 * One structured log event. A record is created once per emit call on the producer's
 * thread, with its message already interpolated and its caller location already resolved.
 * It is never mutated afterwards.
 *
 * <p>Ownership:
 * <ul>
 *   <li><strong>Producer:</strong> creates the record and hands it to the delivery queue</li>
 *   <li><strong>Queue:</strong> owns it until the listener drains it</li>
 *   <li><strong>Listener / formatter:</strong> owns it transiently while rendering it to sinks</li>
 * </ul>
 *
 * <p>Identity fields ({@link #processId}, {@link #threadId}) are captured from the emitting
 * thread, so records drained by the listener still report who produced them.
 *
 * @see LogLevel
 * @see SourceLocation
 * @since 1.0.0
 */
public final class LogRecord {

    private static final long PROCESS_ID = ProcessHandle.current().pid();

    public final Instant timestamp;
    public final LogLevel level;
    public final String loggerName;
    public final String message;
    public final long processId;
    public final long threadId;
    public final String threadName;
    public final SourceLocation source;
    public final Throwable thrown;

    /**
     * Creates a record with explicit values for every field.
     *
     * @param timestamp the wall-clock instant of the emit call
     * @param level the record severity
     * @param loggerName the dotted logger name
     * @param message the fully rendered message
     * @param processId the OS process id of the producer
     * @param threadId the id of the producing thread
     * @param threadName the name of the producing thread
     * @param source the caller location, or null for {@link SourceLocation#UNKNOWN}
     * @param thrown an optional throwable whose stack trace belongs to this record
     */
    public LogRecord(Instant timestamp,
                     LogLevel level,
                     String loggerName,
                     String message,
                     long processId,
                     long threadId,
                     String threadName,
                     SourceLocation source,
                     Throwable thrown) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.level = Objects.requireNonNull(level, "level");
        this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
        this.message = message == null ? "null" : message;
        this.processId = processId;
        this.threadId = threadId;
        this.threadName = threadName == null ? "" : threadName;
        this.source = source == null ? SourceLocation.UNKNOWN : source;
        this.thrown = thrown;
    }

    /**
     * Creates a record stamped with the current time, process and thread.
     *
     * @param level the record severity
     * @param loggerName the dotted logger name
     * @param message the fully rendered message
     * @param source the caller location, or null
     * @param thrown an optional throwable
     * @return a new record
     */
    public static LogRecord now(LogLevel level, String loggerName, String message,
                                SourceLocation source, Throwable thrown) {
        Thread current = Thread.currentThread();
        return new LogRecord(Instant.now(), level, loggerName, message,
            PROCESS_ID, current.getId(), current.getName(), source, thrown);
    }

    /**
     * Returns the id of the current OS process.
     *
     * @return the process id
     */
    public static long currentProcessId() {
        return PROCESS_ID;
    }

    @Override
    public String toString() {
        return "LogRecord{" + level + " " + loggerName + ": " + message + "}";
    }
}
