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

import io.stratalog.sinks.ConsoleSink;
import io.stratalog.sinks.RotatingFileSink;
import io.stratalog.sinks.SinkWriteException;

/**
 * The capability every destination of formatted records provides: render a record,
 * write the rendered line, flush, and close. The listener depends on this contract only
 * and never on the identity of a concrete sink.
 *
 * <h2>Call Discipline</h2>
 * <p>All methods are invoked from the single listener thread that owns the sink, so
 * implementations need no locking on the write path. The only exception is
 * {@link #close()}, which may also be called by the thread performing shutdown after the
 * listener has stopped.</p>
 *
 * <h2>Error Handling</h2>
 * <p>{@link #write(String)} and {@link #flush()} report destination failures with
 * {@link SinkWriteException}. The listener catches it, counts it, writes a fallback
 * notice to stderr, and keeps draining. A failure in one sink never prevents delivery
 * to another.</p>
 *
 * <h2>Built-in Implementations</h2>
 * <ul>
 *   <li>{@link RotatingFileSink} - size-rotated file with cross-process rotation lock</li>
 *   <li>{@link ConsoleSink} - optionally colorized stdout / stderr</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface LogSink extends AutoCloseable {

    /**
     * @return a short name used in fault reports
     */
    String name();

    /**
     * Renders a record into a single line of text without the trailing separator.
     * Each sink chooses its own presentation, for example colored or plain.
     *
     * @param record the record to render
     * @return the rendered line
     */
    String format(LogRecord record);

    /**
     * Writes one rendered line followed by the record separator. The line is written
     * whole or not at all.
     *
     * @param formattedLine the line produced by {@link #format(LogRecord)}
     * @throws SinkWriteException if the destination rejects the write
     */
    void write(String formattedLine) throws SinkWriteException;

    /**
     * Pushes any buffered lines to the destination.
     *
     * @throws SinkWriteException if the destination rejects the flush
     */
    void flush() throws SinkWriteException;

    /**
     * Flushes and releases the destination. Idempotent; never throws.
     */
    @Override
    void close();
}
