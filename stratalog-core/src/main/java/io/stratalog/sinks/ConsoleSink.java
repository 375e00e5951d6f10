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
import io.stratalog.eventing.LogRecord;
import io.stratalog.eventing.LogSink;

import java.io.PrintStream;

/**
 * Writes formatted records to a {@link PrintStream}, normally the process stdout or
 * stderr. Independent of file rotation state.
 *
 * <p>Color is applied only when requested by configuration and when
 * {@link ConsoleColorSupport#detect()} reports an interactive terminal, so redirected
 * output never receives escape sequences.
 *
 * <p>The sink does not own the stream: {@link #close()} flushes it but never closes it.
 *
 * <h2>Usage Examples:</h2>
 * <pre>{@code
 * // Sink for a resolved config snapshot
 * ConsoleSink console = ConsoleSink.fromConfig(config);
 *
 * // Capture output in tests
 * ByteArrayOutputStream buffer = new ByteArrayOutputStream();
 * ConsoleSink captured = new ConsoleSink(new PrintStream(buffer, true),
 *     RecordFormatter.fromConfig(config, false));
 * }</pre>
 *
 * @see RecordFormatter
 * @since 1.0.0
 */
public class ConsoleSink implements LogSink {

    private final PrintStream output;
    private final RecordFormatter formatter;

    public ConsoleSink(PrintStream output, RecordFormatter formatter) {
        this.output = output;
        this.formatter = formatter;
    }

    /**
     * Creates a sink on the configured standard stream with automatic color detection.
     *
     * @param config the snapshot
     * @return the console sink
     */
    public static ConsoleSink fromConfig(LogConfig config) {
        boolean colored = config.isColoredConsole() && ConsoleColorSupport.detect();
        return new ConsoleSink(config.getConsoleStream().resolve(), RecordFormatter.fromConfig(config, colored));
    }

    @Override
    public String name() {
        return "console";
    }

    @Override
    public String format(LogRecord record) {
        return formatter.format(record);
    }

    @Override
    public void write(String formattedLine) throws SinkWriteException {
        output.println(formattedLine);
        if (output.checkError()) {
            throw new SinkWriteException(name(), "console stream reported an error");
        }
    }

    @Override
    public void flush() throws SinkWriteException {
        output.flush();
        if (output.checkError()) {
            throw new SinkWriteException(name(), "console stream reported an error on flush");
        }
    }

    @Override
    public void close() {
        output.flush();
    }
}
