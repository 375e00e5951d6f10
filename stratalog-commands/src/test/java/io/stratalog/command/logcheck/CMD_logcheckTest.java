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

package io.stratalog.command.logcheck;

import io.stratalog.LogConfig;
import io.stratalog.command.loggen.LoadMessage;
import io.stratalog.eventing.LogLevel;
import io.stratalog.eventing.LogRecord;
import io.stratalog.sinks.RecordFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CMD_logcheckTest {

    @TempDir
    Path tempDir;

    private Path writeChain(int records, boolean corrupt) throws Exception {
        RecordFormatter formatter = RecordFormatter.fromConfig(LogConfig.defaults(), false);
        List<String> lines = new ArrayList<>();
        for (int seq = 0; seq < records; seq++) {
            lines.add(formatter.format(LogRecord.now(LogLevel.INFO, "loggen",
                LoadMessage.render("x", 0, seq, 10), null, null)));
        }
        if (corrupt) {
            lines.add("half a line");
        }
        Path file = tempDir.resolve("app.log");
        Files.write(file, lines);
        return file;
    }

    private int run(StringWriter out, String... args) {
        CommandLine commandLine = new CommandLine(new CMD_logcheck());
        commandLine.setOut(new PrintWriter(out));
        return commandLine.execute(args);
    }

    @Test
    void intactChainPasses() throws Exception {
        Path file = writeChain(12, false);
        StringWriter out = new StringWriter();

        assertEquals(0, run(out, file.toString(), "--expect", "12"));
        assertTrue(out.toString().contains("loggen records: 12"), out.toString());
        assertTrue(out.toString().contains("tag x: 12"), out.toString());
    }

    @Test
    void corruptLineFails() throws Exception {
        Path file = writeChain(3, true);
        StringWriter out = new StringWriter();

        assertEquals(1, run(out, file.toString()));
        assertTrue(out.toString().contains("corrupt lines: 1"), out.toString());
    }

    @Test
    void countMismatchFails() throws Exception {
        Path file = writeChain(5, false);

        assertEquals(2, run(new StringWriter(), file.toString(), "-e", "6"));
    }
}
