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

package io.stratalog.command;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_stratalogTest {

    @Test
    void listsSubcommands() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new CMD_stratalog());
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("loggen").contains("logcheck");
    }

    @Test
    void loggenHelpShowsLoggingOptions() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new CMD_stratalog());
        commandLine.setOut(new PrintWriter(out));

        commandLine.execute("help", "loggen");

        assertThat(out.toString()).contains("--threads").contains("--log-dir").contains("--no-color");
    }
}
