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

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingOptionsTest {

    @Test
    void onlyGivenOptionsAreReported() {
        DummyCommand command = new DummyCommand();
        new CommandLine(command).parseArgs("--log-level", "warn", "--log-dir", "/tmp/logs");

        Map<String, Object> values = command.options.toValues();

        assertEquals(Map.of("default_level", "WARNING", "log_dir", Path.of("/tmp/logs").toString()), values);
        assertTrue(command.options.getConfigFile().isEmpty());
    }

    @Test
    void flagsMapToConfigurationKeys() {
        DummyCommand command = new DummyCommand();
        new CommandLine(command).parseArgs(
            "--no-colors", "--colored-file", "--exit-on-critical", "--disable-rotation",
            "--rotation-size", "2.5", "--backup-count", "3", "--log-filename", "svc.log");

        Map<String, Object> values = command.options.toValues();

        assertEquals(Boolean.FALSE, values.get("colored_console"));
        assertEquals(Boolean.TRUE, values.get("colored_file"));
        assertEquals(Boolean.TRUE, values.get("exit_on_critical"));
        assertEquals(Boolean.TRUE, values.get("disable_rotation"));
        assertEquals(2.5, values.get("rotation_size_mb"));
        assertEquals(3, values.get("backup_count"));
        assertEquals("svc.log", values.get("log_filename"));
    }

    @Test
    void configFileAliases() {
        for (String option : new String[] {"--log-config", "--log-conf", "--logging-config"}) {
            DummyCommand command = new DummyCommand();
            new CommandLine(command).parseArgs(option, "conf/logging.yaml");
            assertEquals(Path.of("conf/logging.yaml"), command.options.getConfigFile().orElseThrow(), option);
        }
    }

    @Test
    void unknownLevelIsAParameterError() {
        DummyCommand command = new DummyCommand();
        assertThrows(CommandLine.ParameterException.class,
            () -> new CommandLine(command).parseArgs("--log-level", "LOUD"));
    }

    private static final class DummyCommand implements Runnable {
        @CommandLine.Mixin
        final LoggingOptions options = new LoggingOptions();

        @Override
        public void run() {
        }
    }
}
