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
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigFileLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsYamlWithNestedLevels() throws Exception {
        Path file = tempDir.resolve("logging.yaml");
        Files.writeString(file, String.join("\n",
            "log_dir: /var/log/app",
            "rotation_size_mb: 5",
            "colored_console: false",
            "module_levels:",
            "  io.netty: WARNING",
            ""));

        Map<String, Object> values = ConfigFileLoader.load(file);

        assertEquals("/var/log/app", values.get("log_dir"));
        assertEquals(5, ((Number) values.get("rotation_size_mb")).intValue());
        assertEquals(Boolean.FALSE, values.get("colored_console"));
        assertEquals(Map.of("io.netty", "WARNING"), values.get("module_levels"));
    }

    @Test
    void loadsJson() throws Exception {
        Path file = tempDir.resolve("logging.json");
        Files.writeString(file, "{\"backup_count\": 3, \"default_level\": \"debug\"}");

        Map<String, Object> values = ConfigFileLoader.load(file);

        assertEquals(3.0, values.get("backup_count"));
        assertEquals("debug", values.get("default_level"));
    }

    @Test
    void ymlExtensionIsYaml() throws Exception {
        Path file = tempDir.resolve("logging.yml");
        Files.writeString(file, "backup_count: 2\n");
        assertEquals(2, ((Number) ConfigFileLoader.load(file).get("backup_count")).intValue());
    }

    @Test
    void emptyFileYieldsNoValues() throws Exception {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");
        assertTrue(ConfigFileLoader.load(file).isEmpty());
    }

    @Test
    void missingFileIsAConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> ConfigFileLoader.load(tempDir.resolve("absent.yaml")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void rejectsMalformedAndUnsupportedFiles() throws Exception {
        Path badYaml = tempDir.resolve("bad.yaml");
        Files.writeString(badYaml, "log_dir: [unclosed\n");
        Path badJson = tempDir.resolve("bad.json");
        Files.writeString(badJson, "{\"log_dir\": ");
        Path list = tempDir.resolve("list.yaml");
        Files.writeString(list, "- a\n- b\n");
        Path toml = tempDir.resolve("logging.toml");
        Files.writeString(toml, "log_dir = 'x'\n");

        for (Path file : List.of(badYaml, badJson, list, toml)) {
            assertThrows(ConfigurationException.class, () -> ConfigFileLoader.load(file), file.toString());
        }
    }
}
