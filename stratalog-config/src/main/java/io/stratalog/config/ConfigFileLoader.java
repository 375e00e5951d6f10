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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a configuration file into a map of top-level keys to raw values. The format is
 * chosen by extension: {@code .yaml} and {@code .yml} through snakeyaml-engine,
 * {@code .json} through Gson. An empty file yields an empty map.
 *
 * @since 1.0.0
 */
public final class ConfigFileLoader {

    private static final Logger logger = LogManager.getLogger(ConfigFileLoader.class);

    private static final Gson gson = new GsonBuilder().create();
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();
    private static final LoadSettings loadSettings = LoadSettings.builder().setLabel("stratalog-config").build();

    private ConfigFileLoader() {
    }

    /**
     * @param file a {@code .yaml}, {@code .yml} or {@code .json} file
     * @return the top-level entries, in file order
     * @throws ConfigurationException if the file is missing, unreadable, malformed, of an
     *     unknown format, or its top level is not a mapping
     */
    public static Map<String, Object> load(Path file) throws ConfigurationException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        Object parsed;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                parsed = new Load(loadSettings).loadFromReader(reader);
            } else if (name.endsWith(".json")) {
                parsed = gson.fromJson(reader, MAP_TYPE);
            } else {
                throw new ConfigurationException("unsupported configuration file format: " + file
                    + " (expected .yaml, .yml or .json)");
            }
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("configuration file not found: " + file, e);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read configuration file " + file + ": " + e.getMessage(), e);
        } catch (YamlEngineException | JsonParseException e) {
            throw new ConfigurationException("malformed configuration file " + file + ": " + e.getMessage(), e);
        }
        if (parsed == null) {
            logger.debug("Configuration file {} is empty", file);
            return new LinkedHashMap<>();
        }
        if (!(parsed instanceof Map)) {
            throw new ConfigurationException("configuration file " + file + " must contain a mapping at the top level");
        }
        Map<String, Object> entries = new LinkedHashMap<>();
        ((Map<?, ?>) parsed).forEach((k, v) -> entries.put(String.valueOf(k), v));
        logger.debug("Loaded {} keys from {}", entries.size(), file);
        return entries;
    }
}
