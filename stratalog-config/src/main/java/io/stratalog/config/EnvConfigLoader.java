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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Collects configuration values from environment variables, using the alias lists of
 * {@link ConfigKey}. Values stay strings; coercion happens during resolution. Blank
 * variables count as unset.
 *
 * @since 1.0.0
 */
public final class EnvConfigLoader {

    private final Function<String, String> environment;

    public EnvConfigLoader() {
        this(System::getenv);
    }

    /**
     * @param environment variable lookup, returning null for unset variables
     */
    public EnvConfigLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    public Map<String, Object> load() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ConfigKey key : ConfigKey.values()) {
            for (String variable : key.getEnvAliases()) {
                String value = environment.apply(variable);
                if (value != null && !value.isBlank()) {
                    values.put(key.getName(), value);
                    break;
                }
            }
        }
        return values;
    }

    /**
     * @return the configuration file named by {@value ConfigKey#CONFIG_FILE_ENV}, if set
     */
    public Optional<String> configFile() {
        String value = environment.apply(ConfigKey.CONFIG_FILE_ENV);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
