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

/**
 * A configuration source could not be read, or one of its values has the wrong type or
 * range. {@link ConfigResolver} never lets this escape: the affected value falls back to
 * the next lower layer and the message becomes a resolution warning.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends Exception {

    private final String key;

    public ConfigurationException(String message) {
        this(null, message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(key == null ? message : key + ": " + message, cause);
        this.key = key;
    }

    /**
     * @return the configuration key the problem concerns, or null for a whole source
     */
    public String getKey() {
        return key;
    }
}
