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

import io.stratalog.eventing.LogLevel;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Coerces the loosely typed values of files, environment variables and option strings to
 * the types {@link io.stratalog.LogConfig} needs. YAML hands over integers as
 * {@code Integer} or {@code Long}, JSON as {@code Double}, the environment as strings;
 * every form is accepted where it is unambiguous.
 */
final class ConfigValues {

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "y", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "n", "off");

    private ConfigValues() {
    }

    static boolean toBoolean(ConfigKey key, Object value) throws ConfigurationException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String word = text(value).trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(word)) {
            return true;
        }
        if (FALSE_WORDS.contains(word)) {
            return false;
        }
        throw invalid(key, value, "a boolean (true/false, yes/no, on/off, 1/0)");
    }

    static long toLong(ConfigKey key, Object value, long min) throws ConfigurationException {
        long result;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw invalid(key, value, "a whole number");
            }
            result = ((Number) value).longValue();
        } else {
            try {
                result = Long.parseLong(text(value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key.getName(), "'" + value + "' is not a whole number", e);
            }
        }
        if (result < min) {
            throw invalid(key, value, "a number >= " + min);
        }
        return result;
    }

    static int toInt(ConfigKey key, Object value, int min) throws ConfigurationException {
        long result = toLong(key, value, min);
        if (result > Integer.MAX_VALUE) {
            throw invalid(key, value, "a number <= " + Integer.MAX_VALUE);
        }
        return (int) result;
    }

    static double toDouble(ConfigKey key, Object value, double min) throws ConfigurationException {
        double result;
        if (value instanceof Number) {
            result = ((Number) value).doubleValue();
        } else {
            try {
                result = Double.parseDouble(text(value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key.getName(), "'" + value + "' is not a number", e);
            }
        }
        if (Double.isNaN(result) || Double.isInfinite(result) || result < min) {
            throw invalid(key, value, "a number >= " + min);
        }
        return result;
    }

    static LogLevel toLevel(ConfigKey key, Object value) throws ConfigurationException {
        try {
            return LogLevel.parse(text(value));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key.getName(), e.getMessage(), e);
        }
    }

    static String toText(ConfigKey key, Object value) throws ConfigurationException {
        if (value instanceof Map || value instanceof Iterable) {
            throw invalid(key, value, "a single value");
        }
        String result = text(value);
        if (result.isBlank()) {
            throw invalid(key, value, "a non-empty value");
        }
        return result;
    }

    /**
     * Reads a map of logger name to level. Entries with a bad level are skipped and
     * reported together after the good ones are kept.
     */
    static Map<String, LogLevel> toLevelMap(ConfigKey key, Object value, Map<String, LogLevel> into)
        throws ConfigurationException {
        if (!(value instanceof Map)) {
            throw invalid(key, value, "a mapping of logger name to level");
        }
        StringBuilder rejected = new StringBuilder();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            String prefix = String.valueOf(entry.getKey());
            try {
                into.put(prefix, LogLevel.parse(text(entry.getValue())));
            } catch (IllegalArgumentException e) {
                rejected.append(rejected.length() == 0 ? "" : ", ").append(prefix).append('=').append(entry.getValue());
            }
        }
        if (rejected.length() > 0) {
            throw new ConfigurationException(key.getName(), "ignored entries with unknown levels: " + rejected, null);
        }
        return into;
    }

    static Map<String, LogLevel> toLevelMap(ConfigKey key, Object value) throws ConfigurationException {
        return toLevelMap(key, value, new LinkedHashMap<>());
    }

    private static String text(Object value) {
        if (value instanceof Double && ((Double) value) == Math.rint((Double) value)) {
            return Long.toString(((Double) value).longValue());
        }
        return String.valueOf(value);
    }

    private static ConfigurationException invalid(ConfigKey key, Object value, String expected) {
        return new ConfigurationException(key.getName(), "'" + value + "' is not " + expected, null);
    }
}
