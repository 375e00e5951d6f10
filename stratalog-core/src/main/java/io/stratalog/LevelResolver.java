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

package io.stratalog;

import io.stratalog.delivery.DeliveryQueue;
import io.stratalog.eventing.LogLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the effective threshold for a logger name from a default level and an
 * ordered list of {@code (prefix, level)} pairs. The longest prefix that matches on a
 * dotted-name boundary wins: {@code com.acme} covers {@code com.acme} and
 * {@code com.acme.db} but not {@code com.acmeway}. An empty prefix matches every name.
 *
 * <p>The library's own notice loggers ({@value DeliveryQueue#NOTICE_LOGGER} and
 * {@value #CONFIG_NOTICE_LOGGER}) never resolve above WARNING, so drop counts and
 * configuration fallbacks are written whatever the configured levels are.
 *
 * <p>Results are cached per name, for at most {@value #MAX_CACHED_NAMES} names; names
 * past that bound are resolved on every call. A resolver is bound to one
 * {@link LogConfig} snapshot and is safe for concurrent use.
 *
 * @since 1.0.0
 */
public final class LevelResolver {

    /** Logger carrying configuration fallback warnings. */
    public static final String CONFIG_NOTICE_LOGGER = "stratalog.config";

    static final int MAX_CACHED_NAMES = 4096;
    private static final Set<String> NOTICE_LOGGERS = Set.of(DeliveryQueue.NOTICE_LOGGER, CONFIG_NOTICE_LOGGER);

    private final LogLevel defaultLevel;
    private final List<Map.Entry<String, LogLevel>> overrides;
    private final ConcurrentHashMap<String, LogLevel> cache = new ConcurrentHashMap<>();

    public LevelResolver(LogLevel defaultLevel, Map<String, LogLevel> overrides) {
        this.defaultLevel = defaultLevel;
        List<Map.Entry<String, LogLevel>> ordered = new ArrayList<>(overrides.entrySet());
        ordered.sort(Comparator.comparingInt((Map.Entry<String, LogLevel> e) -> e.getKey().length()).reversed());
        this.overrides = List.copyOf(ordered);
    }

    public LevelResolver(LogConfig config) {
        this(config.getDefaultLevel(), config.getLevelOverrides());
    }

    /**
     * @param loggerName the dotted logger name
     * @return the threshold records from this logger must meet
     */
    public LogLevel resolve(String loggerName) {
        LogLevel cached = cache.get(loggerName);
        if (cached != null) {
            return cached;
        }
        if (cache.size() >= MAX_CACHED_NAMES) {
            return lookup(loggerName);
        }
        return cache.computeIfAbsent(loggerName, this::lookup);
    }

    /**
     * @param level a record level
     * @param loggerName the emitting logger
     * @return true if the record passes the logger's threshold
     */
    public boolean isEnabled(LogLevel level, String loggerName) {
        return level.isAtLeast(resolve(loggerName));
    }

    int cachedNames() {
        return cache.size();
    }

    private LogLevel lookup(String loggerName) {
        LogLevel level = defaultLevel;
        for (Map.Entry<String, LogLevel> override : overrides) {
            if (matches(override.getKey(), loggerName)) {
                level = override.getValue();
                break;
            }
        }
        if (NOTICE_LOGGERS.contains(loggerName) && !LogLevel.WARNING.isAtLeast(level)) {
            return LogLevel.WARNING;
        }
        return level;
    }

    static boolean matches(String prefix, String loggerName) {
        if (prefix.isEmpty()) {
            return true;
        }
        if (!loggerName.startsWith(prefix)) {
            return false;
        }
        return loggerName.length() == prefix.length() || loggerName.charAt(prefix.length()) == '.';
    }
}
