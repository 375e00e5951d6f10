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

import java.util.Locale;

/**
 * How {@link RecordFormatter} renders the record timestamp. This is a presentation choice
 * only; it has no effect on ordering or locking.
 *
 * <ul>
 *   <li><strong>HUMAN:</strong> local date and time using the configured pattern, the
 *       readable default</li>
 *   <li><strong>NUMERIC:</strong> epoch seconds with six decimals, cheaper to render
 *       and trivially sortable</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum TimestampMode {
    HUMAN("human"),
    NUMERIC("numeric");

    private final String name;

    TimestampMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Parses a mode name case-insensitively.
     *
     * @param value the name to parse
     * @return the mode
     * @throws IllegalArgumentException if the value names no mode
     */
    public static TimestampMode fromString(String value) {
        if (value != null) {
            String lower = value.trim().toLowerCase(Locale.ROOT);
            for (TimestampMode mode : values()) {
                if (mode.name.equals(lower)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown timestamp mode '" + value + "', expected human or numeric");
    }
}
