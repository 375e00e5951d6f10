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

import java.util.Map;

/**
 * Decides whether ANSI color may be written to the process console.
 *
 * <p>Detection Logic:
 * <ol>
 *   <li>If {@code NO_COLOR} is set to any value → no color</li>
 *   <li>If {@code TERM} is null or "dumb" → no color</li>
 *   <li>If {@code System.console()} is null (output piped or redirected) → no color</li>
 *   <li>Otherwise the console is an interactive terminal → color allowed</li>
 * </ol>
 *
 * @see ConsoleSink
 * @since 1.0.0
 */
public final class ConsoleColorSupport {

    private ConsoleColorSupport() {
    }

    /**
     * @return true if the process is attached to an interactive, color-capable terminal
     */
    public static boolean detect() {
        return detect(System.getenv(), System.console() != null);
    }

    static boolean detect(Map<String, String> env, boolean hasConsole) {
        if (env.containsKey("NO_COLOR")) {
            return false;
        }
        String term = env.get("TERM");
        if (term == null || term.equals("dumb")) {
            return false;
        }
        return hasConsole;
    }
}
