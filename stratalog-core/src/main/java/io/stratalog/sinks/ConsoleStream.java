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

import java.io.PrintStream;
import java.util.Locale;

/**
 * Standard stream targeted by {@link ConsoleSink}.
 *
 * @since 1.0.0
 */
public enum ConsoleStream {
    STDOUT,
    STDERR;

    /**
     * Resolves the live process stream. Resolved at sink creation so that
     * {@link System#setOut(PrintStream)} redirections made earlier are honored.
     *
     * @return the stream
     */
    public PrintStream resolve() {
        return this == STDOUT ? System.out : System.err;
    }

    public static ConsoleStream fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("console stream must not be null");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "stdout":
            case "out":
                return STDOUT;
            case "stderr":
            case "err":
                return STDERR;
            default:
                throw new IllegalArgumentException("Unknown console stream '" + value + "', expected stdout or stderr");
        }
    }
}
