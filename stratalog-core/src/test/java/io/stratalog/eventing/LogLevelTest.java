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


package io.stratalog.eventing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

    @Test
    void levelsAreOrdered() {
        assertTrue(LogLevel.CRITICAL.isAtLeast(LogLevel.ERROR));
        assertTrue(LogLevel.ERROR.isAtLeast(LogLevel.WARNING));
        assertTrue(LogLevel.WARNING.isAtLeast(LogLevel.INFO));
        assertTrue(LogLevel.INFO.isAtLeast(LogLevel.DEBUG));
        assertTrue(LogLevel.INFO.isAtLeast(LogLevel.INFO));
        assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFO));
    }

    @ParameterizedTest
    @ValueSource(strings = {"warn", "WARN", "warning", " Warning "})
    void warnAliasesParse(String name) {
        assertEquals(LogLevel.WARNING, LogLevel.parse(name));
    }

    @Test
    void unknownNamesAreRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("verbose"));
        assertTrue(e.getMessage().contains("verbose"));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.parse(null));
    }
}
