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


package io.stratalog.rotation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BackupChainTest {

    @TempDir
    Path dir;

    private static void write(Path file, String content) throws IOException {
        Files.writeString(file, content);
    }

    @Test
    void shiftMovesEveryFileUpOneIndex() throws IOException {
        Path active = dir.resolve("app.log");
        BackupChain chain = new BackupChain(active, 3);
        write(active, "current");
        write(chain.backup(1), "one");
        write(chain.backup(2), "two");

        chain.shift();

        assertFalse(Files.exists(active));
        assertEquals("current", Files.readString(chain.backup(1)));
        assertEquals("one", Files.readString(chain.backup(2)));
        assertEquals("two", Files.readString(chain.backup(3)));
    }

    @Test
    void oldestBackupIsDiscarded() throws IOException {
        Path active = dir.resolve("app.log");
        BackupChain chain = new BackupChain(active, 2);
        write(active, "current");
        write(chain.backup(1), "one");
        write(chain.backup(2), "two");

        chain.shift();

        assertEquals("current", Files.readString(chain.backup(1)));
        assertEquals("one", Files.readString(chain.backup(2)));
        assertFalse(Files.exists(chain.backup(3)));
        assertEquals(2, chain.existingBackups().size());
    }

    @Test
    void zeroBackupsDeletesActiveFile() throws IOException {
        Path active = dir.resolve("app.log");
        BackupChain chain = new BackupChain(active, 0);
        write(active, "current");

        chain.shift();

        assertFalse(Files.exists(active));
        assertFalse(Files.exists(chain.backup(1)));
    }

    @Test
    void staleBackupsAboveCountArePruned() throws IOException {
        Path active = dir.resolve("app.log");
        BackupChain wide = new BackupChain(active, 5);
        write(active, "current");
        for (int i = 1; i <= 5; i++) {
            write(wide.backup(i), "old" + i);
        }

        new BackupChain(active, 2).shift();

        assertTrue(Files.exists(wide.backup(1)));
        assertTrue(Files.exists(wide.backup(2)));
        for (int i = 3; i <= 5; i++) {
            assertFalse(Files.exists(wide.backup(i)), "backup " + i + " should be removed");
        }
    }

    @Test
    void gapsInTheChainAreTolerated() throws IOException {
        Path active = dir.resolve("app.log");
        BackupChain chain = new BackupChain(active, 3);
        write(active, "current");
        write(chain.backup(2), "two");

        chain.shift();

        assertEquals("current", Files.readString(chain.backup(1)));
        assertFalse(Files.exists(chain.backup(2)));
        assertEquals("two", Files.readString(chain.backup(3)));
    }

    @Test
    void negativeCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BackupChain(dir.resolve("x.log"), -1));
    }
}
