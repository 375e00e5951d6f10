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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * The ordered files {@code base}, {@code base.1} ... {@code base.N} of one log file, where a
 * higher index is older.
 *
 * <p>{@link #shift()} must only be called while the file's {@link RotationLock} is held and
 * the caller's own handle on the active file is closed.
 *
 * @since 1.0.0
 */
public final class BackupChain {

    private static final Logger logger = LogManager.getLogger(BackupChain.class);

    private final Path activeFile;
    private final int backupCount;

    public BackupChain(Path activeFile, int backupCount) {
        if (backupCount < 0) {
            throw new IllegalArgumentException("backupCount must be >= 0, got " + backupCount);
        }
        this.activeFile = activeFile;
        this.backupCount = backupCount;
    }

    public Path getActiveFile() {
        return activeFile;
    }

    public int getBackupCount() {
        return backupCount;
    }

    /**
     * @param index backup index, starting at 1
     * @return the path of {@code base.index}
     */
    public Path backup(int index) {
        if (index < 1) {
            throw new IllegalArgumentException("backup index starts at 1, got " + index);
        }
        return activeFile.resolveSibling(activeFile.getFileName() + "." + index);
    }

    /**
     * Moves every file one index up, discarding the file at index N, then moves the active
     * file to index 1. With a backup count of zero the active file is deleted instead.
     * Backups left above N by an earlier, larger backup count are removed.
     *
     * @throws IOException if a rename or delete fails; the chain may then be partially shifted
     */
    public void shift() throws IOException {
        if (backupCount == 0) {
            Files.deleteIfExists(activeFile);
        } else {
            Files.deleteIfExists(backup(backupCount));
            for (int index = backupCount - 1; index >= 1; index--) {
                Path source = backup(index);
                if (Files.exists(source)) {
                    Files.move(source, backup(index + 1), StandardCopyOption.REPLACE_EXISTING);
                }
            }
            if (Files.exists(activeFile)) {
                Files.move(activeFile, backup(1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        pruneBeyond(backupCount);
    }

    private void pruneBeyond(int keep) throws IOException {
        int index = keep + 1;
        while (Files.deleteIfExists(backup(index))) {
            logger.debug("Removed stale backup {}", backup(index));
            index++;
        }
    }

    /**
     * @return the existing backups in index order, stopping at the first gap
     */
    public List<Path> existingBackups() {
        List<Path> found = new ArrayList<>();
        for (int index = 1; index <= backupCount; index++) {
            Path candidate = backup(index);
            if (!Files.exists(candidate)) {
                break;
            }
            found.add(candidate);
        }
        return found;
    }

    @Override
    public String toString() {
        return "BackupChain[" + activeFile + ", backups=" + backupCount + "]";
    }
}
