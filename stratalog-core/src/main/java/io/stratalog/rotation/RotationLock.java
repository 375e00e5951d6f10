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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Mutual exclusion for the check-size / rotate / reopen critical section of one log file.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #acquire(Duration)} blocks for at most the given timeout and either
 *       returns a {@link Held} handle or throws {@link LockTimeoutException}</li>
 *   <li>The holder releases by closing the handle, normally with try-with-resources, so
 *       release happens on every exit path</li>
 *   <li>{@link Held#close()} is idempotent and never throws</li>
 *   <li>The lock is held only around stat, rename chain and reopen, never across a
 *       line write</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link FileChannelRotationLock} - advisory OS lock on a sentinel file next to the
 *       log file, shared by every process that logs to the same path</li>
 *   <li>{@link InProcessRotationLock} - JVM-local lock, for deployments where a single
 *       process owns the file</li>
 * </ul>
 *
 * <pre>{@code
 * RotationLock lock = RotationLock.forLogFile(logFile, true);
 * try (RotationLock.Held held = lock.acquire(Duration.ofSeconds(5))) {
 *     // re-stat, shift backups, reopen
 * } catch (LockTimeoutException e) {
 *     // skip rotation this time
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public interface RotationLock {

    /**
     * Waits up to {@code timeout} for exclusive ownership.
     *
     * @param timeout the bounded wait
     * @return the held lock, to be closed by the caller
     * @throws LockTimeoutException if ownership was not obtained in time
     * @throws IOException if the lock resource cannot be opened
     */
    Held acquire(Duration timeout) throws LockTimeoutException, IOException;

    /**
     * @return a description of what is being locked, used in diagnostics
     */
    String describe();

    /**
     * Creates the lock implementation appropriate for a log file.
     *
     * @param logFile the active log file
     * @param crossProcess true to coordinate with other OS processes
     * @return the lock
     */
    static RotationLock forLogFile(Path logFile, boolean crossProcess) {
        return crossProcess ? new FileChannelRotationLock(logFile) : new InProcessRotationLock(logFile);
    }

    /**
     * Ownership of a {@link RotationLock}. Closing it releases the lock.
     */
    interface Held extends AutoCloseable {
        @Override
        void close();
    }
}
