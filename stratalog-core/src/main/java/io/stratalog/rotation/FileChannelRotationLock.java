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
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cross-process rotation lock backed by an advisory {@link FileLock} on a sentinel file
 * named {@code <logfile>.lock}. The sentinel never receives log content.
 *
 * <p>Acquisition Sequence:
 * <ol>
 *   <li>Take the JVM-local {@link InProcessRotationLock} for the same path, since
 *       {@link FileLock}s are held per process and cannot exclude threads of one JVM</li>
 *   <li>Open the sentinel and poll {@link FileChannel#tryLock()} with a short backoff
 *       until it succeeds or the deadline passes</li>
 * </ol>
 *
 * <p>Release runs in reverse order; each step is attempted even if an earlier one fails.
 * Release failures are logged and never propagated.
 *
 * @since 1.0.0
 */
public final class FileChannelRotationLock implements RotationLock {

    private static final Logger logger = LogManager.getLogger(FileChannelRotationLock.class);
    private static final long MIN_BACKOFF_MILLIS = 2;
    private static final long MAX_BACKOFF_MILLIS = 50;

    private final Path sentinel;
    private final InProcessRotationLock localLock;

    public FileChannelRotationLock(Path logFile) {
        Path absolute = logFile.toAbsolutePath().normalize();
        this.sentinel = absolute.resolveSibling(absolute.getFileName() + ".lock");
        this.localLock = new InProcessRotationLock(absolute);
    }

    /**
     * @return the sentinel file path
     */
    public Path getSentinel() {
        return sentinel;
    }

    @Override
    public Held acquire(Duration timeout) throws LockTimeoutException, IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Held local = localLock.acquire(timeout);
        FileChannel channel = null;
        try {
            Files.createDirectories(sentinel.getParent());
            channel = FileChannel.open(sentinel, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = pollForLock(channel, deadline, timeout);
            return new FileHeld(local, channel, fileLock);
        } catch (LockTimeoutException | IOException | RuntimeException e) {
            closeQuietly(channel);
            local.close();
            throw e;
        }
    }

    private FileLock pollForLock(FileChannel channel, long deadline, Duration timeout)
        throws IOException, LockTimeoutException {
        long backoff = MIN_BACKOFF_MILLIS;
        while (true) {
            FileLock fileLock;
            try {
                fileLock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                // another channel in this JVM holds it under a different path spelling
                fileLock = null;
            }
            if (fileLock != null) {
                return fileLock;
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                throw new LockTimeoutException(describe(), timeout);
            }
            try {
                TimeUnit.MILLISECONDS.sleep(Math.min(backoff, TimeUnit.NANOSECONDS.toMillis(remainingNanos) + 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(describe(), timeout, e);
            }
            backoff = Math.min(backoff * 2, MAX_BACKOFF_MILLIS);
        }
    }

    @Override
    public String describe() {
        return sentinel.toString();
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Error closing rotation lock channel: {}", e.getMessage(), e);
        }
    }

    private static final class FileHeld implements Held {
        private final Held local;
        private final FileChannel channel;
        private final FileLock fileLock;
        private final AtomicBoolean released = new AtomicBoolean(false);

        FileHeld(Held local, FileChannel channel, FileLock fileLock) {
            this.local = local;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                fileLock.release();
            } catch (IOException e) {
                logger.warn("Error releasing rotation file lock: {}", e.getMessage(), e);
            } finally {
                try {
                    closeQuietly(channel);
                } finally {
                    local.close();
                }
            }
        }
    }
}
