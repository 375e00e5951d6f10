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

import io.stratalog.LogConfig;
import io.stratalog.delivery.DeliveryStats;
import io.stratalog.eventing.LogRecord;
import io.stratalog.eventing.LogSink;
import io.stratalog.rotation.BackupChain;
import io.stratalog.rotation.LockTimeoutException;
import io.stratalog.rotation.RotationLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;

/**
 * Appends formatted lines to one log file and rotates it by size.
 *
 * <h2>Write Sequence</h2>
 * <ol>
 *   <li>Open the file for append if no handle is held (after a fault or a rotation)</li>
 *   <li>In multi-process mode, stat the file: if it was replaced underneath us (another
 *       process rotated it) reopen, otherwise adopt the on-disk size</li>
 *   <li>If {@code size > 0 && size + length > threshold}: take the {@link RotationLock},
 *       re-stat, and if still over threshold shift the {@link BackupChain} and reopen</li>
 *   <li>Append the line and its separator in one write to an {@code APPEND} channel</li>
 * </ol>
 *
 * <p>A line is never split: an empty file accepts a line larger than the threshold and
 * rotation happens on the following write. A lock timeout skips rotation for this write
 * and the line is appended to the current file.
 *
 * <p>With {@code flushEveryRecords > 1} whole lines are collected and appended together
 * once the batch is full or on {@link #flush()}. The listener flushes whenever its queue
 * runs empty, so batching only delays output under load.
 *
 * <p>Only the listener thread that owns the sink calls {@link #write(String)},
 * {@link #flush()} and {@link #close()}; the write path holds no lock. A closed sink never
 * opens the file again.
 *
 * @see BackupChain
 * @see RotationLock
 * @since 1.0.0
 */
public final class RotatingFileSink implements LogSink {

    private static final Logger logger = LogManager.getLogger(RotatingFileSink.class);
    private static final byte[] SEPARATOR = System.lineSeparator().getBytes(StandardCharsets.UTF_8);

    private final Path file;
    private final RecordFormatter formatter;
    private final long rotationThreshold;
    private final BackupChain chain;
    private final RotationLock lock;
    private final Duration lockTimeout;
    private final boolean multiprocessSafe;
    private final int flushEveryRecords;
    private final boolean syncOnFlush;
    private final DeliveryStats stats;

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private int pendingRecords;

    private FileChannel channel;
    private Object openedFileKey;
    private long currentSize;
    private volatile boolean closed;

    public RotatingFileSink(Path file,
                            RecordFormatter formatter,
                            long rotationThreshold,
                            int backupCount,
                            RotationLock lock,
                            Duration lockTimeout,
                            boolean multiprocessSafe,
                            int flushEveryRecords,
                            boolean syncOnFlush,
                            DeliveryStats stats) {
        this.file = file.toAbsolutePath().normalize();
        this.formatter = formatter;
        this.rotationThreshold = rotationThreshold;
        this.chain = new BackupChain(this.file, backupCount);
        this.lock = lock;
        this.lockTimeout = lockTimeout;
        this.multiprocessSafe = multiprocessSafe;
        this.flushEveryRecords = Math.max(1, flushEveryRecords);
        this.syncOnFlush = syncOnFlush;
        this.stats = stats;
    }

    /**
     * Creates the file sink described by a config snapshot.
     *
     * @param config the snapshot
     * @param stats counters receiving rotation events
     * @return the sink; the file is opened on first write
     */
    public static RotatingFileSink fromConfig(LogConfig config, DeliveryStats stats) {
        Path logFile = config.getLogFile();
        return new RotatingFileSink(
            logFile,
            RecordFormatter.fromConfig(config, config.isColoredFile()),
            config.getRotationThresholdBytes(),
            config.getBackupCount(),
            RotationLock.forLogFile(logFile, config.isMultiprocessSafe()),
            config.getLockTimeout(),
            config.isMultiprocessSafe(),
            config.getFlushEveryRecords(),
            config.isSyncOnFlush(),
            stats
        );
    }

    @Override
    public String name() {
        return "file:" + file.getFileName();
    }

    @Override
    public String format(LogRecord record) {
        return formatter.format(record);
    }

    @Override
    public void write(String formattedLine) throws SinkWriteException {
        if (closed) {
            throw new SinkWriteException(name(), "sink is closed");
        }
        byte[] bytes = encode(formattedLine);
        try {
            ensureOpen();
            if (multiprocessSafe) {
                resync();
            }
            if (needsRotation(bytes.length)) {
                rotate(bytes.length);
            }
            if (flushEveryRecords == 1) {
                append(bytes);
            } else {
                pending.write(bytes, 0, bytes.length);
                pendingRecords++;
                if (pendingRecords >= flushEveryRecords) {
                    writePending();
                }
            }
        } catch (IOException e) {
            discardHandle();
            throw new SinkWriteException(name(), "write to " + file + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void flush() throws SinkWriteException {
        if (closed) {
            return;
        }
        try {
            writePending();
            if (syncOnFlush && channel != null) {
                channel.force(false);
            }
        } catch (IOException e) {
            discardHandle();
            throw new SinkWriteException(name(), "flush of " + file + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writePending();
            if (syncOnFlush && channel != null) {
                channel.force(false);
            }
        } catch (IOException e) {
            logger.warn("Error flushing {} on close: {}", file, e.getMessage(), e);
        } finally {
            closeChannel();
        }
    }

    /**
     * @return the active log file
     */
    public Path getFile() {
        return file;
    }

    /**
     * @return the backup chain of the active file
     */
    public BackupChain getBackupChain() {
        return chain;
    }

    /**
     * @return bytes this sink believes the active file holds, including unflushed lines
     */
    public long getCurrentSize() {
        return currentSize + pending.size();
    }

    private boolean needsRotation(int length) {
        if (rotationThreshold <= 0) {
            return false;
        }
        long size = currentSize + pending.size();
        return size > 0 && size + length > rotationThreshold;
    }

    private void rotate(int length) throws IOException {
        writePending();
        try (RotationLock.Held held = lock.acquire(lockTimeout)) {
            if (closed) {
                throw new IOException("sink for " + file + " was closed during rotation");
            }
            // another process may have rotated while we waited
            resync();
            if (!needsRotation(length)) {
                return;
            }
            closeChannel();
            chain.shift();
            openChannel();
            stats.incrementRotations();
            logger.debug("Rotated {} keeping {} backups", file, chain.getBackupCount());
        } catch (LockTimeoutException e) {
            stats.incrementSkippedRotations();
            logger.warn("Skipping rotation of {}: {}", file, e.getMessage());
        }
    }

    private void resync() throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            closeChannel();
            openChannel();
            return;
        }
        Object key = attributes.fileKey();
        boolean replaced = key != null ? !key.equals(openedFileKey) : attributes.size() < currentSize;
        if (replaced) {
            closeChannel();
            openChannel();
        } else {
            currentSize = attributes.size();
        }
    }

    private void ensureOpen() throws IOException {
        if (channel == null) {
            openChannel();
        }
    }

    private void openChannel() throws IOException {
        if (closed) {
            throw new IOException("sink for " + file + " is closed");
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        openedFileKey = attributes.fileKey();
        currentSize = attributes.size();
    }

    private void writePending() throws IOException {
        if (pendingRecords == 0) {
            return;
        }
        byte[] batch = pending.toByteArray();
        pending.reset();
        pendingRecords = 0;
        ensureOpen();
        append(batch);
    }

    private void append(byte[] bytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        if (syncOnFlush) {
            channel.force(false);
        }
        currentSize += bytes.length;
    }

    private void discardHandle() {
        pending.reset();
        pendingRecords = 0;
        closeChannel();
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("Error closing {}: {}", file, e.getMessage(), e);
        } finally {
            channel = null;
            openedFileKey = null;
        }
    }

    private static byte[] encode(String line) {
        byte[] text = line.getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[text.length + SEPARATOR.length];
        System.arraycopy(text, 0, bytes, 0, text.length);
        System.arraycopy(SEPARATOR, 0, bytes, text.length, SEPARATOR.length);
        return bytes;
    }
}
