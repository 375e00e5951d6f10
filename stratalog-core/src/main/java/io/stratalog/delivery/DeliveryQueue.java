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

package io.stratalog.delivery;

import io.stratalog.eventing.LogLevel;
import io.stratalog.eventing.LogRecord;
import io.stratalog.eventing.SourceLocation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded multi-producer, single-consumer funnel between emitting threads and the
 * {@link LogListener}.
 *
 * <h2>Full-Queue Policy</h2>
 * <p>{@link #enqueue(LogRecord)} never blocks. When the queue is full the record is dropped
 * and counted. The next producer that finds room first injects one synthetic WARNING
 * record on logger {@value #NOTICE_LOGGER} carrying the number of records lost since the
 * previous notice, then enqueues its own record. If the notice itself does not fit, the
 * count is carried over to the next attempt, so every drop is reported exactly once.</p>
 *
 * <h2>Ordering</h2>
 * <p>Records from one producer thread are delivered in emit order. No order is defined
 * between different producer threads.</p>
 *
 * <h2>Closing</h2>
 * <p>After {@link #close()} every enqueue is rejected as {@link EnqueueResult#DROPPED}.
 * {@code close()} waits for enqueues already in flight, so once it returns the queue
 * contents are final and the listener can drain them completely.</p>
 *
 * @since 1.0.0
 */
public final class DeliveryQueue {

    /** Logger name of synthetic drop notices. */
    public static final String NOTICE_LOGGER = "stratalog.delivery";

    private final ArrayBlockingQueue<LogRecord> queue;
    private final int capacity;
    private final DeliveryStats stats;
    private final AtomicLong unreportedDrops = new AtomicLong(0);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile boolean closed;

    public DeliveryQueue(int capacity, DeliveryStats stats) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.stats = stats;
    }

    /**
     * Offers a record without blocking.
     *
     * @param record the record
     * @return whether the record was queued
     */
    public EnqueueResult enqueue(LogRecord record) {
        inFlight.incrementAndGet();
        try {
            if (closed) {
                stats.incrementDropped();
                return EnqueueResult.DROPPED;
            }
            long missed = unreportedDrops.getAndSet(0);
            if (missed > 0 && !queue.offer(dropNotice(missed))) {
                unreportedDrops.addAndGet(missed);
            }
            if (queue.offer(record)) {
                stats.incrementAccepted();
                return EnqueueResult.ACCEPTED;
            }
            unreportedDrops.incrementAndGet();
            stats.incrementDropped();
            return EnqueueResult.DROPPED;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /**
     * Waits up to the given time for the next record.
     *
     * @return the record, or null if none arrived in time
     * @throws InterruptedException if the consumer is interrupted
     */
    public LogRecord poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Moves up to {@code max} queued records into {@code target} without waiting.
     *
     * @return the number of records moved
     */
    public int drainTo(Collection<? super LogRecord> target, int max) {
        return queue.drainTo(target, max);
    }

    /**
     * Rejects all further enqueues and waits for in-flight enqueues to finish.
     */
    public void close() {
        closed = true;
        while (inFlight.get() > 0) {
            Thread.onSpinWait();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Removes everything still queued.
     *
     * @return the removed records
     */
    public List<LogRecord> clear() {
        List<LogRecord> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        return remaining;
    }

    /**
     * Returns and resets the count of drops not yet announced by a notice record.
     *
     * @return the unannounced drop count
     */
    public long takeUnreportedDrops() {
        return unreportedDrops.getAndSet(0);
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    /**
     * Builds the synthetic notice for {@code count} dropped records.
     *
     * @param count the number of dropped records
     * @return a WARNING record on {@value #NOTICE_LOGGER}
     */
    public static LogRecord dropNotice(long count) {
        return notice(count + " log records dropped (delivery queue full)");
    }

    static LogRecord notice(String message) {
        return LogRecord.now(LogLevel.WARNING, NOTICE_LOGGER, message, SourceLocation.UNKNOWN, null);
    }

    /**
     * Extracts the count from a drop notice's message.
     *
     * @param record a record
     * @return the dropped count, or -1 if the record is not a drop notice
     */
    public static long droppedCountOf(LogRecord record) {
        if (!NOTICE_LOGGER.equals(record.loggerName)) {
            return -1;
        }
        int space = record.message.indexOf(' ');
        if (space <= 0 || !record.message.startsWith(" log records dropped", space)) {
            return -1;
        }
        try {
            return Long.parseLong(record.message.substring(0, space));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
