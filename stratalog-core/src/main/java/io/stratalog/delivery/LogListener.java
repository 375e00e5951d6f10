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

import io.stratalog.LevelResolver;
import io.stratalog.eventing.LogRecord;
import io.stratalog.eventing.LogSink;
import io.stratalog.sinks.SinkWriteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single consumer of a {@link DeliveryQueue}. One daemon thread drains the queue and
 * writes every record to each {@link LogSink}, so within a process it is the only writer of
 * the files its sinks own.
 *
 * <p>Per Record:
 * <ol>
 *   <li>Skip the record unless its level meets the threshold {@link LevelResolver} gives
 *       its logger; drop notices on {@value DeliveryQueue#NOTICE_LOGGER} always pass</li>
 *   <li>For each sink, {@code sink.write(sink.format(record))} in its own try block, so a
 *       failing sink never keeps the record from the others</li>
 *   <li>Pass the record to the {@link CriticalHandler}</li>
 * </ol>
 *
 * <p>Fault Handling: a {@link SinkWriteException} (or any runtime failure inside a sink)
 * is counted in {@link DeliveryStats#getSinkFaults()}, a fallback line is written to the
 * fallback stream, and draining continues. The first fault of each sink is also reported
 * through Log4j.
 *
 * <p>Lifecycle: see {@link ListenerState}. {@link #shutdown(Duration)} closes the queue,
 * lets the thread drain for at most the grace period, then counts whatever is left as
 * dropped at shutdown and writes a notice with that count. The thread is never
 * interrupted, since an interrupt during a channel write would close the file channel.
 * The sinks are closed by the listener thread itself, after its final flush, so a thread
 * still busy when {@code shutdown} gives up waiting closes them once it finishes.
 *
 * @see DeliveryQueue
 * @see CriticalHandler
 * @since 1.0.0
 */
public final class LogListener {

    private static final Logger logger = LogManager.getLogger(LogListener.class);
    private static final long POLL_MILLIS = 50;
    private static final long JOIN_MARGIN_MILLIS = 500;
    private static final int BATCH_SIZE = 256;

    private final DeliveryQueue queue;
    private final List<LogSink> sinks;
    private final LevelResolver levels;
    private final CriticalHandler critical;
    private final DeliveryStats stats;
    private final PrintStream fallback;
    private final String threadName;

    private final AtomicReference<ListenerState> state = new AtomicReference<>(ListenerState.STOPPED);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Set<String> reportedSinks = ConcurrentHashMap.newKeySet();
    private volatile long drainDeadlineNanos;
    private volatile Thread thread;

    public LogListener(DeliveryQueue queue,
                       List<LogSink> sinks,
                       LevelResolver levels,
                       CriticalHandler critical,
                       DeliveryStats stats,
                       PrintStream fallback,
                       String threadName) {
        this.queue = queue;
        this.sinks = List.copyOf(sinks);
        this.levels = levels;
        this.critical = critical;
        this.stats = stats;
        this.fallback = fallback;
        this.threadName = threadName;
    }

    /**
     * Starts the consumer thread. A listener can be started once.
     *
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("listener " + threadName + " was already started");
        }
        state.set(ListenerState.RUNNING);
        Thread worker = new Thread(this::runLoop, threadName);
        worker.setDaemon(true);
        thread = worker;
        worker.start();
    }

    public ListenerState getState() {
        return state.get();
    }

    /**
     * Closes the queue and waits for the remaining records to be written, for at most
     * {@code grace}. Records still queued afterwards are counted as dropped at shutdown.
     * Calling it on a listener that never started discards and counts the queue, then
     * closes the sinks from the calling thread.
     *
     * @param grace how long the remaining records may take to drain
     * @return true if the listener thread has finished
     */
    public boolean shutdown(Duration grace) {
        drainDeadlineNanos = System.nanoTime() + grace.toNanos();
        // contents are final once close returns, before the thread sees DRAINING
        queue.close();
        if (!state.compareAndSet(ListenerState.RUNNING, ListenerState.DRAINING) && !started.get()) {
            discardRemaining();
            closeSinks();
            return true;
        }
        return awaitTermination(grace);
    }

    private boolean awaitTermination(Duration grace) {
        Thread worker = thread;
        if (worker == null || worker == Thread.currentThread()) {
            return worker == null;
        }
        try {
            worker.join(grace.toMillis() + JOIN_MARGIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            logger.warn("Listener {} did not stop within {}ms", threadName, grace.toMillis() + JOIN_MARGIN_MILLIS);
            return false;
        }
        return true;
    }

    private void runLoop() {
        List<LogRecord> batch = new ArrayList<>(BATCH_SIZE);
        try {
            while (state.get() == ListenerState.RUNNING) {
                LogRecord first;
                try {
                    first = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    logger.warn("Listener {} interrupted; draining and stopping", threadName);
                    drainDeadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(JOIN_MARGIN_MILLIS);
                    state.compareAndSet(ListenerState.RUNNING, ListenerState.DRAINING);
                    queue.close();
                    break;
                }
                if (first == null) {
                    flushSinks();
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, BATCH_SIZE - 1);
                deliverAll(batch);
                if (queue.isEmpty()) {
                    flushSinks();
                }
            }
            drainUntilDeadline(batch);
        } catch (Throwable t) {
            logger.error("Listener {} failed: {}", threadName, t.getMessage(), t);
            discardRemaining();
        } finally {
            flushSinks();
            closeSinks();
            state.set(ListenerState.STOPPED);
        }
    }

    private void drainUntilDeadline(List<LogRecord> batch) {
        while (System.nanoTime() - drainDeadlineNanos < 0) {
            if (queue.drainTo(batch, BATCH_SIZE) == 0) {
                break;
            }
            deliverAll(batch);
        }
        long unreported = queue.takeUnreportedDrops();
        if (unreported > 0) {
            deliver(DeliveryQueue.dropNotice(unreported));
        }
        discardRemaining();
    }

    private void discardRemaining() {
        int remaining = queue.clear().size();
        if (remaining == 0) {
            return;
        }
        stats.addDroppedAtShutdown(remaining);
        logger.warn("Listener {} dropped {} queued records at shutdown", threadName, remaining);
        if (started.get()) {
            deliver(DeliveryQueue.notice(remaining + " log records dropped at shutdown (grace period elapsed)"));
        }
    }

    private void deliverAll(List<LogRecord> batch) {
        for (LogRecord record : batch) {
            deliver(record);
        }
        batch.clear();
    }

    private void deliver(LogRecord record) {
        stats.incrementDelivered();
        if (!DeliveryQueue.NOTICE_LOGGER.equals(record.loggerName) && !levels.isEnabled(record.level, record.loggerName)) {
            return;
        }
        for (LogSink sink : sinks) {
            String line = null;
            try {
                line = sink.format(record);
                sink.write(line);
            } catch (SinkWriteException e) {
                reportFault(sink, line != null ? line : record.toString(), e);
            } catch (RuntimeException e) {
                reportFault(sink, line != null ? line : record.toString(),
                    new SinkWriteException(sink.name(), e.toString(), e));
            }
        }
        critical.afterDelivery(record);
    }

    private void flushSinks() {
        for (LogSink sink : sinks) {
            try {
                sink.flush();
            } catch (SinkWriteException e) {
                reportFault(sink, null, e);
            } catch (RuntimeException e) {
                reportFault(sink, null, new SinkWriteException(sink.name(), e.toString(), e));
            }
        }
    }

    private void closeSinks() {
        for (LogSink sink : sinks) {
            try {
                sink.close();
            } catch (RuntimeException e) {
                reportFault(sink, null, new SinkWriteException(sink.name(), "close failed: " + e, e));
            }
        }
    }

    private void reportFault(LogSink sink, String undelivered, SinkWriteException e) {
        stats.incrementSinkFaults();
        if (undelivered != null) {
            fallback.println("stratalog: " + e.getMessage() + " | " + undelivered);
        } else {
            fallback.println("stratalog: " + e.getMessage());
        }
        if (reportedSinks.add(sink.name())) {
            logger.warn("Sink {} failed, continuing with fallback: {}", sink.name(), e.getMessage(), e);
        }
    }
}
