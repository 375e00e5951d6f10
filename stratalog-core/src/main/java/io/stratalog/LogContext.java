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

package io.stratalog;

import io.stratalog.delivery.CriticalHandler;
import io.stratalog.delivery.DeliveryQueue;
import io.stratalog.delivery.DeliveryStats;
import io.stratalog.delivery.EnqueueResult;
import io.stratalog.delivery.ListenerState;
import io.stratalog.delivery.LogListener;
import io.stratalog.delivery.ProcessExit;
import io.stratalog.delivery.TerminationAction;
import io.stratalog.eventing.LogRecord;
import io.stratalog.eventing.LogSink;
import io.stratalog.sinks.ConsoleSink;
import io.stratalog.sinks.RotatingFileSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One configured delivery pipeline: a {@link LogConfig} snapshot together with the queue,
 * listener, sinks and critical handler built from it. A context is started once and shut
 * down once; re-initialization builds a new context rather than mutating this one.
 *
 * <p><strong>Ownership:</strong></p>
 * <ul>
 *   <li><strong>Queue:</strong> shared by every producer thread of the process</li>
 *   <li><strong>Listener:</strong> the only thread that writes to the sinks</li>
 *   <li><strong>Sinks:</strong> closed by the listener thread once it stops, never by the
 *       thread calling {@link #shutdown(Duration)}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * LogConfig config = LogConfig.builder().logDirectory(Path.of("logs")).build();
 * try (LogContext context = LogContext.create(config, new DeliveryStats(), TerminationAction.processExit())) {
 *     context.start();
 *     context.submit(LogRecord.now(LogLevel.INFO, "app", "started", null, null));
 * }
 * }</pre>
 *
 * <p>Most code goes through {@link LogRegistry} instead of using a context directly.
 *
 * @see LogRegistry
 * @see LogListener
 * @since 1.0.0
 */
public final class LogContext implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(LogContext.class);
    private static final String LISTENER_THREAD_NAME = "stratalog-listener";

    private final LogConfig config;
    private final LevelResolver levels;
    private final DeliveryQueue queue;
    private final List<LogSink> sinks;
    private final CriticalHandler critical;
    private final LogListener listener;
    private final DeliveryStats stats;
    private final TerminationAction terminationAction;
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    /**
     * Builds a context over explicit sinks.
     *
     * @param config the snapshot the context serves
     * @param sinks the sinks the listener writes to, in order
     * @param stats counters shared with the caller
     * @param terminationAction what to do after a CRITICAL record when exit-on-critical is set
     */
    public LogContext(LogConfig config, List<LogSink> sinks, DeliveryStats stats, TerminationAction terminationAction) {
        this.config = config;
        this.levels = new LevelResolver(config);
        this.stats = stats;
        this.terminationAction = terminationAction;
        this.queue = new DeliveryQueue(config.getQueueCapacity(), stats);
        this.sinks = List.copyOf(sinks);
        this.critical = new CriticalHandler(config.isExitOnCritical(), this.sinks, terminationAction);
        this.listener = new LogListener(queue, this.sinks, levels, critical, stats, System.err, LISTENER_THREAD_NAME);
    }

    /**
     * Builds a context with the sinks the snapshot describes: the rotating file sink, and
     * the console sink when console output is enabled.
     *
     * @param config the snapshot
     * @param stats counters shared with the caller
     * @param terminationAction the critical termination action
     * @return a context that has not been started
     */
    public static LogContext create(LogConfig config, DeliveryStats stats, TerminationAction terminationAction) {
        List<LogSink> sinks = new ArrayList<>(2);
        sinks.add(RotatingFileSink.fromConfig(config, stats));
        if (config.isConsoleEnabled()) {
            sinks.add(ConsoleSink.fromConfig(config));
        }
        return new LogContext(config, sinks, stats, terminationAction);
    }

    /**
     * Starts the listener. Records submitted before this call wait in the queue.
     */
    public void start() {
        listener.start();
        logger.debug("Started delivery to {}", config.getLogFile());
    }

    /**
     * Hands a record to the queue. Never blocks and never throws for a full or closed queue.
     *
     * @param record the record
     * @return whether the record was queued
     */
    public EnqueueResult submit(LogRecord record) {
        return queue.enqueue(record);
    }

    /**
     * Stops accepting records and drains for at most {@code grace}. Idempotent. The sinks
     * are closed by the listener when it finishes; if it is still busy when the period
     * runs out (for example waiting on the rotation lock) this returns false and the
     * listener closes them later. Once the listener thread is exiting the process after a
     * critical record it never drains again, so the remaining records are counted as
     * dropped right away.
     *
     * @param grace the drain period
     * @return true if the listener finished within the period
     */
    public boolean shutdown(Duration grace) {
        if (!shutDown.compareAndSet(false, true)) {
            return true;
        }
        boolean exiting = critical.hasTriggered() && terminationAction instanceof ProcessExit;
        boolean stopped = listener.shutdown(exiting ? Duration.ZERO : grace);
        logger.debug("Shut down delivery to {} ({})", config.getLogFile(), stats);
        return stopped;
    }

    @Override
    public void close() {
        shutdown(config.getShutdownGrace());
    }

    public LogConfig getConfig() {
        return config;
    }

    public LevelResolver getLevelResolver() {
        return levels;
    }

    public DeliveryStats getStats() {
        return stats;
    }

    public ListenerState getListenerState() {
        return listener.getState();
    }

    public boolean isShutDown() {
        return shutDown.get();
    }
}
