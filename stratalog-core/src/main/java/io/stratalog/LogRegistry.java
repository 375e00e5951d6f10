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

import io.stratalog.delivery.DeliveryStats;
import io.stratalog.delivery.ProcessExit;
import io.stratalog.delivery.TerminationAction;
import io.stratalog.eventing.LogLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the active {@link LogContext} and hands out {@link LogHandle}s by name.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #initialize(LogConfig)} builds and starts a context. Calling it again with an
 *       equal snapshot is a no-op; with a different snapshot the new context is published
 *       first (its queue buffers new records), the old one drains and closes its files, and
 *       only then does the new listener start. No path is ever open twice in one process.</li>
 *   <li>{@link #shutdown(Duration)} drains and closes the active context. Records emitted
 *       afterwards are counted and discarded until the next initialize.</li>
 *   <li>{@link #reset()} shuts down and forgets handles, wrapper registrations and counters.</li>
 * </ul>
 *
 * <p>Lifecycle calls are serialized; {@link #getLogger(String)} and emitting are lock-free.
 * Readers see either the old or the new context, never a partially built one.
 *
 * <p>{@link #global()} is the process-wide instance behind {@link StrataLog}. It installs a
 * JVM shutdown hook on first initialize that drains the active context. Separate instances
 * are mainly useful in tests, where a recording {@link TerminationAction} replaces the
 * process exit.
 *
 * @since 1.0.0
 */
public final class LogRegistry {

    private static final Logger logger = LogManager.getLogger(LogRegistry.class);
    private static final LogRegistry GLOBAL = new LogRegistry(TerminationAction.processExit(), true);

    private final TerminationAction terminationAction;
    private final boolean installShutdownHook;
    private final Object lifecycleLock = new Object();
    private final AtomicReference<LogContext> active = new AtomicReference<>();
    private final ConcurrentHashMap<String, LogHandle> handles = new ConcurrentHashMap<>();
    private final Set<String> wrapperClassNames = ConcurrentHashMap.newKeySet();
    private volatile DeliveryStats stats = new DeliveryStats();
    private Thread shutdownHook;

    public LogRegistry() {
        this(TerminationAction.processExit(), false);
    }

    public LogRegistry(TerminationAction terminationAction) {
        this(terminationAction, false);
    }

    private LogRegistry(TerminationAction terminationAction, boolean installShutdownHook) {
        this.terminationAction = terminationAction;
        this.installShutdownHook = installShutdownHook;
        registerDefaultWrappers();
    }

    /**
     * @return the process-wide registry
     */
    public static LogRegistry global() {
        return GLOBAL;
    }

    /**
     * Makes {@code config} the active snapshot.
     *
     * @param config the resolved snapshot
     * @return the active context
     */
    public LogContext initialize(LogConfig config) {
        synchronized (lifecycleLock) {
            LogContext current = active.get();
            if (current != null && current.getConfig().equals(config)) {
                logger.debug("Already initialized with an equal configuration");
                return current;
            }
            LogContext next = LogContext.create(config, stats, terminationAction);
            active.set(next);
            if (current != null) {
                current.shutdown(current.getConfig().getShutdownGrace());
            }
            next.start();
            if (installShutdownHook && shutdownHook == null) {
                shutdownHook = new Thread(this::drainOnExit, "stratalog-shutdown");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }
            logger.debug("Initialized {}", config);
            return next;
        }
    }

    /**
     * Drains and closes the active context.
     *
     * @param grace how long queued records may take to drain
     * @return true if delivery finished within the grace period, or nothing was active
     */
    public boolean shutdown(Duration grace) {
        synchronized (lifecycleLock) {
            LogContext current = active.getAndSet(null);
            return current == null || current.shutdown(grace);
        }
    }

    /**
     * Shuts down with the active snapshot's grace period.
     *
     * @return see {@link #shutdown(Duration)}
     */
    public boolean shutdown() {
        synchronized (lifecycleLock) {
            LogContext current = active.get();
            return shutdown(current == null ? Duration.ZERO : current.getConfig().getShutdownGrace());
        }
    }

    /**
     * Shuts down, then forgets every handle, wrapper registration and counter.
     */
    public void reset() {
        synchronized (lifecycleLock) {
            shutdown();
            handles.clear();
            wrapperClassNames.clear();
            registerDefaultWrappers();
            stats = new DeliveryStats();
        }
    }

    public LogHandle getLogger(String name) {
        return handles.computeIfAbsent(name, n -> new LogHandle(n, this));
    }

    public LogHandle getLogger(Class<?> type) {
        return getLogger(type.getName());
    }

    /**
     * Sets the level of one logger name, and of the names below it, by re-initializing
     * with an extra override.
     *
     * @param loggerName the logger name or dotted prefix
     * @param level the new threshold
     * @throws IllegalStateException if the registry is not initialized
     */
    public void setLevel(String loggerName, LogLevel level) {
        synchronized (lifecycleLock) {
            LogContext current = active.get();
            if (current == null) {
                throw new IllegalStateException("cannot set level of " + loggerName + " before initialize");
            }
            initialize(current.getConfig().toBuilder().levelOverride(loggerName, level).build());
        }
    }

    /**
     * Excludes a class from caller-location capture, for facades that wrap {@link LogHandle}.
     *
     * @param wrapper the wrapping class
     */
    public void registerWrapper(Class<?> wrapper) {
        wrapperClassNames.add(wrapper.getName());
    }

    public boolean isInitialized() {
        return active.get() != null;
    }

    public Optional<LogConfig> currentConfig() {
        LogContext current = active.get();
        return current == null ? Optional.empty() : Optional.of(current.getConfig());
    }

    public DeliveryStats getStats() {
        return stats;
    }

    LogContext activeContext() {
        return active.get();
    }

    Set<String> getWrapperClassNames() {
        return wrapperClassNames;
    }

    private void registerDefaultWrappers() {
        wrapperClassNames.add(LogHandle.class.getName());
        wrapperClassNames.add(StrataLog.class.getName());
    }

    private void drainOnExit() {
        ProcessExit.markShutdownInProgress();
        LogContext current = active.getAndSet(null);
        if (current != null) {
            current.shutdown(current.getConfig().getShutdownGrace());
        }
    }
}
