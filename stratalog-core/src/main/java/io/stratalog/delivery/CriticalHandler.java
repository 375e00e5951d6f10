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
import io.stratalog.eventing.LogSink;
import io.stratalog.sinks.SinkWriteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observes records after the listener has handed them to every sink and, for a CRITICAL
 * record while {@code exitOnCritical} is set, flushes the sinks and runs the
 * {@link TerminationAction}. The action runs at most once per handler.
 *
 * @since 1.0.0
 */
public final class CriticalHandler {

    /** Status passed to the termination action. */
    public static final int EXIT_STATUS = 1;

    private static final Logger logger = LogManager.getLogger(CriticalHandler.class);

    private final boolean exitOnCritical;
    private final List<LogSink> sinks;
    private final TerminationAction action;
    private final AtomicBoolean triggered = new AtomicBoolean(false);

    public CriticalHandler(boolean exitOnCritical, List<LogSink> sinks, TerminationAction action) {
        this.exitOnCritical = exitOnCritical;
        this.sinks = List.copyOf(sinks);
        this.action = action;
    }

    /**
     * Called by the listener once {@code record} has been written.
     *
     * @param record the delivered record
     * @return true if the termination action was invoked
     */
    public boolean afterDelivery(LogRecord record) {
        if (!exitOnCritical || record.level != LogLevel.CRITICAL) {
            return false;
        }
        if (!triggered.compareAndSet(false, true)) {
            return false;
        }
        for (LogSink sink : sinks) {
            try {
                sink.flush();
            } catch (SinkWriteException | RuntimeException e) {
                logger.warn("Flush of {} before critical exit failed: {}", sink.name(), e.getMessage(), e);
            }
        }
        logger.debug("Critical record on {} triggers termination with status {}", record.loggerName, EXIT_STATUS);
        action.terminate(EXIT_STATUS, record);
        return true;
    }

    /**
     * @return true once the termination action has been invoked
     */
    public boolean hasTriggered() {
        return triggered.get();
    }

    public boolean isExitOnCritical() {
        return exitOnCritical;
    }
}
