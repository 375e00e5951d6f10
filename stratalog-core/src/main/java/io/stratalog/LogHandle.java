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

import io.stratalog.eventing.LogLevel;
import io.stratalog.eventing.LogRecord;
import io.stratalog.eventing.SourceLocation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

/**
 * A named logger obtained from {@link LogRegistry#getLogger(String)}. Messages use
 * {@code {}} placeholders; a {@link Throwable} passed after the last placeholder argument
 * is attached to the record and its stack trace is written with it.
 *
 * <pre>{@code
 * LogHandle log = StrataLog.getLogger(Ingest.class);
 * log.info("loaded {} rows from {}", rows, source);
 * log.error("batch {} failed", batchId, cause);
 * }</pre>
 *
 * <p>No method throws. A record emitted while no context is active, or rejected by a full
 * queue, is counted in {@link io.stratalog.delivery.DeliveryStats} and discarded.
 *
 * <p>The effective threshold is resolved once per active context and cached, so a
 * disabled level costs a reference comparison.
 *
 * @since 1.0.0
 */
public final class LogHandle {

    private static final Logger logger = LogManager.getLogger(LogHandle.class);

    private final String name;
    private final LogRegistry registry;
    private volatile Threshold threshold;

    LogHandle(String name, LogRegistry registry) {
        this.name = name;
        this.registry = registry;
    }

    public String getName() {
        return name;
    }

    public void debug(String message, Object... args) {
        log(LogLevel.DEBUG, message, args);
    }

    public void info(String message, Object... args) {
        log(LogLevel.INFO, message, args);
    }

    public void warning(String message, Object... args) {
        log(LogLevel.WARNING, message, args);
    }

    public void error(String message, Object... args) {
        log(LogLevel.ERROR, message, args);
    }

    public void critical(String message, Object... args) {
        log(LogLevel.CRITICAL, message, args);
    }

    /**
     * Logs an ERROR record carrying {@code thrown}.
     *
     * @param message the message
     * @param thrown the exception whose stack trace is written with the record
     */
    public void exception(String message, Throwable thrown) {
        emit(LogLevel.ERROR, message, null, thrown);
    }

    /**
     * Logs at an explicit level.
     *
     * @param level the record level
     * @param message the message with optional {@code {}} placeholders
     * @param args the placeholder values, optionally followed by a throwable
     */
    public void log(LogLevel level, String message, Object... args) {
        emit(level, message, args, null);
    }

    /**
     * @param level a record level
     * @return true if a record at {@code level} from this logger would be written
     */
    public boolean isEnabled(LogLevel level) {
        LogContext context = registry.activeContext();
        return context != null && level.isAtLeast(thresholdFor(context));
    }

    private void emit(LogLevel level, String message, Object[] args, Throwable thrown) {
        try {
            LogContext context = registry.activeContext();
            if (context == null) {
                registry.getStats().incrementDroppedBeforeInit();
                return;
            }
            if (!level.isAtLeast(thresholdFor(context))) {
                return;
            }
            String text = message;
            Throwable attached = thrown;
            if (args != null && args.length > 0) {
                ParameterizedMessage rendered = new ParameterizedMessage(message, args);
                text = rendered.getFormattedMessage();
                if (attached == null) {
                    attached = rendered.getThrowable();
                }
            }
            SourceLocation source = context.getConfig().isIncludeSourceLocation()
                ? SourceLocation.capture(registry.getWrapperClassNames())
                : SourceLocation.UNKNOWN;
            context.submit(LogRecord.now(level, name, text, source, attached));
        } catch (RuntimeException e) {
            registry.getStats().incrementDropped();
            logger.warn("Dropped record for {}: {}", name, e.getMessage(), e);
        }
    }

    private LogLevel thresholdFor(LogContext context) {
        Threshold cached = threshold;
        if (cached == null || cached.context != context) {
            cached = new Threshold(context, context.getLevelResolver().resolve(name));
            threshold = cached;
        }
        return cached.level;
    }

    @Override
    public String toString() {
        return "LogHandle[" + name + "]";
    }

    private static final class Threshold {
        final LogContext context;
        final LogLevel level;

        Threshold(LogContext context, LogLevel level) {
            this.context = context;
            this.level = level;
        }
    }
}
