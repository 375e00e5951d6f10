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

import java.time.Duration;

/**
 * Static entry points on the {@link LogRegistry#global() global registry}.
 *
 * <pre>{@code
 * StrataLog.initialize(config);
 * LogHandle log = StrataLog.getLogger("app.worker");
 * log.info("worker {} started", id);
 * StrataLog.shutdown(2000);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class StrataLog {

    private StrataLog() {
    }

    public static LogContext initialize(LogConfig config) {
        return LogRegistry.global().initialize(config);
    }

    public static LogHandle getLogger(String name) {
        return LogRegistry.global().getLogger(name);
    }

    public static LogHandle getLogger(Class<?> type) {
        return LogRegistry.global().getLogger(type);
    }

    /**
     * @param graceMillis how long queued records may take to drain
     * @return true if delivery finished in time
     */
    public static boolean shutdown(long graceMillis) {
        return LogRegistry.global().shutdown(Duration.ofMillis(graceMillis));
    }

    public static DeliveryStats stats() {
        return LogRegistry.global().getStats();
    }
}
