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

import java.time.Duration;

/**
 * The rotation lock could not be acquired within its bounded wait. Callers skip rotation
 * for the current write and keep delivering records.
 *
 * @since 1.0.0
 */
public class LockTimeoutException extends Exception {

    private final Duration waited;

    public LockTimeoutException(String target, Duration waited) {
        super("rotation lock on " + target + " not acquired within " + waited.toMillis() + "ms");
        this.waited = waited;
    }

    public LockTimeoutException(String target, Duration waited, Throwable cause) {
        super("rotation lock on " + target + " not acquired within " + waited.toMillis() + "ms", cause);
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}
