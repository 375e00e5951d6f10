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

/**
 * Lifecycle of a {@link LogListener}.
 *
 * <pre>
 * STOPPED --start--&gt; RUNNING --shutdown--&gt; DRAINING --queue empty or grace elapsed--&gt; STOPPED
 * </pre>
 *
 * @since 1.0.0
 */
public enum ListenerState {
    /** Not started yet, or finished draining. */
    STOPPED,
    /** Consuming records as they arrive. */
    RUNNING,
    /** The queue is closed to producers; remaining records are being written. */
    DRAINING
}
