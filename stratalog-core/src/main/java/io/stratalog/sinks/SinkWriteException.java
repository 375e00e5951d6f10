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

/**
 * Raised when a sink cannot render a line to its destination: permission denied,
 * disk full, a log directory removed underfoot, or a closed console stream.
 * The listener absorbs it; it never reaches a producer.
 *
 * @since 1.0.0
 */
public class SinkWriteException extends Exception {

    private final String sinkName;

    public SinkWriteException(String sinkName, String message, Throwable cause) {
        super(sinkName + ": " + message, cause);
        this.sinkName = sinkName;
    }

    public SinkWriteException(String sinkName, String message) {
        this(sinkName, message, null);
    }

    /**
     * @return the name of the sink that failed
     */
    public String getSinkName() {
        return sinkName;
    }
}
