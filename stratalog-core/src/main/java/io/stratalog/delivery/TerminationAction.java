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

import io.stratalog.eventing.LogRecord;

/**
 * What {@link CriticalHandler} does once a CRITICAL record has been written and the sinks
 * flushed. The default ends the process; tests substitute a recording action.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TerminationAction {

    /**
     * @param status the exit status to use
     * @param cause the CRITICAL record that triggered termination
     */
    void terminate(int status, LogRecord cause);

    /**
     * @return the action that exits the JVM with the given status
     */
    static TerminationAction processExit() {
        return ProcessExit.INSTANCE;
    }
}
