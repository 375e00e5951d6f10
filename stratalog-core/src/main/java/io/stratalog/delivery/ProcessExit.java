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
 * Exits the JVM. Inside a shutdown hook {@link Runtime#exit(int)} would block forever, so
 * once {@link #markShutdownInProgress()} has been called the process is halted instead.
 *
 * @since 1.0.0
 */
public final class ProcessExit implements TerminationAction {

    static final ProcessExit INSTANCE = new ProcessExit();

    private static volatile boolean shutdownInProgress;

    private ProcessExit() {
    }

    /**
     * Called by the registry's shutdown hook before it drains the active context.
     */
    public static void markShutdownInProgress() {
        shutdownInProgress = true;
    }

    @Override
    public void terminate(int status, LogRecord cause) {
        if (shutdownInProgress) {
            Runtime.getRuntime().halt(status);
        } else {
            System.exit(status);
        }
    }
}
