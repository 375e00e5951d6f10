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

package io.stratalog.command.loggen;

import io.stratalog.LogConfig;
import io.stratalog.LogRegistry;
import io.stratalog.rotation.InProcessRotationLock;
import io.stratalog.rotation.RotationLock;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Child process for {@link CriticalExitTest}. Holds the rotation lock so the listener is
 * still waiting on it when {@code System.exit(0)} starts the shutdown hook; the CRITICAL
 * record is then delivered during the hook's drain and the process halts with status 1.
 */
public final class CriticalDuringShutdown {

    static final String FILENAME = "hook.log";

    private CriticalDuringShutdown() {
    }

    public static void main(String[] args) throws Exception {
        Path dir = Path.of(args[0]);
        Path file = dir.resolve(FILENAME);
        LogRegistry registry = LogRegistry.global();
        registry.initialize(LogConfig.builder()
            .logDirectory(dir)
            .baseFilename(FILENAME)
            .consoleEnabled(false)
            .multiprocessSafe(false)
            .exitOnCritical(true)
            .rotationThresholdBytes(100)
            .lockTimeout(Duration.ofSeconds(1))
            .shutdownGrace(Duration.ofSeconds(10))
            .build());

        // held until the process ends
        RotationLock.Held held = new InProcessRotationLock(file).acquire(Duration.ofSeconds(1));
        registry.getLogger("child").info("before exit {}", "x".repeat(80));
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while ((!Files.exists(file) || Files.size(file) == 0) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        registry.getLogger("child").critical("during shutdown");
        System.exit(0);
    }
}
