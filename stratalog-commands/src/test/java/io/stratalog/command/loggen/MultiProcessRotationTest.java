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

import io.stratalog.command.logcheck.LogChainVerifier;
import io.stratalog.command.logcheck.VerificationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Three JVMs with two producer threads each write 1000 records apiece into one file chain.
 * Each line is about 270 bytes, so the 1.6 MB written crosses the 0.7 MB threshold twice.
 */
class MultiProcessRotationTest {

    private static final int PROCESSES = 3;
    private static final int THREADS = 2;
    private static final int RECORDS = 1000;

    @TempDir
    Path tempDir;

    @Test
    @Timeout(value = 3, unit = TimeUnit.MINUTES)
    void processesShareOneIntactChain() throws Exception {
        List<Process> processes = new ArrayList<>();
        for (int p = 0; p < PROCESSES; p++) {
            processes.add(launch("p" + p));
        }
        for (int p = 0; p < PROCESSES; p++) {
            Process process = processes.get(p);
            assertThat(process.waitFor(150, TimeUnit.SECONDS)).isTrue();
            String output = Files.readString(tempDir.resolve("p" + p + ".out"));
            assertThat(process.exitValue()).as(output).isZero();
        }

        Path active = tempDir.resolve("base.log");
        assertThat(active).exists();
        assertThat(tempDir.resolve("base.log.1")).exists();
        assertThat(tempDir.resolve("base.log.2")).exists();
        assertThat(tempDir.resolve("base.log.3")).doesNotExist();
        assertThat(Files.readString(tempDir.resolve("base.log.lock"))).isEmpty();

        VerificationReport report = new LogChainVerifier(active, 5).verify();
        assertThat(report.getProblems()).isEmpty();
        assertThat(report.getCorruptLines()).isZero();
        assertThat(report.getOutOfOrder()).isZero();
        assertThat(report.getLoadRecords()).isEqualTo((long) PROCESSES * THREADS * RECORDS);
        assertThat(report.getRecordsByTag())
            .containsOnly(Map.entry("p0", 2000L), Map.entry("p1", 2000L), Map.entry("p2", 2000L));
    }

    private Process launch(String tag) throws Exception {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        String classPath = System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
        List<String> command = List.of(java, "-cp", classPath, CMD_loggen.class.getName(),
            "--threads", String.valueOf(THREADS),
            "--count", String.valueOf(RECORDS),
            "--message-size", "150",
            "--tag", tag,
            "--log-dir", tempDir.toString(),
            "--log-filename", "base.log",
            "--log-level", "INFO",
            "--rotation-size", "0.7",
            "--backup-count", "5");
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true)
            .redirectOutput(tempDir.resolve(tag + ".out").toFile());
        builder.environment().keySet().removeIf(name ->
            name.startsWith("STRATALOG_") || name.startsWith("LOG_") || name.startsWith("LOGGING_"));
        return builder.start();
    }
}
