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

import io.stratalog.LogConfig;
import io.stratalog.delivery.DeliveryStats;
import io.stratalog.rotation.BackupChain;
import io.stratalog.rotation.FileChannelRotationLock;
import io.stratalog.rotation.InProcessRotationLock;
import io.stratalog.rotation.RotationLock;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RotatingFileSinkTest {

    private static final int SEPARATOR_LENGTH = System.lineSeparator().length();

    @TempDir
    Path dir;

    private final DeliveryStats stats = new DeliveryStats();

    private RotatingFileSink sink(Path file, long threshold, int backups, boolean multiprocess, int flushEvery) {
        RotationLock lock = multiprocess ? new FileChannelRotationLock(file) : new InProcessRotationLock(file);
        return new RotatingFileSink(file, RecordFormatter.fromConfig(LogConfig.defaults(), false), threshold, backups,
            lock, Duration.ofMillis(200), multiprocess, flushEvery, false, stats);
    }

    /** A line that occupies exactly {@code bytes} on disk including its separator. */
    private static String line(String tag, int bytes) {
        StringBuilder sb = new StringBuilder(tag).append(' ');
        while (sb.length() < bytes - SEPARATOR_LENGTH) {
            sb.append('x');
        }
        return sb.toString();
    }

    private static List<String> read(Path file) throws IOException {
        return Files.exists(file) ? Files.readAllLines(file) : List.of();
    }

    @Test
    void rotatesOncePerThresholdCrossing() throws Exception {
        Path file = dir.resolve("app.log");
        RotatingFileSink sink = sink(file, 1000, 2, false, 1);
        for (int i = 0; i < 35; i++) {
            sink.write(line("r" + i, 100));
        }
        sink.close();

        BackupChain chain = sink.getBackupChain();
        assertThat(stats.getRotations()).isEqualTo(3);
        assertThat(read(file)).hasSize(5);
        assertThat(read(chain.backup(1))).hasSize(10).first(InstanceOfAssertFactories.STRING).startsWith("r20 ");
        assertThat(read(chain.backup(2))).hasSize(10).first(InstanceOfAssertFactories.STRING).startsWith("r10 ");
        assertThat(chain.backup(3)).doesNotExist();
        assertThat(Files.size(file)).isLessThanOrEqualTo(1000);
    }

    @Test
    void oversizedRecordIsWrittenWholeAndRotatesOnNextWrite() throws Exception {
        Path file = dir.resolve("big.log");
        RotatingFileSink sink = sink(file, 50, 3, false, 1);
        String big = line("big", 400);

        sink.write(big);
        assertThat(stats.getRotations()).isZero();
        assertThat(read(file)).containsExactly(big);

        sink.write("small");
        sink.close();

        assertThat(stats.getRotations()).isEqualTo(1);
        assertThat(read(sink.getBackupChain().backup(1))).containsExactly(big);
        assertThat(read(file)).containsExactly("small");
    }

    @Test
    void zeroBackupsStartsFreshFile() throws Exception {
        Path file = dir.resolve("nobackup.log");
        RotatingFileSink sink = sink(file, 250, 0, false, 1);
        sink.write(line("a", 100));
        sink.write(line("b", 100));
        sink.write(line("c", 100));
        sink.close();

        assertThat(read(file)).hasSize(1).first(InstanceOfAssertFactories.STRING).startsWith("c ");
        assertThat(dir.resolve("nobackup.log.1")).doesNotExist();
    }

    @Test
    void zeroThresholdNeverRotates() throws Exception {
        Path file = dir.resolve("unbounded.log");
        RotatingFileSink sink = sink(file, 0, 2, false, 1);
        for (int i = 0; i < 50; i++) {
            sink.write(line("r" + i, 100));
        }
        sink.close();

        assertThat(stats.getRotations()).isZero();
        assertThat(read(file)).hasSize(50);
    }

    @Test
    void batchedLinesReachDiskOnFlush() throws Exception {
        Path file = dir.resolve("batched.log");
        RotatingFileSink sink = sink(file, 0, 1, false, 5);
        sink.write("one");
        sink.write("two");
        sink.write("three");
        assertThat(Files.exists(file) ? Files.size(file) : 0L).isZero();
        assertThat(sink.getCurrentSize()).isGreaterThan(0);

        sink.flush();
        assertThat(read(file)).containsExactly("one", "two", "three");

        for (int i = 0; i < 5; i++) {
            sink.write("batch" + i);
        }
        assertThat(read(file)).hasSize(8);
        sink.close();
    }

    @Test
    void appendsToExistingFileAndCountsItsSize() throws Exception {
        Path file = dir.resolve("existing.log");
        Files.writeString(file, line("old", 900) + System.lineSeparator());
        RotatingFileSink sink = sink(file, 1000, 2, false, 1);

        sink.write(line("new", 200));
        sink.close();

        assertThat(read(sink.getBackupChain().backup(1))).hasSize(1).first(InstanceOfAssertFactories.STRING).startsWith("old ");
        assertThat(read(file)).hasSize(1).first(InstanceOfAssertFactories.STRING).startsWith("new ");
    }

    @Test
    void sinksSharingAFileRotateOncePerCrossing() throws Exception {
        Path file = dir.resolve("shared.log");
        RotatingFileSink first = sink(file, 1000, 5, true, 1);
        RotatingFileSink second = sink(file, 1000, 5, true, 1);

        for (int i = 0; i < 45; i++) {
            (i % 2 == 0 ? first : second).write(line("r" + i, 100));
        }
        first.close();
        second.close();

        BackupChain chain = first.getBackupChain();
        assertThat(stats.getRotations()).isEqualTo(4);
        List<String> all = new ArrayList<>();
        List<Path> backups = new ArrayList<>(chain.existingBackups());
        Collections.reverse(backups);
        for (Path backup : backups) {
            List<String> lines = read(backup);
            assertThat(lines).hasSize(10);
            all.addAll(lines);
        }
        all.addAll(read(file));
        assertThat(all).hasSize(45);
        for (int i = 0; i < 45; i++) {
            assertThat(all.get(i)).startsWith("r" + i + " ");
        }
        assertThat(Files.size(dir.resolve("shared.log.lock"))).isZero();
    }

    @Test
    void lockTimeoutSkipsRotationButKeepsTheRecord() throws Exception {
        Path file = dir.resolve("contended.log");
        RotatingFileSink sink = sink(file, 300, 2, true, 1);
        sink.write(line("a", 100));
        sink.write(line("b", 100));
        sink.write(line("c", 100));

        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> {
            try (RotationLock.Held held = new FileChannelRotationLock(file).acquire(Duration.ofSeconds(1))) {
                acquired.countDown();
                release.await(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        holder.start();
        try {
            assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();
            sink.write(line("d", 100));
            assertThat(stats.getSkippedRotations()).isEqualTo(1);
            assertThat(stats.getRotations()).isZero();
            assertThat(read(file)).hasSize(4);
        } finally {
            release.countDown();
            holder.join(5_000);
        }

        sink.write(line("e", 100));
        sink.close();
        assertThat(stats.getRotations()).isEqualTo(1);
        assertThat(read(sink.getBackupChain().backup(1))).hasSize(4);
        assertThat(read(file)).hasSize(1).first(InstanceOfAssertFactories.STRING).startsWith("e ");
    }

    @Test
    void recoversAfterTheFileIsRemovedUnderneath() throws Exception {
        Path file = dir.resolve("removed.log");
        RotatingFileSink sink = sink(file, 0, 1, true, 1);
        sink.write("before");
        Files.delete(file);

        sink.write("after");
        sink.close();

        assertThat(read(file)).containsExactly("after");
    }

    @Test
    void closedSinkRejectsWrites() {
        RotatingFileSink sink = sink(dir.resolve("closed.log"), 0, 1, false, 1);
        sink.close();
        sink.close();
        assertThatThrownBy(() -> sink.write("late")).isInstanceOf(SinkWriteException.class);
    }

    @Test
    void sinkClosedWhileWaitingToRotateNeverReopensTheFile() throws Exception {
        Path file = dir.resolve("late.log");
        RotatingFileSink sink = new RotatingFileSink(file, RecordFormatter.fromConfig(LogConfig.defaults(), false),
            150, 2, new InProcessRotationLock(file), Duration.ofSeconds(5), false, 1, false, stats);
        sink.write(line("a", 100));

        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread writer;
        try (RotationLock.Held held = new InProcessRotationLock(file).acquire(Duration.ofSeconds(1))) {
            writer = new Thread(() -> {
                try {
                    sink.write(line("b", 100));
                } catch (SinkWriteException e) {
                    failure.set(e);
                }
            });
            writer.start();
            Thread.sleep(200);
            sink.close();
        }
        writer.join(5_000);

        assertThat(failure.get()).isInstanceOf(SinkWriteException.class);
        assertThat(stats.getRotations()).isZero();
        assertThat(sink.getBackupChain().backup(1)).doesNotExist();
        assertThat(read(file)).hasSize(1).first(InstanceOfAssertFactories.STRING).startsWith("a ");
    }
}
