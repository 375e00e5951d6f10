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

import io.stratalog.eventing.LogLevel;
import io.stratalog.eventing.LogRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryQueueTest {

    private static LogRecord record(String message) {
        return LogRecord.now(LogLevel.INFO, "queue.test", message, null, null);
    }

    @Test
    void dropsWhenFullAndReportsOnceOnNextAccept() {
        DeliveryStats stats = new DeliveryStats();
        DeliveryQueue queue = new DeliveryQueue(4, stats);

        for (int i = 0; i < 4; i++) {
            assertThat(queue.enqueue(record("r" + i))).isEqualTo(EnqueueResult.ACCEPTED);
        }
        for (int i = 0; i < 7; i++) {
            assertThat(queue.enqueue(record("lost" + i))).isEqualTo(EnqueueResult.DROPPED);
        }
        assertThat(stats.getDropped()).isEqualTo(7);

        List<LogRecord> drained = new ArrayList<>();
        queue.drainTo(drained, 10);
        assertThat(drained).extracting(r -> r.message).containsExactly("r0", "r1", "r2", "r3");

        assertThat(queue.enqueue(record("after"))).isEqualTo(EnqueueResult.ACCEPTED);
        queue.drainTo(drained, 10);

        LogRecord notice = drained.get(4);
        assertThat(notice.loggerName).isEqualTo(DeliveryQueue.NOTICE_LOGGER);
        assertThat(notice.level).isEqualTo(LogLevel.WARNING);
        assertThat(DeliveryQueue.droppedCountOf(notice)).isEqualTo(7);
        assertThat(drained.get(5).message).isEqualTo("after");

        assertThat(queue.enqueue(record("again"))).isEqualTo(EnqueueResult.ACCEPTED);
        queue.drainTo(drained, 10);
        assertThat(drained).hasSize(7);
        assertThat(drained.stream().filter(r -> DeliveryQueue.droppedCountOf(r) >= 0)).hasSize(1);
        assertThat(stats.getAccepted()).isEqualTo(6);
    }

    @Test
    void noticeThatDoesNotFitCarriesItsCountForward() {
        DeliveryStats stats = new DeliveryStats();
        DeliveryQueue queue = new DeliveryQueue(1, stats);
        queue.enqueue(record("first"));
        queue.enqueue(record("lost"));

        List<LogRecord> drained = new ArrayList<>();
        queue.drainTo(drained, 1);

        // the notice takes the only slot, so this record is dropped in turn
        assertThat(queue.enqueue(record("second"))).isEqualTo(EnqueueResult.DROPPED);
        queue.drainTo(drained, 1);
        assertThat(DeliveryQueue.droppedCountOf(drained.get(1))).isEqualTo(1);

        assertThat(queue.enqueue(record("third"))).isEqualTo(EnqueueResult.DROPPED);
        queue.drainTo(drained, 1);
        assertThat(DeliveryQueue.droppedCountOf(drained.get(2))).isEqualTo(1);

        assertThat(queue.enqueue(record("fourth"))).isEqualTo(EnqueueResult.DROPPED);
        queue.drainTo(drained, 1);
        long reported = drained.stream().mapToLong(DeliveryQueue::droppedCountOf).filter(c -> c > 0).sum();
        assertThat(reported + queue.takeUnreportedDrops()).isEqualTo(stats.getDropped());
    }

    @Test
    void closedQueueRejectsEverything() {
        DeliveryStats stats = new DeliveryStats();
        DeliveryQueue queue = new DeliveryQueue(8, stats);
        queue.enqueue(record("kept"));
        queue.close();

        assertThat(queue.isClosed()).isTrue();
        assertThat(queue.enqueue(record("late"))).isEqualTo(EnqueueResult.DROPPED);
        assertThat(queue.clear()).extracting(r -> r.message).containsExactly("kept");
        assertThat(stats.getDropped()).isEqualTo(1);
    }

    @Test
    void concurrentProducersLoseNothingUncounted() throws Exception {
        DeliveryStats stats = new DeliveryStats();
        DeliveryQueue queue = new DeliveryQueue(64, stats);
        int producers = 8;
        int perProducer = 2_000;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        for (int p = 0; p < producers; p++) {
            int id = p;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perProducer; i++) {
                    queue.enqueue(record(id + ":" + i));
                }
                return null;
            });
        }

        List<LogRecord> drained = new ArrayList<>();
        start.countDown();
        pool.shutdown();
        while (!pool.awaitTermination(1, TimeUnit.MILLISECONDS)) {
            queue.drainTo(drained, 32);
        }
        queue.drainTo(drained, Integer.MAX_VALUE);

        long real = drained.stream().filter(r -> !DeliveryQueue.NOTICE_LOGGER.equals(r.loggerName)).count();
        long reported = drained.stream().mapToLong(DeliveryQueue::droppedCountOf).filter(c -> c > 0).sum();
        assertThat(real + stats.getDropped()).isEqualTo((long) producers * perProducer);
        assertThat(real).isEqualTo(stats.getAccepted());
        assertThat(reported + queue.takeUnreportedDrops()).isEqualTo(stats.getDropped());
    }
}
