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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters describing how records moved through the delivery path. Every record
 * that is not written ends up in exactly one of the drop counters, so degraded logging is
 * always observable.
 *
 * <h2>Counters</h2>
 * <ul>
 *   <li><strong>Accepted:</strong> enqueued by a producer (synthetic notices excluded)</li>
 *   <li><strong>Delivered:</strong> handed to the sinks by the listener, synthetic notices included</li>
 *   <li><strong>Dropped:</strong> rejected because the queue was full or closed</li>
 *   <li><strong>Dropped at shutdown:</strong> still queued when the shutdown grace elapsed</li>
 *   <li><strong>Dropped before init:</strong> emitted while no context was active, before initialize or after shutdown</li>
 *   <li><strong>Sink faults:</strong> {@code write} or {@code flush} failures absorbed by the listener</li>
 *   <li><strong>Rotations:</strong> backup-chain shifts performed by this process</li>
 *   <li><strong>Skipped rotations:</strong> rotations abandoned after a lock timeout</li>
 * </ul>
 *
 * <p>One instance is normally shared by every context a registry creates, so the counts are
 * cumulative across re-initialization.
 *
 * @since 1.0.0
 */
public final class DeliveryStats {
    private final AtomicLong accepted = new AtomicLong(0);
    private final AtomicLong delivered = new AtomicLong(0);
    private final AtomicLong dropped = new AtomicLong(0);
    private final AtomicLong droppedAtShutdown = new AtomicLong(0);
    private final AtomicLong droppedBeforeInit = new AtomicLong(0);
    private final AtomicLong sinkFaults = new AtomicLong(0);
    private final AtomicLong rotations = new AtomicLong(0);
    private final AtomicLong skippedRotations = new AtomicLong(0);

    public long getAccepted() {
        return accepted.get();
    }

    public long getDelivered() {
        return delivered.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getDroppedAtShutdown() {
        return droppedAtShutdown.get();
    }

    public long getDroppedBeforeInit() {
        return droppedBeforeInit.get();
    }

    public long getSinkFaults() {
        return sinkFaults.get();
    }

    public long getRotations() {
        return rotations.get();
    }

    public long getSkippedRotations() {
        return skippedRotations.get();
    }

    /**
     * Returns the sum of every drop counter.
     *
     * @return total records that never reached a sink
     */
    public long getTotalLost() {
        return dropped.get() + droppedAtShutdown.get() + droppedBeforeInit.get();
    }

    void incrementAccepted() {
        accepted.incrementAndGet();
    }

    void incrementDelivered() {
        delivered.incrementAndGet();
    }

    public void incrementDropped() {
        dropped.incrementAndGet();
    }

    void addDroppedAtShutdown(long count) {
        droppedAtShutdown.addAndGet(count);
    }

    public void incrementDroppedBeforeInit() {
        droppedBeforeInit.incrementAndGet();
    }

    void incrementSinkFaults() {
        sinkFaults.incrementAndGet();
    }

    public void incrementRotations() {
        rotations.incrementAndGet();
    }

    public void incrementSkippedRotations() {
        skippedRotations.incrementAndGet();
    }

    @Override
    public String toString() {
        return String.format(
            "DeliveryStats[accepted=%d, delivered=%d, dropped=%d, droppedAtShutdown=%d, droppedBeforeInit=%d, "
                + "sinkFaults=%d, rotations=%d, skippedRotations=%d]",
            accepted.get(), delivered.get(), dropped.get(), droppedAtShutdown.get(), droppedBeforeInit.get(),
            sinkFaults.get(), rotations.get(), skippedRotations.get()
        );
    }
}
