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

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JVM-local rotation lock. All instances created for the same normalized path share one
 * {@link ReentrantLock}, so two delivery contexts in one process (for example an old one
 * draining while a new one starts) never rotate the same file concurrently.
 *
 * @since 1.0.0
 */
public final class InProcessRotationLock implements RotationLock {

    private static final ConcurrentHashMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final Path key;
    private final ReentrantLock lock;

    public InProcessRotationLock(Path logFile) {
        this.key = logFile.toAbsolutePath().normalize();
        this.lock = LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
    }

    @Override
    public Held acquire(Duration timeout) throws LockTimeoutException {
        try {
            if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new LockTimeoutException(describe(), timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(describe(), timeout, e);
        }
        AtomicBoolean released = new AtomicBoolean(false);
        return () -> {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
            }
        };
    }

    @Override
    public String describe() {
        return "in-process:" + key;
    }
}
