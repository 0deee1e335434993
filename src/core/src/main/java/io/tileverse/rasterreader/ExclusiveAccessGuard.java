/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.rasterreader;

import static java.util.Objects.requireNonNull;

import io.tileverse.rasterreader.spi.RasterHandle;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes access to a non-thread-safe {@link RasterHandle}.
 * <p>
 * The wrapped handle is only reachable through a {@link ScopedAccess}, which holds the guard until it's closed:
 *
 * <pre>{@code
 * try (ScopedAccess access = guard.acquire()) {
 *     int count = access.handle().bandCount();
 * }
 * }</pre>
 *
 * At most one {@code ScopedAccess} is held at any time. Concurrent callers block until the holder releases it, in
 * no particular order.
 * <p>
 * The lock is acquired uninterruptibly, so an interrupted thread neither abandons a held guard nor interrupts an
 * in-flight native call. Acquiring the guard again from the thread that already holds it would deadlock with a
 * plain mutex; it fails fast with an {@link IllegalStateException} instead.
 */
final class ExclusiveAccessGuard {

    private final RasterHandle handle;

    private final ReentrantLock lock = new ReentrantLock();

    ExclusiveAccessGuard(RasterHandle handle) {
        this.handle = requireNonNull(handle, "handle");
    }

    /**
     * Blocks until the guard is available and grants exclusive access to the handle.
     *
     * @return the held access, to be closed on every exit path
     * @throws IllegalStateException if the current thread already holds the guard
     */
    ScopedAccess acquire() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Exclusive access is not reentrant, the current thread already holds it");
        }
        lock.lock();
        return new ScopedAccess();
    }

    /**
     * @return {@code true} if some thread currently holds the guard
     */
    boolean isHeld() {
        return lock.isLocked();
    }

    /**
     * @return an estimate of the number of threads waiting for the guard
     */
    int getQueueLength() {
        return lock.getQueueLength();
    }

    /**
     * A held grant of exclusive access, released by {@link #close()}.
     */
    final class ScopedAccess implements AutoCloseable {

        private boolean released;

        private ScopedAccess() {}

        /**
         * @return the guarded handle
         * @throws IllegalStateException if this access was already released
         */
        RasterHandle handle() {
            if (released) {
                throw new IllegalStateException("Exclusive access already released");
            }
            return handle;
        }

        /**
         * Releases the guard. Calling it more than once has no effect.
         */
        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
