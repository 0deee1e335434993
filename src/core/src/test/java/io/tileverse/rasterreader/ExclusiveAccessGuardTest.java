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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.tileverse.rasterreader.ExclusiveAccessGuard.ScopedAccess;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExclusiveAccessGuardTest {

    private SyntheticRasterHandle handle;
    private ExclusiveAccessGuard guard;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        handle = new SyntheticRasterHandle("guarded.tif");
        guard = new ExclusiveAccessGuard(handle);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testAcquireGrantsHandle() {
        try (ScopedAccess access = guard.acquire()) {
            assertSame(handle, access.handle());
            assertThat(guard.isHeld()).isTrue();
        }
        assertThat(guard.isHeld()).isFalse();
    }

    @Test
    void testHandleUnreachableAfterRelease() {
        ScopedAccess access = guard.acquire();
        access.close();
        assertThrows(IllegalStateException.class, access::handle);
    }

    @Test
    void testReleaseIsIdempotent() {
        ScopedAccess access = guard.acquire();
        access.close();
        access.close();
        assertThat(guard.isHeld()).isFalse();

        // still usable afterwards
        try (ScopedAccess again = guard.acquire()) {
            assertSame(handle, again.handle());
        }
    }

    @Test
    void testReentrantAcquireFailsFast() {
        try (ScopedAccess access = guard.acquire()) {
            assertThrows(IllegalStateException.class, guard::acquire);
            // the failed attempt doesn't release the held access
            assertThat(guard.isHeld()).isTrue();
            assertSame(handle, access.handle());
        }
    }

    @Test
    void testConcurrentAcquireBlocksUntilRelease() throws Exception {
        AtomicBoolean acquiredByOther = new AtomicBoolean();
        CompletableFuture<Void> other;
        try (ScopedAccess access = guard.acquire()) {
            other = CompletableFuture.runAsync(
                    () -> {
                        try (ScopedAccess mine = guard.acquire()) {
                            acquiredByOther.set(true);
                        }
                    },
                    executor);

            Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> guard.getQueueLength() == 1);
            assertThat(acquiredByOther).isFalse();
        }
        other.get(5, TimeUnit.SECONDS);
        assertThat(acquiredByOther).isTrue();
    }

    @Test
    void testInterruptedWaiterStillAcquires() throws Exception {
        AtomicBoolean interruptedInside = new AtomicBoolean();
        Thread waiter;
        try (ScopedAccess access = guard.acquire()) {
            waiter = new Thread(() -> {
                try (ScopedAccess mine = guard.acquire()) {
                    interruptedInside.set(Thread.currentThread().isInterrupted());
                }
            });
            waiter.start();
            Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> guard.getQueueLength() == 1);
            waiter.interrupt();
        }
        waiter.join(5_000);
        assertThat(waiter.isAlive()).isFalse();
        // the interrupt status is kept, the acquisition isn't abandoned
        assertThat(interruptedInside).isTrue();
        assertThat(guard.isHeld()).isFalse();
    }
}
