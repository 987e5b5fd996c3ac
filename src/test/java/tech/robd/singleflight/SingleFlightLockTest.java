/*
 [File Info]
 path: src/test/java/tech/robd/singleflight/SingleFlightLockTest.java
 description: Lock behavior: results, FIFO order, cancellation of predecessors before scheduling,
              mutual exclusion, queued bodies superseded before start, onCancel cleanup, async bodies.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.singleflight;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.singleflight.tools.CancellationAssertions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static tech.robd.singleflight.tools.TestAwaitUtils.*;

final class SingleFlightLockTest {

    private SingleFlightLock lock;

    @BeforeEach
    void setUp() {
        lock = new SingleFlightLock();
    }

    // 🧩 Section: basics

    @Test
    @Timeout(2)
    void returnsValueFromBody() {
        assertEquals(42, lock.submit(token -> 42).join());
    }

    @Test
    @Timeout(2)
    void sequentialAwaitedSubmissionsAllRun() {
        List<Integer> results = Collections.synchronizedList(new ArrayList<>());
        lock.submit(token -> results.add(1)).join();
        lock.submit(token -> results.add(2)).join();
        lock.submit(token -> results.add(3)).join();
        assertEquals(List.of(1, 2, 3), results);
    }

    @Test
    @Timeout(2)
    void bodyErrorFailsItsFutureUnchanged() {
        IllegalStateException error = new IllegalStateException("test error");
        CancellationAssertions.expectSameFailure(error, lock.submit(token -> {
            throw error;
        }));
    }

    @Test
    @Timeout(2)
    void activeTokenIsReleasedOnceBodySettles() {
        lock.submit(token -> "done").join();
        awaitTrue(() -> lock.activeToken() == null, 500, "token still active after completion");
    }
    // [/🧩 Section: basics]

    // 🧩 Section: cancellation

    @Test
    @Timeout(2)
        // 50ms body then 10ms body, 5ms apart; only the second effect survives.
    void onlyLatestSubmissionEffectSurvives() {
        AtomicInteger completedCount = new AtomicInteger();
        AtomicReference<String> value = new AtomicReference<>();

        CompletableFuture<Void> first = lock.submit(token -> {
            Thread.sleep(50);
            token.guard();
            completedCount.incrementAndGet();
            value.set("first");
            return null;
        });
        sleepQuietly(5);
        CompletableFuture<Void> second = lock.submit(token -> {
            Thread.sleep(10);
            token.guard();
            completedCount.incrementAndGet();
            value.set("second");
            return null;
        });

        second.join();
        CancellationAssertions.expectCancelled(first);
        assertEquals(1, completedCount.get());
        assertEquals("second", value.get());
    }

    @Test
    @Timeout(2)
    void submitCancelsPredecessorSynchronously() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<CancellationToken> firstToken = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);

        CompletableFuture<Void> first = lock.submit(token -> {
            firstToken.set(token);
            started.countDown();
            release.await();
            return null;
        });
        awaitLatch(started, 500, "first body never started");
        assertFalse(firstToken.get().isCancelled());

        CompletableFuture<String> second = lock.submit(token -> "second");
        // Flipped before submit returned, while the first body still holds the lock
        assertTrue(firstToken.get().isCancelled());
        assertFalse(second.isDone(), "second body must wait for the first to finish");

        release.countDown();
        assertEquals("second", second.join());
        assertDoesNotThrow(first::join, "first body never checkpointed, so it completes normally");
    }

    @Test
    @Timeout(2)
    void predecessorIsCancelledBeforeSuccessorBodyStarts() {
        AtomicReference<CancellationToken> firstToken = new AtomicReference<>();
        AtomicBoolean observedCancelled = new AtomicBoolean();

        CompletableFuture<Void> first = lock.submit(token -> {
            firstToken.set(token);
            Thread.sleep(20);
            return null;
        });
        awaitTrue(() -> firstToken.get() != null, 500, "first body never started");
        lock.submit(token -> {
            observedCancelled.set(firstToken.get().isCancelled());
            return null;
        }).join();

        assertTrue(observedCancelled.get());
        assertTrue(first.isDone());
    }

    @Test
    @Timeout(2)
    void rapidSubmissionsOnlyLastCompletes() {
        List<Integer> completed = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 10; i++) {
            int n = i;
            futures.add(lock.submit(token -> {
                Thread.sleep(20);
                token.guard();
                completed.add(n);
                return null;
            }));
        }
        futures.get(9).join();

        assertEquals(List.of(9), completed);
        for (int i = 0; i < 9; i++) {
            CancellationAssertions.expectCancelled(futures.get(i));
        }
    }

    @Test
    @Timeout(2)
    void queuedBodySupersededBeforeStartNeverRuns() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean middleRan = new AtomicBoolean();

        lock.submit(token -> {
            release.await();
            return null;
        });
        CompletableFuture<Void> middle = lock.submit(token -> {
            middleRan.set(true);
            return null;
        });
        CompletableFuture<String> last = lock.submit(token -> "last");

        release.countDown();
        assertEquals("last", last.join());
        CancellationAssertions.expectCancelled(middle);
        assertFalse(middleRan.get());
    }

    @Test
    @Timeout(2)
    void bodiesWithoutCheckpointsRunToCompletionOneAtATime() {
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch firstStarted = new CountDownLatch(1);

        CompletableFuture<String> first = lock.submit(token -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            firstStarted.countDown();
            Thread.sleep(30);
            concurrent.decrementAndGet();
            return "first";
        });
        awaitLatch(firstStarted, 500, "first body never started");
        CompletableFuture<String> second = lock.submit(token -> {
            maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            Thread.sleep(10);
            concurrent.decrementAndGet();
            return "second";
        });

        assertEquals("second", second.join());
        assertEquals("first", first.join());
        assertEquals(1, maxConcurrent.get());
    }

    @Test
    @Timeout(2)
    void exclusionHoldsOnMultiThreadedExecutor() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            SingleFlightLock pooled = new SingleFlightLock(pool);
            AtomicInteger concurrent = new AtomicInteger();
            AtomicInteger maxConcurrent = new AtomicInteger();
            CompletableFuture<Integer> last = null;

            for (int i = 0; i < 5; i++) {
                int n = i;
                last = pooled.submit(token -> {
                    maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                    Thread.sleep(5);
                    concurrent.decrementAndGet();
                    return n;
                });
            }

            assertEquals(4, last.join());
            assertEquals(1, maxConcurrent.get());
        } finally {
            pool.shutdownNow();
            assertTrue(pool.awaitTermination(1, TimeUnit.SECONDS));
        }
    }
    // [/🧩 Section: cancellation]

    // 🧩 Section: on-cancel

    @Test
    @Timeout(2)
    void onCancelCallbacksRunInOrderWhenSuperseded() {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch registered = new CountDownLatch(1);

        lock.submit(token -> {
            token.onCancel(() -> order.add(1));
            token.onCancel(() -> order.add(2));
            token.onCancel(() -> order.add(3));
            registered.countDown();
            Thread.sleep(50);
            token.guard();
            return null;
        });
        awaitLatch(registered, 500, "callbacks never registered");

        lock.submit(token -> null);
        // Fired synchronously by submit
        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    @Timeout(2)
    void throwingCallbackIsIsolated() {
        AtomicBoolean secondRan = new AtomicBoolean();
        CountDownLatch registered = new CountDownLatch(1);

        lock.submit(token -> {
            token.onCancel(() -> {
                throw new IllegalStateException("callback error");
            });
            token.onCancel(() -> secondRan.set(true));
            registered.countDown();
            Thread.sleep(50);
            return null;
        });
        awaitLatch(registered, 500, "callbacks never registered");

        assertDoesNotThrow(() -> lock.submit(token -> null).join());
        assertTrue(secondRan.get());
    }

    @Test
    @Timeout(2)
    void callbackNotRunWhenBodyCompletesNormally() {
        AtomicBoolean ran = new AtomicBoolean();
        lock.submit(token -> {
            token.onCancel(() -> ran.set(true));
            return null;
        }).join();

        lock.submit(token -> null).join();
        assertFalse(ran.get());
    }

    @Test
    @Timeout(2)
    void lateRegistrationOnSupersededTokenStillRuns() {
        CountDownLatch superseded = new CountDownLatch(1);
        AtomicBoolean lateRan = new AtomicBoolean();

        CompletableFuture<Void> first = lock.submit(token -> {
            superseded.await();
            token.onCancel(() -> lateRan.set(true));
            return null;
        });
        CompletableFuture<Void> second = lock.submit(token -> null);
        superseded.countDown();

        first.join();
        second.join();
        assertTrue(lateRan.get());
    }
    // [/🧩 Section: on-cancel]

    // 🧩 Section: async-bodies

    @Test
    @Timeout(2)
    void asyncBodyHoldsLockUntilStageSettles() {
        CompletableFuture<String> external = new CompletableFuture<>();
        AtomicBoolean secondStarted = new AtomicBoolean();

        CompletableFuture<String> first = lock.submitAsync(token -> external);
        CompletableFuture<String> second = lock.submitAsync(token -> {
            secondStarted.set(true);
            return CompletableFuture.completedFuture("second");
        });

        sleepQuietly(30);
        assertFalse(secondStarted.get());

        external.complete("first");
        assertEquals("first", first.join());
        assertEquals("second", second.join());
    }

    @Test
    @Timeout(2)
    void waitAndAwaitInsideBody() {
        int result = lock.submit(token -> {
            int a = token.wait(() -> 10);
            int b = token.await(CompletableFuture.supplyAsync(() -> 20));
            return a + b;
        }).join();
        assertEquals(30, result);
    }

    @Test
    @Timeout(2)
    void rejectedExecutionSettlesAsCancelled() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        pool.shutdown();
        SingleFlightLock closed = new SingleFlightLock(pool);

        CancellationAssertions.expectCancelled(closed.submit(token -> "never"));
    }

    @Test
    void nullBodyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> lock.submit(null));
        assertThrows(IllegalArgumentException.class, () -> lock.submitAsync(null));
    }
    // [/🧩 Section: async-bodies]
}
