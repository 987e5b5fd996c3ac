/*
 [File Info]
 path: src/test/java/tech/robd/singleflight/machine/MutationTest.java
 description: Mutation behavior: idle start, run/retry transitions, InvalidRetry, rapid runAndAwait
              cancellation, domain errors delivered unchanged, superseded values never shown.
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

package tech.robd.singleflight.machine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.singleflight.InvalidRetryException;
import tech.robd.singleflight.state.MutationState;
import tech.robd.singleflight.tools.CancellationAssertions;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static tech.robd.singleflight.tools.TestAwaitUtils.*;

final class MutationTest {

    private Mutation<Integer, Integer> mutation;

    @AfterEach
    void tearDown() {
        if (mutation != null) mutation.dispose();
    }

    private static Mutation<Integer, Integer> doubling() {
        return new Mutation<>((args, token) -> args * 2);
    }

    @Test
    void startsIdle() {
        mutation = doubling();
        assertTrue(mutation.state().isIdle());
        assertNull(mutation.lastArgs());
    }

    @Test
    @Timeout(2)
    void runMovesThroughRunningToCompleted() {
        mutation = doubling();
        List<MutationState<Integer>> seen = new CopyOnWriteArrayList<>();
        mutation.addListener(seen::add);

        mutation.run(5);
        awaitTrue(() -> mutation.state().hasValue(), 1_000, "mutation never completed");

        assertEquals(List.of(new MutationState.Running<Integer>(), new MutationState.Completed<>(10)), seen);
        assertEquals(5, mutation.lastArgs());
    }

    @Test
    @Timeout(2)
    void retryRerunsWithLastArguments() {
        AtomicInteger calls = new AtomicInteger();
        mutation = new Mutation<>((args, token) -> {
            calls.incrementAndGet();
            return args * 2;
        });

        assertEquals(10, mutation.runAndAwait(5).join());
        mutation.retry();
        awaitTrue(() -> calls.get() == 2 && mutation.state().hasValue(), 1_000, "retry never completed");

        assertEquals(new MutationState.Completed<>(10), mutation.state());
        assertEquals(10, mutation.retryAndAwait().join());
        assertEquals(3, calls.get());
    }

    @Test
    void retryBeforeRunIsInvalid() {
        mutation = doubling();
        assertThrows(InvalidRetryException.class, mutation::retry);
        CancellationAssertions.expectFailure(InvalidRetryException.class, mutation.retryAndAwait());
        assertTrue(mutation.state().isIdle());
    }

    @Test
    @Timeout(2)
    void retryWorksWithNullArguments() {
        Mutation<String, String> echo = new Mutation<>((args, token) -> "got " + args);
        try {
            assertEquals("got null", echo.runAndAwait(null).join());
            assertEquals("got null", echo.retryAndAwait().join());
        } finally {
            echo.dispose();
        }
    }

    @Test
    @Timeout(3)
        // Three rapid awaits on a 50ms body: the first two are superseded, the third wins.
    void rapidRunAndAwaitOnlyLastResolvesWithValue() {
        mutation = new Mutation<>((args, token) -> {
            Thread.sleep(50);
            return args * 2;
        });

        CompletableFuture<Integer> first = mutation.runAndAwait(1);
        CompletableFuture<Integer> second = mutation.runAndAwait(2);
        CompletableFuture<Integer> third = mutation.runAndAwait(3);

        assertEquals(6, third.join());
        CancellationAssertions.expectCancelled(first);
        CancellationAssertions.expectCancelled(second);
        assertEquals(new MutationState.Completed<>(6), mutation.state());
    }

    @Test
    @Timeout(2)
    void domainErrorIsRecordedAndDeliveredUnchanged() {
        IllegalArgumentException error = new IllegalArgumentException("negative");
        mutation = new Mutation<>((args, token) -> {
            if (args < 0) throw error;
            return args;
        });

        CancellationAssertions.expectSameFailure(error, mutation.runAndAwait(-1));
        assertTrue(mutation.state().hasFailed());
        assertSame(error, mutation.state().error());
        assertArrayEquals(error.getStackTrace(), mutation.state().stackTrace());
    }

    @Test
    @Timeout(2)
    void errorThrownByFunctionIsRecordedAsFailed() {
        AssertionError error = new AssertionError("boom");
        mutation = new Mutation<>((args, token) -> {
            throw error;
        });

        CancellationAssertions.expectSameFailure(error, mutation.runAndAwait(1));
        assertTrue(mutation.state().hasFailed(), "state left at " + mutation.state());
        assertSame(error, mutation.state().error());
        assertFalse(mutation.state().isLoading());
    }

    @Test
    @Timeout(2)
    void supersededValueIsNeverObserved() {
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        mutation = new Mutation<>((args, token) -> {
            if (args == 1) {
                firstEntered.countDown();
                releaseFirst.await();
            }
            return args * 100;
        });
        List<MutationState<Integer>> seen = new CopyOnWriteArrayList<>();
        mutation.addListener(seen::add);

        CompletableFuture<Integer> first = mutation.runAndAwait(1);
        awaitLatch(firstEntered, 500, "first run never started");
        CompletableFuture<Integer> second = mutation.runAndAwait(2);
        releaseFirst.countDown();

        assertEquals(200, second.join());
        CancellationAssertions.expectCancelled(first);
        assertFalse(seen.contains(new MutationState.Completed<>(100)), "superseded value leaked: " + seen);
        assertEquals(new MutationState.Completed<>(200), seen.get(seen.size() - 1));
    }

    @Test
    @Timeout(2)
    void supersededRunGetsOnCancelCallback() {
        AtomicBoolean aborted = new AtomicBoolean();
        CountDownLatch entered = new CountDownLatch(1);
        mutation = new Mutation<>((args, token) -> {
            if (args == 1) {
                CountDownLatch hold = new CountDownLatch(1);
                token.onCancel(() -> {
                    aborted.set(true);
                    hold.countDown();
                });
                entered.countDown();
                hold.await();
                token.guard();
            }
            return args;
        });

        CompletableFuture<Integer> first = mutation.runAndAwait(1);
        awaitLatch(entered, 500, "first run never started");
        assertEquals(2, mutation.runAndAwait(2).join());

        assertTrue(aborted.get());
        CancellationAssertions.expectCancelled(first);
    }
}
