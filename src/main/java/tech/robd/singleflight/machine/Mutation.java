/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/machine/Mutation.java
 description: Idle-until-run state machine over MutationState; remembers the last arguments for retry.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.singleflight.CancellationToken;
import tech.robd.singleflight.InvalidRetryException;
import tech.robd.singleflight.state.MutationState;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Observable action that starts {@linkplain MutationState.Idle idle} and runs only when given arguments.
 * Suited to form submissions and other user-triggered writes.
 *
 * <pre>{@code
 * Mutation<User, String> rename = new Mutation<>((name, token) -> api.rename(name));
 *
 * rename.run("John");
 * // after a failure:
 * rename.retry();          // runs again with "John"
 * }</pre>
 *
 * @param <R> result type
 * @param <A> argument type
 */
public final class Mutation<R extends @Nullable Object, A extends @Nullable Object>
        extends ObservableStateMachine<R, A, MutationState<R>> {

    private final MutationFunction<R, A> fn;
    private final Object argsMonitor = new Object();
    private boolean hasRun;
    private @Nullable A lastArgs;

    public Mutation(@NonNull MutationFunction<R, A> fn) {
        super(new MutationState.Idle<>());
        if (fn == null) throw new IllegalArgumentException("Mutation function cannot be null");
        this.fn = fn;
    }

    public Mutation(@NonNull MutationFunction<R, A> fn, @NonNull Executor executor) {
        super(new MutationState.Idle<>(), executor);
        if (fn == null) throw new IllegalArgumentException("Mutation function cannot be null");
        this.fn = fn;
    }

    // 🧩 Section: api

    /**
     * Run with {@code args}, remembering them for {@link #retry()}.
     */
    @Override
    public void run(A args) {
        remember(args);
        super.run(args);
    }

    @Override
    public CompletableFuture<R> runAndAwait(A args) {
        remember(args);
        return super.runAndAwait(args);
    }

    /**
     * Run again with the last arguments given to {@code run}.
     *
     * @throws InvalidRetryException if {@code run} has never been called
     */
    public void retry() {
        super.run(requireLastArgs());
    }

    /**
     * @return future of the retried run, or a future failed with {@link InvalidRetryException}
     * if {@code run} has never been called
     */
    public CompletableFuture<R> retryAndAwait() {
        A args;
        try {
            args = requireLastArgs();
        } catch (InvalidRetryException e) {
            return CompletableFuture.failedFuture(e);
        }
        return super.runAndAwait(args);
    }

    /**
     * @return the arguments of the last run, or {@code null} if never run
     */
    public @Nullable A lastArgs() {
        synchronized (argsMonitor) {
            return lastArgs;
        }
    }

    private void remember(A args) {
        synchronized (argsMonitor) {
            lastArgs = args;
            hasRun = true;
        }
    }

    private A requireLastArgs() {
        synchronized (argsMonitor) {
            if (!hasRun) {
                throw new InvalidRetryException("Unable to retry a mutation that has not been run yet");
            }
            return lastArgs;
        }
    }
    // [/🧩 Section: api]

    // 🧩 Section: builders
    @Override
    protected MutationState<R> buildRunning(MutationState<R> previous) {
        return new MutationState.Running<>(previous);
    }

    @Override
    protected MutationState<R> buildCompleted(MutationState<R> previous, R value) {
        return new MutationState.Completed<>(value, previous);
    }

    @Override
    protected MutationState<R> buildFailed(MutationState<R> previous, Throwable error) {
        return new MutationState.Failed<>(error, previous);
    }

    @Override
    protected R execute(A args, CancellationToken token) throws Exception {
        return fn.apply(args, token);
    }
    // [/🧩 Section: builders]
}
