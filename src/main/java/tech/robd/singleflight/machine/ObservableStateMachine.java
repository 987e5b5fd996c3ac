/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/machine/ObservableStateMachine.java
 description: Generic observable state machine driven by a SingleFlightLock: guarded state writes
              with one-level history, listeners, per-run awaitable results and idempotent disposal.
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
import tech.robd.singleflight.CancelledException;
import tech.robd.singleflight.DisposedException;
import tech.robd.singleflight.FireAndForget;
import tech.robd.singleflight.SingleFlightLock;
import tech.robd.singleflight.diagnostics.Diagnostics;
import tech.robd.singleflight.state.ObservedState;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Drives an observable {@link ObservedState} from a {@link SingleFlightLock}.
 *
 * <p>Each run submits a body to the lock that writes a running state, calls
 * {@link #execute(Object, CancellationToken)}, then writes a completed or failed state.
 * Subclasses supply the concrete variants through the {@code build*} methods.</p>
 *
 * <p>Guarantees:</p>
 * <ul>
 *   <li>Starting a run cancels the previous run's token; a cancelled run's writes are dropped,
 *       so only the latest run's outcome becomes visible.</li>
 *   <li>A {@link CancelledException} from the body is never recorded as a failure.</li>
 *   <li>History is one level deep: the outgoing state's own previous link is cleared before it
 *       becomes the previous state of the incoming one.</li>
 *   <li>The future returned by {@link #runAndAwait(Object)} settles exactly once, with the value,
 *       the domain error, {@link CancelledException} or {@link DisposedException}.</li>
 *   <li>After {@link #dispose()} nothing is written and new runs fail with {@link DisposedException}.</li>
 * </ul>
 *
 * @param <R> result type
 * @param <A> argument type ({@link Void} when there are none)
 * @param <S> state union
 */
public abstract class ObservableStateMachine<R extends @Nullable Object, A extends @Nullable Object,
        S extends ObservedState<R, S>> implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ObservableStateMachine.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int machineId = System.identityHashCode(this);
    private final SingleFlightLock lock;
    // Guards the cancelled/disposed check together with the assignment of state
    private final Object monitor = new Object();
    private final CopyOnWriteArrayList<StateListener<? super S>> listeners = new CopyOnWriteArrayList<>();
    private final Set<PendingResult<R, S>> pending = ConcurrentHashMap.newKeySet();

    private volatile @NonNull S state;
    private volatile boolean disposed;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    protected ObservableStateMachine(@NonNull S initialState) {
        this(initialState, new SingleFlightLock());
    }

    protected ObservableStateMachine(@NonNull S initialState, @NonNull Executor executor) {
        this(initialState, new SingleFlightLock(executor));
    }

    private ObservableStateMachine(@NonNull S initialState, @NonNull SingleFlightLock lock) {
        if (initialState == null) throw new IllegalArgumentException("Initial state cannot be null");
        this.state = initialState;
        this.lock = lock;
    }
    // [/🧩 Section: construction]

    // 🧩 Section: builders
    protected abstract @NonNull S buildRunning(@NonNull S previous);

    protected abstract @NonNull S buildCompleted(@NonNull S previous, R value);

    protected abstract @NonNull S buildFailed(@NonNull S previous, @NonNull Throwable error);

    /**
     * The work of one run. Called on the lock's executor while the lock is held.
     */
    protected abstract R execute(A args, @NonNull CancellationToken token) throws Exception;
    // [/🧩 Section: builders]

    // 🧩 Section: run

    /**
     * Start a run and discard its outcome; observe it through {@link #state()} or a listener.
     */
    public void run(A args) {
        FireAndForget.ignore(start(args), "sm#" + machineId + " run");
    }

    /**
     * Start a run and return a future of its outcome.
     *
     * @return future settled with the value, the domain error, {@link CancelledException} if a
     * newer run superseded this one, or {@link DisposedException} if the machine was disposed first
     */
    public CompletableFuture<R> runAndAwait(A args) {
        return start(args);
    }

    protected final CompletableFuture<R> start(A args) {
        synchronized (monitor) {
            if (disposed) {
                DIAG.debug("sm#{} run rejected: disposed", machineId);
                return CompletableFuture.failedFuture(new DisposedException(describe() + " was disposed"));
            }
            PendingResult<R, S> result = new PendingResult<>(pending);

            // 🧩 Point: run/submit
            // Submitting under the monitor makes the predecessor's cancellation atomic with its writes
            CompletableFuture<Void> submission = lock.submit(token -> {
                result.bind(token);
                body(args, token);
                return null;
            });
            submission.whenComplete((ignored, failure) -> result.submissionSettled(failure, disposed, describe()));
            return result.future();
        }
    }

    private void body(A args, CancellationToken token) throws Exception {
        token.guard();
        write(token, this::buildRunning);
        try {
            R value = token.wait(() -> execute(args, token));
            write(token, previous -> buildCompleted(previous, value));
        } catch (CancelledException ce) {
            DIAG.debug("sm#{} run cancelled", machineId);
            throw ce;
        } catch (Throwable t) {
            // Errors count as domain failures too, so the state never stays Running.
            DIAG.debug("sm#{} run failed: {}", machineId, t.toString());
            write(token, previous -> buildFailed(previous, t));
        }
    }
    // [/🧩 Section: run]

    // 🧩 Section: write
    private void write(CancellationToken token, UnaryOperator<S> builder) {
        S next;
        synchronized (monitor) {
            if (disposed || token.isCancelled()) {
                DIAG.debug("sm#{} write dropped (disposed={}, cancelled={})", machineId, disposed, token.isCancelled());
                return;
            }
            S outgoing = state;
            outgoing.clearPreviousState();
            next = builder.apply(outgoing);
            state = next;
        }
        DIAG.debug("sm#{} state -> {}", machineId, next);

        for (StateListener<? super S> listener : listeners) {
            try {
                listener.onStateChanged(next);
            } catch (Throwable t) {
                DIAG.error("sm#{} listener error: {}", machineId, t.toString());
            }
        }
        for (PendingResult<R, S> result : pending) {
            result.observe(token, next);
        }
    }
    // [/🧩 Section: write]

    // 🧩 Section: observation

    /**
     * @return the current state
     */
    public final @NonNull S state() {
        return state;
    }

    /**
     * @throws DisposedException if the machine has been disposed
     */
    public final void addListener(@NonNull StateListener<? super S> listener) {
        if (listener == null) throw new IllegalArgumentException("Listener cannot be null");
        if (disposed) throw new DisposedException(describe() + " was disposed");
        listeners.add(listener);
    }

    public final void removeListener(@NonNull StateListener<? super S> listener) {
        listeners.remove(listener);
    }
    // [/🧩 Section: observation]

    // 🧩 Section: lifecycle

    /**
     * Tear down. Idempotent. An in-flight body keeps running but its writes are dropped;
     * outstanding {@link #runAndAwait(Object)} futures fail with {@link DisposedException}.
     */
    public final void dispose() {
        synchronized (monitor) {
            if (disposed) return;
            disposed = true;
        }
        DIAG.debug("sm#{} disposed (pending={})", machineId, pending.size());
        listeners.clear();
        for (PendingResult<R, S> result : pending) {
            result.disposed(describe());
        }
    }

    public final boolean isDisposed() {
        return disposed;
    }

    @Override
    public final void close() {
        dispose();
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: misc
    private String describe() {
        return getClass().getSimpleName() + "#" + machineId;
    }

    @Override
    public String toString() {
        return describe() + "[" + state + (disposed ? ", DISPOSED" : "") + "]";
    }
    // [/🧩 Section: misc]
}
