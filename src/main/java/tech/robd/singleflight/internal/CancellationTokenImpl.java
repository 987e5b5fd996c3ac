/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/internal/CancellationTokenImpl.java
 description: Default CancellationToken: atomic flag, FIFO at-most-once cleanup callbacks with
              per-callback isolation, and release of callbacks once the owning task settles.
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

package tech.robd.singleflight.internal;

import tech.robd.singleflight.CancellationToken;
import tech.robd.singleflight.CancelledException;
import tech.robd.singleflight.diagnostics.Diagnostics;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default implementation of {@link CancellationToken} using event-driven callbacks.
 *
 * <p>Callbacks are queued in registration order and each one runs at most once, either when
 * {@link #cancel()} fires them or immediately when registered on an already-cancelled token.
 * Once the owning task settles, {@link #markCompleted()} drops every pending callback so the
 * token stops retaining closures over the task's resources.</p>
 */
public final class CancellationTokenImpl implements CancellationToken {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CancellationTokenImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int tokId = System.identityHashCode(this);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean completed = new AtomicBoolean(false);

    // Callbacks are wrapped to guarantee at-most-once execution
    private final ConcurrentLinkedQueue<CallbackWrapper> callbacks = new ConcurrentLinkedQueue<>();
    // [/🧩 Section: state]

    // 🧩 Section: callback-wrapper
    private static final class CallbackWrapper {
        private final AtomicReference<Runnable> callbackRef;

        CallbackWrapper(Runnable callback) {
            this.callbackRef = new AtomicReference<>(callback);
        }

        void execute() {
            Runnable callback = callbackRef.getAndSet(null);
            if (callback != null) callback.run();
        }

        void clear() {
            callbackRef.set(null);
        }

        boolean isCleared() {
            return callbackRef.get() == null;
        }
    }
    // [/🧩 Section: callback-wrapper]

    // 🧩 Section: query
    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    public int id() {
        return tokId;
    }
    // [/🧩 Section: query]

    // 🧩 Section: checkpoints
    @Override
    public <T> T await(CompletionStage<T> stage) throws Exception {
        Objects.requireNonNull(stage, "Stage cannot be null");
        guard();

        CompletableFuture<T> view = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error != null) view.completeExceptionally(error);
            else view.complete(value);
        });

        T result;
        AutoCloseable registration = onCancel(() -> view.completeExceptionally(new CancelledException()));
        try {
            result = view.get();
        } catch (ExecutionException e) {
            throw asException(unwrap(e.getCause()));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted while awaiting");
        } finally {
            registration.close();
        }
        guard();
        return result;
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static Exception asException(Throwable t) {
        if (t instanceof Exception e) return e;
        if (t instanceof Error err) throw err;
        return new RuntimeException("Unexpected throwable", t);
    }
    // [/🧩 Section: checkpoints]

    // 🧩 Section: registration
    @Override
    public AutoCloseable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        CallbackWrapper wrapper = new CallbackWrapper(callback);

        if (cancelled.get()) {
            DIAG.debug("tok#{} onCancel: already cancelled -> run immediately", tokId);
            safeExecute(wrapper, "onCancel-immediate");
            return () -> {
            };
        }

        callbacks.offer(wrapper);

        // cancel() may have drained the queue between the check and the offer
        if (cancelled.get()) {
            if (callbacks.remove(wrapper)) {
                DIAG.debug("tok#{} onCancel: race -> run after registration", tokId);
                safeExecute(wrapper, "onCancel-race");
            }
        } else {
            DIAG.debug("tok#{} onCancel: registered (pending={})", tokId, callbacks.size());
        }

        return () -> {
            if (callbacks.remove(wrapper)) {
                wrapper.clear();
            }
        };
    }
    // [/🧩 Section: registration]

    // 🧩 Section: cancel
    @Override
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            DIAG.debug("tok#{} cancel: already cancelled", tokId);
            return false;
        }

        DIAG.debug("tok#{} cancel: firing callbacks={}", tokId, callbacks.size());

        CallbackWrapper wrapper;
        while ((wrapper = callbacks.poll()) != null) {
            safeExecute(wrapper, "cancel-callback");
        }
        return true;
    }
    // [/🧩 Section: cancel]

    // 🧩 Section: completion

    /**
     * Mark the owning task as settled. Pending callbacks are dropped without running;
     * a later {@link #cancel()} still flips the flag but has nothing left to fire.
     */
    public void markCompleted() {
        if (completed.compareAndSet(false, true)) {
            CallbackWrapper wrapper;
            while ((wrapper = callbacks.poll()) != null) {
                wrapper.clear();
            }
            DIAG.debug("tok#{} marked completed (cancelled={})", tokId, cancelled.get());
        }
    }

    public boolean isCompleted() {
        return completed.get();
    }
    // [/🧩 Section: completion]

    // 🧩 Section: maintenance
    private void safeExecute(CallbackWrapper wrapper, String where) {
        try {
            wrapper.execute();
        } catch (Throwable t) {
            DIAG.error("tok#{} callback error @{}: {}", tokId, where, t.toString());
        }
    }

    public int getPendingCallbackCount() {
        return (int) callbacks.stream().filter(w -> !w.isCleared()).count();
    }
    // [/🧩 Section: maintenance]

    // 🧩 Section: misc
    @Override
    public String toString() {
        if (cancelled.get()) {
            return "CancellationToken[CANCELLED, completed=" + completed.get() + "]";
        } else if (completed.get()) {
            return "CancellationToken[COMPLETED]";
        } else {
            return "CancellationToken[ACTIVE, callbacks=" + getPendingCallbackCount() + "]";
        }
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }
    // [/🧩 Section: misc]
}
