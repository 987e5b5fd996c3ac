/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/machine/Query.java
 description: Auto-starting, argument-less state machine over QueryState; restart() supersedes the
              running fetch.
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
import tech.robd.singleflight.LockedTask;
import tech.robd.singleflight.state.QueryState;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Observable fetch that starts running as soon as it is created.
 *
 * <pre>{@code
 * Query<List<User>> users = new Query<>(token -> {
 *     HttpRequest req = ...;
 *     CompletableFuture<HttpResponse<String>> call = client.sendAsync(req, ofString());
 *     token.onCancel(() -> call.cancel(true));
 *     return parse(token.await(call).body());
 * });
 *
 * users.addListener(state -> render(state.when(
 *         list -> table(list),
 *         error -> banner(error),
 *         () -> spinner())));
 *
 * users.restart(); // refresh; a fetch still in flight is cancelled
 * }</pre>
 *
 * @param <R> result type
 */
public final class Query<R extends @Nullable Object> extends ObservableStateMachine<R, Void, QueryState<R>> {

    private final LockedTask<R> fn;

    public Query(@NonNull LockedTask<R> fn) {
        super(new QueryState.Running<>());
        if (fn == null) throw new IllegalArgumentException("Query function cannot be null");
        this.fn = fn;
        restart();
    }

    public Query(@NonNull LockedTask<R> fn, @NonNull Executor executor) {
        super(new QueryState.Running<>(), executor);
        if (fn == null) throw new IllegalArgumentException("Query function cannot be null");
        this.fn = fn;
        restart();
    }

    // 🧩 Section: api

    /**
     * Fetch again, cancelling the fetch in flight.
     */
    public void restart() {
        run(null);
    }

    public CompletableFuture<R> restartAndAwait() {
        return runAndAwait(null);
    }
    // [/🧩 Section: api]

    // 🧩 Section: builders
    @Override
    protected QueryState<R> buildRunning(QueryState<R> previous) {
        return new QueryState.Running<>(previous);
    }

    @Override
    protected QueryState<R> buildCompleted(QueryState<R> previous, R value) {
        return new QueryState.Completed<>(value, previous);
    }

    @Override
    protected QueryState<R> buildFailed(QueryState<R> previous, Throwable error) {
        return new QueryState.Failed<>(error, previous);
    }

    @Override
    protected R execute(Void args, CancellationToken token) throws Exception {
        return fn.run(token);
    }
    // [/🧩 Section: builders]
}
