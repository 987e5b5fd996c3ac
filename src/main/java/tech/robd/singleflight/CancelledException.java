/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/CancelledException.java
 description: Thrown at a checkpoint when the token of the running task has been superseded.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

import java.util.concurrent.CancellationException;

/**
 * Raised by {@link CancellationToken#guard()} and {@link CancellationToken#wait(ThrowingSupplier)}
 * once a newer submission has cancelled the token.
 *
 * <p>State machines never record this as a failure; an awaiting future is settled with it instead.
 * Being a {@link CancellationException}, a {@link java.util.concurrent.CompletableFuture} completed
 * with it reports {@code isCancelled() == true}.</p>
 */
public class CancelledException extends CancellationException {

    public static final String TASK_WAS_CANCELLED = "Task was cancelled";

    public CancelledException() {
        super(TASK_WAS_CANCELLED);
    }

    public CancelledException(String message) {
        super(message);
    }
}
