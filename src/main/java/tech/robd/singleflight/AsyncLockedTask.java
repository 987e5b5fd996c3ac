/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/AsyncLockedTask.java
 description: Functional interface for a task body that returns a CompletionStage; the lock is
              held until the stage settles.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface AsyncLockedTask<R extends @Nullable Object> {

    // 🧩 Section: api

    /**
     * Starts this body. The lock is released only when the returned stage settles,
     * so the next submission cannot start before then.
     *
     * @param token the non-null token of this submission
     * @return a non-null stage producing the result
     * @throws Exception if the body fails before producing a stage
     */
    @NonNull
    CompletionStage<R> run(@NonNull CancellationToken token) throws Exception;
    // [/🧩 Section: api]
}
