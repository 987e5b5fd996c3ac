/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/LockedTask.java
 description: Functional interface for a blocking task body run under a SingleFlightLock.
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

@FunctionalInterface
public interface LockedTask<R extends @Nullable Object> {

    // 🧩 Section: api

    /**
     * Runs this body on the lock's executor while it holds the lock.
     *
     * @param token the non-null token of this submission; check it at checkpoints
     * @return the computed result, which may be {@code null}
     * @throws Exception if the body fails. {@link CancelledException} signals that the body
     *                   noticed it was superseded.
     */
    @Nullable
    R run(@NonNull CancellationToken token) throws Exception;
    // [/🧩 Section: api]
}
