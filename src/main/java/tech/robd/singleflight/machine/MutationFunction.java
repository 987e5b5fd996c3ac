/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/machine/MutationFunction.java
 description: Functional interface for the argument-taking body of a Mutation.
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

@FunctionalInterface
public interface MutationFunction<R extends @Nullable Object, A extends @Nullable Object> {

    // 🧩 Section: api

    /**
     * @param args  the arguments given to {@code run}/{@code retry}
     * @param token the token of this run; checkpoint it or register {@code onCancel} cleanup
     * @return the mutation's result
     * @throws Exception recorded as {@code MutationState.Failed}, except
     *                   {@link tech.robd.singleflight.CancelledException}
     */
    @Nullable
    R apply(A args, @NonNull CancellationToken token) throws Exception;
    // [/🧩 Section: api]
}
