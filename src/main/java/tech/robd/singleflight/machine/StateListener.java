/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/machine/StateListener.java
 description: Callback notified with each state a state machine settles into.
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

package tech.robd.singleflight.machine;

import org.jspecify.annotations.NonNull;

/**
 * Observer of an {@link ObservableStateMachine}. Called on the thread that performed the
 * write, which is usually the lock's executor thread; hand off to a UI thread as needed.
 *
 * @param <S> state type
 */
@FunctionalInterface
public interface StateListener<S> {
    void onStateChanged(@NonNull S state);
}
