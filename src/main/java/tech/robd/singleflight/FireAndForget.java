/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/FireAndForget.java
 description: Explicit call-site wrapper that discards a future's outcome, logging failures at debug.
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

import tech.robd.singleflight.diagnostics.Diagnostics;

import java.util.concurrent.CompletionStage;

/**
 * Marks a future as intentionally unobserved.
 *
 * <p>Used where a result is not wanted: fire-and-forget {@code run}/{@code retry}/{@code restart}
 * calls and futures abandoned by a cancelled submission. The failure is consumed here, at the
 * call site, and only shows up in diagnostics.</p>
 */
public final class FireAndForget {

    private static final Diagnostics DIAG = Diagnostics.of(FireAndForget.class);

    private FireAndForget() {
    }

    /**
     * @param stage the stage whose outcome is discarded
     * @param label short description used in the diagnostics line
     */
    public static void ignore(CompletionStage<?> stage, String label) {
        if (stage == null) throw new IllegalArgumentException("stage == null");
        stage.whenComplete((value, error) -> {
            if (error != null) {
                DIAG.debug("{} ignored outcome: {}", label, error.toString());
            }
        });
    }
}
