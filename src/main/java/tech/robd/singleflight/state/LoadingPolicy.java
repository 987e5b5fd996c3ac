/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/state/LoadingPolicy.java
 description: Controls whether QueryState.when shows the previous outcome instead of loading
              while a query restarts.
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

package tech.robd.singleflight.state;

/**
 * Decides what {@link QueryState#when} shows while a query is running again after an earlier outcome.
 *
 * @param skipLoadingOnRestartAfterSuccess show the previous value instead of loading
 * @param skipLoadingOnRestartAfterFailure show the previous error instead of loading
 */
public record LoadingPolicy(boolean skipLoadingOnRestartAfterSuccess, boolean skipLoadingOnRestartAfterFailure) {

    /**
     * Loading is shown on restart after success; the previous error stays visible on restart after failure.
     */
    public static final LoadingPolicy DEFAULT = new LoadingPolicy(false, true);

    public static final LoadingPolicy ALWAYS_LOADING = new LoadingPolicy(false, false);

    public static final LoadingPolicy KEEP_PREVIOUS = new LoadingPolicy(true, true);
}
