/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/diagnostics/ActiveD.java
 description: Active diagnostics instance; a record carrying the owner class whose logger is used.
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

package tech.robd.singleflight.diagnostics;

/**
 * Diagnostics instance that forwards every call to the backend under {@link #owner()}.
 * Obtained through {@link Diagnostics#of(Class)} while diagnostics are enabled.
 * The backend switch is still checked on every call.
 */
record ActiveD(Class<?> owner) implements Diagnostics {
}
