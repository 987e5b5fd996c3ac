/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/diagnostics/Diagnostics.java
 description: Lightweight diagnostics facade used by the lock, tokens and state machines.
              Instance methods forward to DiagnosticsBackend; factories pick active or no-op.
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

package tech.robd.singleflight.diagnostics;

/**
 * Minimal diagnostics/logging facade bound to an owning {@link Class}.
 * <p>
 * Every component of the library holds one of these as a {@code DIAG} constant and logs
 * through it with short id prefixes ({@code tok#}, {@code lock#}, {@code sm#}). Output is
 * routed to SLF4J only while diagnostics are enabled; {@link #of(Class)} resolves to a no-op
 * when they are off as the owner class loads.
 * Enable with {@code -Dsingleflight.diag=true} or {@link #enable()}.
 */
@FunctionalInterface
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * @return the owner class used to resolve the SLF4J logger
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    /**
     * Emit a debug message.
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    default void warn(String msg, Object... args) {
        DiagnosticsBackend.warn(owner(), msg, args);
    }

    /**
     * Emit an error message. Used for isolated callback failures that are never rethrown.
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Create a diagnostics instance for {@code owner}. If the backend is globally disabled,
     * returns a no-op to avoid overhead.
     *
     * @param owner the owning class (non-null)
     * @return active or no-op diagnostics depending on backend state
     */
    static Diagnostics of(Class<?> owner) {
        return DiagnosticsBackend.isEnabled() ? new ActiveD(owner) : NoOpD.INSTANCE;
    }
    // [/🧩 Section: factories]

    // 🧩 Section: enablement

    /**
     * Turn diagnostics on globally. Instances created earlier through {@link #of(Class)}
     * while disabled stay no-op.
     */
    static void enable() {
        DiagnosticsBackend.enable();
    }

    static void disable() {
        DiagnosticsBackend.disable();
    }

    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }
    // [/🧩 Section: enablement]
}
