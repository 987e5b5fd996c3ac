/*
 [File Info]
 path: src/main/java/tech/robd/singleflight/diagnostics/DiagnosticsBackend.java
 description: Internal diagnostics sink that forwards to SLF4J (LocationAwareLogger when available).
              Global on/off switch via system property `singleflight.diag` and enable()/disable().
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Internal diagnostics sink that delegates to SLF4J.
 *
 * <p>Features:
 * <ul>
 *   <li>Global enable/disable via system property {@code singleflight.diag}
 *       (default {@code false}) and programmatic {@link #enable()}/{@link #disable()}.</li>
 *   <li>Per-owner {@link Logger} cache keyed by {@link Class}.</li>
 *   <li>Uses {@link LocationAwareLogger} when available to preserve caller location.</li>
 * </ul>
 */
final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    private static final String FQCN = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * System property to enable diagnostics: {@code -Dsingleflight.diag=true}.
     */
    static final String DIAGNOSTICS_PROPERTY_NAME = "singleflight.diag";

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(
                    System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim()
            );
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
        // no instances
    }

    // 🧩 Section: enablement
    static void enable() {
        enabled = true;
    }

    static void disable() {
        enabled = false;
    }

    static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: enablement]

    // 🧩 Section: emitters
    private static Logger logger(Class<?> owner) {
        return LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
    }

    static void debug(Class<?> owner, String msg, Object... args) {
        emit(owner, LocationAwareLogger.DEBUG_INT, msg, args);
    }

    static void warn(Class<?> owner, String msg, Object... args) {
        emit(owner, LocationAwareLogger.WARN_INT, msg, args);
    }

    static void error(Class<?> owner, String msg, Object... args) {
        emit(owner, LocationAwareLogger.ERROR_INT, msg, args);
    }

    private static void emit(Class<?> owner, int level, String msg, Object[] args) {
        if (!enabled) return; // fast path
        Logger log = logger(owner);
        // 🧩 Point: emitters/location-aware
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQCN, level, msg, args, null);
            return;
        }
        switch (level) {
            case LocationAwareLogger.ERROR_INT -> log.error(msg, args);
            case LocationAwareLogger.WARN_INT -> log.warn(msg, args);
            default -> log.debug(msg, args);
        }
    }
    // [/🧩 Section: emitters]
}
