/*
 * Copyright 2022-2025 Crown Copyright
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
package strata.core.dataset;

import java.util.Locale;

/**
 * How far a dataset has been rolled out. Used to decide which environments may query it.
 */
public enum ReadinessState {
    LIMITED, DEPRECATE, PARTIAL, COMPLETE, EXPERIMENTAL;

    /**
     * Reads a readiness state as written in a configuration document, e.g. "limited".
     *
     * @param  value the value in the document
     * @return       the readiness state
     */
    public static ReadinessState fromConfigValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Readiness state must be set");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown readiness state " + value, e);
        }
    }
}
