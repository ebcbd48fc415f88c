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
package strata.query.backend;

import java.time.Duration;
import java.util.Objects;

/**
 * Statistics reported by the backend for a query it ran.
 *
 * @param bytesScanned the number of bytes read from storage
 * @param rowsRead     the number of rows read from storage
 * @param elapsed      the time the backend took
 */
public record QueryProfile(long bytesScanned, long rowsRead, Duration elapsed) {

    public QueryProfile {
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }
}
