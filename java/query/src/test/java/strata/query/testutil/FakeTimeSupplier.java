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
package strata.query.testutil;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * A clock for tests that only moves when told to.
 */
public class FakeTimeSupplier implements Supplier<Instant> {

    private Instant now;

    public FakeTimeSupplier(Instant start) {
        this.now = start;
    }

    public static FakeTimeSupplier startingAt(String isoInstant) {
        return new FakeTimeSupplier(Instant.parse(isoInstant));
    }

    @Override
    public synchronized Instant get() {
        return now;
    }

    public synchronized void advance(Duration duration) {
        now = now.plus(duration);
    }
}
