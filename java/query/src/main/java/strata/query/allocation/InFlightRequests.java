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
package strata.query.allocation;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks the requests a tenant currently has running. A request that is never released is dropped once it has been
 * held for longer than the timeout. Not thread safe.
 */
public class InFlightRequests {

    private final Map<String, Instant> startTimeByRequestId = new LinkedHashMap<>();

    /**
     * Counts the requests running, after dropping any held for longer than the timeout.
     *
     * @param  now     the current time
     * @param  timeout how long a request may be held
     * @return         the number of requests running
     */
    public int count(Instant now, Duration timeout) {
        if (timeout.compareTo(Duration.between(Instant.MIN, now)) >= 0) {
            return startTimeByRequestId.size();
        }
        Instant cutoff = now.minus(timeout);
        Iterator<Instant> startTimes = startTimeByRequestId.values().iterator();
        while (startTimes.hasNext()) {
            if (startTimes.next().isBefore(cutoff)) {
                startTimes.remove();
            }
        }
        return startTimeByRequestId.size();
    }

    /**
     * Records that a request started.
     *
     * @param requestId the ID of the request
     * @param now       the current time
     */
    public void add(String requestId, Instant now) {
        startTimeByRequestId.put(requestId, now);
    }

    /**
     * Records that a request finished. Does nothing if the request is not held.
     *
     * @param requestId the ID of the request
     */
    public void remove(String requestId) {
        startTimeByRequestId.remove(requestId);
    }
}
