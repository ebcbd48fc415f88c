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

import com.google.common.math.LongMath;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Sums amounts recorded over a sliding window of time. The window is split into a fixed number of buckets, so memory
 * use does not grow with the number of amounts recorded. Amounts leave the window one bucket at a time. Sums saturate
 * at the bounds of a long. Not thread safe.
 */
public class SlidingWindowCounter {

    private final long bucketMillis;
    private final long[] amounts;
    private final long[] bucketIndexes;

    public SlidingWindowCounter(Duration window, int buckets) {
        if (buckets < 1) {
            throw new IllegalArgumentException("Must have at least one bucket, found " + buckets);
        }
        this.bucketMillis = Math.max(1, window.toMillis() / buckets);
        this.amounts = new long[buckets];
        this.bucketIndexes = new long[buckets];
        Arrays.fill(bucketIndexes, Long.MIN_VALUE);
    }

    /**
     * Records an amount at a point in time.
     *
     * @param time   the time
     * @param amount the amount
     */
    public void add(Instant time, long amount) {
        long index = bucketIndex(time);
        int slot = slot(index);
        if (bucketIndexes[slot] != index) {
            bucketIndexes[slot] = index;
            amounts[slot] = 0;
        }
        amounts[slot] = LongMath.saturatedAdd(amounts[slot], amount);
    }

    /**
     * Sums the amounts recorded within the window ending at the given time.
     *
     * @param  now the end of the window
     * @return     the sum
     */
    public long sum(Instant now) {
        long current = bucketIndex(now);
        long sum = 0;
        for (int slot = 0; slot < amounts.length; slot++) {
            if (isInWindow(bucketIndexes[slot], current)) {
                sum = LongMath.saturatedAdd(sum, amounts[slot]);
            }
        }
        return sum;
    }

    /**
     * Finds how long until the oldest amount still in the window leaves it.
     *
     * @param  now the current time
     * @return     the time until the sum next drops, or zero if the window is empty
     */
    public Duration timeUntilOldestExpires(Instant now) {
        long current = bucketIndex(now);
        long oldest = Long.MAX_VALUE;
        for (int slot = 0; slot < amounts.length; slot++) {
            if (amounts[slot] != 0 && isInWindow(bucketIndexes[slot], current)) {
                oldest = Math.min(oldest, bucketIndexes[slot]);
            }
        }
        if (oldest == Long.MAX_VALUE) {
            return Duration.ZERO;
        }
        long expiresAtMillis = (oldest + amounts.length) * bucketMillis;
        return Duration.ofMillis(Math.max(0, expiresAtMillis - now.toEpochMilli()));
    }

    private boolean isInWindow(long bucketIndex, long current) {
        return bucketIndex != Long.MIN_VALUE && bucketIndex <= current && bucketIndex > current - amounts.length;
    }

    private long bucketIndex(Instant time) {
        return Math.floorDiv(time.toEpochMilli(), bucketMillis);
    }

    private int slot(long index) {
        return (int) Math.floorMod(index, (long) amounts.length);
    }
}
