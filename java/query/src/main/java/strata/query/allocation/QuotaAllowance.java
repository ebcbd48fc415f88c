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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of an allocation policy assessing one request. Describes whether the request may run, how many threads
 * it may use, and how much of the tenant's quota is in use.
 */
public class QuotaAllowance {

    public static final long MAX_THRESHOLD = 1_000_000_000_000L;
    public static final String NO_UNITS = "no_units";
    public static final String NO_SUGGESTION = "no_suggestion";

    private final boolean canRun;
    private final long maxThreads;
    private final boolean throttled;
    private final long throttleThreshold;
    private final long rejectionThreshold;
    private final long quotaUsed;
    private final String quotaUnit;
    private final String suggestion;
    private final Map<String, Object> explanation;
    private final Duration retryAfter;

    private QuotaAllowance(Builder builder) {
        canRun = builder.canRun;
        maxThreads = builder.maxThreads;
        throttled = builder.throttled;
        throttleThreshold = builder.throttleThreshold;
        rejectionThreshold = builder.rejectionThreshold;
        quotaUsed = builder.quotaUsed;
        quotaUnit = Objects.requireNonNull(builder.quotaUnit, "quotaUnit must not be null");
        suggestion = Objects.requireNonNull(builder.suggestion, "suggestion must not be null");
        explanation = Collections.unmodifiableMap(new LinkedHashMap<>(builder.explanation));
        retryAfter = builder.retryAfter;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an allowance that lets a request run with no restriction beyond a number of threads.
     *
     * @param  maxThreads  the number of threads the request may use
     * @param  explanation why the request was not assessed further
     * @return             the allowance
     */
    public static QuotaAllowance unrestricted(long maxThreads, String explanation) {
        return builder().canRun(true).maxThreads(maxThreads)
                .explanation(Map.of("reason", explanation))
                .build();
    }

    public boolean canRun() {
        return canRun;
    }

    public long getMaxThreads() {
        return maxThreads;
    }

    public boolean isThrottled() {
        return throttled;
    }

    public long getThrottleThreshold() {
        return throttleThreshold;
    }

    public long getRejectionThreshold() {
        return rejectionThreshold;
    }

    public long getQuotaUsed() {
        return quotaUsed;
    }

    public String getQuotaUnit() {
        return quotaUnit;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public Map<String, Object> getExplanation() {
        return explanation;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * Describes this allowance for the query log.
     *
     * @return a map of the fields of the allowance
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("can_run", canRun);
        map.put("max_threads", maxThreads);
        map.put("is_throttled", throttled);
        map.put("throttle_threshold", throttleThreshold);
        map.put("rejection_threshold", rejectionThreshold);
        map.put("quota_used", quotaUsed);
        map.put("quota_unit", quotaUnit);
        map.put("suggestion", suggestion);
        map.put("explanation", explanation);
        if (retryAfter != null) {
            map.put("retry_after_ms", retryAfter.toMillis());
        }
        return map;
    }

    public Builder toBuilder() {
        return builder()
                .canRun(canRun)
                .maxThreads(maxThreads)
                .throttled(throttled)
                .throttleThreshold(throttleThreshold)
                .rejectionThreshold(rejectionThreshold)
                .quotaUsed(quotaUsed)
                .quotaUnit(quotaUnit)
                .suggestion(suggestion)
                .explanation(explanation)
                .retryAfter(retryAfter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuotaAllowance that = (QuotaAllowance) o;
        return canRun == that.canRun && maxThreads == that.maxThreads && throttled == that.throttled
                && throttleThreshold == that.throttleThreshold && rejectionThreshold == that.rejectionThreshold
                && quotaUsed == that.quotaUsed && Objects.equals(quotaUnit, that.quotaUnit)
                && Objects.equals(suggestion, that.suggestion) && Objects.equals(explanation, that.explanation)
                && Objects.equals(retryAfter, that.retryAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canRun, maxThreads, throttled, throttleThreshold, rejectionThreshold, quotaUsed,
                quotaUnit, suggestion, explanation, retryAfter);
    }

    @Override
    public String toString() {
        return "QuotaAllowance" + toMap();
    }

    /**
     * Builds a quota allowance.
     */
    public static final class Builder {
        private boolean canRun = true;
        private long maxThreads = 10;
        private boolean throttled;
        private long throttleThreshold = MAX_THRESHOLD;
        private long rejectionThreshold = MAX_THRESHOLD;
        private long quotaUsed;
        private String quotaUnit = NO_UNITS;
        private String suggestion = NO_SUGGESTION;
        private Map<String, Object> explanation = Map.of();
        private Duration retryAfter;

        private Builder() {
        }

        public Builder canRun(boolean canRun) {
            this.canRun = canRun;
            return this;
        }

        public Builder maxThreads(long maxThreads) {
            this.maxThreads = maxThreads;
            return this;
        }

        public Builder throttled(boolean throttled) {
            this.throttled = throttled;
            return this;
        }

        public Builder throttleThreshold(long throttleThreshold) {
            this.throttleThreshold = throttleThreshold;
            return this;
        }

        public Builder rejectionThreshold(long rejectionThreshold) {
            this.rejectionThreshold = rejectionThreshold;
            return this;
        }

        public Builder quotaUsed(long quotaUsed) {
            this.quotaUsed = quotaUsed;
            return this;
        }

        public Builder quotaUnit(String quotaUnit) {
            this.quotaUnit = quotaUnit;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Builder explanation(Map<String, Object> explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder retryAfter(Duration retryAfter) {
            this.retryAfter = retryAfter;
            return this;
        }

        public QuotaAllowance build() {
            return new QuotaAllowance(this);
        }
    }
}
