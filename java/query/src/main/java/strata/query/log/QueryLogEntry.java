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
package strata.query.log;

import strata.core.tenant.TenantContext;
import strata.query.allocation.QuotaAllowanceSummary;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A record of one request, whether or not it reached the backend.
 */
public class QueryLogEntry {

    private final String requestId;
    private final String datasetKey;
    private final TenantContext tenant;
    private final QueryStatus status;
    private final Instant startTime;
    private final Duration duration;
    private final String sql;
    private final Map<String, Object> settings;
    private final QuotaAllowanceSummary quotaAllowance;
    private final long bytesScanned;
    private final String errorMessage;

    private QueryLogEntry(Builder builder) {
        requestId = Objects.requireNonNull(builder.requestId, "requestId must not be null");
        datasetKey = builder.datasetKey;
        tenant = Objects.requireNonNull(builder.tenant, "tenant must not be null");
        status = Objects.requireNonNull(builder.status, "status must not be null");
        startTime = builder.startTime;
        duration = builder.duration;
        sql = builder.sql;
        settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
        quotaAllowance = builder.quotaAllowance;
        bytesScanned = builder.bytesScanned;
        errorMessage = builder.errorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRequestId() {
        return requestId;
    }

    public String getDatasetKey() {
        return datasetKey;
    }

    public TenantContext getTenant() {
        return tenant;
    }

    public QueryStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getDuration() {
        return duration;
    }

    public Optional<String> getSql() {
        return Optional.ofNullable(sql);
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public Optional<QuotaAllowanceSummary> getQuotaAllowance() {
        return Optional.ofNullable(quotaAllowance);
    }

    public long getBytesScanned() {
        return bytesScanned;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "QueryLogEntry{" +
                "requestId='" + requestId + '\'' +
                ", datasetKey='" + datasetKey + '\'' +
                ", tenant=" + tenant +
                ", status=" + status +
                ", startTime=" + startTime +
                ", duration=" + duration +
                ", sql='" + sql + '\'' +
                ", settings=" + settings +
                ", quotaAllowance=" + quotaAllowance +
                ", bytesScanned=" + bytesScanned +
                ", errorMessage='" + errorMessage + '\'' +
                '}';
    }

    /**
     * Builds a query log entry.
     */
    public static final class Builder {
        private String requestId;
        private String datasetKey;
        private TenantContext tenant;
        private QueryStatus status;
        private Instant startTime;
        private Duration duration = Duration.ZERO;
        private String sql;
        private Map<String, Object> settings = Map.of();
        private QuotaAllowanceSummary quotaAllowance;
        private long bytesScanned;
        private String errorMessage;

        private Builder() {
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder datasetKey(String datasetKey) {
            this.datasetKey = datasetKey;
            return this;
        }

        public Builder tenant(TenantContext tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder status(QueryStatus status) {
            this.status = status;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder sql(String sql) {
            this.sql = sql;
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings = settings;
            return this;
        }

        public Builder quotaAllowance(QuotaAllowanceSummary quotaAllowance) {
            this.quotaAllowance = quotaAllowance;
            return this;
        }

        public Builder bytesScanned(long bytesScanned) {
            this.bytesScanned = bytesScanned;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public QueryLogEntry build() {
            return new QueryLogEntry(this);
        }
    }
}
