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
package strata.query.router;

import strata.core.tenant.TenantContext;
import strata.query.model.Query;

import java.util.Objects;
import java.util.Optional;

/**
 * A request to run a query against a dataset on behalf of a tenant.
 */
public class QueryRequest {

    private final String requestId;
    private final Query query;
    private final TenantContext tenant;
    private final long estimatedBytesScanned;
    private final String settingsPrefix;
    private final boolean async;

    private QueryRequest(Builder builder) {
        requestId = builder.requestId;
        query = Objects.requireNonNull(builder.query, "query must not be null");
        tenant = Objects.requireNonNull(builder.tenant, "tenant must not be null");
        estimatedBytesScanned = builder.estimatedBytesScanned;
        settingsPrefix = builder.settingsPrefix;
        async = builder.async;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getRequestId() {
        return Optional.ofNullable(requestId);
    }

    public Query getQuery() {
        return query;
    }

    public String getDatasetKey() {
        return query.getDatasetKey();
    }

    public TenantContext getTenant() {
        return tenant;
    }

    public long getEstimatedBytesScanned() {
        return estimatedBytesScanned;
    }

    public Optional<String> getSettingsPrefix() {
        return Optional.ofNullable(settingsPrefix);
    }

    public boolean isAsync() {
        return async;
    }

    @Override
    public String toString() {
        return "QueryRequest{requestId='" + requestId + "', query=" + query + ", tenant=" + tenant
                + ", estimatedBytesScanned=" + estimatedBytesScanned + ", settingsPrefix='" + settingsPrefix
                + "', async=" + async + '}';
    }

    /**
     * Builds a query request.
     */
    public static final class Builder {
        private String requestId;
        private Query query;
        private TenantContext tenant = TenantContext.none();
        private long estimatedBytesScanned;
        private String settingsPrefix;
        private boolean async;

        private Builder() {
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder query(Query query) {
            this.query = query;
            return this;
        }

        public Builder tenant(TenantContext tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder estimatedBytesScanned(long estimatedBytesScanned) {
            this.estimatedBytesScanned = estimatedBytesScanned;
            return this;
        }

        public Builder settingsPrefix(String settingsPrefix) {
            this.settingsPrefix = settingsPrefix;
            return this;
        }

        public Builder async(boolean async) {
            this.async = async;
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }
    }
}
