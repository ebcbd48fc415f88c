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

import strata.query.config.RuntimeConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Everything an allocation policy is created with when a dataset is loaded.
 */
public class AllocationPolicyArgs {

    public static final Duration DEFAULT_TENANT_IDLE_EXPIRY = Duration.ofMinutes(15);
    public static final long DEFAULT_MAX_TRACKED_TENANTS = 100_000;

    private final String datasetKey;
    private final List<String> requiredTenantTypes;
    private final Map<String, Object> defaultConfigOverrides;
    private final RuntimeConfig runtimeConfig;
    private final Supplier<Instant> timeSupplier;
    private final Duration tenantIdleExpiry;
    private final long maxTrackedTenants;

    private AllocationPolicyArgs(Builder builder) {
        datasetKey = Objects.requireNonNull(builder.datasetKey, "datasetKey must not be null");
        requiredTenantTypes = List.copyOf(builder.requiredTenantTypes);
        defaultConfigOverrides = Map.copyOf(builder.defaultConfigOverrides);
        runtimeConfig = Objects.requireNonNull(builder.runtimeConfig, "runtimeConfig must not be null");
        timeSupplier = Objects.requireNonNull(builder.timeSupplier, "timeSupplier must not be null");
        tenantIdleExpiry = builder.tenantIdleExpiry;
        maxTrackedTenants = builder.maxTrackedTenants;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDatasetKey() {
        return datasetKey;
    }

    public List<String> getRequiredTenantTypes() {
        return requiredTenantTypes;
    }

    public Map<String, Object> getDefaultConfigOverrides() {
        return defaultConfigOverrides;
    }

    public RuntimeConfig getRuntimeConfig() {
        return runtimeConfig;
    }

    public Supplier<Instant> getTimeSupplier() {
        return timeSupplier;
    }

    public Duration getTenantIdleExpiry() {
        return tenantIdleExpiry;
    }

    public long getMaxTrackedTenants() {
        return maxTrackedTenants;
    }

    /**
     * Builds the arguments for an allocation policy.
     */
    public static final class Builder {
        private String datasetKey;
        private List<String> requiredTenantTypes = List.of();
        private Map<String, Object> defaultConfigOverrides = Map.of();
        private RuntimeConfig runtimeConfig;
        private Supplier<Instant> timeSupplier = Instant::now;
        private Duration tenantIdleExpiry = DEFAULT_TENANT_IDLE_EXPIRY;
        private long maxTrackedTenants = DEFAULT_MAX_TRACKED_TENANTS;

        private Builder() {
        }

        public Builder datasetKey(String datasetKey) {
            this.datasetKey = datasetKey;
            return this;
        }

        public Builder requiredTenantTypes(List<String> requiredTenantTypes) {
            this.requiredTenantTypes = requiredTenantTypes;
            return this;
        }

        public Builder defaultConfigOverrides(Map<String, Object> defaultConfigOverrides) {
            this.defaultConfigOverrides = defaultConfigOverrides;
            return this;
        }

        public Builder runtimeConfig(RuntimeConfig runtimeConfig) {
            this.runtimeConfig = runtimeConfig;
            return this;
        }

        public Builder timeSupplier(Supplier<Instant> timeSupplier) {
            this.timeSupplier = timeSupplier;
            return this;
        }

        public Builder tenantIdleExpiry(Duration tenantIdleExpiry) {
            this.tenantIdleExpiry = tenantIdleExpiry;
            return this;
        }

        public Builder maxTrackedTenants(long maxTrackedTenants) {
            this.maxTrackedTenants = maxTrackedTenants;
            return this;
        }

        public AllocationPolicyArgs build() {
            return new AllocationPolicyArgs(this);
        }
    }
}
