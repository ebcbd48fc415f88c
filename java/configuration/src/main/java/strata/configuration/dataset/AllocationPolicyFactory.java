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
package strata.configuration.dataset;

import strata.query.allocation.AllocationPolicy;
import strata.query.allocation.AllocationPolicyArgs;
import strata.query.allocation.policy.BytesScannedRejectingPolicy;
import strata.query.allocation.policy.ConcurrentRateLimitAllocationPolicy;
import strata.query.allocation.policy.ReferrerGuardRailPolicy;

import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Creates allocation policies by the names used in dataset configuration documents.
 */
public class AllocationPolicyFactory {

    public static final String REQUIRED_TENANT_TYPES = "required_tenant_types";
    public static final String DEFAULT_CONFIG_OVERRIDES = "default_config_overrides";

    private static final Map<String, Function<AllocationPolicyArgs, AllocationPolicy>> CONSTRUCTORS = Map.of(
            "ConcurrentRateLimitAllocationPolicy", ConcurrentRateLimitAllocationPolicy::new,
            "ReferrerGuardRailPolicy", ReferrerGuardRailPolicy::new,
            "BytesScannedRejectingPolicy", BytesScannedRejectingPolicy::new);

    private AllocationPolicyFactory() {
    }

    /**
     * Creates an allocation policy.
     *
     * @param  name                     the policy name
     * @param  args                     the arguments from the document
     * @param  baseArgs                 the arguments shared by every policy of the dataset
     * @return                          the policy
     * @throws IllegalArgumentException if the name is not recognised or the arguments are invalid
     */
    public static AllocationPolicy create(String name, Map<String, Object> args, AllocationPolicyArgs.Builder baseArgs) {
        Function<AllocationPolicyArgs, AllocationPolicy> constructor = CONSTRUCTORS.get(name);
        if (constructor == null) {
            throw new IllegalArgumentException("Unknown allocation policy " + name);
        }
        ConfigArgs configArgs = new ConfigArgs(name, args);
        return constructor.apply(baseArgs
                .requiredTenantTypes(configArgs.getStringList(REQUIRED_TENANT_TYPES))
                .defaultConfigOverrides(configArgs.getOptionalMap(DEFAULT_CONFIG_OVERRIDES).orElse(Map.of()))
                .build());
    }

    public static Set<String> getNames() {
        return CONSTRUCTORS.keySet();
    }
}
