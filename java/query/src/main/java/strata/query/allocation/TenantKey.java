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

import strata.core.tenant.TenantContext;

import java.util.List;

/**
 * Identifies the tenant an allocation policy tracks quota for, as the values of the tenant dimensions the policy
 * requires, in the order the policy declares them.
 *
 * @param values the dimension values
 */
public record TenantKey(List<String> values) {

    public TenantKey {
        values = List.copyOf(values);
    }

    /**
     * Reads the key from a tenant context.
     *
     * @param  tenant                   the tenant context
     * @param  dimensions               the dimensions the policy requires
     * @return                          the key
     * @throws IllegalArgumentException if any dimension is missing
     */
    public static TenantKey from(TenantContext tenant, List<String> dimensions) {
        return new TenantKey(dimensions.stream()
                .map(dimension -> tenant.get(dimension).orElseThrow(() -> new IllegalArgumentException(
                        "Tenant dimension " + dimension + " not set in " + tenant)))
                .toList());
    }

    @Override
    public String toString() {
        return String.join(",", values);
    }
}
