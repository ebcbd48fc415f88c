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

import java.util.Map;

/**
 * The current value of a config of an allocation policy, for administration.
 *
 * @param definition the config this is a value of
 * @param params     the parameter values this value is set for, empty if the config is not parameterised
 * @param value      the current value
 */
public record AllocationPolicyConfigValue(AllocationPolicyConfigDefinition definition, Map<String, String> params, Object value) {

    public AllocationPolicyConfigValue {
        params = Map.copyOf(params);
    }

    public String getName() {
        return definition.getName();
    }
}
