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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Declares a config of an allocation policy. A config may be parameterised, e.g. by organisation, in which case a
 * value may be set for each combination of parameter values. The default applies when no value is set.
 */
public class AllocationPolicyConfigDefinition {

    private final String name;
    private final String description;
    private final ConfigValueType valueType;
    private final Object defaultValue;
    private final List<String> paramNames;

    private AllocationPolicyConfigDefinition(Builder builder) {
        name = Objects.requireNonNull(builder.name, "name must not be null");
        description = Objects.requireNonNull(builder.description, "description must not be null");
        valueType = Objects.requireNonNull(builder.valueType, "valueType must not be null");
        defaultValue = valueType.parse(String.valueOf(Objects.requireNonNull(builder.defaultValue, "defaultValue must not be null")));
        paramNames = List.copyOf(builder.paramNames);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a copy of this definition with a different default value.
     *
     * @param  newDefault               the default value, in any form that parses as the value type
     * @return                          the copy
     * @throws IllegalArgumentException if the value is not of the right type
     */
    public AllocationPolicyConfigDefinition withDefaultValue(Object newDefault) {
        return toBuilder().defaultValue(newDefault).build();
    }

    /**
     * Checks that the given parameters are exactly the ones this config takes.
     *
     * @param  params                   the parameter values, by name
     * @throws IllegalArgumentException if any parameter is missing or unexpected
     */
    public void validateParams(Map<String, String> params) {
        if (!params.keySet().equals(Set.copyOf(paramNames))) {
            throw new IllegalArgumentException("Config " + name + " takes parameters " + paramNames
                    + ", found " + params.keySet());
        }
    }

    /**
     * Builds the runtime config key for a value of this config.
     *
     * @param  prefix the prefix for the policy
     * @param  params the parameter values, by name
     * @return        the key
     */
    public String buildKey(String prefix, Map<String, String> params) {
        String key = prefix + name;
        if (params.isEmpty()) {
            return key;
        }
        return key + "." + new TreeMap<>(params).entrySet().stream()
                .map(entry -> entry.getKey() + ":" + entry.getValue())
                .collect(Collectors.joining(","));
    }

    public boolean isParameterised() {
        return !paramNames.isEmpty();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ConfigValueType getValueType() {
        return valueType;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public Builder toBuilder() {
        return builder().name(name).description(description).valueType(valueType)
                .defaultValue(defaultValue).paramNames(paramNames);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AllocationPolicyConfigDefinition that = (AllocationPolicyConfigDefinition) o;
        return Objects.equals(name, that.name) && Objects.equals(description, that.description)
                && valueType == that.valueType && Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(paramNames, that.paramNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, valueType, defaultValue, paramNames);
    }

    @Override
    public String toString() {
        return "AllocationPolicyConfigDefinition{name='" + name + "', valueType=" + valueType
                + ", defaultValue=" + defaultValue + ", paramNames=" + paramNames + '}';
    }

    /**
     * Builds a config definition.
     */
    public static final class Builder {
        private String name;
        private String description;
        private ConfigValueType valueType;
        private Object defaultValue;
        private List<String> paramNames = List.of();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder valueType(ConfigValueType valueType) {
            this.valueType = valueType;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder paramNames(List<String> paramNames) {
            this.paramNames = paramNames;
            return this;
        }

        public Builder paramNames(String... paramNames) {
            return paramNames(List.of(paramNames));
        }

        public AllocationPolicyConfigDefinition build() {
            return new AllocationPolicyConfigDefinition(this);
        }
    }
}
