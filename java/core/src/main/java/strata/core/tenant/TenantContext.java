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
package strata.core.tenant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies who a request is made on behalf of. Holds the values of tenant dimensions such as the organisation,
 * project and referrer. This is supplied by the caller for each request, and is immutable.
 */
public class TenantContext {

    public static final String ORGANIZATION_ID = "organization_id";
    public static final String PROJECT_ID = "project_id";
    public static final String REFERRER = "referrer";

    private final Map<String, String> dimensions;

    private TenantContext(Map<String, String> dimensions) {
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a tenant context with no dimensions set.
     *
     * @return the tenant context
     */
    public static TenantContext none() {
        return new TenantContext(Map.of());
    }

    /**
     * Retrieves the value of a tenant dimension.
     *
     * @param  dimension the dimension name, e.g. "organization_id"
     * @return           the value, or an empty optional if it was not supplied
     */
    public Optional<String> get(String dimension) {
        return Optional.ofNullable(dimensions.get(dimension));
    }

    public Optional<String> getReferrer() {
        return get(REFERRER);
    }

    public Optional<String> getOrganizationId() {
        return get(ORGANIZATION_ID);
    }

    /**
     * Checks whether values were supplied for all of the given dimensions.
     *
     * @param  required the dimension names
     * @return          true if every dimension has a value
     */
    public boolean hasAll(List<String> required) {
        return required.stream().allMatch(dimensions::containsKey);
    }

    /**
     * Finds which of the given dimensions were not supplied.
     *
     * @param  required the dimension names
     * @return          the names with no value, in the order given
     */
    public List<String> findMissing(List<String> required) {
        return required.stream()
                .filter(dimension -> !dimensions.containsKey(dimension))
                .toList();
    }

    public Map<String, String> getDimensions() {
        return dimensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TenantContext that = (TenantContext) o;
        return Objects.equals(dimensions, that.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions);
    }

    @Override
    public String toString() {
        return "TenantContext" + dimensions;
    }

    /**
     * Builds a tenant context.
     */
    public static final class Builder {
        private final Map<String, String> dimensions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder organizationId(long organizationId) {
            return dimension(ORGANIZATION_ID, String.valueOf(organizationId));
        }

        public Builder projectId(long projectId) {
            return dimension(PROJECT_ID, String.valueOf(projectId));
        }

        public Builder referrer(String referrer) {
            return dimension(REFERRER, referrer);
        }

        /**
         * Sets the value of a tenant dimension. A null value leaves the dimension unset.
         *
         * @param  dimension the dimension name
         * @param  value     the value
         * @return           this builder
         */
        public Builder dimension(String dimension, String value) {
            if (value != null) {
                dimensions.put(dimension, value);
            }
            return this;
        }

        public TenantContext build() {
            return new TenantContext(dimensions);
        }
    }
}
