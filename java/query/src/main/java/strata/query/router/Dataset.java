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

import strata.core.dataset.ReadinessState;
import strata.core.dataset.StorageTables;
import strata.core.dataset.StreamLoaderBinding;
import strata.core.schema.Schema;
import strata.core.schema.SchemaSerDe;
import strata.query.allocation.AllocationPolicyChain;
import strata.query.checker.MandatoryConditionChecker;
import strata.query.processor.QueryProcessorPipeline;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A dataset that can be queried. Holds everything needed to route a query to the physical tables, from rewriting
 * and checking the query to deciding whether to admit it. This is built once when the dataset configuration is
 * loaded, and does not change.
 */
public class Dataset {

    private final String key;
    private final String setKey;
    private final ReadinessState readinessState;
    private final Schema schema;
    private final StorageTables storageTables;
    private final QueryProcessorPipeline queryProcessors;
    private final List<MandatoryConditionChecker> mandatoryConditionCheckers;
    private final AllocationPolicyChain allocationPolicies;
    private final StreamLoaderBinding streamLoader;

    private Dataset(Builder builder) {
        key = Objects.requireNonNull(builder.key, "key must not be null");
        setKey = Objects.requireNonNull(builder.setKey, "setKey must not be null");
        readinessState = Objects.requireNonNull(builder.readinessState, "readinessState must not be null");
        schema = Objects.requireNonNull(builder.schema, "schema must not be null");
        storageTables = Objects.requireNonNull(builder.storageTables, "storageTables must not be null");
        queryProcessors = builder.queryProcessors;
        mandatoryConditionCheckers = List.copyOf(builder.mandatoryConditionCheckers);
        allocationPolicies = builder.allocationPolicies;
        streamLoader = builder.streamLoader;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getKey() {
        return key;
    }

    public String getSetKey() {
        return setKey;
    }

    public ReadinessState getReadinessState() {
        return readinessState;
    }

    public Schema getSchema() {
        return schema;
    }

    public StorageTables getStorageTables() {
        return storageTables;
    }

    public QueryProcessorPipeline getQueryProcessors() {
        return queryProcessors;
    }

    public List<MandatoryConditionChecker> getMandatoryConditionCheckers() {
        return mandatoryConditionCheckers;
    }

    public AllocationPolicyChain getAllocationPolicies() {
        return allocationPolicies;
    }

    public Optional<StreamLoaderBinding> getStreamLoader() {
        return Optional.ofNullable(streamLoader);
    }

    /**
     * Describes the columns of this dataset as JSON.
     *
     * @return the schema JSON
     */
    public String describeSchema() {
        return new SchemaSerDe().toJson(schema, true);
    }

    @Override
    public String toString() {
        return "Dataset{key='" + key + "', setKey='" + setKey + "', readinessState=" + readinessState
                + ", storageTables=" + storageTables + '}';
    }

    /**
     * Builds a dataset.
     */
    public static final class Builder {
        private String key;
        private String setKey;
        private ReadinessState readinessState = ReadinessState.COMPLETE;
        private Schema schema;
        private StorageTables storageTables;
        private QueryProcessorPipeline queryProcessors = QueryProcessorPipeline.empty();
        private List<MandatoryConditionChecker> mandatoryConditionCheckers = List.of();
        private AllocationPolicyChain allocationPolicies = AllocationPolicyChain.empty();
        private StreamLoaderBinding streamLoader;

        private Builder() {
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder setKey(String setKey) {
            this.setKey = setKey;
            return this;
        }

        public Builder readinessState(ReadinessState readinessState) {
            this.readinessState = readinessState;
            return this;
        }

        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        public Builder storageTables(StorageTables storageTables) {
            this.storageTables = storageTables;
            return this;
        }

        public Builder queryProcessors(QueryProcessorPipeline queryProcessors) {
            this.queryProcessors = queryProcessors;
            return this;
        }

        public Builder mandatoryConditionCheckers(List<MandatoryConditionChecker> mandatoryConditionCheckers) {
            this.mandatoryConditionCheckers = mandatoryConditionCheckers;
            return this;
        }

        public Builder allocationPolicies(AllocationPolicyChain allocationPolicies) {
            this.allocationPolicies = allocationPolicies;
            return this;
        }

        public Builder streamLoader(StreamLoaderBinding streamLoader) {
            this.streamLoader = streamLoader;
            return this;
        }

        public Dataset build() {
            return new Dataset(this);
        }
    }
}
