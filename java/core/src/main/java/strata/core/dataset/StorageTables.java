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
package strata.core.dataset;

import java.util.List;
import java.util.Objects;

/**
 * The physical tables a dataset is routed to in the storage backend, and how they are partitioned.
 */
public class StorageTables {

    private final String localTableName;
    private final String distributedTableName;
    private final List<String> partitionFormat;

    private StorageTables(Builder builder) {
        localTableName = requireNonBlank(builder.localTableName, "localTableName");
        distributedTableName = requireNonBlank(builder.distributedTableName, "distributedTableName");
        partitionFormat = List.copyOf(Objects.requireNonNull(builder.partitionFormat, "partitionFormat must not be null"));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getLocalTableName() {
        return localTableName;
    }

    public String getDistributedTableName() {
        return distributedTableName;
    }

    /**
     * Retrieves the components the tables are partitioned by, e.g. "date" or "retention_days".
     *
     * @return the partition components, in order
     */
    public List<String> getPartitionFormat() {
        return partitionFormat;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be set");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StorageTables that = (StorageTables) o;
        return Objects.equals(localTableName, that.localTableName)
                && Objects.equals(distributedTableName, that.distributedTableName)
                && Objects.equals(partitionFormat, that.partitionFormat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localTableName, distributedTableName, partitionFormat);
    }

    @Override
    public String toString() {
        return "StorageTables{" +
                "localTableName='" + localTableName + '\'' +
                ", distributedTableName='" + distributedTableName + '\'' +
                ", partitionFormat=" + partitionFormat +
                '}';
    }

    /**
     * Builds the storage tables.
     */
    public static final class Builder {
        private String localTableName;
        private String distributedTableName;
        private List<String> partitionFormat = List.of();

        private Builder() {
        }

        public Builder localTableName(String localTableName) {
            this.localTableName = localTableName;
            return this;
        }

        public Builder distributedTableName(String distributedTableName) {
            this.distributedTableName = distributedTableName;
            return this;
        }

        public Builder partitionFormat(List<String> partitionFormat) {
            this.partitionFormat = partitionFormat;
            return this;
        }

        public StorageTables build() {
            return new StorageTables(this);
        }
    }
}
