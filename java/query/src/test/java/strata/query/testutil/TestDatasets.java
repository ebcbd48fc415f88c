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
package strata.query.testutil;

import strata.core.dataset.StorageTables;
import strata.core.schema.Field;
import strata.core.schema.Schema;
import strata.core.schema.type.StringType;
import strata.core.schema.type.UIntType;
import strata.core.schema.type.UuidType;
import strata.query.allocation.AllocationPolicyArgs;
import strata.query.allocation.AllocationPolicyChain;
import strata.query.allocation.policy.BytesScannedRejectingPolicy;
import strata.query.allocation.policy.ConcurrentRateLimitAllocationPolicy;
import strata.query.checker.OrgIdEnforcer;
import strata.query.config.RuntimeConfig;
import strata.query.processor.ClickhouseSettingsOverride;
import strata.query.processor.HexIntColumnProcessor;
import strata.query.processor.QueryProcessorPipeline;
import strata.query.processor.TupleUnaliaser;
import strata.query.processor.UUIDColumnProcessor;
import strata.query.router.Dataset;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static strata.query.testutil.TestPolicyArgs.argsByOrganization;

public class TestDatasets {

    private TestDatasets() {
    }

    public static Schema logsSchema() {
        return Schema.builder()
                .fields(new Field("organization_id", new UIntType(64)),
                        new Field("project_id", new UIntType(64)),
                        new Field("trace_id", new UuidType()),
                        new Field("span_id", new UIntType(64)),
                        new Field("body", new StringType()))
                .build();
    }

    public static Dataset.Builder minimalDataset(String key) {
        return Dataset.builder()
                .key(key)
                .setKey("events_analytics_platform")
                .schema(logsSchema())
                .storageTables(StorageTables.builder()
                        .localTableName(key + "_local")
                        .distributedTableName(key + "_dist")
                        .build());
    }

    public static Dataset logsDataset(RuntimeConfig runtimeConfig, Supplier<Instant> timeSupplier) {
        AllocationPolicyArgs args = argsByOrganization(runtimeConfig, timeSupplier).build();
        return minimalDataset(TestQueries.DATASET)
                .queryProcessors(new QueryProcessorPipeline(List.of(
                        new TupleUnaliaser(),
                        new UUIDColumnProcessor(List.of("trace_id")),
                        new HexIntColumnProcessor(List.of("span_id")),
                        new ClickhouseSettingsOverride(Map.of("max_execution_time", 30L)))))
                .mandatoryConditionCheckers(List.of(new OrgIdEnforcer("organization_id")))
                .allocationPolicies(new AllocationPolicyChain(List.of(
                        new ConcurrentRateLimitAllocationPolicy(args),
                        new BytesScannedRejectingPolicy(args))))
                .build();
    }
}
