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

import org.apache.commons.lang3.StringUtils;

import strata.configuration.dataset.DatasetConfigurationYaml.ColumnYaml;
import strata.configuration.dataset.DatasetConfigurationYaml.SchemaYaml;
import strata.core.dataset.ReadinessState;
import strata.core.dataset.StorageTables;
import strata.core.dataset.StreamLoaderBinding;
import strata.core.schema.Field;
import strata.core.schema.Schema;
import strata.core.schema.type.TypeFactory;
import strata.query.allocation.AllocationPolicy;
import strata.query.allocation.AllocationPolicyArgs;
import strata.query.allocation.AllocationPolicyChain;
import strata.query.checker.MandatoryConditionChecker;
import strata.query.config.RuntimeConfig;
import strata.query.processor.QueryProcessor;
import strata.query.processor.QueryProcessorPipeline;
import strata.query.router.Dataset;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Builds datasets from their configuration documents. Every problem with a document is gathered and reported
 * together, and no dataset is built from a document with any problem.
 */
public class DatasetFactory {

    private final RuntimeConfig runtimeConfig;
    private final Supplier<Instant> timeSupplier;

    public DatasetFactory(RuntimeConfig runtimeConfig) {
        this(runtimeConfig, Instant::now);
    }

    public DatasetFactory(RuntimeConfig runtimeConfig, Supplier<Instant> timeSupplier) {
        this.runtimeConfig = runtimeConfig;
        this.timeSupplier = timeSupplier;
    }

    /**
     * Builds a dataset.
     *
     * @param  document                             the configuration document
     * @return                                      the dataset
     * @throws DatasetConfigurationInvalidException if the document is invalid
     */
    public Dataset create(DatasetConfigurationYaml document) {
        String name = document.getName();
        DatasetConfigurationValidationReporter reporter = new DatasetConfigurationValidationReporter(name);
        if (StringUtils.isBlank(name)) {
            reporter.invalid("name", "must be set");
        }
        String key = readKey(document, reporter);
        ReadinessState readinessState = readReadinessState(document, reporter);
        Schema schema = readSchema(document.getSchema(), reporter);
        StorageTables storageTables = readStorageTables(document.getSchema(), reporter);
        StreamLoaderBinding streamLoader = readStreamLoader(document, reporter);
        List<QueryProcessor> processors = new ArrayList<>();
        List<MandatoryConditionChecker> checkers = new ArrayList<>();
        if (schema != null) {
            processors = readQueryProcessors(document, schema, reporter);
            checkers = readConditionCheckers(document, schema, reporter);
        }
        List<AllocationPolicy> policies = readAllocationPolicies(document, key, reporter);
        reporter.throwIfFailed();
        return Dataset.builder()
                .key(key)
                .setKey(document.getStorage().setKey())
                .readinessState(readinessState)
                .schema(schema)
                .storageTables(storageTables)
                .queryProcessors(new QueryProcessorPipeline(processors))
                .mandatoryConditionCheckers(checkers)
                .allocationPolicies(new AllocationPolicyChain(policies))
                .streamLoader(streamLoader)
                .build();
    }

    private static String readKey(DatasetConfigurationYaml document, DatasetConfigurationValidationReporter reporter) {
        if (document.getStorage() == null) {
            reporter.invalid("storage", "must be set");
            return null;
        }
        if (StringUtils.isBlank(document.getStorage().key())) {
            reporter.invalid("storage.key", "must be set");
        }
        if (StringUtils.isBlank(document.getStorage().setKey())) {
            reporter.invalid("storage.set_key", "must be set");
        }
        return document.getStorage().key();
    }

    private static ReadinessState readReadinessState(DatasetConfigurationYaml document, DatasetConfigurationValidationReporter reporter) {
        try {
            return ReadinessState.fromConfigValue(document.getReadinessState());
        } catch (IllegalArgumentException e) {
            reporter.invalid("readiness_state", e.getMessage());
            return null;
        }
    }

    private static Schema readSchema(SchemaYaml schemaYaml, DatasetConfigurationValidationReporter reporter) {
        if (schemaYaml == null || schemaYaml.columns() == null) {
            reporter.invalid("schema.columns", "must be set");
            return null;
        }
        List<Field> fields = new ArrayList<>();
        boolean valid = true;
        for (int i = 0; i < schemaYaml.columns().size(); i++) {
            ColumnYaml column = schemaYaml.columns().get(i);
            String location = "schema.columns[" + i + "]";
            if (StringUtils.isBlank(column.name())) {
                reporter.invalid(location, "column name must be set");
                valid = false;
                continue;
            }
            try {
                fields.add(new Field(column.name(), TypeFactory.create(column.type(), column.args())));
            } catch (IllegalArgumentException e) {
                reporter.invalid(location + " " + column.name(), e.getMessage());
                valid = false;
            }
        }
        try {
            Schema schema = Schema.builder().fields(fields).build();
            return valid ? schema : null;
        } catch (IllegalArgumentException e) {
            reporter.invalid("schema.columns", e.getMessage());
            return null;
        }
    }

    private static StorageTables readStorageTables(SchemaYaml schemaYaml, DatasetConfigurationValidationReporter reporter) {
        if (schemaYaml == null) {
            return null;
        }
        try {
            return StorageTables.builder()
                    .localTableName(schemaYaml.localTableName())
                    .distributedTableName(schemaYaml.distTableName())
                    .partitionFormat(schemaYaml.partitionFormat() == null ? List.of() : schemaYaml.partitionFormat())
                    .build();
        } catch (IllegalArgumentException e) {
            reporter.invalid("schema", e.getMessage());
            return null;
        }
    }

    private static StreamLoaderBinding readStreamLoader(DatasetConfigurationYaml document, DatasetConfigurationValidationReporter reporter) {
        if (document.getStreamLoader() == null) {
            return null;
        }
        try {
            return new StreamLoaderBinding(document.getStreamLoader().processor(), document.getStreamLoader().defaultTopic());
        } catch (IllegalArgumentException e) {
            reporter.invalid("stream_loader", e.getMessage());
            return null;
        }
    }

    private static List<QueryProcessor> readQueryProcessors(
            DatasetConfigurationYaml document, Schema schema, DatasetConfigurationValidationReporter reporter) {
        List<QueryProcessor> processors = new ArrayList<>();
        for (int i = 0; i < document.getQueryProcessors().size(); i++) {
            DatasetConfigurationYaml.QueryProcessorYaml processor = document.getQueryProcessors().get(i);
            try {
                processors.add(QueryProcessorFactory.create(processor.processor(), processor.args(), schema));
            } catch (IllegalArgumentException e) {
                reporter.invalid("query_processors[" + i + "] " + processor.processor(), e.getMessage());
            }
        }
        return processors;
    }

    private static List<MandatoryConditionChecker> readConditionCheckers(
            DatasetConfigurationYaml document, Schema schema, DatasetConfigurationValidationReporter reporter) {
        List<MandatoryConditionChecker> checkers = new ArrayList<>();
        for (int i = 0; i < document.getMandatoryConditionCheckers().size(); i++) {
            DatasetConfigurationYaml.ConditionCheckerYaml checker = document.getMandatoryConditionCheckers().get(i);
            try {
                checkers.add(ConditionCheckerFactory.create(checker.condition(), checker.args(), schema));
            } catch (IllegalArgumentException e) {
                reporter.invalid("mandatory_condition_checkers[" + i + "] " + checker.condition(), e.getMessage());
            }
        }
        return checkers;
    }

    private List<AllocationPolicy> readAllocationPolicies(
            DatasetConfigurationYaml document, String key, DatasetConfigurationValidationReporter reporter) {
        List<AllocationPolicy> policies = new ArrayList<>();
        if (key == null) {
            return policies;
        }
        for (int i = 0; i < document.getAllocationPolicies().size(); i++) {
            DatasetConfigurationYaml.AllocationPolicyYaml policy = document.getAllocationPolicies().get(i);
            try {
                policies.add(AllocationPolicyFactory.create(policy.name(), policy.args(), AllocationPolicyArgs.builder()
                        .datasetKey(key)
                        .runtimeConfig(runtimeConfig)
                        .timeSupplier(timeSupplier)));
            } catch (IllegalArgumentException e) {
                reporter.invalid("allocation_policies[" + i + "] " + policy.name(), e.getMessage());
            }
        }
        return policies;
    }
}
