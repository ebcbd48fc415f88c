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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The YAML document that configures a dataset. Describes its columns and tables, and the query processors, mandatory
 * condition checkers and allocation policies that apply to queries against it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetConfigurationYaml {

    private static final ObjectMapper MAPPER = new YAMLMapper();

    private final String version;
    private final String kind;
    private final String name;
    private final StorageYaml storage;
    private final String readinessState;
    private final SchemaYaml schema;
    private final List<AllocationPolicyYaml> allocationPolicies;
    private final List<QueryProcessorYaml> queryProcessors;
    private final List<ConditionCheckerYaml> mandatoryConditionCheckers;
    private final StreamLoaderYaml streamLoader;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public DatasetConfigurationYaml(
            @JsonProperty("version") String version,
            @JsonProperty("kind") String kind,
            @JsonProperty("name") String name,
            @JsonProperty("storage") StorageYaml storage,
            @JsonProperty("readiness_state") String readinessState,
            @JsonProperty("schema") SchemaYaml schema,
            @JsonProperty("allocation_policies") List<AllocationPolicyYaml> allocationPolicies,
            @JsonProperty("query_processors") List<QueryProcessorYaml> queryProcessors,
            @JsonProperty("mandatory_condition_checkers") List<ConditionCheckerYaml> mandatoryConditionCheckers,
            @JsonProperty("stream_loader") StreamLoaderYaml streamLoader) {
        this.version = version;
        this.kind = kind;
        this.name = name;
        this.storage = storage;
        this.readinessState = readinessState;
        this.schema = schema;
        this.allocationPolicies = allocationPolicies == null ? List.of() : allocationPolicies;
        this.queryProcessors = queryProcessors == null ? List.of() : queryProcessors;
        this.mandatoryConditionCheckers = mandatoryConditionCheckers == null ? List.of() : mandatoryConditionCheckers;
        this.streamLoader = streamLoader;
    }

    /**
     * Reads a dataset configuration document from a file.
     *
     * @param  path        the path to the file
     * @return             the document
     * @throws IOException if the file could not be read or is not valid YAML for the document
     */
    public static DatasetConfigurationYaml readPath(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return read(reader);
        }
    }

    /**
     * Reads a dataset configuration document.
     *
     * @param  reader      a reader for the YAML
     * @return             the document
     * @throws IOException if the YAML could not be read or does not fit the document
     */
    public static DatasetConfigurationYaml read(Reader reader) throws IOException {
        return MAPPER.readValue(reader, DatasetConfigurationYaml.class);
    }

    public String getVersion() {
        return version;
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public StorageYaml getStorage() {
        return storage;
    }

    public String getReadinessState() {
        return readinessState;
    }

    public SchemaYaml getSchema() {
        return schema;
    }

    public List<AllocationPolicyYaml> getAllocationPolicies() {
        return allocationPolicies;
    }

    public List<QueryProcessorYaml> getQueryProcessors() {
        return queryProcessors;
    }

    public List<ConditionCheckerYaml> getMandatoryConditionCheckers() {
        return mandatoryConditionCheckers;
    }

    public StreamLoaderYaml getStreamLoader() {
        return streamLoader;
    }

    /**
     * Identifies the dataset.
     *
     * @param key    the dataset key
     * @param setKey the set of datasets this belongs to
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StorageYaml(@JsonProperty("key") String key, @JsonProperty("set_key") String setKey) {
    }

    /**
     * The columns and tables of the dataset.
     *
     * @param columns           the columns
     * @param localTableName    the table on each node
     * @param distTableName     the table that spans every node
     * @param partitionFormat   how the tables are partitioned
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SchemaYaml(
            @JsonProperty("columns") List<ColumnYaml> columns,
            @JsonProperty("local_table_name") String localTableName,
            @JsonProperty("dist_table_name") String distTableName,
            @JsonProperty("partition_format") List<String> partitionFormat) {
    }

    /**
     * A column of the dataset.
     *
     * @param name the column name
     * @param type the type tag
     * @param args the type arguments, if any
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ColumnYaml(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("args") Map<String, Object> args) {
    }

    /**
     * An allocation policy.
     *
     * @param name the policy name
     * @param args the arguments to the policy
     */
    public record AllocationPolicyYaml(
            @JsonProperty("name") String name,
            @JsonProperty("args") Map<String, Object> args) {
    }

    /**
     * A query processor.
     *
     * @param processor the processor name
     * @param args      the arguments to the processor
     */
    public record QueryProcessorYaml(
            @JsonProperty("processor") String processor,
            @JsonProperty("args") Map<String, Object> args) {
    }

    /**
     * A mandatory condition checker.
     *
     * @param condition the checker name
     * @param args      the arguments to the checker
     */
    public record ConditionCheckerYaml(
            @JsonProperty("condition") String condition,
            @JsonProperty("args") Map<String, Object> args) {
    }

    /**
     * Where messages are read from to load data into the dataset.
     *
     * @param processor    the message processor name
     * @param defaultTopic the topic read by default
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StreamLoaderYaml(
            @JsonProperty("processor") String processor,
            @JsonProperty("default_topic") String defaultTopic) {
    }
}
