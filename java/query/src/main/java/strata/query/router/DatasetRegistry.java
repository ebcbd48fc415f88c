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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import strata.core.dataset.DatasetNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Holds the datasets that can be queried, by key. The datasets are only replaced all at once on a reload, so a query
 * never sees some datasets from before a reload and some from after.
 */
public class DatasetRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetRegistry.class);

    private final DatasetLoader loader;
    private final AtomicReference<Map<String, Dataset>> datasetsByKey = new AtomicReference<>(Map.of());

    private DatasetRegistry(DatasetLoader loader) {
        this.loader = loader;
    }

    /**
     * Creates a registry and loads every dataset.
     *
     * @param  loader the loader to read dataset definitions
     * @return        the registry
     */
    public static DatasetRegistry load(DatasetLoader loader) {
        DatasetRegistry registry = new DatasetRegistry(loader);
        registry.reload();
        return registry;
    }

    /**
     * Creates a registry holding the given datasets. A reload restores the same datasets.
     *
     * @param  datasets the datasets
     * @return          the registry
     */
    public static DatasetRegistry from(List<Dataset> datasets) {
        List<Dataset> copy = List.copyOf(datasets);
        return load(() -> copy);
    }

    /**
     * Retrieves a dataset.
     *
     * @param  datasetKey               the dataset key
     * @return                          the dataset
     * @throws DatasetNotFoundException if there is no dataset with the key
     */
    public Dataset resolve(String datasetKey) {
        Dataset dataset = datasetsByKey.get().get(datasetKey);
        if (dataset == null) {
            throw DatasetNotFoundException.withKey(datasetKey);
        }
        return dataset;
    }

    /**
     * Reads every dataset definition again, and replaces all the datasets at once. If reading fails, the datasets from
     * before are kept and the failure is thrown.
     */
    public void reload() {
        List<Dataset> datasets = loader.loadAll();
        Map<String, Dataset> byKey = new LinkedHashMap<>();
        for (Dataset dataset : datasets) {
            if (byKey.put(dataset.getKey(), dataset) != null) {
                throw new IllegalArgumentException("Found more than one dataset with key " + dataset.getKey());
            }
        }
        datasetsByKey.set(Collections.unmodifiableMap(byKey));
        LOGGER.info("Loaded {} datasets: {}", byKey.size(), byKey.keySet());
    }

    public Stream<Dataset> streamAllDatasets() {
        return datasetsByKey.get().values().stream();
    }
}
