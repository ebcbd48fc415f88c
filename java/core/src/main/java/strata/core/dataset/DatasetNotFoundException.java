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

/**
 * An exception for when no dataset is registered under the requested key.
 */
public class DatasetNotFoundException extends RuntimeException {

    private final String datasetKey;

    private DatasetNotFoundException(String datasetKey, String message) {
        super(message);
        this.datasetKey = datasetKey;
    }

    /**
     * Creates an instance of this class when we looked up the dataset by its key.
     *
     * @param  datasetKey the dataset key
     * @return            an instance of this class
     */
    public static DatasetNotFoundException withKey(String datasetKey) {
        return new DatasetNotFoundException(datasetKey, "Dataset not found with key \"" + datasetKey + "\"");
    }

    public String getDatasetKey() {
        return datasetKey;
    }
}
