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

import java.util.ArrayList;
import java.util.List;

/**
 * Gathers everything wrong with a dataset configuration document, to throw as one exception.
 */
public class DatasetConfigurationValidationReporter {

    private final String datasetName;
    private final List<String> failures = new ArrayList<>();

    public DatasetConfigurationValidationReporter(String datasetName) {
        this.datasetName = datasetName;
    }

    /**
     * Records that part of the document is invalid.
     *
     * @param location where in the document the problem is
     * @param message  what is wrong
     */
    public void invalid(String location, String message) {
        failures.add(location + ": " + message);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Throws an exception if any part of the document was invalid.
     *
     * @throws DatasetConfigurationInvalidException if any failures were reported
     */
    public void throwIfFailed() throws DatasetConfigurationInvalidException {
        if (!failures.isEmpty()) {
            throw new DatasetConfigurationInvalidException(datasetName, failures);
        }
    }
}
