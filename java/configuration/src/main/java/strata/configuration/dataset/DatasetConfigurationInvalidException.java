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

import java.util.List;

public class DatasetConfigurationInvalidException extends IllegalArgumentException {

    private final transient List<String> failures;

    public DatasetConfigurationInvalidException(String datasetName, List<String> failures) {
        super(buildMessage(datasetName, failures));
        this.failures = List.copyOf(failures);
    }

    private static String buildMessage(String datasetName, List<String> failures) {
        String message = "Dataset configuration " + datasetName + " was invalid. " + failures.get(0) + ".";
        if (failures.size() > 1) {
            message += " Failure 1 of " + failures.size() + ".";
        }
        return message;
    }

    public List<String> getFailures() {
        return failures;
    }
}
