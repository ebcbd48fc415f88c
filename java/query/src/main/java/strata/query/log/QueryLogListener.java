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
package strata.query.log;

/**
 * Receives a record of every request once it has finished, successfully or not.
 */
@FunctionalInterface
public interface QueryLogListener {

    /**
     * Records a finished request.
     *
     * @param entry the record of the request
     */
    void requestFinished(QueryLogEntry entry);
}
