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
package strata.query.backend;

import strata.query.model.Query;

import java.util.Map;

/**
 * Executes SQL against the columnar store. Only called once a query has passed every processor, checker and
 * allocation policy.
 */
@FunctionalInterface
public interface QueryBackend {

    /**
     * Executes a query.
     *
     * @param  sql                       the SQL to run
     * @param  query                     the logical query the SQL was rendered from
     * @param  settings                  the backend execution settings
     * @return                           the result
     * @throws BackendExecutionException if the backend failed to run the query
     */
    QueryResult execute(String sql, Query query, Map<String, Object> settings) throws BackendExecutionException;
}
