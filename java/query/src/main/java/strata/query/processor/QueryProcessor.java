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
package strata.query.processor;

import strata.query.model.Query;
import strata.query.model.QueryProcessingException;

/**
 * Rewrites a logical query before it is checked and executed. Implementations are configured once when a dataset is
 * loaded, and must not hold any state between queries. Processing must be deterministic, with no I/O or clock.
 */
@FunctionalInterface
public interface QueryProcessor {

    /**
     * Rewrites a query.
     *
     * @param  query                    the query
     * @return                          the rewritten query
     * @throws QueryProcessingException if the query cannot be rewritten
     */
    Query process(Query query) throws QueryProcessingException;
}
