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
package strata.query.checker;

import strata.query.model.Query;

/**
 * Checks that a query contains a condition it must always have, e.g. to scope it to a single tenant. A checker never
 * rewrites the query.
 */
@FunctionalInterface
public interface MandatoryConditionChecker {

    /**
     * Checks a query after it has been through the query processors.
     *
     * @param  query                     the query
     * @throws MissingConditionException if the condition is not present
     */
    void check(Query query) throws MissingConditionException;
}
