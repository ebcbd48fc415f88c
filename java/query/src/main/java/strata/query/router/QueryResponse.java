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

import strata.query.allocation.QuotaAllowanceSummary;
import strata.query.backend.QueryResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of a request that reached the backend, with how it was run.
 *
 * @param requestId      the ID of the request
 * @param result         the rows and profile from the backend
 * @param sql            the SQL that was run
 * @param settings       the backend settings it was run with
 * @param quotaAllowance the allowances from the allocation policies
 */
public record QueryResponse(String requestId, QueryResult result, String sql, Map<String, Object> settings,
        QuotaAllowanceSummary quotaAllowance) {

    public QueryResponse {
        settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }
}
