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

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The rows returned by the backend for a query, with its profile.
 */
public class QueryResult {

    private final List<Map<String, Object>> rows;
    private final QueryProfile profile;

    public QueryResult(List<Map<String, Object>> rows, QueryProfile profile) {
        this.rows = List.copyOf(rows);
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public QueryProfile getProfile() {
        return profile;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QueryResult that = (QueryResult) o;
        return Objects.equals(rows, that.rows) && Objects.equals(profile, that.profile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, profile);
    }

    @Override
    public String toString() {
        return "QueryResult{rows=" + rows + ", profile=" + profile + '}';
    }
}
