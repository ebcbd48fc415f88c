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
package strata.query.allocation;

import strata.query.backend.QueryProfile;

import java.util.Optional;

/**
 * What happened to a request after allocation policies assessed it, for the policies to update their quota balance.
 */
public class QueryOutcome {

    private static final QueryOutcome NOT_EXECUTED = new QueryOutcome(Status.NOT_EXECUTED, null);
    private static final QueryOutcome FAILED = new QueryOutcome(Status.FAILED, null);

    private final Status status;
    private final QueryProfile profile;

    private QueryOutcome(Status status, QueryProfile profile) {
        this.status = status;
        this.profile = profile;
    }

    /**
     * The request never reached the backend.
     *
     * @return the outcome
     */
    public static QueryOutcome notExecuted() {
        return NOT_EXECUTED;
    }

    /**
     * The backend failed to run the query.
     *
     * @return the outcome
     */
    public static QueryOutcome failed() {
        return FAILED;
    }

    /**
     * The backend ran the query.
     *
     * @param  profile the statistics reported by the backend
     * @return         the outcome
     */
    public static QueryOutcome succeeded(QueryProfile profile) {
        return new QueryOutcome(Status.SUCCEEDED, profile);
    }

    public Status getStatus() {
        return status;
    }

    public Optional<QueryProfile> getProfile() {
        return Optional.ofNullable(profile);
    }

    public long getBytesScanned() {
        return profile == null ? 0 : profile.bytesScanned();
    }

    @Override
    public String toString() {
        return "QueryOutcome{status=" + status + ", profile=" + profile + '}';
    }

    /**
     * The possible outcomes.
     */
    public enum Status {
        NOT_EXECUTED, FAILED, SUCCEEDED
    }
}
