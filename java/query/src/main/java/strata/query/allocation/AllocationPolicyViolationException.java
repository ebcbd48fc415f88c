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

import strata.query.model.QueryException;

/**
 * Thrown when an allocation policy turns a request away.
 */
public abstract class AllocationPolicyViolationException extends QueryException {

    private final transient PolicyDecision decision;
    private final transient QuotaAllowanceSummary summary;

    protected AllocationPolicyViolationException(String requestId, PolicyDecision decision, QuotaAllowanceSummary summary) {
        super(requestId, "Request " + requestId + " turned away by " + decision.getPolicyName().orElse("allocation policy")
                + ": " + decision.getReason().orElse("quota exceeded"), null);
        this.decision = decision;
        this.summary = summary;
    }

    public String getPolicyName() {
        return decision.getPolicyName().orElse(null);
    }

    public PolicyDecision getDecision() {
        return decision;
    }

    public QuotaAllowanceSummary getSummary() {
        return summary;
    }

    /**
     * Checks whether the request may succeed if it is retried later.
     *
     * @return true if the request may be retried
     */
    public abstract boolean isRetriable();
}
