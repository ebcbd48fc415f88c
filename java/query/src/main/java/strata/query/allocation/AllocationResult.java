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

import java.util.Objects;

/**
 * The result of running a request through the allocation policy chain of a dataset.
 */
public class AllocationResult {

    private final PolicyDecision decision;
    private final QuotaAllowanceSummary summary;

    public AllocationResult(PolicyDecision decision, QuotaAllowanceSummary summary) {
        this.decision = Objects.requireNonNull(decision, "decision must not be null");
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
    }

    public PolicyDecision getDecision() {
        return decision;
    }

    public QuotaAllowanceSummary getSummary() {
        return summary;
    }

    /**
     * Creates the exception to report that the request was turned away.
     *
     * @param  requestId                the ID of the request
     * @return                          the exception
     * @throws IllegalStateException    if the request was admitted
     */
    public AllocationPolicyViolationException toViolation(String requestId) {
        switch (decision.getType()) {
            case THROTTLE:
                return new PolicyThrottleException(requestId, decision, summary);
            case REJECT:
                return new PolicyRejectionException(requestId, decision, summary);
            default:
                throw new IllegalStateException("Request was admitted: " + requestId);
        }
    }

    @Override
    public String toString() {
        return "AllocationResult{decision=" + decision + ", summary=" + summary + '}';
    }
}
