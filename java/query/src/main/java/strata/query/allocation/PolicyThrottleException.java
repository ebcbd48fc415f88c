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

import java.time.Duration;

/**
 * Thrown when an allocation policy turns a request away for now, because the tenant is using too much quota at the
 * moment. The request may be retried after a delay.
 */
public class PolicyThrottleException extends AllocationPolicyViolationException {

    public PolicyThrottleException(String requestId, PolicyDecision decision, QuotaAllowanceSummary summary) {
        super(requestId, decision, summary);
    }

    public Duration getRetryAfter() {
        return getDecision().getRetryAfter().orElse(Duration.ZERO);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
