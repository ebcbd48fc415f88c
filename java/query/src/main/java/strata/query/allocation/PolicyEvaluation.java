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
 * The assessment of one request by one allocation policy. Holds the decision the policy reached, and the decision
 * that actually applies given the policy's mode.
 */
public class PolicyEvaluation {

    private final String policyName;
    private final PolicyMode mode;
    private final boolean assessed;
    private final QuotaAllowance allowance;
    private final PolicyDecision decision;
    private final long defaultMaxThreads;

    private PolicyEvaluation(String policyName, PolicyMode mode, boolean assessed, QuotaAllowance allowance, long defaultMaxThreads) {
        this.policyName = Objects.requireNonNull(policyName, "policyName must not be null");
        this.mode = mode;
        this.assessed = assessed;
        this.allowance = allowance;
        this.decision = PolicyDecision.fromAllowance(policyName, allowance);
        this.defaultMaxThreads = defaultMaxThreads;
    }

    /**
     * Records that a policy assessed a request.
     *
     * @param  policyName        the policy
     * @param  mode              the policy's mode when it assessed the request
     * @param  allowance         the allowance the policy computed
     * @param  defaultMaxThreads the threads to allow if the allowance does not apply
     * @return                   the evaluation
     */
    public static PolicyEvaluation assessed(String policyName, PolicyMode mode, QuotaAllowance allowance, long defaultMaxThreads) {
        return new PolicyEvaluation(policyName, mode, true, allowance, defaultMaxThreads);
    }

    /**
     * Records that a policy did not assess a request, e.g. because it was inactive.
     *
     * @param  policyName the policy
     * @param  mode       the policy's mode
     * @param  allowance  an allowance describing why the request was not assessed
     * @return            the evaluation
     */
    public static PolicyEvaluation skipped(String policyName, PolicyMode mode, QuotaAllowance allowance) {
        return new PolicyEvaluation(policyName, mode, false, allowance, allowance.getMaxThreads());
    }

    public String getPolicyName() {
        return policyName;
    }

    public PolicyMode getMode() {
        return mode;
    }

    public boolean isAssessed() {
        return assessed;
    }

    public QuotaAllowance getAllowance() {
        return allowance;
    }

    /**
     * Retrieves the decision the policy reached, whether or not it is enforced.
     *
     * @return the decision
     */
    public PolicyDecision getDecision() {
        return decision;
    }

    /**
     * Retrieves the decision that applies to the request. A policy in dry run mode always admits the request.
     *
     * @return the effective decision
     */
    public PolicyDecision getEffectiveDecision() {
        if (mode == PolicyMode.ENFORCED) {
            return decision;
        }
        return PolicyDecision.allow();
    }

    /**
     * Checks whether the policy reached a decision other than to admit, but did not apply it due to dry run mode.
     *
     * @return true if a decision was not applied
     */
    public boolean isDryRunViolation() {
        return mode == PolicyMode.DRY_RUN && !decision.isAllowed();
    }

    /**
     * Checks whether the policy admitted the request, and so needs to hear how it turned out.
     *
     * @return true if the policy assessed and admitted the request
     */
    public boolean admitted() {
        return assessed && allowance.canRun();
    }

    /**
     * Retrieves the number of threads the request may use under this policy. In dry run mode a reduced number of
     * threads is not applied.
     *
     * @return the maximum threads
     */
    public long getEffectiveMaxThreads() {
        if (mode == PolicyMode.ENFORCED) {
            return allowance.getMaxThreads();
        }
        return defaultMaxThreads;
    }

    @Override
    public String toString() {
        return "PolicyEvaluation{policyName='" + policyName + "', mode=" + mode + ", assessed=" + assessed
                + ", decision=" + decision + ", allowance=" + allowance + '}';
    }
}
