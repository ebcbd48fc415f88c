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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import strata.core.tenant.TenantContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a request through the allocation policies of a dataset, in order. The first policy that turns the request away
 * decides the result, and later policies are not consulted.
 */
public class AllocationPolicyChain {
    private static final Logger LOGGER = LoggerFactory.getLogger(AllocationPolicyChain.class);

    private final List<AllocationPolicy> policies;

    public AllocationPolicyChain(List<AllocationPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    /**
     * Creates a chain that admits every request.
     *
     * @return the chain
     */
    public static AllocationPolicyChain empty() {
        return new AllocationPolicyChain(List.of());
    }

    /**
     * Decides whether to admit a request. If the request is turned away, any quota taken by earlier policies is given
     * back before this returns. A policy that fails to assess the request is skipped, so the request is not turned
     * away because of it.
     *
     * @param  requestId      the ID of the request
     * @param  tenant         who the request is made on behalf of
     * @param  estimatedBytes the estimated bytes the request will scan
     * @return                the decision, with the allowance of every policy consulted
     */
    public AllocationResult evaluate(String requestId, TenantContext tenant, long estimatedBytes) {
        List<PolicyEvaluation> evaluations = new ArrayList<>();
        for (AllocationPolicy policy : policies) {
            PolicyEvaluation evaluation = evaluateFailingOpen(policy, requestId, tenant, estimatedBytes);
            evaluations.add(evaluation);
            PolicyDecision decision = evaluation.getEffectiveDecision();
            if (!decision.isAllowed()) {
                QuotaAllowanceSummary summary = new QuotaAllowanceSummary(evaluations);
                updateQuotaBalance(requestId, tenant, summary, QueryOutcome.notExecuted());
                LOGGER.debug("Request {} turned away by {}", requestId, policy.getName());
                return new AllocationResult(decision, summary);
            }
        }
        return new AllocationResult(PolicyDecision.allow(), new QuotaAllowanceSummary(evaluations));
    }

    private static PolicyEvaluation evaluateFailingOpen(
            AllocationPolicy policy, String requestId, TenantContext tenant, long estimatedBytes) {
        try {
            return policy.evaluate(requestId, tenant, estimatedBytes);
        } catch (RuntimeException e) {
            LOGGER.error("Failed evaluating {} for request {}, admitting without it", policy.getName(), requestId, e);
            return PolicyEvaluation.skipped(policy.getName(), PolicyMode.INACTIVE,
                    QuotaAllowance.unrestricted(0, "policy failed: " + e));
        }
    }

    /**
     * Tells every policy that admitted a request how it turned out.
     *
     * @param requestId the ID of the request
     * @param tenant    who the request was made on behalf of
     * @param summary   the allowances from when the request was admitted
     * @param outcome   what happened to the request
     */
    public void updateQuotaBalance(String requestId, TenantContext tenant, QuotaAllowanceSummary summary, QueryOutcome outcome) {
        for (PolicyEvaluation evaluation : summary.getEvaluations()) {
            if (!evaluation.admitted()) {
                continue;
            }
            getPolicy(evaluation.getPolicyName()).ifPresent(policy -> {
                try {
                    policy.updateQuotaBalance(requestId, tenant, outcome);
                } catch (RuntimeException e) {
                    LOGGER.error("Failed updating quota balance for {} after request {}",
                            policy.getName(), requestId, e);
                }
            });
        }
    }

    /**
     * Finds a policy by its name.
     *
     * @param  policyName the name
     * @return            the policy, if it is in this chain
     */
    public Optional<AllocationPolicy> getPolicy(String policyName) {
        return policies.stream()
                .filter(policy -> policy.getName().equals(policyName))
                .findFirst();
    }

    public List<AllocationPolicy> getPolicies() {
        return policies;
    }

    /**
     * Discards all quota usage tracked by every policy in the chain.
     */
    public void resetQuotaState() {
        policies.forEach(AllocationPolicy::resetQuotaState);
    }
}
