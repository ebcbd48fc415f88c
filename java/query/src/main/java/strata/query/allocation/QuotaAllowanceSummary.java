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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gathers the allowances of every allocation policy that assessed a request. Attached to the query log and to
 * exceptions when a request is turned away.
 */
public class QuotaAllowanceSummary {

    private final List<PolicyEvaluation> evaluations;

    public QuotaAllowanceSummary(List<PolicyEvaluation> evaluations) {
        this.evaluations = List.copyOf(evaluations);
    }

    public List<PolicyEvaluation> getEvaluations() {
        return evaluations;
    }

    /**
     * Finds the fewest threads any policy allows the request. Policies that were skipped are not counted.
     *
     * @return the threads, or an empty optional if no policy assessed the request
     */
    public Optional<Long> getThreadsUsed() {
        return evaluations.stream()
                .filter(PolicyEvaluation::isAssessed)
                .map(PolicyEvaluation::getEffectiveMaxThreads)
                .min(Long::compare);
    }

    /**
     * Finds the policy whose decision turned the request away.
     *
     * @return the evaluation, if the request was turned away
     */
    public Optional<PolicyEvaluation> getRejectedBy() {
        return evaluations.stream()
                .filter(evaluation -> !evaluation.getEffectiveDecision().isAllowed())
                .findFirst();
    }

    /**
     * Finds the policies that reduced the threads of an admitted request.
     *
     * @return the evaluations
     */
    public List<PolicyEvaluation> getThrottledBy() {
        return evaluations.stream()
                .filter(evaluation -> evaluation.getMode() == PolicyMode.ENFORCED)
                .filter(evaluation -> evaluation.getAllowance().canRun() && evaluation.getAllowance().isThrottled())
                .toList();
    }

    /**
     * Finds the policies in dry run mode that would have turned the request away.
     *
     * @return the evaluations
     */
    public List<PolicyEvaluation> getDryRunViolations() {
        return evaluations.stream()
                .filter(PolicyEvaluation::isDryRunViolation)
                .toList();
    }

    /**
     * Describes the summary for the query log.
     *
     * @return a map describing each policy's allowance and the overall result
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("threads_used", getThreadsUsed().orElse(null));
        map.put("rejected_by", getRejectedBy().map(PolicyEvaluation::getPolicyName).orElse(null));
        map.put("throttled_by", getThrottledBy().stream().map(PolicyEvaluation::getPolicyName).toList());
        map.put("dry_run_violations", getDryRunViolations().stream().map(PolicyEvaluation::getPolicyName).toList());
        Map<String, Object> details = new LinkedHashMap<>();
        for (PolicyEvaluation evaluation : evaluations) {
            Map<String, Object> detail = new LinkedHashMap<>(evaluation.getAllowance().toMap());
            detail.put("mode", evaluation.getMode().name());
            detail.put("decision", evaluation.getDecision().getType().name());
            details.put(evaluation.getPolicyName(), detail);
        }
        map.put("details", details);
        return map;
    }

    @Override
    public String toString() {
        return "QuotaAllowanceSummary" + toMap();
    }
}
