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

import org.junit.jupiter.api.Test;

import strata.core.tenant.TenantContext;
import strata.query.backend.QueryProfile;
import strata.query.config.InMemoryRuntimeConfig;
import strata.query.testutil.FakeTimeSupplier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static strata.query.testutil.TestPolicyArgs.argsByOrganization;
import static strata.query.testutil.TestPolicyArgs.organization;

public class AllocationPolicyChainTest {

    private final InMemoryRuntimeConfig runtimeConfig = new InMemoryRuntimeConfig();
    private final FakeTimeSupplier timeSupplier = FakeTimeSupplier.startingAt("2025-03-01T10:00:00Z");
    private final TenantContext tenant = organization(1);

    @Test
    public void shouldStopAtFirstEnforcedRejection() {
        // Given
        FixedAllowancePolicy inactive = FixedAllowancePolicy.rejecting("inactive", args(), "never applied");
        FixedAllowancePolicy rejecting = FixedAllowancePolicy.rejecting("rejecting", args(), "over quota");
        FixedAllowancePolicy neverReached = FixedAllowancePolicy.rejecting("neverReached", args(), "unused");
        runtimeConfig.set("ourlogs.inactive.is_active", "0");
        AllocationPolicyChain chain = new AllocationPolicyChain(List.of(inactive, rejecting, neverReached));

        // When
        AllocationResult result = chain.evaluate("request-1", tenant, 0);

        // Then
        assertThat(result.getDecision()).isEqualTo(PolicyDecision.reject("rejecting", "over quota"));
        assertThat(result.getSummary().getRejectedBy())
                .map(PolicyEvaluation::getPolicyName).contains("rejecting");
        assertThat(inactive.getComputeCount()).isZero();
        assertThat(neverReached.getComputeCount()).isZero();
    }

    @Test
    public void shouldSkipPolicyWhichFailsAndKeepQuotaOfOthers() {
        // Given
        FixedAllowancePolicy first = FixedAllowancePolicy.allowing("first", args(), 8);
        FixedAllowancePolicy broken = FixedAllowancePolicy.failing("broken", args(),
                new IllegalStateException("config unreadable"));
        FixedAllowancePolicy last = FixedAllowancePolicy.allowing("last", args(), 4);
        AllocationPolicyChain chain = new AllocationPolicyChain(List.of(first, broken, last));

        // When
        AllocationResult result = chain.evaluate("request-1", tenant, 0);
        chain.updateQuotaBalance("request-1", tenant, result.getSummary(), QueryOutcome.notExecuted());

        // Then
        assertThat(result.getDecision()).isEqualTo(PolicyDecision.allow());
        assertThat(result.getSummary().getEvaluations())
                .extracting(PolicyEvaluation::getPolicyName, PolicyEvaluation::isAssessed)
                .containsExactly(tuple("first", true), tuple("broken", false), tuple("last", true));
        assertThat(result.getSummary().getThreadsUsed()).contains(4L);
        assertThat(first.getOutcomes()).containsExactly(QueryOutcome.notExecuted());
        assertThat(last.getOutcomes()).containsExactly(QueryOutcome.notExecuted());
        assertThat(broken.getOutcomes()).isEmpty();
    }

    @Test
    public void shouldAllowWhenViolatingPolicyIsInDryRun() {
        // Given
        FixedAllowancePolicy dryRun = FixedAllowancePolicy.rejecting("dryRun", args(), "over quota");
        FixedAllowancePolicy allowing = FixedAllowancePolicy.allowing("allowing", args(), 4);
        runtimeConfig.set("ourlogs.dryRun.is_enforced", "0");
        AllocationPolicyChain chain = new AllocationPolicyChain(List.of(dryRun, allowing));

        // When
        AllocationResult result = chain.evaluate("request-1", tenant, 0);

        // Then
        assertThat(result.getDecision()).isEqualTo(PolicyDecision.allow());
        assertThat(result.getSummary().getDryRunViolations())
                .extracting(PolicyEvaluation::getPolicyName).containsExactly("dryRun");
        assertThat(result.getSummary().getThreadsUsed()).contains(4L);
        assertThat(allowing.getComputeCount()).isOne();
    }

    @Test
    public void shouldUseFewestThreadsOfEnforcedPolicies() {
        // Given
        AllocationPolicyChain chain = new AllocationPolicyChain(List.of(
                FixedAllowancePolicy.allowing("eight", args(), 8),
                FixedAllowancePolicy.allowing("three", args(), 3),
                FixedAllowancePolicy.allowing("dryRunOne", args(), 1)));
        runtimeConfig.set("ourlogs.dryRunOne.is_enforced", "0");

        // When
        AllocationResult result = chain.evaluate("request-1", tenant, 0);

        // Then
        assertThat(result.getSummary().getThreadsUsed()).contains(3L);
    }

    @Test
    public void shouldReleaseEarlierAdmissionsWhenLaterPolicyThrottles() {
        // Given
        FixedAllowancePolicy allowing = FixedAllowancePolicy.allowing("allowing", args(), 10);
        FixedAllowancePolicy throttling = FixedAllowancePolicy.throttling("throttling", args(), Duration.ofSeconds(5));
        AllocationPolicyChain chain = new AllocationPolicyChain(List.of(allowing, throttling));

        // When
        AllocationResult result = chain.evaluate("request-1", tenant, 0);

        // Then
        assertThat(result.getDecision()).isEqualTo(
                PolicyDecision.throttle("throttling", "too busy", Duration.ofSeconds(5)));
        assertThat(allowing.getOutcomes()).containsExactly(QueryOutcome.notExecuted());
        assertThat(throttling.getOutcomes()).isEmpty();
    }

    @Test
    public void shouldOnlyUpdateBalanceOfPoliciesWhichAdmittedRequest() {
        // Given
        FixedAllowancePolicy allowing = FixedAllowancePolicy.allowing("allowing", args(), 10);
        FixedAllowancePolicy dryRun = FixedAllowancePolicy.rejecting("dryRun", args(), "over quota");
        runtimeConfig.set("ourlogs.dryRun.is_enforced", "0");
        AllocationPolicyChain chain = new AllocationPolicyChain(List.of(allowing, dryRun));
        AllocationResult result = chain.evaluate("request-1", tenant, 0);
        QueryOutcome outcome = QueryOutcome.succeeded(new QueryProfile(100, 10, Duration.ofMillis(20)));

        // When
        chain.updateQuotaBalance("request-1", tenant, result.getSummary(), outcome);

        // Then
        assertThat(allowing.getOutcomes()).containsExactly(outcome);
        assertThat(dryRun.getOutcomes()).isEmpty();
    }

    @Test
    public void shouldNotUpdateBalanceOfSkippedPolicy() {
        // Given
        FixedAllowancePolicy allowing = FixedAllowancePolicy.allowing("allowing", args(), 10);
        AllocationPolicyChain chain = new AllocationPolicyChain(List.of(allowing));
        AllocationResult result = chain.evaluate("request-1", TenantContext.none(), 0);

        // When
        chain.updateQuotaBalance("request-1", TenantContext.none(), result.getSummary(), QueryOutcome.failed());

        // Then
        assertThat(allowing.getComputeCount()).isZero();
        assertThat(allowing.getOutcomes()).isEmpty();
    }

    @Test
    public void shouldAllowEverythingWithNoPolicies() {
        AllocationResult result = AllocationPolicyChain.empty().evaluate("request-1", tenant, 0);
        assertThat(result.getDecision().isAllowed()).isTrue();
        assertThat(result.getSummary().getThreadsUsed()).isEmpty();
    }

    private AllocationPolicyArgs args() {
        return argsByOrganization(runtimeConfig, timeSupplier).build();
    }
}
