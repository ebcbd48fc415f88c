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
package strata.query.allocation.policy;

import org.junit.jupiter.api.Test;

import strata.core.tenant.TenantContext;
import strata.query.allocation.PolicyDecision;
import strata.query.allocation.PolicyEvaluation;
import strata.query.allocation.QueryOutcome;
import strata.query.config.InMemoryRuntimeConfig;
import strata.query.testutil.FakeTimeSupplier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static strata.query.allocation.policy.ReferrerGuardRailPolicy.BLOCKED_REFERRERS;
import static strata.query.allocation.policy.ReferrerGuardRailPolicy.CONCURRENT_SLOT_TIMEOUT_SECONDS;
import static strata.query.allocation.policy.ReferrerGuardRailPolicy.REFERRER_REJECTION_THRESHOLD;
import static strata.query.allocation.policy.ReferrerGuardRailPolicy.REFERRER_REJECTION_THRESHOLD_OVERRIDE;
import static strata.query.allocation.policy.ReferrerGuardRailPolicy.REFERRER_THROTTLE_THRESHOLD;
import static strata.query.testutil.TestPolicyArgs.argsByTenantTypes;

public class ReferrerGuardRailPolicyTest {

    private final InMemoryRuntimeConfig runtimeConfig = new InMemoryRuntimeConfig();
    private final FakeTimeSupplier timeSupplier = FakeTimeSupplier.startingAt("2025-03-01T10:00:00Z");
    private final ReferrerGuardRailPolicy policy = new ReferrerGuardRailPolicy(
            argsByTenantTypes(runtimeConfig, timeSupplier, TenantContext.REFERRER).build());
    private final TenantContext tenant = TenantContext.builder().referrer("api").build();

    @Test
    public void shouldRejectBlockedReferrer() {
        // Given
        policy.setConfigValue(BLOCKED_REFERRERS, "tagstore, api", Map.of());

        // When
        PolicyEvaluation evaluation = policy.evaluate("request-1", tenant, 0);

        // Then
        assertThat(evaluation.getDecision()).isEqualTo(PolicyDecision.reject(
                "ReferrerGuardRailPolicy", "referrer api is blocked"));
    }

    @Test
    public void shouldKeepCountingRunningRequestsWithLargestSlotTimeout() {
        // Given
        policy.setConfigValue(CONCURRENT_SLOT_TIMEOUT_SECONDS, String.valueOf(Long.MAX_VALUE), Map.of());
        policy.setConfigValue(REFERRER_THROTTLE_THRESHOLD, "1", Map.of());
        policy.evaluate("request-1", tenant, 0);

        // When
        PolicyEvaluation evaluation = policy.evaluate("request-2", tenant, 0);

        // Then
        assertThat(evaluation.admitted()).isTrue();
        assertThat(evaluation.getAllowance().isThrottled()).isTrue();
    }

    @Test
    public void shouldReduceThreadsOverThrottleThreshold() {
        // Given
        policy.setConfigValue(REFERRER_THROTTLE_THRESHOLD, "1", Map.of());
        PolicyEvaluation first = policy.evaluate("request-1", tenant, 0);

        // When
        PolicyEvaluation second = policy.evaluate("request-2", tenant, 0);

        // Then
        assertThat(first.getAllowance().getMaxThreads()).isEqualTo(10);
        assertThat(first.getAllowance().isThrottled()).isFalse();
        assertThat(second.admitted()).isTrue();
        assertThat(second.getAllowance().getMaxThreads()).isEqualTo(1);
        assertThat(second.getAllowance().isThrottled()).isTrue();
    }

    @Test
    public void shouldThrottleAtRejectionThreshold() {
        // Given
        policy.setConfigValue(REFERRER_REJECTION_THRESHOLD, "2", Map.of());
        policy.evaluate("request-1", tenant, 0);
        policy.evaluate("request-2", tenant, 0);

        // When
        PolicyEvaluation evaluation = policy.evaluate("request-3", tenant, 0);

        // Then
        assertThat(evaluation.getDecision().getType()).isEqualTo(PolicyDecision.Type.THROTTLE);
        assertThat(evaluation.getDecision().getRetryAfter()).contains(Duration.ofSeconds(1));
    }

    @Test
    public void shouldApplyRejectionThresholdOverrideForReferrer() {
        // Given
        policy.setConfigValue(REFERRER_REJECTION_THRESHOLD_OVERRIDE, "1", Map.of(TenantContext.REFERRER, "api"));
        policy.evaluate("request-1", tenant, 0);

        // When
        PolicyEvaluation sameReferrer = policy.evaluate("request-2", tenant, 0);
        PolicyEvaluation otherReferrer = policy.evaluate("request-3", TenantContext.builder().referrer("ui").build(), 0);

        // Then
        assertThat(sameReferrer.admitted()).isFalse();
        assertThat(otherReferrer.admitted()).isTrue();
    }

    @Test
    public void shouldAdmitAgainOnceRequestFinishes() {
        // Given
        policy.setConfigValue(REFERRER_REJECTION_THRESHOLD, "1", Map.of());
        policy.evaluate("request-1", tenant, 0);
        policy.updateQuotaBalance("request-1", tenant, QueryOutcome.failed());

        // When
        PolicyEvaluation evaluation = policy.evaluate("request-2", tenant, 0);

        // Then
        assertThat(evaluation.admitted()).isTrue();
    }
}
