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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import strata.core.tenant.TenantContext;
import strata.query.config.InMemoryRuntimeConfig;
import strata.query.testutil.FakeTimeSupplier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static strata.query.testutil.TestPolicyArgs.argsByOrganization;
import static strata.query.testutil.TestPolicyArgs.organization;

public class AllocationPolicyTest {

    private final InMemoryRuntimeConfig runtimeConfig = new InMemoryRuntimeConfig();
    private final FakeTimeSupplier timeSupplier = FakeTimeSupplier.startingAt("2025-03-01T10:00:00Z");

    @Nested
    class EvaluateRequest {

        @Test
        void shouldSkipWhenInactive() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.rejecting("policy", args(), "over quota");
            policy.setConfigValue(AllocationPolicy.IS_ACTIVE, "0", Map.of());

            // When
            PolicyEvaluation evaluation = policy.evaluate("request-1", organization(1), 0);

            // Then
            assertThat(evaluation.isAssessed()).isFalse();
            assertThat(evaluation.getMode()).isEqualTo(PolicyMode.INACTIVE);
            assertThat(evaluation.getEffectiveDecision().isAllowed()).isTrue();
            assertThat(policy.getComputeCount()).isZero();
        }

        @Test
        void shouldRecordViolationInDryRun() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.rejecting("policy", args(), "over quota");
            policy.setConfigValue(AllocationPolicy.IS_ENFORCED, "0", Map.of());

            // When
            PolicyEvaluation evaluation = policy.evaluate("request-1", organization(1), 0);

            // Then
            assertThat(evaluation.getMode()).isEqualTo(PolicyMode.DRY_RUN);
            assertThat(evaluation.getDecision()).isEqualTo(PolicyDecision.reject("policy", "over quota"));
            assertThat(evaluation.getEffectiveDecision().isAllowed()).isTrue();
            assertThat(evaluation.isDryRunViolation()).isTrue();
            assertThat(evaluation.admitted()).isFalse();
        }

        @Test
        void shouldSkipWhenTenantDimensionMissing() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.rejecting("policy", args(), "over quota");

            // When
            PolicyEvaluation evaluation = policy.evaluate("request-1", TenantContext.none(), 0);

            // Then
            assertThat(evaluation.isAssessed()).isFalse();
            assertThat(evaluation.getEffectiveDecision().isAllowed()).isTrue();
            assertThat(policy.getComputeCount()).isZero();
        }

        @Test
        void shouldRejectWhenMandatoryTenantDimensionMissing() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy", args(), 10);
            policy.setConfigValue(AllocationPolicy.IS_MANDATORY, "1", Map.of());

            // When
            PolicyEvaluation evaluation = policy.evaluate("request-1", TenantContext.none(), 0);

            // Then
            assertThat(evaluation.getEffectiveDecision()).isEqualTo(PolicyDecision.reject("policy",
                    "missing required tenant dimensions [organization_id]"));
            assertThat(policy.getComputeCount()).isZero();
        }
    }

    @Nested
    class ManageConfig {

        @Test
        void shouldReportDefaultsAsCurrentConfig() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy", args(), 10);

            // When / Then
            assertThat(policy.getCurrentConfigs())
                    .extracting(value -> value.definition().getName(), AllocationPolicyConfigValue::value)
                    .containsExactly(
                            tuple(AllocationPolicy.IS_ACTIVE, 1L),
                            tuple(AllocationPolicy.IS_ENFORCED, 1L),
                            tuple(AllocationPolicy.IS_MANDATORY, 0L),
                            tuple(AllocationPolicy.MAX_THREADS, 10L));
        }

        @Test
        void shouldSetAndDeleteConfigInRuntimeConfig() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy", args(), 10);

            // When
            policy.setConfigValue(AllocationPolicy.MAX_THREADS, "4", Map.of());

            // Then
            assertThat(runtimeConfig.get("ourlogs.policy.max_threads")).contains("4");
            assertThat(policy.getMaxThreads()).isEqualTo(4);

            // When
            policy.deleteConfigValue(AllocationPolicy.MAX_THREADS, Map.of());

            // Then
            assertThat(runtimeConfig.get("ourlogs.policy.max_threads")).isEmpty();
            assertThat(policy.getMaxThreads()).isEqualTo(10);
        }

        @Test
        void shouldFailToSetUnknownConfig() {
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy", args(), 10);
            assertThatThrownBy(() -> policy.setConfigValue("not_a_config", "1", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("policy has no config named not_a_config");
        }

        @Test
        void shouldFailToSetConfigWithWrongType() {
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy", args(), 10);
            assertThatThrownBy(() -> policy.setConfigValue(AllocationPolicy.MAX_THREADS, "lots", Map.of()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Not a whole number: lots");
            assertThat(runtimeConfig.getAll()).isEmpty();
        }

        @Test
        void shouldFailToSetConfigWithUnexpectedParameters() {
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy", args(), 10);
            assertThatThrownBy(() -> policy.setConfigValue(AllocationPolicy.MAX_THREADS, "4", Map.of("referrer", "api")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldUseDefaultWhenRuntimeValueIsInvalid() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy", args(), 10);
            runtimeConfig.set("ourlogs.policy.max_threads", "lots");

            // When / Then
            assertThat(policy.getMaxThreads()).isEqualTo(10);
        }

        @Test
        void shouldApplyDefaultOverridesFromDatasetConfiguration() {
            // Given
            FixedAllowancePolicy policy = FixedAllowancePolicy.allowing("policy",
                    argsByOrganization(runtimeConfig, timeSupplier)
                            .defaultConfigOverrides(Map.of(AllocationPolicy.MAX_THREADS, 6))
                            .build(), 10);

            // When / Then
            assertThat(policy.getMaxThreads()).isEqualTo(6);
        }

        @Test
        void shouldFailWithUnknownDefaultOverride() {
            assertThatThrownBy(() -> FixedAllowancePolicy.allowing("policy",
                    argsByOrganization(runtimeConfig, timeSupplier)
                            .defaultConfigOverrides(Map.of("not_a_config", 6))
                            .build(), 10))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("has no config named not_a_config");
        }
    }

    @Test
    public void shouldRequireAtLeastOneTenantType() {
        assertThatThrownBy(() -> FixedAllowancePolicy.allowing("policy",
                argsByOrganization(runtimeConfig, timeSupplier).requiredTenantTypes(List.of()).build(), 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must require at least one tenant type");
    }

    private AllocationPolicyArgs args() {
        return argsByOrganization(runtimeConfig, timeSupplier).build();
    }
}
