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
package strata.query.router;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import strata.core.dataset.DatasetNotFoundException;
import strata.core.tenant.TenantContext;
import strata.query.allocation.PolicyEvaluation;
import strata.query.allocation.PolicyRejectionException;
import strata.query.allocation.PolicyThrottleException;
import strata.query.backend.BackendExecutionException;
import strata.query.backend.QueryBackend;
import strata.query.checker.MissingConditionException;
import strata.query.config.InMemoryRuntimeConfig;
import strata.query.log.QueryLogEntry;
import strata.query.log.QueryStatus;
import strata.query.model.Conditions;
import strata.query.model.Query;
import strata.query.model.QueryProcessingException;
import strata.query.testutil.FakeQueryBackend;
import strata.query.testutil.FakeTimeSupplier;
import strata.query.testutil.InMemoryQueryLog;
import strata.query.testutil.TestDatasets;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static strata.query.testutil.TestPolicyArgs.organization;
import static strata.query.testutil.TestQueries.column;
import static strata.query.testutil.TestQueries.literal;
import static strata.query.testutil.TestQueries.organizationIs;
import static strata.query.testutil.TestQueries.selectBody;
import static strata.query.testutil.TestQueries.selectBodyForOrganization;

public class DatasetRouterTest {

    private final InMemoryRuntimeConfig runtimeConfig = new InMemoryRuntimeConfig();
    private final FakeTimeSupplier timeSupplier = FakeTimeSupplier.startingAt("2025-03-01T10:00:00Z");
    private final FakeQueryBackend backend = new FakeQueryBackend();
    private final InMemoryQueryLog queryLog = new InMemoryQueryLog();
    private DatasetRegistry registry;

    @BeforeEach
    void setUp() {
        registry = DatasetRegistry.from(List.of(TestDatasets.logsDataset(runtimeConfig, timeSupplier)));
    }

    @Nested
    class RunQuery {

        @Test
        void shouldRunRewrittenQueryAgainstDistributedTable() throws Exception {
            // Given
            Query query = Query.builder()
                    .datasetKey("ourlogs")
                    .select(column("span_id"))
                    .condition(Conditions.and(organizationIs(1),
                            Conditions.equals(column("trace_id"), literal("7400045B25C443B885914600AA83AD04"))))
                    .build();
            backend.returningRows(List.of(Map.of("span_id", "1a2b"))).scanningBytes(1024);

            // When
            QueryResponse response = router().execute(request(query));

            // Then
            assertThat(response.sql()).isEqualTo("SELECT lower(hex(span_id)) FROM ourlogs_dist " +
                    "WHERE (organization_id = 1 AND trace_id = '7400045b-25c4-43b8-8591-4600aa83ad04')");
            assertThat(response.result().getRows()).containsExactly(Map.of("span_id", "1a2b"));
            assertThat(backend.getExecuted()).singleElement()
                    .extracting(FakeQueryBackend.ExecutedQuery::sql).isEqualTo(response.sql());
            assertThat(queryLog.getOnlyEntry()).satisfies(entry -> {
                assertThat(entry.getRequestId()).isEqualTo("request-1");
                assertThat(entry.getStatus()).isEqualTo(QueryStatus.SUCCESS);
                assertThat(entry.getSql()).contains(response.sql());
                assertThat(entry.getBytesScanned()).isEqualTo(1024);
            });
        }

        @Test
        void shouldLimitThreadsToFewestAllowedByPolicies() throws Exception {
            // Given
            runtimeConfig.set("ourlogs.BytesScannedRejectingPolicy.max_threads", "3");

            // When
            QueryResponse response = router().execute(request(selectBodyForOrganization(1)));

            // Then
            assertThat(response.settings()).containsEntry("max_threads", 3L);
        }

        @Test
        void shouldKeepCallerThreadLimitWhenLower() throws Exception {
            // Given
            Query query = selectBody()
                    .condition(organizationIs(1))
                    .settings(Map.of("max_threads", 2L))
                    .build();

            // When
            QueryResponse response = router().execute(request(query));

            // Then
            assertThat(response.settings()).containsEntry("max_threads", 2L);
        }

        @Test
        void shouldApplySettingsFromRuntimeCallerAndDatasetInOrder() throws Exception {
            // Given
            runtimeConfig.set("query_settings/max_execution_time", "10");
            runtimeConfig.set("query_settings/load_balancing", "random");
            runtimeConfig.set("referrer/api/query_settings/max_memory_usage", "1000");
            Query query = selectBody()
                    .condition(organizationIs(1))
                    .settings(Map.of("max_execution_time", 20L, "load_balancing", "in_order"))
                    .build();
            QueryRequest request = QueryRequest.builder()
                    .requestId("request-1")
                    .query(query)
                    .tenant(TenantContext.builder().organizationId(1).referrer("api").build())
                    .build();

            // When
            QueryResponse response = router().execute(request);

            // Then
            assertThat(response.settings())
                    .containsEntry("max_execution_time", 30L)
                    .containsEntry("load_balancing", "in_order")
                    .containsEntry("max_memory_usage", 1000L);
        }

        @Test
        void shouldRecordDryRunViolationButStillRunQuery() throws Exception {
            // Given
            runtimeConfig.set("ourlogs.ConcurrentRateLimitAllocationPolicy.concurrent_limit", "0");
            runtimeConfig.set("ourlogs.ConcurrentRateLimitAllocationPolicy.is_enforced", "0");

            // When
            QueryResponse response = router().execute(request(selectBodyForOrganization(1)));

            // Then
            assertThat(response.quotaAllowance().getDryRunViolations())
                    .extracting(PolicyEvaluation::getPolicyName)
                    .containsExactly("ConcurrentRateLimitAllocationPolicy");
            assertThat(backend.getExecuted()).hasSize(1);
        }
    }

    @Nested
    class RefuseQuery {

        @Test
        void shouldRefuseUnknownDataset() {
            // Given
            Query query = Query.builder().datasetKey("missing").select(column("body")).build();

            // When / Then
            assertThatThrownBy(() -> router().execute(request(query)))
                    .isInstanceOf(DatasetNotFoundException.class);
            assertThat(queryLog.getOnlyEntry().getStatus()).isEqualTo(QueryStatus.INVALID_REQUEST);
        }

        @Test
        void shouldRefuseQueryWhichCannotBeRewritten() {
            // Given
            Query query = selectBody()
                    .condition(Conditions.and(organizationIs(1),
                            Conditions.equals(column("trace_id"), literal("not a uuid"))))
                    .build();

            // When / Then
            assertThatThrownBy(() -> router().execute(request(query)))
                    .isInstanceOf(QueryProcessingException.class)
                    .extracting("requestId").isEqualTo("request-1");
            assertThat(queryLog.getOnlyEntry().getStatus()).isEqualTo(QueryStatus.INVALID_REQUEST);
            assertThat(backend.getExecuted()).isEmpty();
        }

        @Test
        void shouldRefuseQueryNotRestrictedToOrganizationWithoutReachingBackend() {
            // Given
            QueryBackend mockBackend = mock(QueryBackend.class);
            DatasetRouter router = routerBuilder().backend(mockBackend).build();

            // When / Then
            assertThatThrownBy(() -> router.execute(request(selectBody().build())))
                    .isInstanceOf(MissingConditionException.class)
                    .extracting("requestId").isEqualTo("request-1");
            verifyNoInteractions(mockBackend);
            QueryLogEntry entry = queryLog.getOnlyEntry();
            assertThat(entry.getStatus()).isEqualTo(QueryStatus.MISSING_CONDITION);
            assertThat(entry.getQuotaAllowance()).isEmpty();
        }

        @Test
        void shouldThrottleWhenConcurrentLimitReached() {
            // Given
            runtimeConfig.set("ourlogs.ConcurrentRateLimitAllocationPolicy.concurrent_limit", "0");

            // When / Then
            assertThatThrownBy(() -> router().execute(request(selectBodyForOrganization(1))))
                    .isInstanceOfSatisfying(PolicyThrottleException.class, e -> {
                        assertThat(e.getPolicyName()).isEqualTo("ConcurrentRateLimitAllocationPolicy");
                        assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(1));
                        assertThat(e.isRetriable()).isTrue();
                    });
            assertThat(queryLog.getOnlyEntry().getStatus()).isEqualTo(QueryStatus.RATE_LIMITED);
            assertThat(backend.getExecuted()).isEmpty();
        }

        @Test
        void shouldRejectWhenBytesScannedLimitWouldBeExceeded() {
            // Given
            runtimeConfig.set("ourlogs.BytesScannedRejectingPolicy.bytes_scanned_limit", "1000");
            QueryRequest request = QueryRequest.builder()
                    .requestId("request-1")
                    .query(selectBodyForOrganization(1))
                    .tenant(organization(1))
                    .estimatedBytesScanned(5000)
                    .build();

            // When / Then
            assertThatThrownBy(() -> router().execute(request))
                    .isInstanceOfSatisfying(PolicyRejectionException.class, e -> {
                        assertThat(e.getPolicyName()).isEqualTo("BytesScannedRejectingPolicy");
                        assertThat(e.isRetriable()).isFalse();
                    });
            assertThat(queryLog.getOnlyEntry().getStatus()).isEqualTo(QueryStatus.REJECTED);
        }

        @Test
        void shouldReleaseConcurrencySlotWhenLaterPolicyRejects() throws Exception {
            // Given
            runtimeConfig.set("ourlogs.ConcurrentRateLimitAllocationPolicy.concurrent_limit", "1");
            runtimeConfig.set("ourlogs.BytesScannedRejectingPolicy.bytes_scanned_limit", "1000");
            QueryRequest tooLarge = QueryRequest.builder()
                    .requestId("request-1")
                    .query(selectBodyForOrganization(1))
                    .tenant(organization(1))
                    .estimatedBytesScanned(5000)
                    .build();
            assertThatThrownBy(() -> router().execute(tooLarge)).isInstanceOf(PolicyRejectionException.class);

            // When
            QueryResponse response = router().execute(request("request-2", selectBodyForOrganization(1)));

            // Then
            assertThat(response.requestId()).isEqualTo("request-2");
        }
    }

    @Nested
    class BackendFailure {

        @Test
        void shouldReportFailureAndReleaseConcurrencySlot() throws Exception {
            // Given
            runtimeConfig.set("ourlogs.ConcurrentRateLimitAllocationPolicy.concurrent_limit", "1");
            backend.failingWith(new IllegalStateException("connection refused"));
            assertThatThrownBy(() -> router().execute(request(selectBodyForOrganization(1))))
                    .isInstanceOf(BackendExecutionException.class)
                    .extracting("requestId").isEqualTo("request-1");
            backend.succeeding();

            // When
            QueryResponse response = router().execute(request("request-2", selectBodyForOrganization(1)));

            // Then
            assertThat(response.requestId()).isEqualTo("request-2");
            assertThat(queryLog.getEntries()).extracting(QueryLogEntry::getStatus)
                    .containsExactly(QueryStatus.ERROR, QueryStatus.SUCCESS);
        }
    }

    private DatasetRouter router() {
        return routerBuilder().build();
    }

    private DatasetRouter.Builder routerBuilder() {
        return DatasetRouter.builder()
                .registry(registry)
                .backend(backend)
                .runtimeConfig(runtimeConfig)
                .queryLog(queryLog)
                .timeSupplier(timeSupplier);
    }

    private static QueryRequest request(Query query) {
        return request("request-1", query);
    }

    private static QueryRequest request(String requestId, Query query) {
        return QueryRequest.builder()
                .requestId(requestId)
                .query(query)
                .tenant(organization(1))
                .build();
    }
}
