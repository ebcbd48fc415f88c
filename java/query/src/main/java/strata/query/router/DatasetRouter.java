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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import strata.core.dataset.DatasetNotFoundException;
import strata.core.tenant.TenantContext;
import strata.core.util.LoggedDuration;
import strata.query.allocation.AllocationPolicyViolationException;
import strata.query.allocation.AllocationResult;
import strata.query.allocation.PolicyDecision;
import strata.query.allocation.QueryOutcome;
import strata.query.allocation.QuotaAllowanceSummary;
import strata.query.backend.BackendExecutionException;
import strata.query.backend.QueryBackend;
import strata.query.backend.QueryResult;
import strata.query.checker.MandatoryConditionChecker;
import strata.query.checker.MissingConditionException;
import strata.query.config.QuerySettingsConfig;
import strata.query.config.RuntimeConfig;
import strata.query.log.LoggingQueryLogListener;
import strata.query.log.QueryLogEntry;
import strata.query.log.QueryLogListener;
import strata.query.log.QueryStatus;
import strata.query.model.Query;
import strata.query.model.QueryFormatter;
import strata.query.model.QueryProcessingException;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs queries against datasets. A query is rewritten by the dataset's query processors, checked for mandatory
 * conditions, and admitted by the dataset's allocation policies before it is sent to the backend. Processing stops at
 * the first failure, and the backend is never called for a query that failed any of these steps. Every request is
 * recorded in the query log.
 */
public class DatasetRouter {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetRouter.class);
    private static final Marker SECURITY = MarkerFactory.getMarker("SECURITY");

    public static final String MAX_THREADS_SETTING = "max_threads";

    private final DatasetRegistry registry;
    private final QueryBackend backend;
    private final QuerySettingsConfig querySettingsConfig;
    private final QueryLogListener queryLog;
    private final Supplier<String> requestIdSupplier;
    private final Supplier<Instant> timeSupplier;

    private DatasetRouter(Builder builder) {
        registry = Objects.requireNonNull(builder.registry, "registry must not be null");
        backend = Objects.requireNonNull(builder.backend, "backend must not be null");
        querySettingsConfig = new QuerySettingsConfig(Objects.requireNonNull(builder.runtimeConfig, "runtimeConfig must not be null"));
        queryLog = builder.queryLog;
        requestIdSupplier = builder.requestIdSupplier;
        timeSupplier = builder.timeSupplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs a query.
     *
     * @param  request                             the request
     * @return                                     the result from the backend
     * @throws DatasetNotFoundException            if the dataset does not exist
     * @throws QueryProcessingException            if the query could not be rewritten
     * @throws MissingConditionException           if the query is missing a mandatory condition
     * @throws AllocationPolicyViolationException if an allocation policy turned the request away
     * @throws BackendExecutionException           if the backend failed to run the query
     */
    public QueryResponse execute(QueryRequest request) throws QueryProcessingException, MissingConditionException,
            AllocationPolicyViolationException, BackendExecutionException {
        String requestId = request.getRequestId().orElseGet(requestIdSupplier);
        Instant startTime = timeSupplier.get();
        QueryLogEntry.Builder logEntry = QueryLogEntry.builder()
                .requestId(requestId)
                .datasetKey(request.getDatasetKey())
                .tenant(request.getTenant())
                .status(QueryStatus.ERROR)
                .startTime(startTime);
        try {
            return execute(requestId, request, logEntry);
        } finally {
            Instant finishTime = timeSupplier.get();
            LOGGER.debug("Request {} took {}", requestId, LoggedDuration.between(startTime, finishTime));
            queryLog.requestFinished(logEntry.duration(Duration.between(startTime, finishTime)).build());
        }
    }

    private QueryResponse execute(String requestId, QueryRequest request, QueryLogEntry.Builder logEntry)
            throws QueryProcessingException, MissingConditionException, AllocationPolicyViolationException, BackendExecutionException {
        TenantContext tenant = request.getTenant();
        Dataset dataset;
        try {
            dataset = registry.resolve(request.getDatasetKey());
        } catch (DatasetNotFoundException e) {
            logEntry.status(QueryStatus.INVALID_REQUEST).errorMessage(e.getMessage());
            throw e;
        }

        Query query = withRuntimeSettings(request);
        try {
            query = dataset.getQueryProcessors().apply(query);
        } catch (QueryProcessingException e) {
            logEntry.status(QueryStatus.INVALID_REQUEST).errorMessage(e.getMessage());
            throw e.forRequest(requestId);
        }

        for (MandatoryConditionChecker checker : dataset.getMandatoryConditionCheckers()) {
            try {
                checker.check(query);
            } catch (MissingConditionException e) {
                LOGGER.warn(SECURITY, "Refused request {} against dataset {} for {}: {}",
                        requestId, dataset.getKey(), tenant.getDimensions(), e.getMessage());
                logEntry.status(QueryStatus.MISSING_CONDITION).errorMessage(e.getMessage());
                throw e.forRequest(requestId);
            }
        }

        AllocationResult allocation = dataset.getAllocationPolicies()
                .evaluate(requestId, tenant, request.getEstimatedBytesScanned());
        QuotaAllowanceSummary summary = allocation.getSummary();
        logEntry.quotaAllowance(summary);
        PolicyDecision decision = allocation.getDecision();
        if (!decision.isAllowed()) {
            AllocationPolicyViolationException violation = allocation.toViolation(requestId);
            logEntry.status(decision.getType() == PolicyDecision.Type.THROTTLE ? QueryStatus.RATE_LIMITED : QueryStatus.REJECTED)
                    .errorMessage(violation.getMessage());
            throw violation;
        }

        Map<String, Object> settings = withMaxThreads(query.getSettings(), summary);
        query = query.toBuilder().settings(settings).build();
        String sql = QueryFormatter.format(query, dataset.getStorageTables().getDistributedTableName());
        logEntry.sql(sql).settings(settings);

        QueryResult result;
        try {
            result = backend.execute(sql, query, settings);
        } catch (BackendExecutionException e) {
            dataset.getAllocationPolicies().updateQuotaBalance(requestId, tenant, summary, QueryOutcome.failed());
            logEntry.status(QueryStatus.ERROR).errorMessage(e.getMessage());
            throw e.forRequest(requestId);
        } catch (RuntimeException e) {
            dataset.getAllocationPolicies().updateQuotaBalance(requestId, tenant, summary, QueryOutcome.failed());
            logEntry.status(QueryStatus.ERROR).errorMessage(e.getMessage());
            throw new BackendExecutionException(requestId, "Backend failed running request " + requestId, e);
        }
        dataset.getAllocationPolicies().updateQuotaBalance(requestId, tenant, summary,
                QueryOutcome.succeeded(result.getProfile()));
        logEntry.status(QueryStatus.SUCCESS).bytesScanned(result.getProfile().bytesScanned());
        return new QueryResponse(requestId, result, sql, settings, summary);
    }

    private Query withRuntimeSettings(QueryRequest request) {
        Map<String, Object> settings = querySettingsConfig.getSettings(
                request.getSettingsPrefix(), request.isAsync(), request.getTenant().getReferrer());
        settings.putAll(request.getQuery().getSettings());
        return request.getQuery().toBuilder().settings(settings).build();
    }

    private static Map<String, Object> withMaxThreads(Map<String, Object> settings, QuotaAllowanceSummary summary) {
        Map<String, Object> withThreads = new LinkedHashMap<>(settings);
        summary.getThreadsUsed().ifPresent(threads -> {
            Object existing = withThreads.get(MAX_THREADS_SETTING);
            long maxThreads = existing instanceof Number number ? Math.min(number.longValue(), threads) : threads;
            withThreads.put(MAX_THREADS_SETTING, maxThreads);
        });
        return withThreads;
    }

    /**
     * Builds a dataset router.
     */
    public static final class Builder {
        private DatasetRegistry registry;
        private QueryBackend backend;
        private RuntimeConfig runtimeConfig;
        private QueryLogListener queryLog = new LoggingQueryLogListener();
        private Supplier<String> requestIdSupplier = () -> UUID.randomUUID().toString();
        private Supplier<Instant> timeSupplier = Instant::now;

        private Builder() {
        }

        public Builder registry(DatasetRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder backend(QueryBackend backend) {
            this.backend = backend;
            return this;
        }

        public Builder runtimeConfig(RuntimeConfig runtimeConfig) {
            this.runtimeConfig = runtimeConfig;
            return this;
        }

        public Builder queryLog(QueryLogListener queryLog) {
            this.queryLog = queryLog;
            return this;
        }

        public Builder requestIdSupplier(Supplier<String> requestIdSupplier) {
            this.requestIdSupplier = requestIdSupplier;
            return this;
        }

        public Builder timeSupplier(Supplier<Instant> timeSupplier) {
            this.timeSupplier = timeSupplier;
            return this;
        }

        public DatasetRouter build() {
            return new DatasetRouter(this);
        }
    }
}
