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

import strata.core.tenant.TenantContext;
import strata.query.allocation.AllocationPolicy;
import strata.query.allocation.AllocationPolicyArgs;
import strata.query.allocation.AllocationPolicyConfigDefinition;
import strata.query.allocation.ConfigValueType;
import strata.query.allocation.InFlightRequests;
import strata.query.allocation.PolicyRequest;
import strata.query.allocation.QueryOutcome;
import strata.query.allocation.QuotaAllowance;
import strata.query.allocation.SlidingWindowCounter;
import strata.query.allocation.TenantQuotaCache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Limits how many requests a tenant may have running at once, and how many it may start in any one second. A request
 * over either limit is throttled, and may be retried once a running request finishes or the second has passed.
 * <p>
 * The concurrency limit may be overridden for an organisation or for a referrer. An organisation override takes
 * precedence over a referrer override.
 */
public class ConcurrentRateLimitAllocationPolicy extends AllocationPolicy {

    public static final String CONCURRENT_LIMIT = "concurrent_limit";
    public static final String RATE_LIMIT_PER_SECOND = "rate_limit_per_second";
    public static final String ORGANIZATION_CONCURRENT_OVERRIDE = "organization_concurrent_override";
    public static final String REFERRER_CONCURRENT_OVERRIDE = "referrer_concurrent_override";
    public static final String CONCURRENT_SLOT_TIMEOUT_SECONDS = "concurrent_slot_timeout_seconds";
    public static final Duration CONCURRENCY_RETRY_AFTER = Duration.ofSeconds(1);
    public static final String QUOTA_UNIT = "concurrent_queries";

    private static final int RATE_WINDOW_BUCKETS = 10;
    private static final List<AllocationPolicyConfigDefinition> DEFINITIONS = List.of(
            intConfig(CONCURRENT_LIMIT, "The number of requests a tenant may have running at once", 22),
            intConfig(RATE_LIMIT_PER_SECOND, "The number of requests a tenant may start in one second, 0 for no limit", 0),
            intConfig(CONCURRENT_SLOT_TIMEOUT_SECONDS, "How long a running request may hold its slot if it is never released", 600),
            AllocationPolicyConfigDefinition.builder()
                    .name(ORGANIZATION_CONCURRENT_OVERRIDE)
                    .description("The concurrency limit for an organisation, -1 to use the default")
                    .valueType(ConfigValueType.INT).defaultValue(-1)
                    .paramNames(TenantContext.ORGANIZATION_ID)
                    .build(),
            AllocationPolicyConfigDefinition.builder()
                    .name(REFERRER_CONCURRENT_OVERRIDE)
                    .description("The concurrency limit for a referrer, -1 to use the default")
                    .valueType(ConfigValueType.INT).defaultValue(-1)
                    .paramNames(TenantContext.REFERRER)
                    .build());

    private final TenantQuotaCache<State> states;

    public ConcurrentRateLimitAllocationPolicy(AllocationPolicyArgs args) {
        super(args, DEFINITIONS);
        states = new TenantQuotaCache<>(State::new,
                args.getTenantIdleExpiry(), args.getMaxTrackedTenants(), args.getTimeSupplier());
    }

    @Override
    protected QuotaAllowance computeQuotaAllowance(PolicyRequest request) {
        long concurrentLimit = getConcurrentLimit(request.tenant());
        long rateLimit = getLongConfig(RATE_LIMIT_PER_SECOND);
        Duration slotTimeout = Duration.ofSeconds(getLongConfig(CONCURRENT_SLOT_TIMEOUT_SECONDS));
        long maxThreads = getMaxThreads();
        Instant now = now();
        return states.update(request.tenantKey(), state -> {
            int running = state.running.count(now, slotTimeout);
            if (running >= concurrentLimit) {
                return throttled(running, concurrentLimit, CONCURRENCY_RETRY_AFTER,
                        "concurrent limit of " + concurrentLimit + " reached for " + request.tenantKey());
            }
            long startedInLastSecond = state.started.sum(now);
            if (rateLimit > 0 && startedInLastSecond >= rateLimit) {
                return throttled(running, concurrentLimit, state.started.timeUntilOldestExpires(now),
                        "rate limit of " + rateLimit + " per second reached for " + request.tenantKey());
            }
            state.running.add(request.requestId(), now);
            state.started.add(now, 1);
            return QuotaAllowance.builder()
                    .canRun(true).maxThreads(maxThreads)
                    .quotaUsed(running + 1L).quotaUnit(QUOTA_UNIT)
                    .throttleThreshold(concurrentLimit).rejectionThreshold(concurrentLimit)
                    .explanation(Map.of("concurrent", running + 1L, "started_in_last_second", startedInLastSecond + 1))
                    .build();
        });
    }

    @Override
    protected void updateBalance(PolicyRequest request, QueryOutcome outcome) {
        states.updateIfPresent(request.tenantKey(), state -> {
            state.running.remove(request.requestId());
            return null;
        });
    }

    @Override
    public void resetQuotaState() {
        states.clear();
    }

    private long getConcurrentLimit(TenantContext tenant) {
        Optional<Long> organizationOverride = tenant.getOrganizationId()
                .flatMap(organization -> getLongOverride(ORGANIZATION_CONCURRENT_OVERRIDE,
                        Map.of(TenantContext.ORGANIZATION_ID, organization)));
        if (organizationOverride.isPresent()) {
            return organizationOverride.get();
        }
        return tenant.getReferrer()
                .flatMap(referrer -> getLongOverride(REFERRER_CONCURRENT_OVERRIDE, Map.of(TenantContext.REFERRER, referrer)))
                .orElseGet(() -> getLongConfig(CONCURRENT_LIMIT));
    }

    private static QuotaAllowance throttled(int running, long concurrentLimit, Duration retryAfter, String reason) {
        return QuotaAllowance.builder()
                .canRun(false).maxThreads(0).throttled(true)
                .quotaUsed(running).quotaUnit(QUOTA_UNIT)
                .throttleThreshold(concurrentLimit).rejectionThreshold(concurrentLimit)
                .retryAfter(retryAfter)
                .suggestion("wait for running requests to finish, or spread requests out over time")
                .explanation(Map.of("reason", reason))
                .build();
    }

    /**
     * Quota usage for one tenant.
     */
    private static class State {
        private final InFlightRequests running = new InFlightRequests();
        private final SlidingWindowCounter started = new SlidingWindowCounter(Duration.ofSeconds(1), RATE_WINDOW_BUCKETS);
    }
}
