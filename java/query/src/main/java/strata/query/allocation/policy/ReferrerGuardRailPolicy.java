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
import strata.query.allocation.TenantQuotaCache;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Stops any one referrer from taking over the backend. Referrers known to be abusive are refused outright. Otherwise
 * the requests each referrer has running are counted: above one threshold its requests get fewer threads, and at a
 * second threshold they are throttled.
 */
public class ReferrerGuardRailPolicy extends AllocationPolicy {

    public static final String BLOCKED_REFERRERS = "blocked_referrers";
    public static final String REFERRER_THROTTLE_THRESHOLD = "referrer_throttle_threshold";
    public static final String REFERRER_REJECTION_THRESHOLD = "referrer_rejection_threshold";
    public static final String REFERRER_REJECTION_THRESHOLD_OVERRIDE = "referrer_rejection_threshold_override";
    public static final String THROTTLED_THREAD_NUMBER = "throttled_thread_number";
    public static final String CONCURRENT_SLOT_TIMEOUT_SECONDS = "concurrent_slot_timeout_seconds";
    public static final Duration RETRY_AFTER = Duration.ofSeconds(1);
    public static final String QUOTA_UNIT = "concurrent_queries";

    private static final List<AllocationPolicyConfigDefinition> DEFINITIONS = List.of(
            AllocationPolicyConfigDefinition.builder()
                    .name(BLOCKED_REFERRERS)
                    .description("Comma separated referrers whose requests are always refused")
                    .valueType(ConfigValueType.STRING).defaultValue("")
                    .build(),
            intConfig(REFERRER_THROTTLE_THRESHOLD, "The running requests above which a referrer's requests get fewer threads", 50),
            intConfig(REFERRER_REJECTION_THRESHOLD, "The running requests at which a referrer's requests are throttled", 100),
            intConfig(THROTTLED_THREAD_NUMBER, "The threads a request gets once its referrer is over the throttle threshold", 1),
            intConfig(CONCURRENT_SLOT_TIMEOUT_SECONDS, "How long a running request is counted if it is never released", 600),
            AllocationPolicyConfigDefinition.builder()
                    .name(REFERRER_REJECTION_THRESHOLD_OVERRIDE)
                    .description("The rejection threshold for a referrer, -1 to use the default")
                    .valueType(ConfigValueType.INT).defaultValue(-1)
                    .paramNames(TenantContext.REFERRER)
                    .build());

    private final TenantQuotaCache<InFlightRequests> states;

    public ReferrerGuardRailPolicy(AllocationPolicyArgs args) {
        super(args, DEFINITIONS);
        states = new TenantQuotaCache<>(InFlightRequests::new,
                args.getTenantIdleExpiry(), args.getMaxTrackedTenants(), args.getTimeSupplier());
    }

    @Override
    protected QuotaAllowance computeQuotaAllowance(PolicyRequest request) {
        String referrer = request.tenant().getReferrer().orElse("");
        if (isBlocked(referrer)) {
            return QuotaAllowance.builder()
                    .canRun(false).maxThreads(0)
                    .suggestion("requests from this referrer are not accepted")
                    .explanation(Map.of("reason", "referrer " + referrer + " is blocked"))
                    .build();
        }
        long throttleThreshold = getLongConfig(REFERRER_THROTTLE_THRESHOLD);
        long rejectionThreshold = getLongOverride(REFERRER_REJECTION_THRESHOLD_OVERRIDE, Map.of(TenantContext.REFERRER, referrer))
                .orElseGet(() -> getLongConfig(REFERRER_REJECTION_THRESHOLD));
        long throttledThreads = getLongConfig(THROTTLED_THREAD_NUMBER);
        long maxThreads = getMaxThreads();
        Duration slotTimeout = Duration.ofSeconds(getLongConfig(CONCURRENT_SLOT_TIMEOUT_SECONDS));
        Instant now = now();
        return states.update(request.tenantKey(), running -> {
            int count = running.count(now, slotTimeout);
            if (count >= rejectionThreshold) {
                return QuotaAllowance.builder()
                        .canRun(false).maxThreads(0).throttled(true)
                        .quotaUsed(count).quotaUnit(QUOTA_UNIT)
                        .throttleThreshold(throttleThreshold).rejectionThreshold(rejectionThreshold)
                        .retryAfter(RETRY_AFTER)
                        .suggestion("reduce the number of requests from this referrer running at once")
                        .explanation(Map.of("reason", "referrer " + referrer + " has " + count + " requests running"))
                        .build();
            }
            running.add(request.requestId(), now);
            boolean throttled = count + 1 > throttleThreshold;
            return QuotaAllowance.builder()
                    .canRun(true).maxThreads(throttled ? Math.min(throttledThreads, maxThreads) : maxThreads)
                    .throttled(throttled)
                    .quotaUsed(count + 1L).quotaUnit(QUOTA_UNIT)
                    .throttleThreshold(throttleThreshold).rejectionThreshold(rejectionThreshold)
                    .build();
        });
    }

    @Override
    protected void updateBalance(PolicyRequest request, QueryOutcome outcome) {
        states.updateIfPresent(request.tenantKey(), running -> {
            running.remove(request.requestId());
            return null;
        });
    }

    @Override
    public void resetQuotaState() {
        states.clear();
    }

    private boolean isBlocked(String referrer) {
        return Arrays.stream(getStringConfig(BLOCKED_REFERRERS).split(","))
                .map(String::trim)
                .anyMatch(blocked -> !blocked.isEmpty() && blocked.equals(referrer));
    }
}
