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

import com.google.common.math.LongMath;

import strata.core.tenant.TenantContext;
import strata.query.allocation.AllocationPolicy;
import strata.query.allocation.AllocationPolicyArgs;
import strata.query.allocation.AllocationPolicyConfigDefinition;
import strata.query.allocation.ConfigValueType;
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
 * Limits the bytes a tenant may scan within a sliding window of time. A request is refused if the bytes already
 * scanned in the window plus its estimate would go over the limit. Above a lower threshold requests are admitted with
 * fewer threads.
 * <p>
 * The limit may be overridden for a project or for an organisation. A project override takes precedence.
 */
public class BytesScannedRejectingPolicy extends AllocationPolicy {

    public static final String BYTES_SCANNED_LIMIT = "bytes_scanned_limit";
    public static final String ORGANIZATION_BYTES_SCANNED_LIMIT_OVERRIDE = "organization_bytes_scanned_limit_override";
    public static final String PROJECT_BYTES_SCANNED_LIMIT_OVERRIDE = "project_bytes_scanned_limit_override";
    public static final String BYTES_THROTTLE_DIVIDER = "bytes_throttle_divider";
    public static final String THREADS_THROTTLE_DIVIDER = "threads_throttle_divider";
    public static final String BYTES_WINDOW_SECONDS = "bytes_window_seconds";
    public static final String QUOTA_UNIT = "bytes";

    private static final int WINDOW_BUCKETS = 60;
    private static final List<AllocationPolicyConfigDefinition> DEFINITIONS = List.of(
            intConfig(BYTES_SCANNED_LIMIT, "The bytes a tenant may scan within the window", 1_000_000_000_000L),
            intConfig(BYTES_THROTTLE_DIVIDER, "Divides the limit to find the bytes above which requests get fewer threads", 2),
            intConfig(THREADS_THROTTLE_DIVIDER, "Divides the maximum threads for a request over the throttle threshold", 2),
            intConfig(BYTES_WINDOW_SECONDS, "The length of the sliding window bytes scanned are summed over", 600),
            AllocationPolicyConfigDefinition.builder()
                    .name(ORGANIZATION_BYTES_SCANNED_LIMIT_OVERRIDE)
                    .description("The bytes scanned limit for an organisation, -1 to use the default")
                    .valueType(ConfigValueType.INT).defaultValue(-1)
                    .paramNames(TenantContext.ORGANIZATION_ID)
                    .build(),
            AllocationPolicyConfigDefinition.builder()
                    .name(PROJECT_BYTES_SCANNED_LIMIT_OVERRIDE)
                    .description("The bytes scanned limit for a project, -1 to use the default")
                    .valueType(ConfigValueType.INT).defaultValue(-1)
                    .paramNames(TenantContext.PROJECT_ID)
                    .build());

    private final TenantQuotaCache<State> states;

    public BytesScannedRejectingPolicy(AllocationPolicyArgs args) {
        super(args, DEFINITIONS);
        states = new TenantQuotaCache<>(State::new,
                args.getTenantIdleExpiry(), args.getMaxTrackedTenants(), args.getTimeSupplier());
    }

    @Override
    protected QuotaAllowance computeQuotaAllowance(PolicyRequest request) {
        long limit = getLimit(request.tenant());
        long throttleThreshold = limit / Math.max(1, getLongConfig(BYTES_THROTTLE_DIVIDER));
        long maxThreads = getMaxThreads();
        long throttledThreads = Math.max(1, maxThreads / Math.max(1, getLongConfig(THREADS_THROTTLE_DIVIDER)));
        long windowSeconds = getLongConfig(BYTES_WINDOW_SECONDS);
        Instant now = now();
        long scanned = states.update(request.tenantKey(), state -> state.window(windowSeconds).sum(now));
        long projected = LongMath.saturatedAdd(scanned, Math.max(0, request.estimatedBytes()));
        QuotaAllowance.Builder allowance = QuotaAllowance.builder()
                .quotaUsed(scanned).quotaUnit(QUOTA_UNIT)
                .throttleThreshold(throttleThreshold).rejectionThreshold(limit);
        if (projected > limit) {
            return allowance.canRun(false).maxThreads(0)
                    .suggestion("scan fewer bytes, e.g. by narrowing the time range or the projects queried")
                    .explanation(Map.of("reason", request.tenantKey() + " scanned " + scanned
                            + " bytes in the last " + windowSeconds + " seconds, limit is " + limit))
                    .build();
        }
        boolean throttled = projected > throttleThreshold;
        return allowance.canRun(true)
                .maxThreads(throttled ? throttledThreads : maxThreads)
                .throttled(throttled)
                .build();
    }

    @Override
    protected void updateBalance(PolicyRequest request, QueryOutcome outcome) {
        long bytesScanned = outcome.getBytesScanned();
        if (bytesScanned <= 0) {
            return;
        }
        long windowSeconds = getLongConfig(BYTES_WINDOW_SECONDS);
        Instant now = now();
        states.update(request.tenantKey(), state -> {
            state.window(windowSeconds).add(now, bytesScanned);
            return null;
        });
    }

    @Override
    public void resetQuotaState() {
        states.clear();
    }

    private long getLimit(TenantContext tenant) {
        Optional<Long> projectOverride = tenant.get(TenantContext.PROJECT_ID)
                .flatMap(project -> getLongOverride(PROJECT_BYTES_SCANNED_LIMIT_OVERRIDE,
                        Map.of(TenantContext.PROJECT_ID, project)));
        if (projectOverride.isPresent()) {
            return projectOverride.get();
        }
        return tenant.getOrganizationId()
                .flatMap(organization -> getLongOverride(ORGANIZATION_BYTES_SCANNED_LIMIT_OVERRIDE,
                        Map.of(TenantContext.ORGANIZATION_ID, organization)))
                .orElseGet(() -> getLongConfig(BYTES_SCANNED_LIMIT));
    }

    /**
     * Bytes scanned by one tenant. The window is rebuilt empty if its length is reconfigured.
     */
    private static class State {
        private long windowSeconds = -1;
        private SlidingWindowCounter window;

        SlidingWindowCounter window(long seconds) {
            if (seconds != windowSeconds) {
                windowSeconds = seconds;
                window = new SlidingWindowCounter(Duration.ofSeconds(Math.max(1, seconds)), WINDOW_BUCKETS);
            }
            return window;
        }
    }
}
