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

import strata.core.tenant.TenantContext;

/**
 * A request as seen by an allocation policy.
 *
 * @param requestId      the ID of the request
 * @param tenant         who the request is made on behalf of
 * @param tenantKey      the tenant dimension values the policy tracks quota by
 * @param estimatedBytes the estimated bytes the request will scan
 */
public record PolicyRequest(String requestId, TenantContext tenant, TenantKey tenantKey, long estimatedBytes) {
}
