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

import strata.query.testutil.FakeTimeSupplier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

public class TenantQuotaCacheTest {

    private final FakeTimeSupplier timeSupplier = FakeTimeSupplier.startingAt("2025-03-01T10:00:00Z");
    private final TenantQuotaCache<AtomicLong> cache = new TenantQuotaCache<>(
            AtomicLong::new, Duration.ofMinutes(15), 100, timeSupplier);
    private final TenantKey tenant = new TenantKey(List.of("1"));

    @Test
    public void shouldCreateStateOnFirstUpdate() {
        // When
        long value = cache.update(tenant, AtomicLong::incrementAndGet);

        // Then
        assertThat(value).isOne();
        assertThat(cache.size()).isOne();
    }

    @Test
    public void shouldKeepStateBetweenUpdates() {
        // Given
        cache.update(tenant, AtomicLong::incrementAndGet);

        // When
        long value = cache.update(tenant, AtomicLong::incrementAndGet);

        // Then
        assertThat(value).isEqualTo(2);
    }

    @Test
    public void shouldNotCreateStateWhenUpdatingIfPresent() {
        assertThat(cache.updateIfPresent(tenant, AtomicLong::incrementAndGet)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    public void shouldForgetIdleTenant() {
        // Given
        cache.update(tenant, AtomicLong::incrementAndGet);
        timeSupplier.advance(Duration.ofMinutes(16));

        // When / Then
        assertThat(cache.updateIfPresent(tenant, AtomicLong::get)).isEmpty();
        assertThat(cache.update(tenant, AtomicLong::incrementAndGet)).isOne();
    }

    @Test
    public void shouldKeepTenantAccessedWithinExpiry() {
        // Given
        cache.update(tenant, AtomicLong::incrementAndGet);
        timeSupplier.advance(Duration.ofMinutes(10));
        cache.update(tenant, AtomicLong::get);
        timeSupplier.advance(Duration.ofMinutes(10));

        // When / Then
        assertThat(cache.updateIfPresent(tenant, AtomicLong::get)).contains(1L);
    }

    @Test
    public void shouldClearAllState() {
        // Given
        cache.update(tenant, AtomicLong::incrementAndGet);

        // When
        cache.clear();

        // Then
        assertThat(cache.size()).isZero();
    }
}
