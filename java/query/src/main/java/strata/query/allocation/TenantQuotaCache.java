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

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Holds the quota state an allocation policy tracks for each tenant. State that has not been used for a while is
 * evicted, as is the least recently used state once the cache is full. Each tenant's state is only read or changed
 * while holding its lock, so a check and the increment that follows it happen together.
 * <p>
 * An evicted tenant starts again from fresh state. Anything released against the fresh state must not take a count
 * below zero.
 *
 * @param <S> the type of state held per tenant
 */
public class TenantQuotaCache<S> {

    private final Cache<TenantKey, S> cache;
    private final Supplier<S> newState;

    public TenantQuotaCache(Supplier<S> newState, Duration idleExpiry, long maximumSize, Supplier<Instant> timeSupplier) {
        this.newState = newState;
        this.cache = CacheBuilder.newBuilder()
                .expireAfterAccess(idleExpiry.toMillis(), TimeUnit.MILLISECONDS)
                .maximumSize(maximumSize)
                .ticker(tickerFor(timeSupplier))
                .build();
    }

    /**
     * Reads or changes the state of a tenant while holding its lock. Creates fresh state if there is none.
     *
     * @param  <R>    the type of the result
     * @param  key    the tenant
     * @param  update the operation on the state
     * @return        the result of the operation
     */
    public <R> R update(TenantKey key, Function<S, R> update) {
        S state = getOrCreate(key);
        synchronized (state) {
            return update.apply(state);
        }
    }

    /**
     * Reads or changes the state of a tenant while holding its lock, only if there is state held for it.
     *
     * @param  <R>    the type of the result
     * @param  key    the tenant
     * @param  update the operation on the state
     * @return        the result of the operation, or an empty optional if no state was held
     */
    public <R> Optional<R> updateIfPresent(TenantKey key, Function<S, R> update) {
        S state = cache.getIfPresent(key);
        if (state == null) {
            return Optional.empty();
        }
        synchronized (state) {
            return Optional.ofNullable(update.apply(state));
        }
    }

    /**
     * Discards the state of every tenant.
     */
    public void clear() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.size();
    }

    private S getOrCreate(TenantKey key) {
        try {
            return cache.get(key, newState::get);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed creating quota state for tenant " + key, e.getCause());
        }
    }

    private static Ticker tickerFor(Supplier<Instant> timeSupplier) {
        return new Ticker() {
            @Override
            public long read() {
                Instant now = timeSupplier.get();
                return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
            }
        };
    }
}
