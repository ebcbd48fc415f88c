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
package strata.query.config;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Holds runtime settings in memory. Safe for use from many request threads at once.
 */
public class InMemoryRuntimeConfig implements RuntimeConfig {

    private final NavigableMap<String, String> values = new ConcurrentSkipListMap<>();

    public InMemoryRuntimeConfig() {
    }

    public InMemoryRuntimeConfig(Map<String, String> values) {
        this.values.putAll(values);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    @Override
    public Map<String, String> getAll() {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }

    @Override
    public Map<String, String> getAllWithPrefix(String prefix) {
        return Collections.unmodifiableMap(new TreeMap<>(values.subMap(prefix, true, prefix + Character.MAX_VALUE, true)));
    }
}
