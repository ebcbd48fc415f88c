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

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A key/value store of settings that can be changed while the process runs, e.g. allocation policy limits and backend
 * query settings. Values are stored as strings.
 */
public interface RuntimeConfig {

    /**
     * Retrieves a setting.
     *
     * @param  key the key
     * @return     the value, or an empty optional if it is not set
     */
    Optional<String> get(String key);

    /**
     * Sets a setting.
     *
     * @param key   the key
     * @param value the value
     */
    void set(String key, String value);

    /**
     * Removes a setting.
     *
     * @param key the key
     */
    void delete(String key);

    /**
     * Retrieves every setting.
     *
     * @return the settings, ordered by key
     */
    Map<String, String> getAll();

    /**
     * Retrieves every setting with a key starting with the given prefix.
     *
     * @param  prefix the prefix
     * @return        the settings, ordered by key, with the prefix still present in the keys
     */
    default Map<String, String> getAllWithPrefix(String prefix) {
        return getAll().entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> b, TreeMap::new));
    }
}
