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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads backend query settings held in the runtime config. Settings may be set globally, for asynchronous queries,
 * for a settings prefix chosen by the caller, or for a referrer. Where the same setting is set at more than one
 * level, a referrer setting wins over a prefix setting, which wins over an asynchronous setting, which wins over a
 * global setting.
 */
public class QuerySettingsConfig {

    public static final String QUERY_SETTINGS = "query_settings/";
    public static final String ASYNC_QUERY_SETTINGS = "async_query_settings/";

    private final RuntimeConfig runtimeConfig;

    public QuerySettingsConfig(RuntimeConfig runtimeConfig) {
        this.runtimeConfig = runtimeConfig;
    }

    /**
     * Builds the settings to apply to a query.
     *
     * @param  settingsPrefix the prefix chosen by the caller, if any
     * @param  async          true if the query runs asynchronously
     * @param  referrer       the referrer of the request, if known
     * @return                the settings
     */
    public Map<String, Object> getSettings(Optional<String> settingsPrefix, boolean async, Optional<String> referrer) {
        Map<String, Object> settings = new LinkedHashMap<>();
        putAllWithPrefix(QUERY_SETTINGS, settings);
        if (async) {
            putAllWithPrefix(ASYNC_QUERY_SETTINGS, settings);
        }
        settingsPrefix.ifPresent(prefix -> putAllWithPrefix(prefix + "/" + QUERY_SETTINGS, settings));
        referrer.ifPresent(name -> putAllWithPrefix("referrer/" + name + "/" + QUERY_SETTINGS, settings));
        return settings;
    }

    private void putAllWithPrefix(String prefix, Map<String, Object> settings) {
        runtimeConfig.getAllWithPrefix(prefix).forEach((key, value) -> {
            String name = key.substring(prefix.length());
            if (!name.isEmpty() && !name.contains("/")) {
                settings.put(name, ConfigValues.parseSettingValue(value));
            }
        });
    }
}
