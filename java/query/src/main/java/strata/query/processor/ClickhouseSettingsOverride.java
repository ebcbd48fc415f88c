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
package strata.query.processor;

import strata.query.model.Query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies fixed backend execution settings configured for a dataset, e.g. memory and grouping limits. These take
 * precedence over any settings of the same name set by the caller.
 */
public class ClickhouseSettingsOverride implements QueryProcessor {

    private final Map<String, Object> settings;

    public ClickhouseSettingsOverride(Map<String, Object> settings) {
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    @Override
    public Query process(Query query) {
        Map<String, Object> merged = new LinkedHashMap<>(query.getSettings());
        merged.putAll(settings);
        return query.toBuilder().settings(merged).build();
    }

    public Map<String, Object> getSettings() {
        return settings;
    }
}
