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
package strata.configuration.dataset;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the arguments given to a component in a dataset configuration document.
 */
public class ConfigArgs {

    private final String owner;
    private final Map<String, Object> args;

    public ConfigArgs(String owner, Map<String, Object> args) {
        this.owner = owner;
        this.args = args == null ? Map.of() : args;
    }

    /**
     * Reads a required string argument.
     *
     * @param  name                     the argument name
     * @return                          the value
     * @throws IllegalArgumentException if the argument is missing or is not a string
     */
    public String getString(String name) {
        Object value = getRequired(name);
        if (value instanceof String string && !string.isBlank()) {
            return string;
        }
        throw new IllegalArgumentException(owner + " argument " + name + " must be a string, found " + value);
    }

    /**
     * Reads a required list of strings.
     *
     * @param  name                     the argument name
     * @return                          the values
     * @throws IllegalArgumentException if the argument is missing, is not a list, or holds anything but strings
     */
    public List<String> getStringList(String name) {
        Object value = getRequired(name);
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(owner + " argument " + name + " must be a list, found " + value);
        }
        for (Object element : list) {
            if (!(element instanceof String)) {
                throw new IllegalArgumentException(owner + " argument " + name + " must hold strings, found " + element);
            }
        }
        return list.stream().map(String.class::cast).toList();
    }

    /**
     * Reads a required map.
     *
     * @param  name                     the argument name
     * @return                          the map
     * @throws IllegalArgumentException if the argument is missing or is not a map
     */
    public Map<String, Object> getMap(String name) {
        return getOptionalMap(name)
                .orElseThrow(() -> new IllegalArgumentException(owner + " requires argument " + name));
    }

    /**
     * Reads an optional map.
     *
     * @param  name                     the argument name
     * @return                          the map, if it is set
     * @throws IllegalArgumentException if the argument is not a map
     */
    public Optional<Map<String, Object>> getOptionalMap(String name) {
        Object value = args.get(name);
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(owner + " argument " + name + " must be a map, found " + value);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        return Optional.of(copy);
    }

    private Object getRequired(String name) {
        Object value = args.get(name);
        if (value == null) {
            throw new IllegalArgumentException(owner + " requires argument " + name);
        }
        return value;
    }
}
