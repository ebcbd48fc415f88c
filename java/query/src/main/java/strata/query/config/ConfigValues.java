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

import org.apache.commons.lang3.math.NumberUtils;

/**
 * Converts runtime setting strings into typed values.
 */
public class ConfigValues {

    private ConfigValues() {
    }

    /**
     * Reads a setting value as a long if it is a whole number, a double if it is any other number, or otherwise leaves
     * it as a string.
     *
     * @param  value the setting value
     * @return       the typed value
     */
    public static Object parseSettingValue(String value) {
        String trimmed = value.trim();
        if (!NumberUtils.isParsable(trimmed)) {
            return value;
        }
        if (NumberUtils.isDigits(trimmed.startsWith("-") ? trimmed.substring(1) : trimmed)) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                return value;
            }
        }
        return Double.parseDouble(trimmed);
    }

    /**
     * Reads a setting value as a whole number.
     *
     * @param  value                    the setting value
     * @return                          the number
     * @throws IllegalArgumentException if the value is not a whole number
     */
    public static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a whole number: " + value, e);
        }
    }

    /**
     * Reads a setting value as a number.
     *
     * @param  value                    the setting value
     * @return                          the number
     * @throws IllegalArgumentException if the value is not a number
     */
    public static double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value, e);
        }
    }
}
