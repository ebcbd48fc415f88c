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

import strata.query.config.ConfigValues;

/**
 * The type of value an allocation policy config holds.
 */
public enum ConfigValueType {
    INT {
        @Override
        public Object parse(String value) {
            return ConfigValues.parseLong(value);
        }
    },
    FLOAT {
        @Override
        public Object parse(String value) {
            return ConfigValues.parseDouble(value);
        }
    },
    STRING {
        @Override
        public Object parse(String value) {
            return value;
        }
    };

    /**
     * Reads a value of this type from its string form.
     *
     * @param  value                    the string form
     * @return                          the value
     * @throws IllegalArgumentException if the string is not a value of this type
     */
    public abstract Object parse(String value);
}
