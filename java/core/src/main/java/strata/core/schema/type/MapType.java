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
package strata.core.schema.type;

import java.util.Objects;

/**
 * A map from string keys to values of a primitive type.
 *
 * @param keyType   the type of the keys, which must be a string
 * @param valueType the type of the values
 */
public record MapType(PrimitiveType keyType, PrimitiveType valueType) implements Type {

    public static final String TAG = "Map";

    public MapType {
        Objects.requireNonNull(keyType, "keyType must not be null");
        Objects.requireNonNull(valueType, "valueType must not be null");
        if (!(keyType instanceof StringType)) {
            throw new IllegalArgumentException("Map key type must be String, found " + keyType.getTag());
        }
    }

    /**
     * Creates a map type with string keys.
     *
     * @param  valueType the type of the values
     * @return           the map type
     */
    public static MapType stringKeysTo(PrimitiveType valueType) {
        return new MapType(new StringType(), valueType);
    }

    @Override
    public String getTag() {
        return TAG;
    }
}
