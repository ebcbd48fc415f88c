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

import java.util.Set;

/**
 * Validates the width in bits of numeric column types.
 */
public class IntegerWidth {

    private static final Set<Integer> INTEGER_WIDTHS = Set.of(8, 16, 32, 64);
    private static final Set<Integer> FLOAT_WIDTHS = Set.of(32, 64);

    private IntegerWidth() {
    }

    /**
     * Checks the width of an integer type.
     *
     * @param  tag  the type tag, for the error message
     * @param  size the width in bits
     * @return      the width
     * @throws IllegalArgumentException if the width is not one of 8, 16, 32 or 64
     */
    public static int validateInteger(String tag, int size) {
        if (!INTEGER_WIDTHS.contains(size)) {
            throw new IllegalArgumentException(tag + " size must be one of 8, 16, 32 or 64, found " + size);
        }
        return size;
    }

    /**
     * Checks the width of a floating point type.
     *
     * @param  size the width in bits
     * @return      the width
     * @throws IllegalArgumentException if the width is not 32 or 64
     */
    public static int validateFloat(int size) {
        if (!FLOAT_WIDTHS.contains(size)) {
            throw new IllegalArgumentException("Float size must be 32 or 64, found " + size);
        }
        return size;
    }
}
