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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts between 64 bit unsigned integers and their hexadecimal string form, as used for span IDs.
 */
public class HexIntCodec {

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]{1,16}");

    private HexIntCodec() {
    }

    /**
     * Reads a hexadecimal string as an unsigned integer. Values above the signed range wrap to negative longs, with
     * the same bits.
     *
     * @param  hex                      the hexadecimal string
     * @return                          the integer
     * @throws IllegalArgumentException if the string is not hexadecimal or is more than 64 bits
     */
    public static long decode(String hex) {
        if (!HEX.matcher(hex).matches()) {
            throw new IllegalArgumentException("Not a valid 64 bit hexadecimal integer: " + hex);
        }
        return Long.parseUnsignedLong(hex, 16);
    }

    /**
     * Writes an unsigned integer in lowercase hexadecimal.
     *
     * @param  value the integer
     * @return       the hexadecimal string
     */
    public static String encode(long value) {
        return Long.toHexString(value).toLowerCase(Locale.ROOT);
    }
}
