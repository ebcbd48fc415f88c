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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates column types from the tag and arguments used in a dataset configuration document, and converts them back.
 * A type is written as a tag with optional arguments, e.g. <code>{type: UInt, args: {size: 64}}</code> or
 * <code>{type: Map, args: {key: {type: String}, value: {type: Float, args: {size: 64}}}}</code>.
 */
public class TypeFactory {

    public static final String TYPE = "type";
    public static final String ARGS = "args";

    private TypeFactory() {
    }

    /**
     * Creates a type from its tag and arguments.
     *
     * @param  tag  the type tag
     * @param  args the type arguments, or null if there are none
     * @return      the type
     * @throws IllegalArgumentException if the tag is not recognised or the arguments are malformed
     */
    public static Type create(String tag, Map<String, ?> args) {
        if (tag == null) {
            throw new IllegalArgumentException("Type tag must be set");
        }
        switch (tag) {
            case UIntType.TAG:
                return new UIntType(readInt(tag, args, "size"));
            case IntType.TAG:
                return new IntType(readInt(tag, args, "size"));
            case FloatType.TAG:
                return new FloatType(readInt(tag, args, "size"));
            case StringType.TAG:
                return new StringType();
            case UuidType.TAG:
                return new UuidType();
            case DateTimeType.TAG:
                return new DateTimeType();
            case DateTime64Type.TAG:
                return new DateTime64Type(readInt(tag, args, "precision"));
            case MapType.TAG:
                return new MapType(readNestedPrimitive(args, "key"), readNestedPrimitive(args, "value"));
            default:
                throw new IllegalArgumentException("Unknown type " + tag);
        }
    }

    /**
     * Converts a type to a tag and arguments, in the same structure read by {@link #create}.
     *
     * @param  type the type
     * @return      a map holding the tag and any arguments
     */
    public static Map<String, Object> toDescription(Type type) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put(TYPE, type.getTag());
        Map<String, Object> args = toArgs(type);
        if (!args.isEmpty()) {
            description.put(ARGS, args);
        }
        return description;
    }

    private static Map<String, Object> toArgs(Type type) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (type instanceof UIntType uint) {
            args.put("size", uint.size());
        } else if (type instanceof IntType intType) {
            args.put("size", intType.size());
        } else if (type instanceof FloatType floatType) {
            args.put("size", floatType.size());
        } else if (type instanceof DateTime64Type dateTime) {
            args.put("precision", dateTime.precision());
        } else if (type instanceof MapType mapType) {
            args.put("key", toDescription(mapType.keyType()));
            args.put("value", toDescription(mapType.valueType()));
        }
        return args;
    }

    private static int readInt(String tag, Map<String, ?> args, String name) {
        Object value = args == null ? null : args.get(name);
        if (value == null) {
            throw new IllegalArgumentException(tag + " requires argument " + name);
        }
        if (value instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw new IllegalArgumentException(tag + " argument " + name + " must be a whole number, found " + value);
            }
            if (number.doubleValue() < Integer.MIN_VALUE || number.doubleValue() > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(tag + " argument " + name + " is out of range, found " + value);
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(tag + " argument " + name + " must be a number, found " + value, e);
        }
    }

    private static PrimitiveType readNestedPrimitive(Map<String, ?> args, String name) {
        Object value = args == null ? null : args.get(name);
        if (!(value instanceof Map<?, ?> nested)) {
            throw new IllegalArgumentException(MapType.TAG + " requires argument " + name + " with a type");
        }
        Object tag = nested.get(TYPE);
        Type type = create(tag == null ? null : tag.toString(), asArgs(nested.get(ARGS)));
        if (type instanceof PrimitiveType primitive) {
            return primitive;
        }
        throw new IllegalArgumentException(MapType.TAG + " " + name + " must have a primitive type, found " + type.getTag());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asArgs(Object args) {
        if (args == null) {
            return null;
        }
        if (args instanceof Map<?, ?>) {
            return (Map<String, ?>) args;
        }
        throw new IllegalArgumentException("Type arguments must be a map, found " + args);
    }
}
