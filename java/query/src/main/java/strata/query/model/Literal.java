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
package strata.query.model;

import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A constant value in a query. The value may be null, a long, a double, a string or a boolean. Other whole numbers
 * are widened to a long, and other floating point numbers to a double.
 *
 * @param alias the alias, or null
 * @param value the value
 */
public record Literal(String alias, Object value) implements Expression {

    public Literal {
        value = normalise(value);
    }

    /**
     * Creates an unaliased literal.
     *
     * @param  value the value
     * @return       the literal
     */
    public static Literal of(Object value) {
        return new Literal(null, value);
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isString() {
        return value instanceof String;
    }

    @Override
    public Optional<String> getAlias() {
        return Optional.ofNullable(alias);
    }

    @Override
    public Literal withAlias(String newAlias) {
        return new Literal(newAlias, value);
    }

    @Override
    public Expression transform(UnaryOperator<Expression> transformation) {
        return transformation.apply(this);
    }

    @Override
    public Stream<Expression> stream() {
        return Stream.of(this);
    }

    private static Object normalise(Object value) {
        if (value == null || value instanceof Long || value instanceof Double
                || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        throw new IllegalArgumentException("Unsupported literal value of type " + value.getClass().getSimpleName() + ": " + value);
    }
}
