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

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A reference to a column of the dataset.
 *
 * @param alias      the alias, or null
 * @param tableName  the table the column is qualified with, or null
 * @param columnName the column name
 */
public record Column(String alias, String tableName, String columnName) implements Expression {

    public Column {
        Objects.requireNonNull(columnName, "columnName must not be null");
    }

    /**
     * Creates an unaliased, unqualified reference to a column.
     *
     * @param  columnName the column name
     * @return            the column reference
     */
    public static Column of(String columnName) {
        return new Column(null, null, columnName);
    }

    @Override
    public Optional<String> getAlias() {
        return Optional.ofNullable(alias);
    }

    @Override
    public Column withAlias(String newAlias) {
        return new Column(newAlias, tableName, columnName);
    }

    @Override
    public Expression transform(UnaryOperator<Expression> transformation) {
        return transformation.apply(this);
    }

    @Override
    public Stream<Expression> stream() {
        return Stream.of(this);
    }
}
