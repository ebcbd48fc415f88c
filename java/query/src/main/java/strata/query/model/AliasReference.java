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
 * Refers to another expression in the query by its alias, so that it is only computed once.
 *
 * @param name the alias referred to
 */
public record AliasReference(String name) implements Expression {

    public AliasReference {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public Optional<String> getAlias() {
        return Optional.empty();
    }

    @Override
    public AliasReference withAlias(String alias) {
        return this;
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
