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

/**
 * An expression in the selection of a query, with the name of the result column it produces.
 *
 * @param name       the result column name
 * @param expression the expression
 */
public record SelectedExpression(String name, Expression expression) {

    public SelectedExpression {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }

    /**
     * Creates a copy with a different expression.
     *
     * @param  newExpression the expression
     * @return               the copy
     */
    public SelectedExpression withExpression(Expression newExpression) {
        return new SelectedExpression(name, newExpression);
    }
}
