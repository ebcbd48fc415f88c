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
 * An ordering of the results of a query.
 *
 * @param direction  the direction to sort in
 * @param expression the expression to sort by
 */
public record OrderBy(Direction direction, Expression expression) {

    public OrderBy {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }

    /**
     * The direction of an ordering.
     */
    public enum Direction {
        ASC, DESC
    }
}
