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
 * A node in the expression tree of a logical query. Expressions are immutable. Any expression may carry an alias,
 * which names it in the query so that other clauses can refer to it.
 */
public interface Expression {

    /**
     * Retrieves the alias of this expression.
     *
     * @return the alias, or an empty optional if this expression is not aliased
     */
    Optional<String> getAlias();

    /**
     * Creates a copy of this expression with a different alias.
     *
     * @param  alias the new alias, or null to remove it
     * @return       the copy
     */
    Expression withAlias(String alias);

    /**
     * Rebuilds this expression tree bottom-up, applying the transformation to every node after its children have been
     * transformed.
     *
     * @param  transformation the transformation to apply to each node
     * @return                the transformed expression
     */
    Expression transform(UnaryOperator<Expression> transformation);

    /**
     * Streams this expression and all its descendants, parents before children.
     *
     * @return the expressions in the tree
     */
    Stream<Expression> stream();

    /**
     * Creates a copy of this expression tree with every alias removed. Used to compare expressions by what they
     * compute rather than what they are called.
     *
     * @return the copy without aliases
     */
    default Expression withoutAliases() {
        return transform(expression -> expression.withAlias(null));
    }
}
