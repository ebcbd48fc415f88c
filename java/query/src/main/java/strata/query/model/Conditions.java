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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Builds and decomposes conditions in the where and having clauses of a query.
 */
public class Conditions {

    public static final String AND = "and";
    public static final String OR = "or";
    public static final String NOT = "not";
    public static final String EQUALS = "equals";
    public static final String NOT_EQUALS = "notEquals";
    public static final String LESS = "less";
    public static final String LESS_OR_EQUALS = "lessOrEquals";
    public static final String GREATER = "greater";
    public static final String GREATER_OR_EQUALS = "greaterOrEquals";
    public static final String IN = "in";
    public static final String NOT_IN = "notIn";

    private Conditions() {
    }

    /**
     * Combines conditions so that all must hold. A single condition is returned as it is.
     *
     * @param  conditions the conditions
     * @return            the conjunction
     */
    public static Expression and(Expression... conditions) {
        return combine(AND, Arrays.asList(conditions));
    }

    /**
     * Combines conditions so that any may hold. A single condition is returned as it is.
     *
     * @param  conditions the conditions
     * @return            the disjunction
     */
    public static Expression or(Expression... conditions) {
        return combine(OR, Arrays.asList(conditions));
    }

    public static FunctionCall equals(Expression left, Expression right) {
        return FunctionCall.of(EQUALS, left, right);
    }

    public static FunctionCall notEquals(Expression left, Expression right) {
        return FunctionCall.of(NOT_EQUALS, left, right);
    }

    /**
     * Creates a condition that an expression is one of a set of literal values.
     *
     * @param  left   the expression
     * @param  values the values, held as a tuple
     * @return        the condition
     */
    public static FunctionCall in(Expression left, Object... values) {
        Expression[] literals = Arrays.stream(values).map(Literal::of).toArray(Expression[]::new);
        return FunctionCall.of(IN, left, FunctionCall.tuple(literals));
    }

    /**
     * Splits a condition into the conditions of its top-level conjunction. Nested conjunctions are flattened. Any other
     * condition is returned on its own.
     *
     * @param  condition the condition
     * @return           the conditions which must all hold
     */
    public static List<Expression> getConjuncts(Expression condition) {
        List<Expression> conjuncts = new ArrayList<>();
        collectConjuncts(condition, conjuncts);
        return conjuncts;
    }

    /**
     * Finds a comparison of a column to concrete literals. Recognises <code>column = literal</code> in either operand
     * order, and <code>column IN tuple(literals...)</code>.
     *
     * @param  condition  the condition
     * @param  columnName the column
     * @return            the literals compared against, if the condition has that form
     */
    public static Optional<List<Literal>> findColumnMatchingLiterals(Expression condition, String columnName) {
        if (!(condition instanceof FunctionCall call) || call.parameters().size() != 2) {
            return Optional.empty();
        }
        Expression left = call.parameters().get(0);
        Expression right = call.parameters().get(1);
        if (call.isCallTo(EQUALS)) {
            if (isColumn(left, columnName) && right instanceof Literal literal) {
                return Optional.of(List.of(literal));
            }
            if (isColumn(right, columnName) && left instanceof Literal literal) {
                return Optional.of(List.of(literal));
            }
        } else if (call.isCallTo(IN) && isColumn(left, columnName)
                && right instanceof FunctionCall tuple && tuple.isTuple()
                && tuple.parameters().stream().allMatch(Literal.class::isInstance)) {
            return Optional.of(tuple.parameters().stream().map(Literal.class::cast).toList());
        }
        return Optional.empty();
    }

    /**
     * Checks whether an expression refers to the given column.
     *
     * @param  expression the expression
     * @param  columnName the column name
     * @return            true if the expression is a reference to that column
     */
    public static boolean isColumn(Expression expression, String columnName) {
        return expression instanceof Column column && column.columnName().equals(columnName);
    }

    private static void collectConjuncts(Expression condition, List<Expression> conjuncts) {
        if (condition instanceof FunctionCall call && call.isCallTo(AND)) {
            call.parameters().forEach(parameter -> collectConjuncts(parameter, conjuncts));
        } else {
            conjuncts.add(condition);
        }
    }

    private static Expression combine(String function, List<Expression> conditions) {
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("No conditions to combine");
        }
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        return new FunctionCall(null, function, conditions);
    }
}
