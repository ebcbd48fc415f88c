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

import strata.query.model.Column;
import strata.query.model.Conditions;
import strata.query.model.Expression;
import strata.query.model.FunctionCall;
import strata.query.model.Literal;
import strata.query.model.Query;
import strata.query.model.QueryProcessingException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Rewrites string literals that are compared to particular columns in the where and having clauses. Recognises
 * <code>equals</code> and <code>notEquals</code> with the column on either side, and <code>in</code> and
 * <code>notIn</code> with a tuple of literals. Every literal is converted before the query is rebuilt, so a failure
 * leaves nothing half rewritten.
 */
public abstract class ConditionRewriter implements QueryProcessor {

    private static final Set<String> EQUALITY_FUNCTIONS = Set.of(Conditions.EQUALS, Conditions.NOT_EQUALS);
    private static final Set<String> MEMBERSHIP_FUNCTIONS = Set.of(Conditions.IN, Conditions.NOT_IN);

    private final Set<String> columns;

    protected ConditionRewriter(List<String> columns) {
        this.columns = Set.copyOf(columns);
    }

    /**
     * Converts a string literal compared to one of the columns.
     *
     * @param  column                   the column name
     * @param  value                    the string value
     * @return                          the expression to compare against instead
     * @throws QueryProcessingException if the value is not valid for the column
     */
    protected abstract Expression convert(String column, String value) throws QueryProcessingException;

    /**
     * Rewrites the where and having clauses.
     *
     * @param  query                    the query
     * @return                          the query with converted literals
     * @throws QueryProcessingException if any literal is not valid for its column
     */
    protected Query rewriteConditions(Query query) throws QueryProcessingException {
        List<FunctionCall> comparisons = new ArrayList<>();
        query.getCondition().ifPresent(condition -> collectComparisons(condition, comparisons));
        query.getHaving().ifPresent(having -> collectComparisons(having, comparisons));
        if (comparisons.isEmpty()) {
            return query;
        }
        for (FunctionCall comparison : comparisons) {
            validate(comparison);
        }
        return query.transformConditions(this::rewriteValidated);
    }

    public Set<String> getColumns() {
        return columns;
    }

    private void collectComparisons(Expression condition, List<FunctionCall> comparisons) {
        condition.stream()
                .filter(FunctionCall.class::isInstance)
                .map(FunctionCall.class::cast)
                .filter(call -> findColumn(call) != null)
                .forEach(comparisons::add);
    }

    private void validate(FunctionCall comparison) throws QueryProcessingException {
        String column = findColumn(comparison);
        for (Literal literal : stringLiterals(comparison)) {
            convert(column, (String) literal.value());
        }
    }

    private Expression rewriteValidated(Expression expression) {
        if (!(expression instanceof FunctionCall call)) {
            return expression;
        }
        String column = findColumn(call);
        if (column == null) {
            return expression;
        }
        List<Expression> parameters = new ArrayList<>(call.parameters());
        for (int i = 0; i < parameters.size(); i++) {
            parameters.set(i, rewriteParameter(column, parameters.get(i)));
        }
        return call.withParameters(parameters);
    }

    private Expression rewriteParameter(String column, Expression parameter) {
        if (parameter instanceof FunctionCall tuple && tuple.isTuple()) {
            return tuple.withParameters(tuple.parameters().stream()
                    .map(element -> rewriteParameter(column, element))
                    .toList());
        }
        if (parameter instanceof Literal literal && literal.isString()) {
            try {
                return convert(column, (String) literal.value()).withAlias(literal.alias());
            } catch (QueryProcessingException e) {
                throw new IllegalStateException("Literal was validated before rewrite: " + literal, e);
            }
        }
        return parameter;
    }

    private String findColumn(FunctionCall call) {
        if (call.parameters().size() != 2) {
            return null;
        }
        Expression left = call.parameters().get(0);
        Expression right = call.parameters().get(1);
        if (EQUALITY_FUNCTIONS.contains(call.functionName())) {
            if (isListedColumn(left) && right instanceof Literal) {
                return ((Column) left).columnName();
            }
            if (isListedColumn(right) && left instanceof Literal) {
                return ((Column) right).columnName();
            }
        } else if (MEMBERSHIP_FUNCTIONS.contains(call.functionName())
                && isListedColumn(left) && right instanceof FunctionCall tuple && tuple.isTuple()) {
            return ((Column) left).columnName();
        }
        return null;
    }

    private static List<Literal> stringLiterals(FunctionCall comparison) {
        return comparison.parameters().stream()
                .flatMap(parameter -> parameter instanceof FunctionCall tuple && tuple.isTuple()
                        ? tuple.parameters().stream()
                        : Stream.of(parameter))
                .filter(Literal.class::isInstance)
                .map(Literal.class::cast)
                .filter(Literal::isString)
                .toList();
    }

    private boolean isListedColumn(Expression expression) {
        return expression instanceof Column column && columns.contains(column.columnName());
    }
}
