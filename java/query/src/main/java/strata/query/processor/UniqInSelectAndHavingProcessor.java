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

import strata.query.model.AliasReference;
import strata.query.model.Expression;
import strata.query.model.FunctionCall;
import strata.query.model.Query;
import strata.query.model.SelectedExpression;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonicalises distinct count aggregates in the selection and having clauses. A <code>count(distinct(x))</code>
 * becomes <code>countDistinct(x)</code>. When the having clause repeats an aggregate that is aliased in the
 * selection, it is replaced with a reference to the alias so it is only computed once.
 */
public class UniqInSelectAndHavingProcessor implements QueryProcessor {

    public static final String COUNT_DISTINCT = "countDistinct";
    public static final Set<String> DISTINCT_COUNT_FUNCTIONS = Set.of("uniq", "uniqExact", COUNT_DISTINCT);

    @Override
    public Query process(Query query) {
        List<SelectedExpression> selected = query.getSelectedColumns().stream()
                .map(column -> column.withExpression(column.expression().transform(UniqInSelectAndHavingProcessor::canonicalise)))
                .toList();
        Map<Expression, String> aliasByAggregate = findAliasedAggregates(selected);
        Expression having = query.getHaving()
                .map(condition -> condition
                        .transform(UniqInSelectAndHavingProcessor::canonicalise)
                        .transform(expression -> referToSelectedAlias(expression, aliasByAggregate)))
                .orElse(null);
        return query.toBuilder()
                .selectedColumns(selected)
                .having(having)
                .build();
    }

    private static Expression canonicalise(Expression expression) {
        if (expression instanceof FunctionCall count && count.isCallTo("count") && count.parameters().size() == 1
                && count.parameters().get(0) instanceof FunctionCall distinct
                && distinct.isCallTo("distinct") && distinct.parameters().size() == 1) {
            return new FunctionCall(count.alias(), COUNT_DISTINCT, distinct.parameters());
        }
        return expression;
    }

    private static Map<Expression, String> findAliasedAggregates(List<SelectedExpression> selected) {
        Map<Expression, String> aliasByAggregate = new HashMap<>();
        selected.stream()
                .flatMap(column -> column.expression().stream())
                .filter(UniqInSelectAndHavingProcessor::isDistinctCount)
                .filter(expression -> expression.getAlias().isPresent())
                .forEach(expression -> aliasByAggregate.putIfAbsent(
                        expression.withoutAliases(), expression.getAlias().get()));
        return aliasByAggregate;
    }

    private static Expression referToSelectedAlias(Expression expression, Map<Expression, String> aliasByAggregate) {
        if (!isDistinctCount(expression)) {
            return expression;
        }
        String alias = aliasByAggregate.get(expression.withoutAliases());
        if (alias == null) {
            return expression;
        }
        return new AliasReference(alias);
    }

    private static boolean isDistinctCount(Expression expression) {
        return expression instanceof FunctionCall call && DISTINCT_COUNT_FUNCTIONS.contains(call.functionName());
    }
}
