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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A logical query against a dataset. This is immutable. Query processors create modified copies with
 * {@link #toBuilder()}.
 */
public class Query {

    private final String datasetKey;
    private final List<SelectedExpression> selectedColumns;
    private final Expression condition;
    private final List<Expression> groupBy;
    private final Expression having;
    private final List<OrderBy> orderBy;
    private final Integer limit;
    private final Integer offset;
    private final Map<String, Object> settings;

    private Query(Builder builder) {
        datasetKey = Objects.requireNonNull(builder.datasetKey, "datasetKey must not be null");
        selectedColumns = List.copyOf(builder.selectedColumns);
        condition = builder.condition;
        groupBy = List.copyOf(builder.groupBy);
        having = builder.having;
        orderBy = List.copyOf(builder.orderBy);
        limit = builder.limit;
        offset = builder.offset;
        settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
        if (selectedColumns.isEmpty()) {
            throw new IllegalArgumentException("Query must select at least one expression");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getDatasetKey() {
        return datasetKey;
    }

    public List<SelectedExpression> getSelectedColumns() {
        return selectedColumns;
    }

    public Optional<Expression> getCondition() {
        return Optional.ofNullable(condition);
    }

    public List<Expression> getGroupBy() {
        return groupBy;
    }

    public Optional<Expression> getHaving() {
        return Optional.ofNullable(having);
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public Optional<Integer> getLimit() {
        return Optional.ofNullable(limit);
    }

    public Optional<Integer> getOffset() {
        return Optional.ofNullable(offset);
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    /**
     * Applies a transformation to every expression tree in the query, in every clause.
     *
     * @param  transformation the transformation to apply bottom-up to each node
     * @return                the transformed query
     */
    public Query transformExpressions(UnaryOperator<Expression> transformation) {
        return toBuilder()
                .selectedColumns(selectedColumns.stream()
                        .map(selected -> selected.withExpression(selected.expression().transform(transformation)))
                        .toList())
                .condition(transform(condition, transformation))
                .groupBy(groupBy.stream().map(expression -> expression.transform(transformation)).toList())
                .having(transform(having, transformation))
                .orderBy(orderBy.stream()
                        .map(order -> new OrderBy(order.direction(), order.expression().transform(transformation)))
                        .toList())
                .build();
    }

    /**
     * Applies a transformation to the where and having clauses only.
     *
     * @param  transformation the transformation to apply bottom-up to each node
     * @return                the transformed query
     */
    public Query transformConditions(UnaryOperator<Expression> transformation) {
        return toBuilder()
                .condition(transform(condition, transformation))
                .having(transform(having, transformation))
                .build();
    }

    /**
     * Streams every node of every expression tree in the query.
     *
     * @return the expressions
     */
    public Stream<Expression> streamAllExpressions() {
        return Stream.of(
                selectedColumns.stream().map(SelectedExpression::expression),
                getCondition().stream(),
                groupBy.stream(),
                getHaving().stream(),
                orderBy.stream().map(OrderBy::expression))
                .flatMap(expressions -> expressions)
                .flatMap(Expression::stream);
    }

    private static Expression transform(Expression expression, UnaryOperator<Expression> transformation) {
        if (expression == null) {
            return null;
        }
        return expression.transform(transformation);
    }

    public Builder toBuilder() {
        return builder()
                .datasetKey(datasetKey)
                .selectedColumns(selectedColumns)
                .condition(condition)
                .groupBy(groupBy)
                .having(having)
                .orderBy(orderBy)
                .limit(limit)
                .offset(offset)
                .settings(settings);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Query query = (Query) o;
        return Objects.equals(datasetKey, query.datasetKey)
                && Objects.equals(selectedColumns, query.selectedColumns)
                && Objects.equals(condition, query.condition)
                && Objects.equals(groupBy, query.groupBy)
                && Objects.equals(having, query.having)
                && Objects.equals(orderBy, query.orderBy)
                && Objects.equals(limit, query.limit)
                && Objects.equals(offset, query.offset)
                && Objects.equals(settings, query.settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasetKey, selectedColumns, condition, groupBy, having, orderBy, limit, offset, settings);
    }

    @Override
    public String toString() {
        return "Query{" +
                "datasetKey='" + datasetKey + '\'' +
                ", selectedColumns=" + selectedColumns +
                ", condition=" + condition +
                ", groupBy=" + groupBy +
                ", having=" + having +
                ", orderBy=" + orderBy +
                ", limit=" + limit +
                ", offset=" + offset +
                ", settings=" + settings +
                '}';
    }

    /**
     * Builds a query.
     */
    public static final class Builder {
        private String datasetKey;
        private List<SelectedExpression> selectedColumns = new ArrayList<>();
        private Expression condition;
        private List<Expression> groupBy = List.of();
        private Expression having;
        private List<OrderBy> orderBy = List.of();
        private Integer limit;
        private Integer offset;
        private Map<String, Object> settings = Map.of();

        private Builder() {
        }

        public Builder datasetKey(String datasetKey) {
            this.datasetKey = datasetKey;
            return this;
        }

        public Builder selectedColumns(List<SelectedExpression> selectedColumns) {
            this.selectedColumns = new ArrayList<>(selectedColumns);
            return this;
        }

        /**
         * Adds an expression to the selection, named after its alias if it has one.
         *
         * @param  expression the expression
         * @return            this builder
         */
        public Builder select(Expression expression) {
            String name = expression.getAlias().orElseGet(() -> QueryFormatter.format(expression));
            selectedColumns.add(new SelectedExpression(name, expression));
            return this;
        }

        public Builder condition(Expression condition) {
            this.condition = condition;
            return this;
        }

        public Builder groupBy(List<Expression> groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder having(Expression having) {
            this.having = having;
            return this;
        }

        public Builder orderBy(List<OrderBy> orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings = settings;
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
