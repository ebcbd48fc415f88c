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

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a logical query as SQL text for the backend and the query log.
 */
public class QueryFormatter {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Map<String, String> BINARY_OPERATORS = Map.of(
            Conditions.EQUALS, "=",
            Conditions.NOT_EQUALS, "!=",
            Conditions.LESS, "<",
            Conditions.LESS_OR_EQUALS, "<=",
            Conditions.GREATER, ">",
            Conditions.GREATER_OR_EQUALS, ">=",
            Conditions.IN, "IN",
            Conditions.NOT_IN, "NOT IN");

    private QueryFormatter() {
    }

    /**
     * Renders a query against a physical table.
     *
     * @param  query     the query
     * @param  tableName the table to read from
     * @return           the SQL
     */
    public static String format(Query query, String tableName) {
        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(query.getSelectedColumns().stream()
                .map(selected -> format(selected.expression()))
                .collect(Collectors.joining(", ")));
        sql.append(" FROM ").append(escapeIdentifier(tableName));
        query.getCondition().ifPresent(condition -> sql.append(" WHERE ").append(format(condition)));
        if (!query.getGroupBy().isEmpty()) {
            sql.append(" GROUP BY ").append(formatList(query.getGroupBy()));
        }
        query.getHaving().ifPresent(having -> sql.append(" HAVING ").append(format(having)));
        if (!query.getOrderBy().isEmpty()) {
            sql.append(" ORDER BY ").append(query.getOrderBy().stream()
                    .map(order -> format(order.expression()) + " " + order.direction())
                    .collect(Collectors.joining(", ")));
        }
        query.getLimit().ifPresent(limit -> sql.append(" LIMIT ").append(limit));
        query.getOffset().ifPresent(offset -> sql.append(" OFFSET ").append(offset));
        return sql.toString();
    }

    /**
     * Renders an expression.
     *
     * @param  expression the expression
     * @return            the SQL
     */
    public static String format(Expression expression) {
        String body = formatWithoutAlias(expression);
        return expression.getAlias()
                .map(alias -> "(" + body + " AS " + escapeIdentifier(alias) + ")")
                .orElse(body);
    }

    private static String formatWithoutAlias(Expression expression) {
        if (expression instanceof Column column) {
            String name = escapeIdentifier(column.columnName());
            return column.tableName() == null ? name : escapeIdentifier(column.tableName()) + "." + name;
        } else if (expression instanceof Literal literal) {
            return formatLiteral(literal.value());
        } else if (expression instanceof AliasReference reference) {
            return escapeIdentifier(reference.name());
        } else if (expression instanceof FunctionCall call) {
            return formatFunction(call);
        }
        throw new IllegalArgumentException("Unrecognised expression: " + expression);
    }

    private static String formatFunction(FunctionCall call) {
        List<Expression> parameters = call.parameters();
        if (call.isTuple()) {
            return "(" + formatList(parameters) + ")";
        }
        String operator = BINARY_OPERATORS.get(call.functionName());
        if (operator != null && parameters.size() == 2) {
            return format(parameters.get(0)) + " " + operator + " " + format(parameters.get(1));
        }
        if ((call.isCallTo(Conditions.AND) || call.isCallTo(Conditions.OR)) && parameters.size() > 1) {
            String joiner = call.isCallTo(Conditions.AND) ? " AND " : " OR ";
            return "(" + parameters.stream().map(QueryFormatter::format).collect(Collectors.joining(joiner)) + ")";
        }
        return call.functionName() + "(" + formatList(parameters) + ")";
    }

    private static String formatList(List<Expression> expressions) {
        return expressions.stream().map(QueryFormatter::format).collect(Collectors.joining(", "));
    }

    private static String formatLiteral(Object value) {
        if (value == null) {
            return "NULL";
        } else if (value instanceof String string) {
            return "'" + string.replace("\\", "\\\\").replace("'", "\\'") + "'";
        } else if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        return value.toString();
    }

    private static String escapeIdentifier(String identifier) {
        if (SIMPLE_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return "`" + identifier.replace("`", "\\`") + "`";
    }
}
