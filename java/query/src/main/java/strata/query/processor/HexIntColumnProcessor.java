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
import strata.query.model.Expression;
import strata.query.model.FunctionCall;
import strata.query.model.Literal;
import strata.query.model.Query;
import strata.query.model.QueryProcessingException;
import strata.query.model.SelectedExpression;

import java.util.List;

/**
 * Handles columns that store unsigned integers but are exposed to callers as hexadecimal strings. Hexadecimal
 * literals compared to the columns are converted to integers, and selected columns are converted back to hexadecimal
 * with <code>lower(hex(column))</code>. This applies wherever the column appears in a selected expression, e.g. inside
 * an aggregate or a tuple, except inside a call to <code>hex</code>.
 */
public class HexIntColumnProcessor extends ConditionRewriter {

    private static final String HEX = "hex";

    public HexIntColumnProcessor(List<String> columns) {
        super(columns);
    }

    @Override
    public Query process(Query query) throws QueryProcessingException {
        Query decoded = rewriteConditions(query);
        List<SelectedExpression> selected = decoded.getSelectedColumns().stream()
                .map(column -> column.withExpression(encode(column.expression())))
                .toList();
        return decoded.toBuilder().selectedColumns(selected).build();
    }

    @Override
    protected Expression convert(String column, String value) throws QueryProcessingException {
        long decoded;
        try {
            decoded = HexIntCodec.decode(value);
        } catch (IllegalArgumentException e) {
            throw new QueryProcessingException("Not a valid hexadecimal value for column " + column + ": " + value);
        }
        if (decoded >= 0) {
            return Literal.of(decoded);
        }
        return FunctionCall.of("toUInt64", Literal.of(Long.toUnsignedString(decoded)));
    }

    private Expression encode(Expression expression) {
        if (expression instanceof Column column && getColumns().contains(column.columnName())) {
            Column unaliased = column.withAlias(null);
            return new FunctionCall(column.alias(), "lower", List.of(FunctionCall.of(HEX, unaliased)));
        }
        if (expression instanceof FunctionCall call && !call.isCallTo(HEX)) {
            return call.withParameters(call.parameters().stream().map(this::encode).toList());
        }
        return expression;
    }
}
