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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static strata.query.testutil.TestQueries.column;
import static strata.query.testutil.TestQueries.literal;

public class ExpressionTest {

    @Test
    public void shouldStreamParentsBeforeChildren() {
        // Given
        Expression expression = FunctionCall.of("plus", column("a"), FunctionCall.of("abs", column("b")));

        // When
        List<Expression> streamed = expression.stream().toList();

        // Then
        assertThat(streamed).containsExactly(
                expression,
                column("a"),
                FunctionCall.of("abs", column("b")),
                column("b"));
    }

    @Test
    public void shouldTransformChildrenBeforeParent() {
        // Given
        Expression expression = FunctionCall.of("plus", column("a"), column("b"));

        // When
        Expression transformed = expression.transform(node -> {
            if (node instanceof Column column) {
                return Column.of(column.columnName().toUpperCase());
            }
            if (node instanceof FunctionCall call) {
                assertThat(call.parameters()).containsExactly(column("A"), column("B"));
            }
            return node;
        });

        // Then
        assertThat(transformed).isEqualTo(FunctionCall.of("plus", column("A"), column("B")));
    }

    @Test
    public void shouldRemoveAliasesThroughoutTree() {
        // Given
        Expression aliased = new FunctionCall("total", "sum",
                List.of(new Column("value", null, "attr_int"), literal(1).withAlias("one")));

        // When / Then
        assertThat(aliased.withoutAliases())
                .isEqualTo(FunctionCall.of("sum", column("attr_int"), literal(1)));
    }

    @Test
    public void shouldWidenWholeNumberLiterals() {
        assertThat(Literal.of(12).value()).isEqualTo(12L);
        assertThat(Literal.of(1.5f).value()).isEqualTo(1.5);
    }
}
