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

import org.junit.jupiter.api.Test;

import strata.query.model.Conditions;
import strata.query.model.FunctionCall;
import strata.query.model.Query;

import static org.assertj.core.api.Assertions.assertThat;
import static strata.query.testutil.TestQueries.column;
import static strata.query.testutil.TestQueries.literal;
import static strata.query.testutil.TestQueries.selectBody;

public class TupleUnaliaserTest {

    @Test
    public void shouldRemoveAliasesInsideTuples() {
        // Given
        Query query = selectBody()
                .condition(FunctionCall.of(Conditions.IN, column("project_id"),
                        FunctionCall.tuple(literal(1).withAlias("first"), literal(2).withAlias("second"))))
                .build();

        // When
        Query processed = new TupleUnaliaser().process(query);

        // Then
        assertThat(processed.getCondition()).contains(Conditions.in(column("project_id"), 1, 2));
    }

    @Test
    public void shouldKeepAliasesOutsideTuples() {
        // Given
        Query query = Query.builder()
                .datasetKey("ourlogs")
                .select(column("body").withAlias("message"))
                .build();

        // When / Then
        assertThat(new TupleUnaliaser().process(query)).isEqualTo(query);
    }
}
