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
import strata.query.model.Query;
import strata.query.model.QueryProcessingException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static strata.query.testutil.TestQueries.column;
import static strata.query.testutil.TestQueries.literal;
import static strata.query.testutil.TestQueries.selectBody;

public class QueryProcessorPipelineTest {

    @Test
    public void shouldApplyProcessorsInOrder() throws Exception {
        // Given
        List<String> applied = new ArrayList<>();
        QueryProcessorPipeline pipeline = new QueryProcessorPipeline(List.of(
                recordingProcessor("first", applied),
                recordingProcessor("second", applied)));

        // When
        pipeline.apply(selectBody().build());

        // Then
        assertThat(applied).containsExactly("first", "second");
    }

    @Test
    public void shouldStopAtFirstFailingProcessor() {
        // Given
        List<String> applied = new ArrayList<>();
        QueryProcessorPipeline pipeline = new QueryProcessorPipeline(List.of(
                new UUIDColumnProcessor(List.of("trace_id")),
                recordingProcessor("after", applied)));
        Query query = selectBody()
                .condition(Conditions.equals(column("trace_id"), literal("bad")))
                .build();

        // When / Then
        assertThatThrownBy(() -> pipeline.apply(query))
                .isInstanceOf(QueryProcessingException.class);
        assertThat(applied).isEmpty();
    }

    @Test
    public void shouldProduceSameResultForSameInput() throws Exception {
        // Given
        QueryProcessorPipeline pipeline = new QueryProcessorPipeline(List.of(
                new TupleUnaliaser(),
                new HexIntColumnProcessor(List.of("span_id")),
                new ClickhouseSettingsOverride(Map.of("max_threads", 4L))));
        Query query = Query.builder()
                .datasetKey("ourlogs")
                .select(column("span_id"))
                .condition(Conditions.in(column("span_id"), "1a2b", "ff"))
                .build();

        // When / Then
        assertThat(pipeline.apply(query)).isEqualTo(pipeline.apply(query));
    }

    @Test
    public void shouldLeaveQueryUnchangedWhenEmpty() throws Exception {
        Query query = selectBody().build();
        assertThat(QueryProcessorPipeline.empty().apply(query)).isEqualTo(query);
    }

    private static QueryProcessor recordingProcessor(String name, List<String> applied) {
        return query -> {
            applied.add(name);
            return query;
        };
    }
}
