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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static strata.query.testutil.TestQueries.column;
import static strata.query.testutil.TestQueries.literal;
import static strata.query.testutil.TestQueries.selectBody;

public class UUIDColumnProcessorTest {

    private final UUIDColumnProcessor processor = new UUIDColumnProcessor(List.of("trace_id"));

    @Test
    public void shouldCanonicaliseUuidInEquality() throws Exception {
        // Given
        Query query = selectBody()
                .condition(Conditions.equals(column("trace_id"), literal("7400045B25C443B885914600AA83AD04")))
                .build();

        // When
        Query processed = processor.process(query);

        // Then
        assertThat(processed.getCondition()).contains(
                Conditions.equals(column("trace_id"), literal("7400045b-25c4-43b8-8591-4600aa83ad04")));
    }

    @Test
    public void shouldCanonicaliseEveryUuidInMembership() throws Exception {
        // Given
        Query query = selectBody()
                .condition(Conditions.in(column("trace_id"),
                        "7400045b25c443b885914600aa83ad04", "A1B2C3D4-0000-1111-2222-333344445555"))
                .build();

        // When
        Query processed = processor.process(query);

        // Then
        assertThat(processed.getCondition()).contains(Conditions.in(column("trace_id"),
                "7400045b-25c4-43b8-8591-4600aa83ad04", "a1b2c3d4-0000-1111-2222-333344445555"));
    }

    @Test
    public void shouldIgnoreColumnsNotConfigured() throws Exception {
        // Given
        Query query = selectBody()
                .condition(Conditions.equals(column("span_id"), literal("not a uuid")))
                .build();

        // When / Then
        assertThat(processor.process(query)).isEqualTo(query);
    }

    @Test
    public void shouldRejectInvalidUuid() {
        // Given
        Query query = selectBody()
                .condition(Conditions.equals(column("trace_id"), literal("not-a-uuid")))
                .build();

        // When / Then
        assertThatThrownBy(() -> processor.process(query))
                .isInstanceOf(QueryProcessingException.class)
                .hasMessage("Not a valid UUID for column trace_id: not-a-uuid");
    }

    @Test
    public void shouldBeIdempotent() throws Exception {
        // Given
        Query query = selectBody()
                .condition(Conditions.equals(column("trace_id"), literal("7400045B25C443B885914600AA83AD04")))
                .build();

        // When
        Query once = processor.process(query);

        // Then
        assertThat(processor.process(once)).isEqualTo(once);
    }
}
