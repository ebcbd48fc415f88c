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
package strata.core.schema;

import org.junit.jupiter.api.Test;

import strata.core.schema.type.DateTime64Type;
import strata.core.schema.type.MapType;
import strata.core.schema.type.StringType;
import strata.core.schema.type.UIntType;
import strata.core.schema.type.UuidType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SchemaTest {

    @Test
    public void shouldKeepColumnsInOrder() {
        // Given
        Schema schema = Schema.builder().fields(
                new Field("organization_id", new UIntType(64)),
                new Field("trace_id", new UuidType()),
                new Field("timestamp", new DateTime64Type(9)))
                .build();

        // When / Then
        assertThat(schema.getFieldNames()).containsExactly("organization_id", "trace_id", "timestamp");
    }

    @Test
    public void shouldFindColumnType() {
        // Given
        Schema schema = Schema.builder().fields(
                new Field("body", new StringType()),
                new Field("attr_string", MapType.stringKeysTo(new StringType())))
                .build();

        // When / Then
        assertThat(schema.getFieldType("attr_string")).contains(new MapType(new StringType(), new StringType()));
        assertThat(schema.getFieldType("missing")).isEmpty();
    }

    @Test
    public void shouldRefuseDuplicateColumnNames() {
        // Given
        Schema.Builder builder = Schema.builder().fields(
                new Field("body", new StringType()),
                new Field("span_id", new UIntType(64)),
                new Field("body", new StringType()));

        // When / Then
        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Found duplicate column names: [body]");
    }

    @Test
    public void shouldRefuseNoColumns() {
        // Given
        Schema.Builder builder = Schema.builder().fields(List.of());

        // When / Then
        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Must have at least one column");
    }

    @Test
    public void equalsShouldCompareColumnsAndTypes() {
        // Given
        Schema schema1 = Schema.builder().fields(new Field("span_id", new UIntType(64))).build();
        Schema schema2 = Schema.builder().fields(new Field("span_id", new UIntType(64))).build();
        Schema schema3 = Schema.builder().fields(new Field("span_id", new UIntType(32))).build();

        // When / Then
        assertThat(schema1).isEqualTo(schema2);
        assertThat(schema1).isNotEqualTo(schema3);
    }
}
