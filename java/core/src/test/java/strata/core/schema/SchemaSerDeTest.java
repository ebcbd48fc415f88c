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
import strata.core.schema.type.IntType;
import strata.core.schema.type.MapType;
import strata.core.schema.type.UIntType;

import static org.assertj.core.api.Assertions.assertThat;

public class SchemaSerDeTest {

    private final SchemaSerDe serDe = new SchemaSerDe();

    @Test
    public void shouldWriteColumnsWithTypeArguments() {
        // Given
        Schema schema = Schema.builder().fields(
                new Field("span_id", new UIntType(64)),
                new Field("timestamp", new DateTime64Type(9)))
                .build();

        // When
        String json = serDe.toJson(schema);

        // Then
        assertThat(json).isEqualTo("{\"columns\":[" +
                "{\"name\":\"span_id\",\"type\":\"UInt\",\"args\":{\"size\":64}}," +
                "{\"name\":\"timestamp\",\"type\":\"DateTime64\",\"args\":{\"precision\":9}}]}");
    }

    @Test
    public void shouldReadMapColumn() {
        // Given
        String json = "{\"columns\":[{\"name\":\"attr_int\",\"type\":\"Map\",\"args\":{" +
                "\"key\":{\"type\":\"String\"},\"value\":{\"type\":\"Int\",\"args\":{\"size\":64}}}}]}";

        // When
        Schema schema = serDe.fromJson(json);

        // Then
        assertThat(schema.getFields()).containsExactly(
                new Field("attr_int", MapType.stringKeysTo(new IntType(64))));
    }
}
