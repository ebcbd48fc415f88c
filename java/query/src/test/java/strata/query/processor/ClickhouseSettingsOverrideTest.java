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

import strata.query.model.Query;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static strata.query.testutil.TestQueries.selectBody;

public class ClickhouseSettingsOverrideTest {

    @Test
    public void shouldOverrideSettingsFromQuery() {
        // Given
        Query query = selectBody()
                .settings(Map.of("max_execution_time", 60L, "max_rows_to_read", 1000L))
                .build();
        ClickhouseSettingsOverride override = new ClickhouseSettingsOverride(Map.of("max_execution_time", 30L));

        // When
        Query processed = override.process(query);

        // Then
        assertThat(processed.getSettings()).isEqualTo(Map.of(
                "max_execution_time", 30L,
                "max_rows_to_read", 1000L));
    }
}
