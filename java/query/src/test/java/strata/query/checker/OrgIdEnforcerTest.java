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
package strata.query.checker;

import org.junit.jupiter.api.Test;

import strata.query.model.Conditions;
import strata.query.model.FunctionCall;
import strata.query.model.Query;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static strata.query.testutil.TestQueries.column;
import static strata.query.testutil.TestQueries.literal;
import static strata.query.testutil.TestQueries.organizationIs;
import static strata.query.testutil.TestQueries.selectBody;

public class OrgIdEnforcerTest {

    private final OrgIdEnforcer enforcer = new OrgIdEnforcer("organization_id");

    @Test
    public void shouldAcceptEqualityInTopLevelConjunction() {
        // Given
        Query query = selectBody()
                .condition(Conditions.and(
                        Conditions.equals(column("project_id"), literal(2)),
                        organizationIs(1)))
                .build();

        // When / Then
        assertThatCode(() -> enforcer.check(query)).doesNotThrowAnyException();
    }

    @Test
    public void shouldAcceptMembershipOfConcreteValues() {
        // Given
        Query query = selectBody()
                .condition(Conditions.in(column("organization_id"), 1, 2))
                .build();

        // When / Then
        assertThatCode(() -> enforcer.check(query)).doesNotThrowAnyException();
    }

    @Test
    public void shouldRejectQueryWithNoCondition() {
        // Given
        Query query = selectBody().build();

        // When / Then
        assertThatThrownBy(() -> enforcer.check(query))
                .isInstanceOf(MissingConditionException.class)
                .hasMessage("Query must restrict organization_id to concrete values in its top-level conditions");
    }

    @Test
    public void shouldRejectRestrictionInsideDisjunction() {
        // Given
        Query query = selectBody()
                .condition(Conditions.or(
                        organizationIs(1),
                        Conditions.equals(column("project_id"), literal(2))))
                .build();

        // When / Then
        assertThatThrownBy(() -> enforcer.check(query))
                .isInstanceOf(MissingConditionException.class)
                .extracting("fieldName").isEqualTo("organization_id");
    }

    @Test
    public void shouldRejectComparisonWithNull() {
        // Given
        Query query = selectBody()
                .condition(Conditions.equals(column("organization_id"), literal(null)))
                .build();

        // When / Then
        assertThatThrownBy(() -> enforcer.check(query))
                .isInstanceOf(MissingConditionException.class);
    }

    @Test
    public void shouldRejectEmptyMembership() {
        // Given
        Query query = selectBody()
                .condition(FunctionCall.of(Conditions.IN, column("organization_id"), FunctionCall.tuple()))
                .build();

        // When / Then
        assertThatThrownBy(() -> enforcer.check(query))
                .isInstanceOf(MissingConditionException.class);
    }

    @Test
    public void shouldRejectRangeCondition() {
        // Given
        Query query = selectBody()
                .condition(FunctionCall.of(Conditions.GREATER, column("organization_id"), literal(0)))
                .build();

        // When / Then
        assertThatThrownBy(() -> enforcer.check(query))
                .isInstanceOf(MissingConditionException.class);
    }
}
