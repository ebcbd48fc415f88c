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

import strata.query.model.Conditions;
import strata.query.model.Expression;
import strata.query.model.Literal;
import strata.query.model.Query;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Requires every query to be restricted to specific organisations. The top-level conditions of the where clause must
 * include either <code>field = value</code> or <code>field IN (values...)</code>, with at least one value and no null
 * values. A restriction nested under an <code>or</code> does not count.
 */
public class OrgIdEnforcer implements MandatoryConditionChecker {

    private final String fieldName;

    public OrgIdEnforcer(String fieldName) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
    }

    @Override
    public void check(Query query) throws MissingConditionException {
        Expression condition = query.getCondition()
                .orElseThrow(() -> MissingConditionException.forField(fieldName));
        boolean restricted = Conditions.getConjuncts(condition).stream()
                .map(conjunct -> Conditions.findColumnMatchingLiterals(conjunct, fieldName))
                .flatMap(Optional::stream)
                .anyMatch(OrgIdEnforcer::isConcrete);
        if (!restricted) {
            throw MissingConditionException.forField(fieldName);
        }
    }

    public String getFieldName() {
        return fieldName;
    }

    private static boolean isConcrete(List<Literal> values) {
        return !values.isEmpty() && values.stream().noneMatch(Literal::isNull);
    }
}
