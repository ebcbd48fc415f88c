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

import strata.query.model.Expression;
import strata.query.model.FunctionCall;
import strata.query.model.Query;

/**
 * Removes aliases from everything nested inside a tuple, leaving only the alias of the tuple itself.
 */
public class TupleUnaliaser implements QueryProcessor {

    @Override
    public Query process(Query query) {
        return query.transformExpressions(TupleUnaliaser::unaliasTuple);
    }

    private static Expression unaliasTuple(Expression expression) {
        if (expression instanceof FunctionCall tuple && tuple.isTuple()) {
            return tuple.withParameters(tuple.parameters().stream()
                    .map(Expression::withoutAliases)
                    .toList());
        }
        return expression;
    }
}
