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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A call to a function, aggregate or operator. Conditions are function calls as well, e.g. <code>equals(a, b)</code>
 * or <code>and(x, y)</code>. Tuples are calls to the function <code>tuple</code>.
 *
 * @param alias        the alias, or null
 * @param functionName the function name
 * @param parameters   the parameters
 */
public record FunctionCall(String alias, String functionName, List<Expression> parameters) implements Expression {

    public static final String TUPLE = "tuple";

    public FunctionCall {
        Objects.requireNonNull(functionName, "functionName must not be null");
        parameters = List.copyOf(parameters);
    }

    /**
     * Creates an unaliased function call.
     *
     * @param  functionName the function name
     * @param  parameters   the parameters
     * @return              the function call
     */
    public static FunctionCall of(String functionName, Expression... parameters) {
        return new FunctionCall(null, functionName, Arrays.asList(parameters));
    }

    /**
     * Creates an unaliased tuple.
     *
     * @param  elements the elements of the tuple
     * @return          the tuple
     */
    public static FunctionCall tuple(Expression... elements) {
        return of(TUPLE, elements);
    }

    public boolean isTuple() {
        return TUPLE.equals(functionName);
    }

    /**
     * Checks whether this is a call to the given function.
     *
     * @param  name the function name
     * @return      true if this calls that function
     */
    public boolean isCallTo(String name) {
        return functionName.equals(name);
    }

    /**
     * Creates a copy of this call with different parameters.
     *
     * @param  newParameters the parameters
     * @return               the copy
     */
    public FunctionCall withParameters(List<Expression> newParameters) {
        return new FunctionCall(alias, functionName, newParameters);
    }

    @Override
    public Optional<String> getAlias() {
        return Optional.ofNullable(alias);
    }

    @Override
    public FunctionCall withAlias(String newAlias) {
        return new FunctionCall(newAlias, functionName, parameters);
    }

    @Override
    public Expression transform(UnaryOperator<Expression> transformation) {
        List<Expression> transformed = parameters.stream()
                .map(parameter -> parameter.transform(transformation))
                .toList();
        return transformation.apply(withParameters(transformed));
    }

    @Override
    public Stream<Expression> stream() {
        return Stream.concat(Stream.of(this), parameters.stream().flatMap(Expression::stream));
    }
}
