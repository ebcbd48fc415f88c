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
import strata.query.model.Literal;
import strata.query.model.Query;
import strata.query.model.QueryProcessingException;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates UUID values compared to UUID columns, and rewrites them in canonical form: lowercase, with hyphens.
 * Values may be given with or without hyphens, in any case.
 */
public class UUIDColumnProcessor extends ConditionRewriter {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{12}");

    public UUIDColumnProcessor(List<String> columns) {
        super(columns);
    }

    @Override
    public Query process(Query query) throws QueryProcessingException {
        return rewriteConditions(query);
    }

    @Override
    protected Expression convert(String column, String value) throws QueryProcessingException {
        return Literal.of(canonicalise(column, value));
    }

    /**
     * Converts a UUID to canonical form.
     *
     * @param  column                   the column the value is compared to
     * @param  value                    the UUID
     * @return                          the UUID in lowercase, hyphenated form
     * @throws QueryProcessingException if the value is not a UUID
     */
    public static String canonicalise(String column, String value) throws QueryProcessingException {
        if (!UUID_PATTERN.matcher(value).matches()) {
            throw new QueryProcessingException("Not a valid UUID for column " + column + ": " + value);
        }
        String hex = value.replace("-", "").toLowerCase(Locale.ROOT);
        return hex.substring(0, 8) + "-" + hex.substring(8, 12) + "-" + hex.substring(12, 16)
                + "-" + hex.substring(16, 20) + "-" + hex.substring(20);
    }
}
