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

import strata.query.model.QueryException;

/**
 * Thrown when a query is missing a condition that is required on every query against a dataset. This is a security
 * failure, as the query could read data belonging to other tenants.
 */
public class MissingConditionException extends QueryException {

    private final String fieldName;

    private MissingConditionException(String requestId, String fieldName, String message, Throwable cause) {
        super(requestId, message, cause);
        this.fieldName = fieldName;
    }

    /**
     * Creates an exception for a missing condition on a field.
     *
     * @param  fieldName the field that must be restricted
     * @return           the exception
     */
    public static MissingConditionException forField(String fieldName) {
        return new MissingConditionException(null, fieldName,
                "Query must restrict " + fieldName + " to concrete values in its top-level conditions", null);
    }

    /**
     * Creates a copy of this exception linked to a request.
     *
     * @param  requestId the request ID
     * @return           the exception for the request
     */
    public MissingConditionException forRequest(String requestId) {
        return new MissingConditionException(requestId, fieldName, getMessage(), this);
    }

    public String getFieldName() {
        return fieldName;
    }
}
