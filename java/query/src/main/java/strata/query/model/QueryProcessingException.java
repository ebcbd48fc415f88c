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

/**
 * Thrown when a query processor cannot rewrite a query, e.g. because a literal is not valid for the column it is
 * compared to.
 */
public class QueryProcessingException extends QueryException {

    public QueryProcessingException(String message) {
        this(null, message, null);
    }

    public QueryProcessingException(String requestId, String message, Throwable cause) {
        super(requestId, message, cause);
    }

    /**
     * Creates a copy of this exception linked to a request.
     *
     * @param  requestId the request ID
     * @return           the exception for the request
     */
    public QueryProcessingException forRequest(String requestId) {
        return new QueryProcessingException(requestId, getMessage(), this);
    }
}
