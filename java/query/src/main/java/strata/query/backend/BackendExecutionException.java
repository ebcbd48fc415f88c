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
package strata.query.backend;

import strata.query.model.QueryException;

/**
 * Thrown when the backend fails to run a query. The cause is the failure reported by the backend.
 */
public class BackendExecutionException extends QueryException {

    public BackendExecutionException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public BackendExecutionException(String requestId, String message, Throwable cause) {
        super(requestId, message, cause);
    }

    /**
     * Creates a copy of this exception linked to a request.
     *
     * @param  requestId the request ID
     * @return           the exception for the request
     */
    public BackendExecutionException forRequest(String requestId) {
        return new BackendExecutionException(requestId, getMessage(), getCause());
    }
}
