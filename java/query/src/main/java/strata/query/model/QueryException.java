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
 * A failure handling a query request. The request ID is set once the failure reaches the router, which knows which
 * request it belongs to.
 */
public abstract class QueryException extends Exception {

    private final String requestId;

    protected QueryException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    /**
     * Retrieves the ID of the request that failed.
     *
     * @return the request ID, or null if the failure has not been linked to a request
     */
    public String getRequestId() {
        return requestId;
    }
}
