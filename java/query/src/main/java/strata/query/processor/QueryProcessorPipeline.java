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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import strata.query.model.Query;
import strata.query.model.QueryProcessingException;

import java.util.List;

/**
 * Applies the query processors configured for a dataset, in order. Each processor receives the output of the one
 * before. If any processor fails, the whole pipeline fails and no partial rewrite is returned.
 */
public class QueryProcessorPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryProcessorPipeline.class);

    private final List<QueryProcessor> processors;

    public QueryProcessorPipeline(List<QueryProcessor> processors) {
        this.processors = List.copyOf(processors);
    }

    /**
     * Creates a pipeline that leaves queries unchanged.
     *
     * @return the pipeline
     */
    public static QueryProcessorPipeline empty() {
        return new QueryProcessorPipeline(List.of());
    }

    /**
     * Rewrites a query with every processor in turn.
     *
     * @param  query                    the query
     * @return                          the rewritten query
     * @throws QueryProcessingException if any processor fails
     */
    public Query apply(Query query) throws QueryProcessingException {
        Query processed = query;
        for (QueryProcessor processor : processors) {
            processed = processor.process(processed);
            LOGGER.debug("Applied {}, query is now {}", processor.getClass().getSimpleName(), processed);
        }
        return processed;
    }

    public List<QueryProcessor> getProcessors() {
        return processors;
    }
}
