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
package strata.query.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import strata.core.util.LoggedDuration;

/**
 * Writes a line to the log for every finished request.
 */
public class LoggingQueryLogListener implements QueryLogListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingQueryLogListener.class);

    @Override
    public void requestFinished(QueryLogEntry entry) {
        LoggedDuration duration = LoggedDuration.of(entry.getDuration());
        if (entry.getStatus() == QueryStatus.SUCCESS) {
            LOGGER.info("Request {} against dataset {} for {} finished in {}, scanned {} bytes: {}",
                    entry.getRequestId(), entry.getDatasetKey(), entry.getTenant().getDimensions(), duration,
                    entry.getBytesScanned(), entry.getSql().orElse(""));
        } else {
            LOGGER.warn("Request {} against dataset {} for {} ended with status {} after {}: {}",
                    entry.getRequestId(), entry.getDatasetKey(), entry.getTenant().getDimensions(),
                    entry.getStatus(), duration, entry.getErrorMessage().orElse(""));
        }
        entry.getQuotaAllowance().ifPresent(summary -> LOGGER.debug("Quota allowance for request {}: {}",
                entry.getRequestId(), summary.toMap()));
    }
}
