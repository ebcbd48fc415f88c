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
package strata.core.dataset;

import org.apache.commons.lang3.StringUtils;

/**
 * Declares which message processor and default topic feed a dataset. This is stored and exposed, but ingestion itself
 * happens elsewhere.
 *
 * @param processor    the name of the message processor
 * @param defaultTopic the topic messages are read from by default
 */
public record StreamLoaderBinding(String processor, String defaultTopic) {

    public StreamLoaderBinding {
        if (StringUtils.isBlank(processor)) {
            throw new IllegalArgumentException("Stream loader processor must be set");
        }
        if (StringUtils.isBlank(defaultTopic)) {
            throw new IllegalArgumentException("Stream loader default topic must be set");
        }
    }
}
