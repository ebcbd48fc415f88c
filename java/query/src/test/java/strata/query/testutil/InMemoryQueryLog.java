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
package strata.query.testutil;

import strata.query.log.QueryLogEntry;
import strata.query.log.QueryLogListener;

import java.util.ArrayList;
import java.util.List;

public class InMemoryQueryLog implements QueryLogListener {

    private final List<QueryLogEntry> entries = new ArrayList<>();

    @Override
    public synchronized void requestFinished(QueryLogEntry entry) {
        entries.add(entry);
    }

    public synchronized List<QueryLogEntry> getEntries() {
        return List.copyOf(entries);
    }

    public synchronized QueryLogEntry getOnlyEntry() {
        if (entries.size() != 1) {
            throw new IllegalStateException("Expected one entry, found " + entries);
        }
        return entries.get(0);
    }
}
