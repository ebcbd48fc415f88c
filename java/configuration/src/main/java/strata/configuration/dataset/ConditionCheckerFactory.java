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
package strata.configuration.dataset;

import strata.core.schema.Schema;
import strata.query.checker.MandatoryConditionChecker;
import strata.query.checker.OrgIdEnforcer;

import java.util.Map;
import java.util.Set;

/**
 * Creates mandatory condition checkers by the names used in dataset configuration documents.
 */
public class ConditionCheckerFactory {

    private static final Map<String, Constructor> CONSTRUCTORS = Map.of(
            "OrgIdEnforcer", (args, schema) -> new OrgIdEnforcer(readField(args, schema)));

    private ConditionCheckerFactory() {
    }

    /**
     * Creates a mandatory condition checker.
     *
     * @param  name                     the checker name
     * @param  args                     the arguments from the document
     * @param  schema                   the columns of the dataset
     * @return                          the checker
     * @throws IllegalArgumentException if the name is not recognised or the arguments are invalid
     */
    public static MandatoryConditionChecker create(String name, Map<String, Object> args, Schema schema) {
        Constructor constructor = CONSTRUCTORS.get(name);
        if (constructor == null) {
            throw new IllegalArgumentException("Unknown mandatory condition checker " + name);
        }
        return constructor.create(new ConfigArgs(name, args), schema);
    }

    public static Set<String> getNames() {
        return CONSTRUCTORS.keySet();
    }

    private static String readField(ConfigArgs args, Schema schema) {
        String field = args.getString("field_name");
        if (schema.getField(field).isEmpty()) {
            throw new IllegalArgumentException("Column " + field + " not found in schema");
        }
        return field;
    }

    /**
     * Creates a checker from its arguments.
     */
    @FunctionalInterface
    private interface Constructor {
        MandatoryConditionChecker create(ConfigArgs args, Schema schema);
    }
}
