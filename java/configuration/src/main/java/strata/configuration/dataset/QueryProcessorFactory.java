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
import strata.core.schema.type.Type;
import strata.core.schema.type.UIntType;
import strata.core.schema.type.UuidType;
import strata.query.processor.ClickhouseSettingsOverride;
import strata.query.processor.HexIntColumnProcessor;
import strata.query.processor.QueryProcessor;
import strata.query.processor.TupleUnaliaser;
import strata.query.processor.UUIDColumnProcessor;
import strata.query.processor.UniqInSelectAndHavingProcessor;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Creates query processors by the names used in dataset configuration documents. Checks that any columns a processor
 * is configured for exist in the dataset, with a type the processor can handle.
 */
public class QueryProcessorFactory {

    private static final Map<String, Constructor> CONSTRUCTORS = Map.of(
            "UniqInSelectAndHavingProcessor", (args, schema) -> new UniqInSelectAndHavingProcessor(),
            "UUIDColumnProcessor", (args, schema) -> new UUIDColumnProcessor(
                    readColumns(args, schema, type -> type instanceof UuidType, "UUID")),
            "HexIntColumnProcessor", (args, schema) -> new HexIntColumnProcessor(
                    readColumns(args, schema, type -> type instanceof UIntType, "unsigned integer")),
            "TupleUnaliaser", (args, schema) -> new TupleUnaliaser(),
            "ClickhouseSettingsOverride", (args, schema) -> new ClickhouseSettingsOverride(args.getMap("settings")));

    private QueryProcessorFactory() {
    }

    /**
     * Creates a query processor.
     *
     * @param  name                     the processor name
     * @param  args                     the arguments from the document
     * @param  schema                   the columns of the dataset
     * @return                          the processor
     * @throws IllegalArgumentException if the name is not recognised or the arguments are invalid
     */
    public static QueryProcessor create(String name, Map<String, Object> args, Schema schema) {
        Constructor constructor = CONSTRUCTORS.get(name);
        if (constructor == null) {
            throw new IllegalArgumentException("Unknown query processor " + name);
        }
        return constructor.create(new ConfigArgs(name, args), schema);
    }

    public static Set<String> getNames() {
        return CONSTRUCTORS.keySet();
    }

    private static List<String> readColumns(ConfigArgs args, Schema schema, Predicate<Type> allowedType, String typeDescription) {
        List<String> columns = args.getStringList("columns");
        for (String column : columns) {
            Type type = schema.getFieldType(column)
                    .orElseThrow(() -> new IllegalArgumentException("Column " + column + " not found in schema"));
            if (!allowedType.test(type)) {
                throw new IllegalArgumentException("Column " + column + " must be of " + typeDescription
                        + " type, found " + type.getTag());
            }
        }
        return columns;
    }

    /**
     * Creates a query processor from its arguments.
     */
    @FunctionalInterface
    private interface Constructor {
        QueryProcessor create(ConfigArgs args, Schema schema);
    }
}
