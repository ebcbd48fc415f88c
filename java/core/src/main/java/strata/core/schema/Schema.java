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
package strata.core.schema;

import strata.core.schema.type.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A Schema describes the columns found in a dataset. Column names are unique, and the order of columns is the order
 * they were declared in.
 */
public class Schema {
    private final List<Field> fields;

    private Schema(Builder builder) {
        fields = validateFields(builder.fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Schema loadFromString(String schemaJson) {
        return new SchemaSerDe().fromJson(schemaJson);
    }

    public List<Field> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        return fields.stream()
                .map(Field::getName)
                .collect(Collectors.toUnmodifiableList());
    }

    public Optional<Field> getField(String fieldName) {
        return fields.stream()
                .filter(f -> f.getName().equals(fieldName))
                .findFirst();
    }

    /**
     * Retrieves the type of a column.
     *
     * @param  fieldName the column name
     * @return           the type, or an empty optional if there is no column with that name
     */
    public Optional<Type> getFieldType(String fieldName) {
        return getField(fieldName).map(Field::getType);
    }

    @Override
    public String toString() {
        return "Schema{" + "fields=" + fields + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Schema schema = (Schema) o;
        return Objects.equals(fields, schema.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    /**
     * Builds a schema.
     */
    public static final class Builder {
        private List<Field> fields;

        private Builder() {
        }

        public Builder fields(List<Field> fields) {
            this.fields = fields;
            return this;
        }

        public Builder fields(Field... fields) {
            return fields(Arrays.asList(fields));
        }

        public Schema build() {
            return new Schema(this);
        }
    }

    private static List<Field> validateFields(List<Field> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Must have at least one column");
        }
        validateNoDuplicates(fields);
        return Collections.unmodifiableList(new ArrayList<>(fields));
    }

    private static void validateNoDuplicates(List<Field> fields) {
        Set<String> foundNames = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        fields.forEach(field -> {
            boolean isNew = foundNames.add(field.getName());
            if (!isNew) {
                duplicates.add(field.getName());
            }
        });
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Found duplicate column names: " + duplicates);
        }
    }
}
