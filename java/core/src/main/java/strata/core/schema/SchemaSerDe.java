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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.google.gson.reflect.TypeToken;

import strata.core.schema.type.Type;
import strata.core.schema.type.TypeFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serialises a dataset schema to and from a JSON string. Columns are written in the same structure as in a dataset
 * configuration document, e.g. <code>{"name": "span_id", "type": "UInt", "args": {"size": 64}}</code>.
 */
public class SchemaSerDe {
    private static final java.lang.reflect.Type ARGS_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    private final Gson gson;
    private final Gson gsonPrettyPrinting;

    public SchemaSerDe() {
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Schema.class, new SchemaJsonSerializer())
                .registerTypeAdapter(Schema.class, new SchemaJsonDeserializer())
                .create();
        this.gsonPrettyPrinting = new GsonBuilder()
                .setPrettyPrinting()
                .registerTypeAdapter(Schema.class, new SchemaJsonSerializer())
                .registerTypeAdapter(Schema.class, new SchemaJsonDeserializer())
                .create();
    }

    /**
     * Serialises a schema to a JSON string.
     *
     * @param  schema the schema
     * @return        a JSON string
     */
    public String toJson(Schema schema) {
        return gson.toJson(schema, Schema.class);
    }

    /**
     * Serialises a schema to a JSON string.
     *
     * @param  schema      the schema
     * @param  prettyPrint whether to pretty-print the JSON string
     * @return             a JSON string
     */
    public String toJson(Schema schema, boolean prettyPrint) {
        if (prettyPrint) {
            return gsonPrettyPrinting.toJson(schema, Schema.class);
        }
        return toJson(schema);
    }

    /**
     * Deserialises a JSON string to a schema.
     *
     * @param  jsonSchema the JSON string
     * @return            a schema
     */
    public Schema fromJson(String jsonSchema) {
        return gson.fromJson(jsonSchema, Schema.class);
    }

    /**
     * A GSON plugin to serialise a schema as a list of columns.
     */
    private static class SchemaJsonSerializer implements JsonSerializer<Schema> {

        @Override
        public JsonElement serialize(Schema schema, java.lang.reflect.Type typeOfSrc, JsonSerializationContext context) {
            JsonArray columns = new JsonArray();
            for (Field field : schema.getFields()) {
                JsonObject column = new JsonObject();
                column.addProperty("name", field.getName());
                Map<String, Object> description = TypeFactory.toDescription(field.getType());
                description.forEach((key, value) -> column.add(key, context.serialize(value)));
                columns.add(column);
            }
            JsonObject object = new JsonObject();
            object.add("columns", columns);
            return object;
        }
    }

    /**
     * A GSON plugin to deserialise a schema from a list of columns.
     */
    private static class SchemaJsonDeserializer implements JsonDeserializer<Schema> {

        @Override
        public Schema deserialize(JsonElement jsonElement, java.lang.reflect.Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
            if (!jsonElement.isJsonObject() || !jsonElement.getAsJsonObject().has("columns")) {
                throw new JsonParseException("Expected an object with columns, found " + jsonElement);
            }
            List<Field> fields = new ArrayList<>();
            for (JsonElement element : jsonElement.getAsJsonObject().getAsJsonArray("columns")) {
                JsonObject column = element.getAsJsonObject();
                String tag = column.get(TypeFactory.TYPE).getAsString();
                Map<String, Object> args = column.has(TypeFactory.ARGS)
                        ? context.deserialize(column.get(TypeFactory.ARGS), ARGS_TYPE)
                        : null;
                Type type = TypeFactory.create(tag, args);
                fields.add(new Field(column.get("name").getAsString(), type));
            }
            return Schema.builder().fields(fields).build();
        }
    }
}
