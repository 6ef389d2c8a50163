/*
 * Copyright (c) 2013-2024 Cinchapi Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.cinchapi.linkage.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import javax.annotation.Nullable;

import com.cinchapi.linkage.MalformedSchemaException;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A {@link Model} is the schema definition for a class of {@link Record
 * Records}. It maps each field name to a {@link FieldDefinition}.
 * <p>
 * A {@link Model} is read from and written to the store as a whole, so any
 * top-level attributes that are not understood here are kept and written back
 * as they were.
 * </p>
 */
public final class Model {

    /**
     * Parse a {@link Model} from its stored JSON form.
     * 
     * @param json
     * @return the {@link Model}
     */
    public static Model fromJson(JsonObject json) {
        JsonObject extra = json.deepCopy();
        JsonElement id = extra.remove("_id");
        Preconditions.checkArgument(id != null && !id.isJsonNull(),
                "A model must have an _id");
        JsonElement rev = extra.remove("_rev");
        JsonElement name = extra.remove("name");
        JsonElement schema = extra.remove("schema");
        Model model = new Model(id.getAsString(),
                name == null || name.isJsonNull() ? null : name.getAsString(),
                extra);
        model.rev = rev == null || rev.isJsonNull() ? null : rev.getAsString();
        if(schema != null && schema.isJsonObject()) {
            for (Entry<String, JsonElement> entry : schema.getAsJsonObject()
                    .entrySet()) {
                model.schema.put(entry.getKey(), FieldDefinition
                        .fromJson(entry.getValue().getAsJsonObject()));
            }
        }
        return model;
    }

    /**
     * Return a new {@link Model} with an empty schema.
     * 
     * @param id
     * @param name
     * @return the {@link Model}
     */
    public static Model of(String id, String name) {
        return new Model(id, name, new JsonObject());
    }

    private final String id;
    private final String name;
    private final Map<String, FieldDefinition> schema;
    private final JsonObject extra;

    @Nullable
    private String rev;

    private Model(String id, @Nullable String name, JsonObject extra) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(id),
                "A model must have an id");
        this.id = id;
        this.name = name;
        this.extra = extra;
        this.schema = new LinkedHashMap<>();
    }

    /**
     * Return the id.
     * 
     * @return the id
     */
    public String id() {
        return id;
    }

    /**
     * Return the display name.
     * 
     * @return the name
     */
    @Nullable
    public String name() {
        return name;
    }

    /**
     * Return the store revision this {@link Model} was read at, if any.
     * 
     * @return the revision
     */
    @Nullable
    public String revision() {
        return rev;
    }

    /**
     * Return an unmodifiable view of the schema.
     * 
     * @return the schema
     */
    public Map<String, FieldDefinition> schema() {
        return Collections.unmodifiableMap(schema);
    }

    /**
     * Return the {@link FieldDefinition.Link link fields}, in schema order.
     * 
     * @return the link fields
     */
    public Map<String, FieldDefinition.Link> linkFields() {
        Map<String, FieldDefinition.Link> links = new LinkedHashMap<>();
        schema.forEach((fieldName, field) -> {
            switch (field.kind()) {
            case LINK:
                links.put(fieldName, field.asLink());
                break;
            case SCALAR:
                break;
            default:
                throw new UnsupportedOperationException(
                        "Unknown field kind " + field.kind());
            }
        });
        return links;
    }

    /**
     * Return {@code true} if any field in the schema is a link.
     * 
     * @return a boolean
     */
    public boolean hasLinkFields() {
        return schema.values().stream().anyMatch(FieldDefinition::isLink);
    }

    /**
     * Verify that every link field names the model and field on the other
     * side of the relationship.
     * 
     * @throws MalformedSchemaException if a link field is incomplete
     */
    public void checkLinkFields() {
        linkFields().forEach((fieldName, field) -> {
            if(Strings.isNullOrEmpty(field.remoteModelId())
                    || Strings.isNullOrEmpty(field.remoteFieldName())) {
                throw new MalformedSchemaException("Link field '" + fieldName
                        + "' of model " + id
                        + " must declare both a modelId and a fieldName");
            }
        });
    }

    /**
     * Add or replace the field definition for {@code fieldName}.
     * 
     * @param fieldName
     * @param field
     * @return {@code true} if the schema changed
     */
    public boolean putField(String fieldName, FieldDefinition field) {
        Preconditions.checkNotNull(field);
        return !field.equals(schema.put(fieldName, field));
    }

    /**
     * Remove the field definition for {@code fieldName}.
     * 
     * @param fieldName
     * @return {@code true} if the schema changed
     */
    public boolean removeField(String fieldName) {
        return schema.remove(fieldName) != null;
    }

    /**
     * Return the stored JSON form of this {@link Model}.
     * 
     * @return the JSON
     */
    public JsonObject toJson() {
        JsonObject json = extra.deepCopy();
        json.addProperty("_id", id);
        if(rev != null) {
            json.addProperty("_rev", rev);
        }
        if(name != null) {
            json.addProperty("name", name);
        }
        JsonObject fields = new JsonObject();
        schema.forEach((fieldName, field) -> fields.add(fieldName,
                field.toJson()));
        json.add("schema", fields);
        return json;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", id)
                .add("name", name).add("schema", schema).toString();
    }

}
