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
import java.util.LinkedHashSet;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A {@link Record} is a document that belongs to exactly one {@link Model}
 * and holds field values.
 */
public final class Record {

    /**
     * Wrap the stored JSON form of a record.
     * 
     * @param json
     * @return the {@link Record}
     */
    public static Record fromJson(JsonObject json) {
        JsonElement id = json.get("_id");
        Preconditions.checkArgument(id != null && !id.isJsonNull(),
                "A record must have an _id");
        JsonElement modelId = json.get("modelId");
        return new Record(id.getAsString(),
                modelId == null || modelId.isJsonNull() ? null
                        : modelId.getAsString(),
                json.deepCopy());
    }

    /**
     * Return a new {@link Record} without any field values.
     * 
     * @param id
     * @param modelId
     * @return the {@link Record}
     */
    public static Record of(String id, String modelId) {
        JsonObject json = new JsonObject();
        json.addProperty("_id", id);
        json.addProperty("modelId", modelId);
        return new Record(id, modelId, json);
    }

    private final String id;

    @Nullable
    private final String modelId;

    private final JsonObject data;

    private Record(String id, @Nullable String modelId, JsonObject data) {
        this.id = id;
        this.modelId = modelId;
        this.data = data;
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
     * Return the id of the owning {@link Model}, if it is known.
     * 
     * @return the model id
     */
    @Nullable
    public String modelId() {
        return modelId;
    }

    /**
     * Return the ids of the records referenced by the link field
     * {@code fieldName}, without duplicates and in the order they first
     * appear.
     * <p>
     * An absent or {@code null} value references nothing.
     * </p>
     * 
     * @param fieldName
     * @return the referenced record ids
     * @throws IllegalArgumentException if the value is not an array of ids
     */
    public Set<String> references(String fieldName) {
        JsonElement value = data.get(fieldName);
        if(value == null || value.isJsonNull()) {
            return Collections.emptySet();
        }
        Preconditions.checkArgument(value.isJsonArray(),
                "Link field '%s' of record %s must hold an array of ids, but was %s",
                fieldName, id, value);
        Set<String> ids = new LinkedHashSet<>();
        for (JsonElement element : value.getAsJsonArray()) {
            Preconditions.checkArgument(
                    element.isJsonPrimitive()
                            && element.getAsJsonPrimitive().isString(),
                    "Link field '%s' of record %s contains %s, which is not a record id",
                    fieldName, id, element);
            ids.add(element.getAsString());
        }
        return ids;
    }

    /**
     * Set the link field {@code fieldName} to reference the {@code ids}.
     * 
     * @param fieldName
     * @param ids
     * @return this {@link Record}
     */
    public Record link(String fieldName, String... ids) {
        JsonArray array = new JsonArray();
        for (String linked : ids) {
            array.add(linked);
        }
        data.add(fieldName, array);
        return this;
    }

    /**
     * Return the JSON form of this {@link Record}.
     * 
     * @return the JSON
     */
    public JsonObject toJson() {
        return data.deepCopy();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", id)
                .add("modelId", modelId).toString();
    }

}
