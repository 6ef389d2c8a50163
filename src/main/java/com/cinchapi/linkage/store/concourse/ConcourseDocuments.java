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
package com.cinchapi.linkage.store.concourse;

import java.util.LinkedHashMap;
import java.util.Map;

import com.cinchapi.concourse.lang.BuildableState;
import com.cinchapi.concourse.lang.Criteria;
import com.cinchapi.concourse.thrift.Operator;
import com.cinchapi.linkage.LinkDocument;
import com.cinchapi.linkage.store.LinkScope;
import com.google.common.base.Preconditions;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * The mapping between JSON documents and Concourse records.
 * <p>
 * Each document is stored in its own record. The full document is kept as a
 * JSON string under {@link #JSON_KEY}; the document id, the revision and, for
 * {@link LinkDocument link documents}, each attribute of both sides are kept
 * under their own keys so that they can be found with a {@link Criteria}.
 * </p>
 */
final class ConcourseDocuments {

    /**
     * The key that holds the document id.
     */
    static final String ID_KEY = "doc_id";

    /**
     * The key that holds the document revision.
     */
    static final String REV_KEY = "doc_rev";

    /**
     * The key that holds the serialized document.
     */
    static final String JSON_KEY = "doc_json";

    /**
     * The attributes of a link document side that are indexed.
     */
    private static final String[] SIDE_ATTRIBUTES = { "modelId", "fieldName",
            "recordId" };

    /**
     * Return the key under which the {@code attribute} of the {@code side}
     * ({@code side1} or {@code side2}) is indexed.
     * 
     * @param side
     * @param attribute
     * @return the key
     */
    static String sideKey(String side, String attribute) {
        return side + "_" + attribute;
    }

    /**
     * Return the searchable keys of the {@code document}, other than its
     * id and revision, mapped to their values.
     * 
     * @param document
     * @return the indexed values
     */
    static Map<String, Object> index(JsonObject document) {
        Map<String, Object> index = new LinkedHashMap<>();
        if(LinkDocument.isLinkDocument(document)) {
            for (String side : new String[] { "side1", "side2" }) {
                JsonObject json = document.getAsJsonObject(side);
                for (String attribute : SIDE_ATTRIBUTES) {
                    index.put(sideKey(side, attribute),
                            json.get(attribute).getAsString());
                }
            }
        }
        else {
            JsonElement id = document.get("_id");
            Preconditions.checkArgument(id == null || !id.isJsonPrimitive()
                    || !id.getAsString()
                            .startsWith(LinkDocument.ID_PREFIX + ":"),
                    "Link document %s is incomplete", id);
        }
        return index;
    }

    /**
     * Return the stored form of the {@code document} at {@code revision}.
     * 
     * @param document
     * @param revision
     * @return the serialized document
     */
    static String serialize(JsonObject document, String revision) {
        JsonObject copy = document.deepCopy();
        copy.remove("_deleted");
        copy.addProperty("_rev", revision);
        return copy.toString();
    }

    /**
     * Parse a serialized document.
     * 
     * @param json
     * @return the document
     */
    static JsonObject deserialize(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

    /**
     * Return the {@link Criteria} that finds the record holding the document
     * with {@code id}.
     * 
     * @param id
     * @return the criteria
     */
    static Criteria byId(String id) {
        return Criteria.where().key(ID_KEY).operator(Operator.EQUALS)
                .value(id);
    }

    /**
     * Return the {@link Criteria} that finds the link documents with either
     * side in the {@code scope}.
     * 
     * @param scope
     * @return the criteria
     */
    static Criteria inScope(LinkScope scope) {
        return Criteria.where().group(side("side1", scope)).or()
                .group(side("side2", scope));
    }

    private static BuildableState side(String side, LinkScope scope) {
        BuildableState state = Criteria.where()
                .key(sideKey(side, "modelId")).operator(Operator.EQUALS)
                .value(scope.modelId());
        if(scope.fieldName() != null) {
            state = state.and().key(sideKey(side, "fieldName"))
                    .operator(Operator.EQUALS).value(scope.fieldName());
        }
        if(scope.recordId() != null) {
            state = state.and().key(sideKey(side, "recordId"))
                    .operator(Operator.EQUALS).value(scope.recordId());
        }
        return state;
    }

    private ConcourseDocuments() {/* no-init */}

}
