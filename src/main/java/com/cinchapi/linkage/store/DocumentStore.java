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
package com.cinchapi.linkage.store;

import java.util.List;

import com.cinchapi.linkage.ConflictException;
import com.cinchapi.linkage.NotFoundException;
import com.cinchapi.linkage.schema.Model;
import com.google.gson.JsonObject;

/**
 * A {@link DocumentStore} provides access to the JSON documents of one
 * instance.
 * <p>
 * Every document carries its id in {@code _id} and, once stored, a revision
 * in {@code _rev}. Writing a document with {@code "_deleted": true} turns it
 * into a tombstone. Multi-document writes are not atomic: each item of a
 * {@link #bulkDocs(List) bulk write} succeeds or fails on its own.
 * </p>
 */
public interface DocumentStore {

    /**
     * Return the live document with {@code id}.
     * 
     * @param id
     * @return the document
     * @throws NotFoundException if there is no live document with {@code id}
     */
    public JsonObject get(String id);

    /**
     * Write a single {@code document}.
     * <p>
     * A document without a {@code _rev} is created; a document with a
     * {@code _rev} replaces (or, if it is {@code _deleted}, tombstones) the
     * stored document at that revision.
     * </p>
     * 
     * @param document
     * @return the new revision
     * @throws ConflictException if the revision is stale or the document
     *             already exists
     * @throws NotFoundException if a revision is given for a document that
     *             does not exist
     */
    public String put(JsonObject document);

    /**
     * Write each of the {@code documents} independently and return one
     * {@link WriteResult} per document, in the same order.
     * 
     * @param documents
     * @return the results
     */
    public List<WriteResult> bulkDocs(List<JsonObject> documents);

    /**
     * Return the {@link Model} with {@code id}.
     * 
     * @param id
     * @return the {@link Model}
     * @throws NotFoundException if the model does not exist
     */
    public default Model getModel(String id) {
        return Model.fromJson(get(id));
    }

    /**
     * Write the {@code model}.
     * 
     * @param model
     * @return the new revision
     * @throws ConflictException if the model was modified since it was read
     */
    public default String putModel(Model model) {
        return put(model.toJson());
    }

}
