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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import com.cinchapi.linkage.ConflictException;
import com.cinchapi.linkage.LinkDocument;
import com.cinchapi.linkage.NotFoundException;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A {@link DocumentStore} that keeps every document in memory.
 * <p>
 * Revisions follow the {@code <generation>-<digest>} convention and are
 * checked on every write, so concurrent modification is reported as a
 * {@link ConflictException} just like a networked store would. Deleted
 * documents are kept as tombstones and a new document may later be created
 * with the same id.
 * </p>
 */
@ThreadSafe
public class InMemoryDocumentStore implements DocumentStore, LinkQuery {

    /**
     * Return the value of the {@code member} in {@code document}, if it is
     * present.
     * 
     * @param document
     * @param member
     * @return the value or {@code null}
     */
    @Nullable
    private static String string(JsonObject document, String member) {
        JsonElement element = document.get(member);
        return element == null || element.isJsonNull() ? null
                : element.getAsString();
    }

    /**
     * The stored documents (including tombstones), by id.
     */
    private final Map<String, Stored> documents = new LinkedHashMap<>();

    @Override
    public synchronized JsonObject get(String id) {
        Stored stored = documents.get(id);
        if(stored == null || stored.deleted) {
            throw new NotFoundException(id);
        }
        return stored.document.deepCopy();
    }

    @Override
    public synchronized String put(JsonObject document) {
        String id = string(document, "_id");
        Preconditions.checkArgument(id != null,
                "Cannot write a document without an _id");
        String rev = string(document, "_rev");
        JsonElement tombstone = document.get("_deleted");
        boolean deleted = tombstone != null && !tombstone.isJsonNull()
                && tombstone.getAsBoolean();
        Stored stored = documents.get(id);
        if(rev == null) {
            if(stored != null && !stored.deleted) {
                throw new ConflictException(id, "document already exists");
            }
            else if(deleted) {
                throw new NotFoundException(id);
            }
        }
        else if(stored == null) {
            throw new NotFoundException(id);
        }
        else if(stored.deleted) {
            throw new ConflictException(id, "document has been deleted");
        }
        else if(!rev.equals(stored.rev)) {
            throw new ConflictException(id, "revision " + rev
                    + " is stale, the current revision is " + stored.rev);
        }
        JsonObject copy = document.deepCopy();
        copy.remove("_rev");
        String revision = Revisions.next(stored == null ? null : stored.rev,
                copy);
        copy.addProperty("_rev", revision);
        documents.put(id, new Stored(revision, copy, deleted));
        return revision;
    }

    @Override
    public synchronized List<WriteResult> bulkDocs(List<JsonObject> docs) {
        ImmutableList.Builder<WriteResult> results = ImmutableList.builder();
        for (JsonObject document : docs) {
            String id = string(document, "_id");
            try {
                results.add(WriteResult.ok(id, put(document)));
            }
            catch (ConflictException e) {
                results.add(WriteResult.failed(id, WriteResult.Error.CONFLICT,
                        e.getMessage()));
            }
            catch (NotFoundException e) {
                results.add(WriteResult.failed(id, WriteResult.Error.NOT_FOUND,
                        e.getMessage()));
            }
            catch (IllegalArgumentException e) {
                results.add(WriteResult.failed(id, WriteResult.Error.REJECTED,
                        e.getMessage()));
            }
        }
        return results.build();
    }

    @Override
    public synchronized List<LinkDocument> getLinkDocuments(LinkScope scope) {
        return documents.values().stream().filter(stored -> !stored.deleted)
                .map(stored -> stored.document)
                .filter(LinkDocument::isLinkDocument)
                .map(LinkDocument::fromJson).filter(scope::matches)
                .collect(Collectors.toList());
    }

    /**
     * Return the number of live documents.
     * 
     * @return the number of documents that are not tombstones
     */
    public synchronized int size() {
        return (int) documents.values().stream()
                .filter(stored -> !stored.deleted).count();
    }

    /**
     * The stored state of a single document.
     */
    private static final class Stored {

        final String rev;
        final JsonObject document;
        final boolean deleted;

        Stored(String rev, JsonObject document, boolean deleted) {
            this.rev = rev;
            this.document = document;
            this.deleted = deleted;
        }

    }

}
