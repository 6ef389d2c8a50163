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

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import com.cinchapi.concourse.Concourse;
import com.cinchapi.concourse.ConnectionPool;
import com.cinchapi.concourse.TransactionException;
import com.cinchapi.linkage.ConflictException;
import com.cinchapi.linkage.LinkDocument;
import com.cinchapi.linkage.NotFoundException;
import com.cinchapi.linkage.store.DocumentStore;
import com.cinchapi.linkage.store.LinkQuery;
import com.cinchapi.linkage.store.LinkScope;
import com.cinchapi.linkage.store.Revisions;
import com.cinchapi.linkage.store.WriteResult;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A {@link DocumentStore} and {@link LinkQuery} that keeps documents in a
 * Concourse environment.
 * <p>
 * Every single-document write runs in its own Concourse transaction and the
 * revision is advanced with {@link Concourse#verifyAndSwap(String, Object,
 * long, Object) verifyAndSwap}, so a concurrent writer causes a
 * {@link ConflictException}, as does a transaction that Concourse aborts
 * because another one touched the same data. A {@link #bulkDocs(List) bulk
 * write} is a sequence of such writes whose outcomes are reported
 * independently.
 * Deleting a document clears its record.
 * </p>
 */
public final class ConcourseDocumentStore
        implements DocumentStore, LinkQuery, AutoCloseable {

    /**
     * Return a builder that can be used to configure the connection.
     * 
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    private static String string(JsonObject document, String member) {
        JsonElement element = document.get(member);
        return element == null || element.isJsonNull() ? null
                : element.getAsString();
    }

    /**
     * The connections to the environment.
     */
    private final DocumentRecords.Connections connections;

    /**
     * Construct a new instance.
     * 
     * @param connections
     */
    ConcourseDocumentStore(DocumentRecords.Connections connections) {
        this.connections = connections;
    }

    @Override
    public JsonObject get(String id) {
        DocumentRecords records = connections.request();
        try {
            Long located = records.locate(id);
            if(located == null) {
                throw new NotFoundException(id);
            }
            return ConcourseDocuments
                    .deserialize(records.json(located.longValue()));
        }
        finally {
            connections.release(records);
        }
    }

    @Override
    public String put(JsonObject document) {
        String id = string(document, "_id");
        Preconditions.checkArgument(id != null,
                "Cannot write a document without an _id");
        DocumentRecords records = connections.request();
        try {
            records.stage();
            String revision = write(records, id, document);
            if(records.commit()) {
                return revision;
            }
            else {
                throw new ConflictException(id,
                        "the transaction could not be committed");
            }
        }
        catch (TransactionException e) {
            records.abort();
            throw new ConflictException(id,
                    "the transaction was preempted by a concurrent write", e);
        }
        catch (RuntimeException e) {
            records.abort();
            throw e;
        }
        finally {
            connections.release(records);
        }
    }

    @Override
    public List<WriteResult> bulkDocs(List<JsonObject> documents) {
        ImmutableList.Builder<WriteResult> results = ImmutableList.builder();
        for (JsonObject document : documents) {
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
    public List<LinkDocument> getLinkDocuments(LinkScope scope) {
        DocumentRecords records = connections.request();
        try {
            Set<Long> located = records.locate(scope);
            if(located.isEmpty()) {
                return ImmutableList.of();
            }
            return records.json(located).values().stream()
                    .map(ConcourseDocuments::deserialize)
                    .filter(LinkDocument::isLinkDocument)
                    .map(LinkDocument::fromJson).filter(scope::matches)
                    .collect(Collectors.toList());
        }
        finally {
            connections.release(records);
        }
    }

    @Override
    public void close() throws Exception {
        connections.close();
    }

    /**
     * Write the {@code document} within the current transaction.
     * 
     * @param records
     * @param id
     * @param document
     * @return the new revision
     */
    private static String write(DocumentRecords records, String id,
            JsonObject document) {
        String rev = string(document, "_rev");
        JsonElement tombstone = document.get("_deleted");
        boolean deleted = tombstone != null && !tombstone.isJsonNull()
                && tombstone.getAsBoolean();
        JsonObject body = document.deepCopy();
        body.remove("_rev");
        Long located = records.locate(id);
        if(rev == null) {
            if(located != null) {
                throw new ConflictException(id, "document already exists");
            }
            else if(deleted) {
                throw new NotFoundException(id);
            }
            String revision = Revisions.next(null, body);
            long created = records.create(id);
            records.add(ConcourseDocuments.REV_KEY, revision, created);
            records.add(ConcourseDocuments.JSON_KEY,
                    ConcourseDocuments.serialize(body, revision), created);
            ConcourseDocuments.index(body).forEach(
                    (key, value) -> records.add(key, value, created));
            return revision;
        }
        else if(located == null) {
            throw new NotFoundException(id);
        }
        else {
            long record = located.longValue();
            String revision = Revisions.next(rev, body);
            if(!records.verifyAndSwap(ConcourseDocuments.REV_KEY, rev,
                    record, revision)) {
                throw new ConflictException(id,
                        "revision " + rev + " is stale");
            }
            if(deleted) {
                records.clear(record);
            }
            else {
                records.set(ConcourseDocuments.JSON_KEY,
                        ConcourseDocuments.serialize(body, revision), record);
                ConcourseDocuments.index(body).forEach(
                        (key, value) -> records.set(key, value, record));
            }
            return revision;
        }
    }

    /**
     * Builds a {@link ConcourseDocumentStore}.
     */
    public static class Builder {

        private String environment = "";
        private String host = "localhost";
        private String password = "admin";
        private int port = 1717;
        private String username = "admin";

        /**
         * Build the configured {@link ConcourseDocumentStore} and return the
         * instance.
         * 
         * @return a {@link ConcourseDocumentStore}
         */
        public ConcourseDocumentStore build() {
            return new ConcourseDocumentStore(ConcourseDocumentRecords
                    .pooled(ConnectionPool.newCachedConnectionPool(host, port,
                            username, password, environment)));
        }

        /**
         * Set the connection's environment.
         * 
         * @param environment
         * @return this builder
         */
        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Set the connection's host.
         * 
         * @param host
         * @return this builder
         */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Set the connection's password.
         * 
         * @param password
         * @return this builder
         */
        public Builder password(String password) {
            this.password = password;
            return this;
        }

        /**
         * Set the connection's port.
         * 
         * @param port
         * @return this builder
         */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Set the connection's username.
         * 
         * @param username
         * @return this builder
         */
        public Builder username(String username) {
            this.username = username;
            return this;
        }

        /**
         * Return a copy of this builder's connection settings that targets
         * the {@code environment}.
         * 
         * @param environment
         * @return the copy
         */
        Builder copyFor(String environment) {
            return new Builder().host(host).port(port).username(username)
                    .password(password).environment(environment);
        }

    }

}
