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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The outcome of writing a single document as part of a
 * {@link DocumentStore#bulkDocs(java.util.List) bulk write}.
 */
@Immutable
public final class WriteResult {

    /**
     * The reasons an item of a bulk write can be rejected.
     */
    public enum Error {
        /**
         * The document was concurrently modified or already exists.
         */
        CONFLICT,

        /**
         * An update or tombstone referred to a document that does not exist.
         */
        NOT_FOUND,

        /**
         * The store refused the document for any other reason.
         */
        REJECTED
    }

    /**
     * Return a successful result.
     * 
     * @param id
     * @param revision
     * @return the result
     */
    public static WriteResult ok(String id, String revision) {
        return new WriteResult(id, revision, null, null);
    }

    /**
     * Return a failed result.
     * 
     * @param id
     * @param error
     * @param reason
     * @return the result
     */
    public static WriteResult failed(String id, Error error, String reason) {
        Preconditions.checkNotNull(error);
        return new WriteResult(id, null, error, reason);
    }

    private final String id;

    @Nullable
    private final String revision;

    @Nullable
    private final Error error;

    @Nullable
    private final String reason;

    private WriteResult(String id, @Nullable String revision,
            @Nullable Error error, @Nullable String reason) {
        this.id = id;
        this.revision = revision;
        this.error = error;
        this.reason = reason;
    }

    public String id() {
        return id;
    }

    @Nullable
    public String revision() {
        return revision;
    }

    @Nullable
    public Error error() {
        return error;
    }

    @Nullable
    public String reason() {
        return reason;
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isConflict() {
        return error == Error.CONFLICT;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("id", id)
                .add("revision", revision).add("error", error)
                .add("reason", reason).toString();
    }

}
