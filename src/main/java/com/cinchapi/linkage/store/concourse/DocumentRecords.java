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

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.cinchapi.concourse.TransactionException;
import com.cinchapi.linkage.store.LinkScope;

/**
 * The record level operations that a {@link ConcourseDocumentStore} performs
 * over a single connection.
 * <p>
 * Any operation within a {@link #stage() staged} transaction may throw a
 * {@link TransactionException} if a concurrent transaction touched the same
 * data.
 * </p>
 */
interface DocumentRecords {

    /**
     * Return the record that holds the document with {@code id}, or
     * {@code null} if there is none.
     *
     * @param id
     * @return the record
     */
    @Nullable
    Long locate(String id);

    /**
     * Return the records that hold link documents with either side in the
     * {@code scope}.
     *
     * @param scope
     * @return the records
     */
    Set<Long> locate(LinkScope scope);

    /**
     * Return the serialized document held in {@code record}.
     *
     * @param record
     * @return the serialized document
     */
    String json(long record);

    /**
     * Return the serialized documents held in the {@code records}.
     *
     * @param records
     * @return the serialized documents, by record
     */
    Map<Long, String> json(Set<Long> records);

    /**
     * Create a new record for the document with {@code id}.
     *
     * @param id
     * @return the new record
     */
    long create(String id);

    /**
     * Add {@code value} to {@code key} in {@code record}.
     *
     * @param key
     * @param value
     * @param record
     */
    void add(String key, Object value, long record);

    /**
     * Replace every value of {@code key} in {@code record} with
     * {@code value}.
     *
     * @param key
     * @param value
     * @param record
     */
    void set(String key, Object value, long record);

    /**
     * Atomically replace {@code expected} with {@code replacement} in
     * {@code key} of {@code record}.
     *
     * @param key
     * @param expected
     * @param record
     * @param replacement
     * @return {@code true} if {@code expected} was stored and replaced
     */
    boolean verifyAndSwap(String key, Object expected, long record,
            Object replacement);

    /**
     * Remove all the data in {@code record}.
     *
     * @param record
     */
    void clear(long record);

    void stage();

    boolean commit();

    void abort();

    /**
     * A source of {@link DocumentRecords} connections.
     */
    interface Connections extends AutoCloseable {

        /**
         * Borrow a connection.
         *
         * @return the connection
         */
        DocumentRecords request();

        /**
         * Return a borrowed connection.
         *
         * @param records
         */
        void release(DocumentRecords records);

    }

}
