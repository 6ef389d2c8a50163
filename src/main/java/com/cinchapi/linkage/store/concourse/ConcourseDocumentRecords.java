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

import com.cinchapi.concourse.Concourse;
import com.cinchapi.concourse.ConnectionPool;
import com.cinchapi.linkage.store.LinkScope;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

/**
 * {@link DocumentRecords} backed by a {@link Concourse} connection, using the
 * key layout of {@link ConcourseDocuments}.
 */
final class ConcourseDocumentRecords implements DocumentRecords {

    /**
     * Return {@link DocumentRecords.Connections} that borrow from the
     * {@code pool}.
     *
     * @param pool
     * @return the connections
     */
    static DocumentRecords.Connections pooled(ConnectionPool pool) {
        return new DocumentRecords.Connections() {

            @Override
            public DocumentRecords request() {
                return new ConcourseDocumentRecords(pool.request());
            }

            @Override
            public void release(DocumentRecords records) {
                pool.release(((ConcourseDocumentRecords) records).concourse);
            }

            @Override
            public void close() throws Exception {
                if(!pool.isClosed()) {
                    pool.close();
                }
            }

        };
    }

    private final Concourse concourse;

    ConcourseDocumentRecords(Concourse concourse) {
        this.concourse = concourse;
    }

    @Override
    @Nullable
    public Long locate(String id) {
        return Iterables.getFirst(
                concourse.find(ConcourseDocuments.byId(id)), null);
    }

    @Override
    public Set<Long> locate(LinkScope scope) {
        return concourse.find(ConcourseDocuments.inScope(scope));
    }

    @Override
    public String json(long record) {
        return concourse.get(ConcourseDocuments.JSON_KEY, record);
    }

    @Override
    public Map<Long, String> json(Set<Long> records) {
        if(records.isEmpty()) {
            return ImmutableMap.of();
        }
        return concourse.get(ConcourseDocuments.JSON_KEY, records);
    }

    @Override
    public long create(String id) {
        return concourse.add(ConcourseDocuments.ID_KEY, id);
    }

    @Override
    public void add(String key, Object value, long record) {
        concourse.add(key, value, record);
    }

    @Override
    public void set(String key, Object value, long record) {
        concourse.set(key, value, record);
    }

    @Override
    public boolean verifyAndSwap(String key, Object expected, long record,
            Object replacement) {
        return concourse.verifyAndSwap(key, expected, record, replacement);
    }

    @Override
    public void clear(long record) {
        concourse.clear(record);
    }

    @Override
    public void stage() {
        concourse.stage();
    }

    @Override
    public boolean commit() {
        return concourse.commit();
    }

    @Override
    public void abort() {
        concourse.abort();
    }

}
