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
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import com.cinchapi.concourse.TransactionException;
import com.cinchapi.linkage.store.LinkScope;

/**
 * {@link DocumentRecords} over in-memory records with Concourse-like
 * transactions: writes made after {@link #stage()} only become visible on
 * {@link #commit()}.
 * <p>
 * Single threaded. The same object serves as its own
 * {@link DocumentRecords.Connections}.
 * </p>
 */
class InMemoryDocumentRecords
        implements DocumentRecords, DocumentRecords.Connections {

    private Map<Long, Map<String, Object>> committed = new TreeMap<>();
    private Map<Long, Map<String, Object>> staged;
    private long nextRecord = 1;

    private boolean failNextCommit = false;
    private String preempted;

    int aborts = 0;
    int requests = 0;
    int releases = 0;
    boolean closed = false;

    /**
     * Make the next commit fail as if a concurrent transaction won.
     */
    void failNextCommit() {
        failNextCommit = true;
    }

    /**
     * Make the next attempt to create a record for {@code id} throw a
     * {@link TransactionException}.
     *
     * @param id
     */
    void preempt(String id) {
        preempted = id;
    }

    /**
     * Return the number of committed records.
     *
     * @return the count
     */
    int size() {
        return committed.size();
    }

    @Override
    public Long locate(String id) {
        for (Map.Entry<Long, Map<String, Object>> entry : data().entrySet()) {
            if(id.equals(entry.getValue().get(ConcourseDocuments.ID_KEY))) {
                return entry.getKey();
            }
        }
        return null;
    }

    @Override
    public Set<Long> locate(LinkScope scope) {
        Set<Long> records = new LinkedHashSet<>();
        data().forEach((record, values) -> {
            if(inScope(values, "side1", scope)
                    || inScope(values, "side2", scope)) {
                records.add(record);
            }
        });
        return records;
    }

    @Override
    public String json(long record) {
        return (String) data().get(record).get(ConcourseDocuments.JSON_KEY);
    }

    @Override
    public Map<Long, String> json(Set<Long> records) {
        Map<Long, String> json = new LinkedHashMap<>();
        for (long record : records) {
            json.put(record, json(record));
        }
        return json;
    }

    @Override
    public long create(String id) {
        if(id.equals(preempted)) {
            preempted = null;
            throw new TransactionException();
        }
        long record = nextRecord++;
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(ConcourseDocuments.ID_KEY, id);
        data().put(record, values);
        return record;
    }

    @Override
    public void add(String key, Object value, long record) {
        data().get(record).putIfAbsent(key, value);
    }

    @Override
    public void set(String key, Object value, long record) {
        data().get(record).put(key, value);
    }

    @Override
    public boolean verifyAndSwap(String key, Object expected, long record,
            Object replacement) {
        Map<String, Object> values = data().get(record);
        if(values != null && Objects.equals(values.get(key), expected)) {
            values.put(key, replacement);
            return true;
        }
        return false;
    }

    @Override
    public void clear(long record) {
        data().remove(record);
    }

    @Override
    public void stage() {
        staged = new TreeMap<>();
        committed.forEach((record, values) -> staged.put(record,
                new LinkedHashMap<>(values)));
    }

    @Override
    public boolean commit() {
        if(failNextCommit) {
            failNextCommit = false;
            staged = null;
            return false;
        }
        committed = staged;
        staged = null;
        return true;
    }

    @Override
    public void abort() {
        staged = null;
        ++aborts;
    }

    @Override
    public DocumentRecords request() {
        ++requests;
        return this;
    }

    @Override
    public void release(DocumentRecords records) {
        ++releases;
    }

    @Override
    public void close() {
        closed = true;
    }

    private Map<Long, Map<String, Object>> data() {
        return staged != null ? staged : committed;
    }

    private static boolean inScope(Map<String, Object> values, String side,
            LinkScope scope) {
        return scope.modelId().equals(
                values.get(ConcourseDocuments.sideKey(side, "modelId")))
                && (scope.fieldName() == null || scope.fieldName().equals(
                        values.get(ConcourseDocuments.sideKey(side,
                                "fieldName"))))
                && (scope.recordId() == null || scope.recordId().equals(
                        values.get(ConcourseDocuments.sideKey(side,
                                "recordId"))));
    }

}
