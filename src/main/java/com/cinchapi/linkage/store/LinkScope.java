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

import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.linkage.LinkDocument;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The scope of a {@link LinkQuery}: a model and, optionally, a field and a
 * record. An omitted field or record matches any.
 */
@Immutable
public final class LinkScope {

    /**
     * Return a scope matching every link document of the model.
     * 
     * @param modelId
     * @return the scope
     */
    public static LinkScope of(String modelId) {
        return new LinkScope(modelId, null, null);
    }

    /**
     * Return a scope.
     * 
     * @param modelId
     * @param fieldName the field, or {@code null} for any field
     * @param recordId the record, or {@code null} for any record
     * @return the scope
     */
    public static LinkScope of(String modelId, @Nullable String fieldName,
            @Nullable String recordId) {
        return new LinkScope(modelId, fieldName, recordId);
    }

    private final String modelId;

    @Nullable
    private final String fieldName;

    @Nullable
    private final String recordId;

    private LinkScope(String modelId, @Nullable String fieldName,
            @Nullable String recordId) {
        this.modelId = Preconditions.checkNotNull(modelId);
        this.fieldName = fieldName;
        this.recordId = recordId;
    }

    public String modelId() {
        return modelId;
    }

    @Nullable
    public String fieldName() {
        return fieldName;
    }

    @Nullable
    public String recordId() {
        return recordId;
    }

    /**
     * Return {@code true} if the {@code side} falls within this scope.
     * 
     * @param side
     * @return a boolean
     */
    public boolean matches(LinkDocument.Side side) {
        return modelId.equals(side.modelId())
                && (fieldName == null || fieldName.equals(side.fieldName()))
                && (recordId == null || recordId.equals(side.recordId()));
    }

    /**
     * Return {@code true} if either side of the {@code document} falls within
     * this scope and the document is not a tombstone.
     * 
     * @param document
     * @return a boolean
     */
    public boolean matches(LinkDocument document) {
        return !document.isDeleted() && (matches(document.side1())
                || matches(document.side2()));
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof LinkScope) {
            LinkScope other = (LinkScope) obj;
            return modelId.equals(other.modelId)
                    && Objects.equals(fieldName, other.fieldName)
                    && Objects.equals(recordId, other.recordId);
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, fieldName, recordId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("modelId", modelId)
                .add("fieldName", fieldName == null ? "*" : fieldName)
                .add("recordId", recordId == null ? "*" : recordId)
                .toString();
    }

}
