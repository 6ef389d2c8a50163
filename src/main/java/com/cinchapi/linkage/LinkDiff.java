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
package com.cinchapi.linkage;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

import com.cinchapi.linkage.schema.FieldDefinition;
import com.cinchapi.linkage.store.LinkScope;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The {@link LinkDocument link documents} that must be created and deleted so
 * that one link field of one record references exactly a desired set of
 * records.
 * <p>
 * Both the current and the desired references are treated as sets: a record
 * that is referenced on both sides is left alone no matter where it appears.
 * If more than one link document associates the record with the same other
 * record, all but one are deleted.
 * </p>
 */
@Immutable
public final class LinkDiff {

    /**
     * Compute the {@link LinkDiff} for the link {@code field} named
     * {@code fieldName} of the record {@code recordId} in model
     * {@code modelId}.
     * 
     * @param modelId
     * @param fieldName
     * @param recordId
     * @param field the definition of the link field
     * @param current the live link documents for the field and record
     * @param desired the ids of the records that should be linked
     * @return the {@link LinkDiff}
     */
    public static LinkDiff of(String modelId, String fieldName,
            String recordId, FieldDefinition.Link field,
            Collection<LinkDocument> current, Set<String> desired) {
        LinkScope self = LinkScope.of(modelId, fieldName, recordId);
        ImmutableList.Builder<LinkDocument> deletes = ImmutableList.builder();
        Map<String, LinkDocument> linked = new LinkedHashMap<>();
        for (LinkDocument document : current) {
            LinkDocument.Side other = document.opposite(self);
            if(other != null
                    && linked.putIfAbsent(other.recordId(), document) != null) {
                deletes.add(document);
            }
        }
        linked.forEach((id, document) -> {
            if(!desired.contains(id)) {
                deletes.add(document);
            }
        });
        ImmutableList.Builder<LinkDocument> creates = ImmutableList.builder();
        for (String id : desired) {
            if(!linked.containsKey(id)) {
                creates.add(LinkDocument.of(modelId, fieldName, recordId,
                        field.remoteModelId(), field.remoteFieldName(), id));
            }
        }
        return new LinkDiff(creates.build(), deletes.build());
    }

    private final List<LinkDocument> creates;
    private final List<LinkDocument> deletes;

    private LinkDiff(List<LinkDocument> creates, List<LinkDocument> deletes) {
        this.creates = creates;
        this.deletes = deletes;
    }

    /**
     * Return the new {@link LinkDocument link documents} to create.
     * 
     * @return the creations
     */
    public List<LinkDocument> creates() {
        return creates;
    }

    /**
     * Return the existing {@link LinkDocument link documents} to delete.
     * 
     * @return the deletions
     */
    public List<LinkDocument> deletes() {
        return deletes;
    }

    /**
     * Return {@code true} if nothing needs to be written.
     * 
     * @return a boolean
     */
    public boolean isEmpty() {
        return creates.isEmpty() && deletes.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("creates", creates)
                .add("deletes", deletes).toString();
    }

}
