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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.linkage.schema.FieldDefinition;
import com.cinchapi.linkage.schema.Model;
import com.cinchapi.linkage.schema.Record;
import com.cinchapi.linkage.store.DocumentStore;
import com.cinchapi.linkage.store.Instance;
import com.cinchapi.linkage.store.LinkQuery;
import com.cinchapi.linkage.store.LinkScope;
import com.cinchapi.linkage.store.WriteResult;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.gson.JsonObject;

/**
 * A {@link LinkCoordinator} brings the {@link LinkDocument link documents}
 * and reciprocal link fields of an instance back in sync after a single
 * {@link LinkEvent event}.
 * <p>
 * A coordinator is created for one event and operates against one
 * {@link Instance}. Each operation reads the current state from the store,
 * computes what must change and writes only that. Because every step is a
 * reconciliation against the stored state, re-invoking an operation after a
 * partial failure finishes the job instead of repeating it.
 * </p>
 * <p>
 * No locking is performed. Concurrent events for the same record can
 * interleave between reading the current link documents and writing the
 * changes; the store's revision checks turn such races into conflicts, and a
 * conflicting operation is re-run from scratch up to
 * {@link Builder#maxConflictRetries(int) a bounded number of times}.
 * </p>
 */
public final class LinkCoordinator {

    private static final Logger log = LoggerFactory
            .getLogger(LinkCoordinator.class);

    /**
     * The default number of times an operation is re-run after a write
     * conflict.
     */
    public static final int DEFAULT_MAX_CONFLICT_RETRIES = 3;

    /**
     * Return a builder for a {@link LinkCoordinator}.
     * 
     * @return the builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return {@code true} if the {@code model} declares any link field.
     * 
     * @param model
     * @return a boolean
     */
    public static boolean hasLinkFields(Model model) {
        return model.hasLinkFields();
    }

    private final String instanceId;
    private final DocumentStore store;
    private final LinkQuery links;
    private final String modelId;

    @Nullable
    private final Record record;

    private final int maxConflictRetries;

    /**
     * The model, once it has been supplied or fetched.
     */
    @Nullable
    private Model model;

    private LinkCoordinator(String instanceId, Instance instance,
            EventData eventData, int maxConflictRetries) {
        this.instanceId = instanceId;
        this.store = instance.store();
        this.links = instance.links();
        this.modelId = eventData.modelId();
        this.model = eventData.model();
        this.record = eventData.record();
        this.maxConflictRetries = maxConflictRetries;
    }

    /**
     * Return the id of the instance this coordinator operates against.
     * 
     * @return the instance id
     */
    public String instanceId() {
        return instanceId;
    }

    /**
     * Return the model of the event, fetching it from the store the first
     * time it is needed if it was not supplied with the event.
     * 
     * @return the {@link Model}
     * @throws NotFoundException if the model does not exist
     */
    public Model model() {
        if(model == null) {
            model = store.getModel(modelId);
        }
        return model;
    }

    /**
     * Return {@code true} if the model of the event declares any link field.
     * 
     * @return a boolean
     */
    public boolean doesModelHaveLinkFields() {
        return hasLinkFields(model());
    }

    /**
     * Return the live link documents of the event's model, narrowed to the
     * {@code fieldName} and {@code recordId} when they are given.
     * 
     * @param fieldName the field or {@code null} for any field
     * @param recordId the record or {@code null} for any record
     * @return the link documents
     */
    public List<LinkDocument> getLinkDocuments(@Nullable String fieldName,
            @Nullable String recordId) {
        return links.getLinkDocuments(
                LinkScope.of(modelId, fieldName, recordId));
    }

    /**
     * Create and delete link documents so that each link field of the saved
     * record is backed by exactly one link document per referenced record.
     * <p>
     * A link field that is absent from the record references nothing, so all
     * of its link documents are deleted.
     * </p>
     * 
     * @throws MalformedSchemaException if a link field is incomplete
     * @throws BulkWriteException if any link document could not be written
     */
    public void recordSaved() {
        Record saved = requireRecord();
        Model model = model();
        model.checkLinkFields();
        reconcile("recordSaved " + saved.id(), () -> {
            ImmutableList.Builder<JsonObject> operations = ImmutableList
                    .builder();
            model.linkFields().forEach((fieldName, field) -> {
                LinkDiff diff = LinkDiff.of(model.id(), fieldName, saved.id(),
                        field, getLinkDocuments(fieldName, saved.id()),
                        saved.references(fieldName));
                log.debug("Field '{}' of record {} in instance {}: {}",
                        fieldName, saved.id(), instanceId, diff);
                diff.creates().forEach(
                        document -> operations.add(document.toJson()));
                diff.deletes().forEach(document -> operations
                        .add(document.tombstone().toJson()));
            });
            return operations.build();
        });
    }

    /**
     * Delete every link document of the deleted record, across all of its
     * fields.
     * 
     * @throws BulkWriteException if any link document could not be deleted
     */
    public void recordDeleted() {
        Record deleted = requireRecord();
        reconcile("recordDeleted " + deleted.id(),
                () -> tombstones(getLinkDocuments(null, deleted.id())));
    }

    /**
     * Add or update the reciprocal field in the model on the other side of
     * each link field of the saved model.
     * <p>
     * Each link field is propagated on its own. A field whose propagation
     * fails does not prevent the others from being propagated.
     * </p>
     * 
     * @throws MalformedSchemaException if a link field is incomplete
     * @throws SchemaPropagationException if any reciprocal field could not be
     *             written
     */
    public void modelSaved() {
        Model model = model();
        model.checkLinkFields();
        propagate(model, model.linkFields(),
                (fieldName, field) -> other -> other.putField(
                field.remoteFieldName(),
                FieldDefinition.link(model.name(), model.id(), fieldName)));
    }

    /**
     * Remove the reciprocal field from the model on the other side of each
     * link field of the deleted model and then delete every link document of
     * the deleted model.
     * <p>
     * Link documents are only deleted once all reciprocal fields are gone. If
     * any removal fails the link documents are left in place; invoking this
     * operation again completes the cleanup.
     * </p>
     * <p>
     * A link field that points back into the deleted model itself is not
     * propagated, since the schema that would hold the reciprocal field is
     * going away with the model.
     * </p>
     * 
     * @throws MalformedSchemaException if a link field is incomplete
     * @throws SchemaPropagationException if any reciprocal field could not be
     *             removed
     * @throws BulkWriteException if any link document could not be deleted
     */
    public void modelDeleted() {
        Model model = model();
        model.checkLinkFields();
        Map<String, FieldDefinition.Link> remote = Maps.filterValues(
                model.linkFields(),
                field -> !model.id().equals(field.remoteModelId()));
        propagate(model, remote, (fieldName, field) -> other -> {
            boolean changed = false;
            for (Map.Entry<String, FieldDefinition.Link> entry : other
                    .linkFields().entrySet()) {
                FieldDefinition.Link reciprocal = entry.getValue();
                if(reciprocal.pointsTo(model.id(), fieldName)
                        || (entry.getKey().equals(model.name()) && model.id()
                                .equals(reciprocal.remoteModelId()))) {
                    changed |= other.removeField(entry.getKey());
                }
            }
            return changed;
        });
        reconcile("modelDeleted " + model.id(),
                () -> tombstones(getLinkDocuments(null, null)));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("instance", instanceId)
                .add("modelId", modelId).add("record", record).toString();
    }

    /**
     * Apply a patch to the model on the other side of each of the
     * {@code fields} of the {@code model}, collecting failures per field.
     * 
     * @param model
     * @param fields the link fields to propagate
     * @param patches a function from each link field to the patch for the
     *            other model; a patch returns {@code true} if it changed the
     *            model
     */
    private void propagate(Model model,
            Map<String, FieldDefinition.Link> fields, PatchFactory patches) {
        Map<String, RuntimeException> failures = new LinkedHashMap<>();
        fields.forEach((fieldName, field) -> {
            try {
                patchModel(field.remoteModelId(),
                        patches.create(fieldName, field));
            }
            catch (RuntimeException e) {
                log.warn("Could not propagate link field '{}' of model {} "
                        + "to model {} in instance {}", fieldName, model.id(),
                        field.remoteModelId(), instanceId, e);
                failures.put(fieldName, e);
            }
        });
        if(!failures.isEmpty()) {
            throw new SchemaPropagationException(model.id(), failures);
        }
    }

    /**
     * Fetch the model with {@code id}, apply the {@code patch} and write it
     * back if it changed. The whole step is repeated if the write conflicts.
     * 
     * @param id
     * @param patch
     */
    private void patchModel(String id, Predicate<Model> patch) {
        for (int attempt = 0;; ++attempt) {
            Model other = store.getModel(id);
            if(!patch.test(other)) {
                return;
            }
            try {
                store.putModel(other);
                return;
            }
            catch (ConflictException e) {
                if(attempt >= maxConflictRetries) {
                    throw e;
                }
                log.warn("Model {} in instance {} changed concurrently; "
                        + "retrying ({}/{})", id, instanceId, attempt + 1,
                        maxConflictRetries);
            }
        }
    }

    /**
     * Plan a set of writes and apply them as one bulk write. If some of the
     * writes conflict, and none failed for any other reason, the whole
     * operation is planned and applied again.
     * 
     * @param operation a description of the operation
     * @param planner computes the writes from the current stored state
     */
    private void reconcile(String operation,
            Supplier<List<JsonObject>> planner) {
        for (int attempt = 0;; ++attempt) {
            List<JsonObject> writes = planner.get();
            if(writes.isEmpty()) {
                log.debug("{} in instance {} requires no writes", operation,
                        instanceId);
                return;
            }
            log.debug("{} in instance {} writes {} link document(s)",
                    operation, instanceId, writes.size());
            List<WriteResult> failures = store.bulkDocs(writes).stream()
                    .filter(result -> !result.isOk())
                    .collect(Collectors.toList());
            if(failures.isEmpty()) {
                return;
            }
            else if(attempt < maxConflictRetries
                    && failures.stream().allMatch(WriteResult::isConflict)) {
                log.warn("{} in instance {} hit {} conflict(s); retrying "
                        + "({}/{})", operation, instanceId, failures.size(),
                        attempt + 1, maxConflictRetries);
            }
            else {
                log.warn("{} in instance {} failed to write {}", operation,
                        instanceId, failures);
                throw new BulkWriteException(failures);
            }
        }
    }

    private Record requireRecord() {
        Preconditions.checkState(record != null,
                "A record is required to handle a record event for model %s",
                modelId);
        return record;
    }

    /**
     * Return the tombstones of the {@code documents}.
     * 
     * @param documents
     * @return the tombstones
     */
    private static List<JsonObject> tombstones(
            List<LinkDocument> documents) {
        return documents.stream()
                .map(document -> document.tombstone().toJson())
                .collect(Collectors.toList());
    }

    /**
     * Creates the patch to apply to the model on the other side of a link
     * field.
     */
    @FunctionalInterface
    private interface PatchFactory {

        Predicate<Model> create(String fieldName, FieldDefinition.Link field);

    }

    /**
     * Builds a {@link LinkCoordinator}.
     */
    public static class Builder {

        private String instanceId;
        private Instance instance;
        private EventData eventData;
        private int maxConflictRetries = DEFAULT_MAX_CONFLICT_RETRIES;

        /**
         * Build the configured {@link LinkCoordinator}.
         * 
         * @return the {@link LinkCoordinator}
         */
        public LinkCoordinator build() {
            Preconditions.checkState(instanceId != null && instance != null,
                    "An instance is required");
            Preconditions.checkState(eventData != null,
                    "Event data is required");
            Model model = eventData.model();
            Preconditions.checkState(
                    model == null
                            || Objects.equals(model.id(), eventData.modelId()),
                    "The model in the event data does not match its modelId");
            return new LinkCoordinator(instanceId, instance, eventData,
                    maxConflictRetries);
        }

        /**
         * Set the data about the event being handled.
         * 
         * @param eventData
         * @return this builder
         */
        public Builder eventData(EventData eventData) {
            this.eventData = eventData;
            return this;
        }

        /**
         * Set the instance to operate against.
         * 
         * @param instanceId
         * @param instance
         * @return this builder
         */
        public Builder instance(String instanceId, Instance instance) {
            this.instanceId = instanceId;
            this.instance = instance;
            return this;
        }

        /**
         * Set the number of times an operation is re-run after a write
         * conflict before the conflict is reported.
         * 
         * @param maxConflictRetries
         * @return this builder
         */
        public Builder maxConflictRetries(int maxConflictRetries) {
            Preconditions.checkArgument(maxConflictRetries >= 0);
            this.maxConflictRetries = maxConflictRetries;
            return this;
        }

    }

}
