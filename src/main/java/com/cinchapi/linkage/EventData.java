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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.linkage.schema.Model;
import com.cinchapi.linkage.schema.Record;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * What happened to drive a {@link LinkCoordinator}: the id of the affected
 * model and, if the event source already has them, the model and the record.
 */
@Immutable
public final class EventData {

    /**
     * Return {@link EventData} that only identifies the model. The model is
     * fetched on demand.
     * 
     * @param modelId
     * @return the {@link EventData}
     */
    public static EventData of(String modelId) {
        return new EventData(modelId, null, null);
    }

    /**
     * Return {@link EventData} for a model event.
     * 
     * @param model
     * @return the {@link EventData}
     */
    public static EventData of(Model model) {
        return new EventData(model.id(), model, null);
    }

    /**
     * Return {@link EventData} for a record event in which the model is
     * fetched on demand.
     * 
     * @param modelId
     * @param record
     * @return the {@link EventData}
     */
    public static EventData of(String modelId, Record record) {
        return new EventData(modelId, null,
                Preconditions.checkNotNull(record));
    }

    /**
     * Return {@link EventData} for a record event.
     * 
     * @param model
     * @param record
     * @return the {@link EventData}
     */
    public static EventData of(Model model, Record record) {
        return new EventData(model.id(), model,
                Preconditions.checkNotNull(record));
    }

    private final String modelId;

    @Nullable
    private final Model model;

    @Nullable
    private final Record record;

    private EventData(String modelId, @Nullable Model model,
            @Nullable Record record) {
        this.modelId = Preconditions.checkNotNull(modelId);
        this.model = model;
        this.record = record;
        Preconditions.checkArgument(
                record == null || record.modelId() == null
                        || record.modelId().equals(modelId),
                "Record %s belongs to model %s, not %s", record,
                record == null ? null : record.modelId(), modelId);
    }

    public String modelId() {
        return modelId;
    }

    @Nullable
    public Model model() {
        return model;
    }

    @Nullable
    public Record record() {
        return record;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("modelId", modelId).add("model", model)
                .add("record", record).toString();
    }

}
