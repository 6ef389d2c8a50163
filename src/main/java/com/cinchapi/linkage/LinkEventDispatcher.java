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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cinchapi.linkage.store.Instances;
import com.google.common.base.Preconditions;

/**
 * Routes {@link LinkEvent events} to a {@link LinkCoordinator}.
 * <p>
 * Events for a model that has no link fields are skipped without touching
 * any link documents.
 * </p>
 */
public final class LinkEventDispatcher {

    private static final Logger log = LoggerFactory
            .getLogger(LinkEventDispatcher.class);

    /**
     * Resolves the instance id of each event.
     */
    private final Instances instances;

    private final int maxConflictRetries;

    /**
     * Construct a new instance.
     * 
     * @param instances
     */
    public LinkEventDispatcher(Instances instances) {
        this(instances, LinkCoordinator.DEFAULT_MAX_CONFLICT_RETRIES);
    }

    /**
     * Construct a new instance.
     * 
     * @param instances
     * @param maxConflictRetries
     */
    public LinkEventDispatcher(Instances instances, int maxConflictRetries) {
        this.instances = Preconditions.checkNotNull(instances);
        this.maxConflictRetries = maxConflictRetries;
    }

    /**
     * Handle the {@code event} that occurred in the instance identified by
     * {@code instanceId}.
     * 
     * @param event
     * @param instanceId
     * @param eventData
     * @return {@code true} if the event was handled, {@code false} if it was
     *         skipped because the model has no link fields
     */
    public boolean dispatch(LinkEvent event, String instanceId,
            EventData eventData) {
        LinkCoordinator coordinator = LinkCoordinator.builder()
                .instance(instanceId, instances.get(instanceId))
                .eventData(eventData).maxConflictRetries(maxConflictRetries)
                .build();
        if(!coordinator.doesModelHaveLinkFields()) {
            log.debug("Skipping {} for model {} without link fields", event,
                    eventData.modelId());
            return false;
        }
        switch (event) {
        case RECORD_SAVED:
            coordinator.recordSaved();
            break;
        case RECORD_DELETED:
            coordinator.recordDeleted();
            break;
        case MODEL_SAVED:
            coordinator.modelSaved();
            break;
        case MODEL_DELETED:
            coordinator.modelDeleted();
            break;
        default:
            throw new UnsupportedOperationException(
                    "Unknown event " + event);
        }
        return true;
    }

}
