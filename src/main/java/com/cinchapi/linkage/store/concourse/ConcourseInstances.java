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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import com.cinchapi.linkage.store.Instance;
import com.cinchapi.linkage.store.Instances;
import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * {@link Instances} where each instance id names a Concourse environment on
 * the same server.
 * <p>
 * A {@link ConcourseDocumentStore} is opened for an environment the first
 * time it is requested and kept until this object is {@link #close()
 * closed}.
 * </p>
 */
public final class ConcourseInstances implements Instances, AutoCloseable {

    /**
     * The connection settings shared by every environment.
     */
    private final ConcourseDocumentStore.Builder settings;

    /**
     * The open stores, by environment.
     */
    private final Cache<String, ConcourseDocumentStore> stores = CacheBuilder
            .newBuilder().build();

    /**
     * Construct a new instance.
     * 
     * @param settings the connection settings; the environment is replaced
     *            by each instance id
     */
    public ConcourseInstances(ConcourseDocumentStore.Builder settings) {
        this.settings = settings;
    }

    @Override
    public Instance get(String instanceId) {
        try {
            return Instance.of(stores.get(instanceId,
                    () -> settings.copyFor(instanceId).build()));
        }
        catch (ExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException(e.getCause());
        }
    }

    @Override
    public void close() throws Exception {
        List<Exception> errors = new ArrayList<>();
        for (ConcourseDocumentStore store : stores.asMap().values()) {
            try {
                store.close();
            }
            catch (Exception e) {
                errors.add(e);
            }
        }
        stores.invalidateAll();
        if(!errors.isEmpty()) {
            Exception error = errors.get(0);
            errors.stream().skip(1).forEach(error::addSuppressed);
            throw error;
        }
    }

}
