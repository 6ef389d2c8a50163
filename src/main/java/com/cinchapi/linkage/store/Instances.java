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

import java.util.Map;

import com.cinchapi.linkage.NotFoundException;
import com.google.common.collect.ImmutableMap;

/**
 * Resolves an instance id to the {@link Instance} that should be operated
 * against.
 */
@FunctionalInterface
public interface Instances {

    /**
     * Return {@link Instances} that resolve from a fixed mapping.
     * 
     * @param instances
     * @return the {@link Instances}
     */
    public static Instances of(Map<String, Instance> instances) {
        Map<String, Instance> copy = ImmutableMap.copyOf(instances);
        return instanceId -> {
            Instance instance = copy.get(instanceId);
            if(instance == null) {
                throw new NotFoundException(instanceId);
            }
            return instance;
        };
    }

    /**
     * Return the {@link Instance} for {@code instanceId}.
     * 
     * @param instanceId
     * @return the {@link Instance}
     */
    public Instance get(String instanceId);

}
