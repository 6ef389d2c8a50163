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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Thrown when the reciprocal field of one or more link fields could not be
 * written to (or removed from) the model on the other side of the
 * relationship.
 * <p>
 * Each failure is attributed to the link field whose propagation failed.
 * Fields that are not in {@link #failures()} were propagated successfully.
 * </p>
 */
@SuppressWarnings("serial")
public class SchemaPropagationException extends LinkageException {

    private final Map<String, RuntimeException> failures;

    public SchemaPropagationException(String modelId,
            Map<String, RuntimeException> failures) {
        super("Could not propagate link field(s) " + failures.keySet()
                + " of model " + modelId);
        this.failures = ImmutableMap.copyOf(failures);
        failures.values().forEach(this::addSuppressed);
    }

    /**
     * Return a mapping from each link field name to the error that prevented
     * its reciprocal field from being propagated.
     * 
     * @return the failures
     */
    public Map<String, RuntimeException> failures() {
        return failures;
    }

}
