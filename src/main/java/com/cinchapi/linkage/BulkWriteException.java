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

import java.util.List;
import java.util.stream.Collectors;

import com.cinchapi.linkage.store.WriteResult;
import com.google.common.collect.ImmutableList;

/**
 * A {@link BulkWriteException} is thrown when one or more items of a bulk
 * write were rejected by the store.
 * <p>
 * Items that were accepted remain applied; only the {@link #failures()} were
 * not written.
 * </p>
 */
@SuppressWarnings("serial")
public class BulkWriteException extends LinkageException {

    /**
     * The results of the items that failed.
     */
    private final List<WriteResult> failures;

    public BulkWriteException(List<WriteResult> failures) {
        super(failures.size() + " link document write(s) failed: "
                + failures.stream().map(WriteResult::toString)
                        .collect(Collectors.joining(", ")));
        this.failures = ImmutableList.copyOf(failures);
    }

    /**
     * Return the {@link WriteResult results} of the items that were not
     * written.
     * 
     * @return the failed items
     */
    public List<WriteResult> failures() {
        return failures;
    }

}
