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

/**
 * A {@link ConflictException} is thrown when the store rejects a write
 * because the document was concurrently modified (e.g. the supplied revision
 * is stale or a document with the same id already exists).
 */
@SuppressWarnings("serial")
public class ConflictException extends LinkageException {

    private final String id;

    public ConflictException(String id, String reason) {
        super("Conflict writing " + id + ": " + reason);
        this.id = id;
    }

    public ConflictException(String id, String reason, Throwable cause) {
        super("Conflict writing " + id + ": " + reason, cause);
        this.id = id;
    }

    /**
     * Return the id of the document whose write conflicted.
     * 
     * @return the id
     */
    public String id() {
        return id;
    }

}
