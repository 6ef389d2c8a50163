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
 * A {@link NotFoundException} is thrown when a document that is required for
 * an operation does not exist in the store.
 */
@SuppressWarnings("serial")
public class NotFoundException extends LinkageException {

    /**
     * The id of the missing document.
     */
    private final String id;

    public NotFoundException(String id) {
        super("Document " + id + " does not exist");
        this.id = id;
    }

    /**
     * Return the id of the document that could not be found.
     * 
     * @return the missing id
     */
    public String id() {
        return id;
    }

}
