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

import java.util.List;

import com.cinchapi.linkage.LinkDocument;

/**
 * Finds the live {@link LinkDocument link documents} of an instance.
 */
@FunctionalInterface
public interface LinkQuery {

    /**
     * Return every live {@link LinkDocument} that has a side within the
     * {@code scope}, regardless of whether it is {@code side1} or
     * {@code side2}.
     * 
     * @param scope
     * @return the matching link documents
     */
    public List<LinkDocument> getLinkDocuments(LinkScope scope);

}
