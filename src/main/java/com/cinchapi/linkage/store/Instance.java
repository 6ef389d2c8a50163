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

import javax.annotation.concurrent.Immutable;

import com.google.common.base.Preconditions;

/**
 * The collaborators used to operate against one instance: its
 * {@link DocumentStore} and its {@link LinkQuery}.
 */
@Immutable
public final class Instance {

    /**
     * Return an {@link Instance} backed by a single object that is both the
     * store and the link query.
     * 
     * @param store
     * @return the {@link Instance}
     */
    public static <T extends DocumentStore & LinkQuery> Instance of(T store) {
        return new Instance(store, store);
    }

    /**
     * Return an {@link Instance}.
     * 
     * @param store
     * @param links
     * @return the {@link Instance}
     */
    public static Instance of(DocumentStore store, LinkQuery links) {
        return new Instance(store, links);
    }

    private final DocumentStore store;
    private final LinkQuery links;

    private Instance(DocumentStore store, LinkQuery links) {
        this.store = Preconditions.checkNotNull(store);
        this.links = Preconditions.checkNotNull(links);
    }

    public DocumentStore store() {
        return store;
    }

    public LinkQuery links() {
        return links;
    }

}
