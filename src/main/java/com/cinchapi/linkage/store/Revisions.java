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

import java.nio.charset.StandardCharsets;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import com.google.gson.JsonObject;

/**
 * Utilities for document revisions of the form
 * {@code <generation>-<digest>}.
 */
public final class Revisions {

    /**
     * Return the revision that follows {@code current} for a document whose
     * content (without {@code _rev}) is {@code body}.
     * 
     * @param current the current revision or {@code null} for a new document
     * @param body
     * @return the next revision
     */
    public static String next(@Nullable String current, JsonObject body) {
        String digest = Hashing.sha256()
                .hashString(body.toString(), StandardCharsets.UTF_8)
                .toString();
        return (generation(current) + 1) + "-" + digest.substring(0, 16);
    }

    /**
     * Return the generation of the {@code revision}, or {@code 0} if there is
     * no revision.
     * 
     * @param revision
     * @return the generation
     */
    public static int generation(@Nullable String revision) {
        if(revision == null) {
            return 0;
        }
        int dash = revision.indexOf('-');
        Preconditions.checkArgument(dash > 0, "Malformed revision %s",
                revision);
        try {
            return Integer.parseInt(revision.substring(0, dash));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Malformed revision " + revision, e);
        }
    }

    private Revisions() {/* no-init */}

}
