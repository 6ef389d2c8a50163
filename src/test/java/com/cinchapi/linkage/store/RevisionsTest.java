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

import org.junit.Assert;
import org.junit.Test;

import com.google.gson.JsonObject;

/**
 * Unit tests for {@link Revisions}.
 */
public class RevisionsTest {

    @Test
    public void testNextAdvancesGeneration() {
        JsonObject body = new JsonObject();
        body.addProperty("_id", "a");
        String first = Revisions.next(null, body);
        Assert.assertEquals(1, Revisions.generation(first));
        Assert.assertEquals(8, Revisions.generation(Revisions.next("7-x", body)));
    }

    @Test
    public void testDigestDependsOnContent() {
        JsonObject a = new JsonObject();
        a.addProperty("value", 1);
        JsonObject b = new JsonObject();
        b.addProperty("value", 2);
        Assert.assertNotEquals(Revisions.next(null, a),
                Revisions.next(null, b));
        Assert.assertEquals(Revisions.next(null, a), Revisions.next(null, a));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedRevision() {
        Revisions.generation("abc");
    }

}
