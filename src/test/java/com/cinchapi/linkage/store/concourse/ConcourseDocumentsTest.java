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

import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.cinchapi.linkage.LinkDocument;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;

/**
 * Unit tests for {@link ConcourseDocuments}.
 */
public class ConcourseDocumentsTest {

    @Test
    public void testLinkDocumentSidesAreIndexed() {
        JsonObject json = LinkDocument
                .of("m1", "books", "r1", "m2", "author", "b1").toJson();
        Map<String, Object> index = ConcourseDocuments.index(json);
        Assert.assertEquals(ImmutableMap.builder()
                .put("side1_modelId", "m1").put("side1_fieldName", "books")
                .put("side1_recordId", "r1").put("side2_modelId", "m2")
                .put("side2_fieldName", "author").put("side2_recordId", "b1")
                .build(), index);
    }

    @Test
    public void testOtherDocumentsAreNotIndexed() {
        JsonObject json = new JsonObject();
        json.addProperty("_id", "m1");
        json.addProperty("name", "Author");
        Assert.assertTrue(ConcourseDocuments.index(json).isEmpty());
    }

    @Test
    public void testDocumentsWithSideMembersAreNotIndexed() {
        JsonObject json = new JsonObject();
        json.addProperty("_id", "x1");
        json.add("side1", new JsonObject());
        json.add("side2", new JsonObject());
        Assert.assertTrue(ConcourseDocuments.index(json).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIncompleteSideIsRejected() {
        JsonObject json = LinkDocument
                .of("m1", "books", "r1", "m2", "author", "b1").toJson();
        json.getAsJsonObject("side2").remove("recordId");
        ConcourseDocuments.index(json);
    }

    @Test
    public void testSerializedFormCarriesRevision() {
        JsonObject json = LinkDocument
                .of("m1", "books", "r1", "m2", "author", "b1").toJson();
        json.addProperty("_deleted", false);
        JsonObject stored = ConcourseDocuments.deserialize(
                ConcourseDocuments.serialize(json, "2-abc"));
        Assert.assertEquals("2-abc", stored.get("_rev").getAsString());
        Assert.assertFalse(stored.has("_deleted"));
        Assert.assertEquals(LinkDocument.fromJson(json).id(),
                LinkDocument.fromJson(stored).id());
    }

}
