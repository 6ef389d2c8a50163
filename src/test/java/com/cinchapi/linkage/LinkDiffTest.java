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
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.Assert;
import org.junit.Test;

import com.cinchapi.linkage.schema.FieldDefinition;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonObject;

/**
 * Unit tests for {@link LinkDiff}.
 */
public class LinkDiffTest {

    private static final FieldDefinition.Link BOOKS = FieldDefinition
            .link(null, "m2", "author");

    @Test
    public void testOnlyChangedReferencesAreWritten() {
        LinkDiff diff = LinkDiff.of("m1", "books", "r1", BOOKS,
                current("A", "B", "C"), ImmutableSet.of("B", "C", "D"));
        Assert.assertEquals(ImmutableSet.of("A"), others(diff.deletes()));
        Assert.assertEquals(ImmutableSet.of("D"), others(diff.creates()));
    }

    @Test
    public void testOrderDoesNotMatter() {
        LinkDiff diff = LinkDiff.of("m1", "books", "r1", BOOKS,
                current("C", "A", "B"), ImmutableSet.of("B", "A", "C"));
        Assert.assertTrue(diff.isEmpty());
    }

    @Test
    public void testEmptyDesiredDeletesEverything() {
        LinkDiff diff = LinkDiff.of("m1", "books", "r1", BOOKS,
                current("A", "B"), ImmutableSet.of());
        Assert.assertEquals(2, diff.deletes().size());
        Assert.assertTrue(diff.creates().isEmpty());
    }

    @Test
    public void testCreatedLinksPointAtTheRemoteField() {
        LinkDiff diff = LinkDiff.of("m1", "books", "r1", BOOKS,
                ImmutableList.of(), ImmutableSet.of("b1"));
        LinkDocument created = diff.creates().get(0);
        Assert.assertEquals("m1", created.side1().modelId());
        Assert.assertEquals("books", created.side1().fieldName());
        Assert.assertEquals("r1", created.side1().recordId());
        Assert.assertEquals("m2", created.side2().modelId());
        Assert.assertEquals("author", created.side2().fieldName());
        Assert.assertEquals("b1", created.side2().recordId());
    }

    @Test
    public void testLinksCreatedFromTheOtherSideAreRecognized() {
        LinkDocument reverse = stored(
                LinkDocument.of("m2", "author", "b1", "m1", "books", "r1"));
        LinkDiff diff = LinkDiff.of("m1", "books", "r1", BOOKS,
                ImmutableList.of(reverse), ImmutableSet.of("b1"));
        Assert.assertTrue(diff.isEmpty());
    }

    @Test
    public void testDuplicateLinksAreCollapsed() {
        LinkDocument first = stored(
                LinkDocument.of("m1", "books", "r1", "m2", "author", "A"));
        JsonObject json = first.toJson();
        json.addProperty("_id", "link:duplicate");
        LinkDocument second = LinkDocument.fromJson(json);
        LinkDiff diff = LinkDiff.of("m1", "books", "r1", BOOKS,
                ImmutableList.of(first, second), ImmutableSet.of("A"));
        Assert.assertTrue(diff.creates().isEmpty());
        Assert.assertEquals(ImmutableList.of(second), diff.deletes());
    }

    private static List<LinkDocument> current(String... bookIds) {
        ImmutableList.Builder<LinkDocument> documents = ImmutableList
                .builder();
        for (String bookId : bookIds) {
            documents.add(stored(LinkDocument.of("m1", "books", "r1", "m2",
                    "author", bookId)));
        }
        return documents.build();
    }

    private static LinkDocument stored(LinkDocument document) {
        JsonObject json = document.toJson();
        json.addProperty("_rev", "1-test");
        return LinkDocument.fromJson(json);
    }

    private static Set<String> others(List<LinkDocument> documents) {
        return documents.stream().map(document -> document.side2().recordId())
                .collect(Collectors.toSet());
    }

}
