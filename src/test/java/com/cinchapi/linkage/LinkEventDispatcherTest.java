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

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.cinchapi.linkage.schema.FieldDefinition;
import com.cinchapi.linkage.schema.Model;
import com.cinchapi.linkage.schema.Record;
import com.cinchapi.linkage.store.Instance;
import com.cinchapi.linkage.store.Instances;
import com.cinchapi.linkage.store.LinkScope;
import com.google.common.collect.ImmutableMap;

/**
 * Unit tests for {@link LinkEventDispatcher}.
 */
public class LinkEventDispatcherTest {

    private RecordingDocumentStore store;
    private LinkEventDispatcher dispatcher;

    @Before
    public void setUp() {
        store = new RecordingDocumentStore();
        Model author = Model.of("m1", "Author");
        author.putField("books", FieldDefinition.link(null, "m2", "author"));
        Model book = Model.of("m2", "Book");
        Model note = Model.of("m3", "Note");
        note.putField("text", FieldDefinition.scalar("string"));
        store.putModel(author);
        store.putModel(book);
        store.putModel(note);
        dispatcher = new LinkEventDispatcher(
                Instances.of(ImmutableMap.of("app", Instance.of(store, store))));
    }

    @Test
    public void testModelsWithoutLinkFieldsAreSkipped() {
        Assert.assertFalse(dispatcher.dispatch(LinkEvent.RECORD_SAVED, "app",
                EventData.of("m3", Record.of("n1", "m3"))));
        Assert.assertFalse(dispatcher.dispatch(LinkEvent.MODEL_SAVED, "app",
                EventData.of("m3")));
        Assert.assertTrue(store.batches.isEmpty());
    }

    @Test
    public void testEventsAreRouted() {
        Assert.assertTrue(dispatcher.dispatch(LinkEvent.MODEL_SAVED, "app",
                EventData.of("m1")));
        Assert.assertTrue(store.getModel("m2").schema().containsKey("author"));

        Assert.assertTrue(dispatcher.dispatch(LinkEvent.RECORD_SAVED, "app",
                EventData.of("m1", Record.of("r1", "m1").link("books", "b1"))));
        Assert.assertEquals(1,
                store.getLinkDocuments(LinkScope.of("m2", "author", "b1"))
                        .size());

        Assert.assertTrue(dispatcher.dispatch(LinkEvent.RECORD_DELETED, "app",
                EventData.of("m1", Record.of("r1", "m1"))));
        Assert.assertTrue(store.getLinkDocuments(LinkScope.of("m1")).isEmpty());

        Model author = store.getModel("m1");
        Assert.assertTrue(dispatcher.dispatch(LinkEvent.MODEL_DELETED, "app",
                EventData.of(author)));
        Assert.assertFalse(store.getModel("m2").schema().containsKey("author"));
    }

    @Test(expected = NotFoundException.class)
    public void testUnknownInstance() {
        dispatcher.dispatch(LinkEvent.MODEL_SAVED, "elsewhere",
                EventData.of("m1"));
    }

}
