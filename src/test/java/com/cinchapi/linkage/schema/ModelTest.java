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
package com.cinchapi.linkage.schema;

import org.junit.Assert;
import org.junit.Test;

import com.cinchapi.linkage.MalformedSchemaException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

/**
 * Unit tests for {@link Model} and {@link FieldDefinition}.
 */
public class ModelTest {

    private static final String AUTHOR = "{\"_id\": \"m1\", \"_rev\": \"3-ab\", "
            + "\"name\": \"Author\", \"primaryDisplay\": \"name\", "
            + "\"schema\": {"
            + "\"name\": {\"type\": \"string\", \"constraints\": {\"presence\": true}}, "
            + "\"books\": {\"type\": \"link\", \"modelId\": \"m2\", \"fieldName\": \"author\"}}}";

    @Test
    public void testParseSchema() {
        Model model = Model.fromJson(parse(AUTHOR));
        Assert.assertEquals("m1", model.id());
        Assert.assertEquals("Author", model.name());
        Assert.assertEquals("3-ab", model.revision());
        Assert.assertEquals(FieldDefinition.Kind.SCALAR,
                model.schema().get("name").kind());
        FieldDefinition.Link books = model.schema().get("books").asLink();
        Assert.assertEquals("m2", books.remoteModelId());
        Assert.assertEquals("author", books.remoteFieldName());
        Assert.assertNull(books.name());
    }

    @Test
    public void testUnknownAttributesAreWrittenBack() {
        JsonObject json = parse(AUTHOR);
        Assert.assertEquals(json, Model.fromJson(json).toJson());
    }

    @Test
    public void testHasLinkFields() {
        Model model = Model.fromJson(parse(AUTHOR));
        Assert.assertTrue(model.hasLinkFields());
        model.removeField("books");
        Assert.assertFalse(model.hasLinkFields());
        Assert.assertTrue(model.linkFields().isEmpty());
    }

    @Test
    public void testLinkFieldsKeepSchemaOrder() {
        Model model = Model.of("m1", "Author");
        model.putField("b", FieldDefinition.link(null, "m2", "x"));
        model.putField("a", FieldDefinition.scalar("number"));
        model.putField("c", FieldDefinition.link(null, "m3", "y"));
        Assert.assertArrayEquals(new String[] { "b", "c" },
                model.linkFields().keySet().toArray());
    }

    @Test
    public void testPutFieldReportsChange() {
        Model model = Model.of("m1", "Author");
        Assert.assertTrue(
                model.putField("books", FieldDefinition.link(null, "m2", "a")));
        Assert.assertFalse(
                model.putField("books", FieldDefinition.link(null, "m2", "a")));
        Assert.assertTrue(
                model.putField("books", FieldDefinition.link("B", "m2", "a")));
    }

    @Test(expected = MalformedSchemaException.class)
    public void testLinkFieldWithoutModelIdIsMalformed() {
        Model model = Model.fromJson(parse("{\"_id\": \"m1\", \"schema\": "
                + "{\"books\": {\"type\": \"link\", \"fieldName\": \"author\"}}}"));
        model.checkLinkFields();
    }

    @Test(expected = IllegalStateException.class)
    public void testScalarIsNotALink() {
        FieldDefinition.scalar("string").asLink();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testModelRequiresId() {
        Model.fromJson(parse("{\"name\": \"Nameless\"}"));
    }

    private static JsonObject parse(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

}
