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

import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * The definition of a single field in a {@link Model Model's} schema.
 * <p>
 * A {@link FieldDefinition} is either a {@link Link} or a {@link Scalar}, as
 * reported by {@link #kind()}. Only {@link Link} fields participate in link
 * maintenance; {@link Scalar} fields are carried so that they can be written
 * back untouched.
 * </p>
 */
@Immutable
public abstract class FieldDefinition {

    /**
     * The value of the {@code type} attribute that identifies a link field.
     */
    public static final String LINK_TYPE = "link";

    /**
     * The tag that distinguishes the variants of {@link FieldDefinition}.
     */
    public enum Kind {
        LINK, SCALAR
    }

    /**
     * Return a {@link Link} field that points to {@code fieldName} in the
     * model identified by {@code modelId}.
     * 
     * @param name the display name, if any
     * @param modelId
     * @param fieldName
     * @return the field definition
     */
    public static Link link(@Nullable String name, String modelId,
            String fieldName) {
        return new Link(name, modelId, fieldName);
    }

    /**
     * Return a {@link Scalar} field of the {@code type}.
     * 
     * @param type
     * @return the field definition
     */
    public static Scalar scalar(String type) {
        JsonObject json = new JsonObject();
        json.addProperty("type", type);
        return new Scalar(json);
    }

    /**
     * Parse a {@link FieldDefinition} from its JSON form.
     * <p>
     * A {@code link} field is parsed even if it does not name the other side
     * of the relationship; {@link Model#checkLinkFields()} reports that.
     * </p>
     * 
     * @param json
     * @return the field definition
     */
    public static FieldDefinition fromJson(JsonObject json) {
        String type = string(json, "type");
        if(LINK_TYPE.equals(type)) {
            return new Link(string(json, "name"), string(json, "modelId"),
                    string(json, "fieldName"));
        }
        else {
            return new Scalar(json.deepCopy());
        }
    }

    @Nullable
    private static String string(JsonObject json, String member) {
        JsonElement element = json.get(member);
        return element == null || element.isJsonNull() ? null
                : element.getAsString();
    }

    /**
     * Construct a new instance.
     */
    FieldDefinition() {}

    /**
     * Return the {@link Kind} of this field.
     * 
     * @return the kind
     */
    public abstract Kind kind();

    /**
     * Return the value of the {@code type} attribute.
     * 
     * @return the type
     */
    public abstract String type();

    /**
     * Return {@code true} if this is a {@link Link} field.
     * 
     * @return a boolean
     */
    public final boolean isLink() {
        return kind() == Kind.LINK;
    }

    /**
     * Return this field as a {@link Link}.
     * 
     * @return this field
     * @throws IllegalStateException if this is not a {@link Link} field
     */
    public final Link asLink() {
        Preconditions.checkState(isLink(), "%s is not a link field", this);
        return (Link) this;
    }

    /**
     * Return the JSON form of this field.
     * 
     * @return the JSON
     */
    public abstract JsonObject toJson();

    /**
     * A field whose value is a collection of ids of records in another model.
     */
    @Immutable
    public static final class Link extends FieldDefinition {

        @Nullable
        private final String name;

        @Nullable
        private final String modelId;

        @Nullable
        private final String fieldName;

        private Link(@Nullable String name, @Nullable String modelId,
                @Nullable String fieldName) {
            this.name = name;
            this.modelId = modelId;
            this.fieldName = fieldName;
        }

        @Override
        public Kind kind() {
            return Kind.LINK;
        }

        @Override
        public String type() {
            return LINK_TYPE;
        }

        /**
         * Return the display name, if any.
         * 
         * @return the name
         */
        @Nullable
        public String name() {
            return name;
        }

        /**
         * Return the id of the model on the other side of the link.
         * 
         * @return the remote model id
         */
        @Nullable
        public String remoteModelId() {
            return modelId;
        }

        /**
         * Return the name of the field on the other side of the link that
         * mirrors this one.
         * 
         * @return the remote field name
         */
        @Nullable
        public String remoteFieldName() {
            return fieldName;
        }

        /**
         * Return {@code true} if this link points at {@code fieldName} in the
         * model identified by {@code modelId}.
         * 
         * @param modelId
         * @param fieldName
         * @return a boolean
         */
        public boolean pointsTo(String modelId, String fieldName) {
            return Objects.equals(this.modelId, modelId)
                    && Objects.equals(this.fieldName, fieldName);
        }

        @Override
        public JsonObject toJson() {
            JsonObject json = new JsonObject();
            if(name != null) {
                json.addProperty("name", name);
            }
            json.addProperty("type", LINK_TYPE);
            json.addProperty("modelId", modelId);
            json.addProperty("fieldName", fieldName);
            return json;
        }

        @Override
        public boolean equals(Object obj) {
            if(obj instanceof Link) {
                Link other = (Link) obj;
                return Objects.equals(name, other.name)
                        && Objects.equals(modelId, other.modelId)
                        && Objects.equals(fieldName, other.fieldName);
            }
            else {
                return false;
            }
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, modelId, fieldName);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).omitNullValues()
                    .add("name", name).add("modelId", modelId)
                    .add("fieldName", fieldName).toString();
        }

    }

    /**
     * Any field that is not a {@link Link}. The original JSON is retained.
     */
    @Immutable
    public static final class Scalar extends FieldDefinition {

        private final JsonObject json;

        private Scalar(JsonObject json) {
            this.json = json;
        }

        @Override
        public Kind kind() {
            return Kind.SCALAR;
        }

        @Override
        public String type() {
            return string(json, "type");
        }

        @Override
        public JsonObject toJson() {
            return json.deepCopy();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Scalar && json.equals(((Scalar) obj).json);
        }

        @Override
        public int hashCode() {
            return json.hashCode();
        }

        @Override
        public String toString() {
            return json.toString();
        }

    }

}
