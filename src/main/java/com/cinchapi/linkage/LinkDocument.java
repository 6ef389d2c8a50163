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

import java.util.Objects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import com.cinchapi.linkage.store.LinkScope;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A {@link LinkDocument} records one association between two records.
 * <p>
 * The link is bidirectional: which record is {@link #side1()} and which is
 * {@link #side2()} only reflects the record whose save created it. The
 * {@link #id()} is derived from both sides in a fixed order, so the same
 * association always maps to the same document regardless of which side
 * initiated it.
 * </p>
 */
@Immutable
public final class LinkDocument {

    /**
     * The prefix of every link document id.
     */
    public static final String ID_PREFIX = "link";

    /**
     * Escapes the components of a link document id.
     */
    private static final Escaper ESCAPER = UrlEscapers
            .urlFormParameterEscaper();

    /**
     * Create a new link document that associates the record on the first side
     * with the record on the second side.
     * <p>
     * No validation is performed; the caller is responsible for pairing the
     * fields correctly.
     * </p>
     * 
     * @param modelId1 the model of the first record
     * @param fieldName1 the link field of the first model
     * @param recordId1 the first record
     * @param modelId2 the model of the second record
     * @param fieldName2 the link field of the second model
     * @param recordId2 the second record
     * @return the {@link LinkDocument}
     */
    public static LinkDocument of(String modelId1, String fieldName1,
            String recordId1, String modelId2, String fieldName2,
            String recordId2) {
        Side side1 = new Side(modelId1, fieldName1, recordId1);
        Side side2 = new Side(modelId2, fieldName2, recordId2);
        return new LinkDocument(idOf(side1, side2), null, side1, side2, false);
    }

    /**
     * Return the id of the link document that associates the two sides, in
     * either order.
     * 
     * @param a
     * @param b
     * @return the id
     */
    public static String idOf(Side a, Side b) {
        String ka = a.key();
        String kb = b.key();
        return ka.compareTo(kb) <= 0 ? ID_PREFIX + ":" + ka + ":" + kb
                : ID_PREFIX + ":" + kb + ":" + ka;
    }

    /**
     * Return {@code true} if the stored {@code json} has the shape of a link
     * document: an id (if any) with the link prefix and two complete sides.
     * 
     * @param json
     * @return a boolean
     */
    public static boolean isLinkDocument(JsonObject json) {
        JsonElement id = json.get("_id");
        if(id != null && !(isString(id)
                && id.getAsString().startsWith(ID_PREFIX + ":"))) {
            return false;
        }
        return isSide(json.get("side1")) && isSide(json.get("side2"));
    }

    private static boolean isSide(@Nullable JsonElement element) {
        if(element == null || !element.isJsonObject()) {
            return false;
        }
        JsonObject side = element.getAsJsonObject();
        return isString(side.get("modelId")) && isString(side.get("fieldName"))
                && isString(side.get("recordId"));
    }

    private static boolean isString(@Nullable JsonElement element) {
        return element != null && element.isJsonPrimitive()
                && element.getAsJsonPrimitive().isString();
    }

    /**
     * Parse a stored link document.
     * 
     * @param json
     * @return the {@link LinkDocument}
     */
    public static LinkDocument fromJson(JsonObject json) {
        Preconditions.checkArgument(isLinkDocument(json),
                "%s is not a link document", json);
        Side side1 = Side.fromJson(json.getAsJsonObject("side1"));
        Side side2 = Side.fromJson(json.getAsJsonObject("side2"));
        String id = string(json, "_id");
        JsonElement deleted = json.get("_deleted");
        return new LinkDocument(id != null ? id : idOf(side1, side2),
                string(json, "_rev"), side1, side2,
                deleted != null && !deleted.isJsonNull()
                        && deleted.getAsBoolean());
    }

    @Nullable
    private static String string(JsonObject json, String member) {
        JsonElement element = json.get(member);
        return element == null || element.isJsonNull() ? null
                : element.getAsString();
    }

    private final String id;

    @Nullable
    private final String rev;

    private final Side side1;
    private final Side side2;
    private final boolean deleted;

    private LinkDocument(String id, @Nullable String rev, Side side1,
            Side side2, boolean deleted) {
        this.id = id;
        this.rev = rev;
        this.side1 = side1;
        this.side2 = side2;
        this.deleted = deleted;
    }

    public String id() {
        return id;
    }

    /**
     * Return the revision this document was read at, or {@code null} if it
     * has not been stored.
     * 
     * @return the revision
     */
    @Nullable
    public String revision() {
        return rev;
    }

    public Side side1() {
        return side1;
    }

    public Side side2() {
        return side2;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * Return the side that is opposite to the side within {@code scope}, or
     * {@code null} if neither side is within it.
     * 
     * @param scope
     * @return the other side
     */
    @Nullable
    public Side opposite(LinkScope scope) {
        if(scope.matches(side1)) {
            return side2;
        }
        else if(scope.matches(side2)) {
            return side1;
        }
        else {
            return null;
        }
    }

    /**
     * Return {@code true} if either side refers to the record with
     * {@code recordId}.
     * 
     * @param recordId
     * @return a boolean
     */
    public boolean references(String recordId) {
        return side1.recordId().equals(recordId)
                || side2.recordId().equals(recordId);
    }

    /**
     * Return a copy of this document that is marked for deletion.
     * 
     * @return the tombstone
     */
    public LinkDocument tombstone() {
        return new LinkDocument(id, rev, side1, side2, true);
    }

    /**
     * Return the stored JSON form of this document.
     * 
     * @return the JSON
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("_id", id);
        if(rev != null) {
            json.addProperty("_rev", rev);
        }
        json.add("side1", side1.toJson());
        json.add("side2", side2.toJson());
        if(deleted) {
            json.addProperty("_deleted", true);
        }
        return json;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj instanceof LinkDocument) {
            LinkDocument other = (LinkDocument) obj;
            return id.equals(other.id) && Objects.equals(rev, other.rev)
                    && deleted == other.deleted;
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, rev, deleted);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("id", id)
                .add("rev", rev).add("side1", side1).add("side2", side2)
                .add("deleted", deleted ? true : null).toString();
    }

    /**
     * One end of a {@link LinkDocument}: a record, the model it belongs to and
     * the link field that holds the reference.
     */
    @Immutable
    public static final class Side {

        static Side fromJson(JsonObject json) {
            return new Side(string(json, "modelId"),
                    string(json, "fieldName"), string(json, "recordId"));
        }

        private final String modelId;
        private final String fieldName;
        private final String recordId;

        Side(String modelId, String fieldName, String recordId) {
            this.modelId = Preconditions.checkNotNull(modelId);
            this.fieldName = Preconditions.checkNotNull(fieldName);
            this.recordId = Preconditions.checkNotNull(recordId);
        }

        public String modelId() {
            return modelId;
        }

        public String fieldName() {
            return fieldName;
        }

        public String recordId() {
            return recordId;
        }

        /**
         * Return a string that uniquely identifies this side.
         * 
         * @return the key
         */
        String key() {
            return ESCAPER.escape(modelId) + "/" + ESCAPER.escape(fieldName)
                    + "/" + ESCAPER.escape(recordId);
        }

        JsonObject toJson() {
            JsonObject json = new JsonObject();
            json.addProperty("modelId", modelId);
            json.addProperty("fieldName", fieldName);
            json.addProperty("recordId", recordId);
            return json;
        }

        @Override
        public boolean equals(Object obj) {
            if(obj instanceof Side) {
                Side other = (Side) obj;
                return modelId.equals(other.modelId)
                        && fieldName.equals(other.fieldName)
                        && recordId.equals(other.recordId);
            }
            else {
                return false;
            }
        }

        @Override
        public int hashCode() {
            return Objects.hash(modelId, fieldName, recordId);
        }

        @Override
        public String toString() {
            return modelId + "." + fieldName + "#" + recordId;
        }

    }

}
