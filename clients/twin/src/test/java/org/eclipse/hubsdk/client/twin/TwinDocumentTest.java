/*******************************************************************************
 * Copyright (c) 2024 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/

package org.eclipse.hubsdk.client.twin;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Tests verifying behavior of {@link TwinDocument}.
 *
 */
public class TwinDocumentTest {

    /**
     * Verifies that null values in a patch remove the corresponding properties
     * while other values are merged recursively.
     */
    @Test
    public void testMergeRemovesTombstonedProperties() {

        final JsonObject target = new JsonObject("{\"a\":{\"b\":0,\"c\":2,\"d\":3}}");
        final JsonObject patch = new JsonObject("{\"a\":{\"b\":1,\"c\":null}}");

        TwinDocument.merge(target, patch);

        assertThat(target).isEqualTo(new JsonObject("{\"a\":{\"b\":1,\"d\":3}}"));
    }

    /**
     * Verifies that a tombstone removes a whole subtree and that merging a tombstone
     * for a property that does not exist has no effect.
     */
    @Test
    public void testMergeRemovesSubtree() {

        final JsonObject target = new JsonObject("{\"a\":{\"b\":{\"c\":1}},\"x\":true}");

        TwinDocument.merge(target, new JsonObject("{\"a\":null,\"unknown\":null}"));

        assertThat(target).isEqualTo(new JsonObject("{\"x\":true}"));
    }

    /**
     * Verifies that an object replaces a scalar value and does not retain tombstones.
     */
    @Test
    public void testMergeObjectReplacesScalar() {

        final JsonObject target = new JsonObject().put("a", 5);

        TwinDocument.merge(target, new JsonObject("{\"a\":{\"b\":1,\"c\":null}}"));

        assertThat(target).isEqualTo(new JsonObject("{\"a\":{\"b\":1}}"));
    }

    /**
     * Verifies that arrays are replaced as a whole and are not shared with the patch.
     */
    @Test
    public void testMergeReplacesArrays() {

        final JsonObject target = new JsonObject().put("list", new JsonArray().add(1).add(2));
        final JsonObject patch = new JsonObject().put("list", new JsonArray().add(3));

        TwinDocument.merge(target, patch);
        patch.getJsonArray("list").add(4);

        assertThat(target.getJsonArray("list")).containsExactly(3);
    }

    /**
     * Verifies that the paths of a patch are listed with parents before children.
     */
    @Test
    public void testPathsListsParentsFirst() {

        final JsonObject patch = new JsonObject("{\"a\":{\"b\":1,\"c\":null},\"e\":{\"f\":{\"g\":\"x\"}}}");

        assertThat(TwinDocument.paths(patch)).containsExactly("a", "a.b", "a.c", "e", "e.f", "e.f.g");
    }

    /**
     * Verifies that a twin is created from the document returned by the hub.
     */
    @Test
    public void testFromJson() {

        final JsonObject json = new JsonObject("{\"desired\":{\"temp\":21,\"$version\":7,\"gone\":null},"
                + "\"reported\":{\"fw\":\"1.0\"}}");

        final TwinDocument doc = TwinDocument.fromJson(json);

        assertThat(doc.getVersion()).isEqualTo(7L);
        assertThat(doc.getDesiredProperties()).isEqualTo(new JsonObject("{\"temp\":21,\"$version\":7}"));
        assertThat(doc.getReportedProperties()).isEqualTo(new JsonObject("{\"fw\":\"1.0\"}"));
        assertThat(doc.getDesiredProperty("temp")).isEqualTo(21);
        assertThat(doc.getDesiredProperty("temp.unknown")).isNull();
        assertThat(doc.getDesiredProperty("missing")).isNull();
    }

    /**
     * Verifies that the property trees returned by a twin are copies.
     */
    @Test
    public void testGettersReturnCopies() {

        final TwinDocument doc = TwinDocument.empty();
        doc.mergeDesiredProperties(new JsonObject("{\"a\":{\"b\":1}}"));

        doc.getDesiredProperties().put("x", 1);
        ((JsonObject) doc.getDesiredProperty("a")).put("c", 2);

        assertThat(doc.getDesiredProperties()).isEqualTo(new JsonObject("{\"a\":{\"b\":1}}"));
    }
}
