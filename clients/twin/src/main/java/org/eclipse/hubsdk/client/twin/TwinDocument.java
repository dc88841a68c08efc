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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * A locally cached copy of a device twin.
 * <p>
 * The desired and reported properties are JSON trees. Patches are merged into
 * the trees with {@code null} values acting as tombstones, i.e. a {@code null}
 * value removes the corresponding property (and its subtree) instead of being stored.
 * <p>
 * Instances are not thread safe.
 */
public final class TwinDocument {

    /**
     * The name of the field containing the desired properties.
     */
    public static final String FIELD_DESIRED = "desired";
    /**
     * The name of the field containing the reported properties.
     */
    public static final String FIELD_REPORTED = "reported";
    /**
     * The name of the field containing a property tree's version.
     */
    public static final String FIELD_VERSION = "$version";
    /**
     * The name of the field containing the twin's entity tag.
     */
    public static final String FIELD_ETAG = "etag";

    private static final String PATH_SEPARATOR = ".";

    private final JsonObject desired;
    private final JsonObject reported;
    private final String etag;

    private TwinDocument(final JsonObject desired, final JsonObject reported, final String etag) {
        this.desired = desired;
        this.reported = reported;
        this.etag = etag;
    }

    /**
     * Creates an empty twin.
     *
     * @return The twin.
     */
    public static TwinDocument empty() {
        return new TwinDocument(new JsonObject(), new JsonObject(), null);
    }

    /**
     * Creates a twin from the document returned by the hub.
     * <p>
     * Tombstones contained in the document are removed.
     *
     * @param json The document containing the <em>desired</em> and <em>reported</em> trees.
     * @return The twin.
     * @throws NullPointerException if json is {@code null}.
     * @throws ClassCastException if the desired or reported fields are not JSON objects.
     */
    public static TwinDocument fromJson(final JsonObject json) {
        Objects.requireNonNull(json);
        final TwinDocument doc = new TwinDocument(new JsonObject(), new JsonObject(), json.getString(FIELD_ETAG));
        merge(doc.desired, json.getJsonObject(FIELD_DESIRED, new JsonObject()));
        merge(doc.reported, json.getJsonObject(FIELD_REPORTED, new JsonObject()));
        return doc;
    }

    /**
     * Creates a deep copy of this twin.
     *
     * @return The copy.
     */
    public TwinDocument copy() {
        return new TwinDocument(desired.copy(), reported.copy(), etag);
    }

    /**
     * Gets a copy of the desired properties.
     *
     * @return The properties.
     */
    public JsonObject getDesiredProperties() {
        return desired.copy();
    }

    /**
     * Gets a copy of the reported properties.
     *
     * @return The properties.
     */
    public JsonObject getReportedProperties() {
        return reported.copy();
    }

    /**
     * Gets the version of the desired properties.
     *
     * @return The version or {@code null} if unknown.
     */
    public Long getVersion() {
        final Object version = desired.getValue(FIELD_VERSION);
        return version instanceof Number ? ((Number) version).longValue() : null;
    }

    /**
     * @return The twin's entity tag or {@code null} if unknown.
     */
    public String getEtag() {
        return etag;
    }

    /**
     * Merges a patch into the desired properties.
     *
     * @param patch The patch.
     * @throws NullPointerException if patch is {@code null}.
     */
    public void mergeDesiredProperties(final JsonObject patch) {
        merge(desired, Objects.requireNonNull(patch));
    }

    /**
     * Merges a patch into the reported properties.
     *
     * @param patch The patch.
     * @throws NullPointerException if patch is {@code null}.
     */
    public void mergeReportedProperties(final JsonObject patch) {
        merge(reported, Objects.requireNonNull(patch));
    }

    /**
     * Gets the value of a desired property.
     *
     * @param path The dot separated path of the property or the empty string
     *             for the whole tree.
     * @return A copy of the value or {@code null} if no such property exists.
     * @throws NullPointerException if path is {@code null}.
     */
    public Object getDesiredProperty(final String path) {
        return copyOf(valueAt(desired, path));
    }

    /**
     * Merges a patch into a JSON tree.
     * <p>
     * Properties of the patch that are JSON objects are merged recursively into the
     * corresponding objects of the target. A {@code null} value removes the corresponding
     * property from the target. Any other value replaces the target's value.
     *
     * @param target The tree to merge into.
     * @param patch The patch to merge.
     * @return The target.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    public static JsonObject merge(final JsonObject target, final JsonObject patch) {

        Objects.requireNonNull(target);
        Objects.requireNonNull(patch);

        for (final String key : patch.fieldNames()) {
            final Object value = patch.getValue(key);
            if (value == null) {
                target.remove(key);
            } else if (value instanceof JsonObject) {
                final Object existing = target.getValue(key);
                final JsonObject subtree = existing instanceof JsonObject ? (JsonObject) existing : new JsonObject();
                target.put(key, merge(subtree, (JsonObject) value));
            } else {
                target.put(key, copyOf(value));
            }
        }
        return target;
    }

    /**
     * Gets the paths of all properties contained in a patch.
     * <p>
     * Parents are listed before their children.
     *
     * @param patch The patch.
     * @return The dot separated paths.
     * @throws NullPointerException if patch is {@code null}.
     */
    public static List<String> paths(final JsonObject patch) {
        final List<String> result = new ArrayList<>();
        collectPaths(Objects.requireNonNull(patch), "", result);
        return result;
    }

    private static void collectPaths(final JsonObject node, final String prefix, final List<String> result) {
        for (final String key : node.fieldNames()) {
            final String path = prefix.isEmpty() ? key : prefix + PATH_SEPARATOR + key;
            result.add(path);
            final Object value = node.getValue(key);
            if (value instanceof JsonObject) {
                collectPaths((JsonObject) value, path, result);
            }
        }
    }

    /**
     * Gets the value at a path of a JSON tree.
     *
     * @param tree The tree.
     * @param path The dot separated path or the empty string for the tree itself.
     * @return The value (not a copy) or {@code null} if the tree contains no value at the path.
     * @throws NullPointerException if any of the parameters is {@code null}.
     */
    static Object valueAt(final JsonObject tree, final String path) {
        Objects.requireNonNull(tree);
        Objects.requireNonNull(path);
        if (path.isEmpty()) {
            return tree;
        }
        Object current = tree;
        for (final String segment : path.split("\\.", -1)) {
            if (!(current instanceof JsonObject)) {
                return null;
            }
            current = ((JsonObject) current).getValue(segment);
        }
        return current;
    }

    private static Object copyOf(final Object value) {
        if (value instanceof JsonObject) {
            return ((JsonObject) value).copy();
        } else if (value instanceof JsonArray) {
            return ((JsonArray) value).copy();
        }
        return value;
    }

    @Override
    public String toString() {
        return new JsonObject()
                .put(FIELD_DESIRED, desired)
                .put(FIELD_REPORTED, reported)
                .put(FIELD_ETAG, etag)
                .encode();
    }
}
