package com.sandkev.canvasio.resource;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-kind field mapping consulted by the generic node logic.
 *
 * @param name        display name, used in logs
 * @param pathSegment url segment of the collection ({@code assignments}, {@code pages}, ...)
 * @param idField     field holding the identifier used in item urls
 * @param titleField  field holding the display title
 * @param htmlField   field holding the main html body, if the kind has one
 * @param urlField    field holding the browser url, if the kind has one
 * @param payloadKey  key that wraps fields in create/update bodies, or {@code null} for bare fields
 * @param children    child collections, by collection name
 */
public record ResourceKind(String name,
                           String pathSegment,
                           String idField,
                           String titleField,
                           @Nullable String htmlField,
                           @Nullable String urlField,
                           @Nullable String payloadKey,
                           Map<String, ResourceKind> children) {

    public ResourceKind {
        if (pathSegment == null || pathSegment.isBlank()) throw new IllegalArgumentException("pathSegment is required");
        if (idField == null || idField.isBlank()) throw new IllegalArgumentException("idField is required");
        children = children == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /** Wraps a field set the way this kind's write endpoints expect it. */
    public Object wrapPayload(Map<String, Object> fields) {
        return payloadKey == null ? fields : Map.of(payloadKey, fields);
    }

    @Override
    public String toString() {
        return name;
    }
}
