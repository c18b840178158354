package de.bsommerfeld.harvester.core.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Read-only snapshot of a remote node (folder, review link or asset) as
 * fetched during a single harvest run.
 *
 * @param id         opaque, stable identifier
 * @param name       display name, never {@code null}
 * @param kind       classification derived from the API type
 * @param parentId   identifier of the enclosing folder, {@code null} for roots
 * @param attributes raw metadata bag; its shape varies between responses
 */
public record Item(
        String id,
        String name,
        ItemKind kind,
        String parentId,
        JsonNode attributes) {

    public Item {
        name = name != null ? name : "Unnamed";
        kind = kind != null ? kind : ItemKind.UNKNOWN;
        attributes = attributes != null ? attributes : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Convenience constructor for items without metadata.
     */
    public Item(String id, String name, ItemKind kind, String parentId) {
        this(id, name, kind, parentId, null);
    }
}
