package de.bsommerfeld.harvester.frameio;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.core.domain.ItemKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Tolerant readers for the inconsistent response shapes of the review
 * service. Listings arrive either as bare arrays or wrapped in an object
 * under one of several keys.
 */
public final class ResponseParser {

    private static final List<String> LIST_KEYS = List.of("items", "data", "results", "children", "assets");

    private ResponseParser() {
    }

    /** Elements of a listing response, empty when the shape is unrecognised. */
    public static List<JsonNode> elements(JsonNode response) {
        List<JsonNode> out = new ArrayList<>();
        if (response == null) {
            return out;
        }
        if (response.isArray()) {
            response.forEach(out::add);
            return out;
        }
        for (String key : LIST_KEYS) {
            JsonNode candidate = response.get(key);
            if (candidate != null && candidate.isArray()) {
                candidate.forEach(out::add);
                return out;
            }
        }
        return out;
    }

    /**
     * Reads an item. Review link entries that wrap the actual asset in an
     * {@code asset} object are unwrapped first.
     */
    public static Item toItem(JsonNode node) {
        JsonNode source = node;
        JsonNode wrapped = node.get("asset");
        if (wrapped != null && wrapped.isObject() && wrapped.hasNonNull("id")) {
            source = wrapped;
        }
        String type = text(source, "type");
        if (type == null) {
            type = text(source, "_type");
        }
        return new Item(
                text(source, "id"),
                text(source, "name"),
                ItemKind.fromApiType(type),
                text(source, "parent_id"),
                source);
    }

    /** Reads an item and forces its kind, used where the endpoint implies the type. */
    public static Item toItem(JsonNode node, ItemKind kind) {
        Item item = toItem(node);
        return new Item(item.id(), item.name(), kind, item.parentId(), item.attributes());
    }

    /** Text value of a field, {@code null} when absent, null or blank. */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
