package de.bsommerfeld.harvester.frameio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.core.domain.ItemKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseParserTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    void elements_shouldAcceptBareArray() throws Exception {
        assertEquals(2, ResponseParser.elements(json("[{},{}]")).size());
    }

    @Test
    void elements_shouldUnwrapKnownKeys() throws Exception {
        assertEquals(1, ResponseParser.elements(json("{\"data\":[{\"id\":\"1\"}]}")).size());
        assertEquals(3, ResponseParser.elements(json("{\"results\":[1,2,3]}")).size());
    }

    @Test
    void elements_shouldReturnEmptyForUnknownShape() throws Exception {
        assertTrue(ResponseParser.elements(json("{\"id\":\"1\"}")).isEmpty());
        assertTrue(ResponseParser.elements(null).isEmpty());
    }

    @Test
    void toItem_shouldReadCoreFields() throws Exception {
        Item item = ResponseParser.toItem(json("{\"id\":\"a1\",\"name\":\"Cut v2\",\"type\":\"file\",\"parent_id\":\"f1\"}"));

        assertEquals("a1", item.id());
        assertEquals("Cut v2", item.name());
        assertEquals(ItemKind.FILE, item.kind());
        assertEquals("f1", item.parentId());
    }

    @Test
    void toItem_shouldUnwrapReviewLinkAsset() throws Exception {
        Item item = ResponseParser.toItem(json(
                "{\"id\":\"rli\",\"asset\":{\"id\":\"a9\",\"name\":\"Spot\",\"_type\":\"version_stack\"}}"));

        assertEquals("a9", item.id());
        assertEquals(ItemKind.VERSION_STACK, item.kind());
    }

    @Test
    void toItem_shouldDefaultMissingNameAndType() throws Exception {
        Item item = ResponseParser.toItem(json("{\"id\":\"x\"}"));

        assertEquals("Unnamed", item.name());
        assertEquals(ItemKind.UNKNOWN, item.kind());
        assertNull(item.parentId());
    }

    @Test
    void text_shouldIgnoreBlankAndNestedValues() throws Exception {
        JsonNode node = json("{\"a\":\"  \",\"b\":{\"c\":1},\"d\":null,\"e\":\"ok\"}");

        assertNull(ResponseParser.text(node, "a"));
        assertNull(ResponseParser.text(node, "b"));
        assertNull(ResponseParser.text(node, "d"));
        assertEquals("ok", ResponseParser.text(node, "e"));
    }
}
