import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.scanprev.script.ScanScript;
import com.scanprev.script.json.TreeJson;

import static org.junit.jupiter.api.Assertions.*;

public class TreeJsonTest {

    @Test
    void dumpTree_showsRewrittenBuilder() {
        JsonNode tree = new ScanScript().dumpTree(String.join("\n",
                "@scan(prev)",
                "function sums(xs) { return [prev + x for x in xs]; }"));

        JsonNode fn = tree.get(0);
        assertEquals("function", fn.get("node").asText());
        assertEquals("sums", fn.get("name").asText());
        assertEquals(0, fn.get("decorators").size());

        JsonNode value = fn.get("body").get(0).get("value");
        assertEquals("scan", value.get("node").asText());
        assertEquals("prev", value.get("placeholder").asText());
        assertEquals("LIST", value.get("builder").get("kind").asText());
        assertEquals("x", value.get("builder").get("clauses").get(0).get("name").asText());
    }

    @Test
    void parseTree_keepsDecoratorsAndPlainBuilders() {
        JsonNode tree = TreeJson.program(new ScanScript().parse(String.join("\n",
                "@scan(prev)",
                "function sums(xs) { return {x for x in xs if x > 0}; }")));

        JsonNode fn = tree.get(0);
        assertEquals("@scan(prev)", fn.get("decorators").get(0).asText());

        JsonNode value = fn.get("body").get(0).get("value");
        assertEquals("builder", value.get("node").asText());
        assertEquals("SET", value.get("kind").asText());
        assertEquals(1, value.get("clauses").get(0).get("filters").size());
    }

    @Test
    void equalSources_renderEqually_regardlessOfLayout() {
        ScanScript es = new ScanScript();
        JsonNode a = es.dumpTree("let a = [x * 2 for x in [1, 2]];");
        JsonNode b = es.dumpTree("let a =\n  [x * 2\n   for x in [1, 2]];");
        assertEquals(a, b);
    }

    @Test
    void pretty_rendersText() {
        String text = TreeJson.pretty(new ScanScript().dumpTree("let a = -1;"));
        assertTrue(text.contains("\"node\" : \"unary\""), text);
    }
}
