package com.issueq.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.issueq.query.QueryParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonWriterTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode tree(String text) throws IOException {
        String json = new AstJsonWriter(false).write(new QueryParser().parse(text));
        return mapper.readTree(json);
    }

    @Test
    public void testQualifiedValue() throws IOException {
        JsonNode document = tree("-label:bug");

        assertEquals("QueryDocument", document.get("type").asText());
        assertEquals(0, document.get("start").asInt());
        assertEquals(10, document.get("end").asInt());

        JsonNode value = document.get("nodes").get(0).get("nodes").get(0);
        assertEquals("QualifiedValue", value.get("type").asText());
        assertTrue(value.get("not").asBoolean());
        assertEquals("label", value.get("qualifier").get("value").asText());
        assertEquals("bug", value.get("value").get("value").asText());
        assertEquals(7, value.get("value").get("start").asInt());
    }

    @Test
    public void testRangeOmitsAbsentBound() throws IOException {
        JsonNode range = tree("stars:10..*").get("nodes").get(0).get("nodes").get(0).get("value");

        assertEquals("Range", range.get("type").asText());
        assertEquals(10.0, range.get("open").get("value").asDouble());
        assertFalse(range.has("close"));
    }

    @Test
    public void testOrAndSortBy() throws IOException {
        JsonNode or = tree("a OR b sort-desc-by:updated").get("nodes").get(0);

        assertEquals("OrExpression", or.get("type").asText());
        assertEquals("a", or.get("left").get("nodes").get(0).get("value").asText());
        assertFalse(or.get("left").has("sortby"));
        JsonNode sortby = or.get("right").get("sortby");
        assertEquals("SORT_DESC_BY", sortby.get("keyword").asText());
        assertEquals("updated", sortby.get("criteria").get("value").asText());
    }

    @Test
    public void testDefinitionAndMissing() throws IOException {
        JsonNode definition = tree("${x}=").get("nodes").get(0);

        assertEquals("VariableDefinition", definition.get("type").asText());
        assertEquals("${x}", definition.get("name").get("value").asText());
        assertEquals("Missing", definition.get("value").get("type").asText());
        assertEquals("query expected", definition.get("value").get("message").asText());
    }

    @Test
    public void testAny() throws IOException {
        JsonNode any = tree("a OR").get("nodes").get(0).get("nodes").get(1);

        assertEquals("Any", any.get("type").asText());
        assertEquals("OR", any.get("tokenType").asText());
    }

    @Test
    public void testLongOrChain() throws IOException {
        String json = new AstJsonWriter(false).write(new QueryParser().parse("a OR ".repeat(5000) + "a"));

        JsonFactory factory = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
            .build();
        int orExpressions = 0;
        int queries = 0;
        try (JsonParser parser = factory.createParser(json)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                if (token == JsonToken.FIELD_NAME && "type".equals(parser.currentName())) {
                    String type = parser.nextTextValue();
                    if ("OrExpression".equals(type)) {
                        orExpressions++;
                    } else if ("Query".equals(type)) {
                        queries++;
                    }
                }
            }
        }
        assertEquals(5000, orExpressions);
        assertEquals(5001, queries);
    }

    @Test
    public void testCompactAndPretty() throws IOException {
        QueryParser parser = new QueryParser();
        String compact = new AstJsonWriter(false).write(parser.parse("is:open"));
        StringWriter pretty = new StringWriter();
        new AstJsonWriter(true).write(parser.parse("is:open"), pretty);

        assertFalse(compact.contains("\n"));
        assertTrue(pretty.toString().contains("\n"));
        assertEquals(mapper.readTree(compact), mapper.readTree(pretty.toString()));
    }
}
