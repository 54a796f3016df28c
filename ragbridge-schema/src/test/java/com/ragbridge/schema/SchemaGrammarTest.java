package com.ragbridge.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaGrammarTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static List<String> check(String json) throws Exception {
        return SchemaGrammar.check(MAPPER.readTree(json));
    }

    @Test
    void acceptsRecognizedKeywords() throws Exception {
        List<String> errors = check("""
                {"$schema":"http://json-schema.org/draft-07/schema#","type":"object","title":"Retrieval",
                 "properties":{
                   "top_k":{"type":"integer","minimum":1,"maximum":100,"default":5,"title":"Top K"},
                   "mode":{"type":"string","enum":["naive","hybrid"],"default":"naive","description":"Query mode"},
                   "advanced":{"type":"object","properties":{"boost":{"type":"number","default":1.5}}}
                 },
                 "required":["top_k"]}
                """);

        assertTrue(errors.isEmpty(), errors.toString());
    }

    @Test
    void rejectsUnknownKeyword() throws Exception {
        List<String> errors = check("""
                {"type":"object","properties":{"q":{"type":"string","pattern":"^a"}}}
                """);

        assertFalse(errors.isEmpty());
        assertTrue(String.join(" ", errors).contains("pattern"), errors.toString());
    }

    @Test
    void rejectsDocumentThatIsNotDraft7() throws Exception {
        assertFalse(check("{\"type\":\"object\",\"properties\":{\"k\":{\"type\":\"integer\",\"minimum\":\"one\"}}}").isEmpty());
        assertFalse(check("{\"type\":\"object\",\"required\":\"top_k\"}").isEmpty());
    }

    @Test
    void rejectsNonObjectRoot() throws Exception {
        assertFalse(check("{\"type\":\"string\"}").isEmpty());
        assertFalse(check("[1,2]").isEmpty());
    }

    @Test
    void rejectsBoundsOnNonNumericProperty() throws Exception {
        assertFalse(check("{\"type\":\"object\",\"properties\":{\"q\":{\"type\":\"string\",\"minimum\":1}}}").isEmpty());
    }

    @Test
    void rejectsEnumValueOfWrongType() throws Exception {
        assertFalse(check("{\"type\":\"object\",\"properties\":{\"k\":{\"type\":\"integer\",\"enum\":[1,\"two\"]}}}").isEmpty());
    }

    @Test
    void rejectsDefaultNotInEnum() throws Exception {
        assertFalse(check("{\"type\":\"object\",\"properties\":{\"m\":{\"type\":\"string\",\"enum\":[\"a\"],\"default\":\"b\"}}}").isEmpty());
    }

    @Test
    void rejectsMinimumAboveMaximum() throws Exception {
        List<String> errors = check("{\"type\":\"object\",\"properties\":{\"k\":{\"type\":\"integer\",\"minimum\":9,\"maximum\":1}}}");

        assertTrue(String.join(" ", errors).contains("greater than"), errors.toString());
    }

    @Test
    void rejectsMissingOrUnsupportedType() throws Exception {
        assertFalse(check("{\"type\":\"object\",\"properties\":{\"m\":{\"title\":\"no type\"}}}").isEmpty());
        assertFalse(check("{\"type\":\"object\",\"properties\":{\"m\":{\"type\":\"array\"}}}").isEmpty());
    }
}
