package me.golemcore.proxy.domain.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.proxy.domain.model.ChainResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpErrorFormatterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void rejectionUsesRejectedCode() throws Exception {
        Map<String, JsonNode> metadata = new LinkedHashMap<>();
        metadata.put("validator", objectMapper.readTree("{\"rule\":\"no-delete\"}"));
        ChainResult result = ChainResult.builder()
                .status(403)
                .error("delete is not allowed")
                .processorChain(List.of("logger", "validator"))
                .metadata(metadata)
                .build();

        ObjectNode envelope = McpErrorFormatter.format(result, IntNode.valueOf(5));

        assertEquals("2.0", envelope.path("jsonrpc").asText());
        assertEquals(5, envelope.path("id").asInt());
        JsonNode error = envelope.path("error");
        assertEquals(McpErrorFormatter.REJECTED_CODE, error.path("code").asInt());
        assertEquals("Request rejected by processor", error.path("message").asText());
        assertEquals("validator", error.path("data").path("processor_chain").get(1).asText());
        assertEquals("no-delete", error.path("data").path("metadata").path("validator").path("rule").asText());
        assertEquals("delete is not allowed", error.path("data").path("rejection_reason").asText());
    }

    @Test
    void serverErrorUsesProcessingFailedCode() {
        ChainResult result = ChainResult.builder()
                .status(500)
                .error("processor 'slow' timed out after 1 seconds")
                .build();

        ObjectNode envelope = McpErrorFormatter.format(result, TextNode.valueOf("abc"));

        assertEquals("abc", envelope.path("id").asText());
        assertEquals(McpErrorFormatter.PROCESSING_FAILED_CODE, envelope.path("error").path("code").asInt());
        assertEquals("Request processing failed", envelope.path("error").path("message").asText());
        assertTrue(envelope.path("error").path("data").path("processor_chain").isArray());
    }

    @Test
    void missingIdBecomesNull() {
        ChainResult result = ChainResult.builder().status(400).error("bad").build();

        ObjectNode envelope = McpErrorFormatter.format(result, null);

        assertTrue(envelope.has("id"));
        assertTrue(envelope.get("id").isNull());
    }

    @Test
    void rejectionReasonOmittedWithoutError() {
        ChainResult result = ChainResult.builder().status(451).build();

        ObjectNode envelope = McpErrorFormatter.format(result, IntNode.valueOf(1));

        assertFalse(envelope.path("error").path("data").has("rejection_reason"));
    }

    @Test
    void successfulResultIsNotAnError() {
        ChainResult result = ChainResult.builder().status(200).build();

        assertThrows(IllegalArgumentException.class, () -> McpErrorFormatter.format(result, IntNode.valueOf(1)));
    }
}
