package me.golemcore.proxy.adapter.inbound.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.proxy.adapter.inbound.http.dto.ApiErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class RelayExceptionHandlerTest {

    private RelayExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new RelayExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "no MCP server at /mcp/a/b");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("no MCP server at /mcp/a/b", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleOversizedBody() {
        DataBufferLimitException ex = new DataBufferLimitException("Exceeded limit on max bytes to buffer");

        StepVerifier.create(handler.handleBodyTooLarge(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.PAYLOAD_TOO_LARGE, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(413, body.getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldAnswerDownstreamFailureWithJsonRpcError() {
        DownstreamUnavailableException ex = new DownstreamUnavailableException("/mcp/dev/search",
                TextNode.valueOf("req-1"), new SocketTimeoutException("timeout"));

        StepVerifier.create(handler.handleDownstreamUnavailable(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
                    ObjectNode body = response.getBody();
                    assertNotNull(body);
                    assertEquals("req-1", body.path("id").asText());
                    assertEquals(-32603, body.path("error").path("code").asInt());
                    assertEquals("/mcp/dev/search", body.path("error").path("data").path("endpoint").asText());
                    assertEquals("timeout", body.path("error").path("data").path("reason").asText());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandleGenericException() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("Unexpected failure")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(500, body.getStatus());
                    assertEquals("Internal server error", body.getMessage());
                })
                .verifyComplete();
    }
}
