package me.golemcore.proxy.adapter.outbound.http;

import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import mockwebserver3.RecordedRequest;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DownstreamHttpClientTest {

    private static final int MAX_BODY = 1024;

    private MockWebServer mockServer;
    private DownstreamHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        client = new DownstreamHttpClient(new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.close();
    }

    @Test
    void postsBodyWithHeadersAndReadsResponse() throws Exception {
        mockServer.enqueue(new MockResponse.Builder()
                .code(200)
                .setHeader("Content-Type", "application/json")
                .setHeader("Mcp-Session-Id", "abc-123")
                .body("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}")
                .build());
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Authorization", "Bearer token");

        DownstreamResponse response = client.exchange("POST", mockServer.url("/mcp"), headers,
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}".getBytes(StandardCharsets.UTF_8), MAX_BODY);

        assertEquals(200, response.getStatus());
        assertTrue(response.getContentType().startsWith("application/json"));
        assertEquals("abc-123", response.getSessionId());
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}",
                new String(response.getBody(), StandardCharsets.UTF_8));

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("Bearer token", request.getHeaders().get("Authorization"));
        assertEquals("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}", request.getBody().utf8());
    }

    @Test
    void deleteWithoutBody() throws Exception {
        mockServer.enqueue(new MockResponse.Builder().code(204).build());

        DownstreamResponse response = client.exchange("DELETE", mockServer.url("/mcp"),
                Map.of("Mcp-Session-Id", "abc-123"), new byte[0], MAX_BODY);

        assertEquals(204, response.getStatus());
        assertEquals(0, response.getBody().length);
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("abc-123", request.getHeaders().get("Mcp-Session-Id"));
    }

    @Test
    void errorStatusIsReturnedNotThrown() throws Exception {
        mockServer.enqueue(new MockResponse.Builder().code(503).body("busy").build());

        DownstreamResponse response = client.exchange("POST", mockServer.url("/mcp"), Map.of(),
                "{}".getBytes(StandardCharsets.UTF_8), MAX_BODY);

        assertEquals(503, response.getStatus());
        assertEquals("busy", new String(response.getBody(), StandardCharsets.UTF_8));
    }

    @Test
    void oversizedResponseFails() {
        mockServer.enqueue(new MockResponse.Builder().code(200).body("x".repeat(MAX_BODY + 1)).build());

        IOException ex = assertThrows(IOException.class, () -> client.exchange("POST", mockServer.url("/mcp"),
                Map.of(), "{}".getBytes(StandardCharsets.UTF_8), MAX_BODY));
        assertTrue(ex.getMessage().contains("exceeds"));
    }
}
