package me.golemcore.proxy.adapter.inbound.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.proxy.adapter.outbound.http.DownstreamHttpClient;
import me.golemcore.proxy.domain.model.ProcessorConfig;
import me.golemcore.proxy.domain.model.ProcessorInput;
import me.golemcore.proxy.domain.model.ProcessorOutput;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.domain.processor.ProcessorChain;
import me.golemcore.proxy.domain.processor.ProcessorExecutor;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.ActivityLogPort;
import mockwebserver3.MockResponse;
import mockwebserver3.MockWebServer;
import mockwebserver3.RecordedRequest;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AggregatedGatewayServiceTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final String INITIALIZE = "{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"initialize\","
            + "\"params\":{\"protocolVersion\":\"2025-03-26\",\"capabilities\":{},"
            + "\"clientInfo\":{\"name\":\"client\",\"version\":\"1\"}}}";
    private static final String SEARCH_TOOLS = "[{\"name\":\"query\",\"description\":\"Search the web\","
            + "\"inputSchema\":{\"type\":\"object\"}}]";
    private static final String FILE_TOOLS = "[{\"name\":\"read\",\"description\":\"Read a file\"}]";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer search;
    private MockWebServer files;
    private ProcessorExecutor executor;
    private ActivityLogPort activityLog;
    private AggregatedGatewayService service;

    @BeforeEach
    void setUp() throws IOException {
        search = new MockWebServer();
        search.start();
        files = new MockWebServer();
        files.start();
        executor = mock(ProcessorExecutor.class);
        activityLog = mock(ActivityLogPort.class);
        ProxyProperties properties = new ProxyProperties();
        properties.getHttp().setMaxBodySize(65536);
        service = new AggregatedGatewayService(new DownstreamHttpClient(new OkHttpClient()), activityLog,
                objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        search.close();
        files.close();
    }

    private HttpRelayEndpoint server(String name, HttpUrl target, Map<String, String> headers,
            ProcessorConfig... processors) {
        ProcessorChain chain = new ProcessorChain(List.of(processors), executor, objectMapper, Clock.systemUTC(),
                name, Transport.HTTP, "http_endpoint_mcp_dev_" + name + "_1");
        return HttpRelayEndpoint.builder()
                .gateway("dev")
                .server(name)
                .path("/mcp/dev/" + name)
                .sessionId("http_endpoint_mcp_dev_" + name + "_1")
                .target(target)
                .headers(headers)
                .chain(chain)
                .build();
    }

    private AggregatedGateway gateway(HttpRelayEndpoint... endpoints) {
        Map<String, HttpRelayEndpoint> servers = new LinkedHashMap<>();
        for (HttpRelayEndpoint endpoint : endpoints) {
            servers.put(endpoint.getServer(), endpoint);
        }
        return AggregatedGateway.builder()
                .gateway("dev")
                .path("/mcp/dev")
                .sessionId("http_gateway_mcp_dev_1")
                .servers(servers)
                .build();
    }

    private AggregatedGateway gateway(ProcessorConfig... processors) {
        return gateway(server("search", search.url("/mcp"), Map.of(), processors),
                server("files", files.url("/mcp"), Map.of(), processors));
    }

    private static ProcessorConfig processor(String name) {
        return ProcessorConfig.builder().name(name).type("cli").config(Map.of("command", name)).build();
    }

    private static MockResponse json(String body) {
        return new MockResponse.Builder().setHeader(CONTENT_TYPE, "application/json").body(body).build();
    }

    /**
     * Queues the replies of one downstream handshake. The initialize reply
     * carries a session id; the tools are streamed as an event when
     * requested.
     */
    private static void enqueueHandshake(MockWebServer server, String sessionId, String tools, boolean stream) {
        server.enqueue(new MockResponse.Builder()
                .setHeader(CONTENT_TYPE, "application/json")
                .setHeader(SESSION_HEADER, sessionId)
                .body("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"protocolVersion\":\"2025-03-26\","
                        + "\"capabilities\":{\"tools\":{}}}}")
                .build());
        server.enqueue(new MockResponse.Builder().code(202).build());
        String listed = "{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"tools\":" + tools + "}}";
        server.enqueue(stream
                ? new MockResponse.Builder()
                        .setHeader(CONTENT_TYPE, "text/event-stream")
                        .body("event: message\ndata: " + listed + "\n\n")
                        .build()
                : json(listed));
    }

    private static HttpHeaders headers(String sessionId) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(CONTENT_TYPE, "application/json");
        if (sessionId != null) {
            headers.set(SESSION_HEADER, sessionId);
        }
        return headers;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private String open(AggregatedGateway gateway) throws Exception {
        enqueueHandshake(search, "search-session", SEARCH_TOOLS, true);
        enqueueHandshake(files, "files-session", FILE_TOOLS, false);
        ResponseEntity<byte[]> response = service.handle(gateway, headers(null), bytes(INITIALIZE));
        assertEquals(200, response.getStatusCode().value());
        String sessionId = response.getHeaders().getFirst(SESSION_HEADER);
        assertNotNull(sessionId);
        return sessionId;
    }

    private JsonNode post(AggregatedGateway gateway, String sessionId, String body) throws Exception {
        return objectMapper.readTree(service.handle(gateway, headers(sessionId), bytes(body)).getBody());
    }

    private static String call(int id, String tool) {
        return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"tools/call\",\"params\":{\"name\":\"" + tool
                + "\",\"arguments\":{\"path\":\"/etc/hosts\"}}}";
    }

    private static void skipHandshake(MockWebServer server) throws InterruptedException {
        for (int i = 0; i < 3; i++) {
            server.takeRequest(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void initializeOpensSessionOverEveryServer() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        enqueueHandshake(search, "search-session", SEARCH_TOOLS, true);
        enqueueHandshake(files, "files-session", FILE_TOOLS, false);

        ResponseEntity<byte[]> response = service.handle(gateway, headers(null), bytes(INITIALIZE));

        assertEquals(200, response.getStatusCode().value());
        assertNotNull(response.getHeaders().getFirst(SESSION_HEADER));
        JsonNode result = objectMapper.readTree(response.getBody()).path("result");
        assertEquals("2025-03-26", result.path("protocolVersion").asText());
        assertEquals("golemcore-gateway-dev", result.path("serverInfo").path("name").asText());
        assertTrue(result.path("capabilities").path("tools").path("listChanged").asBoolean());

        RecordedRequest initialize = search.takeRequest();
        assertEquals("initialize", objectMapper.readTree(initialize.getBody().utf8()).path("method").asText());
        RecordedRequest initialized = search.takeRequest();
        assertEquals("notifications/initialized",
                objectMapper.readTree(initialized.getBody().utf8()).path("method").asText());
        assertEquals("search-session", initialized.getHeaders().get(SESSION_HEADER));
        assertEquals("2025-03-26", initialized.getHeaders().get("Mcp-Protocol-Version"));
        assertEquals(3, files.getRequestCount());
        assertEquals(1, service.getSessionCount());
    }

    @Test
    void toolsAreListedUnderServerNamespace() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        String sessionId = open(gateway);

        JsonNode tools = post(gateway, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}")
                .path("result").path("tools");

        assertEquals(2, tools.size());
        assertEquals("search___query", tools.get(0).path("name").asText());
        assertEquals("[search] Search the web", tools.get(0).path("description").asText());
        assertEquals("object", tools.get(0).path("inputSchema").path("type").asText());
        assertEquals("files___read", tools.get(1).path("name").asText());
        assertEquals("[files] Read a file", tools.get(1).path("description").asText());
    }

    @Test
    void toolCallIsRoutedByNamespaceWithOriginalName() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        String sessionId = open(gateway);
        skipHandshake(files);
        files.enqueue(json("{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":{\"content\":[{\"type\":\"text\","
                + "\"text\":\"127.0.0.1 localhost\"}]}}"));

        JsonNode reply = post(gateway, sessionId, call(21, "files___read"));

        assertEquals(21, reply.path("id").asInt());
        assertEquals("127.0.0.1 localhost", reply.path("result").path("content").get(0).path("text").asText());
        RecordedRequest forwarded = files.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(forwarded);
        JsonNode request = objectMapper.readTree(forwarded.getBody().utf8());
        assertEquals("read", request.path("params").path("name").asText());
        assertEquals("/etc/hosts", request.path("params").path("arguments").path("path").asText());
        assertEquals("files-session", forwarded.getHeaders().get(SESSION_HEADER));
        assertEquals(3, search.getRequestCount());
    }

    @Test
    void clientCredentialsOverrideConfiguredHeaders() throws Exception {
        AggregatedGateway gateway = gateway(server("search", search.url("/mcp"),
                Map.of("Authorization", "Bearer configured", "X-Static", "1")));
        enqueueHandshake(search, "search-session", SEARCH_TOOLS, false);
        HttpHeaders inbound = headers(null);
        inbound.set("Authorization", "Bearer client");
        inbound.set("X-Not-Forwarded", "1");

        service.handle(gateway, inbound, bytes(INITIALIZE));

        RecordedRequest initialize = search.takeRequest();
        assertEquals("Bearer client", initialize.getHeaders().get("Authorization"));
        assertEquals("1", initialize.getHeaders().get("X-Static"));
        assertNull(initialize.getHeaders().get("X-Not-Forwarded"));
    }

    @Test
    void rejectedToolCallNeverReachesServer() throws Exception {
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            ProcessorInput input = invocation.getArgument(1);
            return "read".equals(input.getPayload().path("params").path("name").asText())
                    ? ProcessorOutput.builder().status(403).payload(input.getPayload()).error("reads are off").build()
                    : ProcessorOutput.builder().status(200).payload(input.getPayload()).build();
        });
        AggregatedGateway gateway = gateway(processor("policy"));
        String sessionId = open(gateway);

        JsonNode reply = post(gateway, sessionId, call(5, "files___read"));

        assertEquals(5, reply.path("id").asInt());
        assertEquals(-32001, reply.path("error").path("code").asInt());
        assertEquals("reads are off", reply.path("error").path("data").path("rejection_reason").asText());
        assertEquals(3, files.getRequestCount());
    }

    @Test
    void rejectedReplyIsReplacedByError() throws Exception {
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            ProcessorInput input = invocation.getArgument(1);
            return input.getPayload().has("result")
                    ? ProcessorOutput.builder().status(451).payload(input.getPayload()).error("redacted").build()
                    : ProcessorOutput.builder().status(200).payload(input.getPayload()).build();
        });
        AggregatedGateway gateway = gateway(processor("dlp"));
        String sessionId = open(gateway);
        files.enqueue(json("{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":{\"content\":[{\"type\":\"text\","
                + "\"text\":\"secret\"}]}}"));

        JsonNode reply = post(gateway, sessionId, call(6, "files___read"));

        assertEquals(6, reply.path("id").asInt());
        assertEquals("redacted", reply.path("error").path("data").path("rejection_reason").asText());
        assertFalse(reply.toString().contains("secret"));
    }

    @Test
    void unknownToolsAreInvalidParams() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        String sessionId = open(gateway);

        for (String tool : List.of("read", "mail___send", "files___write", "___read")) {
            JsonNode reply = post(gateway, sessionId, call(8, tool));
            assertEquals(-32602, reply.path("error").path("code").asInt(), tool);
        }
        assertEquals(3, files.getRequestCount());
    }

    @Test
    void unreachableServerIsLeftOut() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        AggregatedGateway gateway = gateway(server("search", search.url("/mcp"), Map.of()),
                server("files", HttpUrl.get("http://127.0.0.1:" + closedPort + "/mcp"), Map.of()));
        enqueueHandshake(search, "search-session", SEARCH_TOOLS, false);

        ResponseEntity<byte[]> response = service.handle(gateway, headers(null), bytes(INITIALIZE));
        String sessionId = response.getHeaders().getFirst(SESSION_HEADER);

        JsonNode tools = post(gateway, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}")
                .path("result").path("tools");
        assertEquals(1, tools.size());
        assertEquals("search___query", tools.get(0).path("name").asText());
    }

    @Test
    void noReachableServerFailsInitialize() throws Exception {
        search.enqueue(new MockResponse.Builder().code(500).build());
        files.enqueue(json("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32600,\"message\":\"bad version\"}}"));

        ResponseEntity<byte[]> response = service.handle(gateway(new ProcessorConfig[0]), headers(null), bytes(INITIALIZE));

        assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
        assertNull(response.getHeaders().getFirst(SESSION_HEADER));
        JsonNode error = objectMapper.readTree(response.getBody()).path("error");
        assertEquals(-32603, error.path("code").asInt());
        assertEquals(2, error.path("data").path("failures").size());
        assertTrue(error.path("data").path("failures").get(1).asText().contains("bad version"));
        assertEquals(0, service.getSessionCount());
    }

    @Test
    void requestsOutsideSessionAreRefused() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        String ping = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}";

        assertEquals(400, service.handle(gateway, headers(null), bytes(ping)).getStatusCode().value());
        assertEquals(404, service.handle(gateway, headers("stale"), bytes(ping)).getStatusCode().value());
        assertEquals(400, service.handle(gateway, headers(null), bytes("not json")).getStatusCode().value());
    }

    @Test
    void localMethodsAndNotifications() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        String sessionId = open(gateway);

        assertTrue(post(gateway, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}")
                .path("result").isObject());
        assertEquals(-32601, post(gateway, sessionId, "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"resources/list\"}")
                .path("error").path("code").asInt());
        ResponseEntity<byte[]> notification = service.handle(gateway, headers(sessionId),
                bytes("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"));
        assertEquals(202, notification.getStatusCode().value());
    }

    @Test
    void batchGetsOneReplyPerRequest() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        String sessionId = open(gateway);

        JsonNode replies = post(gateway, sessionId, "[{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"},"
                + "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/cancelled\"},"
                + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}]");

        assertEquals(2, replies.size());
        assertEquals(1, replies.get(0).path("id").asInt());
        assertEquals(2, replies.get(1).path("result").path("tools").size());
    }

    @Test
    void deleteClosesDownstreamSessions() throws Exception {
        AggregatedGateway gateway = gateway(new ProcessorConfig[0]);
        String sessionId = open(gateway);
        skipHandshake(search);
        search.enqueue(new MockResponse.Builder().code(204).build());
        files.enqueue(new MockResponse.Builder().code(204).build());

        ResponseEntity<byte[]> response = service.delete(gateway, headers(sessionId));

        assertEquals(204, response.getStatusCode().value());
        RecordedRequest closed = search.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(closed);
        assertEquals("DELETE", closed.getMethod());
        assertEquals("search-session", closed.getHeaders().get(SESSION_HEADER));
        assertEquals(0, service.getSessionCount());
        assertEquals(404, service.delete(gateway, headers(sessionId)).getStatusCode().value());
    }
}
