package me.golemcore.proxy.adapter.outbound.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client session with one downstream MCP server over streamable
 * HTTP.
 *
 * <p>
 * {@link #connect(String)} performs the handshake ({@code initialize}, then
 * {@code notifications/initialized}) and caches the server's tools from
 * {@code tools/list}. Replies are read from plain JSON bodies or from the
 * {@code data:} lines of an event stream; the message whose id matches the
 * request is the answer, anything else in the stream is skipped.
 *
 * <p>
 * Not a Spring bean. Created per gateway session and server.
 */
@Slf4j
public class McpHttpSession {

    private static final String JSONRPC_VERSION = "2.0";
    private static final String PROTOCOL_VERSION_HEADER = "Mcp-Protocol-Version";
    private static final String SSE_DATA_PREFIX = "data:";

    @Getter
    private final String serverName;
    private final HttpUrl target;
    private final Map<String, String> headers;
    private final DownstreamHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final int maxBodySize;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private volatile String sessionId;
    @Getter
    private volatile ArrayNode tools;

    public McpHttpSession(String serverName, HttpUrl target, Map<String, String> headers,
            DownstreamHttpClient httpClient, ObjectMapper objectMapper, int maxBodySize) {
        this.serverName = serverName;
        this.target = target;
        this.headers = new ConcurrentHashMap<>(headers);
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.maxBodySize = maxBodySize;
        this.headers.putIfAbsent("Accept", "application/json, text/event-stream");
        this.headers.put("Content-Type", "application/json");
    }

    /**
     * Initializes the downstream session and fetches its tools.
     *
     * @throws IOException
     *             if the server is unreachable or answers either request with
     *             an error
     */
    public void connect(String protocolVersion) throws IOException {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", protocolVersion);
        params.putObject("capabilities");
        params.putObject("clientInfo").put("name", "golemcore-proxy").put("version", "1.0.0");

        JsonNode initResult = call("initialize", params);
        String negotiated = initResult.path("protocolVersion").asText(protocolVersion);
        headers.put(PROTOCOL_VERSION_HEADER, negotiated);
        log.debug("[Gateway:{}] Initialized (protocol {})", serverName, negotiated);

        ObjectNode initialized = objectMapper.createObjectNode();
        initialized.put("jsonrpc", JSONRPC_VERSION);
        initialized.put("method", "notifications/initialized");
        send(initialized);

        JsonNode listed = call("tools/list", objectMapper.createObjectNode()).path("tools");
        tools = listed.isArray() ? (ArrayNode) listed : objectMapper.createArrayNode();
        log.info("[Gateway:{}] Connected, {} tool(s)", serverName, tools.size());
    }

    public boolean hasTool(String name) {
        ArrayNode current = tools;
        if (current == null) {
            return false;
        }
        for (JsonNode tool : current) {
            if (name.equals(tool.path("name").asText(null))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sends a request under a fresh downstream id and returns the full reply
     * message, error replies included.
     */
    public ObjectNode forward(ObjectNode request) throws IOException {
        ObjectNode outbound = request.deepCopy();
        int id = nextId.getAndIncrement();
        outbound.put("id", id);
        return exchange(outbound, id);
    }

    /**
     * Ends the downstream session. Failures are logged and otherwise ignored.
     */
    public void close() {
        if (sessionId == null) {
            return;
        }
        try {
            httpClient.exchange("DELETE", target, headers, null, maxBodySize);
        } catch (IOException e) {
            log.debug("[Gateway:{}] Error closing downstream session: {}", serverName, e.getMessage());
        }
    }

    private JsonNode call(String method, ObjectNode params) throws IOException {
        int id = nextId.getAndIncrement();
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.set("params", params);

        ObjectNode reply = exchange(request, id);
        JsonNode error = reply.get("error");
        if (error != null && !error.isNull()) {
            throw new IOException(String.format("%s failed: %s (code %d)", method,
                    error.path("message").asText("unknown error"), error.path("code").asInt(-1)));
        }
        return reply.path("result");
    }

    private ObjectNode exchange(ObjectNode request, int id) throws IOException {
        DownstreamResponse response = send(request);
        if (response.getStatus() >= 400) {
            throw new IOException("HTTP " + response.getStatus() + " from " + target);
        }
        String body = new String(response.getBody(), StandardCharsets.UTF_8);
        String contentType = response.getContentType();
        if (contentType != null && contentType.startsWith("text/event-stream")) {
            for (String line : body.split("\n")) {
                if (line.startsWith(SSE_DATA_PREFIX)) {
                    ObjectNode reply = matchReply(line.substring(SSE_DATA_PREFIX.length()).trim(), id);
                    if (reply != null) {
                        return reply;
                    }
                }
            }
        } else {
            ObjectNode reply = matchReply(body, id);
            if (reply != null) {
                return reply;
            }
        }
        throw new IOException("no reply to request " + id + " from " + target);
    }

    private DownstreamResponse send(ObjectNode message) throws IOException {
        DownstreamResponse response = httpClient.exchange("POST", target, headers,
                objectMapper.writeValueAsBytes(message), maxBodySize);
        if (response.getSessionId() != null) {
            sessionId = response.getSessionId();
            headers.put(DownstreamHttpClient.SESSION_HEADER, sessionId);
        }
        return response;
    }

    private ObjectNode matchReply(String frame, int id) {
        if (frame.isEmpty()) {
            return null;
        }
        JsonNode message;
        try {
            message = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("[Gateway:{}] Skipping unparseable reply: {}", serverName, e.getOriginalMessage());
            return null;
        }
        if (message instanceof ObjectNode reply && reply.path("id").asInt(-1) == id && !reply.has("method")) {
            return reply;
        }
        return null;
    }
}
