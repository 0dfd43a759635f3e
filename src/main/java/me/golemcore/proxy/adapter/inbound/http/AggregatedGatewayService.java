package me.golemcore.proxy.adapter.inbound.http;

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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.outbound.http.DownstreamHttpClient;
import me.golemcore.proxy.adapter.outbound.http.McpHttpSession;
import me.golemcore.proxy.domain.model.ChainResult;
import me.golemcore.proxy.domain.model.MessageDirection;
import me.golemcore.proxy.domain.model.MessageType;
import me.golemcore.proxy.domain.model.ProxyEvent;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.domain.processor.McpErrorFormatter;
import me.golemcore.proxy.domain.processor.ProcessorChain;
import me.golemcore.proxy.infrastructure.config.ProxyProperties;
import me.golemcore.proxy.port.outbound.ActivityLogPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MCP server behind {@code /mcp/<gateway>} that merges the tools of every
 * server in the gateway.
 *
 * <p>
 * {@code initialize} opens a gateway session: each server gets its own
 * downstream session carrying the client's {@code Authorization},
 * {@code X-API-Key} and {@code X-Auth-Token} headers on top of the configured
 * ones. Servers that cannot be reached are left out; the session fails only
 * when none can be reached. Later requests must carry the issued
 * {@code Mcp-Session-Id}.
 *
 * <p>
 * {@code tools/list} answers with every tool renamed to
 * {@code <server>___<tool>} and its description prefixed with
 * {@code [<server>]}. {@code tools/call} is routed by that prefix with the
 * original tool name restored, and the request and the reply both pass
 * through the processor chain of the target server. {@code ping} is answered
 * locally; other methods are unknown.
 */
@Service
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@Slf4j
public class AggregatedGatewayService {

    public static final String NAMESPACE_SEPARATOR = "___";
    static final String DEFAULT_PROTOCOL_VERSION = "2025-06-18";

    private static final List<String> AUTH_HEADERS = List.of(HttpHeaders.AUTHORIZATION, "X-API-Key",
            "X-Auth-Token");
    private static final int PARSE_ERROR = -32700;
    private static final int INVALID_REQUEST = -32600;
    private static final int METHOD_NOT_FOUND = -32601;
    private static final int INVALID_PARAMS = -32602;

    private final DownstreamHttpClient downstreamClient;
    private final ActivityLogPort activityLog;
    private final ObjectMapper objectMapper;
    private final int maxBodySize;
    private final Map<String, GatewaySession> sessions = new ConcurrentHashMap<>();

    public AggregatedGatewayService(DownstreamHttpClient downstreamClient, ActivityLogPort activityLog,
            ObjectMapper objectMapper, ProxyProperties properties) {
        this.downstreamClient = downstreamClient;
        this.activityLog = activityLog;
        this.objectMapper = objectMapper;
        this.maxBodySize = properties.getHttp().getMaxBodySize();
    }

    public ResponseEntity<byte[]> handle(AggregatedGateway gateway, HttpHeaders inbound, byte[] body)
            throws JsonProcessingException {
        if (body != null && body.length > maxBodySize) {
            throw new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "request body exceeds " + maxBodySize + " bytes");
        }
        JsonNode frame;
        try {
            frame = body != null && body.length > 0 ? objectMapper.readTree(body) : null;
        } catch (IOException e) {
            log.warn("[Gateway:{}] Unparseable request: {}", gateway.getGateway(), e.getMessage());
            frame = null;
        }
        if (frame == null || !(frame.isObject() || frame.isArray())) {
            return json(HttpStatus.BAD_REQUEST,
                    McpErrorFormatter.envelope(null, PARSE_ERROR, "Parse error", null), null);
        }

        String sessionId = inbound.getFirst(DownstreamHttpClient.SESSION_HEADER);
        GatewaySession session = sessionId != null ? sessions.get(sessionId) : null;
        if (sessionId != null && (session == null || !session.gateway.equals(gateway.getGateway()))) {
            return json(HttpStatus.NOT_FOUND,
                    McpErrorFormatter.envelope(frame.get("id"), INVALID_REQUEST, "Unknown session: " + sessionId,
                            null),
                    null);
        }
        if (session == null) {
            if (frame instanceof ObjectNode message && "initialize".equals(message.path("method").asText())) {
                return initialize(gateway, inbound, message);
            }
            return json(HttpStatus.BAD_REQUEST, McpErrorFormatter.envelope(frame.get("id"), INVALID_REQUEST,
                    "Missing " + DownstreamHttpClient.SESSION_HEADER + " header", null), null);
        }

        JsonNode reply;
        if (frame instanceof ArrayNode batch) {
            ArrayNode replies = objectMapper.createArrayNode();
            for (JsonNode element : batch) {
                ObjectNode elementReply = element instanceof ObjectNode message
                        ? handleMessage(gateway, session, message)
                        : McpErrorFormatter.envelope(null, INVALID_REQUEST, "Invalid Request", null);
                if (elementReply != null) {
                    replies.add(elementReply);
                }
            }
            reply = replies.isEmpty() ? null : replies;
        } else {
            reply = handleMessage(gateway, session, (ObjectNode) frame);
        }
        return reply != null ? json(HttpStatus.OK, reply, session.id) : ResponseEntity.accepted().<byte[]>build();
    }

    public ResponseEntity<byte[]> delete(AggregatedGateway gateway, HttpHeaders inbound) {
        String sessionId = inbound.getFirst(DownstreamHttpClient.SESSION_HEADER);
        GatewaySession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null || !session.gateway.equals(gateway.getGateway())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).<byte[]>build();
        }
        sessions.remove(sessionId);
        session.connections.values().forEach(McpHttpSession::close);
        log.info("[Gateway:{}] Session {} closed", gateway.getGateway(), sessionId);
        record(gateway, ProxyEvent.EventKind.SYSTEM, MessageDirection.SYSTEM, null, "session closed: " + sessionId,
                true, null);
        return ResponseEntity.noContent().<byte[]>build();
    }

    int getSessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        sessions.values().forEach(session -> session.connections.values().forEach(McpHttpSession::close));
        sessions.clear();
    }

    // ==================== SESSIONS ====================

    private ResponseEntity<byte[]> initialize(AggregatedGateway gateway, HttpHeaders inbound, ObjectNode request)
            throws JsonProcessingException {
        JsonNode id = request.get("id");
        String protocolVersion = request.path("params").path("protocolVersion").asText(DEFAULT_PROTOCOL_VERSION);
        Map<String, String> authHeaders = authHeaders(inbound);

        Map<String, McpHttpSession> connections = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();
        for (HttpRelayEndpoint server : gateway.getServers().values()) {
            Map<String, String> headers = new LinkedHashMap<>(server.getHeaders());
            // Client credentials override configured ones
            headers.putAll(authHeaders);
            McpHttpSession connection = new McpHttpSession(server.getServer(), server.getTarget(), headers,
                    downstreamClient, objectMapper, maxBodySize);
            try {
                connection.connect(protocolVersion);
                connections.put(server.getServer(), connection);
            } catch (IOException e) {
                log.warn("[Gateway:{}] Failed to connect to {}: {}", gateway.getGateway(), server.getServer(),
                        e.getMessage());
                failures.add(server.getServer() + ": " + e.getMessage());
            }
        }

        if (connections.isEmpty()) {
            record(gateway, ProxyEvent.EventKind.SYSTEM, MessageDirection.SYSTEM, null, "session failed", false,
                    String.join("; ", failures));
            ObjectNode data = objectMapper.createObjectNode();
            ArrayNode reasons = data.putArray("failures");
            failures.forEach(reasons::add);
            return json(HttpStatus.BAD_GATEWAY, McpErrorFormatter.envelope(id,
                    McpErrorFormatter.PROCESSING_FAILED_CODE, "Failed to connect to any downstream server", data),
                    null);
        }

        GatewaySession session = new GatewaySession(UUID.randomUUID().toString(), gateway.getGateway(),
                protocolVersion, Collections.unmodifiableMap(connections));
        sessions.put(session.id, session);
        log.info("[Gateway:{}] Session {} opened with {} of {} server(s)", gateway.getGateway(), session.id,
                connections.size(), gateway.getServers().size());
        record(gateway, ProxyEvent.EventKind.SYSTEM, MessageDirection.SYSTEM, null, "session opened: " + session.id,
                true, failures.isEmpty() ? null : String.join("; ", failures));
        return json(HttpStatus.OK, result(id, initializeResult(gateway, protocolVersion)), session.id);
    }

    private Map<String, String> authHeaders(HttpHeaders inbound) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : AUTH_HEADERS) {
            String value = inbound.getFirst(name);
            if (value != null && !value.isEmpty()) {
                headers.put(name, value);
            }
        }
        return headers;
    }

    private ObjectNode initializeResult(AggregatedGateway gateway, String protocolVersion) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("protocolVersion", protocolVersion);
        result.putObject("capabilities").putObject("tools").put("listChanged", true);
        result.putObject("serverInfo")
                .put("name", "golemcore-gateway-" + gateway.getGateway())
                .put("version", "1.0.0");
        return result;
    }

    // ==================== MESSAGES ====================

    private ObjectNode handleMessage(AggregatedGateway gateway, GatewaySession session, ObjectNode message) {
        MessageType type = MessageType.classify(message);
        if (type != MessageType.REQUEST) {
            log.debug("[Gateway:{}] Ignoring client {}", gateway.getGateway(), type.getValue());
            return null;
        }
        JsonNode id = message.get("id");
        String method = message.path("method").asText();
        return switch (method) {
        case "initialize" -> result(id, initializeResult(gateway, session.protocolVersion));
        case "ping" -> result(id, objectMapper.createObjectNode());
        case "tools/list" -> result(id, listTools(session));
        case "tools/call" -> callTool(gateway, session, message);
        default -> McpErrorFormatter.envelope(id, METHOD_NOT_FOUND, "Method not found: " + method, null);
        };
    }

    private ObjectNode listTools(GatewaySession session) {
        ArrayNode tools = objectMapper.createArrayNode();
        for (Map.Entry<String, McpHttpSession> connection : session.connections.entrySet()) {
            String serverName = connection.getKey();
            for (JsonNode tool : connection.getValue().getTools()) {
                if (!(tool instanceof ObjectNode original) || !original.hasNonNull("name")) {
                    continue;
                }
                ObjectNode namespaced = original.deepCopy();
                namespaced.put("name", serverName + NAMESPACE_SEPARATOR + original.get("name").asText());
                namespaced.put("description", "[" + serverName + "] " + original.path("description").asText(""));
                tools.add(namespaced);
            }
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.set("tools", tools);
        return result;
    }

    private ObjectNode callTool(AggregatedGateway gateway, GatewaySession session, ObjectNode request) {
        JsonNode id = request.get("id");
        String name = request.path("params").path("name").asText("");
        int separator = name.indexOf(NAMESPACE_SEPARATOR);
        String serverName = separator > 0 ? name.substring(0, separator) : "";
        String toolName = separator > 0 ? name.substring(separator + NAMESPACE_SEPARATOR.length()) : "";
        McpHttpSession connection = session.connections.get(serverName);
        if (connection == null || !connection.hasTool(toolName)) {
            return McpErrorFormatter.envelope(id, INVALID_PARAMS, "Unknown tool: " + name, null);
        }
        ProcessorChain chain = gateway.getServers().get(serverName).getChain();

        ObjectNode call = request.deepCopy();
        ((ObjectNode) call.get("params")).put("name", toolName);
        ChainResult outbound = chain.execute(MessageType.REQUEST, call);
        if (!outbound.isSuccess()) {
            log.warn("[Gateway:{}] Call to {} rejected (status {}): {}", gateway.getGateway(), name,
                    outbound.getStatus(), outbound.getError());
            record(gateway, ProxyEvent.EventKind.REQUEST, MessageDirection.CLIENT_TO_SERVER, MessageType.REQUEST,
                    request.toString(), false, outbound.getError());
            return McpErrorFormatter.format(outbound, id);
        }
        record(gateway, ProxyEvent.EventKind.REQUEST, MessageDirection.CLIENT_TO_SERVER, MessageType.REQUEST,
                outbound.getPayload().toString(), true, null);

        ObjectNode reply;
        try {
            reply = connection.forward(outbound.getPayload());
        } catch (IOException e) {
            log.warn("[Gateway:{}] Call to {} failed: {}", gateway.getGateway(), name, e.getMessage());
            record(gateway, ProxyEvent.EventKind.RESPONSE, MessageDirection.SERVER_TO_CLIENT, null, null, false,
                    e.getMessage());
            ObjectNode data = objectMapper.createObjectNode();
            data.put("server", serverName);
            data.put("reason", e.getMessage());
            return McpErrorFormatter.envelope(id, McpErrorFormatter.PROCESSING_FAILED_CODE,
                    "Downstream server unavailable", data);
        }
        reply.set("id", id);

        ChainResult inbound = chain.execute(MessageType.RESPONSE, reply);
        if (!inbound.isSuccess()) {
            log.warn("[Gateway:{}] Reply from {} replaced by error (status {}): {}", gateway.getGateway(), name,
                    inbound.getStatus(), inbound.getError());
            record(gateway, ProxyEvent.EventKind.RESPONSE, MessageDirection.SERVER_TO_CLIENT, MessageType.RESPONSE,
                    reply.toString(), false, inbound.getError());
            return McpErrorFormatter.format(inbound, id);
        }
        record(gateway, ProxyEvent.EventKind.RESPONSE, MessageDirection.SERVER_TO_CLIENT, MessageType.RESPONSE,
                inbound.getPayload().toString(), true, null);
        return inbound.getPayload();
    }

    private ObjectNode result(JsonNode id, JsonNode result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ResponseEntity<byte[]> json(HttpStatus status, JsonNode body, String sessionId)
            throws JsonProcessingException {
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON);
        if (sessionId != null) {
            response.header(DownstreamHttpClient.SESSION_HEADER, sessionId);
        }
        return response.body(objectMapper.writeValueAsBytes(body));
    }

    private void record(AggregatedGateway gateway, ProxyEvent.EventKind kind, MessageDirection direction,
            MessageType type, String message, boolean success, String error) {
        activityLog.record(ProxyEvent.builder()
                .kind(kind)
                .sessionId(gateway.getSessionId())
                .serverId(gateway.getGateway())
                .transport(Transport.HTTP)
                .direction(direction)
                .messageType(type)
                .endpoint(gateway.getPath())
                .message(message)
                .success(success)
                .error(error)
                .build());
    }

    private static final class GatewaySession {

        private final String id;
        private final String gateway;
        private final String protocolVersion;
        private final Map<String, McpHttpSession> connections;

        private GatewaySession(String id, String gateway, String protocolVersion,
                Map<String, McpHttpSession> connections) {
            this.id = id;
            this.gateway = gateway;
            this.protocolVersion = protocolVersion;
            this.connections = connections;
        }
    }
}
