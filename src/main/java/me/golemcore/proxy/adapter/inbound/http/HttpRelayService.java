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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.outbound.http.DownstreamHttpClient;
import me.golemcore.proxy.adapter.outbound.http.DownstreamResponse;
import me.golemcore.proxy.domain.model.BatchResult;
import me.golemcore.proxy.domain.model.ChainResult;
import me.golemcore.proxy.domain.model.MessageDirection;
import me.golemcore.proxy.domain.model.MessageType;
import me.golemcore.proxy.domain.model.ProxyEvent;
import me.golemcore.proxy.domain.model.Transport;
import me.golemcore.proxy.domain.processor.McpErrorFormatter;
import me.golemcore.proxy.domain.processor.PayloadParseException;
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
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Forwards one HTTP exchange to the downstream server of an endpoint, running
 * the request body and the response body through the endpoint's processor
 * chain.
 *
 * <p>
 * A rejected request never reaches the downstream server; the client gets a
 * JSON-RPC error envelope with the chain's status code. A rejected response
 * body is replaced by an envelope while the downstream status is kept. A
 * rejected server request found in a response is answered to the downstream
 * server with a separate POST and dropped from the body; a rejected server
 * notification is dropped. {@code text/event-stream} responses are processed
 * one {@code data:} line at a time.
 *
 * <p>
 * Batches are processed element by element. Only the surviving elements are
 * forwarded and the errors for rejected requests are merged into the
 * response. Bodies that are neither JSON objects nor arrays pass through
 * untouched.
 */
@Service
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@Slf4j
public class HttpRelayService {

    private static final List<String> FORWARDED_HEADERS = List.of(
            HttpHeaders.ACCEPT,
            HttpHeaders.CONTENT_TYPE,
            HttpHeaders.AUTHORIZATION,
            DownstreamHttpClient.SESSION_HEADER,
            "Mcp-Protocol-Version",
            "Last-Event-ID");
    private static final String DEFAULT_ACCEPT = "application/json, text/event-stream";
    private static final String SSE_DATA_PREFIX = "data:";

    private final DownstreamHttpClient downstreamClient;
    private final ActivityLogPort activityLog;
    private final ObjectMapper objectMapper;
    private final int maxBodySize;

    public HttpRelayService(DownstreamHttpClient downstreamClient, ActivityLogPort activityLog,
            ObjectMapper objectMapper, ProxyProperties properties) {
        this.downstreamClient = downstreamClient;
        this.activityLog = activityLog;
        this.objectMapper = objectMapper;
        this.maxBodySize = properties.getHttp().getMaxBodySize();
    }

    public ResponseEntity<byte[]> relay(HttpRelayEndpoint endpoint, String method, HttpHeaders inbound,
            byte[] body) throws JsonProcessingException {
        String requestId = UUID.randomUUID().toString();
        byte[] requestBody = body != null ? body : new byte[0];
        if (requestBody.length > maxBodySize) {
            throw new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "request body exceeds " + maxBodySize + " bytes");
        }
        log.debug("[HttpRelay] {} {} request {} ({} bytes)", method, endpoint.getPath(), requestId,
                requestBody.length);

        ProcessorChain chain = endpoint.getChain();
        Map<String, String> headers = outboundHeaders(endpoint, inbound);
        JsonNode rpcId = null;
        ArrayNode localReplies = null;
        if (requestBody.length > 0 && chain.hasProcessors()) {
            String raw = new String(requestBody, StandardCharsets.UTF_8);
            JsonNode frame = parseOrNull(endpoint, raw);
            if (frame instanceof ObjectNode payload) {
                rpcId = payload.get("id");
                MessageType type = MessageType.classify(payload);
                ChainResult result = chain.execute(type, payload);
                if (!result.isSuccess()) {
                    log.warn("[HttpRelay] {} {} rejected (status {}): {}", endpoint.getPath(), type.getValue(),
                            result.getStatus(), result.getError());
                    record(endpoint, ProxyEvent.EventKind.REQUEST, MessageDirection.CLIENT_TO_SERVER, type, raw,
                            false, result.getError());
                    return ResponseEntity.status(result.getStatus())
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(objectMapper.writeValueAsBytes(McpErrorFormatter.format(result, rpcId)));
                }
                requestBody = objectMapper.writeValueAsBytes(result.getPayload());
            } else if (frame instanceof ArrayNode batch) {
                BatchResult result = chain.executeBatch(batch);
                if (result.hasRejections()) {
                    String error = result.getRejections().get(0).getError();
                    log.warn("[HttpRelay] {} {} of {} batch element(s) rejected: {}", endpoint.getPath(),
                            result.getRejections().size(), batch.size(), error);
                    record(endpoint, ProxyEvent.EventKind.REQUEST, MessageDirection.CLIENT_TO_SERVER, null, raw,
                            false, error);
                }
                localReplies = result.getReplies();
                if (result.getForward().isEmpty()) {
                    return localReplies.isEmpty()
                            ? ResponseEntity.accepted().<byte[]>build()
                            : ResponseEntity.ok()
                                    .contentType(MediaType.APPLICATION_JSON)
                                    .body(objectMapper.writeValueAsBytes(localReplies));
                }
                requestBody = objectMapper.writeValueAsBytes(result.getForward());
            }
        }
        record(endpoint, ProxyEvent.EventKind.REQUEST, MessageDirection.CLIENT_TO_SERVER, null,
                new String(requestBody, StandardCharsets.UTF_8), true, null);

        DownstreamResponse downstream;
        try {
            downstream = downstreamClient.exchange(method, endpoint.getTarget(), headers, requestBody, maxBodySize);
        } catch (IOException e) {
            log.warn("[HttpRelay] {} downstream failed: {}", endpoint.getPath(), e.getMessage());
            record(endpoint, ProxyEvent.EventKind.RESPONSE, MessageDirection.SERVER_TO_CLIENT, null, null, false,
                    e.getMessage());
            throw new DownstreamUnavailableException(endpoint.getPath(), rpcId, e);
        }

        Map<String, String> replyHeaders = new LinkedHashMap<>(headers);
        replyHeaders.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (downstream.getSessionId() != null) {
            replyHeaders.put(DownstreamHttpClient.SESSION_HEADER, downstream.getSessionId());
        }
        byte[] responseBody = processResponse(endpoint, downstream, replyHeaders);
        int status = downstream.getStatus();
        String contentType = downstream.getContentType();
        if (localReplies != null && !localReplies.isEmpty()) {
            if (responseBody.length == 0) {
                status = status == HttpStatus.ACCEPTED.value() ? HttpStatus.OK.value() : status;
                contentType = MediaType.APPLICATION_JSON_VALUE;
            }
            responseBody = mergeReplies(endpoint, contentType, responseBody, localReplies);
        }
        record(endpoint, ProxyEvent.EventKind.RESPONSE, MessageDirection.SERVER_TO_CLIENT, null,
                new String(responseBody, StandardCharsets.UTF_8), status < 400, null);

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (contentType != null) {
            response.header(HttpHeaders.CONTENT_TYPE, contentType);
        }
        if (downstream.getSessionId() != null) {
            response.header(DownstreamHttpClient.SESSION_HEADER, downstream.getSessionId());
        }
        return response.body(responseBody);
    }

    private Map<String, String> outboundHeaders(HttpRelayEndpoint endpoint, HttpHeaders inbound) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : FORWARDED_HEADERS) {
            String value = inbound.getFirst(name);
            if (value != null) {
                headers.put(name, value);
            }
        }
        headers.putIfAbsent(HttpHeaders.ACCEPT, DEFAULT_ACCEPT);
        headers.putIfAbsent(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        // Configured headers win over client headers
        headers.putAll(endpoint.getHeaders());
        return headers;
    }

    private byte[] processResponse(HttpRelayEndpoint endpoint, DownstreamResponse downstream,
            Map<String, String> replyHeaders) throws JsonProcessingException {
        byte[] body = downstream.getBody();
        if (body.length == 0 || !endpoint.getChain().hasProcessors()) {
            return body;
        }
        String text = new String(body, StandardCharsets.UTF_8);
        if (isEventStream(downstream.getContentType())) {
            return processEventStream(endpoint, text, replyHeaders).getBytes(StandardCharsets.UTF_8);
        }
        String processed = processResponseFrame(endpoint, text, replyHeaders);
        return processed != null ? processed.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }

    private String processEventStream(HttpRelayEndpoint endpoint, String stream, Map<String, String> replyHeaders)
            throws JsonProcessingException {
        StringBuilder processed = new StringBuilder(stream.length());
        int start = 0;
        while (start < stream.length()) {
            int end = stream.indexOf('\n', start);
            String line = end < 0 ? stream.substring(start) : stream.substring(start, end);
            boolean keep = true;
            if (line.startsWith(SSE_DATA_PREFIX)) {
                boolean carriageReturn = line.endsWith("\r");
                String data = line.substring(SSE_DATA_PREFIX.length()).trim();
                String frame = processResponseFrame(endpoint, data, replyHeaders);
                // An event left without data lines is ignored by the client
                keep = frame != null;
                if (keep) {
                    processed.append(SSE_DATA_PREFIX).append(' ').append(frame);
                    if (carriageReturn) {
                        processed.append('\r');
                    }
                }
            } else {
                processed.append(line);
            }
            if (end < 0) {
                break;
            }
            if (keep) {
                processed.append('\n');
            }
            start = end + 1;
        }
        return processed.toString();
    }

    /**
     * Runs one response frame through the chain.
     *
     * @return the frame to hand to the client, or {@code null} when nothing is
     *         left of it
     */
    private String processResponseFrame(HttpRelayEndpoint endpoint, String frame, Map<String, String> replyHeaders)
            throws JsonProcessingException {
        if (frame.isEmpty()) {
            return frame;
        }
        JsonNode node = parseOrNull(endpoint, frame);
        if (node instanceof ArrayNode batch) {
            return processResponseBatch(endpoint, frame, batch, replyHeaders);
        }
        if (!(node instanceof ObjectNode payload)) {
            return frame;
        }
        JsonNode id = payload.get("id");
        MessageType type = MessageType.classify(payload);
        ChainResult result = endpoint.getChain().execute(type, payload);
        if (result.isSuccess()) {
            return objectMapper.writeValueAsString(result.getPayload());
        }
        record(endpoint, ProxyEvent.EventKind.RESPONSE, MessageDirection.SERVER_TO_CLIENT, type, frame, false,
                result.getError());
        switch (type) {
        case REQUEST -> {
            log.warn("[HttpRelay] {} server request {} rejected (status {}): {}", endpoint.getPath(), id,
                    result.getStatus(), result.getError());
            answerDownstream(endpoint, replyHeaders, McpErrorFormatter.format(result, id));
            return null;
        }
        case NOTIFICATION -> {
            log.warn("[HttpRelay] {} server notification dropped (status {}): {}", endpoint.getPath(),
                    result.getStatus(), result.getError());
            return null;
        }
        default -> {
            log.warn("[HttpRelay] {} response {} replaced by error (status {}): {}", endpoint.getPath(), id,
                    result.getStatus(), result.getError());
            return objectMapper.writeValueAsString(McpErrorFormatter.format(result, id));
        }
        }
    }

    private String processResponseBatch(HttpRelayEndpoint endpoint, String frame, ArrayNode batch,
            Map<String, String> replyHeaders) throws JsonProcessingException {
        BatchResult result = endpoint.getChain().executeBatch(batch);
        if (result.hasRejections()) {
            String error = result.getRejections().get(0).getError();
            log.warn("[HttpRelay] {} {} of {} response batch element(s) rejected: {}", endpoint.getPath(),
                    result.getRejections().size(), batch.size(), error);
            record(endpoint, ProxyEvent.EventKind.RESPONSE, MessageDirection.SERVER_TO_CLIENT, null, frame, false,
                    error);
        }
        if (!result.getReplies().isEmpty()) {
            answerDownstream(endpoint, replyHeaders, result.getReplies());
        }
        return result.getForward().isEmpty() ? null : objectMapper.writeValueAsString(result.getForward());
    }

    private void answerDownstream(HttpRelayEndpoint endpoint, Map<String, String> replyHeaders, JsonNode reply) {
        try {
            downstreamClient.exchange("POST", endpoint.getTarget(), replyHeaders, objectMapper.writeValueAsBytes(reply),
                    maxBodySize);
        } catch (IOException e) {
            log.warn("[HttpRelay] {} could not deliver error to downstream: {}", endpoint.getPath(), e.getMessage());
        }
    }

    private byte[] mergeReplies(HttpRelayEndpoint endpoint, String contentType, byte[] body, ArrayNode replies)
            throws JsonProcessingException {
        if (body.length == 0) {
            return objectMapper.writeValueAsBytes(replies);
        }
        String text = new String(body, StandardCharsets.UTF_8);
        if (isEventStream(contentType)) {
            String separator = text.endsWith("\n\n") ? "" : text.endsWith("\n") ? "\n" : "\n\n";
            return (text + separator + "event: message\n" + SSE_DATA_PREFIX + " "
                    + objectMapper.writeValueAsString(replies) + "\n\n").getBytes(StandardCharsets.UTF_8);
        }
        JsonNode node = parseOrNull(endpoint, text);
        ArrayNode merged = objectMapper.createArrayNode();
        if (node instanceof ArrayNode batch) {
            merged.addAll(batch);
        } else if (node instanceof ObjectNode single) {
            merged.add(single);
        } else {
            log.warn("[HttpRelay] {} cannot merge {} local error(s) into a non-JSON response", endpoint.getPath(),
                    replies.size());
            return body;
        }
        merged.addAll(replies);
        return objectMapper.writeValueAsBytes(merged);
    }

    private static boolean isEventStream(String contentType) {
        return contentType != null && contentType.startsWith(MediaType.TEXT_EVENT_STREAM_VALUE);
    }

    private JsonNode parseOrNull(HttpRelayEndpoint endpoint, String raw) {
        try {
            return endpoint.getChain().parseFrame(raw);
        } catch (PayloadParseException e) {
            log.warn("[HttpRelay] {} forwarding unparseable body unmodified: {}", endpoint.getPath(),
                    e.getMessage());
            return null;
        }
    }

    private void record(HttpRelayEndpoint endpoint, ProxyEvent.EventKind kind, MessageDirection direction,
            MessageType type, String message, boolean success, String error) {
        activityLog.record(ProxyEvent.builder()
                .kind(kind)
                .sessionId(endpoint.getSessionId())
                .serverId(endpoint.getGateway() + "/" + endpoint.getServer())
                .transport(Transport.HTTP)
                .direction(direction)
                .messageType(type)
                .endpoint(endpoint.getPath())
                .message(message)
                .success(success)
                .error(error)
                .build());
    }
}
