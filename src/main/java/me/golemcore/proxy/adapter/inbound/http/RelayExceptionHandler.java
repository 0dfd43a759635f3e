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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.inbound.http.dto.ApiErrorResponse;
import me.golemcore.proxy.domain.processor.McpErrorFormatter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps relay failures to HTTP responses. Downstream failures are answered
 * with a JSON-RPC error so MCP clients can correlate them with their request.
 */
@RestControllerAdvice
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@Slf4j
public class RelayExceptionHandler {

    @ExceptionHandler(DownstreamUnavailableException.class)
    public Mono<ResponseEntity<ObjectNode>> handleDownstreamUnavailable(DownstreamUnavailableException ex) {
        log.warn("[HttpRelay] {}", ex.getMessage());
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("endpoint", ex.getPath());
        data.put("reason", ex.getCause() != null ? ex.getCause().getMessage() : ex.getMessage());
        ObjectNode body = McpErrorFormatter.envelope(ex.getRequestId(), McpErrorFormatter.PROCESSING_FAILED_CODE,
                "Downstream server unavailable", data);
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[HttpRelay] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(DataBufferLimitException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleBodyTooLarge(DataBufferLimitException ex) {
        log.warn("[HttpRelay] Request body too large: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.PAYLOAD_TOO_LARGE.value())
                .message("request body too large")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[HttpRelay] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }
}
