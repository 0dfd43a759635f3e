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

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * HTTP entry point of the relay: {@code /mcp/<gateway>/<server>} for single
 * servers and {@code /mcp/<gateway>} for the aggregated gateway.
 *
 * <p>
 * {@code POST} carries JSON-RPC frames and {@code DELETE} ends a session;
 * both run on the bounded elastic scheduler since processors and the
 * downstream calls block. Server endpoints go through {@link HttpRelayService},
 * gateway endpoints through {@link AggregatedGatewayService}. Standalone
 * {@code GET} event streams are not relayed and answer 405, which MCP clients
 * treat as "no server-initiated stream".
 */
@RestController
@RequestMapping("/mcp")
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@RequiredArgsConstructor
public class HttpRelayController {

    private final HttpRelayRegistry registry;
    private final HttpRelayService relayService;
    private final AggregatedGatewayService gatewayService;

    @PostMapping("/{gateway}")
    public Mono<ResponseEntity<byte[]>> postGateway(
            @PathVariable String gateway,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {

        return Mono.fromCallable(() -> gatewayService.handle(gateway(gateway), headers, body))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{gateway}")
    public Mono<ResponseEntity<byte[]>> deleteGateway(
            @PathVariable String gateway,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> gatewayService.delete(gateway(gateway), headers))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{gateway}")
    public Mono<ResponseEntity<byte[]>> getGateway(@PathVariable String gateway) {
        return Mono.fromCallable(() -> {
            gateway(gateway);
            return methodNotAllowed();
        });
    }

    @PostMapping("/{gateway}/{server}")
    public Mono<ResponseEntity<byte[]>> post(
            @PathVariable String gateway,
            @PathVariable String server,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {

        return Mono.fromCallable(() -> relayService.relay(endpoint(gateway, server), "POST", headers, body))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{gateway}/{server}")
    public Mono<ResponseEntity<byte[]>> delete(
            @PathVariable String gateway,
            @PathVariable String server,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> relayService.relay(endpoint(gateway, server), "DELETE", headers, null))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{gateway}/{server}")
    public Mono<ResponseEntity<byte[]>> get(@PathVariable String gateway, @PathVariable String server) {
        return Mono.fromCallable(() -> {
            endpoint(gateway, server);
            return methodNotAllowed();
        });
    }

    private static ResponseEntity<byte[]> methodNotAllowed() {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .header(HttpHeaders.ALLOW, "POST, DELETE")
                .build();
    }

    private AggregatedGateway gateway(String gateway) {
        return registry.findGateway(gateway)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "no MCP gateway at /mcp/" + gateway));
    }

    private HttpRelayEndpoint endpoint(String gateway, String server) {
        return registry.find(gateway, server)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "no MCP server at /mcp/" + gateway + "/" + server));
    }
}
